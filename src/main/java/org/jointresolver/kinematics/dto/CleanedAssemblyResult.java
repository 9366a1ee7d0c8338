package org.jointresolver.kinematics.dto;

import java.util.List;

/**
 * {@code kinematics_clean_assembly} 的返回结果（只做清理与接地合并，不合成运动树）。
 *
 * @param rootGroup 合并后的根组
 * @param groups    剩余的组
 * @param joints    剩余的连接及其分类
 * @param warnings  非致命告警
 */
public record CleanedAssemblyResult(
        String rootGroup,
        List<RigidGroupView> groups,
        List<RigidJointView> joints,
        List<String> warnings
) {
}
