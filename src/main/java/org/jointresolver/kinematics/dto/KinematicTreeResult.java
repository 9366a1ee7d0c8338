package org.jointresolver.kinematics.dto;

import java.util.List;

/**
 * {@code kinematics_build_tree} 的返回结果。
 *
 * @param root              运动树根节点
 * @param nodeCount         树上的节点数
 * @param jointCount        树上的骨架关节数
 * @param mergedGroups      因刚性等价被合并掉的组数
 * @param remainingGroups   清理后结果集中剩余的组数（包含不可达的组）
 * @param remainingJoints   清理后结果集中剩余的连接数
 * @param unreachableGroups 无法从接地组到达、未进入运动树的组
 * @param warnings          非致命告警
 */
public record KinematicTreeResult(
        KinematicNodeView root,
        int nodeCount,
        int jointCount,
        int mergedGroups,
        int remainingGroups,
        int remainingJoints,
        List<String> unreachableGroups,
        List<String> warnings
) {
}
