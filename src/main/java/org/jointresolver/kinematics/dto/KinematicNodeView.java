package org.jointresolver.kinematics.dto;

import java.util.List;

/**
 * 运动树节点。
 *
 * @param group           合并后的组名称
 * @param grounded        是否接地（只有根节点为 true）
 * @param occurrenceCount 合并后的实例数量
 * @param occurrences     合并后的实例名称（{@code app.kinematics.include-occurrences=false} 时为空）
 * @param children        子节点
 */
public record KinematicNodeView(
        String group,
        boolean grounded,
        int occurrenceCount,
        List<String> occurrences,
        List<KinematicChildView> children
) {
}
