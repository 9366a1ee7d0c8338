package org.jointresolver.kinematics.dto;

/**
 * 运动树上的一个骨架关节。
 *
 * @param name             关节名称
 * @param type             骨架关节类型
 * @param sourceType       原始装配关节类型
 * @param degreesOfFreedom 自由度
 * @param parentGroup      参考组（父组）
 * @param childGroup       子组
 * @param parentOccurrence 父组一侧的实例
 * @param childOccurrence  子组一侧的实例
 */
public record KinematicJointView(
        String name,
        String type,
        String sourceType,
        int degreesOfFreedom,
        String parentGroup,
        String childGroup,
        String parentOccurrence,
        String childOccurrence
) {
}
