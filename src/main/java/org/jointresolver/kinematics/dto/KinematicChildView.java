package org.jointresolver.kinematics.dto;

/**
 * @param joint 连接父节点与子节点的骨架关节
 * @param node  子节点
 */
public record KinematicChildView(KinematicJointView joint, KinematicNodeView node) {
}
