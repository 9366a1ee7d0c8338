package org.jointresolver.kinematics.dto;

import java.util.List;

/**
 * @param groupOne    一端组名称
 * @param groupTwo    另一端组名称
 * @param kind        连接分类（MOVABLE/RIGID_EQUIVALENT/AMBIGUOUS/EMPTY）
 * @param joints      剩余关节名称
 * @param constraints 剩余约束名称
 */
public record RigidJointView(String groupOne, String groupTwo, String kind, List<String> joints, List<String> constraints) {
}
