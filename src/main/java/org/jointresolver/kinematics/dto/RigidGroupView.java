package org.jointresolver.kinematics.dto;

import java.util.List;

/**
 * @param name            组名称
 * @param grounded        是否接地
 * @param occurrenceCount 实例数量
 * @param occurrences     实例名称（可能被省略）
 */
public record RigidGroupView(String name, boolean grounded, int occurrenceCount, List<String> occurrences) {
}
