package org.jointresolver.kinematics.dto;

import java.util.List;

/**
 * 以 JSON 提供的装配图（外部提取器的输出）。
 * <p>
 * 连接通过下标引用 {@link #groups} 中的组；关节/约束通过名称引用 {@link #occurrences} 中的实例。
 *
 * @param occurrences 零件实例
 * @param groups      刚体组
 * @param joints      刚体组之间的连接
 */
public record AssemblyDocument(
        List<OccurrenceSpec> occurrences,
        List<GroupSpec> groups,
        List<EdgeSpec> joints
) {

    /**
     * @param name       实例名称（文档内唯一）
     * @param suppressed 是否被抑制（为空视为 false）
     */
    public record OccurrenceSpec(String name, Boolean suppressed) {
    }

    /**
     * @param name        组名称（为空时使用 {@code group<下标>}）
     * @param grounded    是否接地（为空视为 false）
     * @param occurrences 实例名称列表
     */
    public record GroupSpec(String name, Boolean grounded, List<String> occurrences) {
    }

    /**
     * @param groupOne    一端组的下标
     * @param groupTwo    另一端组的下标
     * @param joints      装配关节
     * @param constraints 装配约束
     */
    public record EdgeSpec(Integer groupOne, Integer groupTwo, List<RelationSpec> joints, List<RelationSpec> constraints) {
    }

    /**
     * @param name          关系名称
     * @param type          关节类型（{@code RIGID/ROTATIONAL/SLIDER/CYLINDRICAL/PLANAR/BALL}）或约束类型（{@code MATE/FLUSH/...}）
     * @param suppressed    是否被抑制（为空视为 false）
     * @param occurrenceOne 一端实例名称
     * @param occurrenceTwo 另一端实例名称
     */
    public record RelationSpec(String name, String type, Boolean suppressed, String occurrenceOne, String occurrenceTwo) {
    }
}
