package org.jointresolver.assembly;

/**
 * 两个零件实例之间的装配关系（关节或约束）的公共部分。
 */
public interface AssemblyRelationship {

    String name();

    boolean suppressed();

    PartOccurrence occurrenceOne();

    PartOccurrence occurrenceTwo();

    /**
     * 关系本身被抑制，或任一端点实例被抑制，都视为无效关系。
     */
    default boolean suppressedOrDetached() {
        return suppressed() || occurrenceOne().suppressed() || occurrenceTwo().suppressed();
    }
}
