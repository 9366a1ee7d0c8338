package org.jointresolver.rigid;

/**
 * 连接的分类结果。
 */
public enum EdgeKind {
    /**
     * 至少有一个非刚性类型的关节：树上的一条边。
     */
    MOVABLE,
    /**
     * 只有约束，或有多个（全部刚性的）关节：两端会被合并成同一个刚体。
     */
    RIGID_EQUIVALENT,
    /**
     * 恰好一个刚性关节且没有约束：不进入任何邻接表，遍历时被忽略。
     */
    AMBIGUOUS,
    /**
     * 没有关节也没有约束（正常情况下已被清理掉）。
     */
    EMPTY
}
