package org.jointresolver.assembly;

/**
 * 装配约束类型（只做标记，不参与分类）。
 */
public enum ConstraintType {
    MATE,
    FLUSH,
    ANGLE,
    INSERT,
    TANGENT,
    TRANSITIONAL,
    OTHER
}
