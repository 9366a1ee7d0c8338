package org.jointresolver.assembly;

/**
 * 装配约束：两个实例之间不允许相对运动的关系。
 */
public interface AssemblyConstraint extends AssemblyRelationship {

    ConstraintType constraintType();
}
