package org.jointresolver.assembly;

/**
 * 装配关节（可运动机械关节，或类型为 {@link JointType#RIGID} 的刚性关节）。
 */
public interface AssemblyJoint extends AssemblyRelationship {

    JointType jointType();
}
