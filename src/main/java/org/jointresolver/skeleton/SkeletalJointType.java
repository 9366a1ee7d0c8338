package org.jointresolver.skeleton;

import org.jointresolver.assembly.JointType;

/**
 * 骨架关节类型（运动树上的一条边）。
 */
public enum SkeletalJointType {
    ROTATIONAL(1),
    LINEAR(1),
    CYLINDRICAL(2),
    PLANAR(3),
    BALL(3);

    private final int degreesOfFreedom;

    SkeletalJointType(int degreesOfFreedom) {
        this.degreesOfFreedom = degreesOfFreedom;
    }

    public int degreesOfFreedom() {
        return degreesOfFreedom;
    }

    /**
     * 装配关节类型 -> 骨架关节类型。刚性关节没有对应的骨架关节。
     */
    public static SkeletalJointType of(JointType jointType) {
        return switch (jointType) {
            case ROTATIONAL -> ROTATIONAL;
            case SLIDER -> LINEAR;
            case CYLINDRICAL -> CYLINDRICAL;
            case PLANAR -> PLANAR;
            case BALL -> BALL;
            case RIGID -> throw new IllegalArgumentException("刚性关节不能作为骨架关节");
        };
    }
}
