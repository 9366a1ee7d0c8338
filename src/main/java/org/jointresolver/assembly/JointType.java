package org.jointresolver.assembly;

/**
 * 装配关节类型。
 */
public enum JointType {
    RIGID,
    ROTATIONAL,
    SLIDER,
    CYLINDRICAL,
    PLANAR,
    BALL;

    public boolean isRigid() {
        return this == RIGID;
    }
}
