package org.jointresolver.rigid;

/**
 * 装配中没有任何接地（grounded）的刚体组，无法确定运动树的根。
 */
public class NoGroundedGroupException extends IllegalStateException {

    public NoGroundedGroupException(String message) {
        super(message);
    }
}
