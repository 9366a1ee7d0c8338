package org.jointresolver.rigid;

import org.jointresolver.assembly.AssemblyConstraint;
import org.jointresolver.assembly.AssemblyJoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 两个刚体组之间的连接（图的一条边）。
 * <p>
 * 一条边可以同时带有关节列表与约束列表，也可以只有其中一种。
 * 端点在语义上无序，但字段是可变的：地面合并与组合并之后会把端点重定向到合并目标。
 */
public class RigidJoint {

    private RigidGroup groupOne;
    private RigidGroup groupTwo;
    private final List<AssemblyJoint> joints = new ArrayList<>();
    private final List<AssemblyConstraint> constraints = new ArrayList<>();

    public RigidJoint(RigidGroup groupOne, RigidGroup groupTwo) {
        this.groupOne = Objects.requireNonNull(groupOne, "groupOne");
        this.groupTwo = Objects.requireNonNull(groupTwo, "groupTwo");
    }

    public RigidGroup groupOne() {
        return groupOne;
    }

    public RigidGroup groupTwo() {
        return groupTwo;
    }

    public void setGroupOne(RigidGroup groupOne) {
        this.groupOne = Objects.requireNonNull(groupOne, "groupOne");
    }

    public void setGroupTwo(RigidGroup groupTwo) {
        this.groupTwo = Objects.requireNonNull(groupTwo, "groupTwo");
    }

    public List<AssemblyJoint> joints() {
        return joints;
    }

    public List<AssemblyConstraint> constraints() {
        return constraints;
    }

    public RigidJoint addJoint(AssemblyJoint joint) {
        joints.add(joint);
        return this;
    }

    public RigidJoint addConstraint(AssemblyConstraint constraint) {
        constraints.add(constraint);
        return this;
    }

    public boolean isSelfLoop() {
        return groupOne == groupTwo;
    }

    /**
     * 既没有关节也没有约束。
     */
    public boolean isEmpty() {
        return joints.isEmpty() && constraints.isEmpty();
    }

    public boolean connects(RigidGroup a, RigidGroup b) {
        return (groupOne == a && groupTwo == b) || (groupOne == b && groupTwo == a);
    }

    /**
     * 第一个非刚性类型的关节；没有则返回 null。
     */
    public AssemblyJoint firstMovableJoint() {
        for (AssemblyJoint joint : joints) {
            if (!joint.jointType().isRigid()) {
                return joint;
            }
        }
        return null;
    }

    /**
     * 按合并表重定向端点。合并表只做一步映射（目标永远不是另一个条目的源）。
     */
    void redirect(Map<RigidGroup, RigidGroup> mergeInto) {
        RigidGroup target = mergeInto.get(groupOne);
        if (target != null) {
            groupOne = target;
        }
        target = mergeInto.get(groupTwo);
        if (target != null) {
            groupTwo = target;
        }
    }

    @Override
    public String toString() {
        return groupOne.name() + " <-> " + groupTwo.name()
                + " (joints=" + joints.size() + ", constraints=" + constraints.size() + ")";
    }
}
