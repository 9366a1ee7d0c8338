package org.jointresolver.rigid;

import java.util.ArrayList;
import java.util.List;

/**
 * 整个装配图：有序的刚体组列表 + 有序的连接列表。
 * <p>
 * 顺序决定了树合成时的平局处理，因此两者都必须是有序列表（不能用无序集合）。
 * 每个清理/合并步骤都会原地修改这两个列表；同一实例在一次合成过程中只能被一个调用方持有。
 */
public class RigidResults {

    private final List<RigidGroup> groups = new ArrayList<>();
    private final List<RigidJoint> joints = new ArrayList<>();

    public List<RigidGroup> groups() {
        return groups;
    }

    public List<RigidJoint> joints() {
        return joints;
    }

    public RigidGroup addGroup(RigidGroup group) {
        groups.add(group);
        return group;
    }

    public RigidJoint addJoint(RigidJoint joint) {
        joints.add(joint);
        return joint;
    }

    public List<RigidGroup> groundedGroups() {
        List<RigidGroup> result = new ArrayList<>();
        for (RigidGroup group : groups) {
            if (group.isGrounded()) {
                result.add(group);
            }
        }
        return result;
    }

    public int occurrenceCount() {
        int count = 0;
        for (RigidGroup group : groups) {
            count += group.occurrences().size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "RigidResults{groups=" + groups.size() + ", joints=" + joints.size() + "}";
    }
}
