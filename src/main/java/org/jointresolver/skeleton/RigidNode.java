package org.jointresolver.skeleton;

import org.jointresolver.assembly.PartOccurrence;
import org.jointresolver.rigid.RigidGroup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * 运动树节点：一个（合并后的）刚体组，以及通过骨架关节挂在它下面的子节点。
 */
public class RigidNode {

    private final RigidGroup group;
    private final List<Child> children = new ArrayList<>();

    /**
     * 子节点及连接它的骨架关节。
     */
    public record Child(SkeletalJoint joint, RigidNode node) {
    }

    public RigidNode(RigidGroup group) {
        this.group = Objects.requireNonNull(group, "group");
    }

    public RigidGroup group() {
        return group;
    }

    public String modelId() {
        return group.name();
    }

    public List<PartOccurrence> occurrences() {
        return Collections.unmodifiableList(group.occurrences());
    }

    public void addChild(SkeletalJoint joint, RigidNode child) {
        if (child == this) {
            throw new IllegalArgumentException("节点不能挂在自己下面：" + modelId());
        }
        children.add(new Child(Objects.requireNonNull(joint, "joint"), child));
    }

    public List<Child> children() {
        return Collections.unmodifiableList(children);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * 前序遍历列出本节点及其所有后代（子节点按添加顺序）。
     */
    public List<RigidNode> listAllNodes() {
        List<RigidNode> result = new ArrayList<>();
        Deque<RigidNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            RigidNode node = stack.pop();
            result.add(node);
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i).node());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "RigidNode{" + modelId() + ", children=" + children.size() + "}";
    }
}
