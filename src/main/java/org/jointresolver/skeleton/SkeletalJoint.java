package org.jointresolver.skeleton;

import org.jointresolver.assembly.AssemblyJoint;
import org.jointresolver.assembly.JointType;
import org.jointresolver.assembly.PartOccurrence;
import org.jointresolver.rigid.RigidGroup;
import org.jointresolver.rigid.RigidJoint;

/**
 * 运动树边上的关节描述。
 * <p>
 * 只携带导出器计算相对变换所需的信息：关节类型、两端实例、参考组（父组）与子组；
 * 具体数值变换由导出器负责。
 */
public final class SkeletalJoint {

    private final SkeletalJointType type;
    private final AssemblyJoint source;
    private final RigidGroup parentGroup;
    private final RigidGroup childGroup;
    private final PartOccurrence parentOccurrence;
    private final PartOccurrence childOccurrence;

    private SkeletalJoint(SkeletalJointType type, AssemblyJoint source, RigidGroup parentGroup, RigidGroup childGroup,
                          PartOccurrence parentOccurrence, PartOccurrence childOccurrence) {
        this.type = type;
        this.source = source;
        this.parentGroup = parentGroup;
        this.childGroup = childGroup;
        this.parentOccurrence = parentOccurrence;
        this.childOccurrence = childOccurrence;
    }

    /**
     * 由连接的第一个可运动关节创建骨架关节，以 parentGroup 为参考坐标系。
     * <p>
     * 必须在合并完成、端点已重定向之后调用：连接的某一端必须正好是 parentGroup。
     *
     * @throws IllegalStateException    连接不连接 parentGroup
     * @throws IllegalArgumentException 连接上没有可运动关节
     */
    public static SkeletalJoint create(RigidJoint joint, RigidGroup parentGroup) {
        RigidGroup childGroup;
        if (joint.groupOne() == parentGroup) {
            childGroup = joint.groupTwo();
        } else if (joint.groupTwo() == parentGroup) {
            childGroup = joint.groupOne();
        } else {
            throw new IllegalStateException("连接 " + joint + " 不连接参考组 " + parentGroup.name());
        }

        AssemblyJoint source = joint.firstMovableJoint();
        if (source == null) {
            throw new IllegalArgumentException("连接上没有可运动关节，无法创建骨架关节：" + joint);
        }

        PartOccurrence parentOccurrence = source.occurrenceOne();
        PartOccurrence childOccurrence = source.occurrenceTwo();
        // 子组通常远小于（合并后的）父组，用子组判断方向
        if (childGroup.contains(parentOccurrence) && !childGroup.contains(childOccurrence)) {
            parentOccurrence = source.occurrenceTwo();
            childOccurrence = source.occurrenceOne();
        }
        return new SkeletalJoint(SkeletalJointType.of(source.jointType()), source, parentGroup, childGroup, parentOccurrence, childOccurrence);
    }

    public SkeletalJointType type() {
        return type;
    }

    public JointType sourceType() {
        return source.jointType();
    }

    public String name() {
        return source.name();
    }

    public AssemblyJoint source() {
        return source;
    }

    /**
     * 参考坐标系所在的组（父组）。
     */
    public RigidGroup parentGroup() {
        return parentGroup;
    }

    public RigidGroup childGroup() {
        return childGroup;
    }

    public PartOccurrence parentOccurrence() {
        return parentOccurrence;
    }

    public PartOccurrence childOccurrence() {
        return childOccurrence;
    }

    @Override
    public String toString() {
        return type + " " + name() + " (" + parentGroup.name() + " -> " + childGroup.name() + ")";
    }
}
