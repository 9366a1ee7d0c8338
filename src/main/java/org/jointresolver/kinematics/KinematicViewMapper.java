package org.jointresolver.kinematics;

import org.jointresolver.assembly.AssemblyRelationship;
import org.jointresolver.assembly.PartOccurrence;
import org.jointresolver.kinematics.dto.CleanedAssemblyResult;
import org.jointresolver.kinematics.dto.KinematicChildView;
import org.jointresolver.kinematics.dto.KinematicJointView;
import org.jointresolver.kinematics.dto.KinematicNodeView;
import org.jointresolver.kinematics.dto.KinematicTreeResult;
import org.jointresolver.kinematics.dto.RigidGroupView;
import org.jointresolver.kinematics.dto.RigidJointView;
import org.jointresolver.rigid.RigidBodyCleaner;
import org.jointresolver.rigid.RigidGroup;
import org.jointresolver.rigid.RigidJoint;
import org.jointresolver.skeleton.RigidNode;
import org.jointresolver.skeleton.SkeletalJoint;

import java.util.ArrayList;
import java.util.List;

/**
 * 合成结果 -> 工具返回 DTO。
 */
public final class KinematicViewMapper {

    private KinematicViewMapper() {
    }

    public static KinematicTreeResult toTreeResult(KinematicTreeSynthesizer.Synthesis synthesis, boolean includeOccurrences) {
        RigidNode root = synthesis.root();
        int nodeCount = root.listAllNodes().size();
        List<String> unreachable = new ArrayList<>();
        for (RigidGroup group : synthesis.diagnostics().unreachableGroups()) {
            unreachable.add(group.name());
        }
        return new KinematicTreeResult(
                toNodeView(root, includeOccurrences),
                nodeCount,
                nodeCount - 1,
                synthesis.diagnostics().mergeCount(),
                synthesis.results().groups().size(),
                synthesis.results().joints().size(),
                unreachable,
                List.copyOf(synthesis.diagnostics().warnings())
        );
    }

    public static CleanedAssemblyResult toCleanedResult(KinematicTreeSynthesizer.Cleaning cleaning, boolean includeOccurrences) {
        List<RigidGroupView> groups = new ArrayList<>(cleaning.results().groups().size());
        for (RigidGroup group : cleaning.results().groups()) {
            groups.add(new RigidGroupView(group.name(), group.isGrounded(), group.occurrences().size(), occurrenceNames(group, includeOccurrences)));
        }
        List<RigidJointView> joints = new ArrayList<>(cleaning.results().joints().size());
        for (RigidJoint joint : cleaning.results().joints()) {
            joints.add(new RigidJointView(
                    joint.groupOne().name(),
                    joint.groupTwo().name(),
                    RigidBodyCleaner.classify(joint).name(),
                    relationNames(joint.joints()),
                    relationNames(joint.constraints())
            ));
        }
        return new CleanedAssemblyResult(cleaning.root().name(), groups, joints, List.copyOf(cleaning.diagnostics().warnings()));
    }

    public static KinematicNodeView toNodeView(RigidNode node, boolean includeOccurrences) {
        List<KinematicChildView> children = new ArrayList<>(node.children().size());
        for (RigidNode.Child child : node.children()) {
            children.add(new KinematicChildView(toJointView(child.joint()), toNodeView(child.node(), includeOccurrences)));
        }
        RigidGroup group = node.group();
        return new KinematicNodeView(group.name(), group.isGrounded(), group.occurrences().size(), occurrenceNames(group, includeOccurrences), children);
    }

    public static KinematicJointView toJointView(SkeletalJoint joint) {
        return new KinematicJointView(
                joint.name(),
                joint.type().name(),
                joint.sourceType().name(),
                joint.type().degreesOfFreedom(),
                joint.parentGroup().name(),
                joint.childGroup().name(),
                joint.parentOccurrence().name(),
                joint.childOccurrence().name()
        );
    }

    private static List<String> occurrenceNames(RigidGroup group, boolean includeOccurrences) {
        if (!includeOccurrences) {
            return List.of();
        }
        List<String> names = new ArrayList<>(group.occurrences().size());
        for (PartOccurrence occurrence : group.occurrences()) {
            names.add(occurrence.name());
        }
        return names;
    }

    private static List<String> relationNames(List<? extends AssemblyRelationship> relations) {
        List<String> names = new ArrayList<>(relations.size());
        for (AssemblyRelationship relation : relations) {
            names.add(relation.name());
        }
        return names;
    }
}
