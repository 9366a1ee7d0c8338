package org.jointresolver.mcp;

import org.jointresolver.kinematics.AssemblyDocumentReader;
import org.jointresolver.kinematics.KinematicTreeSynthesizer;
import org.jointresolver.kinematics.KinematicsProperties;
import org.jointresolver.kinematics.dto.CleanedAssemblyResult;
import org.jointresolver.kinematics.dto.KinematicChildView;
import org.jointresolver.kinematics.dto.KinematicJointView;
import org.jointresolver.kinematics.dto.KinematicTreeResult;
import org.jointresolver.kinematics.dto.RigidJointView;
import org.jointresolver.rigid.NoGroundedGroupException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KinematicsMcpToolsTest {

    private static final String ROBOT_ARM = """
            {
              "occurrences": [
                {"name": "base:1"}, {"name": "plate:1"}, {"name": "arm:1"},
                {"name": "gripper:1"}, {"name": "stray:1"}
              ],
              "groups": [
                {"name": "base", "grounded": true, "occurrences": ["base:1"]},
                {"name": "plate", "occurrences": ["plate:1"]},
                {"name": "arm", "occurrences": ["arm:1"]},
                {"name": "gripper", "occurrences": ["gripper:1"]},
                {"name": "stray", "occurrences": ["stray:1"]}
              ],
              "joints": [
                {"groupOne": 0, "groupTwo": 1,
                 "constraints": [{"name": "Mate:1", "type": "MATE", "occurrenceOne": "base:1", "occurrenceTwo": "plate:1"}]},
                {"groupOne": 2, "groupTwo": 1,
                 "joints": [{"name": "Shoulder", "type": "ROTATIONAL", "occurrenceOne": "arm:1", "occurrenceTwo": "plate:1"}]},
                {"groupOne": 2, "groupTwo": 3,
                 "joints": [{"name": "Slide", "type": "SLIDER", "occurrenceOne": "arm:1", "occurrenceTwo": "gripper:1"}]},
                {"groupOne": 3, "groupTwo": 4,
                 "joints": [{"name": "Tack", "type": "RIGID", "occurrenceOne": "gripper:1", "occurrenceTwo": "stray:1"}]}
              ]
            }
            """;

    private static KinematicsMcpTools tools(KinematicsProperties properties) {
        AssemblyDocumentReader reader = new AssemblyDocumentReader(
                properties.getMaxDocumentSize().toBytes(), properties.getMaxGroups(), properties.getMaxJoints());
        KinematicTreeSynthesizer synthesizer = new KinematicTreeSynthesizer(
                new KinematicTreeSynthesizer.Options(properties.isFailOnDisconnected()));
        return new KinematicsMcpTools(properties, reader, synthesizer);
    }

    @Test
    void buildTree_returnsMergedRootWithMovableChildren() {
        KinematicTreeResult result = tools(new KinematicsProperties()).buildTree(ROBOT_ARM, null);

        assertThat(result.root().group()).isEqualTo("base");
        assertThat(result.root().grounded()).isTrue();
        assertThat(result.root().occurrences()).containsExactly("base:1", "plate:1");
        assertThat(result.nodeCount()).isEqualTo(3);
        assertThat(result.jointCount()).isEqualTo(2);
        assertThat(result.mergedGroups()).isEqualTo(1);

        KinematicChildView arm = result.root().children().get(0);
        KinematicJointView shoulder = arm.joint();
        assertThat(shoulder.name()).isEqualTo("Shoulder");
        assertThat(shoulder.type()).isEqualTo("ROTATIONAL");
        assertThat(shoulder.parentGroup()).isEqualTo("base");
        assertThat(shoulder.childGroup()).isEqualTo("arm");
        assertThat(shoulder.parentOccurrence()).isEqualTo("plate:1");
        assertThat(shoulder.childOccurrence()).isEqualTo("arm:1");

        KinematicChildView gripper = arm.node().children().get(0);
        assertThat(gripper.joint().type()).isEqualTo("LINEAR");
        assertThat(gripper.joint().sourceType()).isEqualTo("SLIDER");
        assertThat(gripper.node().group()).isEqualTo("gripper");
        assertThat(gripper.node().grounded()).isFalse();

        assertThat(result.unreachableGroups()).containsExactly("stray");
        assertThat(result.warnings()).hasSize(2);
    }

    @Test
    void buildTree_canOmitOccurrenceNames() {
        KinematicsProperties properties = new KinematicsProperties();
        properties.setIncludeOccurrences(false);

        KinematicTreeResult result = tools(properties).buildTree(ROBOT_ARM, null);

        assertThat(result.root().occurrences()).isEmpty();
        assertThat(result.root().occurrenceCount()).isEqualTo(2);
        assertThat(tools(properties).buildTree(ROBOT_ARM, true).root().occurrences()).hasSize(2);
    }

    @Test
    void buildTree_withoutGround_fails() {
        String json = """
                {"occurrences": [{"name": "a"}], "groups": [{"name": "A", "occurrences": ["a"]}], "joints": []}
                """;

        assertThatThrownBy(() -> tools(new KinematicsProperties()).buildTree(json, null))
                .isInstanceOf(NoGroundedGroupException.class);
    }

    @Test
    void cleanAssembly_reportsEdgeKinds() {
        CleanedAssemblyResult result = tools(new KinematicsProperties()).cleanAssembly(ROBOT_ARM, false);

        assertThat(result.rootGroup()).isEqualTo("base");
        assertThat(result.groups()).hasSize(5);
        assertThat(result.joints()).extracting(RigidJointView::kind)
                .containsExactly("RIGID_EQUIVALENT", "MOVABLE", "MOVABLE", "AMBIGUOUS");
        assertThat(result.joints().get(3).joints()).containsExactly("Tack");
        assertThat(result.warnings()).hasSize(1);
    }
}
