package org.jointresolver.rigid;

import org.jointresolver.assembly.JointType;
import org.jointresolver.assembly.PartOccurrence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.jointresolver.AssemblyFixtures.connect;
import static org.jointresolver.AssemblyFixtures.group;
import static org.jointresolver.AssemblyFixtures.joint;
import static org.jointresolver.AssemblyFixtures.mate;
import static org.jointresolver.AssemblyFixtures.occ;
import static org.jointresolver.AssemblyFixtures.rigid;
import static org.jointresolver.AssemblyFixtures.rotational;
import static org.jointresolver.AssemblyFixtures.suppressedJoint;
import static org.jointresolver.AssemblyFixtures.suppressedOcc;

class RigidBodyCleanerTest {

    @Test
    void cleanMeaningless_removesSuppressedAndDegenerateElements() {
        RigidResults results = new RigidResults();
        PartOccurrence a = occ("a");
        PartOccurrence s = suppressedOcc("s");
        PartOccurrence b = occ("b");
        PartOccurrence hidden = suppressedOcc("hidden");
        PartOccurrence d = occ("d");
        RigidGroup groupA = group(results, "A", true, a, s);
        RigidGroup groupB = group(results, "B", false, b);
        RigidGroup groupC = group(results, "C", false, hidden);
        RigidGroup groupD = group(results, "D", false, d);

        RigidJoint suppressedOnly = connect(results, groupA, groupB).addJoint(suppressedJoint("J1", a, b));
        RigidJoint selfLoop = connect(results, groupA, groupA).addJoint(rotational("J2", a, a));
        RigidJoint toEmptyGroup = connect(results, groupB, groupC).addJoint(rotational("J3", b, hidden));
        RigidJoint mixed = connect(results, groupA, groupD)
                .addJoint(rotational("J4", a, d))
                .addConstraint(mate("M1", s, d));
        RigidJoint bare = connect(results, groupB, groupD);

        RigidBodyCleaner.cleanMeaningless(results);

        assertThat(groupA.occurrences()).containsExactly(a);
        assertThat(results.groups()).containsExactly(groupA, groupB, groupD);
        assertThat(results.joints()).containsExactly(mixed);
        assertThat(results.joints()).doesNotContain(suppressedOnly, selfLoop, toEmptyGroup, bare);
        assertThat(mixed.joints()).hasSize(1);
        assertThat(mixed.constraints()).isEmpty();
    }

    @Test
    void cleanMeaningless_isIdempotent() {
        RigidResults results = new RigidResults();
        PartOccurrence a = occ("a");
        PartOccurrence b = occ("b");
        PartOccurrence c = suppressedOcc("c");
        RigidGroup groupA = group(results, "A", true, a, c);
        RigidGroup groupB = group(results, "B", false, b);
        group(results, "C", false, c);
        connect(results, groupA, groupB).addJoint(rotational("J1", a, b)).addConstraint(mate("M1", c, b));
        connect(results, groupB, groupB).addConstraint(mate("M2", b, b));

        RigidBodyCleaner.cleanMeaningless(results);
        List<RigidGroup> groupsOnce = new ArrayList<>(results.groups());
        List<RigidJoint> jointsOnce = new ArrayList<>(results.joints());
        List<PartOccurrence> occurrencesOnce = new ArrayList<>(groupA.occurrences());
        int entriesOnce = results.joints().get(0).joints().size() + results.joints().get(0).constraints().size();

        RigidBodyCleaner.cleanMeaningless(results);

        assertThat(results.groups()).containsExactlyElementsOf(groupsOnce);
        assertThat(results.joints()).containsExactlyElementsOf(jointsOnce);
        assertThat(groupA.occurrences()).containsExactlyElementsOf(occurrencesOnce);
        assertThat(results.joints().get(0).joints().size() + results.joints().get(0).constraints().size()).isEqualTo(entriesOnce);
        for (RigidJoint joint : results.joints()) {
            assertThat(joint.groupOne()).isNotSameAs(joint.groupTwo());
        }
    }

    @Test
    void cleanGroundedBodies_mergesAllGroundedGroupsIntoFirst() {
        RigidResults results = new RigidResults();
        PartOccurrence a = occ("a");
        PartOccurrence b = occ("b");
        PartOccurrence c = occ("c");
        RigidGroup g1 = group(results, "G1", true, a, b);
        RigidGroup g2 = group(results, "G2", true, c);

        RigidGroup root = RigidBodyCleaner.cleanGroundedBodies(results);

        assertThat(root).isSameAs(g1);
        assertThat(results.groups()).containsExactly(g1);
        assertThat(g1.occurrences()).containsExactly(a, b, c);
        assertThat(g2.occurrences()).isEmpty();
        assertThat(results.groups().stream().map(RigidGroup::name)).doesNotContain("G2");
    }

    @Test
    void cleanGroundedBodies_redirectsEdgesOfMergedGroundAndDropsLoops() {
        RigidResults results = new RigidResults();
        PartOccurrence a = occ("a");
        PartOccurrence c = occ("c");
        PartOccurrence m = occ("m");
        RigidGroup g1 = group(results, "G1", true, a);
        RigidGroup g2 = group(results, "G2", true, c);
        RigidGroup movable = group(results, "M", false, m);
        RigidJoint groundToGround = connect(results, g1, g2).addConstraint(mate("M1", a, c));
        RigidJoint arm = connect(results, movable, g2).addJoint(rotational("J1", m, c));

        RigidBodyCleaner.cleanGroundedBodies(results);

        assertThat(results.joints()).containsExactly(arm);
        assertThat(results.joints()).doesNotContain(groundToGround);
        assertThat(arm.groupOne()).isSameAs(movable);
        assertThat(arm.groupTwo()).isSameAs(g1);
        assertThat(results.groundedGroups()).containsExactly(g1);
    }

    @Test
    void cleanGroundedBodies_withoutGround_failsWithoutTouchingGroups() {
        RigidResults results = new RigidResults();
        PartOccurrence a = occ("a");
        PartOccurrence b = occ("b");
        RigidGroup groupA = group(results, "A", false, a);
        RigidGroup groupB = group(results, "B", false, b);
        connect(results, groupA, groupB).addJoint(rotational("J1", a, b));

        assertThatThrownBy(() -> RigidBodyCleaner.cleanGroundedBodies(results))
                .isInstanceOf(NoGroundedGroupException.class)
                .isInstanceOf(IllegalStateException.class);

        assertThat(groupA.occurrences()).containsExactly(a);
        assertThat(groupB.occurrences()).containsExactly(b);
        assertThat(results.groups()).containsExactly(groupA, groupB);
        assertThat(results.joints()).hasSize(1);
    }

    @Test
    void classify_coversEveryBranch() {
        RigidGroup one = new RigidGroup("one", true);
        RigidGroup two = new RigidGroup("two", false);
        PartOccurrence a = occ("a");
        PartOccurrence b = occ("b");

        RigidJoint movable = new RigidJoint(one, two).addJoint(rigid("R1", a, b)).addJoint(rotational("J1", a, b));
        RigidJoint movableWithConstraints = new RigidJoint(one, two).addJoint(joint("S1", JointType.SLIDER, a, b)).addConstraint(mate("M1", a, b));
        RigidJoint constraintOnly = new RigidJoint(one, two).addConstraint(mate("M2", a, b));
        RigidJoint twoRigid = new RigidJoint(one, two).addJoint(rigid("R2", a, b)).addJoint(rigid("R3", a, b));
        RigidJoint oneRigid = new RigidJoint(one, two).addJoint(rigid("R4", a, b));
        RigidJoint oneRigidWithConstraint = new RigidJoint(one, two).addJoint(rigid("R5", a, b)).addConstraint(mate("M3", a, b));
        RigidJoint empty = new RigidJoint(one, two);

        assertThat(RigidBodyCleaner.classify(movable)).isEqualTo(EdgeKind.MOVABLE);
        assertThat(RigidBodyCleaner.classify(movableWithConstraints)).isEqualTo(EdgeKind.MOVABLE);
        assertThat(RigidBodyCleaner.classify(constraintOnly)).isEqualTo(EdgeKind.RIGID_EQUIVALENT);
        assertThat(RigidBodyCleaner.classify(twoRigid)).isEqualTo(EdgeKind.RIGID_EQUIVALENT);
        assertThat(RigidBodyCleaner.classify(oneRigidWithConstraint)).isEqualTo(EdgeKind.RIGID_EQUIVALENT);
        assertThat(RigidBodyCleaner.classify(oneRigid)).isEqualTo(EdgeKind.AMBIGUOUS);
        assertThat(RigidBodyCleaner.classify(empty)).isEqualTo(EdgeKind.EMPTY);
    }

    @Test
    void generateJointMaps_buildsUndirectedOrderedMapsForEveryGroup() {
        RigidResults results = new RigidResults();
        PartOccurrence r = occ("r");
        PartOccurrence a = occ("a");
        PartOccurrence b = occ("b");
        PartOccurrence lonely = occ("lonely");
        RigidGroup root = group(results, "R", true, r);
        RigidGroup groupA = group(results, "A", false, a);
        RigidGroup groupB = group(results, "B", false, b);
        RigidGroup isolated = group(results, "L", false, lonely);
        connect(results, root, groupB).addJoint(rotational("J1", r, b));
        connect(results, root, groupA).addJoint(rotational("J2", r, a));
        connect(results, groupA, root).addJoint(rotational("J3", a, r));
        connect(results, groupA, groupB).addConstraint(mate("M1", a, b));
        connect(results, groupB, isolated).addJoint(rigid("R1", b, lonely));

        SynthesisDiagnostics diagnostics = new SynthesisDiagnostics();
        RigidBodyCleaner.JointMaps maps = RigidBodyCleaner.generateJointMaps(results, diagnostics);

        assertThat(maps.movable()).containsOnlyKeys(root, groupA, groupB, isolated);
        assertThat(maps.rigidEquivalent()).containsOnlyKeys(root, groupA, groupB, isolated);
        assertThat(maps.movableNeighbours(root)).containsExactly(groupB, groupA);
        assertThat(maps.movableNeighbours(groupA)).containsExactly(root);
        assertThat(maps.rigidNeighbours(groupA)).containsExactly(groupB);
        assertThat(maps.rigidNeighbours(groupB)).containsExactly(groupA);
        assertThat(maps.movableNeighbours(isolated)).isEmpty();
        assertThat(maps.rigidNeighbours(isolated)).isEmpty();
        assertThat(diagnostics.ambiguousEdges()).hasSize(1);
        assertThat(diagnostics.warnings()).hasSize(1);
    }

    @Test
    void generateJointMaps_skipsEdgesToUnknownGroups() {
        RigidResults results = new RigidResults();
        PartOccurrence r = occ("r");
        PartOccurrence x = occ("x");
        RigidGroup root = group(results, "R", true, r);
        RigidGroup stranger = new RigidGroup("X", false, List.of(x));
        RigidJoint dangling = connect(results, root, stranger).addJoint(rotational("J1", r, x));

        SynthesisDiagnostics diagnostics = new SynthesisDiagnostics();
        RigidBodyCleaner.JointMaps maps = RigidBodyCleaner.generateJointMaps(results, diagnostics);

        assertThat(maps.movableNeighbours(root)).isEmpty();
        assertThat(maps.movable()).doesNotContainKey(stranger);
        assertThat(diagnostics.danglingEdges()).containsExactly(dangling);
        assertThat(diagnostics.hasWarnings()).isTrue();
    }

    @Test
    void generateJointMaps_remembersFirstParallelMovableEdgeInBothDirections() {
        RigidResults results = new RigidResults();
        PartOccurrence r = occ("r");
        PartOccurrence a = occ("a");
        PartOccurrence b = occ("b");
        RigidGroup root = group(results, "R", true, r);
        RigidGroup groupA = group(results, "A", false, a);
        RigidGroup groupB = group(results, "B", false, b);
        connect(results, root, groupA).addConstraint(mate("Mate1", r, a));
        RigidJoint first = connect(results, groupA, root).addJoint(rotational("First", a, r));
        connect(results, root, groupA).addJoint(joint("Second", JointType.SLIDER, r, a));
        connect(results, root, groupB).addConstraint(mate("Mate2", r, b));

        RigidBodyCleaner.JointMaps maps = RigidBodyCleaner.generateJointMaps(results, new SynthesisDiagnostics());

        assertThat(maps.movableEdge(root, groupA)).isSameAs(first);
        assertThat(maps.movableEdge(groupA, root)).isSameAs(first);
        assertThat(maps.movableEdge(root, groupB)).isNull();
        assertThat(maps.movableEdge(groupA, groupB)).isNull();
        assertThat(maps.movableNeighbours(root)).containsExactly(groupA);
    }
}
