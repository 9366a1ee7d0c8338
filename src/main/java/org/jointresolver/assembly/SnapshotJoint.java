package org.jointresolver.assembly;

import java.util.Objects;

/**
 * 装配关节快照。
 */
public final class SnapshotJoint implements AssemblyJoint {

    private final String name;
    private final JointType jointType;
    private final boolean suppressed;
    private final PartOccurrence occurrenceOne;
    private final PartOccurrence occurrenceTwo;

    public SnapshotJoint(String name, JointType jointType, boolean suppressed, PartOccurrence occurrenceOne, PartOccurrence occurrenceTwo) {
        this.name = name;
        this.jointType = Objects.requireNonNull(jointType, "jointType");
        this.suppressed = suppressed;
        this.occurrenceOne = Objects.requireNonNull(occurrenceOne, "occurrenceOne");
        this.occurrenceTwo = Objects.requireNonNull(occurrenceTwo, "occurrenceTwo");
    }

    public SnapshotJoint(String name, JointType jointType, PartOccurrence occurrenceOne, PartOccurrence occurrenceTwo) {
        this(name, jointType, false, occurrenceOne, occurrenceTwo);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public JointType jointType() {
        return jointType;
    }

    @Override
    public boolean suppressed() {
        return suppressed;
    }

    @Override
    public PartOccurrence occurrenceOne() {
        return occurrenceOne;
    }

    @Override
    public PartOccurrence occurrenceTwo() {
        return occurrenceTwo;
    }

    @Override
    public String toString() {
        return name + "[" + jointType + "] " + occurrenceOne.name() + " <-> " + occurrenceTwo.name();
    }
}
