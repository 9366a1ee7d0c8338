package org.jointresolver.assembly;

import java.util.Objects;

/**
 * 装配约束快照。
 */
public final class SnapshotConstraint implements AssemblyConstraint {

    private final String name;
    private final ConstraintType constraintType;
    private final boolean suppressed;
    private final PartOccurrence occurrenceOne;
    private final PartOccurrence occurrenceTwo;

    public SnapshotConstraint(String name, ConstraintType constraintType, boolean suppressed, PartOccurrence occurrenceOne, PartOccurrence occurrenceTwo) {
        this.name = name;
        this.constraintType = (constraintType == null) ? ConstraintType.OTHER : constraintType;
        this.suppressed = suppressed;
        this.occurrenceOne = Objects.requireNonNull(occurrenceOne, "occurrenceOne");
        this.occurrenceTwo = Objects.requireNonNull(occurrenceTwo, "occurrenceTwo");
    }

    public SnapshotConstraint(String name, PartOccurrence occurrenceOne, PartOccurrence occurrenceTwo) {
        this(name, ConstraintType.MATE, false, occurrenceOne, occurrenceTwo);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ConstraintType constraintType() {
        return constraintType;
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
        return name + "[" + constraintType + "] " + occurrenceOne.name() + " <-> " + occurrenceTwo.name();
    }
}
