package org.jointresolver.assembly;

/**
 * 以数据形式提供的零件实例快照（例如来自 JSON 装配文档）。
 * <p>
 * 注意：这里刻意不用 record，两个同名实例也必须是不同的对象（引用相等）。
 */
public final class SnapshotOccurrence implements PartOccurrence {

    private final String name;
    private final boolean suppressed;

    public SnapshotOccurrence(String name, boolean suppressed) {
        this.name = name;
        this.suppressed = suppressed;
    }

    public SnapshotOccurrence(String name) {
        this(name, false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean suppressed() {
        return suppressed;
    }

    @Override
    public String toString() {
        return suppressed ? name + " (suppressed)" : name;
    }
}
