package org.jointresolver.rigid;

import org.jointresolver.assembly.PartOccurrence;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 刚体组：一起运动的零件实例集合。
 * <p>
 * 说明：
 * <ul>
 *   <li>身份是引用身份：不重写 {@code equals/hashCode}，内容相同的两个组在被显式合并前仍是两个组。</li>
 *   <li>合并时实例被追加到目标组，源组被清空；清空的组会在清理阶段被移出结果集。</li>
 *   <li>{@link #occurrences()} 返回的是可变列表，清理/合并阶段直接原地修改。</li>
 * </ul>
 */
public class RigidGroup {

    private final String name;
    private final List<PartOccurrence> occurrences = new ArrayList<>();
    private boolean grounded;

    public RigidGroup(String name, boolean grounded, Collection<? extends PartOccurrence> occurrences) {
        this.name = name;
        this.grounded = grounded;
        if (occurrences != null) {
            this.occurrences.addAll(occurrences);
        }
    }

    public RigidGroup(String name, boolean grounded) {
        this(name, grounded, null);
    }

    public String name() {
        return name;
    }

    public List<PartOccurrence> occurrences() {
        return occurrences;
    }

    public boolean isGrounded() {
        return grounded;
    }

    public boolean isEmpty() {
        return occurrences.isEmpty();
    }

    /**
     * 判断实例是否属于本组（按引用比较）。
     */
    public boolean contains(PartOccurrence occurrence) {
        for (PartOccurrence candidate : occurrences) {
            if (candidate == occurrence) {
                return true;
            }
        }
        return false;
    }

    /**
     * 把 source 的实例全部移入本组，并清空 source。grounded 标志不变。
     */
    public void takeOccurrencesFrom(RigidGroup source) {
        if (source == this) {
            return;
        }
        occurrences.addAll(source.occurrences);
        source.occurrences.clear();
    }

    /**
     * 合并 source：移入全部实例，并把 source 的 grounded 标志并入本组。
     */
    public void absorb(RigidGroup source) {
        takeOccurrencesFrom(source);
        grounded = grounded || source.grounded;
    }

    @Override
    public String toString() {
        return name + (grounded ? " (grounded)" : "") + " " + occurrences.size() + " occurrence(s)";
    }
}
