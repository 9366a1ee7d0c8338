package org.jointresolver.rigid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 合成过程中的非致命诊断信息。
 * <p>
 * 数据不一致（悬空连接、含义不明的连接、不可达的组）不会中断合成，只会被跳过并记录在这里，
 * 由调用方决定是否需要处理。
 */
public final class SynthesisDiagnostics {

    private final List<String> warnings = new ArrayList<>();
    private final List<RigidJoint> ambiguousEdges = new ArrayList<>();
    private final List<RigidJoint> danglingEdges = new ArrayList<>();
    private final List<RigidGroup> unreachableGroups = new ArrayList<>();
    private int mergeCount;
    private int skeletalJointCount;

    public void warn(String message) {
        warnings.add(message);
    }

    void ambiguousEdge(RigidJoint edge) {
        ambiguousEdges.add(edge);
    }

    void danglingEdge(RigidJoint edge) {
        danglingEdges.add(edge);
    }

    void unreachableGroup(RigidGroup group) {
        unreachableGroups.add(group);
    }

    void merged(int count) {
        mergeCount += count;
    }

    void skeletalJoints(int count) {
        skeletalJointCount += count;
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<RigidJoint> ambiguousEdges() {
        return Collections.unmodifiableList(ambiguousEdges);
    }

    public List<RigidJoint> danglingEdges() {
        return Collections.unmodifiableList(danglingEdges);
    }

    public List<RigidGroup> unreachableGroups() {
        return Collections.unmodifiableList(unreachableGroups);
    }

    public int mergeCount() {
        return mergeCount;
    }

    public int skeletalJointCount() {
        return skeletalJointCount;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
