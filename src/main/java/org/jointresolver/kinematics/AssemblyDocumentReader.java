package org.jointresolver.kinematics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jointresolver.assembly.ConstraintType;
import org.jointresolver.assembly.JointType;
import org.jointresolver.assembly.PartOccurrence;
import org.jointresolver.assembly.SnapshotConstraint;
import org.jointresolver.assembly.SnapshotJoint;
import org.jointresolver.assembly.SnapshotOccurrence;
import org.jointresolver.kinematics.dto.AssemblyDocument;
import org.jointresolver.rigid.RigidGroup;
import org.jointresolver.rigid.RigidJoint;
import org.jointresolver.rigid.RigidResults;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 把 JSON 装配文档（{@link AssemblyDocument}）转换为 {@link RigidResults}。
 * <p>
 * 说明：
 * <ul>
 *   <li>组、连接的顺序与文档中的顺序一致（树合成的平局处理依赖这个顺序）。</li>
 *   <li>每次读取都会创建全新的对象图，多个调用之间不共享任何可变状态。</li>
 *   <li>文档引用错误（未知实例名、组下标越界、未知类型）直接报参数错误，不做猜测。</li>
 * </ul>
 */
public class AssemblyDocumentReader {

    /**
     * 装配文档解析用的 JSON 解析器（默认配置：未知字段视为错误）。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final long maxChars;
    private final int maxGroups;
    private final int maxJoints;

    public AssemblyDocumentReader(long maxChars, int maxGroups, int maxJoints) {
        this.maxChars = maxChars;
        this.maxGroups = maxGroups;
        this.maxJoints = maxJoints;
    }

    public RigidResults read(String json) {
        return toResults(parse(json));
    }

    public AssemblyDocument parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("参数错误：装配文档不能为空");
        }
        if (json.length() > maxChars) {
            throw new IllegalArgumentException("装配文档过大：" + json.length() + " 字符（上限 " + maxChars + "）");
        }
        try {
            return OBJECT_MAPPER.readValue(json, AssemblyDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("装配文档不是合法的 JSON：" + e.getOriginalMessage(), e);
        }
    }

    public RigidResults toResults(AssemblyDocument document) {
        List<AssemblyDocument.OccurrenceSpec> occurrenceSpecs = nullToEmpty(document.occurrences());
        List<AssemblyDocument.GroupSpec> groupSpecs = nullToEmpty(document.groups());
        List<AssemblyDocument.EdgeSpec> edgeSpecs = nullToEmpty(document.joints());
        if (groupSpecs.size() > maxGroups) {
            throw new IllegalArgumentException("刚体组数量超过上限：" + groupSpecs.size() + "（上限 " + maxGroups + "）");
        }
        if (edgeSpecs.size() > maxJoints) {
            throw new IllegalArgumentException("连接数量超过上限：" + edgeSpecs.size() + "（上限 " + maxJoints + "）");
        }

        Map<String, PartOccurrence> occurrences = new HashMap<>();
        for (AssemblyDocument.OccurrenceSpec spec : occurrenceSpecs) {
            if (spec == null || spec.name() == null || spec.name().isBlank()) {
                throw new IllegalArgumentException("参数错误：occurrences[].name 不能为空");
            }
            PartOccurrence previous = occurrences.putIfAbsent(spec.name(), new SnapshotOccurrence(spec.name(), Boolean.TRUE.equals(spec.suppressed())));
            if (previous != null) {
                throw new IllegalArgumentException("参数错误：实例名称重复：" + spec.name());
            }
        }

        RigidResults results = new RigidResults();
        List<RigidGroup> groups = new ArrayList<>(groupSpecs.size());
        // 实例名称 -> 所属组下标，一个实例只能属于一个刚体组
        Map<String, Integer> owners = new HashMap<>();
        for (int i = 0; i < groupSpecs.size(); i++) {
            AssemblyDocument.GroupSpec spec = groupSpecs.get(i);
            if (spec == null) {
                throw new IllegalArgumentException("参数错误：groups[" + i + "] 不能为空");
            }
            String name = (spec.name() == null || spec.name().isBlank()) ? "group" + i : spec.name();
            List<PartOccurrence> members = new ArrayList<>();
            for (String occurrenceName : nullToEmpty(spec.occurrences())) {
                PartOccurrence member = lookup(occurrences, occurrenceName, "groups[" + i + "].occurrences");
                Integer owner = owners.putIfAbsent(member.name(), i);
                if (owner != null) {
                    throw new IllegalArgumentException("参数错误：实例 " + member.name() + " 同时出现在 groups[" + owner + "] 与 groups[" + i + "] 中");
                }
                members.add(member);
            }
            groups.add(results.addGroup(new RigidGroup(name, Boolean.TRUE.equals(spec.grounded()), members)));
        }

        for (int i = 0; i < edgeSpecs.size(); i++) {
            AssemblyDocument.EdgeSpec spec = edgeSpecs.get(i);
            if (spec == null) {
                throw new IllegalArgumentException("参数错误：joints[" + i + "] 不能为空");
            }
            String path = "joints[" + i + "]";
            RigidJoint edge = new RigidJoint(
                    groupAt(groups, spec.groupOne(), path + ".groupOne"),
                    groupAt(groups, spec.groupTwo(), path + ".groupTwo")
            );
            List<AssemblyDocument.RelationSpec> jointSpecs = nullToEmpty(spec.joints());
            for (int j = 0; j < jointSpecs.size(); j++) {
                AssemblyDocument.RelationSpec relation = requireRelation(jointSpecs.get(j), path + ".joints[" + j + "]");
                edge.addJoint(new SnapshotJoint(
                        relation.name(),
                        parseJointType(relation.type(), path + ".joints[" + j + "].type"),
                        Boolean.TRUE.equals(relation.suppressed()),
                        lookup(occurrences, relation.occurrenceOne(), path + ".joints[" + j + "].occurrenceOne"),
                        lookup(occurrences, relation.occurrenceTwo(), path + ".joints[" + j + "].occurrenceTwo")
                ));
            }
            List<AssemblyDocument.RelationSpec> constraintSpecs = nullToEmpty(spec.constraints());
            for (int j = 0; j < constraintSpecs.size(); j++) {
                AssemblyDocument.RelationSpec relation = requireRelation(constraintSpecs.get(j), path + ".constraints[" + j + "]");
                edge.addConstraint(new SnapshotConstraint(
                        relation.name(),
                        parseConstraintType(relation.type(), path + ".constraints[" + j + "].type"),
                        Boolean.TRUE.equals(relation.suppressed()),
                        lookup(occurrences, relation.occurrenceOne(), path + ".constraints[" + j + "].occurrenceOne"),
                        lookup(occurrences, relation.occurrenceTwo(), path + ".constraints[" + j + "].occurrenceTwo")
                ));
            }
            results.addJoint(edge);
        }
        return results;
    }

    static JointType parseJointType(String type, String path) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("参数错误：" + path + " 不能为空");
        }
        try {
            return JointType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("参数错误：" + path + " 不是已知的关节类型：" + type, e);
        }
    }

    static ConstraintType parseConstraintType(String type, String path) {
        if (type == null || type.isBlank()) {
            return ConstraintType.OTHER;
        }
        try {
            return ConstraintType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("参数错误：" + path + " 不是已知的约束类型：" + type, e);
        }
    }

    private static AssemblyDocument.RelationSpec requireRelation(AssemblyDocument.RelationSpec relation, String path) {
        if (relation == null) {
            throw new IllegalArgumentException("参数错误：" + path + " 不能为空");
        }
        return relation;
    }

    private static PartOccurrence lookup(Map<String, PartOccurrence> occurrences, String name, String path) {
        PartOccurrence occurrence = (name == null) ? null : occurrences.get(name);
        if (occurrence == null) {
            throw new IllegalArgumentException("参数错误：" + path + " 引用了未知实例：" + name);
        }
        return occurrence;
    }

    private static RigidGroup groupAt(List<RigidGroup> groups, Integer index, String path) {
        if (index == null || index < 0 || index >= groups.size()) {
            throw new IllegalArgumentException("参数错误：" + path + " 组下标越界：" + index + "（共 " + groups.size() + " 个组）");
        }
        return groups.get(index);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return (list == null) ? List.of() : list;
    }
}
