package org.jointresolver.rigid;

import org.jointresolver.assembly.AssemblyJoint;
import org.jointresolver.assembly.AssemblyRelationship;
import org.jointresolver.assembly.PartOccurrence;
import org.jointresolver.skeleton.RigidNode;
import org.jointresolver.skeleton.SkeletalJoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 刚体图清理与运动树合成。
 * <p>
 * 流水线（每一步都原地修改 {@link RigidResults}）：
 * <ol>
 *   <li>{@link #cleanMeaningless}：去掉被抑制的实例/关节/约束、自环、空连接、空组。</li>
 *   <li>{@link #cleanGroundedBodies}：把所有接地组合并为一个根组。</li>
 *   <li>{@link #generateJointMaps}：按连接分类生成“可运动”与“刚性等价”两张邻接表。</li>
 *   <li>{@link #planTree}：从根组开始逐层广度优先展开，得到合并表与待创建的骨架关节（不修改任何数据）。</li>
 *   <li>{@link #applyPlan}：执行合并、修正连接端点、创建骨架关节、最后再清理一遍。</li>
 * </ol>
 * <p>
 * 骨架关节必须在合并完成之后才能创建，否则关节会指向已经被清空的组。
 * 所有集合都使用插入有序的实现，保证同一输入得到同一棵树。
 */
public final class RigidBodyCleaner {

    private static final Logger log = LoggerFactory.getLogger(RigidBodyCleaner.class);

    private RigidBodyCleaner() {
    }

    /**
     * 两张邻接表（无向、去重、插入有序）。每个组在两张表中都有条目，可能为空集合。
     *
     * @param movable         通过可运动关节相连的组
     * @param rigidEquivalent 通过约束/纯刚性关节相连的组
     * @param movableEdges    组 -> 可运动邻居 -> 按连接列表顺序第一条相连的可运动连接（两个方向都登记）
     */
    public record JointMaps(
            Map<RigidGroup, Set<RigidGroup>> movable,
            Map<RigidGroup, Set<RigidGroup>> rigidEquivalent,
            Map<RigidGroup, Map<RigidGroup, RigidJoint>> movableEdges
    ) {
        public Set<RigidGroup> movableNeighbours(RigidGroup group) {
            return movable.getOrDefault(group, Collections.emptySet());
        }

        /**
         * @return 连接 a、b 的第一条可运动连接；两者不是可运动邻居时返回 null
         */
        public RigidJoint movableEdge(RigidGroup a, RigidGroup b) {
            return movableEdges.getOrDefault(a, Collections.emptyMap()).get(b);
        }

        public Set<RigidGroup> rigidNeighbours(RigidGroup group) {
            return rigidEquivalent.getOrDefault(group, Collections.emptySet());
        }
    }

    /**
     * 延迟创建的骨架关节。
     *
     * @param joint      承载可运动关节的连接
     * @param parentNode 父节点（分支所有者的节点）
     * @param node       子节点
     */
    public record PlannedJoint(RigidJoint joint, RigidNode parentNode, RigidNode node) {
    }

    /**
     * 树合成的规划结果。规划阶段只读，所有修改都推迟到 {@link #applyPlan}。
     *
     * @param root              根组（第一个接地组）
     * @param rootNode          根节点
     * @param mergeInto         被合并组 -> 合并目标（目标总是分支所有者，不会再被映射）
     * @param plannedJoints     按发现顺序排列的待创建骨架关节
     * @param unreachableGroups 无法从根组到达的组（不会出现在树中）
     */
    public record TreePlan(
            RigidGroup root,
            RigidNode rootNode,
            Map<RigidGroup, RigidGroup> mergeInto,
            List<PlannedJoint> plannedJoints,
            List<RigidGroup> unreachableGroups
    ) {
    }

    private record Branch(RigidGroup current, RigidGroup target) {
    }

    /**
     * 删除无意义的元素。
     * <p>
     * 顺序：被抑制的实例 → 被抑制（或端点被抑制）的关节与约束 → 自环/端点为空/没有任何关节约束的连接 → 空组。
     * 幂等：连续执行两次与执行一次结果相同。
     */
    public static void cleanMeaningless(RigidResults results) {
        for (RigidGroup group : results.groups()) {
            group.occurrences().removeIf(PartOccurrence::suppressed);
        }
        for (RigidJoint joint : results.joints()) {
            joint.joints().removeIf(AssemblyRelationship::suppressedOrDetached);
            joint.constraints().removeIf(AssemblyRelationship::suppressedOrDetached);
        }
        results.joints().removeIf(joint -> joint.isSelfLoop()
                || joint.groupOne().isEmpty()
                || joint.groupTwo().isEmpty()
                || joint.isEmpty());
        results.groups().removeIf(RigidGroup::isEmpty);
    }

    /**
     * 把所有接地组合并到第一个接地组中，并把指向被清空组的连接端点改为该根组。
     *
     * @return 合并后的根组
     * @throws NoGroundedGroupException 没有任何接地组（此时不会修改输入）
     */
    public static RigidGroup cleanGroundedBodies(RigidResults results) {
        RigidGroup firstRoot = findFirstGrounded(results);
        if (firstRoot == null) {
            throw new NoGroundedGroupException("装配中没有接地的刚体组（groups=" + results.groups().size() + "），无法确定运动树的根");
        }
        int merged = 0;
        for (RigidGroup group : results.groups()) {
            if (group != firstRoot && group.isGrounded()) {
                firstRoot.takeOccurrencesFrom(group);
                merged++;
            }
        }
        for (RigidJoint joint : results.joints()) {
            if (joint.groupOne().isEmpty()) {
                joint.setGroupOne(firstRoot);
            }
            if (joint.groupTwo().isEmpty()) {
                joint.setGroupTwo(firstRoot);
            }
        }
        if (merged > 0) {
            log.info("合并了 {} 个额外的接地组到根组 {}", merged, firstRoot.name());
        }
        cleanMeaningless(results);
        return firstRoot;
    }

    /**
     * 连接分类。
     * <ul>
     *   <li>任一关节不是刚性类型：{@link EdgeKind#MOVABLE}</li>
     *   <li>否则有约束，或有多个（刚性）关节：{@link EdgeKind#RIGID_EQUIVALENT}</li>
     *   <li>恰好一个刚性关节且没有约束：{@link EdgeKind#AMBIGUOUS}</li>
     * </ul>
     */
    public static EdgeKind classify(RigidJoint joint) {
        for (AssemblyJoint entry : joint.joints()) {
            if (!entry.jointType().isRigid()) {
                return EdgeKind.MOVABLE;
            }
        }
        if (!joint.constraints().isEmpty() || joint.joints().size() > 1) {
            return EdgeKind.RIGID_EQUIVALENT;
        }
        if (joint.joints().size() == 1) {
            return EdgeKind.AMBIGUOUS;
        }
        return EdgeKind.EMPTY;
    }

    /**
     * 生成两张邻接表。
     * <p>
     * 引用了不在组列表中的组的连接会被跳过；单个刚性关节的连接（{@link EdgeKind#AMBIGUOUS}）不进入任何一张表。
     * 两种情况都会记入 diagnostics。
     */
    public static JointMaps generateJointMaps(RigidResults results, SynthesisDiagnostics diagnostics) {
        Map<RigidGroup, Set<RigidGroup>> movable = new LinkedHashMap<>();
        Map<RigidGroup, Set<RigidGroup>> rigidEquivalent = new LinkedHashMap<>();
        Map<RigidGroup, Map<RigidGroup, RigidJoint>> movableEdges = new LinkedHashMap<>();
        for (RigidGroup group : results.groups()) {
            movable.put(group, new LinkedHashSet<>());
            rigidEquivalent.put(group, new LinkedHashSet<>());
            movableEdges.put(group, new LinkedHashMap<>());
        }
        for (RigidJoint joint : results.joints()) {
            if (!movable.containsKey(joint.groupOne()) || !movable.containsKey(joint.groupTwo())) {
                diagnostics.danglingEdge(joint);
                warn(diagnostics, "连接引用了不在组列表中的刚体组，已跳过：" + joint);
                continue;
            }
            EdgeKind kind = classify(joint);
            log.debug("连接分类 {} -> {}", joint, kind);
            switch (kind) {
                case MOVABLE -> {
                    link(movable, joint);
                    // 平行的可运动连接只保留第一条
                    movableEdges.get(joint.groupOne()).putIfAbsent(joint.groupTwo(), joint);
                    movableEdges.get(joint.groupTwo()).putIfAbsent(joint.groupOne(), joint);
                }
                case RIGID_EQUIVALENT -> link(rigidEquivalent, joint);
                case AMBIGUOUS -> {
                    // 单个刚性关节既不算可运动也不算刚性等价，保持忽略
                    diagnostics.ambiguousEdge(joint);
                    warn(diagnostics, "连接只有一个刚性关节且没有约束，未参与运动树合成：" + joint);
                }
                case EMPTY -> log.debug("忽略空连接 {}", joint);
            }
        }
        return new JointMaps(movable, rigidEquivalent, movableEdges);
    }

    /**
     * 从根组开始逐层展开，规划合并与骨架关节（不修改输入）。
     * <ul>
     *   <li>可运动邻居：分配新节点，记录待创建关节（父节点为当前分支所有者的节点），并开启新分支。</li>
     *   <li>刚性等价邻居：记录合并到当前分支所有者，沿同一分支继续展开。</li>
     * </ul>
     * 每个组只在第一次被发现时处理。
     *
     * @throws NoGroundedGroupException 没有接地组
     */
    public static TreePlan planTree(RigidResults results, SynthesisDiagnostics diagnostics) {
        JointMaps maps = generateJointMaps(results, diagnostics);

        RigidGroup root = findFirstGrounded(results);
        if (root == null) {
            throw new NoGroundedGroupException("装配中没有接地的刚体组，无法确定运动树的根");
        }

        Map<RigidGroup, RigidGroup> mergeInto = new LinkedHashMap<>();
        Map<RigidGroup, RigidNode> nodes = new LinkedHashMap<>();
        List<PlannedJoint> plannedJoints = new ArrayList<>();
        Set<RigidGroup> closed = new LinkedHashSet<>();

        RigidNode rootNode = new RigidNode(root);
        nodes.put(root, rootNode);
        closed.add(root);

        List<Branch> open = new ArrayList<>();
        open.add(new Branch(root, root));
        int depth = 0;
        while (!open.isEmpty()) {
            List<Branch> next = new ArrayList<>();
            for (Branch branch : open) {
                for (RigidGroup neighbour : maps.movableNeighbours(branch.current())) {
                    if (!closed.add(neighbour)) {
                        continue;
                    }
                    RigidJoint edge = maps.movableEdge(branch.current(), neighbour);
                    if (edge == null) {
                        throw new IllegalStateException("邻接表与连接列表不一致：找不到 " + branch.current().name() + " 与 " + neighbour.name() + " 之间的可运动连接");
                    }
                    RigidNode node = new RigidNode(neighbour);
                    nodes.put(neighbour, node);
                    plannedJoints.add(new PlannedJoint(edge, nodes.get(branch.target()), node));
                    next.add(new Branch(neighbour, neighbour));
                }
                for (RigidGroup neighbour : maps.rigidNeighbours(branch.current())) {
                    if (!closed.add(neighbour)) {
                        continue;
                    }
                    mergeInto.put(neighbour, branch.target());
                    next.add(new Branch(neighbour, branch.target()));
                }
            }
            open = next;
            depth++;
        }
        log.debug("广度优先展开结束，层数 {}，已访问 {} 个组", depth, closed.size());

        List<RigidGroup> unreachable = new ArrayList<>();
        for (RigidGroup group : results.groups()) {
            if (!closed.contains(group)) {
                unreachable.add(group);
                diagnostics.unreachableGroup(group);
            }
        }
        if (!unreachable.isEmpty()) {
            warn(diagnostics, "有 " + unreachable.size() + " 个刚体组无法从接地组到达，已从运动树中排除：" + names(unreachable));
        }
        return new TreePlan(root, rootNode, mergeInto, plannedJoints, unreachable);
    }

    /**
     * 执行规划：合并组 → 修正连接端点 → 创建骨架关节 → 再清理一次。
     *
     * @return 运动树的根节点
     */
    public static RigidNode applyPlan(RigidResults results, TreePlan plan, SynthesisDiagnostics diagnostics) {
        log.debug("执行 {} 条合并", plan.mergeInto().size());
        for (Map.Entry<RigidGroup, RigidGroup> entry : plan.mergeInto().entrySet()) {
            entry.getValue().absorb(entry.getKey());
        }
        diagnostics.merged(plan.mergeInto().size());

        for (RigidJoint joint : results.joints()) {
            joint.redirect(plan.mergeInto());
        }

        for (PlannedJoint planned : plan.plannedJoints()) {
            SkeletalJoint skeletalJoint = SkeletalJoint.create(planned.joint(), planned.parentNode().group());
            planned.parentNode().addChild(skeletalJoint, planned.node());
        }
        diagnostics.skeletalJoints(plan.plannedJoints().size());

        cleanMeaningless(results);
        log.info("运动树合成完成：合并 {} 个组，创建 {} 个骨架关节，剩余 {} 个组",
                plan.mergeInto().size(), plan.plannedJoints().size(), results.groups().size());
        return plan.rootNode();
    }

    /**
     * 规划并执行运动树合成。
     */
    public static RigidNode buildAndCleanTree(RigidResults results, SynthesisDiagnostics diagnostics) {
        return applyPlan(results, planTree(results, diagnostics), diagnostics);
    }

    public static RigidNode buildAndCleanTree(RigidResults results) {
        return buildAndCleanTree(results, new SynthesisDiagnostics());
    }

    private static RigidGroup findFirstGrounded(RigidResults results) {
        for (RigidGroup group : results.groups()) {
            if (group.isGrounded()) {
                return group;
            }
        }
        return null;
    }

    private static void link(Map<RigidGroup, Set<RigidGroup>> map, RigidJoint joint) {
        map.get(joint.groupOne()).add(joint.groupTwo());
        map.get(joint.groupTwo()).add(joint.groupOne());
    }

    private static void warn(SynthesisDiagnostics diagnostics, String message) {
        log.warn(message);
        diagnostics.warn(message);
    }

    private static List<String> names(List<RigidGroup> groups) {
        List<String> names = new ArrayList<>(groups.size());
        for (RigidGroup group : groups) {
            names.add(group.name());
        }
        return names;
    }
}
