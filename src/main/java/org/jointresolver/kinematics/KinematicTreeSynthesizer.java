package org.jointresolver.kinematics;

import org.jointresolver.rigid.DisconnectedAssemblyException;
import org.jointresolver.rigid.RigidBodyCleaner;
import org.jointresolver.rigid.RigidGroup;
import org.jointresolver.rigid.RigidResults;
import org.jointresolver.rigid.SynthesisDiagnostics;
import org.jointresolver.skeleton.RigidNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 运动树合成流水线门面：清理 → 接地合并（→ 清理）→ 规划 → 执行合并与骨架关节创建 → 清理。
 * <p>
 * 调用期间独占传入的 {@link RigidResults}；同一个实例不能被并发合成。
 */
public class KinematicTreeSynthesizer {

    /**
     * @param failOnDisconnected 存在不可达的组时是否抛出 {@link DisconnectedAssemblyException}
     */
    public record Options(boolean failOnDisconnected) {
        public static Options defaults() {
            return new Options(false);
        }
    }

    /**
     * @param root        运动树根节点
     * @param results     合成后的装配图（已合并、已清理）
     * @param diagnostics 非致命诊断信息
     */
    public record Synthesis(RigidNode root, RigidResults results, SynthesisDiagnostics diagnostics) {
    }

    /**
     * @param root        合并后的根组
     * @param results     清理后的装配图
     * @param diagnostics 非致命诊断信息
     */
    public record Cleaning(RigidGroup root, RigidResults results, SynthesisDiagnostics diagnostics) {
    }

    private final Options options;

    public KinematicTreeSynthesizer(Options options) {
        this.options = (options == null) ? Options.defaults() : options;
    }

    public KinematicTreeSynthesizer() {
        this(Options.defaults());
    }

    /**
     * 执行完整流水线。
     *
     * @throws org.jointresolver.rigid.NoGroundedGroupException 没有接地组
     * @throws DisconnectedAssemblyException                    开启 failOnDisconnected 且存在不可达的组（此时合并尚未执行）
     */
    public Synthesis synthesize(RigidResults results) {
        SynthesisDiagnostics diagnostics = new SynthesisDiagnostics();
        RigidBodyCleaner.cleanMeaningless(results);
        RigidBodyCleaner.cleanGroundedBodies(results);

        RigidBodyCleaner.TreePlan plan = RigidBodyCleaner.planTree(results, diagnostics);
        if (options.failOnDisconnected() && !plan.unreachableGroups().isEmpty()) {
            List<String> names = new ArrayList<>(plan.unreachableGroups().size());
            for (RigidGroup group : plan.unreachableGroups()) {
                names.add(group.name());
            }
            throw new DisconnectedAssemblyException(names);
        }
        RigidNode root = RigidBodyCleaner.applyPlan(results, plan, diagnostics);
        return new Synthesis(root, results, diagnostics);
    }

    /**
     * 只执行清理与接地合并，不合成运动树。连接分类中的异常情况同样记入诊断信息。
     */
    public Cleaning clean(RigidResults results) {
        SynthesisDiagnostics diagnostics = new SynthesisDiagnostics();
        RigidBodyCleaner.cleanMeaningless(results);
        RigidGroup root = RigidBodyCleaner.cleanGroundedBodies(results);
        RigidBodyCleaner.generateJointMaps(results, diagnostics);
        return new Cleaning(root, results, diagnostics);
    }
}
