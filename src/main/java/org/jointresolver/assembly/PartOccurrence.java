package org.jointresolver.assembly;

/**
 * 零件实例（occurrence）的只读句柄。
 * <p>
 * 实例本身归外部 CAD 模型所有；刚体组只持有引用，不负责其生命周期。
 */
public interface PartOccurrence {

    /**
     * 实例名称（例如 {@code base:1}），仅用于展示/诊断。
     */
    String name();

    /**
     * 实例在 CAD 模型中是否被抑制（suppressed）。
     */
    boolean suppressed();
}
