package org.jointresolver.rigid;

import java.util.List;

/**
 * 存在无法从接地组到达的刚体组（仅在要求完整覆盖时抛出）。
 */
public class DisconnectedAssemblyException extends IllegalStateException {

    private final List<String> unreachableGroups;

    public DisconnectedAssemblyException(List<String> unreachableGroups) {
        super("存在 " + unreachableGroups.size() + " 个无法从接地组到达的刚体组：" + unreachableGroups);
        this.unreachableGroups = List.copyOf(unreachableGroups);
    }

    public List<String> unreachableGroups() {
        return unreachableGroups;
    }
}
