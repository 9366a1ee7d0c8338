package org.jointresolver.kinematics;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * 运动树合成服务的业务配置（{@code app.kinematics.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #failOnDisconnected}：存在无法从接地组到达的组时是报错还是丢弃（默认丢弃并给出告警）。</li>
 *   <li>通过 size/count 上限控制单次调用的输入规模，避免超大装配文档占满内存。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.kinematics")
public class KinematicsProperties {

    /**
     * 存在不可达的刚体组时是否直接失败。
     * <p>
     * false（默认）：不可达的组不进入运动树，只在结果的 warnings/unreachableGroups 中列出。
     */
    private boolean failOnDisconnected = false;

    /**
     * 装配 JSON 文档的最大长度（按字符计）。
     */
    @NotNull
    private DataSize maxDocumentSize = DataSize.ofMegabytes(16);

    /**
     * 单个装配文档允许的最大刚体组数量。
     */
    @Min(1)
    @Max(10_000_000)
    private int maxGroups = 100_000;

    /**
     * 单个装配文档允许的最大连接数量。
     */
    @Min(1)
    @Max(10_000_000)
    private int maxJoints = 500_000;

    /**
     * 返回结果中是否列出每个组的实例名称（大装配可关闭以减小响应体积）。
     */
    private boolean includeOccurrences = true;

    public boolean isFailOnDisconnected() {
        return failOnDisconnected;
    }

    public void setFailOnDisconnected(boolean failOnDisconnected) {
        this.failOnDisconnected = failOnDisconnected;
    }

    public DataSize getMaxDocumentSize() {
        return maxDocumentSize;
    }

    public void setMaxDocumentSize(DataSize maxDocumentSize) {
        this.maxDocumentSize = maxDocumentSize;
    }

    public int getMaxGroups() {
        return maxGroups;
    }

    public void setMaxGroups(int maxGroups) {
        this.maxGroups = maxGroups;
    }

    public int getMaxJoints() {
        return maxJoints;
    }

    public void setMaxJoints(int maxJoints) {
        this.maxJoints = maxJoints;
    }

    public boolean isIncludeOccurrences() {
        return includeOccurrences;
    }

    public void setIncludeOccurrences(boolean includeOccurrences) {
        this.includeOccurrences = includeOccurrences;
    }
}
