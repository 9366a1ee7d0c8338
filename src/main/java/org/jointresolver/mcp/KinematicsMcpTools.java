package org.jointresolver.mcp;

import org.jointresolver.kinematics.AssemblyDocumentReader;
import org.jointresolver.kinematics.KinematicTreeSynthesizer;
import org.jointresolver.kinematics.KinematicViewMapper;
import org.jointresolver.kinematics.KinematicsProperties;
import org.jointresolver.kinematics.dto.CleanedAssemblyResult;
import org.jointresolver.kinematics.dto.KinematicTreeResult;
import org.jointresolver.rigid.RigidResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * 运动树合成 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>由装配图合成单根运动树（{@code kinematics_build_tree}）。</li>
 *   <li>只做清理与接地合并，查看每条连接的分类（{@code kinematics_clean_assembly}）。</li>
 * </ul>
 * <p>
 * 每次调用都从 JSON 文档重新构建装配图，调用之间不共享任何可变状态。
 */
@Component
public class KinematicsMcpTools {

    private static final Logger log = LoggerFactory.getLogger(KinematicsMcpTools.class);

    private final KinematicsProperties properties;
    private final AssemblyDocumentReader documentReader;
    private final KinematicTreeSynthesizer synthesizer;

    public KinematicsMcpTools(KinematicsProperties properties, AssemblyDocumentReader documentReader, KinematicTreeSynthesizer synthesizer) {
        this.properties = properties;
        this.documentReader = documentReader;
        this.synthesizer = synthesizer;
    }

    /**
     * 合成运动树。
     * <p>
     * 没有接地组时直接报错；不可达的组默认不进入运动树，并在 warnings/unreachableGroups 中列出
     * （{@code app.kinematics.fail-on-disconnected=true} 时改为报错）。
     */
    @Tool(
            name = "kinematics_build_tree",
            description = "把装配刚体图（JSON：occurrences/groups/joints）合成为以接地组为根的运动树：合并约束相连的组，可运动关节成为树边。"
    )
    public KinematicTreeResult buildTree(
            @ToolParam(description = "装配文档 JSON：{occurrences:[{name,suppressed}], groups:[{name,grounded,occurrences:[name]}], joints:[{groupOne,groupTwo,joints:[{name,type,suppressed,occurrenceOne,occurrenceTwo}],constraints:[...]}]}") String assemblyJson,
            @ToolParam(required = false, description = "是否返回每个节点的实例名称（默认 app.kinematics.include-occurrences）") Boolean includeOccurrences
    ) {
        RigidResults results = documentReader.read(assemblyJson);
        log.info("合成运动树：{} 个组，{} 条连接", results.groups().size(), results.joints().size());
        KinematicTreeSynthesizer.Synthesis synthesis = synthesizer.synthesize(results);
        return KinematicViewMapper.toTreeResult(synthesis, resolveIncludeOccurrences(includeOccurrences));
    }

    /**
     * 只做清理与接地合并。
     */
    @Tool(
            name = "kinematics_clean_assembly",
            description = "清理装配刚体图（去掉被抑制的实例/关节/约束、自环、空连接、空组）并合并所有接地组，返回剩余的组与每条连接的分类。"
    )
    public CleanedAssemblyResult cleanAssembly(
            @ToolParam(description = "装配文档 JSON（格式同 kinematics_build_tree）") String assemblyJson,
            @ToolParam(required = false, description = "是否返回每个组的实例名称（默认 app.kinematics.include-occurrences）") Boolean includeOccurrences
    ) {
        RigidResults results = documentReader.read(assemblyJson);
        KinematicTreeSynthesizer.Cleaning cleaning = synthesizer.clean(results);
        return KinematicViewMapper.toCleanedResult(cleaning, resolveIncludeOccurrences(includeOccurrences));
    }

    private boolean resolveIncludeOccurrences(Boolean includeOccurrences) {
        return (includeOccurrences != null) ? includeOccurrences : properties.isIncludeOccurrences();
    }
}
