package com.safety.analysis.service.impl;

import com.safety.analysis.config.SafetyAnalysisConfig;
import com.safety.analysis.model.*;
import com.safety.analysis.service.argument.ArgumentationGenerator;
import com.safety.analysis.service.argument.ArgumentationResult;
import com.safety.analysis.service.argument.RecommendationTable;
import com.safety.analysis.service.argument.TextFormat;
import com.safety.analysis.service.fta.*;
import com.safety.analysis.service.gsn.GsnModel;
import com.safety.analysis.service.gsn.GsnModelLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 安全分析服务实现类
 *
 * 每次请求根据请求体重新构建模型，服务本身只持有不可变配置（推荐表）。
 */
@Slf4j
@Service
public class SafetyAnalysisServiceImpl {

    @Autowired
    private SafetyAnalysisConfig config;

    @Autowired
    private RecommendationTable recommendationTable;

    private final FaultTreeModelLoader faultTreeLoader = new FaultTreeModelLoader();

    private final GsnModelLoader gsnLoader = new GsnModelLoader();

    /**
     * 计算割集
     */
    public CutSetResponse calculateCutSets(FaultTreeRequest request) {
        FaultTreeModel model = loadFaultTree(request);
        FaultTreeNode root = resolveRoot(model, request.getRootId());

        List<Set<String>> cutSets = newCutSetCalculator().calculateCutSets(model, root);

        CutSetResponse response = new CutSetResponse();
        response.setRootId(root.getUniqueId());
        for (Set<String> cutSet : cutSets) {
            List<String> ids = new ArrayList<>(cutSet);
            List<String> names = new ArrayList<>();
            for (String id : ids) {
                names.add(model.getDisplayName(model.getNode(id)));
            }
            response.getCutSets().add(ids);
            response.getCutSetNames().add(names);
        }
        return response;
    }

    /**
     * 共因分析
     */
    public CommonCauseResponse analyzeCommonCauses(FaultTreeRequest request) {
        FaultTreeModel model = loadFaultTree(request);
        FaultTreeNode root = resolveRoot(model, request.getRootId());

        CommonCauseAnalyzer analyzer = new CommonCauseAnalyzer();
        CommonCauseResponse response = new CommonCauseResponse();
        response.setRootId(root.getUniqueId());
        response.setCauses(analyzer.analyze(model, root));
        response.setReport(analyzer.buildReport(model, root));
        return response;
    }

    /**
     * 生成论证文本
     */
    public ArgumentationResponse generateArgumentation(FaultTreeRequest request, TextFormat format) {
        FaultTreeModel model = loadFaultTree(request);
        FaultTreeNode root = resolveRoot(model, request.getRootId());

        ArgumentationGenerator generator = new ArgumentationGenerator(recommendationTable, newCutSetCalculator(),
                config.getDefaultSeverity(), config.getDefaultControllability());
        ArgumentationResult result = generator.generate(model, root, format);

        ArgumentationResponse response = new ArgumentationResponse();
        response.setNodeId(result.getNodeId());
        response.setLevel(result.getLevel());
        response.setLevelText(result.getLevelText());
        response.setFormat((format != null ? format : TextFormat.PLAIN).name());
        response.setText(result.getText());
        response.setHierarchy(generator.buildHierarchicalArgumentation(model, root));
        return response;
    }

    /**
     * 按兼容规则加载 GSN 模型后重新序列化
     */
    public GsnModelData normalizeGsnModel(GsnModelData data) {
        GsnModel model = gsnLoader.load(data);
        return gsnLoader.save(model);
    }

    /**
     * 查询节点所在模块名
     */
    public ModuleNameResponse findModuleName(ModuleNameRequest request) {
        if (request == null || request.getNodeId() == null) {
            throw new IllegalArgumentException("node_id must not be null");
        }
        GsnModel model = gsnLoader.load(request.getModel());
        String moduleName = model.getGraph().findModuleName(request.getNodeId()).orElse(null);
        log.info("【模块名解析】-> 节点={}, 模块={}", request.getNodeId(), moduleName);
        return new ModuleNameResponse(request.getNodeId(), moduleName);
    }

    private CutSetCalculator newCutSetCalculator() {
        return new CutSetCalculator(config.getCutSetWarnThreshold());
    }

    private FaultTreeModel loadFaultTree(FaultTreeRequest request) {
        if (request == null || request.getTopEvents() == null || request.getTopEvents().isEmpty()) {
            throw new IllegalArgumentException("top_events must not be empty");
        }
        return faultTreeLoader.load(request.getTopEvents());
    }

    /**
     * 分析起点：指定ID时取该节点，否则取第一个顶层节点
     */
    private FaultTreeNode resolveRoot(FaultTreeModel model, String rootId) {
        if (rootId != null && !rootId.isEmpty()) {
            return model.requireNode(rootId);
        }
        List<FaultTreeNode> topLevel = model.getTopLevelNodes();
        if (topLevel.isEmpty()) {
            throw new IllegalArgumentException("fault tree has no top-level node");
        }
        return topLevel.get(0);
    }
}
