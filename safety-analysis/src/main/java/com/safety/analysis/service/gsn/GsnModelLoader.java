package com.safety.analysis.service.gsn;

import com.safety.analysis.model.GsnDiagramData;
import com.safety.analysis.model.GsnModelData;
import com.safety.analysis.model.GsnModuleData;
import com.safety.analysis.model.GsnNodeData;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * GSN 模型加载 / 保存（兼容旧版本文件）
 *
 * 加载时与 {@link GsnArgumentGraph#addChild} 的严格校验不同，历史数据中的问题连接一律丢弃而不抛异常：
 * 1. 同一ID出现在多个图中时只创建一个节点
 * 2. children 与 context 两个列表合并：同时出现的ID只建一条 context 连接，只在 context 中的ID也建 context 连接
 * 3. 指向不存在节点的连接、自环、违反连接规则的连接被丢弃，两个方向都不留下引用
 * 4. original_id 在所有节点创建后再解析，无效时回退为主实例
 */
@Slf4j
public class GsnModelLoader {

    /**
     * 加载统计
     */
    private static class LoadStats {
        int nodesCreated;
        int duplicateNodes;
        int nodesSkipped;
        int unknownTypes;
        int linksAdded;
        int unknownTargets;
        int selfLinks;
        int invalidLinks;
        int originalFallbacks;
        int diagramsSkipped;
    }

    public GsnModel load(GsnModelData data) {
        GsnModel model = new GsnModel();
        if (data == null) {
            log.warn("【GSN加载】-> 输入为空");
            return model;
        }

        LoadStats stats = new LoadStats();
        List<GsnNodeData> allNodes = new ArrayList<>();
        for (GsnDiagramData diagram : data.getDiagrams()) {
            allNodes.addAll(diagram.getNodes());
        }
        for (GsnModuleData module : data.getModules()) {
            collectNodes(module, allNodes);
        }

        // 1. 创建节点
        GsnArgumentGraph graph = model.getGraph();
        for (GsnNodeData nodeData : allNodes) {
            createNode(graph, nodeData, stats);
        }

        // 2. 建立连接
        for (GsnNodeData nodeData : allNodes) {
            if (nodeData != null && graph.hasNode(nodeData.getUniqueId())) {
                linkChildren(graph, nodeData, stats);
            }
        }

        // 3. 解析克隆引用
        resolveOriginals(graph, stats);

        // 4. 图和模块结构
        for (GsnDiagramData diagramData : data.getDiagrams()) {
            GsnDiagram diagram = buildDiagram(graph, diagramData, stats);
            if (diagram != null) {
                model.getDiagrams().add(diagram);
            }
        }
        for (GsnModuleData moduleData : data.getModules()) {
            model.getModules().add(buildModule(graph, moduleData, stats));
        }

        log.info("【GSN加载】-> ========================================");
        log.info("【GSN加载】-> 加载完成统计：");
        log.info("【GSN加载】->   - 创建节点: {} 个（重复ID合并: {}，无效节点跳过: {}，未知类型按Goal处理: {}）",
                stats.nodesCreated, stats.duplicateNodes, stats.nodesSkipped, stats.unknownTypes);
        log.info("【GSN加载】->   - 建立连接: {} 条", stats.linksAdded);
        log.info("【GSN加载】->   - 丢弃连接: 目标不存在 {} 条，自环 {} 条，违反连接规则 {} 条",
                stats.unknownTargets, stats.selfLinks, stats.invalidLinks);
        log.info("【GSN加载】->   - 克隆回退为主实例: {} 个，跳过无效图: {} 个",
                stats.originalFallbacks, stats.diagramsSkipped);
        log.info("【GSN加载】-> ========================================");
        return model;
    }

    private void collectNodes(GsnModuleData module, List<GsnNodeData> result) {
        for (GsnDiagramData diagram : module.getDiagrams()) {
            result.addAll(diagram.getNodes());
        }
        for (GsnModuleData sub : module.getModules()) {
            collectNodes(sub, result);
        }
    }

    private void createNode(GsnArgumentGraph graph, GsnNodeData data, LoadStats stats) {
        if (data == null || data.getUniqueId() == null || data.getUniqueId().isEmpty()) {
            log.warn("【GSN加载】-> 节点缺少 unique_id，跳过");
            stats.nodesSkipped++;
            return;
        }
        if (graph.hasNode(data.getUniqueId())) {
            stats.duplicateNodes++;
            return;
        }

        GsnNodeType type = GsnNodeType.fromLabel(data.getNodeType());
        if (type == null) {
            log.warn("【GSN加载】-> 未知节点类型，按 Goal 处理: id={}, type={}", data.getUniqueId(), data.getNodeType());
            type = GsnNodeType.GOAL;
            stats.unknownTypes++;
        }

        GsnNode node = new GsnNode(data.getUniqueId(), data.getUserName(), type);
        node.setDescription(data.getDescription());
        node.setSpiTarget(data.getSpiTarget());
        node.setWorkProduct(data.getWorkProduct());
        node.setEvidenceLink(data.getEvidenceLink());
        node.setPrimaryInstance(data.getPrimaryInstance() == null || data.getPrimaryInstance());
        node.setOriginalId(data.getOriginalId());
        if (data.getX() != null) {
            node.setX(data.getX());
        }
        if (data.getY() != null) {
            node.setY(data.getY());
        }
        graph.addNode(node);
        stats.nodesCreated++;
    }

    private void linkChildren(GsnArgumentGraph graph, GsnNodeData data, LoadStats stats) {
        String parentId = data.getUniqueId();
        Set<String> contextIds = new HashSet<>(data.getContext());

        // children 在前，只出现在 context 中的追加在后
        Map<String, GsnRelation> merged = new LinkedHashMap<>();
        for (String childId : data.getChildren()) {
            merged.putIfAbsent(childId, contextIds.contains(childId) ? GsnRelation.CONTEXT : GsnRelation.SOLVED);
        }
        for (String childId : data.getContext()) {
            merged.putIfAbsent(childId, GsnRelation.CONTEXT);
        }

        for (Map.Entry<String, GsnRelation> entry : merged.entrySet()) {
            String childId = entry.getKey();
            GsnRelation relation = entry.getValue();

            if (!graph.hasNode(childId)) {
                log.debug("【GSN加载-目标不存在】丢弃连接: {} -> {}", parentId, childId);
                stats.unknownTargets++;
                continue;
            }
            if (parentId.equals(childId)) {
                log.debug("【GSN加载-自环】丢弃连接: {}", parentId);
                stats.selfLinks++;
                continue;
            }
            if (!graph.isAllowed(parentId, childId, relation)) {
                log.debug("【GSN加载-连接不合法】丢弃连接: {} -[{}]-> {}", parentId, relation.getValue(), childId);
                stats.invalidLinks++;
                continue;
            }
            if (graph.getRelation(parentId, childId) == null) {
                stats.linksAdded++;
            }
            graph.addChild(parentId, childId, relation);
        }
    }

    private void resolveOriginals(GsnArgumentGraph graph, LoadStats stats) {
        for (GsnNode node : graph.getNodes()) {
            if (node.isPrimaryInstance()) {
                continue;
            }
            String originalId = node.getOriginalId();
            if (originalId == null || originalId.equals(node.getUniqueId()) || !graph.hasNode(originalId)) {
                log.debug("【GSN加载】-> 克隆引用无效，回退为主实例: {} -> {}", node.getUniqueId(), originalId);
                node.setPrimaryInstance(true);
                node.setOriginalId(null);
                stats.originalFallbacks++;
            }
        }
    }

    private GsnDiagram buildDiagram(GsnArgumentGraph graph, GsnDiagramData data, LoadStats stats) {
        String rootId = data.getRoot();
        if (!graph.hasNode(rootId)) {
            rootId = null;
            for (GsnNodeData nodeData : data.getNodes()) {
                if (nodeData != null && graph.hasNode(nodeData.getUniqueId())) {
                    rootId = nodeData.getUniqueId();
                    break;
                }
            }
            if (rootId == null) {
                log.warn("【GSN加载】-> 图没有可用的根节点，跳过: {}", data.getDiagId());
                stats.diagramsSkipped++;
                return null;
            }
            log.warn("【GSN加载】-> 图的根节点无效，改用第一个节点: diag={}, root={}", data.getDiagId(), rootId);
        }

        String diagId = data.getDiagId() != null ? data.getDiagId() : UUID.randomUUID().toString();
        GsnDiagram diagram = new GsnDiagram(diagId, rootId);
        for (GsnNodeData nodeData : data.getNodes()) {
            if (nodeData != null && graph.hasNode(nodeData.getUniqueId())) {
                diagram.addNode(nodeData.getUniqueId());
            }
        }
        return diagram;
    }

    private GsnModule buildModule(GsnArgumentGraph graph, GsnModuleData data, LoadStats stats) {
        GsnModule module = new GsnModule(data.getName());
        for (GsnDiagramData diagramData : data.getDiagrams()) {
            GsnDiagram diagram = buildDiagram(graph, diagramData, stats);
            if (diagram != null) {
                module.getDiagrams().add(diagram);
            }
        }
        for (GsnModuleData sub : data.getModules()) {
            module.getModules().add(buildModule(graph, sub, stats));
        }
        return module;
    }

    // ========== 保存 ==========

    /**
     * 保存为持久化结构：children 写全部子节点，context 写其中的 context 子集
     */
    public GsnModelData save(GsnModel model) {
        GsnModelData data = new GsnModelData();
        List<GsnDiagramData> diagrams = new ArrayList<>();
        for (GsnDiagram diagram : model.getDiagrams()) {
            diagrams.add(saveDiagram(model.getGraph(), diagram));
        }
        data.setDiagrams(diagrams);

        List<GsnModuleData> modules = new ArrayList<>();
        for (GsnModule module : model.getModules()) {
            modules.add(saveModule(model.getGraph(), module));
        }
        data.setModules(modules);
        return data;
    }

    private GsnModuleData saveModule(GsnArgumentGraph graph, GsnModule module) {
        GsnModuleData data = new GsnModuleData();
        data.setName(module.getName());
        List<GsnDiagramData> diagrams = new ArrayList<>();
        for (GsnDiagram diagram : module.getDiagrams()) {
            diagrams.add(saveDiagram(graph, diagram));
        }
        data.setDiagrams(diagrams);
        List<GsnModuleData> subs = new ArrayList<>();
        for (GsnModule sub : module.getModules()) {
            subs.add(saveModule(graph, sub));
        }
        data.setModules(subs);
        return data;
    }

    private GsnDiagramData saveDiagram(GsnArgumentGraph graph, GsnDiagram diagram) {
        GsnDiagramData data = new GsnDiagramData();
        data.setDiagId(diagram.getDiagId());
        data.setRoot(diagram.getRootId());
        List<GsnNodeData> nodes = new ArrayList<>();
        for (String nodeId : diagram.getNodeIds()) {
            GsnNode node = graph.getNode(nodeId);
            if (node != null) {
                nodes.add(saveNode(graph, node));
            }
        }
        data.setNodes(nodes);
        return data;
    }

    private GsnNodeData saveNode(GsnArgumentGraph graph, GsnNode node) {
        GsnNodeData data = new GsnNodeData();
        data.setUniqueId(node.getUniqueId());
        data.setUserName(node.getUserName());
        data.setNodeType(node.getNodeType().getLabel());
        data.setDescription(node.getDescription());
        data.setSpiTarget(node.getSpiTarget());
        data.setWorkProduct(node.getWorkProduct());
        data.setEvidenceLink(node.getEvidenceLink());
        data.setPrimaryInstance(node.isPrimaryInstance());
        data.setOriginalId(node.isPrimaryInstance() ? node.getUniqueId() : node.getOriginalId());
        data.setX(node.getX());
        data.setY(node.getY());
        data.setChildren(new ArrayList<>(graph.getChildren(node.getUniqueId())));
        data.setContext(new ArrayList<>(graph.getContextChildren(node.getUniqueId())));
        return data;
    }
}
