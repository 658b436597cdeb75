package com.safety.analysis.service.fta;

import com.safety.analysis.model.FaultTreeNodeData;
import com.safety.analysis.util.NumberParser;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 故障树加载 / 导出
 *
 * 加载规则：
 * 1. 嵌套结构按深度优先展开为 {@link FaultTreeModel}
 * 2. 相同 unique_id 再次出现时复用第一次创建的节点（共享子树），只追加一条父子边
 * 3. 缺失 gate_type 时按 AND 处理
 * 4. original_id 在整棵树加载完后再解析，指向不存在的节点时回退为主实例
 */
@Slf4j
public class FaultTreeModelLoader {

    /**
     * 加载多棵顶层树到同一个模型
     */
    public FaultTreeModel load(List<FaultTreeNodeData> topEvents) {
        FaultTreeModel model = new FaultTreeModel();
        if (topEvents == null || topEvents.isEmpty()) {
            log.warn("【故障树加载】-> 输入为空");
            return model;
        }

        int[] skipped = {0};
        for (FaultTreeNodeData data : topEvents) {
            loadNode(model, data, null, skipped);
        }

        int fallbackCount = resolveOriginals(model);

        log.info("【故障树加载】-> 顶层树数: {}, 节点数: {}, 边数: {}, 跳过无效节点: {}, 克隆回退为主实例: {}",
                topEvents.size(), model.getNodeCount(), model.getEdgeCount(), skipped[0], fallbackCount);
        return model;
    }

    private void loadNode(FaultTreeModel model, FaultTreeNodeData data, String parentId, int[] skipped) {
        if (data == null || data.getUniqueId() == null || data.getUniqueId().isEmpty()) {
            log.warn("【故障树加载】-> 节点缺少 unique_id，跳过（父节点: {}）", parentId);
            skipped[0]++;
            return;
        }

        String id = data.getUniqueId();
        if (model.hasNode(id)) {
            // 共享子树：只补边，不再展开
            if (parentId != null) {
                model.addEdge(parentId, id);
            }
            log.debug("【故障树加载】-> 复用已加载节点: {}", id);
            return;
        }

        model.addNode(toNode(data));
        if (parentId != null) {
            model.addEdge(parentId, id);
        }

        for (FaultTreeNodeData child : data.getChildren()) {
            loadNode(model, child, id, skipped);
        }
    }

    private FaultTreeNode toNode(FaultTreeNodeData data) {
        FaultTreeNode node = new FaultTreeNode(data.getUniqueId(), data.getUserName(), data.getType());
        node.setGateType(GateType.parse(data.getGateType()));
        node.setQuantValue(NumberParser.parseDouble(data.getQuantValue()));
        node.setDescription(data.getDescription());
        node.setRationale(data.getRationale());
        node.setSeverity(data.getSeverity() != null ? String.valueOf(data.getSeverity()) : null);
        node.setControllability(data.getControllability() != null ? String.valueOf(data.getControllability()) : null);
        node.setSafetyRequirements(data.getSafetyRequirements() != null
                ? new ArrayList<>(data.getSafetyRequirements()) : null);
        node.setPage(Boolean.TRUE.equals(data.getPage()));
        node.setPrimaryInstance(data.getPrimaryInstance() == null || data.getPrimaryInstance());
        node.setOriginalId(data.getOriginalId());
        return node;
    }

    /**
     * 解析克隆引用，返回回退为主实例的节点数
     */
    private int resolveOriginals(FaultTreeModel model) {
        int fallback = 0;
        for (FaultTreeNode node : model.getNodes()) {
            if (node.isPrimaryInstance()) {
                continue;
            }
            String originalId = node.getOriginalId();
            if (originalId == null || originalId.equals(node.getUniqueId()) || !model.hasNode(originalId)) {
                log.debug("【故障树加载】-> 克隆引用无效，回退为主实例: {} -> {}", node.getUniqueId(), originalId);
                node.setPrimaryInstance(true);
                node.setOriginalId(null);
                fallback++;
            }
        }
        return fallback;
    }

    /**
     * 导出为嵌套结构
     *
     * 共享子树在每个父节点下完整输出一次；当前路径上再次出现的节点只输出自身属性，不再展开子节点。
     */
    public List<FaultTreeNodeData> export(FaultTreeModel model) {
        List<FaultTreeNodeData> result = new ArrayList<>();
        for (FaultTreeNode top : model.getTopLevelNodes()) {
            result.add(exportNode(model, top, new HashSet<>()));
        }
        return result;
    }

    private FaultTreeNodeData exportNode(FaultTreeModel model, FaultTreeNode node, Set<String> onPath) {
        FaultTreeNodeData data = new FaultTreeNodeData();
        data.setUniqueId(node.getUniqueId());
        data.setUserName(node.getUserName());
        data.setType(node.getTypeLabel());
        data.setGateType(node.getGateType() != null ? node.getGateType().name() : null);
        data.setQuantValue(node.getQuantValue());
        data.setDescription(node.getDescription());
        data.setRationale(node.getRationale());
        data.setSeverity(node.getSeverity());
        data.setControllability(node.getControllability());
        data.setPage(node.isPage());
        data.setPrimaryInstance(node.isPrimaryInstance());
        data.setOriginalId(node.getOriginalId());
        data.setSafetyRequirements(new ArrayList<>(node.getSafetyRequirements()));

        if (!onPath.add(node.getUniqueId())) {
            return data;
        }
        List<FaultTreeNodeData> children = new ArrayList<>();
        for (FaultTreeNode child : model.getChildNodes(node.getUniqueId())) {
            children.add(exportNode(model, child, onPath));
        }
        data.setChildren(children);
        onPath.remove(node.getUniqueId());
        return data;
    }
}
