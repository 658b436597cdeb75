package com.safety.analysis.service.gsn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * GSN 图：根节点 + 登记在图中的节点ID（根节点总在第一位，允许未连接的孤立节点）
 */
public class GsnDiagram {
    private final String diagId;
    private final String rootId;
    private final List<String> nodeIds = new ArrayList<>();

    public GsnDiagram(String diagId, String rootId) {
        if (rootId == null) {
            throw new IllegalArgumentException("diagram root must not be null");
        }
        this.diagId = diagId;
        this.rootId = rootId;
        this.nodeIds.add(rootId);
    }

    /**
     * 登记节点（不建立连接），已登记时忽略
     */
    public void addNode(String nodeId) {
        if (nodeId != null && !nodeIds.contains(nodeId)) {
            nodeIds.add(nodeId);
        }
    }

    /**
     * 移除登记，根节点不可移除
     */
    public boolean removeNode(String nodeId) {
        if (rootId.equals(nodeId)) {
            return false;
        }
        return nodeIds.remove(nodeId);
    }

    public boolean containsNode(String nodeId) {
        return nodeIds.contains(nodeId);
    }

    public String getDiagId() {
        return diagId;
    }

    public String getRootId() {
        return rootId;
    }

    public List<String> getNodeIds() {
        return Collections.unmodifiableList(nodeIds);
    }
}
