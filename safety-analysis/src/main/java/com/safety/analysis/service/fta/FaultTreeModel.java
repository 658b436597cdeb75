package com.safety.analysis.service.fta;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 故障树模型（以唯一ID为键的节点仓库）
 *
 * 核心数据结构：
 * 1. nodes：uniqueId -> FaultTreeNode
 * 2. childIds：有序子节点ID列表（拥有关系）
 * 3. parentIds：父节点ID集合（仅回指，允许一个节点挂在多个父节点下）
 *
 * 核心功能：
 * 1. 节点和边的管理
 * 2. 克隆链解析（防环）
 * 3. 扁平化遍历（页面边界过滤）
 * 4. 顶层节点识别、基本事件收集
 */
@Slf4j
public class FaultTreeModel {

    // ========== 核心数据结构 ==========

    /** 节点存储：uniqueId -> FaultTreeNode（保持插入顺序） */
    private final Map<String, FaultTreeNode> nodes;

    /** 出边：nodeId -> [child1, child2, ...] */
    private final Map<String, List<String>> childIds;

    /** 入边：nodeId -> {parent1, parent2, ...} */
    private final Map<String, Set<String>> parentIds;

    public FaultTreeModel() {
        this.nodes = new LinkedHashMap<>();
        this.childIds = new HashMap<>();
        this.parentIds = new HashMap<>();
    }

    // ========== 基础操作 ==========

    /**
     * 添加节点
     *
     * @throws IllegalArgumentException ID为空，或ID已被另一个节点占用
     */
    public void addNode(FaultTreeNode node) {
        if (node == null || node.getUniqueId() == null || node.getUniqueId().isEmpty()) {
            throw new IllegalArgumentException("node and node.uniqueId must not be null");
        }

        FaultTreeNode existing = nodes.get(node.getUniqueId());
        if (existing != null && existing != node) {
            throw new IllegalArgumentException("duplicate unique id: " + node.getUniqueId());
        }
        nodes.put(node.getUniqueId(), node);
    }

    /**
     * 检查边是否存在
     */
    public boolean hasEdge(String parentId, String childId) {
        if (parentId == null || childId == null) {
            return false;
        }
        List<String> children = childIds.get(parentId);
        return children != null && children.contains(childId);
    }

    /**
     * 添加边（父 -> 子），子节点追加到父节点子列表末尾
     *
     * @throws IllegalArgumentException 任一端节点不存在
     */
    public void addEdge(String parentId, String childId) {
        if (!nodes.containsKey(parentId) || !nodes.containsKey(childId)) {
            throw new IllegalArgumentException("unknown node in edge: " + parentId + " -> " + childId);
        }

        // 防止自环
        if (parentId.equals(childId)) {
            log.info("【故障树】-> 检测到自环，跳过: {}", parentId);
            return;
        }

        if (hasEdge(parentId, childId)) {
            log.debug("【故障树】-> 边已存在，跳过: {} -> {}", parentId, childId);
            return;
        }

        if (hasEdge(childId, parentId)) {
            log.warn("【故障树】-> 检测到反向边，将形成环: {} <-> {}", parentId, childId);
        }

        childIds.computeIfAbsent(parentId, k -> new ArrayList<>()).add(childId);
        parentIds.computeIfAbsent(childId, k -> new LinkedHashSet<>()).add(parentId);
    }

    /**
     * 移除边
     */
    public void removeEdge(String parentId, String childId) {
        List<String> children = childIds.get(parentId);
        if (children != null) {
            children.remove(childId);
        }
        Set<String> parents = parentIds.get(childId);
        if (parents != null) {
            parents.remove(parentId);
        }
    }

    /**
     * 移除节点（同时移除相关边，子节点本身保留）
     */
    public void removeNode(String nodeId) {
        if (!nodes.containsKey(nodeId)) {
            return;
        }

        for (String parent : new ArrayList<>(getParents(nodeId))) {
            removeEdge(parent, nodeId);
        }
        for (String child : new ArrayList<>(getChildren(nodeId))) {
            removeEdge(nodeId, child);
        }

        nodes.remove(nodeId);
        childIds.remove(nodeId);
        parentIds.remove(nodeId);
    }

    public FaultTreeNode getNode(String nodeId) {
        return nodeId != null ? nodes.get(nodeId) : null;
    }

    /**
     * 获取节点，不存在时抛出异常
     */
    public FaultTreeNode requireNode(String nodeId) {
        FaultTreeNode node = getNode(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("unknown node id: " + nodeId);
        }
        return node;
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /**
     * 获取节点的有序子节点ID
     */
    public List<String> getChildren(String nodeId) {
        return Collections.unmodifiableList(childIds.getOrDefault(nodeId, Collections.emptyList()));
    }

    /**
     * 获取节点的有序子节点
     */
    public List<FaultTreeNode> getChildNodes(String nodeId) {
        List<FaultTreeNode> result = new ArrayList<>();
        for (String childId : getChildren(nodeId)) {
            FaultTreeNode child = nodes.get(childId);
            if (child != null) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * 获取节点的所有父节点ID
     */
    public Set<String> getParents(String nodeId) {
        return Collections.unmodifiableSet(parentIds.getOrDefault(nodeId, Collections.emptySet()));
    }

    public int getInDegree(String nodeId) {
        Set<String> parents = parentIds.get(nodeId);
        return parents != null ? parents.size() : 0;
    }

    public int getOutDegree(String nodeId) {
        List<String> children = childIds.get(nodeId);
        return children != null ? children.size() : 0;
    }

    // ========== 克隆 ==========

    /**
     * 沿克隆链找到主实例
     *
     * 终止条件：
     * 1. 当前节点为主实例
     * 2. originalId 为空或指向自身
     * 3. originalId 指向不存在的节点
     * 4. 再次遇到已访问过的节点（环）
     *
     * 对主实例调用时直接返回自身；结果幂等。
     */
    public FaultTreeNode resolveOriginal(FaultTreeNode node) {
        if (node == null) {
            return null;
        }

        FaultTreeNode current = node;
        Set<String> visited = new HashSet<>();
        visited.add(current.getUniqueId());

        while (!current.isPrimaryInstance()) {
            String originalId = current.getOriginalId();
            if (originalId == null || originalId.equals(current.getUniqueId())) {
                break;
            }
            FaultTreeNode original = nodes.get(originalId);
            if (original == null) {
                log.debug("【克隆解析】-> 原始节点不存在: clone={}, originalId={}", current.getUniqueId(), originalId);
                break;
            }
            if (!visited.add(originalId)) {
                log.warn("【克隆解析】-> 克隆链存在环，停止于: {}", current.getUniqueId());
                break;
            }
            current = original;
        }
        return current;
    }

    /**
     * 创建克隆节点：复制属性，不复制子节点，指向源节点的主实例
     *
     * @param source 源节点
     * @param cloneId 新节点ID
     * @param parentId 挂载的父节点ID，可为 null
     */
    public FaultTreeNode cloneNode(FaultTreeNode source, String cloneId, String parentId) {
        FaultTreeNode original = resolveOriginal(source);

        FaultTreeNode clone = new FaultTreeNode(cloneId, source.getUserName(), source.getTypeLabel());
        clone.setGateType(source.getGateType());
        clone.setQuantValue(source.getQuantValue());
        clone.setDescription(source.getDescription());
        clone.setRationale(source.getRationale());
        clone.setSeverity(source.getSeverity());
        clone.setControllability(source.getControllability());
        clone.setSafetyRequirements(new ArrayList<>(source.getSafetyRequirements()));
        clone.setPage(source.isPage());
        clone.setPrimaryInstance(false);
        clone.setOriginalId(original.getUniqueId());

        addNode(clone);
        if (parentId != null) {
            addEdge(parentId, cloneId);
        }
        log.debug("【故障树】-> 创建克隆: clone={}, original={}", cloneId, original.getUniqueId());
        return clone;
    }

    /**
     * 节点显示名称
     *
     * 用户名为空或等于默认名时为 "Node {uid}"，否则为 "Node {uid}: {userName}"；
     * 克隆节点的 uid 取主实例的ID。
     */
    public String getDisplayName(FaultTreeNode node) {
        if (node == null) {
            return "";
        }
        String uid = node.isPrimaryInstance() ? node.getUniqueId() : resolveOriginal(node).getUniqueId();
        String baseName = node.getUserName();
        String defaultName = "Node " + uid;
        if (baseName == null || baseName.isEmpty() || baseName.equals(defaultName)) {
            return defaultName;
        }
        return defaultName + ": " + baseName;
    }

    // ========== 遍历 ==========

    /**
     * 扁平化遍历（深度优先前序，每个ID只出现一次）
     *
     * 除遍历起点外，若节点的任一父节点（遍历起点除外）是页面边界，则该节点
     * 不纳入结果，也不经由它继续向下遍历。起点本身是页面节点时照常包含并展开。
     */
    public List<FaultTreeNode> getAllNodes(FaultTreeNode root) {
        return traverse(root, true);
    }

    /**
     * 扁平化遍历（不做页面过滤）
     */
    public List<FaultTreeNode> getAllNodesNoFilter(FaultTreeNode root) {
        return traverse(root, false);
    }

    private List<FaultTreeNode> traverse(FaultTreeNode root, boolean filterPages) {
        if (root == null) {
            throw new IllegalArgumentException("root must not be null");
        }

        List<FaultTreeNode> result = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(root.getUniqueId());
        String rootId = root.getUniqueId();

        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }

            FaultTreeNode node = nodes.get(current);
            if (node == null) {
                continue;
            }

            if (filterPages && !current.equals(rootId) && isBehindPage(current, rootId)) {
                log.debug("【扁平化遍历】-> 页面边界后的节点，跳过: {}", current);
                continue;
            }

            result.add(node);

            // 逆序压栈，保证按子节点顺序出栈
            List<String> children = getChildren(current);
            for (int i = children.size() - 1; i >= 0; i--) {
                if (!visited.contains(children.get(i))) {
                    stack.push(children.get(i));
                }
            }
        }
        return result;
    }

    private boolean isBehindPage(String nodeId, String rootId) {
        for (String parentId : getParents(nodeId)) {
            if (parentId.equals(rootId)) {
                continue;
            }
            FaultTreeNode parent = nodes.get(parentId);
            if (parent != null && parent.isPage()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 顶层节点：没有父节点的节点，保持插入顺序
     */
    public List<FaultTreeNode> getTopLevelNodes() {
        List<FaultTreeNode> result = new ArrayList<>();
        for (FaultTreeNode node : nodes.values()) {
            if (getInDegree(node.getUniqueId()) == 0) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * 起点下（页面过滤后）的所有基本事件
     */
    public List<FaultTreeNode> getBasicEvents(FaultTreeNode root) {
        List<FaultTreeNode> result = new ArrayList<>();
        for (FaultTreeNode node : getAllNodes(root)) {
            if (node.getNodeType() == FaultNodeType.BASIC_EVENT) {
                result.add(node);
            }
        }
        return result;
    }

    // ========== Getters ==========

    public Collection<FaultTreeNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        int count = 0;
        for (List<String> edges : childIds.values()) {
            count += edges.size();
        }
        return count;
    }
}
