package com.safety.analysis.service.gsn;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * GSN 论证图（以唯一ID为键的节点仓库）
 *
 * 核心数据结构：
 * 1. nodes：uniqueId -> GsnNode
 * 2. childIds：有序子节点ID列表，solved-by 与 in-context-of 子节点都在其中，每个子节点只出现一次
 * 3. contextIds：子节点中以 context 关系连接的部分（childIds 的子集）
 * 4. parentIds：父节点ID集合（仅回指）
 *
 * 连接规则（违反时抛出 {@link InvalidRelationshipException}）：
 * 1. 不能连接自身
 * 2. Assumption 不能有子节点
 * 3. context 关系的子节点不能是 Goal / Strategy
 * 4. solved 关系的子节点不能是 Context / Assumption / Justification
 */
@Slf4j
public class GsnArgumentGraph {

    private final Map<String, GsnNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> childIds = new HashMap<>();
    private final Map<String, Set<String>> contextIds = new HashMap<>();
    private final Map<String, Set<String>> parentIds = new HashMap<>();

    // ========== 节点 ==========

    /**
     * 添加节点
     *
     * @throws IllegalArgumentException ID为空、类型为空，或ID已被另一个节点占用
     */
    public void addNode(GsnNode node) {
        if (node == null || node.getUniqueId() == null || node.getUniqueId().isEmpty()) {
            throw new IllegalArgumentException("node and node.uniqueId must not be null");
        }
        if (node.getNodeType() == null) {
            throw new IllegalArgumentException("node type must not be null: " + node.getUniqueId());
        }
        GsnNode existing = nodes.get(node.getUniqueId());
        if (existing != null && existing != node) {
            throw new IllegalArgumentException("duplicate unique id: " + node.getUniqueId());
        }
        nodes.put(node.getUniqueId(), node);
    }

    public GsnNode getNode(String nodeId) {
        return nodeId != null ? nodes.get(nodeId) : null;
    }

    public GsnNode requireNode(String nodeId) {
        GsnNode node = getNode(nodeId);
        if (node == null) {
            throw new IllegalArgumentException("unknown GSN node id: " + nodeId);
        }
        return node;
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    public Collection<GsnNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int getNodeCount() {
        return nodes.size();
    }

    // ========== 连接 ==========

    /**
     * 检查连接是否合法，不合法时返回原因，合法时返回 null
     */
    public static String checkRelationship(GsnNode parent, GsnNode child, GsnRelation relation) {
        if (parent == child || parent.getUniqueId().equals(child.getUniqueId())) {
            return "a node cannot be linked to itself";
        }
        if (parent.getNodeType() == GsnNodeType.ASSUMPTION) {
            return "Assumption nodes cannot have children";
        }
        GsnNodeType childType = child.getNodeType();
        if (relation == GsnRelation.CONTEXT
                && (childType == GsnNodeType.GOAL || childType == GsnNodeType.STRATEGY)) {
            return childType.getLabel() + " cannot be attached as context";
        }
        if (relation == GsnRelation.SOLVED && childType.isInContext()) {
            return childType.getLabel() + " nodes can only be attached as context";
        }
        return null;
    }

    public boolean isAllowed(String parentId, String childId, GsnRelation relation) {
        GsnNode parent = getNode(parentId);
        GsnNode child = getNode(childId);
        return parent != null && child != null && checkRelationship(parent, child, relation) == null;
    }

    /**
     * 以 solved 关系连接
     */
    public void addChild(String parentId, String childId) {
        addChild(parentId, childId, GsnRelation.SOLVED);
    }

    /**
     * 连接父子节点
     *
     * 子节点已在父节点下时不重复添加，只更新关系标记。
     *
     * @throws InvalidRelationshipException 连接违反规则
     * @throws IllegalArgumentException 任一端节点不存在
     */
    public void addChild(String parentId, String childId, GsnRelation relation) {
        GsnNode parent = requireNode(parentId);
        GsnNode child = requireNode(childId);
        GsnRelation rel = relation != null ? relation : GsnRelation.SOLVED;

        String reason = checkRelationship(parent, child, rel);
        if (reason != null) {
            throw new InvalidRelationshipException(parentId, childId, rel, reason);
        }

        List<String> children = childIds.computeIfAbsent(parentId, k -> new ArrayList<>());
        if (!children.contains(childId)) {
            children.add(childId);
        }
        if (rel == GsnRelation.CONTEXT) {
            contextIds.computeIfAbsent(parentId, k -> new LinkedHashSet<>()).add(childId);
        } else {
            Set<String> context = contextIds.get(parentId);
            if (context != null) {
                context.remove(childId);
            }
        }
        parentIds.computeIfAbsent(childId, k -> new LinkedHashSet<>()).add(parentId);
        log.debug("【GSN】-> 连接: {} -[{}]-> {}", parentId, rel.getValue(), childId);
    }

    /**
     * 断开父子连接（同时清除 context 标记）
     *
     * @return 连接原本存在时返回 true
     */
    public boolean removeChild(String parentId, String childId) {
        List<String> children = childIds.get(parentId);
        boolean removed = children != null && children.remove(childId);

        Set<String> context = contextIds.get(parentId);
        if (context != null) {
            context.remove(childId);
        }
        Set<String> parents = parentIds.get(childId);
        if (parents != null) {
            parents.remove(parentId);
        }
        if (removed) {
            log.debug("【GSN】-> 断开连接: {} -> {}", parentId, childId);
        }
        return removed;
    }

    /**
     * 修改连接：新连接先校验，校验通过后再断开旧连接并建立新连接
     *
     * @throws InvalidRelationshipException 新连接不合法，此时旧连接保持不变
     */
    public void reconnect(String oldParentId, String oldChildId,
                          String newParentId, String newChildId, GsnRelation relation) {
        GsnNode newParent = requireNode(newParentId);
        GsnNode newChild = requireNode(newChildId);
        GsnRelation rel = relation != null ? relation : GsnRelation.SOLVED;

        String reason = checkRelationship(newParent, newChild, rel);
        if (reason != null) {
            throw new InvalidRelationshipException(newParentId, newChildId, rel, reason);
        }

        removeChild(oldParentId, oldChildId);
        addChild(newParentId, newChildId, rel);
    }

    /**
     * 两节点之间的关系，未连接时返回 null
     */
    public GsnRelation getRelation(String parentId, String childId) {
        List<String> children = childIds.get(parentId);
        if (children == null || !children.contains(childId)) {
            return null;
        }
        Set<String> context = contextIds.get(parentId);
        return context != null && context.contains(childId) ? GsnRelation.CONTEXT : GsnRelation.SOLVED;
    }

    /**
     * 全部子节点ID（solved 与 context），保持连接顺序
     */
    public List<String> getChildren(String nodeId) {
        return Collections.unmodifiableList(childIds.getOrDefault(nodeId, Collections.emptyList()));
    }

    /**
     * context 子节点ID，按子节点顺序
     */
    public List<String> getContextChildren(String nodeId) {
        Set<String> context = contextIds.get(nodeId);
        if (context == null || context.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String childId : getChildren(nodeId)) {
            if (context.contains(childId)) {
                result.add(childId);
            }
        }
        return result;
    }

    /**
     * solved 子节点ID，按子节点顺序
     */
    public List<String> getSolvedChildren(String nodeId) {
        Set<String> context = contextIds.getOrDefault(nodeId, Collections.emptySet());
        List<String> result = new ArrayList<>();
        for (String childId : getChildren(nodeId)) {
            if (!context.contains(childId)) {
                result.add(childId);
            }
        }
        return result;
    }

    public Set<String> getParents(String nodeId) {
        return Collections.unmodifiableSet(parentIds.getOrDefault(nodeId, Collections.emptySet()));
    }

    // ========== 克隆 ==========

    /**
     * 沿 originalId 找到主实例，防环；对主实例调用时返回自身
     */
    public GsnNode resolveOriginal(GsnNode node) {
        if (node == null) {
            return null;
        }
        GsnNode current = node;
        Set<String> visited = new HashSet<>();
        visited.add(current.getUniqueId());

        while (!current.isPrimaryInstance()) {
            String originalId = current.getOriginalId();
            if (originalId == null || originalId.equals(current.getUniqueId())) {
                break;
            }
            GsnNode original = nodes.get(originalId);
            if (original == null || !visited.add(originalId)) {
                break;
            }
            current = original;
        }
        return current;
    }

    /**
     * 创建克隆：复制名称、类型、描述、SPI目标、工作产品和证据链接，指向源节点的主实例
     *
     * @param nodeId 源节点
     * @param parentId 挂载的父节点，可为 null；Context / Assumption / Justification 以 context 关系挂载，其余为 solved
     * @throws InvalidRelationshipException 挂载关系不合法，此时克隆不会加入图中
     */
    public GsnNode cloneNode(String nodeId, String parentId) {
        GsnNode source = requireNode(nodeId);
        GsnNode original = resolveOriginal(source);

        GsnNode clone = new GsnNode(UUID.randomUUID().toString(), source.getUserName(), source.getNodeType());
        clone.setDescription(source.getDescription());
        clone.setSpiTarget(source.getSpiTarget());
        clone.setWorkProduct(source.getWorkProduct());
        clone.setEvidenceLink(source.getEvidenceLink());
        clone.setX(source.getX());
        clone.setY(source.getY());
        clone.setPrimaryInstance(false);
        clone.setOriginalId(original.getUniqueId());

        GsnRelation relation = source.getNodeType().isInContext() ? GsnRelation.CONTEXT : GsnRelation.SOLVED;
        if (parentId != null) {
            String reason = checkRelationship(requireNode(parentId), clone, relation);
            if (reason != null) {
                throw new InvalidRelationshipException(parentId, clone.getUniqueId(), relation, reason);
            }
        }

        addNode(clone);
        if (parentId != null) {
            addChild(parentId, clone.getUniqueId(), relation);
        }
        log.debug("【GSN】-> 创建克隆: clone={}, original={}", clone.getUniqueId(), original.getUniqueId());
        return clone;
    }

    /**
     * 与节点共享同一主实例的所有节点（主实例本身 + 全部克隆）
     */
    public List<GsnNode> getInstances(String nodeId) {
        GsnNode original = resolveOriginal(requireNode(nodeId));
        List<GsnNode> result = new ArrayList<>();
        for (GsnNode candidate : nodes.values()) {
            if (resolveOriginal(candidate) == original) {
                result.add(candidate);
            }
        }
        return result;
    }

    /**
     * 修改节点属性，并同步到主实例及其所有克隆
     *
     * @return 被修改的节点数
     */
    public int updateDetails(String nodeId, GsnNodeDetails details) {
        if (details == null) {
            return 0;
        }
        List<GsnNode> instances = getInstances(nodeId);
        for (GsnNode instance : instances) {
            if (details.getUserName() != null) {
                instance.setUserName(details.getUserName());
            }
            if (details.getDescription() != null) {
                instance.setDescription(details.getDescription());
            }
            if (details.getWorkProduct() != null) {
                instance.setWorkProduct(details.getWorkProduct());
            }
            if (details.getEvidenceLink() != null) {
                instance.setEvidenceLink(details.getEvidenceLink());
            }
            if (details.getSpiTarget() != null) {
                instance.setSpiTarget(details.getSpiTarget());
            }
        }
        log.debug("【GSN】-> 属性同步: node={}, 实例数={}", nodeId, instances.size());
        return instances.size();
    }

    // ========== 模块名解析 ==========

    /**
     * 查找节点所在模块名
     *
     * 先对祖先做广度优先搜索，第一个 Module 类型祖先的当前名称即为结果；
     * 找不到时沿 originalId 链在主实例（及中间克隆）上重复查找，链上有环时停止。
     * 每次调用实时计算，不缓存，模块改名后立即生效。
     */
    public Optional<String> findModuleName(String nodeId) {
        GsnNode current = requireNode(nodeId);
        Set<String> visitedOriginals = new HashSet<>();

        while (current != null && visitedOriginals.add(current.getUniqueId())) {
            Optional<String> found = findModuleAncestor(current.getUniqueId());
            if (found.isPresent()) {
                return found;
            }
            String originalId = current.getOriginalId();
            if (originalId == null || originalId.equals(current.getUniqueId())) {
                break;
            }
            current = nodes.get(originalId);
        }
        return Optional.empty();
    }

    private Optional<String> findModuleAncestor(String nodeId) {
        Deque<String> queue = new ArrayDeque<>(getParents(nodeId));
        Set<String> visited = new HashSet<>(queue);
        visited.add(nodeId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            GsnNode node = nodes.get(current);
            if (node == null) {
                continue;
            }
            if (node.getNodeType() == GsnNodeType.MODULE) {
                return Optional.ofNullable(node.getUserName());
            }
            for (String parent : getParents(current)) {
                if (visited.add(parent)) {
                    queue.add(parent);
                }
            }
        }
        return Optional.empty();
    }
}
