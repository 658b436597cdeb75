package com.safety.analysis.service.fta;

import com.safety.analysis.constants.AnalysisConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 割集计算器
 *
 * 按门的结构直接枚举割集：
 * - 叶子节点：[{自身ID}]
 * - OR 门：各子节点割集按子节点顺序拼接
 * - AND 门：从 [{}] 出发，自左向右与每个子节点的割集做笛卡尔积并集
 *
 * 门类型缺失或不是精确的 OR 时一律按 AND 处理。
 *
 * 注意：结果不做去重和最小化（不是 MOCUS 意义上的最小割集）。多个 AND 子节点各自
 * 拥有多个割集时结果数量呈指数增长，这里只打印告警，不截断。
 */
@Slf4j
public class CutSetCalculator {

    private final int warnThreshold;

    public CutSetCalculator() {
        this(AnalysisConstants.Limits.CUT_SET_WARN_THRESHOLD);
    }

    public CutSetCalculator(int warnThreshold) {
        this.warnThreshold = warnThreshold;
    }

    /**
     * 计算节点的割集
     *
     * @param model 故障树模型
     * @param node 起点节点
     * @return 有序割集列表，每个割集为不可变的节点ID集合
     */
    public List<Set<String>> calculateCutSets(FaultTreeModel model, FaultTreeNode node) {
        if (model == null || node == null) {
            throw new IllegalArgumentException("model and node must not be null");
        }

        List<Set<String>> result = calculate(model, node, new HashSet<>());
        log.info("【割集计算】-> 节点={}, 割集数={}", node.getUniqueId(), result.size());
        return result;
    }

    private List<Set<String>> calculate(FaultTreeModel model, FaultTreeNode node, Set<String> onPath) {
        String nodeId = node.getUniqueId();
        List<FaultTreeNode> children = model.getChildNodes(nodeId);

        if (children.isEmpty()) {
            return Collections.singletonList(singleton(nodeId));
        }

        if (!onPath.add(nodeId)) {
            // 当前路径上再次遇到自己：按叶子处理，避免无限递归
            log.warn("【割集计算】-> 检测到环，按叶子处理: {}", nodeId);
            return Collections.singletonList(singleton(nodeId));
        }

        try {
            GateType gate = node.getGateType() != null ? node.getGateType() : GateType.AND;
            if (gate == GateType.OR) {
                return orCombine(model, children, onPath);
            }
            return andCombine(model, nodeId, children, onPath);
        } finally {
            onPath.remove(nodeId);
        }
    }

    private List<Set<String>> orCombine(FaultTreeModel model, List<FaultTreeNode> children, Set<String> onPath) {
        List<Set<String>> result = new ArrayList<>();
        for (FaultTreeNode child : children) {
            result.addAll(calculate(model, child, onPath));
        }
        return result;
    }

    private List<Set<String>> andCombine(FaultTreeModel model, String nodeId,
                                         List<FaultTreeNode> children, Set<String> onPath) {
        List<Set<String>> accumulated = new ArrayList<>();
        accumulated.add(Collections.emptySet());

        for (FaultTreeNode child : children) {
            List<Set<String>> childSets = calculate(model, child, onPath);
            List<Set<String>> next = new ArrayList<>(accumulated.size() * childSets.size());

            for (Set<String> acc : accumulated) {
                for (Set<String> cs : childSets) {
                    Set<String> combined = new LinkedHashSet<>(acc);
                    combined.addAll(cs);
                    next.add(Collections.unmodifiableSet(combined));
                }
            }

            if (next.size() > warnThreshold) {
                log.warn("【割集计算】-> AND门 {} 的中间割集数 {} 超过告警阈值 {}", nodeId, next.size(), warnThreshold);
            }
            accumulated = next;
        }
        return accumulated;
    }

    private static Set<String> singleton(String nodeId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Collections.singletonList(nodeId)));
    }
}
