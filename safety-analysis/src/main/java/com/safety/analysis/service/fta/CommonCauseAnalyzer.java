package com.safety.analysis.service.fta;

import com.safety.analysis.constants.AnalysisConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 共因分析
 *
 * 与扁平化遍历不同，这里不做 visited 去重：从起点出发的每一条路径都计数一次，
 * 经由 k 条不同路径可达的节点计数为 k。当前路径上的节点不会被再次展开，保证有环时也能结束。
 */
@Slf4j
public class CommonCauseAnalyzer {

    /**
     * 统计每个节点在所有遍历路径中的出现次数（起点计1次），按首次出现顺序
     */
    public Map<String, Integer> countOccurrences(FaultTreeModel model, FaultTreeNode root) {
        if (model == null || root == null) {
            throw new IllegalArgumentException("model and root must not be null");
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        walk(model, root.getUniqueId(), counts, new HashSet<>());
        return counts;
    }

    private void walk(FaultTreeModel model, String nodeId, Map<String, Integer> counts, Set<String> onPath) {
        counts.merge(nodeId, 1, Integer::sum);

        if (!onPath.add(nodeId)) {
            log.warn("【共因分析】-> 检测到环，停止展开: {}", nodeId);
            return;
        }
        for (String childId : model.getChildren(nodeId)) {
            walk(model, childId, counts, onPath);
        }
        onPath.remove(nodeId);
    }

    /**
     * 分析共因：出现次数大于1的节点
     */
    public List<CommonCause> analyze(FaultTreeModel model, FaultTreeNode root) {
        Map<String, Integer> counts = countOccurrences(model, root);

        List<CommonCause> causes = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() <= 1) {
                continue;
            }
            FaultTreeNode node = model.getNode(entry.getKey());
            if (node == null) {
                continue;
            }
            causes.add(new CommonCause(
                    node.getUniqueId(),
                    model.getDisplayName(node),
                    node.getTypeLabel(),
                    node.getDescription(),
                    entry.getValue()));
        }

        log.info("【共因分析】-> 起点={}, 统计节点数={}, 共因数={}", root.getUniqueId(), counts.size(), causes.size());
        return causes;
    }

    /**
     * 生成多行文本报告；没有共因时正文为 "None found."
     */
    public String buildReport(FaultTreeModel model, FaultTreeNode root) {
        List<CommonCause> causes = analyze(model, root);

        StringBuilder sb = new StringBuilder();
        sb.append(AnalysisConstants.Report.COMMON_CAUSE_HEADER).append('\n');
        if (causes.isEmpty()) {
            sb.append(AnalysisConstants.Report.NONE_FOUND);
            return sb.toString();
        }

        for (int i = 0; i < causes.size(); i++) {
            CommonCause cause = causes.get(i);
            sb.append("- ").append(cause.getDisplayName())
              .append(" (").append(cause.getNodeType()).append(')')
              .append(" occurs ").append(cause.getOccurrences()).append(" times: ")
              .append(cause.getDescription() != null ? cause.getDescription() : "");
            if (i < causes.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }
}
