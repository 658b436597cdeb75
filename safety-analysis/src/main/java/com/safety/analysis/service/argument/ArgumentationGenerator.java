package com.safety.analysis.service.argument;

import com.safety.analysis.constants.AnalysisConstants;
import com.safety.analysis.service.fta.CutSetCalculator;
import com.safety.analysis.service.fta.FaultNodeType;
import com.safety.analysis.service.fta.FaultTreeModel;
import com.safety.analysis.service.fta.FaultTreeNode;
import com.safety.analysis.util.AssuranceLevels;
import com.safety.analysis.util.NumberParser;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 论证文本生成器
 *
 * 输出内容（按顺序）：
 * 1. 标题：节点显示名 + PAL 等级（由量化值离散化得到，无法解析时为1）
 * 2. 严重度 / 可控性（缺失或非数字时取默认值）
 * 3. 该等级的推荐内容，按固定类别顺序
 * 4. 节点名称或描述中命中的额外推荐关键字（忽略大小写）
 * 5. 割集列表
 * 6. 割集中每个节点的描述与理由（按首次出现顺序，各一次）
 *
 * 推荐表由构造参数显式传入，生成器本身无状态。
 */
@Slf4j
public class ArgumentationGenerator {

    private final RecommendationTable table;
    private final CutSetCalculator cutSetCalculator;
    private final double defaultSeverity;
    private final double defaultControllability;

    public ArgumentationGenerator(RecommendationTable table) {
        this(table, new CutSetCalculator(),
                AnalysisConstants.Assurance.DEFAULT_SEVERITY,
                AnalysisConstants.Assurance.DEFAULT_CONTROLLABILITY);
    }

    public ArgumentationGenerator(RecommendationTable table, CutSetCalculator cutSetCalculator,
                                  double defaultSeverity, double defaultControllability) {
        if (table == null) {
            throw new IllegalArgumentException("recommendation table must not be null");
        }
        this.table = table;
        this.cutSetCalculator = cutSetCalculator;
        this.defaultSeverity = defaultSeverity;
        this.defaultControllability = defaultControllability;
    }

    /**
     * 生成论证文本
     *
     * @param model 故障树模型
     * @param node 论证对象节点
     * @param format 输出格式，null 按 PLAIN 处理
     */
    public ArgumentationResult generate(FaultTreeModel model, FaultTreeNode node, TextFormat format) {
        if (model == null || node == null) {
            throw new IllegalArgumentException("model and node must not be null");
        }
        TextFormat fmt = format != null ? format : TextFormat.PLAIN;

        int level = AssuranceLevels.discretize(node.getQuantValue());
        double severity = NumberParser.safeDouble(node.getSeverity(), defaultSeverity);
        double controllability = NumberParser.safeDouble(node.getControllability(), defaultControllability);
        String displayName = model.getDisplayName(node);

        List<String> lines = new ArrayList<>();

        // 1. 标题
        lines.add(fmt.heading("Argumentation for " + displayName));
        lines.add(fmt.line(AnalysisConstants.Assurance.PAL_TITLE + " " + level));

        // 2. 严重度 / 可控性
        lines.add(fmt.labeled("Severity", oneDecimal(severity)));
        lines.add(fmt.labeled("Controllability", oneDecimal(controllability)));

        // 3. 等级推荐
        if (table.hasLevel(level)) {
            for (String category : AnalysisConstants.Recommendation.ORDERED_CATEGORIES) {
                String guidance = table.getGuidance(level, category);
                if (guidance != null) {
                    lines.add(fmt.labeled(category, guidance));
                }
            }
        } else {
            log.warn("【论证生成】-> 推荐表中没有等级{}，跳过推荐内容", level);
        }

        // 4. 额外推荐
        List<String> extras = matchExtraRecommendations(node, level);
        if (!extras.isEmpty()) {
            lines.add(fmt.heading(AnalysisConstants.Recommendation.EXTRA_RECOMMENDATIONS + ":"));
            lines.add(fmt.list(extras));
        }

        // 5. 割集
        List<Set<String>> cutSets = cutSetCalculator.calculateCutSets(model, node);
        lines.add(fmt.heading("Cut Sets:"));
        for (int i = 0; i < cutSets.size(); i++) {
            lines.add(fmt.line("Cut Set " + (i + 1) + ": " + String.join(", ", sortedNames(model, cutSets.get(i)))));
        }

        // 6. 节点详情
        lines.add(fmt.heading("Node Details:"));
        Set<String> described = new LinkedHashSet<>();
        for (Set<String> cutSet : cutSets) {
            described.addAll(cutSet);
        }
        for (String id : described) {
            FaultTreeNode detail = model.getNode(id);
            if (detail == null) {
                continue;
            }
            lines.add(fmt.heading(model.getDisplayName(detail)));
            lines.add(fmt.labeled("Description", detail.getDescription()));
            lines.add(fmt.labeled("Rationale", detail.getRationale()));
            if (detail.getQuantValue() != null) {
                if (detail.getNodeType() == FaultNodeType.CONFIDENCE_LEVEL) {
                    lines.add(fmt.labeled("Assessment", AssuranceLevels.metricToText("confidence", detail.getQuantValue())));
                } else if (detail.getNodeType() == FaultNodeType.ROBUSTNESS_SCORE) {
                    lines.add(fmt.labeled("Assessment", AssuranceLevels.metricToText("robustness", detail.getQuantValue())));
                }
            }
        }

        log.info("【论证生成】-> 节点={}, 等级={}, 割集数={}, 额外推荐数={}",
                node.getUniqueId(), level, cutSets.size(), extras.size());

        return new ArgumentationResult(node.getUniqueId(), level, AssuranceLevels.assuranceLevelText(level),
                severity, controllability, cutSets, String.join("\n", lines));
    }

    /**
     * 节点名称或描述中出现的关键字对应的额外推荐，按推荐表中的关键字顺序
     */
    List<String> matchExtraRecommendations(FaultTreeNode node, int level) {
        String haystack = ((node.getUserName() != null ? node.getUserName() : "") + " "
                + node.getDescription()).toLowerCase(Locale.ROOT);

        List<String> matched = new ArrayList<>();
        for (Map.Entry<String, String> entry : table.getExtraRecommendations(level).entrySet()) {
            if (haystack.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                matched.add(entry.getKey() + ": " + entry.getValue());
            }
        }
        return matched;
    }

    private List<String> sortedNames(FaultTreeModel model, Set<String> cutSet) {
        List<String> names = new ArrayList<>();
        for (String id : cutSet) {
            FaultTreeNode node = model.getNode(id);
            names.add(node != null ? model.getDisplayName(node) : id);
        }
        Collections.sort(names);
        return names;
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    /**
     * 层级论证：缩进输出节点名称与理由
     *
     * 共享节点只完整描述一次，之后以 "(see above)" 引用；环上的节点同样按已描述处理。
     */
    public String buildHierarchicalArgumentation(FaultTreeModel model, FaultTreeNode node) {
        if (model == null || node == null) {
            throw new IllegalArgumentException("model and node must not be null");
        }
        List<String> lines = new ArrayList<>();
        describe(model, node, 0, new HashSet<>(), lines);
        return String.join("\n", lines);
    }

    private void describe(FaultTreeModel model, FaultTreeNode node, int depth, Set<String> described, List<String> lines) {
        StringBuilder indent = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            indent.append("  ");
        }
        String name = model.getDisplayName(node);

        if (!described.add(node.getUniqueId())) {
            lines.add(indent + name + " " + AnalysisConstants.Report.SEE_ABOVE);
            return;
        }

        String rationale = node.getRationale();
        lines.add(indent + name + (rationale.isEmpty() ? "" : ": " + rationale));
        for (FaultTreeNode child : model.getChildNodes(node.getUniqueId())) {
            describe(model, child, depth + 1, described, lines);
        }
    }
}
