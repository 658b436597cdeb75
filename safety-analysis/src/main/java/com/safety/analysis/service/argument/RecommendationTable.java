package com.safety.analysis.service.argument;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.safety.analysis.constants.AnalysisConstants;
import com.safety.analysis.util.NumberParser;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * 推荐表（不可变配置对象）
 *
 * 结构：等级(1~5) -> 类别 -> 指导文本；其中 "Extra Recommendations" 类别的值为
 * 关键字 -> 指导文本 的映射，按节点名称 / 描述中出现的关键字追加输出。
 *
 * JSON 格式：
 * <pre>
 * {
 *   "1": {
 *     "Testing Requirements": "...",
 *     "Extra Recommendations": { "braking": "..." }
 *   }
 * }
 * </pre>
 */
@Slf4j
public final class RecommendationTable {

    /** level -> category -> guidance */
    private final Map<Integer, Map<String, String>> guidance;

    /** level -> keyword -> guidance */
    private final Map<Integer, Map<String, String>> extras;

    public RecommendationTable(Map<Integer, Map<String, String>> guidance,
                               Map<Integer, Map<String, String>> extras) {
        this.guidance = copy(guidance);
        this.extras = copy(extras);
    }

    private static Map<Integer, Map<String, String>> copy(Map<Integer, Map<String, String>> source) {
        Map<Integer, Map<String, String>> result = new TreeMap<>();
        if (source != null) {
            for (Map.Entry<Integer, Map<String, String>> entry : source.entrySet()) {
                result.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * 从 JSON 流加载
     */
    public static RecommendationTable fromStream(InputStream in, ObjectMapper objectMapper) throws IOException {
        return fromJson(objectMapper.readTree(in));
    }

    /**
     * 从 JSON 树加载；无法识别的等级键或非文本的类别值会被跳过并打印告警
     */
    public static RecommendationTable fromJson(JsonNode root) {
        Map<Integer, Map<String, String>> guidance = new TreeMap<>();
        Map<Integer, Map<String, String>> extras = new TreeMap<>();

        if (root == null || !root.isObject()) {
            log.warn("【推荐表】-> 根节点不是对象，返回空表");
            return new RecommendationTable(guidance, extras);
        }

        Iterator<Map.Entry<String, JsonNode>> levels = root.fields();
        while (levels.hasNext()) {
            Map.Entry<String, JsonNode> levelEntry = levels.next();
            Integer level = NumberParser.parseInteger(levelEntry.getKey());
            if (level == null || !levelEntry.getValue().isObject()) {
                log.warn("【推荐表】-> 无效的等级条目，跳过: {}", levelEntry.getKey());
                continue;
            }

            Map<String, String> categories = new LinkedHashMap<>();
            Map<String, String> keywords = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = levelEntry.getValue().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (AnalysisConstants.Recommendation.EXTRA_RECOMMENDATIONS.equals(field.getKey()) && value.isObject()) {
                    value.fields().forEachRemaining(kw -> keywords.put(kw.getKey(), kw.getValue().asText()));
                } else if (value.isTextual()) {
                    categories.put(field.getKey(), value.asText());
                } else {
                    log.warn("【推荐表】-> 等级{} 的类别值不是文本，跳过: {}", level, field.getKey());
                }
            }
            guidance.put(level, categories);
            extras.put(level, keywords);
        }

        log.info("【推荐表】-> 加载完成，等级: {}", guidance.keySet());
        return new RecommendationTable(guidance, extras);
    }

    public boolean hasLevel(int level) {
        return guidance.containsKey(level);
    }

    public Set<Integer> getLevels() {
        return guidance.keySet();
    }

    /**
     * 某等级下某类别的指导文本，不存在时返回 null
     */
    public String getGuidance(int level, String category) {
        Map<String, String> categories = guidance.get(level);
        return categories != null ? categories.get(category) : null;
    }

    public Map<String, String> getCategories(int level) {
        return guidance.getOrDefault(level, Collections.emptyMap());
    }

    /**
     * 某等级的额外推荐（关键字 -> 文本），保持配置中的顺序
     */
    public Map<String, String> getExtraRecommendations(int level) {
        return extras.getOrDefault(level, Collections.emptyMap());
    }
}
