package com.safety.analysis.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 风险评级查表工具
 *
 * 核心功能：
 * 1. 暴露度 / 可控性 / 严重度 到条件概率的映射
 * 2. 验证目标推导（ISO 21448: R_HB = A_H / (P_E|HB * P_C|E * P_S|C)）
 * 3. 网络安全风险等级（可行性 x 影响）
 * 4. CAL 等级（攻击向量 x 影响）
 * 5. ASIL 等级（严重度 x 可控性 x 暴露度）
 *
 * 风险等级与 CAL 查表遇到不支持的组合时抛出 {@link UnsupportedRatingException}，不做猜测。
 */
@Slf4j
public final class RiskRatingTables {

    /** 影响等级，按从低到高排序 */
    public static final List<String> IMPACT_LEVELS =
            Collections.unmodifiableList(Arrays.asList("Negligible", "Moderate", "Major", "Severe"));

    private static final Map<Integer, Double> EXPOSURE_PROBABILITIES = new HashMap<>();
    private static final Map<Integer, Double> CONTROLLABILITY_PROBABILITIES = new HashMap<>();
    private static final Map<Integer, Double> SEVERITY_PROBABILITIES = new HashMap<>();

    /** 可行性 -> 影响 -> 风险等级 */
    private static final Map<String, Map<String, String>> RISK_LEVEL_TABLE = new LinkedHashMap<>();

    /** 攻击向量列 -> 影响 -> CAL */
    private static final Map<String, Map<String, String>> CAL_TABLE = new LinkedHashMap<>();

    /** key = "严重度/可控性/暴露度" */
    private static final Map<String, String> ASIL_TABLE = new HashMap<>();

    static {
        EXPOSURE_PROBABILITIES.put(1, 1e-4);
        EXPOSURE_PROBABILITIES.put(2, 1e-3);
        EXPOSURE_PROBABILITIES.put(3, 1e-2);
        EXPOSURE_PROBABILITIES.put(4, 1e-1);

        CONTROLLABILITY_PROBABILITIES.put(1, 1e-3);
        CONTROLLABILITY_PROBABILITIES.put(2, 1e-2);
        CONTROLLABILITY_PROBABILITIES.put(3, 1e-1);

        SEVERITY_PROBABILITIES.put(1, 1e-3);
        SEVERITY_PROBABILITIES.put(2, 1e-2);
        SEVERITY_PROBABILITIES.put(3, 1e-1);

        RISK_LEVEL_TABLE.put("High", row("High", "High", "Medium", "Low"));
        RISK_LEVEL_TABLE.put("Medium", row("High", "Medium", "Low", "Low"));
        RISK_LEVEL_TABLE.put("Low", row("Medium", "Low", "Low", "Low"));

        CAL_TABLE.put("Physical-Local", calRow("CAL2", "CAL1", "CAL1"));
        CAL_TABLE.put("Adjacent Network", calRow("CAL3", "CAL2", "CAL1"));
        CAL_TABLE.put("Network-Remote", calRow("CAL4", "CAL3", "CAL2"));

        // 严重度 1
        asil(1, 1, "QM", "QM", "QM", "QM");
        asil(1, 2, "QM", "QM", "QM", "A");
        asil(1, 3, "QM", "QM", "QM", "B");
        // 严重度 2
        asil(2, 1, "QM", "QM", "QM", "A");
        asil(2, 2, "QM", "QM", "A", "B");
        asil(2, 3, "QM", "A", "B", "C");
        // 严重度 3
        asil(3, 1, "QM", "QM", "A", "B");
        asil(3, 2, "QM", "A", "B", "C");
        asil(3, 3, "A", "B", "C", "D");
    }

    private RiskRatingTables() {
        // 工具类，防止实例化
    }

    private static Map<String, String> row(String severe, String major, String moderate, String negligible) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Severe", severe);
        row.put("Major", major);
        row.put("Moderate", moderate);
        row.put("Negligible", negligible);
        return row;
    }

    private static Map<String, String> calRow(String severe, String major, String moderate) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("Severe", severe);
        row.put("Major", major);
        row.put("Moderate", moderate);
        return row;
    }

    private static void asil(int severity, int controllability, String... byExposure) {
        for (int i = 0; i < byExposure.length; i++) {
            ASIL_TABLE.put(asilKey(severity, controllability, i + 1), byExposure[i]);
        }
    }

    private static String asilKey(int severity, int controllability, int exposure) {
        return severity + "/" + controllability + "/" + exposure;
    }

    // ========== 概率映射 ==========

    public static double exposureToProbability(int level) {
        return EXPOSURE_PROBABILITIES.getOrDefault(level, 1.0);
    }

    public static double controllabilityToProbability(int level) {
        return CONTROLLABILITY_PROBABILITIES.getOrDefault(level, 1.0);
    }

    public static double severityToProbability(int level) {
        return SEVERITY_PROBABILITIES.getOrDefault(level, 1.0);
    }

    /**
     * 由接受准则推导验证目标
     *
     * 例：A_H = 1e-8/h, P_E|HB = 0.05, P_C|E = 0.1, P_S|C = 0.01 -> R_HB = 2e-4/h
     *
     * @throws IllegalArgumentException 任一概率因子不为正
     */
    public static double deriveValidationTarget(double acceptanceRate,
                                                double exposureGivenHb,
                                                double uncontrollableGivenExposure,
                                                double severityGivenUncontrollable) {
        double denominator = exposureGivenHb * uncontrollableGivenExposure * severityGivenUncontrollable;
        if (denominator <= 0) {
            throw new IllegalArgumentException(
                    "Probability factors must be positive to derive a validation target");
        }
        return acceptanceRate / denominator;
    }

    /**
     * 由暴露度 / 可控性 / 严重度等级直接推导验证目标
     */
    public static double validationTargetFromRatings(double acceptanceRate,
                                                     int exposure, int controllability, int severity) {
        return deriveValidationTarget(acceptanceRate,
                exposureToProbability(exposure),
                controllabilityToProbability(controllability),
                severityToProbability(severity));
    }

    // ========== 网络安全评级 ==========

    /**
     * 多个影响类别中的最高影响，未知取值按最低处理
     */
    public static String overallImpact(String... impacts) {
        String highest = IMPACT_LEVELS.get(0);
        int highestIndex = 0;
        if (impacts == null) {
            return highest;
        }
        for (String impact : impacts) {
            int index = IMPACT_LEVELS.indexOf(impact);
            if (index > highestIndex) {
                highestIndex = index;
                highest = impact;
            }
        }
        return highest;
    }

    /**
     * 风险等级查表
     *
     * @throws UnsupportedRatingException 可行性或影响不在表中
     */
    public static String riskLevel(String feasibility, String impact) {
        Map<String, String> row = RISK_LEVEL_TABLE.get(feasibility);
        if (row == null || !row.containsKey(impact)) {
            log.warn("【风险评级】-> 不支持的组合: feasibility={}, impact={}", feasibility, impact);
            throw new UnsupportedRatingException("risk level", feasibility + "/" + impact);
        }
        return row.get(impact);
    }

    /**
     * CAL 查表
     *
     * 攻击向量归并：Physical / Local -> Physical-Local，Adjacent -> Adjacent Network，
     * 其他 -> Network-Remote
     *
     * @throws UnsupportedRatingException 影响不在表中（如 Negligible）
     */
    public static String cal(String attackVector, String impact) {
        String column = attackVectorColumn(attackVector);
        String value = CAL_TABLE.get(column).get(impact);
        if (value == null) {
            log.warn("【风险评级】-> 不支持的CAL组合: attackVector={}, impact={}", attackVector, impact);
            throw new UnsupportedRatingException("CAL", column + "/" + impact);
        }
        return value;
    }

    static String attackVectorColumn(String attackVector) {
        if ("Physical".equals(attackVector) || "Local".equals(attackVector)) {
            return "Physical-Local";
        }
        if ("Adjacent".equals(attackVector)) {
            return "Adjacent Network";
        }
        return "Network-Remote";
    }

    /**
     * ASIL 查表，未定义的组合返回 QM
     */
    public static String asil(int severity, int controllability, int exposure) {
        return ASIL_TABLE.getOrDefault(asilKey(severity, controllability, exposure), "QM");
    }
}
