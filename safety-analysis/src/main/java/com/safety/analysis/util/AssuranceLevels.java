package com.safety.analysis.util;

import com.safety.analysis.constants.AnalysisConstants;

/**
 * 保证等级离散化
 *
 * 将连续的量化值映射到 1~5 的 PAL 等级：
 * <pre>
 *   q >= 4.5 -> 5
 *   q >= 3.5 -> 4
 *   q >= 2.5 -> 3
 *   q >= 1.5 -> 2
 *   其他     -> 1
 * </pre>
 */
public final class AssuranceLevels {

    private AssuranceLevels() {
        // 工具类，防止实例化
    }

    public static int discretize(double value) {
        if (value >= 4.5) {
            return 5;
        }
        if (value >= 3.5) {
            return 4;
        }
        if (value >= 2.5) {
            return 3;
        }
        if (value >= 1.5) {
            return 2;
        }
        return 1;
    }

    /**
     * 离散化任意原始值，缺失或无法解析时返回等级1
     */
    public static int discretize(Object rawValue) {
        Double parsed = NumberParser.parseDouble(rawValue);
        if (parsed == null) {
            return AnalysisConstants.Assurance.MIN_LEVEL;
        }
        return discretize(parsed.doubleValue());
    }

    /**
     * 等级文本：PAL1 ~ PAL5，越界等级按边界处理
     */
    public static String assuranceLevelText(int level) {
        int clamped = Math.max(AnalysisConstants.Assurance.MIN_LEVEL,
                Math.min(AnalysisConstants.Assurance.MAX_LEVEL, level));
        return "PAL" + clamped;
    }

    /**
     * 置信度 / 鲁棒性指标描述
     *
     * @param metricType "confidence" 或 "robustness"
     * @param value 原始值，会先离散化
     */
    public static String metricToText(String metricType, Object value) {
        int level = discretize(value);
        if ("robustness".equalsIgnoreCase(metricType)) {
            switch (level) {
                case 5: return "Excellent Safety Load";
                case 4: return "High Safety Load";
                case 3: return "Moderate Safety Load";
                case 2: return "Poor Safety Load";
                default: return "Very Poor Safety Load";
            }
        }
        switch (level) {
            case 5: return "Excellent confidence";
            case 4: return "High confidence";
            case 3: return "Moderate confidence";
            case 2: return "Poor confidence";
            default: return "Very poor confidence";
        }
    }
}
