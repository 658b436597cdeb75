package com.safety.analysis.util;

/**
 * 数值安全解析工具
 *
 * 历史工程文件中的严重度、可控性、量化值可能是数字、数字字符串、空串或任意文本，
 * 解析失败时统一降级为调用方给定的默认值，不向上抛出异常。
 */
public final class NumberParser {

    private NumberParser() {
        // 工具类，防止实例化
    }

    /**
     * 安全获取Double类型的值
     *
     * @param value 原始值（Number / String / null / 其他）
     * @param defaultValue 默认值
     * @return 解析结果，不存在或转换失败则返回默认值
     */
    public static double safeDouble(Object value, double defaultValue) {
        Double parsed = parseDouble(value);
        return parsed != null ? parsed : defaultValue;
    }

    /**
     * 安全解析Double
     *
     * @return 解析结果，不存在或转换失败则返回null
     */
    public static Double parseDouble(Object value) {
        if (value == null) {
            return null;
        }

        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) ? null : d;
        }

        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }

        try {
            double d = Double.parseDouble(text);
            return Double.isNaN(d) ? null : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 安全获取Integer类型的值（小数向下取整）
     *
     * @return 解析结果，不存在或转换失败则返回null
     */
    public static Integer parseInteger(Object value) {
        Double d = parseDouble(value);
        if (d == null || d.isInfinite()) {
            return null;
        }
        return d.intValue();
    }
}
