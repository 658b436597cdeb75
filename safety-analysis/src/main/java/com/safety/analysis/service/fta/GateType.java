package com.safety.analysis.service.fta;

/**
 * 门类型
 */
public enum GateType {
    AND,
    OR;

    /**
     * 解析门类型：只有精确的 "OR"（忽略大小写与首尾空白）才是 OR，其余一律按 AND 处理
     */
    public static GateType parse(String raw) {
        if (raw != null && "OR".equals(raw.trim().toUpperCase())) {
            return OR;
        }
        return AND;
    }
}
