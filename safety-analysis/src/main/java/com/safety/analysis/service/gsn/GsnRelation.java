package com.safety.analysis.service.gsn;

/**
 * GSN 连接关系
 */
public enum GsnRelation {
    /** solved-by（默认） */
    SOLVED("solved"),
    /** in-context-of */
    CONTEXT("context");

    private final String value;

    GsnRelation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 只有 "context"（忽略大小写）解析为 CONTEXT，其余为 SOLVED
     */
    public static GsnRelation parse(String raw) {
        if (raw != null && CONTEXT.value.equalsIgnoreCase(raw.trim())) {
            return CONTEXT;
        }
        return SOLVED;
    }
}
