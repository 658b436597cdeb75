package com.safety.analysis.service.gsn;

/**
 * GSN 节点类型
 */
public enum GsnNodeType {
    GOAL("Goal", false),
    STRATEGY("Strategy", false),
    SOLUTION("Solution", false),
    CONTEXT("Context", true),                // 上下文
    ASSUMPTION("Assumption", true),          // 假设
    JUSTIFICATION("Justification", true),    // 理由
    AWAY_GOAL("Away Goal", false),
    AWAY_SOLUTION("Away Solution", false),
    AWAY_MODULE("Away Module", false),
    MODULE("Module", false);

    private final String label;
    private final boolean inContext;

    GsnNodeType(String label, boolean inContext) {
        this.label = label;
        this.inContext = inContext;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 是否只能以 context 关系挂载（Context / Assumption / Justification）
     */
    public boolean isInContext() {
        return inContext;
    }

    /**
     * 按标签解析（忽略大小写，下划线视为空格），无法识别时返回 null
     */
    public static GsnNodeType fromLabel(String label) {
        if (label == null) {
            return null;
        }
        String normalized = label.trim().replace('_', ' ');
        for (GsnNodeType type : values()) {
            if (type.label.equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
