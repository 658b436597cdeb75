package com.safety.analysis.service.fta;

/**
 * 故障树节点类型枚举
 */
public enum FaultNodeType {
    TOP_EVENT("TOP EVENT", true),                                 // 顶事件
    GATE("GATE", true),                                           // 门
    RIGOR_LEVEL("RIGOR LEVEL", true),                             // 严格度门
    FUNCTIONAL_INSUFFICIENCY("FUNCTIONAL INSUFFICIENCY", true),   // 功能不足
    BASIC_EVENT("BASIC EVENT", false),                            // 基本事件
    CONFIDENCE_LEVEL("CONFIDENCE LEVEL", false),                  // 置信度
    ROBUSTNESS_SCORE("ROBUSTNESS SCORE", false),                  // 鲁棒性
    TRIGGERING_CONDITION("TRIGGERING CONDITION", false),          // 触发条件
    UNKNOWN("UNKNOWN", false);                                    // 未知类型

    private final String label;
    private final boolean gate;

    FaultNodeType(String label, boolean gate) {
        this.label = label;
        this.gate = gate;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 是否为门类节点（新建时默认 AND 门）
     */
    public boolean isGate() {
        return gate;
    }

    /**
     * 按标签解析，忽略大小写，下划线与空格等价；无法识别时返回 UNKNOWN
     */
    public static FaultNodeType fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        String normalized = label.trim().replace('_', ' ').toUpperCase();
        for (FaultNodeType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
