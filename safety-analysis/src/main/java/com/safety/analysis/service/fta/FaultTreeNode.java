package com.safety.analysis.service.fta;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 故障树节点
 *
 * 只保存节点自身属性，父子关系统一由 {@link FaultTreeModel} 以 id 列表维护：
 * - 子节点：有序 id 列表（拥有关系）
 * - 父节点：id 集合（仅回指，支持共享子树）
 * - 克隆：originalId 指向原始节点（非拥有引用，解析时需防环）
 */
@Getter
@Setter
public class FaultTreeNode {
    private String uniqueId;
    private String userName;

    private FaultNodeType nodeType;

    /** 原始类型标签（未知类型时保留原文） */
    private String typeLabel;

    /** 门类型，非门节点为 null */
    private GateType gateType;

    private Double quantValue;
    private String description = "";
    private String rationale = "";

    /** 严重度 / 可控性原始值，可能来自历史数据中的非数字文本 */
    private String severity;
    private String controllability;

    private List<SafetyRequirementRef> safetyRequirements;

    /** 是否为页面边界节点 */
    private boolean page;

    private boolean primaryInstance = true;

    /** 克隆节点指向的原始节点ID，主实例为 null 或自身ID */
    private String originalId;

    public FaultTreeNode() {
        this.safetyRequirements = new ArrayList<>();
    }

    public FaultTreeNode(String uniqueId, String userName, String typeLabel) {
        this();
        this.uniqueId = uniqueId;
        this.userName = userName;
        this.typeLabel = typeLabel;
        this.nodeType = FaultNodeType.fromLabel(typeLabel);
        this.gateType = nodeType.isGate() ? GateType.AND : null;
    }

    // 特殊的 Setter 方法（带业务逻辑）
    public void setTypeLabel(String typeLabel) {
        this.typeLabel = typeLabel;
        this.nodeType = FaultNodeType.fromLabel(typeLabel);
    }

    public void setSafetyRequirements(List<SafetyRequirementRef> safetyRequirements) {
        this.safetyRequirements = safetyRequirements != null ? safetyRequirements : new ArrayList<>();
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public void setRationale(String rationale) {
        this.rationale = rationale != null ? rationale : "";
    }
}
