package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.safety.analysis.service.fta.SafetyRequirementRef;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 故障树节点持久化结构（嵌套子节点）
 *
 * 共享子树在 JSON 中会以相同 unique_id 多次出现，加载时复用第一次创建的节点。
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FaultTreeNodeData {

    @JsonProperty("unique_id")
    private String uniqueId;

    @JsonProperty("user_name")
    private String userName;

    /**
     * 节点类型标签，如 "TOP EVENT"、"GATE"、"BASIC EVENT"
     */
    @JsonProperty("type")
    private String type;

    @JsonProperty("gate_type")
    private String gateType;

    /**
     * 量化值，历史数据中可能是数字或文本
     */
    @JsonProperty("quant_value")
    private Object quantValue;

    private String description;

    private String rationale;

    /**
     * 严重度 / 可控性，历史数据中可能是数字或文本
     */
    private Object severity;

    private Object controllability;

    @JsonProperty("is_page")
    private Boolean page;

    @JsonProperty("is_primary_instance")
    private Boolean primaryInstance;

    @JsonProperty("original_id")
    private String originalId;

    @JsonProperty("safety_requirements")
    private List<SafetyRequirementRef> safetyRequirements;

    private List<FaultTreeNodeData> children = new ArrayList<>();

    public void setChildren(List<FaultTreeNodeData> children) {
        this.children = children != null ? children : new ArrayList<>();
    }
}
