package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * GSN 节点持久化结构
 *
 * children 为全部子节点ID，context 为其中以 context 关系连接的子集。
 * 旧版本文件中 context 子节点可能只出现在 context 列表里，也可能在两个列表中各出现一次。
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class GsnNodeData {

    @JsonProperty("unique_id")
    private String uniqueId;

    @JsonProperty("user_name")
    private String userName;

    @JsonProperty("node_type")
    private String nodeType;

    private String description;

    @JsonProperty("spi_target")
    private String spiTarget;

    @JsonProperty("work_product")
    private String workProduct;

    @JsonProperty("evidence_link")
    private String evidenceLink;

    @JsonProperty("is_primary_instance")
    private Boolean primaryInstance;

    @JsonProperty("original_id")
    private String originalId;

    private Double x;
    private Double y;

    private List<String> children = new ArrayList<>();

    private List<String> context = new ArrayList<>();

    public void setChildren(List<String> children) {
        this.children = children != null ? children : new ArrayList<>();
    }

    public void setContext(List<String> context) {
        this.context = context != null ? context : new ArrayList<>();
    }
}
