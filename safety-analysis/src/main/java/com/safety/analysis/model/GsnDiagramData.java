package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * GSN 图持久化结构
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class GsnDiagramData {

    @JsonProperty("diag_id")
    private String diagId;

    /** 根节点ID */
    private String root;

    private List<GsnNodeData> nodes = new ArrayList<>();

    public void setNodes(List<GsnNodeData> nodes) {
        this.nodes = nodes != null ? nodes : new ArrayList<>();
    }
}
