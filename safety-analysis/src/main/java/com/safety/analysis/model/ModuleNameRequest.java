package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

/**
 * 模块名查询请求
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModuleNameRequest {

    private GsnModelData model;

    @JsonProperty("node_id")
    private String nodeId;
}
