package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 模块名查询结果，未找到模块时 module_name 为 null
 */
@Getter
@Setter
@NoArgsConstructor
public class ModuleNameResponse {

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("module_name")
    private String moduleName;

    public ModuleNameResponse(String nodeId, String moduleName) {
        this.nodeId = nodeId;
        this.moduleName = moduleName;
    }
}
