package com.safety.analysis.service.fta;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

/**
 * 共因条目：经由多条路径可达的节点
 */
@Getter
public class CommonCause {
    @JsonProperty("node_id")
    private final String nodeId;
    @JsonProperty("display_name")
    private final String displayName;
    @JsonProperty("node_type")
    private final String nodeType;
    private final String description;
    private final int occurrences;

    public CommonCause(String nodeId, String displayName, String nodeType, String description, int occurrences) {
        this.nodeId = nodeId;
        this.displayName = displayName;
        this.nodeType = nodeType;
        this.description = description;
        this.occurrences = occurrences;
    }
}
