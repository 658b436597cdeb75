package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 故障树分析请求：顶事件列表 + 分析起点ID（为空时取第一个顶事件）
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class FaultTreeRequest {

    @JsonProperty("top_events")
    private List<FaultTreeNodeData> topEvents = new ArrayList<>();

    @JsonProperty("root_id")
    private String rootId;
}
