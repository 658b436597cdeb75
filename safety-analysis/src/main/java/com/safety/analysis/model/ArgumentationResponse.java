package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

/**
 * 论证文本生成结果
 */
@Getter
@Setter
public class ArgumentationResponse {

    @JsonProperty("node_id")
    private String nodeId;

    private int level;

    @JsonProperty("level_text")
    private String levelText;

    private String format;

    private String text;

    /** 层级论证（缩进树） */
    private String hierarchy;
}
