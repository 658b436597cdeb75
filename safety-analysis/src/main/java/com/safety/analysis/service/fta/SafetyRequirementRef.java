package com.safety.analysis.service.fta;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 节点引用的安全需求
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SafetyRequirementRef {
    private String id;

    @JsonProperty("req_type")
    private String reqType;

    private String text;

    public SafetyRequirementRef(String id, String reqType, String text) {
        this.id = id;
        this.reqType = reqType;
        this.text = text;
    }
}
