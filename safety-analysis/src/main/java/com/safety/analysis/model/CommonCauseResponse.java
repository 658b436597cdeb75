package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.safety.analysis.service.fta.CommonCause;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 共因分析结果
 */
@Getter
@Setter
public class CommonCauseResponse {

    @JsonProperty("root_id")
    private String rootId;

    private List<CommonCause> causes = new ArrayList<>();

    /** 多行文本报告 */
    private String report;
}
