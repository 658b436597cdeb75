package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 割集计算结果：ID 形式与显示名形式一一对应
 */
@Getter
@Setter
public class CutSetResponse {

    @JsonProperty("root_id")
    private String rootId;

    @JsonProperty("cut_sets")
    private List<List<String>> cutSets = new ArrayList<>();

    @JsonProperty("cut_set_names")
    private List<List<String>> cutSetNames = new ArrayList<>();
}
