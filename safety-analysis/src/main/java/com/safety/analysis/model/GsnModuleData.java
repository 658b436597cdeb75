package com.safety.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * GSN 模块包持久化结构
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class GsnModuleData {
    private String name;
    private List<GsnDiagramData> diagrams = new ArrayList<>();
    private List<GsnModuleData> modules = new ArrayList<>();

    public void setDiagrams(List<GsnDiagramData> diagrams) {
        this.diagrams = diagrams != null ? diagrams : new ArrayList<>();
    }

    public void setModules(List<GsnModuleData> modules) {
        this.modules = modules != null ? modules : new ArrayList<>();
    }
}
