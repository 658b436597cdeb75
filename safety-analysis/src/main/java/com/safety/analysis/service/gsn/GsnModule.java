package com.safety.analysis.service.gsn;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * GSN 模块包：包含若干图和子模块
 */
@Getter
@Setter
public class GsnModule {
    private String name;
    private List<GsnDiagram> diagrams = new ArrayList<>();
    private List<GsnModule> modules = new ArrayList<>();

    public GsnModule() {
    }

    public GsnModule(String name) {
        this.name = name;
    }
}
