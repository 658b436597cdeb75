package com.safety.analysis.service.gsn;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * GSN 模型：共享节点图 + 顶层图 + 模块包
 *
 * 节点在所有图之间共享同一个 {@link GsnArgumentGraph}，同一节点可以登记在多个图中。
 */
@Getter
public class GsnModel {
    private final GsnArgumentGraph graph;
    private final List<GsnDiagram> diagrams = new ArrayList<>();
    private final List<GsnModule> modules = new ArrayList<>();

    public GsnModel() {
        this(new GsnArgumentGraph());
    }

    public GsnModel(GsnArgumentGraph graph) {
        this.graph = graph;
    }

    /**
     * 所有图（顶层图在前，随后按模块深度优先）
     */
    public List<GsnDiagram> getAllDiagrams() {
        List<GsnDiagram> result = new ArrayList<>(diagrams);
        for (GsnModule module : modules) {
            collect(module, result);
        }
        return result;
    }

    private void collect(GsnModule module, List<GsnDiagram> result) {
        result.addAll(module.getDiagrams());
        for (GsnModule sub : module.getModules()) {
            collect(sub, result);
        }
    }
}
