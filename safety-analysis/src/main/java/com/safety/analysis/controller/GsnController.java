package com.safety.analysis.controller;

import com.safety.analysis.model.GsnModelData;
import com.safety.analysis.model.ModuleNameRequest;
import com.safety.analysis.model.ModuleNameResponse;
import com.safety.analysis.service.impl.SafetyAnalysisServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

/**
 * GSN 模型REST API控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/gsn")
public class GsnController {

    @Autowired
    private SafetyAnalysisServiceImpl safetyAnalysisService;

    /**
     * 按兼容规则加载并重新序列化 GSN 模型（合并重复节点、丢弃不合法连接）
     */
    @PostMapping("/normalize")
    public GsnModelData normalize(@RequestBody GsnModelData model) {
        log.info("收到GSN模型规范化请求, 顶层图数={}, 模块数={}",
                model.getDiagrams().size(), model.getModules().size());
        return safetyAnalysisService.normalizeGsnModel(model);
    }

    /**
     * 查询节点所在模块名
     */
    @PostMapping("/module-name")
    public ModuleNameResponse findModuleName(@RequestBody ModuleNameRequest request) {
        log.info("收到模块名查询请求, nodeId={}", request.getNodeId());
        if (request.getModel() == null) {
            log.error("【输入验证失败】-> GSN模型为空");
            throw new IllegalArgumentException("model must not be null");
        }
        if (request.getNodeId() == null || request.getNodeId().isEmpty()) {
            log.error("【输入验证失败】-> nodeId为空");
            throw new IllegalArgumentException("node_id must not be empty");
        }
        return safetyAnalysisService.findModuleName(request);
    }
}
