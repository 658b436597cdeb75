package com.safety.analysis.controller;

import com.safety.analysis.model.ArgumentationResponse;
import com.safety.analysis.model.CommonCauseResponse;
import com.safety.analysis.model.CutSetResponse;
import com.safety.analysis.model.FaultTreeRequest;
import com.safety.analysis.service.argument.TextFormat;
import com.safety.analysis.service.impl.SafetyAnalysisServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

/**
 * 故障树分析REST API控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/fta")
public class FaultTreeAnalysisController {

    @Autowired
    private SafetyAnalysisServiceImpl safetyAnalysisService;

    /**
     * 计算割集
     *
     * @param request 顶事件列表 + 分析起点
     * @return 割集（ID 与显示名）
     */
    @PostMapping("/cut-sets")
    public CutSetResponse calculateCutSets(@RequestBody FaultTreeRequest request) {
        log.info("收到割集计算请求, rootId={}", request.getRootId());
        validate(request);
        return safetyAnalysisService.calculateCutSets(request);
    }

    /**
     * 共因分析
     */
    @PostMapping("/common-causes")
    public CommonCauseResponse analyzeCommonCauses(@RequestBody FaultTreeRequest request) {
        log.info("收到共因分析请求, rootId={}", request.getRootId());
        validate(request);
        return safetyAnalysisService.analyzeCommonCauses(request);
    }

    /**
     * 生成论证文本
     *
     * @param format PLAIN 或 HTML，默认 PLAIN
     */
    @PostMapping("/argumentation")
    public ArgumentationResponse generateArgumentation(
            @RequestBody FaultTreeRequest request,
            @RequestParam(value = "format", required = false) String format) {
        log.info("收到论证生成请求, rootId={}, format={}", request.getRootId(), format);
        validate(request);
        return safetyAnalysisService.generateArgumentation(request, TextFormat.parse(format));
    }

    private void validate(FaultTreeRequest request) {
        if (request.getTopEvents() == null || request.getTopEvents().isEmpty()) {
            log.error("【输入验证失败】-> 顶事件列表为空");
            throw new IllegalArgumentException("top_events must not be empty");
        }
    }
}
