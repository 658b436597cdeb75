package com.safety.analysis.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * REST 接口测试（完整 Spring 上下文，推荐表从 classpath 加载）
 */
@SpringBootTest
@AutoConfigureMockMvc
public class SafetyAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static String resource(String path) throws IOException {
        return StreamUtils.copyToString(new ClassPathResource(path).getInputStream(), StandardCharsets.UTF_8);
    }

    private static String faultTreeRequest(String rootId) throws IOException {
        String rootPart = rootId != null ? ",\"root_id\":\"" + rootId + "\"" : "";
        return "{\"top_events\":" + resource("fta/brake-tree.json") + rootPart + "}";
    }

    @Test
    @DisplayName("POST /api/fta/cut-sets 返回割集ID与显示名")
    void testCutSets() throws Exception {
        mockMvc.perform(post("/api/fta/cut-sets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(faultTreeRequest(null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.root_id").value("1"))
                .andExpect(jsonPath("$.cut_sets", hasSize(2)))
                .andExpect(jsonPath("$.cut_sets[0]", contains("3", "6", "7")))
                .andExpect(jsonPath("$.cut_set_names[1][0]").value("Node 4: Software fault"));
    }

    @Test
    @DisplayName("POST /api/fta/common-causes 返回共因与报告")
    void testCommonCauses() throws Exception {
        mockMvc.perform(post("/api/fta/common-causes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(faultTreeRequest("1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.causes", hasSize(1)))
                .andExpect(jsonPath("$.causes[0].node_id").value("3"))
                .andExpect(jsonPath("$.causes[0].occurrences").value(2))
                .andExpect(jsonPath("$.report", startsWith("Common Causes:")));
    }

    @Test
    @DisplayName("POST /api/fta/argumentation?format=HTML")
    void testArgumentation() throws Exception {
        mockMvc.perform(post("/api/fta/argumentation")
                        .param("format", "html")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(faultTreeRequest(null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.level").value(4))
                .andExpect(jsonPath("$.level_text").value("PAL4"))
                .andExpect(jsonPath("$.format").value("HTML"))
                .andExpect(jsonPath("$.text", containsString("<b>Severity:</b> 2.0<br/>")));
    }

    @Test
    @DisplayName("顶事件为空返回 400")
    void testEmptyTopEvents() throws Exception {
        mockMvc.perform(post("/api/fta/cut-sets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"top_events\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad request"))
                .andExpect(jsonPath("$.message").value("top_events must not be empty"));
    }

    @Test
    @DisplayName("起点不存在返回 400")
    void testUnknownRoot() throws Exception {
        mockMvc.perform(post("/api/fta/cut-sets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(faultTreeRequest("nope")))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /api/gsn/normalize 丢弃不合法连接")
    void testGsnNormalize() throws Exception {
        mockMvc.perform(post("/api/gsn/normalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(resource("gsn/legacy-model.json")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.diagrams[0].root").value("g1"))
                .andExpect(jsonPath("$.diagrams[0].nodes[0].children", not(hasItem("missing"))))
                .andExpect(jsonPath("$.modules[0].name").value("Braking"));
    }

    @Test
    @DisplayName("POST /api/gsn/module-name")
    void testModuleName() throws Exception {
        String body = "{\"model\":" + resource("gsn/legacy-model.json") + ",\"node_id\":\"g3\"}";
        mockMvc.perform(post("/api/gsn/module-name")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.node_id").value("g3"))
                .andExpect(jsonPath("$.module_name").value("Braking Module"));
    }

    @Test
    @DisplayName("模块名查询缺少 node_id 返回 400")
    void testModuleNameMissingNodeId() throws Exception {
        mockMvc.perform(post("/api/gsn/module-name")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"model\":{\"diagrams\":[],\"modules\":[]}}"))
                .andExpect(status().isBadRequest());
    }
}
