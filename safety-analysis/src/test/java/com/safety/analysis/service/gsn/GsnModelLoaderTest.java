package com.safety.analysis.service.gsn;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.safety.analysis.model.GsnDiagramData;
import com.safety.analysis.model.GsnModelData;
import com.safety.analysis.model.GsnNodeData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GsnModelLoader 单元测试（旧版本文件兼容）
 */
public class GsnModelLoaderTest {

    private static final Logger log = LoggerFactory.getLogger(GsnModelLoaderTest.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GsnModelLoader loader = new GsnModelLoader();

    private GsnModelData legacy;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/gsn/legacy-model.json")) {
            legacy = objectMapper.readValue(in, GsnModelData.class);
        }
    }

    @Test
    @DisplayName("同时出现在 children 和 context 中的ID只建一条 context 连接")
    void testChildrenAndContextCollapse() {
        GsnArgumentGraph graph = loader.load(legacy).getGraph();

        assertEquals(Arrays.asList("s1", "c1", "a1"), graph.getChildren("g1"));
        assertEquals(Arrays.asList("c1", "a1"), graph.getContextChildren("g1"));
        assertEquals(GsnRelation.CONTEXT, graph.getRelation("g1", "c1"));
        assertEquals(GsnRelation.SOLVED, graph.getRelation("g1", "s1"));
    }

    @Test
    @DisplayName("不合法连接静默丢弃，两个方向都不留引用")
    void testInvalidLinksDropped() {
        GsnArgumentGraph graph = loader.load(legacy).getGraph();

        // Goal 作为 context
        assertNull(graph.getRelation("g1", "g2"));
        assertTrue(graph.getParents("g2").isEmpty());
        // Assumption 的子节点
        assertTrue(graph.getChildren("a1").isEmpty());
        assertEquals(Collections.singleton("g1"), graph.getParents("s1"));
        // Context 以 solved 关系连接
        assertNull(graph.getRelation("g3", "c2"));
        assertTrue(graph.getParents("c2").isEmpty());
        // 自环与不存在的目标
        assertFalse(graph.getChildren("g1").contains("g1"));
        assertFalse(graph.getChildren("g1").contains("missing"));
    }

    @Test
    @DisplayName("只列在 Goal.children 中的 Assumption / Justification 被丢弃")
    void testSupportingNodeListedAsChildDropped() {
        GsnNodeData goal = node("g", "Goal");
        goal.setChildren(Arrays.asList("a", "j", "s"));
        GsnNodeData assumption = node("a", "Assumption");
        GsnNodeData justification = node("j", "Justification");
        GsnNodeData solution = node("s", "Solution");

        GsnDiagramData diagram = new GsnDiagramData();
        diagram.setDiagId("d");
        diagram.setRoot("g");
        diagram.setNodes(Arrays.asList(goal, assumption, justification, solution));
        GsnModelData data = new GsnModelData();
        data.setDiagrams(Collections.singletonList(diagram));

        GsnArgumentGraph graph = loader.load(data).getGraph();

        assertEquals(Collections.singletonList("s"), graph.getChildren("g"));
        assertNull(graph.getRelation("g", "a"));
        assertTrue(graph.getParents("a").isEmpty(), "被丢弃的连接在子节点一侧也不应留下引用");
        assertTrue(graph.getParents("j").isEmpty());
        assertEquals(4, graph.getNodeCount(), "节点本身仍然保留");
    }

    private static GsnNodeData node(String id, String type) {
        GsnNodeData data = new GsnNodeData();
        data.setUniqueId(id);
        data.setNodeType(type);
        return data;
    }

    @Test
    @DisplayName("多个图中的同一ID合并为一个节点，未知类型按 Goal 处理")
    void testDuplicateNodesCollapse() {
        GsnModel model = loader.load(legacy);
        GsnArgumentGraph graph = model.getGraph();

        assertEquals(10, graph.getNodeCount());
        assertEquals(GsnNodeType.GOAL, graph.getNode("x1").getNodeType());

        assertEquals(1, model.getDiagrams().size());
        assertEquals(1, model.getModules().size());
        GsnDiagram moduleDiagram = model.getModules().get(0).getDiagrams().get(0);
        assertEquals("m1", moduleDiagram.getRootId());
        assertTrue(moduleDiagram.containsNode("g1"), "同一节点可以登记在多个图中");
        assertEquals(2, model.getAllDiagrams().size());
    }

    @Test
    @DisplayName("克隆引用：有效引用保持，无效引用回退为主实例")
    void testOriginalResolution() {
        GsnArgumentGraph graph = loader.load(legacy).getGraph();

        GsnNode s2 = graph.getNode("s2");
        assertFalse(s2.isPrimaryInstance());
        assertSame(graph.getNode("s1"), graph.resolveOriginal(s2));

        GsnNode c2 = graph.getNode("c2");
        assertTrue(c2.isPrimaryInstance());
        assertNull(c2.getOriginalId());
    }

    @Test
    @DisplayName("加载后的模块名解析")
    void testModuleNameAfterLoad() {
        GsnArgumentGraph graph = loader.load(legacy).getGraph();

        assertEquals(Optional.of("Braking Module"), graph.findModuleName("s2"));
        assertEquals(Optional.empty(), graph.findModuleName("s1"));
    }

    @Test
    @DisplayName("保存：children 写全部子节点，context 写 context 子集；再次加载结果不变")
    void testSaveAndReload() throws Exception {
        GsnModelData saved = loader.save(loader.load(legacy));
        String json = objectMapper.writeValueAsString(saved);
        log.info("保存结果: {}", json);

        GsnDiagramData diagram = saved.getDiagrams().get(0);
        GsnNodeData g1 = diagram.getNodes().get(0);
        assertEquals("g1", g1.getUniqueId());
        assertEquals(Arrays.asList("s1", "c1", "a1"), g1.getChildren());
        assertEquals(Arrays.asList("c1", "a1"), g1.getContext());
        assertTrue(json.contains("\"unique_id\""));
        assertTrue(json.contains("\"diag_id\""));

        GsnModelData reloaded = objectMapper.readValue(json, GsnModelData.class);
        GsnModelData savedAgain = loader.save(loader.load(reloaded));
        assertEquals(json, objectMapper.writeValueAsString(savedAgain));
    }

    @Test
    @DisplayName("根节点无效的图改用第一个可用节点，没有可用节点的图被跳过")
    void testDiagramRootFallback() {
        GsnModelData data = new GsnModelData();

        GsnDiagramData withBadRoot = new GsnDiagramData();
        withBadRoot.setDiagId("bad-root");
        withBadRoot.setRoot("ghost");
        GsnNodeData goal = new GsnNodeData();
        goal.setUniqueId("g");
        goal.setNodeType("Goal");
        withBadRoot.setNodes(Collections.singletonList(goal));

        GsnDiagramData empty = new GsnDiagramData();
        empty.setDiagId("empty");
        empty.setRoot("ghost");

        data.setDiagrams(Arrays.asList(withBadRoot, empty));
        GsnModel model = loader.load(data);

        assertEquals(1, model.getDiagrams().size());
        assertEquals("g", model.getDiagrams().get(0).getRootId());
    }
}
