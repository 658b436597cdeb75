package com.safety.analysis.service.fta;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommonCauseAnalyzer 单元测试
 */
public class CommonCauseAnalyzerTest {

    private static final Logger log = LoggerFactory.getLogger(CommonCauseAnalyzerTest.class);

    private FaultTreeModel model;
    private CommonCauseAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        model = new FaultTreeModel();
        analyzer = new CommonCauseAnalyzer();
    }

    private FaultTreeNode add(String id, String name, String type) {
        FaultTreeNode node = new FaultTreeNode(id, name, type);
        model.addNode(node);
        return node;
    }

    @Test
    @DisplayName("经由 k 条路径可达的节点计数为 k")
    void testCountEqualsPathCount() {
        FaultTreeNode top = add("top", "", "TOP EVENT");
        add("g1", "", "GATE");
        add("g2", "", "GATE");
        add("g3", "", "GATE");
        FaultTreeNode sensor = add("s", "Sensor fault", "BASIC EVENT");
        sensor.setDescription("Camera blinded");
        model.addEdge("top", "g1");
        model.addEdge("top", "g2");
        model.addEdge("g1", "g3");
        model.addEdge("g2", "g3");
        model.addEdge("g3", "s");
        model.addEdge("top", "s");

        Map<String, Integer> counts = analyzer.countOccurrences(model, top);
        log.info("计数: {}", counts);
        assertEquals(1, counts.get("top"));
        assertEquals(2, counts.get("g3"));
        assertEquals(3, counts.get("s"), "s 经 g1-g3、g2-g3 与 top 直连共三条路径");

        List<CommonCause> causes = analyzer.analyze(model, top);
        assertEquals(2, causes.size());
        assertEquals("g3", causes.get(0).getNodeId());
        assertEquals("s", causes.get(1).getNodeId());
        assertEquals("Node s: Sensor fault", causes.get(1).getDisplayName());
    }

    @Test
    @DisplayName("没有重复节点时报告正文为 None found.")
    void testNoneFound() {
        FaultTreeNode top = add("top", "", "TOP EVENT");
        add("a", "", "BASIC EVENT");
        model.addEdge("top", "a");

        String report = analyzer.buildReport(model, top);
        assertEquals("Common Causes:\nNone found.", report);
    }

    @Test
    @DisplayName("报告格式：名称、类型、次数、描述")
    void testReportFormat() {
        FaultTreeNode top = add("top", "", "TOP EVENT");
        add("g1", "", "GATE");
        add("g2", "", "GATE");
        FaultTreeNode shared = add("p", "Power loss", "BASIC EVENT");
        shared.setDescription("12V bus drops");
        model.addEdge("top", "g1");
        model.addEdge("top", "g2");
        model.addEdge("g1", "p");
        model.addEdge("g2", "p");

        String report = analyzer.buildReport(model, top);
        log.info("报告:\n{}", report);
        assertEquals("Common Causes:\n- Node p: Power loss (BASIC EVENT) occurs 2 times: 12V bus drops", report);
    }

    @Test
    @DisplayName("有环时计数能够结束")
    void testCycleSafe() {
        FaultTreeNode a = add("a", "", "GATE");
        add("b", "", "GATE");
        model.addEdge("a", "b");
        model.addEdge("b", "a");

        Map<String, Integer> counts = analyzer.countOccurrences(model, a);
        assertEquals(2, counts.get("a"), "环回到起点时记一次，但不再展开");
        assertEquals(1, counts.get("b"));
    }
}
