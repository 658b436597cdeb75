package com.safety.analysis.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AssuranceLevels 单元测试
 */
public class AssuranceLevelsTest {

    @Test
    @DisplayName("阈值边界：4.5/3.5/2.5/1.5")
    void testThresholds() {
        assertEquals(5, AssuranceLevels.discretize(4.5));
        assertEquals(4, AssuranceLevels.discretize(4.49));
        assertEquals(4, AssuranceLevels.discretize(3.5));
        assertEquals(3, AssuranceLevels.discretize(2.5));
        assertEquals(2, AssuranceLevels.discretize(1.5));
        assertEquals(1, AssuranceLevels.discretize(1.49));
        assertEquals(1, AssuranceLevels.discretize(-3.0));
        assertEquals(5, AssuranceLevels.discretize(99.0));
    }

    @Test
    @DisplayName("原始值：字符串可解析，缺失或非数字为等级1")
    void testRawValues() {
        assertEquals(3, AssuranceLevels.discretize((Object) "2.7"));
        assertEquals(1, AssuranceLevels.discretize((Object) null));
        assertEquals(1, AssuranceLevels.discretize((Object) "high"));
        assertEquals(1, AssuranceLevels.discretize((Object) Double.NaN));
    }

    @Test
    @DisplayName("等级文本与指标描述")
    void testTexts() {
        assertEquals("PAL3", AssuranceLevels.assuranceLevelText(3));
        assertEquals("PAL1", AssuranceLevels.assuranceLevelText(0));
        assertEquals("PAL5", AssuranceLevels.assuranceLevelText(9));

        assertEquals("High confidence", AssuranceLevels.metricToText("confidence", 4.0));
        assertEquals("Very poor confidence", AssuranceLevels.metricToText("confidence", "n/a"));
        assertEquals("Moderate Safety Load", AssuranceLevels.metricToText("robustness", 3));
    }
}
