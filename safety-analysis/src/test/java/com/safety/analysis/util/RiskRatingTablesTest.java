package com.safety.analysis.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RiskRatingTables 单元测试
 */
public class RiskRatingTablesTest {

    @Test
    @DisplayName("风险等级查表")
    void testRiskLevel() {
        assertEquals("High", RiskRatingTables.riskLevel("High", "Major"));
        assertEquals("Medium", RiskRatingTables.riskLevel("Medium", "Major"));
        assertEquals("Medium", RiskRatingTables.riskLevel("Low", "Severe"));
        assertEquals("Low", RiskRatingTables.riskLevel("High", "Negligible"));
    }

    @Test
    @DisplayName("不支持的风险组合抛出 UnsupportedRatingException")
    void testRiskLevelUnsupported() {
        UnsupportedRatingException ex = assertThrows(UnsupportedRatingException.class,
                () -> RiskRatingTables.riskLevel("Very High", "Major"));
        assertEquals("Very High/Major", ex.getKey());
        assertTrue(ex instanceof IllegalArgumentException);
    }

    @Test
    @DisplayName("CAL：攻击向量归并，Negligible 没有对应列")
    void testCal() {
        assertEquals("CAL2", RiskRatingTables.cal("Physical", "Severe"));
        assertEquals("CAL1", RiskRatingTables.cal("Local", "Moderate"));
        assertEquals("CAL2", RiskRatingTables.cal("Adjacent", "Major"));
        assertEquals("CAL4", RiskRatingTables.cal("Network", "Severe"));
        assertEquals("CAL3", RiskRatingTables.cal(null, "Major"));

        UnsupportedRatingException ex = assertThrows(UnsupportedRatingException.class,
                () -> RiskRatingTables.cal("Network", "Negligible"));
        assertEquals("CAL", ex.getTable());
    }

    @Test
    @DisplayName("总体影响取最高值")
    void testOverallImpact() {
        assertEquals("Major", RiskRatingTables.overallImpact("Moderate", "Major", "Negligible"));
        assertEquals("Severe", RiskRatingTables.overallImpact("Severe", "Major"));
        assertEquals("Negligible", RiskRatingTables.overallImpact("unknown"));
    }

    @Test
    @DisplayName("ASIL 风险图")
    void testAsil() {
        assertEquals("D", RiskRatingTables.asil(3, 3, 4));
        assertEquals("A", RiskRatingTables.asil(1, 2, 4));
        assertEquals("QM", RiskRatingTables.asil(1, 1, 4));
        assertEquals("QM", RiskRatingTables.asil(0, 3, 4), "未定义的组合为 QM");
    }

    @Test
    @DisplayName("验证目标推导")
    void testValidationTarget() {
        double target = RiskRatingTables.deriveValidationTarget(1e-8, 0.05, 0.1, 0.01);
        assertEquals(2e-4, target, 1e-12);

        double fromRatings = RiskRatingTables.validationTargetFromRatings(1e-8, 4, 3, 3);
        assertEquals(1e-8 / (1e-1 * 1e-1 * 1e-1), fromRatings, 1e-15);

        assertThrows(IllegalArgumentException.class,
                () -> RiskRatingTables.deriveValidationTarget(1e-8, 0.0, 0.1, 0.01));
    }
}
