package com.safety.analysis.config;

import com.safety.analysis.constants.AnalysisConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 安全分析配置类
 */
@Configuration
@ConfigurationProperties(prefix = "safety-analysis")
public class SafetyAnalysisConfig {

    /**
     * 推荐表 classpath 路径
     */
    private String recommendationTable = AnalysisConstants.Recommendation.DEFAULT_TABLE_RESOURCE;

    /**
     * 中间割集数量告警阈值
     */
    private int cutSetWarnThreshold = AnalysisConstants.Limits.CUT_SET_WARN_THRESHOLD;

    /**
     * 严重度缺失时的默认值
     */
    private double defaultSeverity = AnalysisConstants.Assurance.DEFAULT_SEVERITY;

    /**
     * 可控性缺失时的默认值
     */
    private double defaultControllability = AnalysisConstants.Assurance.DEFAULT_CONTROLLABILITY;

    // Getters and Setters
    public String getRecommendationTable() {
        return recommendationTable;
    }

    public void setRecommendationTable(String recommendationTable) {
        this.recommendationTable = recommendationTable;
    }

    public int getCutSetWarnThreshold() {
        return cutSetWarnThreshold;
    }

    public void setCutSetWarnThreshold(int cutSetWarnThreshold) {
        this.cutSetWarnThreshold = cutSetWarnThreshold;
    }

    public double getDefaultSeverity() {
        return defaultSeverity;
    }

    public void setDefaultSeverity(double defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public double getDefaultControllability() {
        return defaultControllability;
    }

    public void setDefaultControllability(double defaultControllability) {
        this.defaultControllability = defaultControllability;
    }
}
