package com.safety.analysis.constants;

import java.util.Arrays;
import java.util.List;

/**
 * 安全分析相关常量定义
 */
public final class AnalysisConstants {

    private AnalysisConstants() {
        // 工具类，防止实例化
    }

    /**
     * 推荐表类别
     */
    public static final class Recommendation {
        private Recommendation() {}

        public static final String TESTING_REQUIREMENTS = "Testing Requirements";
        public static final String IFTD_RESPONSIBILITIES = "IFTD Responsibilities";
        public static final String PREVENTIVE_MAINTENANCE = "Preventive Maintenance Actions";
        public static final String AVSC_GUIDELINES = "Relevant AVSC Guidelines";
        public static final String EXTRA_RECOMMENDATIONS = "Extra Recommendations";

        /** 论证文本中按此顺序输出的类别 */
        public static final List<String> ORDERED_CATEGORIES = Arrays.asList(
            TESTING_REQUIREMENTS,
            IFTD_RESPONSIBILITIES,
            PREVENTIVE_MAINTENANCE,
            AVSC_GUIDELINES
        );

        /** 推荐表默认资源路径 */
        public static final String DEFAULT_TABLE_RESOURCE = "recommendations.json";
    }

    /**
     * 保证等级相关常量
     */
    public static final class Assurance {
        private Assurance() {}

        public static final int MIN_LEVEL = 1;
        public static final int MAX_LEVEL = 5;

        /** 严重度 / 可控性缺失或无法解析时的默认值 */
        public static final double DEFAULT_SEVERITY = 3.0;
        public static final double DEFAULT_CONTROLLABILITY = 3.0;

        public static final String PAL_TITLE = "Prototype Assurance Level (PAL)";
    }

    /**
     * 割集计算限制
     */
    public static final class Limits {
        private Limits() {}

        /** 中间割集数量超过该值时打印告警（不截断） */
        public static final int CUT_SET_WARN_THRESHOLD = 10000;
    }

    /**
     * 报告文本
     */
    public static final class Report {
        private Report() {}

        public static final String COMMON_CAUSE_HEADER = "Common Causes:";
        public static final String NONE_FOUND = "None found.";
        public static final String SEE_ABOVE = "(see above)";
    }
}
