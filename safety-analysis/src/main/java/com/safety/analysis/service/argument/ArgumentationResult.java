package com.safety.analysis.service.argument;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 论证生成结果
 */
@Getter
public class ArgumentationResult {
    private final String nodeId;
    private final int level;
    private final String levelText;
    private final double severity;
    private final double controllability;
    private final List<Set<String>> cutSets;
    private final String text;

    public ArgumentationResult(String nodeId, int level, String levelText, double severity,
                               double controllability, List<Set<String>> cutSets, String text) {
        this.nodeId = nodeId;
        this.level = level;
        this.levelText = levelText;
        this.severity = severity;
        this.controllability = controllability;
        this.cutSets = Collections.unmodifiableList(cutSets);
        this.text = text;
    }
}
