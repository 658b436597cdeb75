package com.safety.analysis.util;

/**
 * 风险 / CAL 查表时遇到表中不存在的组合
 */
public class UnsupportedRatingException extends IllegalArgumentException {

    private final String table;
    private final String key;

    public UnsupportedRatingException(String table, String key) {
        super("Unsupported " + table + " lookup: " + key);
        this.table = table;
        this.key = key;
    }

    public String getTable() {
        return table;
    }

    public String getKey() {
        return key;
    }
}
