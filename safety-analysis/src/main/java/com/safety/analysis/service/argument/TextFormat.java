package com.safety.analysis.service.argument;

import java.util.List;

/**
 * 论证文本输出格式
 */
public enum TextFormat {
    /** 纯文本，换行分隔 */
    PLAIN,
    /** 轻量 HTML 标记（b / br / ul / li） */
    HTML;

    /**
     * 解析格式参数，空值或无法识别时为 PLAIN
     */
    public static TextFormat parse(String raw) {
        if (raw != null && "HTML".equalsIgnoreCase(raw.trim())) {
            return HTML;
        }
        return PLAIN;
    }

    String heading(String text) {
        return this == HTML ? "<b>" + escape(text) + "</b><br/>" : text;
    }

    String line(String text) {
        return this == HTML ? escape(text) + "<br/>" : text;
    }

    String labeled(String label, String value) {
        return this == HTML ? "<b>" + escape(label) + ":</b> " + escape(value) + "<br/>" : label + ": " + value;
    }

    String list(List<String> items) {
        StringBuilder sb = new StringBuilder();
        if (this == HTML) {
            sb.append("<ul>");
            for (String item : items) {
                sb.append("<li>").append(escape(item)).append("</li>");
            }
            sb.append("</ul>");
            return sb.toString();
        }
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(items.get(i));
        }
        return sb.toString();
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
