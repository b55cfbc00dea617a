package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.StyleAttributes;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 样式规则表：样式名 -> 样式属性
 *
 * 构建后不可变，可在并发请求间安全共享。查询不存在的样式返回空样式，不报错。
 */
public final class StyleRuleTable {

    private final Map<String, StyleAttributes> styles;

    private StyleRuleTable(Map<String, StyleAttributes> styles) {
        this.styles = styles;
    }

    /**
     * 按给定映射构建规则表（保持插入顺序），null 值视为空样式
     */
    public static StyleRuleTable of(Map<String, StyleAttributes> styles) {
        Map<String, StyleAttributes> copy = new LinkedHashMap<>();
        if (styles != null) {
            for (Map.Entry<String, StyleAttributes> entry : styles.entrySet()) {
                StyleAttributes value = entry.getValue() == null ? StyleAttributes.EMPTY : entry.getValue();
                copy.put(entry.getKey(), value);
            }
        }
        return new StyleRuleTable(Collections.unmodifiableMap(copy));
    }

    public static StyleRuleTable empty() {
        return new StyleRuleTable(Collections.<String, StyleAttributes>emptyMap());
    }

    /**
     * 内置默认规则表
     */
    public static StyleRuleTable defaults() {
        return DefaultStyleRules.TABLE;
    }

    public boolean contains(String styleName) {
        return styles.containsKey(styleName);
    }

    /**
     * 查询样式属性
     *
     * @param styleName 样式名
     * @return 样式属性，不存在时为 {@link StyleAttributes#EMPTY}
     */
    public StyleAttributes lookup(String styleName) {
        StyleAttributes style = styles.get(styleName);
        return style == null ? StyleAttributes.EMPTY : style;
    }

    /**
     * 按顺序返回第一个存在于规则表中的候选样式名，都不存在时返回最后一个候选
     *
     * @param candidates 候选样式名（至少一个）
     */
    public String firstPresent(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates must not be empty");
        }
        for (String candidate : candidates) {
            if (contains(candidate)) {
                return candidate;
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    public Set<String> styleNames() {
        return styles.keySet();
    }

    public int size() {
        return styles.size();
    }

    @JsonValue
    public Map<String, StyleAttributes> asMap() {
        return styles;
    }

    @Override
    public String toString() {
        return "StyleRuleTable" + styles.keySet();
    }
}
