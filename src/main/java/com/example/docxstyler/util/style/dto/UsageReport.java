package com.example.docxstyler.util.style.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 样式使用统计：样式名 -> 使用次数
 *
 * 按样式首次出现的顺序保存，只增不减。每个请求一个实例，不跨请求共享。
 */
public class UsageReport {

    private final Map<String, Integer> counters = new LinkedHashMap<>();

    public void increment(String styleName) {
        counters.merge(styleName, 1, Integer::sum);
    }

    public int count(String styleName) {
        return counters.getOrDefault(styleName, 0);
    }

    /**
     * 所有样式的计数之和，等于处理过的行数
     */
    public int total() {
        int sum = 0;
        for (int c : counters.values()) {
            sum += c;
        }
        return sum;
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    @JsonValue
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(counters);
    }

    @Override
    public String toString() {
        return counters.toString();
    }
}
