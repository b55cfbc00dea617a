package com.example.docxstyler.util.style.rule;

import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.TextUtils;
import com.example.docxstyler.util.style.dto.ClassifiedLine;

import java.util.Collections;
import java.util.List;

/**
 * 项目符号规则：行以任一符号标记开头时命中
 *
 * 去掉行首两个字符（符号 + 空格）后 trim。样式名取候选列表中第一个存在于规则表的样式，
 * 都不存在时取最后一个候选，这样不完整的样式表也能得到可用的列表样式。
 */
public class BulletRule implements ClassificationRule {

    private static final int MARKER_LENGTH = 2;

    private final List<String> markers;
    private final List<String> candidateStyles;

    public BulletRule(List<String> markers, List<String> candidateStyles) {
        if (candidateStyles.isEmpty()) {
            throw new IllegalArgumentException("candidateStyles must not be empty");
        }
        this.markers = Collections.unmodifiableList(markers);
        this.candidateStyles = Collections.unmodifiableList(candidateStyles);
    }

    @Override
    public ClassifiedLine classify(String rawText, String text, StyleRuleTable rules) {
        for (String marker : markers) {
            if (text.startsWith(marker)) {
                String clean = text.length() >= MARKER_LENGTH ? TextUtils.strip(text.substring(MARKER_LENGTH)) : "";
                return new ClassifiedLine(rawText, rules.firstPresent(candidateStyles), clean);
            }
        }
        return null;
    }

    public List<String> getCandidateStyles() {
        return candidateStyles;
    }

    @Override
    public String toString() {
        return "BulletRule{" + markers + " -> " + candidateStyles + "}";
    }
}
