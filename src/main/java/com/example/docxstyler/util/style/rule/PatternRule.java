package com.example.docxstyler.util.style.rule;

import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.TextUtils;
import com.example.docxstyler.util.style.dto.ClassifiedLine;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 正则规则：行首匹配时命中，去掉匹配到的部分后 trim
 *
 * 用于编号列表识别，如 "1. "、"2) "、"a. "、"B) "。
 */
public class PatternRule implements ClassificationRule {

    private final String styleName;
    private final Pattern pattern;

    public PatternRule(String styleName, Pattern pattern) {
        this.styleName = styleName;
        this.pattern = pattern;
    }

    @Override
    public ClassifiedLine classify(String rawText, String text, StyleRuleTable rules) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.lookingAt()) {
            return null;
        }
        return new ClassifiedLine(rawText, styleName, TextUtils.strip(text.substring(matcher.end())));
    }

    @Override
    public String toString() {
        return "PatternRule{" + styleName + " /" + pattern.pattern() + "/}";
    }
}
