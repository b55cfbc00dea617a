package com.example.docxstyler.util.style.rule;

import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.TextUtils;
import com.example.docxstyler.util.style.dto.ClassifiedLine;

import java.util.Collections;
import java.util.List;

/**
 * 前缀规则：行以任一前缀开头时命中，去掉前缀后 trim
 *
 * 用于标题识别，如 "H1:" / "# "。
 */
public class PrefixRule implements ClassificationRule {

    private final String styleName;
    private final List<String> prefixes;

    public PrefixRule(String styleName, List<String> prefixes) {
        this.styleName = styleName;
        this.prefixes = Collections.unmodifiableList(prefixes);
    }

    @Override
    public ClassifiedLine classify(String rawText, String text, StyleRuleTable rules) {
        for (String prefix : prefixes) {
            if (text.startsWith(prefix)) {
                return new ClassifiedLine(rawText, styleName, TextUtils.strip(text.substring(prefix.length())));
            }
        }
        return null;
    }

    public String getStyleName() {
        return styleName;
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    @Override
    public String toString() {
        return "PrefixRule{" + styleName + " " + prefixes + "}";
    }
}
