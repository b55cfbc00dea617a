package com.example.docxstyler.util.style.rule;

import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.dto.ClassifiedLine;

/**
 * 行分类规则
 *
 * 规则按顺序依次尝试，第一个命中的规则决定样式名和清洗后的文本。
 */
public interface ClassificationRule {

    /**
     * 尝试分类一行
     *
     * @param rawText 原始行
     * @param text 已归一化的行（去掉行尾换行和 BOM）
     * @param rules 当前请求的样式规则表
     * @return 命中时返回分类结果，未命中返回 null
     */
    ClassifiedLine classify(String rawText, String text, StyleRuleTable rules);
}
