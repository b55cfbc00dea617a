package com.example.docxstyler.util.style.dto;

import java.util.Objects;

/**
 * 单行分类结果：原始文本、样式名、清洗后的文本
 */
public class ClassifiedLine {
    public final String rawText;
    public final String styleName;
    public final String cleanedText;

    public ClassifiedLine(String rawText, String styleName, String cleanedText) {
        this.rawText = rawText;
        this.styleName = styleName;
        this.cleanedText = cleanedText;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClassifiedLine)) return false;
        ClassifiedLine that = (ClassifiedLine) o;
        return Objects.equals(rawText, that.rawText)
                && Objects.equals(styleName, that.styleName)
                && Objects.equals(cleanedText, that.cleanedText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawText, styleName, cleanedText);
    }

    @Override
    public String toString() {
        return "ClassifiedLine{style='" + styleName + "', text='" + cleanedText + "'}";
    }
}
