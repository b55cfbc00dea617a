package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.StyleAttributes;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置默认样式表（公司文档规范）
 *
 * 调用方未提供样式表时使用。进程内唯一、不可变。
 */
final class DefaultStyleRules {

    private static final String FONT = "Century Gothic";
    private static final String BRAND_BLUE = "#0052A3";
    private static final String TEXT_1 = "Text 1";

    static final StyleRuleTable TABLE = StyleRuleTable.of(build());

    private DefaultStyleRules() {
    }

    private static Map<String, StyleAttributes> build() {
        Map<String, StyleAttributes> styles = new LinkedHashMap<>();

        styles.put(StyleNames.HEADING_1, heading(14, true, BRAND_BLUE, 1.15, 12, 1.0, 1, "%1"));
        styles.put(StyleNames.HEADING_2, heading(12, true, BRAND_BLUE, 1.15, 12, 1.02, 2, "%1.%2"));
        styles.put(StyleNames.HEADING_3, heading(11, true, BRAND_BLUE, 1.15, 8, 1.27, 3, "%1.%2.%3"));
        styles.put(StyleNames.HEADING_4, heading(9, false, "RGB(1,95,95)", 1.5, 8, 1.52, 4, "%1.%2.%3.%4"));

        styles.put(StyleNames.NORMAL, StyleAttributes.builder()
            .fontName(FONT).fontSizePt(10.0).bold(false).italic(false)
            .color(TEXT_1).alignment("Left").lineSpacing(1.0)
            .spacingBeforePt(0.0).spacingAfterPt(6.0)
            .widowOrphanControl(true)
            .followingStyle(StyleNames.NORMAL)
            .build());

        styles.put(StyleNames.LIST_PARAGRAPH_BULLET_POINTS, StyleAttributes.builder()
            .fontName(FONT).fontSizePt(10.5).bold(false).italic(false)
            .color(TEXT_1).alignment("Left").lineSpacing(1.0)
            .spacingBeforePt(0.0).spacingAfterPt(0.0)
            .indentLeftCm(1.27)
            .spacingSameParagraphs(false)
            .basedOn(StyleNames.NORMAL)
            .followingStyle(StyleNames.LIST_PARAGRAPH_BULLET_POINTS)
            .build());

        styles.put(StyleNames.NORMAL_BULLET, StyleAttributes.builder()
            .fontName(FONT).fontSizePt(10.0).bold(false).italic(false)
            .color(TEXT_1).alignment("Left").lineSpacing(1.08)
            .spacingBeforePt(8.0).spacingAfterPt(8.0)
            .indentHangingCm(0.63).indentLeftCm(1.27)
            .bulletLevel(1).bulletAlignmentCm(0.63)
            .basedOn("List Paragraph Bullet Point")
            .followingStyle(StyleNames.NORMAL_BULLET)
            .build());

        return styles;
    }

    private static StyleAttributes heading(double sizePt, boolean bold, String color, double lineSpacing,
                                           double spacingBeforePt, double hangingCm,
                                           int numberingLevel, String numberingPattern) {
        return StyleAttributes.builder()
            .fontName(FONT).fontSizePt(sizePt).bold(bold).italic(false)
            .color(color).alignment("Left").lineSpacing(lineSpacing)
            .spacingBeforePt(spacingBeforePt).spacingAfterPt(6.0)
            .keepWithNext(true).keepLinesTogether(true)
            .indentLeftCm(0.0).indentHangingCm(hangingCm)
            .numberingLevel(numberingLevel).numberingPattern(numberingPattern)
            .basedOn(StyleNames.NORMAL).followingStyle(StyleNames.NORMAL)
            .build();
    }
}
