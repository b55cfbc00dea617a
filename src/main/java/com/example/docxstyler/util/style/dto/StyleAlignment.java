package com.example.docxstyler.util.style.dto;

import org.apache.poi.xwpf.usermodel.ParagraphAlignment;

/**
 * 样式表中允许的段落对齐方式
 */
public enum StyleAlignment {

    LEFT("Left", ParagraphAlignment.LEFT),
    CENTER("Center", ParagraphAlignment.CENTER),
    RIGHT("Right", ParagraphAlignment.RIGHT),
    JUSTIFY("Justify", ParagraphAlignment.BOTH);

    private final String label;
    private final ParagraphAlignment paragraphAlignment;

    StyleAlignment(String label, ParagraphAlignment paragraphAlignment) {
        this.label = label;
        this.paragraphAlignment = paragraphAlignment;
    }

    public ParagraphAlignment getParagraphAlignment() {
        return paragraphAlignment;
    }

    /**
     * 按样式表中的名称查找（区分大小写）
     *
     * @param label 如 "Left"、"Justify"
     * @return 对应的对齐方式，未识别时返回 null
     */
    public static StyleAlignment fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (StyleAlignment alignment : values()) {
            if (alignment.label.equals(label)) {
                return alignment;
            }
        }
        return null;
    }
}
