package com.example.docxstyler.util.style;

/**
 * 分类器使用的样式名
 */
public final class StyleNames {

    public static final String HEADING_1 = "Heading 1";
    public static final String HEADING_2 = "Heading 2";
    public static final String HEADING_3 = "Heading 3";
    public static final String HEADING_4 = "Heading 4";
    public static final String NORMAL = "Normal";
    public static final String NORMAL_BULLET = "Normal Bullet";
    public static final String LIST_PARAGRAPH_BULLET_POINTS = "List Paragraph Bullet Points";

    private StyleNames() {
    }

    /**
     * 第 level 级标题的样式名（1-4）
     */
    public static String heading(int level) {
        return "Heading " + level;
    }
}
