package com.example.docxstyler.util.style.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 单个样式的属性集合
 *
 * 所有字段均可为空：null 表示"未设置"，应用时保持段落/Run 的默认格式不变。
 * 未识别的 JSON 字段在解析时被忽略。
 *
 * 段落级：alignment、lineSpacing、spacingBeforePt、spacingAfterPt、indentLeftCm、
 * indentHangingCm、keepWithNext、keepLinesTogether
 * Run 级：fontName、fontSizePt、bold、italic、color
 * 其余字段为描述性元数据，原样保留，不参与排版。
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StyleAttributes {

    /**
     * 空样式：不设置任何属性
     */
    public static final StyleAttributes EMPTY = StyleAttributes.builder().build();

    // ==================== Run 级属性 ====================

    @JsonProperty("font_name")
    String fontName;

    @JsonProperty("font_size_pt")
    Double fontSizePt;

    @JsonProperty("bold")
    Boolean bold;

    @JsonProperty("italic")
    Boolean italic;

    /**
     * 颜色表达式，如 "#0052A3"、"RGB(1,95,95)"、"Text 1"
     */
    @JsonProperty("color")
    String color;

    // ==================== 段落级属性 ====================

    /**
     * Left / Center / Right / Justify，其他值忽略
     */
    @JsonProperty("alignment")
    String alignment;

    /**
     * 行距倍数
     */
    @JsonProperty("line_spacing")
    Double lineSpacing;

    @JsonProperty("spacing_before_pt")
    Double spacingBeforePt;

    @JsonProperty("spacing_after_pt")
    Double spacingAfterPt;

    @JsonProperty("indent_left_cm")
    Double indentLeftCm;

    /**
     * 悬挂缩进（以负的首行缩进写入）
     */
    @JsonProperty("indent_hanging_cm")
    Double indentHangingCm;

    @JsonProperty("keep_with_next")
    Boolean keepWithNext;

    @JsonProperty("keep_lines_together")
    Boolean keepLinesTogether;

    // ==================== 元数据（不参与排版） ====================

    @JsonProperty("based_on")
    String basedOn;

    @JsonProperty("following_style")
    String followingStyle;

    @JsonProperty("numbering_level")
    Integer numberingLevel;

    @JsonProperty("numbering_pattern")
    String numberingPattern;

    @JsonProperty("bullet_level")
    Integer bulletLevel;

    @JsonProperty("bullet_alignment_cm")
    Double bulletAlignmentCm;

    @JsonProperty("widow_orphan_control")
    Boolean widowOrphanControl;

    @JsonProperty("spacing_same_paragraphs")
    Boolean spacingSameParagraphs;

    /**
     * 是否未设置任何字段
     */
    @JsonIgnore
    public boolean isEmpty() {
        return EMPTY.equals(this);
    }
}
