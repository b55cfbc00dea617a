package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.StyleAlignment;
import com.example.docxstyler.util.style.dto.StyleAttributes;
import org.apache.poi.xwpf.usermodel.LineSpacingRule;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;

import java.util.Collections;
import java.util.List;

/**
 * 将样式属性应用到段落及其 Run
 *
 * 每个属性独立应用，只处理已设置（非 null）的字段。
 * 无状态，不会拒绝任何样式记录。
 */
public class ParagraphStyler {

    private ParagraphStyler() {
    }

    /**
     * 应用样式到段落
     *
     * @param paragraph 目标段落
     * @param style 样式属性，null 视为空样式
     */
    public static void apply(XWPFParagraph paragraph, StyleAttributes style) {
        if (style == null) {
            style = StyleAttributes.EMPTY;
        }
        applyParagraphFormat(paragraph, style);

        for (XWPFRun run : runsOf(paragraph)) {
            applyRunFormat(run, style);
        }
    }

    // ==================== 段落级 ====================

    private static void applyParagraphFormat(XWPFParagraph paragraph, StyleAttributes style) {
        StyleAlignment alignment = StyleAlignment.fromLabel(style.getAlignment());
        if (alignment != null) {
            paragraph.setAlignment(alignment.getParagraphAlignment());
        }

        if (style.getLineSpacing() != null) {
            paragraph.setSpacingBetween(style.getLineSpacing(), LineSpacingRule.AUTO);
        }
        if (style.getSpacingBeforePt() != null) {
            paragraph.setSpacingBefore(Measurements.pointsToTwips(style.getSpacingBeforePt()));
        }
        if (style.getSpacingAfterPt() != null) {
            paragraph.setSpacingAfter(Measurements.pointsToTwips(style.getSpacingAfterPt()));
        }
        if (style.getIndentLeftCm() != null) {
            paragraph.setIndentationLeft(Measurements.centimetersToTwips(style.getIndentLeftCm()));
        }
        if (style.getIndentHangingCm() != null) {
            setFirstLineIndent(paragraph, -Measurements.centimetersToTwips(style.getIndentHangingCm()));
        }

        // 只设置，不清除
        if (Boolean.TRUE.equals(style.getKeepWithNext())) {
            CTPPr pPr = paragraphProperties(paragraph);
            if (!pPr.isSetKeepNext()) {
                pPr.addNewKeepNext();
            }
        }
        if (Boolean.TRUE.equals(style.getKeepLinesTogether())) {
            CTPPr pPr = paragraphProperties(paragraph);
            if (!pPr.isSetKeepLines()) {
                pPr.addNewKeepLines();
            }
        }
    }

    /**
     * 首行缩进：负值在 OOXML 中写作 w:hanging
     */
    private static void setFirstLineIndent(XWPFParagraph paragraph, int twips) {
        if (twips < 0) {
            paragraph.setIndentationHanging(-twips);
        } else {
            paragraph.setIndentationFirstLine(twips);
        }
    }

    private static CTPPr paragraphProperties(XWPFParagraph paragraph) {
        CTP ctp = paragraph.getCTP();
        return ctp.isSetPPr() ? ctp.getPPr() : ctp.addNewPPr();
    }

    // ==================== Run 级 ====================

    /**
     * 段落没有 Run 时先创建一个空 Run，保证字体属性有挂载点
     */
    private static List<XWPFRun> runsOf(XWPFParagraph paragraph) {
        List<XWPFRun> runs = paragraph.getRuns();
        if (runs == null || runs.isEmpty()) {
            return Collections.singletonList(paragraph.createRun());
        }
        return runs;
    }

    private static void applyRunFormat(XWPFRun run, StyleAttributes style) {
        if (style.getFontName() != null) {
            run.setFontFamily(style.getFontName());
        }
        if (style.getFontSizePt() != null) {
            run.setFontSize(style.getFontSizePt());
        }
        if (style.getBold() != null) {
            run.setBold(style.getBold());
        }
        if (style.getItalic() != null) {
            run.setItalic(style.getItalic());
        }
        if (style.getColor() != null) {
            run.setColor(ColorResolver.resolve(style.getColor()).toHex());
        }
    }
}
