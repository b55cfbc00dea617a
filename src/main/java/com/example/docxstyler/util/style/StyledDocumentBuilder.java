package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.ClassifiedLine;
import com.example.docxstyler.util.style.dto.UsageReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.util.List;

/**
 * 文档构建器
 *
 * 逐行分类 -> 追加段落 -> 应用样式 -> 计数。
 * 输出段落顺序与输入行顺序一致，不合并、不拆分。空输入得到空文档和空统计。
 */
@Slf4j
public class StyledDocumentBuilder {

    private final LineClassifier classifier;

    public StyledDocumentBuilder() {
        this(LineClassifier.standard());
    }

    public StyledDocumentBuilder(LineClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * 将所有行追加到文档
     *
     * @param document 输出文档
     * @param lines 输入行（按顺序）
     * @param rules 样式规则表
     * @return 样式使用统计
     */
    public UsageReport build(XWPFDocument document, List<String> lines, StyleRuleTable rules) {
        UsageReport report = new UsageReport();
        for (String line : lines) {
            ClassifiedLine classified = classifier.classify(line, rules);
            appendStyledParagraph(document, classified.cleanedText, classified.styleName, rules, report);
            log.debug("分类: {}", classified);
        }
        return report;
    }

    /**
     * 追加一个段落并应用样式；规则表中不存在的样式按空样式处理
     */
    public static XWPFParagraph appendStyledParagraph(XWPFDocument document, String text, String styleName,
                                                      StyleRuleTable rules, UsageReport report) {
        XWPFParagraph paragraph = document.createParagraph();
        if (text != null && !text.isEmpty()) {
            paragraph.createRun().setText(text);
        }
        ParagraphStyler.apply(paragraph, rules.lookup(styleName));
        report.increment(styleName);
        return paragraph;
    }
}
