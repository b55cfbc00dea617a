package com.example.docxstyler.service;

import com.example.docxstyler.util.docx.DocxWriter;
import com.example.docxstyler.util.docx.DraftReader;
import com.example.docxstyler.util.docx.InvalidDraftException;
import com.example.docxstyler.util.style.InvalidStyleMapException;
import com.example.docxstyler.util.style.StyleMapParser;
import com.example.docxstyler.util.style.StyleRuleTable;
import com.example.docxstyler.util.style.StyledDocumentBuilder;
import com.example.docxstyler.util.style.dto.StyledDocument;
import com.example.docxstyler.util.style.dto.UsageReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * 文档排版服务
 *
 * 一次请求的完整流程：
 * 1. 确定样式表（调用方提供的 JSON 或内置默认表）
 * 2. 读取草稿为文本行（.txt / .docx）
 * 3. 逐行分类并应用样式，统计样式使用次数
 * 4. 序列化为 docx
 *
 * 每次请求单独构建样式表和统计，不共享可变状态。
 */
@Slf4j
@Service
public class DocxStyleService {

    private final StyledDocumentBuilder documentBuilder = new StyledDocumentBuilder();

    /**
     * 对草稿排版
     *
     * @param filename 草稿文件名（.txt 或 .docx）
     * @param data 草稿内容
     * @param styleMapJson 调用方样式表 JSON，为空时使用内置默认表
     * @return 排版结果
     * @throws InvalidStyleMapException 样式表不合法
     * @throws InvalidDraftException 草稿类型不支持或无法解析
     * @throws IOException docx 写出失败
     */
    public StyledDocument format(String filename, byte[] data, String styleMapJson)
            throws InvalidStyleMapException, InvalidDraftException, IOException {

        StyleRuleTable rules = resolveRules(styleMapJson);
        List<String> lines = DraftReader.readLines(filename, data);
        log.info("开始排版: file={}, 行数={}, 样式数={}", filename, lines.size(), rules.size());

        try (XWPFDocument document = new XWPFDocument()) {
            UsageReport report = documentBuilder.build(document, lines, rules);
            byte[] content = DocxWriter.toBytes(document);
            log.info("排版完成: file={}, 段落数={}, 样式统计={}", filename, document.getParagraphs().size(), report);
            return new StyledDocument(content, document.getParagraphs().size(), report);
        }
    }

    /**
     * 内置默认样式表
     */
    public StyleRuleTable defaultRules() {
        return StyleRuleTable.defaults();
    }

    private StyleRuleTable resolveRules(String styleMapJson) throws InvalidStyleMapException {
        if (styleMapJson == null || styleMapJson.trim().isEmpty()) {
            return StyleRuleTable.defaults();
        }
        StyleRuleTable rules = StyleMapParser.parse(styleMapJson);
        log.info("使用调用方样式表: {}", rules.styleNames());
        return rules;
    }
}
