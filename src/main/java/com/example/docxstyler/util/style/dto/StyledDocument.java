package com.example.docxstyler.util.style.dto;

/**
 * 一次排版请求的输出：序列化后的 docx、段落数、样式使用统计
 */
public class StyledDocument {
    private final byte[] content;
    private final int paragraphCount;
    private final UsageReport usageReport;

    public StyledDocument(byte[] content, int paragraphCount, UsageReport usageReport) {
        this.content = content;
        this.paragraphCount = paragraphCount;
        this.usageReport = usageReport;
    }

    public byte[] getContent() {
        return content;
    }

    public int getParagraphCount() {
        return paragraphCount;
    }

    public UsageReport getUsageReport() {
        return usageReport;
    }
}
