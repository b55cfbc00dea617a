package com.example.docxstyler.util.docx;

import org.apache.poi.xwpf.usermodel.XWPFDocument;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * docx 输出工具
 */
public class DocxWriter {

    public static final String CONTENT_TYPE =
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    private DocxWriter() {
    }

    /**
     * 将文档写入字节数组
     *
     * @param document 文档（调用方负责关闭）
     * @return docx 字节
     * @throws IOException 写出失败
     */
    public static byte[] toBytes(XWPFDocument document) throws IOException {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            document.write(baos);
            return baos.toByteArray();
        }
    }
}
