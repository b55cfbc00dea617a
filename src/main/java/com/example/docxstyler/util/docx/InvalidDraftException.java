package com.example.docxstyler.util.docx;

/**
 * 上传的草稿文件无法读取（类型不支持或内容损坏）
 */
public class InvalidDraftException extends Exception {

    public InvalidDraftException(String message) {
        super(message);
    }

    public InvalidDraftException(String message, Throwable cause) {
        super(message, cause);
    }
}
