package com.example.docxstyler.util.style;

/**
 * 调用方提供的样式表无法解析或结构不合法
 */
public class InvalidStyleMapException extends Exception {

    public InvalidStyleMapException(String message) {
        super(message);
    }

    public InvalidStyleMapException(String message, Throwable cause) {
        super(message, cause);
    }
}
