package com.example.docxstyler.util.style;

/**
 * 文本处理工具类
 */
public class TextUtils {

    private TextUtils() {
    }

    /**
     * 去掉首尾空白
     *
     * 空白字符集比 {@link String#trim()} 宽：除 ASCII 控制空白外，还包括
     * 不间断空格 U+00A0 / U+202F、NEL U+0085、U+2000 到 U+200A、全角空格 U+3000 等。
     * 从 docx 复制出来的文本经常带不间断空格。
     *
     * @param text 原始文本，可为 null
     * @return 去掉首尾空白后的文本
     */
    public static String strip(String text) {
        if (text == null) {
            return "";
        }
        int start = 0;
        int end = text.length();
        while (start < end && isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * 是否为空白字符
     */
    public static boolean isWhitespace(char ch) {
        if (ch >= '\t' && ch <= '\r') {
            return true;
        }
        if (ch >= 0x1C && ch <= 0x20) {
            return true;
        }
        switch (ch) {
            case 0x85:
            case 0xA0:
            case 0x1680:
            case 0x2028:
            case 0x2029:
            case 0x202F:
            case 0x205F:
            case 0x3000:
                return true;
            default:
                return ch >= 0x2000 && ch <= 0x200A;
        }
    }

    /**
     * 重复字符串（Java 8兼容）
     *
     * @param str 要重复的字符串
     * @param count 重复次数
     * @return 重复后的字符串
     */
    public static String repeatString(String str, int count) {
        if (count <= 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder(str.length() * count);
        for (int i = 0; i < count; i++) {
            sb.append(str);
        }
        return sb.toString();
    }
}
