package com.example.docxstyler.util.style;

import com.example.docxstyler.util.style.dto.RgbColor;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 颜色表达式解析
 *
 * 支持的形式：
 * - "#RRGGBB"：十六进制
 * - "RGB(r,g,b)"：十进制分量，前缀不区分大小写
 *
 * 其他输入（包括 "Text 1" 这类主题色名称）一律返回黑色，不解析主题色。
 * 本类不抛出异常。
 */
public class ColorResolver {

    private static final Pattern HEX_PATTERN =
        Pattern.compile("^#([0-9A-Fa-f]{2})([0-9A-Fa-f]{2})([0-9A-Fa-f]{2})$");

    private static final String RGB_PREFIX = "RGB(";

    private ColorResolver() {
    }

    /**
     * 解析颜色表达式
     *
     * @param expression 颜色表达式，可为 null
     * @return RGB 颜色，无法解析时为黑色
     */
    public static RgbColor resolve(String expression) {
        if (expression == null) {
            return RgbColor.BLACK;
        }

        Matcher hex = HEX_PATTERN.matcher(expression);
        if (hex.matches()) {
            return new RgbColor(
                Integer.parseInt(hex.group(1), 16),
                Integer.parseInt(hex.group(2), 16),
                Integer.parseInt(hex.group(3), 16));
        }

        if (expression.toUpperCase(Locale.ROOT).startsWith(RGB_PREFIX)) {
            RgbColor rgb = parseComponents(expression);
            if (rgb != null) {
                return rgb;
            }
        }

        return RgbColor.BLACK;
    }

    /**
     * 解析 "RGB(r,g,b)"：去掉前缀和最后一个字符，按逗号拆成三段
     */
    private static RgbColor parseComponents(String expression) {
        if (expression.length() <= RGB_PREFIX.length()) {
            return null;
        }
        String inner = expression.substring(RGB_PREFIX.length(), expression.length() - 1);
        String[] parts = inner.split(",", -1);
        if (parts.length != 3) {
            return null;
        }

        int[] values = new int[3];
        for (int i = 0; i < 3; i++) {
            try {
                values[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                return null;
            }
            if (values[i] < 0 || values[i] > 255) {
                return null;
            }
        }
        return new RgbColor(values[0], values[1], values[2]);
    }
}
