package com.example.docxstyler.util.style.dto;

import lombok.Value;

/**
 * 24位 RGB 颜色
 */
@Value
public class RgbColor {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);

    int red;
    int green;
    int blue;

    /**
     * 转为 OOXML 使用的十六进制形式（无 # 前缀），如 "0052A3"
     */
    public String toHex() {
        return String.format("%02X%02X%02X", red, green, blue);
    }
}
