package com.example.docxstyler.util.style;

/**
 * 排版单位换算，OOXML 段落属性以 twip（1/20 磅）为单位
 */
public class Measurements {

    public static final int TWIPS_PER_POINT = 20;
    public static final double TWIPS_PER_CM = 1440 / 2.54;

    private Measurements() {
    }

    public static int pointsToTwips(double points) {
        return (int) Math.round(points * TWIPS_PER_POINT);
    }

    public static int centimetersToTwips(double centimeters) {
        return (int) Math.round(centimeters * TWIPS_PER_CM);
    }
}
