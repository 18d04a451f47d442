package nl.bytesoflife.natalchart.render;

import nl.bytesoflife.natalchart.model.AspectQuality;
import nl.bytesoflife.natalchart.model.ZodiacSign;

import java.util.EnumMap;
import java.util.Map;

/**
 * Look of the rendered wheel. Radii are fractions of the outer radius.
 */
public class ChartSvgOptions {

    private int size = 800;
    private double margin = 20;
    private String fontFamily = "DejaVu Sans, Segoe UI Symbol, sans-serif";
    private String backgroundColor = "#ffffff";
    private String lineColor = "#333333";
    private String textColor = "#111111";

    private double zodiacInnerRadius = 0.85;
    private double glyphRadius = 0.74;
    private double glyphStep = 0.085;
    private int glyphLevels = 3;
    private double glyphSize = 22;
    private double houseNumberRadius = 0.45;
    private double aspectRadius = 0.40;

    private final Map<ZodiacSign.Element, String> elementColors = new EnumMap<>(ZodiacSign.Element.class);
    private final Map<AspectQuality, String> aspectColors = new EnumMap<>(AspectQuality.class);

    public ChartSvgOptions() {
        elementColors.put(ZodiacSign.Element.FIRE, "#f6d5c8");
        elementColors.put(ZodiacSign.Element.EARTH, "#dfe8c9");
        elementColors.put(ZodiacSign.Element.AIR, "#f5efc4");
        elementColors.put(ZodiacSign.Element.WATER, "#cfe0f1");
        aspectColors.put(AspectQuality.HARD, "#c0392b");
        aspectColors.put(AspectQuality.SOFT, "#2471a3");
        aspectColors.put(AspectQuality.NEUTRAL, "#229954");
        aspectColors.put(AspectQuality.MINOR, "#8e8e8e");
    }

    /** Independent copy; later changes to either instance do not affect the other. */
    public ChartSvgOptions copy() {
        ChartSvgOptions c = new ChartSvgOptions();
        c.size = size;
        c.margin = margin;
        c.fontFamily = fontFamily;
        c.backgroundColor = backgroundColor;
        c.lineColor = lineColor;
        c.textColor = textColor;
        c.zodiacInnerRadius = zodiacInnerRadius;
        c.glyphRadius = glyphRadius;
        c.glyphStep = glyphStep;
        c.glyphLevels = glyphLevels;
        c.glyphSize = glyphSize;
        c.houseNumberRadius = houseNumberRadius;
        c.aspectRadius = aspectRadius;
        c.elementColors.putAll(elementColors);
        c.aspectColors.putAll(aspectColors);
        return c;
    }

    public int getSize() { return size; }
    public double getMargin() { return margin; }
    public String getFontFamily() { return fontFamily; }
    public String getBackgroundColor() { return backgroundColor; }
    public String getLineColor() { return lineColor; }
    public String getTextColor() { return textColor; }
    public double getZodiacInnerRadius() { return zodiacInnerRadius; }
    public double getGlyphRadius() { return glyphRadius; }
    public double getGlyphStep() { return glyphStep; }
    public int getGlyphLevels() { return glyphLevels; }
    public double getGlyphSize() { return glyphSize; }
    public double getHouseNumberRadius() { return houseNumberRadius; }
    public double getAspectRadius() { return aspectRadius; }

    public String getElementColor(ZodiacSign.Element element) {
        return elementColors.get(element);
    }

    public String getAspectColor(AspectQuality quality) {
        return aspectColors.get(quality);
    }

    /** Outer radius of the wheel in pixels. */
    public double outerRadius() {
        return size / 2.0 - margin;
    }

    public ChartSvgOptions setSize(int size) {
        if (size < 200) throw new IllegalArgumentException("Canvas size must be at least 200px: " + size);
        this.size = size;
        return this;
    }

    public ChartSvgOptions setMargin(double margin) {
        if (margin < 0) throw new IllegalArgumentException("Margin must not be negative: " + margin);
        this.margin = margin;
        return this;
    }

    public ChartSvgOptions setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
        return this;
    }

    public ChartSvgOptions setBackgroundColor(String backgroundColor) {
        this.backgroundColor = backgroundColor;
        return this;
    }

    public ChartSvgOptions setLineColor(String lineColor) {
        this.lineColor = lineColor;
        return this;
    }

    public ChartSvgOptions setTextColor(String textColor) {
        this.textColor = textColor;
        return this;
    }

    public ChartSvgOptions setGlyphRadius(double glyphRadius) {
        this.glyphRadius = glyphRadius;
        return this;
    }

    public ChartSvgOptions setGlyphStep(double glyphStep) {
        this.glyphStep = glyphStep;
        return this;
    }

    public ChartSvgOptions setGlyphLevels(int glyphLevels) {
        if (glyphLevels < 1) throw new IllegalArgumentException("At least one glyph level required");
        this.glyphLevels = glyphLevels;
        return this;
    }

    public ChartSvgOptions setGlyphSize(double glyphSize) {
        this.glyphSize = glyphSize;
        return this;
    }

    public ChartSvgOptions setElementColor(ZodiacSign.Element element, String color) {
        elementColors.put(element, color);
        return this;
    }

    public ChartSvgOptions setAspectColor(AspectQuality quality, String color) {
        aspectColors.put(quality, color);
        return this;
    }
}
