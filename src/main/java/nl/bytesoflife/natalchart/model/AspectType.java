package nl.bytesoflife.natalchart.model;

import java.util.Map;

public enum AspectType {
    CONJUNCTION(0.0, "☌"),
    SEXTILE(60.0, "⚹"),
    SQUARE(90.0, "□"),
    TRINE(120.0, "△"),
    OPPOSITION(180.0, "☍"),
    SEMISQUARE(45.0, "∠"),
    SESQUIQUADRATE(135.0, "⚼"),
    QUINCUNX(150.0, "⚻");

    private static final Map<String, AspectType> NAMES = Map.ofEntries(
            Map.entry("conjunction", CONJUNCTION),
            Map.entry("sextile", SEXTILE),
            Map.entry("square", SQUARE),
            Map.entry("trine", TRINE),
            Map.entry("opposition", OPPOSITION),
            Map.entry("semisquare", SEMISQUARE),
            Map.entry("semi-square", SEMISQUARE),
            Map.entry("sesquiquadrate", SESQUIQUADRATE),
            Map.entry("sesquisquare", SESQUIQUADRATE),
            Map.entry("quincunx", QUINCUNX),
            Map.entry("inconjunct", QUINCUNX)
    );

    private final double exactAngle;
    private final String glyph;

    AspectType(double exactAngle, String glyph) {
        this.exactAngle = exactAngle;
        this.glyph = glyph;
    }

    public double getExactAngle() { return exactAngle; }
    public String getGlyph() { return glyph; }

    public boolean isMajor() {
        return ordinal() <= OPPOSITION.ordinal();
    }

    public static AspectType fromName(String name) {
        AspectType type = NAMES.get(name.toLowerCase());
        if (type == null) {
            throw new IllegalArgumentException("Unknown aspect type: " + name);
        }
        return type;
    }
}
