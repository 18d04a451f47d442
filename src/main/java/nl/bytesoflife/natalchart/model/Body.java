package nl.bytesoflife.natalchart.model;

import java.util.List;

/**
 * Bodies and calculated points the engine can place in a chart, in canonical chart order.
 */
public enum Body implements ChartPoint {
    SUN("Sun", "☉", BodyCategory.LUMINARY),
    MOON("Moon", "☽", BodyCategory.LUMINARY),
    MERCURY("Mercury", "☿", BodyCategory.PERSONAL),
    VENUS("Venus", "♀", BodyCategory.PERSONAL),
    MARS("Mars", "♂", BodyCategory.PERSONAL),
    JUPITER("Jupiter", "♃", BodyCategory.SOCIAL),
    SATURN("Saturn", "♄", BodyCategory.SOCIAL),
    URANUS("Uranus", "♅", BodyCategory.OUTER),
    NEPTUNE("Neptune", "♆", BodyCategory.OUTER),
    PLUTO("Pluto", "♇", BodyCategory.OUTER),
    CHIRON("Chiron", "⚷", BodyCategory.POINT),
    MEAN_LILITH("Mean Lilith", "⚸", BodyCategory.POINT),
    MEAN_NODE("Mean Node", "☊", BodyCategory.POINT),
    TRUE_NODE("True Node", "☊", BodyCategory.POINT);

    /** Sun through Pluto, always part of a chart. */
    public static final List<Body> CLASSICAL = List.of(
            SUN, MOON, MERCURY, VENUS, MARS, JUPITER, SATURN, URANUS, NEPTUNE, PLUTO);

    private final String displayName;
    private final String glyph;
    private final BodyCategory category;

    Body(String displayName, String glyph, BodyCategory category) {
        this.displayName = displayName;
        this.glyph = glyph;
        this.category = category;
    }

    @Override
    public String getDisplayName() { return displayName; }

    @Override
    public String getGlyph() { return glyph; }

    @Override
    public BodyCategory getCategory() { return category; }

    @Override
    public int canonicalOrder() {
        return ordinal();
    }

    public boolean isLuminary() {
        return category == BodyCategory.LUMINARY;
    }

    public boolean isLunarNode() {
        return this == MEAN_NODE || this == TRUE_NODE;
    }
}
