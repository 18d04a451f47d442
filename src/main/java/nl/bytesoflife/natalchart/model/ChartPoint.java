package nl.bytesoflife.natalchart.model;

/**
 * Anything that can take part in an aspect: a body or a chart angle.
 */
public interface ChartPoint {

    String getDisplayName();

    String getGlyph();

    BodyCategory getCategory();

    /** Sort key giving the canonical order of points within an aspect pair. */
    int canonicalOrder();
}
