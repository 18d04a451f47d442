package nl.bytesoflife.natalchart.model;

public enum BodyCategory {
    LUMINARY,
    PERSONAL,
    SOCIAL,
    OUTER,
    /** Calculated points: lunar nodes, Lilith, Chiron and the chart angles. */
    POINT
}
