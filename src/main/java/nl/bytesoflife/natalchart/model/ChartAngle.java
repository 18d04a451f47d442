package nl.bytesoflife.natalchart.model;

public enum ChartAngle implements ChartPoint {
    ASCENDANT("Ascendant", "ASC"),
    MIDHEAVEN("Midheaven", "MC"),
    DESCENDANT("Descendant", "DSC"),
    IMUM_COELI("Imum Coeli", "IC");

    private final String displayName;
    private final String abbreviation;

    ChartAngle(String displayName, String abbreviation) {
        this.displayName = displayName;
        this.abbreviation = abbreviation;
    }

    @Override
    public String getDisplayName() { return displayName; }

    public String getAbbreviation() { return abbreviation; }

    @Override
    public String getGlyph() { return abbreviation; }

    @Override
    public BodyCategory getCategory() { return BodyCategory.POINT; }

    @Override
    public int canonicalOrder() {
        return 100 + ordinal();
    }
}
