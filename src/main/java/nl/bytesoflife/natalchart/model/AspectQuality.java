package nl.bytesoflife.natalchart.model;

public enum AspectQuality {
    /** Square, opposition. */
    HARD,
    /** Trine, sextile. */
    SOFT,
    /** Conjunction. */
    NEUTRAL,
    MINOR;

    public static AspectQuality fromName(String name) {
        return switch (name.toLowerCase()) {
            case "hard" -> HARD;
            case "soft" -> SOFT;
            case "neutral" -> NEUTRAL;
            case "minor" -> MINOR;
            default -> throw new IllegalArgumentException("Unknown aspect quality: " + name);
        };
    }
}
