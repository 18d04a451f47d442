package nl.bytesoflife.natalchart.model;

/**
 * Which lunar node, if any, is included in a chart.
 */
public enum NodeMode {
    NONE,
    MEAN,
    TRUE;

    public static NodeMode fromName(String name) {
        return switch (name.toLowerCase()) {
            case "none", "false" -> NONE;
            case "mean" -> MEAN;
            case "true" -> TRUE;
            default -> throw new IllegalArgumentException("Unknown node mode: " + name);
        };
    }
}
