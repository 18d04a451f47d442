package nl.bytesoflife.natalchart.aspect;

import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.BodyCategory;
import nl.bytesoflife.natalchart.model.ChartPoint;

/**
 * Orb scaling class of a pair of points.
 */
public enum PairCategory {
    LUMINARY,
    PLANETARY,
    OUTER,
    POINT;

    public static PairCategory of(ChartPoint a, ChartPoint b) {
        if (a.getCategory() == BodyCategory.POINT || b.getCategory() == BodyCategory.POINT) {
            return POINT;
        }
        if (isLuminary(a) || isLuminary(b)) {
            return LUMINARY;
        }
        if (a.getCategory() == BodyCategory.OUTER && b.getCategory() == BodyCategory.OUTER) {
            return OUTER;
        }
        return PLANETARY;
    }

    public static PairCategory fromName(String name) {
        return switch (name.toLowerCase()) {
            case "luminary" -> LUMINARY;
            case "planetary" -> PLANETARY;
            case "outer" -> OUTER;
            case "point" -> POINT;
            default -> throw new IllegalArgumentException("Unknown pair category: " + name);
        };
    }

    private static boolean isLuminary(ChartPoint point) {
        return point instanceof Body body && body.isLuminary();
    }
}
