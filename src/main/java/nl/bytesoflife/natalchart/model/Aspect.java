package nl.bytesoflife.natalchart.model;

import java.util.Locale;

/**
 * An angular relationship between two chart points.
 * The first point always precedes the second in canonical order.
 */
public class Aspect {

    private final ChartPoint first;
    private final ChartPoint second;
    private final AspectType type;
    private final AspectQuality quality;
    private final double separation;
    private final double orb;
    private final boolean applying;

    public Aspect(ChartPoint first, ChartPoint second, AspectType type, AspectQuality quality,
                  double separation, double orb, boolean applying) {
        if (first == null || second == null || type == null || quality == null) {
            throw new IllegalArgumentException("Aspect points, type and quality are required");
        }
        if (first.equals(second)) {
            throw new IllegalArgumentException("Aspect must be between two different points");
        }
        if (first.canonicalOrder() > second.canonicalOrder()) {
            throw new IllegalArgumentException("Aspect points must be in canonical order: "
                    + first.getDisplayName() + ", " + second.getDisplayName());
        }
        if (separation < 0 || separation > 180) {
            throw new IllegalArgumentException("Separation must be in [0, 180]: " + separation);
        }
        this.first = first;
        this.second = second;
        this.type = type;
        this.quality = quality;
        this.separation = separation;
        this.orb = orb;
        this.applying = applying;
    }

    public ChartPoint getFirst() { return first; }
    public ChartPoint getSecond() { return second; }
    public AspectType getType() { return type; }
    public AspectQuality getQuality() { return quality; }
    public double getSeparation() { return separation; }

    /** Actual separation minus the exact aspect angle. */
    public double getOrb() { return orb; }

    public boolean isApplying() { return applying; }

    public boolean isHard() {
        return type == AspectType.SQUARE || type == AspectType.OPPOSITION;
    }

    public boolean involves(ChartPoint point) {
        return first.equals(point) || second.equals(point);
    }

    /** The other side of the aspect, or null if {@code point} is not part of it. */
    public ChartPoint other(ChartPoint point) {
        if (first.equals(point)) return second;
        if (second.equals(point)) return first;
        return null;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s %s %s (orb %+.2f, %s)",
                first.getDisplayName(), type.name().toLowerCase(), second.getDisplayName(),
                orb, applying ? "applying" : "separating");
    }
}
