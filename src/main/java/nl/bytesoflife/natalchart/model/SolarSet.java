package nl.bytesoflife.natalchart.model;

import java.util.List;

/**
 * Summary projection of a chart: the Sun's placement, the sign on the fifth cusp and
 * the hard aspects (square, opposition) the Sun makes.
 */
public class SolarSet {

    private final ZodiacSign sunSign;
    private final int sunHouse;
    private final double sunDegree;
    private final ZodiacSign fifthHouseSign;
    private final List<Aspect> hardAspects;

    public SolarSet(ZodiacSign sunSign, int sunHouse, double sunDegree,
                    ZodiacSign fifthHouseSign, List<Aspect> hardAspects) {
        if (sunSign == null || fifthHouseSign == null) {
            throw new IllegalArgumentException("Sun sign and fifth house sign are required");
        }
        if (sunHouse < 1 || sunHouse > 12) {
            throw new IllegalArgumentException("Sun house must be in [1, 12]: " + sunHouse);
        }
        if (sunDegree < 0 || sunDegree >= 30) {
            throw new IllegalArgumentException("Sun degree must be in [0, 30): " + sunDegree);
        }
        for (Aspect aspect : hardAspects) {
            if (!aspect.isHard() || !aspect.involves(Body.SUN)) {
                throw new IllegalArgumentException("Only hard aspects to the Sun allowed, got: " + aspect);
            }
        }
        this.sunSign = sunSign;
        this.sunHouse = sunHouse;
        this.sunDegree = sunDegree;
        this.fifthHouseSign = fifthHouseSign;
        this.hardAspects = List.copyOf(hardAspects);
    }

    public ZodiacSign getSunSign() { return sunSign; }
    public int getSunHouse() { return sunHouse; }

    /** Decimal degree of the Sun within its sign. */
    public double getSunDegree() { return sunDegree; }

    public ZodiacSign getFifthHouseSign() { return fifthHouseSign; }
    public List<Aspect> getHardAspects() { return hardAspects; }

    public boolean hasHardAspects() {
        return !hardAspects.isEmpty();
    }

    public List<Aspect> getSquares() {
        return hardAspects.stream().filter(a -> a.getType() == AspectType.SQUARE).toList();
    }

    public List<Aspect> getOppositions() {
        return hardAspects.stream().filter(a -> a.getType() == AspectType.OPPOSITION).toList();
    }

    /** Stable lookup key for interpretation tables, e.g. {@code ARIES_LEO_2}. */
    public String interpretationKey() {
        return sunSign.name() + "_" + fifthHouseSign.name() + "_" + hardAspects.size();
    }

    @Override
    public String toString() {
        return "SolarSet{sun=" + sunSign.getDisplayName() + " house " + sunHouse
                + ", fifth=" + fifthHouseSign.getDisplayName()
                + ", hardAspects=" + hardAspects.size() + "}";
    }
}
