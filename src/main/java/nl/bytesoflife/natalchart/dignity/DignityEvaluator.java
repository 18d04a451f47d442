package nl.bytesoflife.natalchart.dignity;

import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.Dignity;
import nl.bytesoflife.natalchart.model.ZodiacSign;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static nl.bytesoflife.natalchart.model.ZodiacSign.*;

/**
 * Essential dignity of a body in a sign. Rulerships combine the traditional scheme with the
 * modern rulers of Aquarius, Pisces and Scorpio; exaltations are the traditional seven.
 * When a body qualifies for more than one label the order is
 * domicile, exaltation, detriment, fall.
 */
public final class DignityEvaluator {

    private static final Map<Body, Set<ZodiacSign>> DOMICILES = new EnumMap<>(Body.class);
    private static final Map<Body, ZodiacSign> EXALTATIONS = new EnumMap<>(Body.class);

    static {
        DOMICILES.put(Body.SUN, EnumSet.of(LEO));
        DOMICILES.put(Body.MOON, EnumSet.of(CANCER));
        DOMICILES.put(Body.MERCURY, EnumSet.of(GEMINI, VIRGO));
        DOMICILES.put(Body.VENUS, EnumSet.of(TAURUS, LIBRA));
        DOMICILES.put(Body.MARS, EnumSet.of(ARIES, SCORPIO));
        DOMICILES.put(Body.JUPITER, EnumSet.of(SAGITTARIUS, PISCES));
        DOMICILES.put(Body.SATURN, EnumSet.of(CAPRICORN, AQUARIUS));
        DOMICILES.put(Body.URANUS, EnumSet.of(AQUARIUS));
        DOMICILES.put(Body.NEPTUNE, EnumSet.of(PISCES));
        DOMICILES.put(Body.PLUTO, EnumSet.of(SCORPIO));

        EXALTATIONS.put(Body.SUN, ARIES);
        EXALTATIONS.put(Body.MOON, TAURUS);
        EXALTATIONS.put(Body.MERCURY, VIRGO);
        EXALTATIONS.put(Body.VENUS, PISCES);
        EXALTATIONS.put(Body.MARS, CAPRICORN);
        EXALTATIONS.put(Body.JUPITER, CANCER);
        EXALTATIONS.put(Body.SATURN, LIBRA);
    }

    private DignityEvaluator() {
    }

    /** Dignity of {@code body} in {@code sign}, or null when it has none (always null for points). */
    public static Dignity evaluate(Body body, ZodiacSign sign) {
        Set<ZodiacSign> domiciles = DOMICILES.getOrDefault(body, Collections.emptySet());
        ZodiacSign exaltation = EXALTATIONS.get(body);
        if (domiciles.contains(sign)) {
            return Dignity.DOMICILE;
        }
        if (sign == exaltation) {
            return Dignity.EXALTATION;
        }
        for (ZodiacSign home : domiciles) {
            if (home.opposite() == sign) {
                return Dignity.DETRIMENT;
            }
        }
        if (exaltation != null && exaltation.opposite() == sign) {
            return Dignity.FALL;
        }
        return null;
    }
}
