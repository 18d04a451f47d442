package nl.bytesoflife.natalchart.house;

import nl.bytesoflife.natalchart.model.HouseSystem;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static nl.bytesoflife.natalchart.coordinate.AngleMath.atan2Deg;
import static nl.bytesoflife.natalchart.coordinate.AngleMath.cosDeg;
import static nl.bytesoflife.natalchart.coordinate.AngleMath.forwardArc;
import static nl.bytesoflife.natalchart.coordinate.AngleMath.normalize;
import static nl.bytesoflife.natalchart.coordinate.AngleMath.sinDeg;
import static nl.bytesoflife.natalchart.coordinate.AngleMath.tanDeg;

/**
 * The house division methods, keyed by {@link HouseSystem}.
 *
 * <p>Quadrant systems compute cusps 11, 12, 2 and 3; 10 and 1 are the Midheaven and
 * Ascendant and the remaining six are the opposite points.</p>
 */
final class HouseAlgorithms {

    static final double PLACIDUS_TOLERANCE = 1e-7;
    static final int PLACIDUS_MAX_ITERATIONS = 100;

    private static final Map<HouseSystem, HouseAlgorithm> TABLE;

    static {
        Map<HouseSystem, HouseAlgorithm> table = new EnumMap<>(HouseSystem.class);
        table.put(HouseSystem.PLACIDUS, HouseAlgorithms::placidus);
        table.put(HouseSystem.KOCH, HouseAlgorithms::koch);
        table.put(HouseSystem.EQUAL, HouseAlgorithms::equal);
        table.put(HouseSystem.WHOLE_SIGN, HouseAlgorithms::wholeSign);
        table.put(HouseSystem.CAMPANUS, HouseAlgorithms::campanus);
        table.put(HouseSystem.REGIOMONTANUS, HouseAlgorithms::regiomontanus);
        table.put(HouseSystem.PORPHYRY, HouseAlgorithms::porphyry);
        table.put(HouseSystem.TOPOCENTRIC, HouseAlgorithms::topocentric);
        table.put(HouseSystem.MORINUS, HouseAlgorithms::morinus);
        TABLE = Collections.unmodifiableMap(table);
    }

    private HouseAlgorithms() {
    }

    static HouseAlgorithm forSystem(HouseSystem system) {
        HouseAlgorithm algorithm = TABLE.get(system);
        if (algorithm == null) {
            throw new IllegalArgumentException("No algorithm registered for " + system);
        }
        return algorithm;
    }

    static double[] equal(HouseFrame frame) {
        double[] cusps = new double[12];
        for (int i = 0; i < 12; i++) {
            cusps[i] = normalize(frame.ascendant() + 30.0 * i);
        }
        return cusps;
    }

    static double[] wholeSign(HouseFrame frame) {
        double first = Math.floor(frame.ascendant() / 30.0) * 30.0;
        double[] cusps = new double[12];
        for (int i = 0; i < 12; i++) {
            cusps[i] = normalize(first + 30.0 * i);
        }
        return cusps;
    }

    static double[] porphyry(HouseFrame frame) {
        double mc = frame.midheaven();
        double asc = frame.ascendant();
        double upper = forwardArc(mc, asc) / 3.0;
        double lower = forwardArc(asc, frame.imumCoeli()) / 3.0;
        return quadrant(frame,
                mc + upper, mc + 2 * upper,
                asc + lower, asc + 2 * lower);
    }

    static double[] regiomontanus(HouseFrame frame) {
        double[] q = new double[4];
        double[] h = {30, 60, 120, 150};
        for (int i = 0; i < 4; i++) {
            double pole = Math.toDegrees(Math.atan(tanDeg(frame.latitude()) * sinDeg(h[i])));
            q[i] = oblique(frame.ramc() + h[i], pole, frame.obliquity());
        }
        return quadrant(frame, q[0], q[1], q[2], q[3]);
    }

    static double[] campanus(HouseFrame frame) {
        double[] q = new double[4];
        double[] h = {30, 60, 120, 150};
        for (int i = 0; i < 4; i++) {
            double ra = frame.ramc() + atan2Deg(sinDeg(h[i]) * cosDeg(frame.latitude()), cosDeg(h[i]));
            double pole = Math.toDegrees(Math.asin(sinDeg(frame.latitude()) * sinDeg(h[i])));
            q[i] = oblique(ra, pole, frame.obliquity());
        }
        return quadrant(frame, q[0], q[1], q[2], q[3]);
    }

    static double[] topocentric(HouseFrame frame) {
        double[] q = new double[4];
        double[] h = {30, 60, 120, 150};
        double[] k = {1.0 / 3.0, 2.0 / 3.0, 2.0 / 3.0, 1.0 / 3.0};
        for (int i = 0; i < 4; i++) {
            double pole = Math.toDegrees(Math.atan(k[i] * tanDeg(frame.latitude())));
            q[i] = oblique(frame.ramc() + h[i], pole, frame.obliquity());
        }
        return quadrant(frame, q[0], q[1], q[2], q[3]);
    }

    static double[] morinus(HouseFrame frame) {
        double[] cusps = new double[12];
        for (int i = 1; i <= 12; i++) {
            double ra = frame.ramc() + 30.0 * (i - 10);
            cusps[i - 1] = atan2Deg(sinDeg(ra) * cosDeg(frame.obliquity()), cosDeg(ra));
        }
        return cusps;
    }

    static double[] koch(HouseFrame frame) {
        double declination = Math.toDegrees(Math.asin(sinDeg(frame.midheaven()) * sinDeg(frame.obliquity())));
        double dsa = 90.0 + ascensionalDifference(frame.latitude(), declination, "Midheaven");
        double ramc = frame.ramc();
        return quadrant(frame,
                HouseFrame.ascendant(ramc - 2.0 * dsa / 3.0, frame.latitude(), frame.obliquity()),
                HouseFrame.ascendant(ramc - dsa / 3.0, frame.latitude(), frame.obliquity()),
                HouseFrame.ascendant(ramc + dsa / 3.0, frame.latitude(), frame.obliquity()),
                HouseFrame.ascendant(ramc + 2.0 * dsa / 3.0, frame.latitude(), frame.obliquity()));
    }

    static double[] placidus(HouseFrame frame) {
        return quadrant(frame,
                placidusCusp(frame, 11, 1.0 / 3.0, false),
                placidusCusp(frame, 12, 2.0 / 3.0, false),
                placidusCusp(frame, 2, 2.0 / 3.0, true),
                placidusCusp(frame, 3, 1.0 / 3.0, true));
    }

    /**
     * Finds the right ascension whose hour angle is the given fraction of its own semi-arc
     * (diurnal above the horizon, nocturnal below), then projects it onto the ecliptic.
     */
    private static double placidusCusp(HouseFrame frame, int house, double fraction, boolean belowHorizon) {
        double ramc = frame.ramc();
        double eps = frame.obliquity();
        double ra = belowHorizon ? ramc + 180.0 - 90.0 * fraction : ramc + 90.0 * fraction;
        for (int i = 0; i < PLACIDUS_MAX_ITERATIONS; i++) {
            double declination = Math.toDegrees(Math.atan(sinDeg(ra) * tanDeg(eps)));
            double ad = ascensionalDifference(frame.latitude(), declination, "cusp " + house);
            double next = belowHorizon
                    ? ramc + 180.0 - fraction * (90.0 - ad)
                    : ramc + fraction * (90.0 + ad);
            double delta = Math.abs(normalize(next - ra + 180.0) - 180.0);
            ra = next;
            if (delta < PLACIDUS_TOLERANCE) {
                return atan2Deg(sinDeg(ra), cosDeg(ra) * cosDeg(eps));
            }
        }
        throw new HouseConvergenceException(String.format(Locale.US,
                "Placidus cusp %d did not converge within %d iterations", house, PLACIDUS_MAX_ITERATIONS));
    }

    /** asin(tan(lat) tan(dec)); undefined for circumpolar points. */
    private static double ascensionalDifference(double latitude, double declination, String what) {
        double x = tanDeg(latitude) * tanDeg(declination);
        if (Math.abs(x) > 1.0) {
            throw new HouseConvergenceException(String.format(Locale.US,
                    "Semi-arc of %s undefined at latitude %.4f (circumpolar)", what, latitude));
        }
        return Math.toDegrees(Math.asin(x));
    }

    /** Ecliptic longitude where the house circle through {@code ra} with pole height {@code pole} meets the ecliptic. */
    private static double oblique(double ra, double pole, double obliquity) {
        return atan2Deg(sinDeg(ra), cosDeg(ra) * cosDeg(obliquity) - tanDeg(pole) * sinDeg(obliquity));
    }

    private static double[] quadrant(HouseFrame frame, double c11, double c12, double c2, double c3) {
        double[] cusps = new double[12];
        cusps[0] = frame.ascendant();
        cusps[1] = normalize(c2);
        cusps[2] = normalize(c3);
        cusps[9] = frame.midheaven();
        cusps[10] = normalize(c11);
        cusps[11] = normalize(c12);
        for (int i = 3; i < 9; i++) {
            int opposite = (i + 6) % 12;
            cusps[i] = normalize(cusps[opposite] + 180.0);
        }
        return cusps;
    }
}
