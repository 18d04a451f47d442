package nl.bytesoflife.natalchart.ephemeris;

import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.AstroTime;

/**
 * Lunar node and apogee polynomials (Meeus, Astronomical Algorithms, ch. 47).
 */
final class LunarTheory {

    private LunarTheory() {
    }

    static double meanNode(double jd) {
        double t = AstroTime.centuriesSinceJ2000(jd);
        return AngleMath.normalize(125.0445479
                - 1934.1362891 * t
                + 0.0020754 * t * t
                + t * t * t / 467441.0
                - t * t * t * t / 60616000.0);
    }

    static double trueNode(double jd) {
        double t = AstroTime.centuriesSinceJ2000(jd);
        double d = elongation(t);
        double m = sunAnomaly(t);
        double mPrime = moonAnomaly(t);
        double f = latitudeArgument(t);
        return AngleMath.normalize(meanNode(jd)
                - 1.4979 * AngleMath.sinDeg(2 * (d - f))
                - 0.1500 * AngleMath.sinDeg(m)
                - 0.1226 * AngleMath.sinDeg(2 * d)
                + 0.1176 * AngleMath.sinDeg(2 * f)
                - 0.0801 * AngleMath.sinDeg(2 * (mPrime - f)));
    }

    /** Mean lunar apogee ("Black Moon Lilith"). */
    static double meanApogee(double jd) {
        double t = AstroTime.centuriesSinceJ2000(jd);
        double perigee = 83.3532465
                + 4069.0137287 * t
                - 0.0103200 * t * t
                - t * t * t / 80053.0
                + t * t * t * t / 18999000.0;
        return AngleMath.normalize(perigee + 180.0);
    }

    private static double elongation(double t) {
        return 297.8501921 + 445267.1114034 * t - 0.0018819 * t * t
                + t * t * t / 545868.0 - t * t * t * t / 113065000.0;
    }

    private static double sunAnomaly(double t) {
        return 357.5291092 + 35999.0502909 * t - 0.0001536 * t * t + t * t * t / 24490000.0;
    }

    private static double moonAnomaly(double t) {
        return 134.9633964 + 477198.8675055 * t + 0.0087414 * t * t
                + t * t * t / 69699.0 - t * t * t * t / 14712000.0;
    }

    private static double latitudeArgument(double t) {
        return 93.2720950 + 483202.0175233 * t - 0.0036539 * t * t
                - t * t * t / 3526000.0 + t * t * t * t / 863310000.0;
    }
}
