package nl.bytesoflife.natalchart.coordinate;

import java.time.Instant;

/**
 * Julian day conversions and the time-dependent quantities the house systems need.
 * Universal time is used throughout; the difference to terrestrial time is ignored.
 */
public final class AstroTime {

    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private static final double UNIX_EPOCH_JD = 2440587.5;
    private static final double SECONDS_PER_DAY = 86400.0;

    private AstroTime() {
    }

    public static double julianDay(Instant instant) {
        return UNIX_EPOCH_JD + (instant.getEpochSecond() + instant.getNano() / 1e9) / SECONDS_PER_DAY;
    }

    public static Instant fromJulianDay(double jd) {
        double seconds = (jd - UNIX_EPOCH_JD) * SECONDS_PER_DAY;
        long whole = (long) Math.floor(seconds);
        long nanos = Math.round((seconds - whole) * 1e9);
        return Instant.ofEpochSecond(whole, nanos);
    }

    /** Julian centuries since J2000.0. */
    public static double centuriesSinceJ2000(double jd) {
        return (jd - J2000) / DAYS_PER_CENTURY;
    }

    /** Mean obliquity of the ecliptic in degrees (IAU 1980 polynomial). */
    public static double meanObliquity(double jd) {
        double t = centuriesSinceJ2000(jd);
        double seconds = 21.448 - t * (46.8150 + t * (0.00059 - t * 0.001813));
        return 23.0 + (26.0 + seconds / 60.0) / 60.0;
    }

    /** Greenwich mean sidereal time in degrees (IAU 1982 expression). */
    public static double greenwichSiderealTime(double jd) {
        double t = centuriesSinceJ2000(jd);
        double theta = 280.46061837
                + 360.98564736629 * (jd - J2000)
                + t * t * (0.000387933 - t / 38710000.0);
        return AngleMath.normalize(theta);
    }

    /**
     * Local sidereal time expressed as the right ascension of the meridian (RAMC), in degrees.
     *
     * @param eastLongitude geographic longitude, east positive
     */
    public static double localSiderealTime(double jd, double eastLongitude) {
        return AngleMath.normalize(greenwichSiderealTime(jd) + eastLongitude);
    }
}
