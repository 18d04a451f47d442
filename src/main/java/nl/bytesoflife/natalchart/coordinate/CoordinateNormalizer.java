package nl.bytesoflife.natalchart.coordinate;

import nl.bytesoflife.natalchart.model.ZodiacPosition;
import nl.bytesoflife.natalchart.model.ZodiacSign;

/**
 * Converts raw ecliptic longitudes into zodiac positions.
 */
public final class CoordinateNormalizer {

    private static final int SECONDS_PER_SIGN = 30 * 3600;

    private CoordinateNormalizer() {
    }

    public static ZodiacSign signOf(double longitude) {
        double lon = AngleMath.normalize(longitude);
        return ZodiacSign.fromIndex((int) Math.floor(lon / 30.0) % 12);
    }

    /**
     * Splits a longitude into sign, degree, minute and second. Seconds are rounded half-up;
     * a carry that would reach 30 degrees is held at 29°59'59" so the sign never changes.
     */
    public static ZodiacPosition normalize(double longitude) {
        double lon = AngleMath.normalize(longitude);
        ZodiacSign sign = signOf(lon);
        double inSign = lon - sign.startLongitude();

        long totalSeconds = (long) Math.floor(inSign * 3600.0 + 0.5);
        if (totalSeconds >= SECONDS_PER_SIGN) {
            totalSeconds = SECONDS_PER_SIGN - 1;
        } else if (totalSeconds < 0) {
            totalSeconds = 0;
        }

        int degree = (int) (totalSeconds / 3600);
        int minute = (int) ((totalSeconds % 3600) / 60);
        int second = (int) (totalSeconds % 60);
        return new ZodiacPosition(sign, degree, minute, second);
    }

    /** Stationary bodies (speed exactly zero) are not retrograde. */
    public static boolean isRetrograde(double speed) {
        return speed < 0;
    }
}
