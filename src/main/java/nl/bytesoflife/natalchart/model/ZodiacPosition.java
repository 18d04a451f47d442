package nl.bytesoflife.natalchart.model;

import java.util.Locale;

/**
 * A longitude expressed as sign plus whole degrees, minutes and seconds within that sign.
 *
 * @param sign   the sign containing the longitude
 * @param degree whole degrees within the sign, 0..29
 * @param minute arc minutes, 0..59
 * @param second arc seconds, 0..59
 */
public record ZodiacPosition(ZodiacSign sign, int degree, int minute, int second) {

    public ZodiacPosition {
        if (sign == null) {
            throw new IllegalArgumentException("Sign must not be null");
        }
        if (degree < 0 || degree >= 30) {
            throw new IllegalArgumentException("Degree must be in [0, 30): " + degree);
        }
        if (minute < 0 || minute >= 60) {
            throw new IllegalArgumentException("Minute must be in [0, 60): " + minute);
        }
        if (second < 0 || second >= 60) {
            throw new IllegalArgumentException("Second must be in [0, 60): " + second);
        }
    }

    /** Decimal degrees within the sign. */
    public double degreeInSign() {
        return degree + minute / 60.0 + second / 3600.0;
    }

    /** Absolute ecliptic longitude reconstructed from the sign and its parts. */
    public double longitude() {
        return sign.startLongitude() + degreeInSign();
    }

    public String format() {
        return String.format(Locale.US, "%d°%02d'%02d\" %s", degree, minute, second, sign.getDisplayName());
    }

    @Override
    public String toString() {
        return format();
    }
}
