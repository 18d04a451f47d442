package nl.bytesoflife.natalchart.coordinate;

/**
 * Degree-based angle helpers shared by the house, aspect and rendering code.
 */
public final class AngleMath {

    private AngleMath() {
    }

    /** Normalizes an angle into [0, 360). */
    public static double normalize(double degrees) {
        double result = degrees % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        // -1e-17 % 360 + 360 rounds to 360.0
        return result >= 360.0 ? 0.0 : result;
    }

    /** Signed difference {@code to - from} folded into (-180, 180]. */
    public static double signedDifference(double from, double to) {
        double diff = normalize(to - from);
        return diff > 180.0 ? diff - 360.0 : diff;
    }

    /** Shortest arc between two longitudes, in [0, 180]. */
    public static double separation(double a, double b) {
        double diff = Math.abs(normalize(a) - normalize(b));
        return Math.min(diff, 360.0 - diff);
    }

    /** Distance travelled from {@code from} to {@code to} in the direction of increasing longitude. */
    public static double forwardArc(double from, double to) {
        return normalize(to - from);
    }

    public static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cosDeg(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    public static double tanDeg(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    public static double atan2Deg(double y, double x) {
        return normalize(Math.toDegrees(Math.atan2(y, x)));
    }
}
