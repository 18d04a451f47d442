package nl.bytesoflife.natalchart.house;

import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.AstroTime;

import java.time.Instant;

/**
 * Sky geometry at one moment and place, the input of every house algorithm.
 *
 * @param ramc       right ascension of the meridian (local sidereal time) in degrees
 * @param latitude   geographic latitude, already clamped away from the poles
 * @param obliquity  mean obliquity of the ecliptic
 * @param ascendant  ecliptic longitude rising on the eastern horizon
 * @param midheaven  ecliptic longitude culminating on the upper meridian
 */
public record HouseFrame(double ramc, double latitude, double obliquity, double ascendant, double midheaven) {

    /** Latitudes of exactly +-90 are pulled in by this much; the horizon is undefined at the poles. */
    public static final double POLE_CLAMP = 1e-6;

    public static HouseFrame at(Instant instant, double latitude, double eastLongitude) {
        double jd = AstroTime.julianDay(instant);
        double lat = clampLatitude(latitude);
        double ramc = AstroTime.localSiderealTime(jd, eastLongitude);
        double obliquity = AstroTime.meanObliquity(jd);
        double mc = midheaven(ramc, obliquity);
        return new HouseFrame(ramc, lat, obliquity, orientedAscendant(ramc, lat, obliquity, mc), mc);
    }

    /**
     * Inside the polar circles the horizon formula can return the descending point of the
     * ecliptic; the Ascendant is then taken as its opposite so it lies in the half from MC to IC.
     */
    static double orientedAscendant(double ramc, double latitude, double obliquity, double midheaven) {
        double asc = ascendant(ramc, latitude, obliquity);
        if (Math.abs(latitude) > 90.0 - obliquity && AngleMath.forwardArc(midheaven, asc) > 180.0) {
            return AngleMath.normalize(asc + 180.0);
        }
        return asc;
    }

    static double clampLatitude(double latitude) {
        double limit = 90.0 - POLE_CLAMP;
        return Math.max(-limit, Math.min(limit, latitude));
    }

    static double ascendant(double ramc, double latitude, double obliquity) {
        return AngleMath.atan2Deg(AngleMath.cosDeg(ramc),
                -(AngleMath.sinDeg(ramc) * AngleMath.cosDeg(obliquity)
                        + AngleMath.tanDeg(latitude) * AngleMath.sinDeg(obliquity)));
    }

    static double midheaven(double ramc, double obliquity) {
        return AngleMath.atan2Deg(AngleMath.sinDeg(ramc), AngleMath.cosDeg(ramc) * AngleMath.cosDeg(obliquity));
    }

    public double descendant() {
        return AngleMath.normalize(ascendant + 180.0);
    }

    public double imumCoeli() {
        return AngleMath.normalize(midheaven + 180.0);
    }
}
