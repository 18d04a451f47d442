package nl.bytesoflife.natalchart.ephemeris;

import nl.bytesoflife.natalchart.EphemerisRangeExceededException;
import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.AstroTime;
import nl.bytesoflife.natalchart.model.Body;

import java.time.Instant;

/**
 * Low precision analytic ephemeris built from mean orbital elements of date
 * (P. Schlyter, "How to compute planetary positions") with the principal Moon, Jupiter,
 * Saturn and Uranus perturbations, a periodic fit for Pluto and osculating elements for Chiron.
 * Lunar node and Lilith come from {@link LunarTheory}.
 *
 * <p>Accuracy is in the order of arc minutes for the planets, which is enough for sign and
 * house placement but not for timing work. Chiron is only approximate. Speeds are central
 * differences over one day. The class is stateless and thread-safe.</p>
 */
public class KeplerianEphemeris implements EphemerisProvider {

    public static final Instant RANGE_START = Instant.parse("1800-01-01T00:00:00Z");
    public static final Instant RANGE_END = Instant.parse("2199-12-31T23:59:59Z");

    private static final double SPEED_HALF_STEP_DAYS = 0.5;
    private static final double EARTH_RADII_TO_AU = 6378.14 / 149597870.7;
    /** Precession in longitude, degrees per day, for elements referred to J2000. */
    private static final double PRECESSION_PER_DAY = 3.82394e-5;
    /** Day number origin used by the element tables (1999-12-31 0h UT). */
    private static final double ELEMENT_EPOCH_JD = 2451543.5;

    private static final int KEPLER_MAX_ITERATIONS = 30;
    private static final double KEPLER_TOLERANCE = 1e-9;

    @Override
    public Instant supportedStart() {
        return RANGE_START;
    }

    @Override
    public Instant supportedEnd() {
        return RANGE_END;
    }

    @Override
    public EphemerisPosition positionAt(Instant instant, Body body) {
        if (!supports(instant)) {
            throw new EphemerisRangeExceededException(instant, RANGE_START, RANGE_END);
        }
        double jd = AstroTime.julianDay(instant);
        double[] now = geocentric(body, jd);
        double before = geocentric(body, jd - SPEED_HALF_STEP_DAYS)[0];
        double after = geocentric(body, jd + SPEED_HALF_STEP_DAYS)[0];
        double speed = AngleMath.signedDifference(before, after) / (2 * SPEED_HALF_STEP_DAYS);
        return new EphemerisPosition(now[0], now[1], now[2], speed);
    }

    /** Returns {longitude, latitude, distance}. */
    double[] geocentric(Body body, double jd) {
        double d = jd - ELEMENT_EPOCH_JD;
        return switch (body) {
            case SUN -> sun(d);
            case MOON -> moon(d);
            case MERCURY, VENUS, MARS, JUPITER, SATURN, URANUS, NEPTUNE ->
                    toGeocentric(planetHeliocentric(body, d), d);
            case PLUTO -> toGeocentric(plutoHeliocentric(d), d);
            case CHIRON -> toGeocentric(chironHeliocentric(d), d);
            case MEAN_NODE -> new double[]{LunarTheory.meanNode(jd), 0.0, 0.0};
            case TRUE_NODE -> new double[]{LunarTheory.trueNode(jd), 0.0, 0.0};
            case MEAN_LILITH -> new double[]{LunarTheory.meanApogee(jd), 0.0, 0.0};
        };
    }

    private static double[] sun(double d) {
        double w = 282.9404 + 4.70935e-5 * d;
        double e = 0.016709 - 1.151e-9 * d;
        double m = AngleMath.normalize(356.0470 + 0.9856002585 * d);
        double[] vr = trueAnomalyAndRadius(m, e, 1.0);
        return new double[]{AngleMath.normalize(vr[0] + w), 0.0, vr[1]};
    }

    private static double[] moon(double d) {
        OrbitalElements el = new OrbitalElements(
                125.1228 - 0.0529538083 * d,
                5.1454,
                318.0634 + 0.1643573223 * d,
                60.2666,
                0.054900,
                AngleMath.normalize(115.3654 + 13.0649929509 * d));
        double[] ecl = eclipticFromElements(el);

        double ms = sunMeanAnomaly(d);
        double mm = el.meanAnomaly();
        double ls = ms + 282.9404 + 4.70935e-5 * d;
        double lm = mm + el.perihelion() + el.node();
        double dd = lm - ls;
        double f = lm - el.node();

        double lon = ecl[0]
                - 1.274 * AngleMath.sinDeg(mm - 2 * dd)
                + 0.658 * AngleMath.sinDeg(2 * dd)
                - 0.186 * AngleMath.sinDeg(ms)
                - 0.059 * AngleMath.sinDeg(2 * mm - 2 * dd)
                - 0.057 * AngleMath.sinDeg(mm - 2 * dd + ms)
                + 0.053 * AngleMath.sinDeg(mm + 2 * dd)
                + 0.046 * AngleMath.sinDeg(2 * dd - ms)
                + 0.041 * AngleMath.sinDeg(mm - ms)
                - 0.035 * AngleMath.sinDeg(dd)
                - 0.031 * AngleMath.sinDeg(mm + ms)
                - 0.015 * AngleMath.sinDeg(2 * f - 2 * dd)
                + 0.011 * AngleMath.sinDeg(mm - 4 * dd);
        double lat = ecl[1]
                - 0.173 * AngleMath.sinDeg(f - 2 * dd)
                - 0.055 * AngleMath.sinDeg(mm - f - 2 * dd)
                - 0.046 * AngleMath.sinDeg(mm + f - 2 * dd)
                + 0.033 * AngleMath.sinDeg(f + 2 * dd)
                + 0.017 * AngleMath.sinDeg(2 * mm + f);
        double r = ecl[2]
                - 0.58 * AngleMath.cosDeg(mm - 2 * dd)
                - 0.46 * AngleMath.cosDeg(2 * dd);
        return new double[]{AngleMath.normalize(lon), lat, r * EARTH_RADII_TO_AU};
    }

    private static double[] planetHeliocentric(Body body, double d) {
        OrbitalElements el = elementsOf(body, d);
        double[] ecl = eclipticFromElements(el);
        double lon = ecl[0];
        double lat = ecl[1];

        double mj = jupiterMeanAnomaly(d);
        double ms = saturnMeanAnomaly(d);
        switch (body) {
            case JUPITER -> lon += -0.332 * AngleMath.sinDeg(2 * mj - 5 * ms - 67.6)
                    - 0.056 * AngleMath.sinDeg(2 * mj - 2 * ms + 21)
                    + 0.042 * AngleMath.sinDeg(3 * mj - 5 * ms + 21)
                    - 0.036 * AngleMath.sinDeg(mj - 2 * ms)
                    + 0.022 * AngleMath.cosDeg(mj - ms)
                    + 0.023 * AngleMath.sinDeg(2 * mj - 3 * ms + 52)
                    - 0.016 * AngleMath.sinDeg(mj - 5 * ms - 69);
            case SATURN -> {
                lon += 0.812 * AngleMath.sinDeg(2 * mj - 5 * ms - 67.6)
                        - 0.229 * AngleMath.cosDeg(2 * mj - 4 * ms - 2)
                        + 0.119 * AngleMath.sinDeg(mj - 2 * ms - 3)
                        + 0.046 * AngleMath.sinDeg(2 * mj - 6 * ms - 69)
                        + 0.014 * AngleMath.sinDeg(mj - 3 * ms + 32);
                lat += -0.020 * AngleMath.cosDeg(2 * mj - 4 * ms - 2)
                        + 0.018 * AngleMath.sinDeg(2 * mj - 6 * ms - 49);
            }
            case URANUS -> {
                double mu = el.meanAnomaly();
                lon += 0.040 * AngleMath.sinDeg(ms - 2 * mu + 6)
                        + 0.035 * AngleMath.sinDeg(ms - 3 * mu + 33)
                        - 0.015 * AngleMath.sinDeg(mj - mu + 20);
            }
            default -> {
                // unperturbed
            }
        }
        return new double[]{AngleMath.normalize(lon), lat, ecl[2]};
    }

    private static OrbitalElements elementsOf(Body body, double d) {
        return switch (body) {
            case MERCURY -> new OrbitalElements(
                    48.3313 + 3.24587e-5 * d, 7.0047 + 5.00e-8 * d, 29.1241 + 1.01444e-5 * d,
                    0.387098, 0.205635 + 5.59e-10 * d, AngleMath.normalize(168.6562 + 4.0923344368 * d));
            case VENUS -> new OrbitalElements(
                    76.6799 + 2.46590e-5 * d, 3.3946 + 2.75e-8 * d, 54.8910 + 1.38374e-5 * d,
                    0.723330, 0.006773 - 1.302e-9 * d, AngleMath.normalize(48.0052 + 1.6021302244 * d));
            case MARS -> new OrbitalElements(
                    49.5574 + 2.11081e-5 * d, 1.8497 - 1.78e-8 * d, 286.5016 + 2.92961e-5 * d,
                    1.523688, 0.093405 + 2.516e-9 * d, AngleMath.normalize(18.6021 + 0.5240207766 * d));
            case JUPITER -> new OrbitalElements(
                    100.4542 + 2.76854e-5 * d, 1.3030 - 1.557e-7 * d, 273.8777 + 1.64505e-5 * d,
                    5.20256, 0.048498 + 4.469e-9 * d, jupiterMeanAnomaly(d));
            case SATURN -> new OrbitalElements(
                    113.6634 + 2.38980e-5 * d, 2.4886 - 1.081e-7 * d, 339.3939 + 2.97661e-5 * d,
                    9.55475, 0.055546 - 9.499e-9 * d, saturnMeanAnomaly(d));
            case URANUS -> new OrbitalElements(
                    74.0005 + 1.3978e-5 * d, 0.7733 + 1.9e-8 * d, 96.6612 + 3.0565e-5 * d,
                    19.18171 - 1.55e-8 * d, 0.047318 + 7.45e-9 * d, AngleMath.normalize(142.5905 + 0.011725806 * d));
            case NEPTUNE -> new OrbitalElements(
                    131.7806 + 3.0173e-5 * d, 1.7700 - 2.55e-7 * d, 272.8461 - 6.027e-6 * d,
                    30.05826 + 3.313e-8 * d, 0.008606 + 2.15e-9 * d, AngleMath.normalize(260.2471 + 0.005995147 * d));
            default -> throw new IllegalArgumentException("No orbital elements for " + body);
        };
    }

    private static double[] plutoHeliocentric(double d) {
        double s = 50.03 + 0.033459652 * d;
        double p = 238.95 + 0.003968789 * d;
        double lon = 238.9508 + 0.00400703 * d
                - 19.799 * AngleMath.sinDeg(p) + 19.848 * AngleMath.cosDeg(p)
                + 0.897 * AngleMath.sinDeg(2 * p) - 4.956 * AngleMath.cosDeg(2 * p)
                + 0.610 * AngleMath.sinDeg(3 * p) + 1.211 * AngleMath.cosDeg(3 * p)
                - 0.341 * AngleMath.sinDeg(4 * p) - 0.190 * AngleMath.cosDeg(4 * p)
                + 0.128 * AngleMath.sinDeg(5 * p) - 0.034 * AngleMath.cosDeg(5 * p)
                - 0.038 * AngleMath.sinDeg(6 * p) + 0.031 * AngleMath.cosDeg(6 * p)
                + 0.020 * AngleMath.sinDeg(s - p) - 0.010 * AngleMath.cosDeg(s - p);
        double lat = -3.9082
                - 5.453 * AngleMath.sinDeg(p) - 14.975 * AngleMath.cosDeg(p)
                + 3.527 * AngleMath.sinDeg(2 * p) + 1.673 * AngleMath.cosDeg(2 * p)
                - 1.051 * AngleMath.sinDeg(3 * p) + 0.328 * AngleMath.cosDeg(3 * p)
                + 0.179 * AngleMath.sinDeg(4 * p) - 0.292 * AngleMath.cosDeg(4 * p)
                + 0.019 * AngleMath.sinDeg(5 * p) + 0.100 * AngleMath.cosDeg(5 * p)
                - 0.031 * AngleMath.sinDeg(6 * p) - 0.026 * AngleMath.cosDeg(6 * p)
                + 0.011 * AngleMath.cosDeg(s - p);
        double r = 40.72
                + 6.68 * AngleMath.sinDeg(p) + 6.90 * AngleMath.cosDeg(p)
                - 1.18 * AngleMath.sinDeg(2 * p) - 0.03 * AngleMath.cosDeg(2 * p)
                + 0.15 * AngleMath.sinDeg(3 * p) - 0.14 * AngleMath.cosDeg(3 * p);
        return new double[]{AngleMath.normalize(lon + PRECESSION_PER_DAY * d), lat, r};
    }

    private static double[] chironHeliocentric(double d) {
        OrbitalElements el = new OrbitalElements(
                209.379, 6.935, 339.258, 13.6481, 0.3827,
                AngleMath.normalize(27.67 + 0.019548 * d));
        double[] ecl = eclipticFromElements(el);
        return new double[]{AngleMath.normalize(ecl[0] + PRECESSION_PER_DAY * d), ecl[1], ecl[2]};
    }

    /** Adds the Sun's geocentric vector to a heliocentric {lon, lat, r}. */
    private static double[] toGeocentric(double[] helio, double d) {
        double[] sun = sun(d);
        double cosLat = AngleMath.cosDeg(helio[1]);
        double x = helio[2] * cosLat * AngleMath.cosDeg(helio[0]) + sun[2] * AngleMath.cosDeg(sun[0]);
        double y = helio[2] * cosLat * AngleMath.sinDeg(helio[0]) + sun[2] * AngleMath.sinDeg(sun[0]);
        double z = helio[2] * AngleMath.sinDeg(helio[1]);
        double lon = AngleMath.atan2Deg(y, x);
        double lat = Math.toDegrees(Math.atan2(z, Math.hypot(x, y)));
        return new double[]{lon, lat, Math.sqrt(x * x + y * y + z * z)};
    }

    /** Position in the orbit projected onto the ecliptic, as {lon, lat, r}. */
    private static double[] eclipticFromElements(OrbitalElements el) {
        double[] vr = trueAnomalyAndRadius(el.meanAnomaly(), el.eccentricity(), el.semiMajorAxis());
        double r = vr[1];
        double u = vr[0] + el.perihelion();
        double cosN = AngleMath.cosDeg(el.node());
        double sinN = AngleMath.sinDeg(el.node());
        double cosI = AngleMath.cosDeg(el.inclination());
        double x = r * (cosN * AngleMath.cosDeg(u) - sinN * AngleMath.sinDeg(u) * cosI);
        double y = r * (sinN * AngleMath.cosDeg(u) + cosN * AngleMath.sinDeg(u) * cosI);
        double z = r * AngleMath.sinDeg(u) * AngleMath.sinDeg(el.inclination());
        double lon = AngleMath.atan2Deg(y, x);
        double lat = Math.toDegrees(Math.atan2(z, Math.hypot(x, y)));
        return new double[]{lon, lat, r};
    }

    /** Solves Kepler's equation; returns {true anomaly, radius}. */
    private static double[] trueAnomalyAndRadius(double meanAnomaly, double e, double a) {
        double m = Math.toRadians(meanAnomaly);
        double ecc = m + e * Math.sin(m) * (1.0 + e * Math.cos(m));
        for (int i = 0; i < KEPLER_MAX_ITERATIONS; i++) {
            double delta = (ecc - e * Math.sin(ecc) - m) / (1.0 - e * Math.cos(ecc));
            ecc -= delta;
            if (Math.abs(delta) < KEPLER_TOLERANCE) {
                break;
            }
        }
        double xv = a * (Math.cos(ecc) - e);
        double yv = a * Math.sqrt(1.0 - e * e) * Math.sin(ecc);
        return new double[]{Math.toDegrees(Math.atan2(yv, xv)), Math.hypot(xv, yv)};
    }

    private static double sunMeanAnomaly(double d) {
        return AngleMath.normalize(356.0470 + 0.9856002585 * d);
    }

    private static double jupiterMeanAnomaly(double d) {
        return AngleMath.normalize(19.8950 + 0.0830853001 * d);
    }

    private static double saturnMeanAnomaly(double d) {
        return AngleMath.normalize(316.9670 + 0.0334442282 * d);
    }
}
