package nl.bytesoflife.natalchart.house;

import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.CoordinateNormalizer;
import nl.bytesoflife.natalchart.model.AnglePoint;
import nl.bytesoflife.natalchart.model.ChartAngle;
import nl.bytesoflife.natalchart.model.ChartAngles;
import nl.bytesoflife.natalchart.model.HouseCusp;
import nl.bytesoflife.natalchart.model.HouseSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes house cusps for a moment and place. When the requested system cannot produce
 * twelve cyclically ordered cusps the calculator falls back to {@link HouseSystem#EQUAL}
 * and records why on the returned {@link HouseComputation}.
 */
public class HouseSystemCalculator {

    private static final Logger log = LoggerFactory.getLogger(HouseSystemCalculator.class);

    private static final double ORDER_TOLERANCE = 1e-6;

    public HouseComputation compute(Instant instant, double latitude, double eastLongitude, HouseSystem system) {
        return compute(HouseFrame.at(instant, latitude, eastLongitude), system);
    }

    public HouseComputation compute(HouseFrame frame, HouseSystem system) {
        HouseSystem used = system;
        String reason = null;
        double[] longitudes;
        try {
            longitudes = HouseAlgorithms.forSystem(system).cusps(frame);
            if (!isCyclicallyOrdered(longitudes)) {
                throw new HouseConvergenceException(system + " cusps are not cyclically ordered");
            }
        } catch (HouseConvergenceException e) {
            used = HouseSystem.EQUAL;
            reason = e.getMessage();
            longitudes = HouseAlgorithms.equal(frame);
            log.warn("House system {} unavailable at latitude {}, falling back to {}: {}",
                    system, frame.latitude(), used, reason);
        }

        List<HouseCusp> cusps = new ArrayList<>(12);
        for (int i = 0; i < 12; i++) {
            double lon = AngleMath.normalize(longitudes[i]);
            cusps.add(new HouseCusp(i + 1, lon, CoordinateNormalizer.normalize(lon)));
        }
        return new HouseComputation(cusps, anglesOf(frame), system, used, reason != null, reason);
    }

    public static ChartAngles anglesOf(HouseFrame frame) {
        return new ChartAngles(
                angle(ChartAngle.ASCENDANT, frame.ascendant()),
                angle(ChartAngle.MIDHEAVEN, frame.midheaven()),
                angle(ChartAngle.DESCENDANT, frame.descendant()),
                angle(ChartAngle.IMUM_COELI, frame.imumCoeli()));
    }

    private static AnglePoint angle(ChartAngle angle, double longitude) {
        double lon = AngleMath.normalize(longitude);
        return new AnglePoint(angle, lon, CoordinateNormalizer.normalize(lon));
    }

    /** Every forward arc between consecutive cusps is positive and together they go round exactly once. */
    static boolean isCyclicallyOrdered(double[] cusps) {
        double total = 0;
        for (int i = 0; i < 12; i++) {
            double value = cusps[i];
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return false;
            }
            double arc = AngleMath.forwardArc(cusps[i], cusps[(i + 1) % 12]);
            if (arc <= 0) {
                return false;
            }
            total += arc;
        }
        return Math.abs(total - 360.0) < ORDER_TOLERANCE;
    }
}
