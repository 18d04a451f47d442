package nl.bytesoflife.natalchart.house;

import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.model.HouseCusp;

import java.util.List;

/**
 * Places longitudes in houses. House n spans {@code [cusp n, cusp n+1)} in the direction of
 * increasing longitude, so a point exactly on a cusp belongs to the house that starts there.
 */
public final class HouseAssigner {

    private HouseAssigner() {
    }

    public static int houseOf(double longitude, List<HouseCusp> cusps) {
        if (cusps.size() != 12) {
            throw new IllegalArgumentException("Exactly 12 cusps required, got " + cusps.size());
        }
        double lon = AngleMath.normalize(longitude);
        for (int i = 0; i < 12; i++) {
            double start = cusps.get(i).longitude();
            double end = cusps.get((i + 1) % 12).longitude();
            if (AngleMath.forwardArc(start, lon) < AngleMath.forwardArc(start, end)) {
                return cusps.get(i).number();
            }
        }
        throw new IllegalStateException("Cusps are not cyclically ordered; no house contains " + lon);
    }
}
