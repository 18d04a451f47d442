package nl.bytesoflife.natalchart.aspect;

import nl.bytesoflife.natalchart.model.ChartPoint;

/**
 * Input to aspect detection: a point, where it is and how fast it moves (degrees per day).
 */
public record AspectPoint(ChartPoint point, double longitude, double speed) {

    public AspectPoint {
        if (point == null) {
            throw new IllegalArgumentException("Point must not be null");
        }
    }
}
