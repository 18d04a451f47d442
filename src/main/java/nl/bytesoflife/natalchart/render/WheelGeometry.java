package nl.bytesoflife.natalchart.render;

import nl.bytesoflife.natalchart.coordinate.AngleMath;

/**
 * Maps ecliptic longitude to canvas coordinates: Ascendant at nine o'clock, longitude
 * increasing counter-clockwise.
 */
record WheelGeometry(double cx, double cy, double outerRadius, double ascendant) {

    double angle(double longitude) {
        return 180.0 + (longitude - ascendant);
    }

    double x(double longitude, double fraction) {
        return cx + outerRadius * fraction * AngleMath.cosDeg(angle(longitude));
    }

    double y(double longitude, double fraction) {
        return cy - outerRadius * fraction * AngleMath.sinDeg(angle(longitude));
    }
}
