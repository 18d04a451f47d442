package nl.bytesoflife.natalchart.model;

import java.time.Instant;

/**
 * Birth moment and place. The instant is already resolved to UTC by the caller.
 *
 * @param instant   birth instant in UTC
 * @param latitude  geographic latitude in degrees, north positive, [-90, 90]
 * @param longitude geographic longitude in degrees, east positive, [-180, 180]
 * @param label     optional display label, may be null
 */
public record BirthInput(Instant instant, double latitude, double longitude, String label) {

    public BirthInput(Instant instant, double latitude, double longitude) {
        this(instant, latitude, longitude, null);
    }

    public boolean hasLabel() {
        return label != null && !label.isBlank();
    }
}
