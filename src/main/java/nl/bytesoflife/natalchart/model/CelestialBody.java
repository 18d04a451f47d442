package nl.bytesoflife.natalchart.model;

import java.util.Locale;

/**
 * A body placed in a chart: raw coordinates plus the derived zodiac and house placement.
 */
public class CelestialBody {

    private final Body body;
    private final double longitude;
    private final double latitude;
    private final double distance;
    private final double speed;
    private final ZodiacPosition position;
    private final int house;
    private final boolean retrograde;
    private final Dignity dignity;

    public CelestialBody(Body body, double longitude, double latitude, double distance, double speed,
                         ZodiacPosition position, int house, boolean retrograde, Dignity dignity) {
        if (body == null || position == null) {
            throw new IllegalArgumentException("Body and position are required");
        }
        if (!(longitude >= 0 && longitude < 360)) {
            throw new IllegalArgumentException("Longitude must be in [0, 360): " + longitude);
        }
        if (house < 1 || house > 12) {
            throw new IllegalArgumentException("House must be in [1, 12]: " + house);
        }
        this.body = body;
        this.longitude = longitude;
        this.latitude = latitude;
        this.distance = distance;
        this.speed = speed;
        this.position = position;
        this.house = house;
        this.retrograde = retrograde;
        this.dignity = dignity;
    }

    public Body getBody() { return body; }
    public double getLongitude() { return longitude; }
    public double getLatitude() { return latitude; }
    public double getDistance() { return distance; }

    /** Longitudinal speed in degrees per day, negative when retrograde. */
    public double getSpeed() { return speed; }

    public ZodiacPosition getPosition() { return position; }
    public ZodiacSign getSign() { return position.sign(); }
    public int getDegree() { return position.degree(); }
    public int getMinute() { return position.minute(); }
    public int getSecond() { return position.second(); }
    public int getHouse() { return house; }
    public boolean isRetrograde() { return retrograde; }

    /** Essential dignity, or null when the body has none in its sign or dignities are disabled. */
    public Dignity getDignity() { return dignity; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(body.getDisplayName()).append(' ').append(position.format());
        if (retrograde) sb.append(" R");
        sb.append(String.format(Locale.US, " house %d", house));
        if (dignity != null) sb.append(" (").append(dignity.name().toLowerCase()).append(')');
        return sb.toString();
    }
}
