package nl.bytesoflife.natalchart.ephemeris;

/**
 * Raw geocentric ecliptic position of a body at one instant, referred to the equinox of date.
 *
 * @param longitude ecliptic longitude in degrees, [0, 360)
 * @param latitude  ecliptic latitude in degrees
 * @param distance  distance from the Earth in AU, 0 for calculated points
 * @param speed     longitudinal speed in degrees per day
 */
public record EphemerisPosition(double longitude, double latitude, double distance, double speed) {
}
