package nl.bytesoflife.natalchart.ephemeris;

/**
 * Keplerian elements at one instant. Angles in degrees, semi-major axis in AU
 * (Earth radii for the Moon).
 *
 * @param node          longitude of the ascending node
 * @param inclination   inclination to the ecliptic
 * @param perihelion    argument of perihelion
 * @param semiMajorAxis mean distance
 * @param eccentricity  eccentricity, [0, 1)
 * @param meanAnomaly   mean anomaly
 */
record OrbitalElements(double node, double inclination, double perihelion,
                       double semiMajorAxis, double eccentricity, double meanAnomaly) {
}
