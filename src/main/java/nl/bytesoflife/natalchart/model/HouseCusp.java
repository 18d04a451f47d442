package nl.bytesoflife.natalchart.model;

/**
 * Start of a house on the ecliptic.
 *
 * @param number    house number, 1..12
 * @param longitude cusp longitude in [0, 360)
 * @param position  sign and degree of the cusp
 */
public record HouseCusp(int number, double longitude, ZodiacPosition position) {

    public HouseCusp {
        if (number < 1 || number > 12) {
            throw new IllegalArgumentException("House number must be in [1, 12]: " + number);
        }
        if (!(longitude >= 0 && longitude < 360)) {
            throw new IllegalArgumentException("Cusp longitude must be in [0, 360): " + longitude);
        }
    }

    public ZodiacSign sign() {
        return position.sign();
    }

    public int degree() {
        return position.degree();
    }
}
