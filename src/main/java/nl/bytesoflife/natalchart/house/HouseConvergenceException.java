package nl.bytesoflife.natalchart.house;

/**
 * Raised inside the house algorithms when a cusp cannot be computed. Never leaves this package:
 * {@link HouseSystemCalculator} turns it into an equal-house fallback.
 */
class HouseConvergenceException extends RuntimeException {

    HouseConvergenceException(String message) {
        super(message);
    }
}
