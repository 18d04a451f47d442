package nl.bytesoflife.natalchart.model;

/**
 * A chart angle (Ascendant, Midheaven, ...) with its zodiac position.
 */
public record AnglePoint(ChartAngle angle, double longitude, ZodiacPosition position) {

    public ZodiacSign sign() {
        return position.sign();
    }
}
