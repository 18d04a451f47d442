package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.ZodiacPosition;

/**
 * A transiting body and the natal house it passes through.
 */
public record TransitPosition(Body body, double longitude, double speed, ZodiacPosition position,
                              int natalHouse, boolean retrograde) {
}
