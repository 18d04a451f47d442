package nl.bytesoflife.natalchart.ephemeris;

import nl.bytesoflife.natalchart.EphemerisRangeExceededException;
import nl.bytesoflife.natalchart.model.Body;

import java.time.Instant;

/**
 * Source of body positions. Implementations must be safe for concurrent use.
 */
public interface EphemerisProvider {

    /**
     * @throws EphemerisRangeExceededException if {@code instant} lies outside
     *         [{@link #supportedStart()}, {@link #supportedEnd()}]
     */
    EphemerisPosition positionAt(Instant instant, Body body);

    Instant supportedStart();

    Instant supportedEnd();

    default boolean supports(Instant instant) {
        return !instant.isBefore(supportedStart()) && !instant.isAfter(supportedEnd());
    }
}
