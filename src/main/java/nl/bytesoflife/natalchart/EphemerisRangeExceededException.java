package nl.bytesoflife.natalchart;

import java.time.Instant;

public class EphemerisRangeExceededException extends ChartException {

    private final Instant instant;

    public EphemerisRangeExceededException(Instant instant, Instant supportedStart, Instant supportedEnd) {
        super("Instant " + instant + " outside supported ephemeris range ["
                + supportedStart + ", " + supportedEnd + "]", CalculationStage.EPHEMERIS_RESOLVED);
        this.instant = instant;
    }

    public Instant getInstant() {
        return instant;
    }
}
