package nl.bytesoflife.natalchart;

/**
 * Base class of the errors a chart request can end with. Every subtype is terminal for the
 * request: no partial result is produced and retrying with the same input fails the same way.
 */
public class ChartException extends RuntimeException {

    private final CalculationStage stage;

    public ChartException(String message, CalculationStage stage) {
        super(message);
        this.stage = stage;
    }

    public ChartException(String message, CalculationStage stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    /** The stage that was being attempted when the request failed. */
    public CalculationStage getStage() {
        return stage;
    }
}
