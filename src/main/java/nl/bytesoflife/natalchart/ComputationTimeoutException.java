package nl.bytesoflife.natalchart;

import java.time.Duration;

public class ComputationTimeoutException extends ChartException {

    public ComputationTimeoutException(String message, CalculationStage stage) {
        super(message, stage);
    }

    public ComputationTimeoutException(Duration budget, CalculationStage stage) {
        super("Chart computation exceeded its budget of " + budget.toMillis() + "ms", stage);
    }
}
