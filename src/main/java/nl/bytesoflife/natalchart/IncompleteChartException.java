package nl.bytesoflife.natalchart;

public class IncompleteChartException extends ChartException {

    public IncompleteChartException(String message) {
        super(message, CalculationStage.ASSEMBLED);
    }
}
