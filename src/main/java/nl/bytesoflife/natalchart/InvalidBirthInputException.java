package nl.bytesoflife.natalchart;

public class InvalidBirthInputException extends ChartException {

    public InvalidBirthInputException(String message) {
        super(message, CalculationStage.RECEIVED);
    }
}
