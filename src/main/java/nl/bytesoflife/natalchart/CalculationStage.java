package nl.bytesoflife.natalchart;

/**
 * Stages a chart request moves through. {@link #FAILED} and {@link #COMPLETED} are terminal.
 */
public enum CalculationStage {
    RECEIVED,
    EPHEMERIS_RESOLVED,
    HOUSES_COMPUTED,
    BODIES_ASSIGNED,
    ASPECTS_COMPUTED,
    ASSEMBLED,
    RENDERED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
