package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.ChartResult;

import java.time.Instant;

/**
 * The moment the Sun returns to its natal longitude, and the chart cast for it.
 *
 * @param residual remaining difference to the natal Sun longitude, in degrees
 */
public record SolarReturn(int year, Instant instant, double residual, ChartResult chart) {
}
