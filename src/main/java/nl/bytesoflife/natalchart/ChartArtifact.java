package nl.bytesoflife.natalchart;

import nl.bytesoflife.natalchart.render.RenderedChart;

/**
 * A calculated chart together with its rendering.
 */
public record ChartArtifact(ChartResult result, RenderedChart rendered) {
}
