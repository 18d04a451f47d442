package nl.bytesoflife.natalchart.render;

import nl.bytesoflife.natalchart.ChartResult;

/**
 * Turns a calculated chart into its visual forms. Implementations must be deterministic:
 * the same {@link ChartResult} always yields byte-identical output.
 */
public interface ChartRenderer {

    String renderSvg(ChartResult result);

    /** SVG plus the HTML document embedding it. */
    RenderedChart render(ChartResult result);
}
