package nl.bytesoflife.natalchart.render;

import nl.bytesoflife.natalchart.ChartResult;
import nl.bytesoflife.natalchart.model.CelestialBody;
import nl.bytesoflife.natalchart.model.HouseCusp;

import java.util.Locale;

/**
 * Printable HTML document around an already rendered SVG. The wheel is embedded as is and the
 * position tables are read from the {@link ChartResult}; nothing is recalculated.
 */
final class HtmlChartDocument {

    private HtmlChartDocument() {
    }

    static String build(ChartResult result, String svg) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n");
        html.append("<html lang=\"").append(SvgChartRenderer.escape(result.getLanguage())).append("\">\n");
        html.append("<head>\n<meta charset=\"utf-8\">\n");
        html.append("<title>").append(SvgChartRenderer.escape(SvgChartRenderer.title(result))).append("</title>\n");
        html.append("<style>body{font-family:sans-serif;margin:2em}figure{margin:0}"
                + "table{border-collapse:collapse;margin-top:1em}td,th{padding:2px 8px;text-align:left}"
                + "@media print{body{margin:0}}</style>\n");
        html.append("</head>\n<body>\n");
        html.append("<figure class=\"natal-chart\">\n").append(svg).append("</figure>\n");

        html.append("<table class=\"positions\">\n<tr><th>Body</th><th>Position</th><th>House</th></tr>\n");
        for (CelestialBody body : result.getBodies()) {
            html.append(String.format(Locale.US, "<tr><td>%s</td><td>%s%s</td><td>%d</td></tr>\n",
                    body.getBody().getDisplayName(), body.getPosition().format(),
                    body.isRetrograde() ? " R" : "", body.getHouse()));
        }
        html.append("</table>\n");

        html.append("<table class=\"houses\">\n<tr><th>House</th><th>Cusp</th></tr>\n");
        for (HouseCusp cusp : result.getCusps()) {
            html.append(String.format(Locale.US, "<tr><td>%d</td><td>%s</td></tr>\n",
                    cusp.number(), cusp.position().format()));
        }
        html.append("</table>\n");
        html.append(String.format(Locale.US, "<p class=\"house-system\">%s%s</p>\n",
                result.getHouseSystemUsed(),
                result.isFallbackOccurred() ? " (requested " + result.getHouseSystemRequested() + ")" : ""));
        html.append("</body>\n</html>\n");
        return html.toString();
    }
}
