package nl.bytesoflife.natalchart.render;

import nl.bytesoflife.natalchart.ChartResult;
import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.model.AnglePoint;
import nl.bytesoflife.natalchart.model.Aspect;
import nl.bytesoflife.natalchart.model.AspectQuality;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.CelestialBody;
import nl.bytesoflife.natalchart.model.ChartAngle;
import nl.bytesoflife.natalchart.model.ChartPoint;
import nl.bytesoflife.natalchart.model.HouseCusp;
import nl.bytesoflife.natalchart.model.ZodiacSign;

import java.util.List;
import java.util.Locale;

/**
 * Draws the chart wheel as SVG: zodiac band, house cusps and numbers, the two axes, body glyphs
 * with degree labels, and aspect lines in the centre.
 *
 * <p>Output depends only on the {@link ChartResult} content (the calculation timestamp is not
 * drawn) and all numbers are written with {@link Locale#US} at fixed precision.</p>
 */
public class SvgChartRenderer implements ChartRenderer {

    private final ChartSvgOptions options;

    public SvgChartRenderer() {
        this(new ChartSvgOptions());
    }

    /** The options are copied; changing them afterwards does not affect this renderer. */
    public SvgChartRenderer(ChartSvgOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Render options must not be null");
        }
        this.options = options.copy();
    }

    /** A copy of the options in use. */
    public ChartSvgOptions getOptions() {
        return options.copy();
    }

    @Override
    public RenderedChart render(ChartResult result) {
        String svg = renderSvg(result);
        return RenderedChart.of(svg, HtmlChartDocument.build(result, svg));
    }

    @Override
    public String renderSvg(ChartResult result) {
        int size = options.getSize();
        WheelGeometry geometry = new WheelGeometry(size / 2.0, size / 2.0, options.outerRadius(),
                result.getAngles().ascendant().longitude());

        StringBuilder svg = new StringBuilder();
        svg.append(String.format(Locale.US,
                "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\" font-family=\"%s\">\n",
                size, size, size, size, escape(options.getFontFamily())));
        svg.append("<title>").append(escape(title(result))).append("</title>\n");
        svg.append(String.format(Locale.US, "<rect width=\"%d\" height=\"%d\" fill=\"%s\"/>\n",
                size, size, options.getBackgroundColor()));

        appendZodiac(svg, geometry);
        appendHouses(svg, geometry, result.getCusps());
        appendAxes(svg, geometry, result);
        appendAspects(svg, geometry, result);
        appendBodies(svg, geometry, result.getBodies());

        svg.append("</svg>\n");
        return svg.toString();
    }

    static String title(ChartResult result) {
        return result.getBirthInput().hasLabel() ? result.getBirthInput().label() : "Natal chart";
    }

    private void appendZodiac(StringBuilder svg, WheelGeometry g) {
        double inner = options.getZodiacInnerRadius();
        double outerPx = g.outerRadius();
        double innerPx = g.outerRadius() * inner;
        svg.append("<g id=\"zodiac\">\n");
        for (ZodiacSign sign : ZodiacSign.values()) {
            double start = sign.startLongitude();
            double end = start + 30.0;
            svg.append(String.format(Locale.US,
                    "<path d=\"M %s %s A %s %s 0 0 0 %s %s L %s %s A %s %s 0 0 1 %s %s Z\" fill=\"%s\" stroke=\"%s\" stroke-width=\"1\"/>\n",
                    fmt(g.x(start, 1.0)), fmt(g.y(start, 1.0)), fmt(outerPx), fmt(outerPx),
                    fmt(g.x(end, 1.0)), fmt(g.y(end, 1.0)),
                    fmt(g.x(end, inner)), fmt(g.y(end, inner)), fmt(innerPx), fmt(innerPx),
                    fmt(g.x(start, inner)), fmt(g.y(start, inner)),
                    options.getElementColor(sign.getElement()), options.getLineColor()));
            double mid = start + 15.0;
            double r = (1.0 + inner) / 2.0;
            svg.append(String.format(Locale.US,
                    "<text x=\"%s\" y=\"%s\" font-size=\"%s\" text-anchor=\"middle\" dominant-baseline=\"central\" fill=\"%s\">%s</text>\n",
                    fmt(g.x(mid, r)), fmt(g.y(mid, r)), fmt(outerPx * (1.0 - inner) * 0.6),
                    options.getTextColor(), sign.getGlyph()));
        }
        svg.append("</g>\n");
    }

    private void appendHouses(StringBuilder svg, WheelGeometry g, List<HouseCusp> cusps) {
        double inner = options.getAspectRadius();
        double outer = options.getZodiacInnerRadius();
        svg.append("<g id=\"houses\">\n");
        svg.append(circle(g, outer, "none", options.getLineColor(), 1));
        svg.append(circle(g, inner, "none", options.getLineColor(), 1));
        for (int i = 0; i < cusps.size(); i++) {
            HouseCusp cusp = cusps.get(i);
            double lon = cusp.longitude();
            svg.append(line(g, lon, inner, lon, outer, options.getLineColor(), 1, null));

            double next = cusps.get((i + 1) % cusps.size()).longitude();
            double mid = lon + AngleMath.forwardArc(lon, next) / 2.0;
            double r = options.getHouseNumberRadius();
            svg.append(String.format(Locale.US,
                    "<text x=\"%s\" y=\"%s\" font-size=\"12\" text-anchor=\"middle\" dominant-baseline=\"central\" fill=\"%s\">%d</text>\n",
                    fmt(g.x(mid, r)), fmt(g.y(mid, r)), options.getTextColor(), cusp.number()));
        }
        svg.append("</g>\n");
    }

    private void appendAxes(StringBuilder svg, WheelGeometry g, ChartResult result) {
        svg.append("<g id=\"axes\">\n");
        AnglePoint asc = result.getAngles().ascendant();
        AnglePoint mc = result.getAngles().midheaven();
        svg.append(line(g, asc.longitude(), 1.0, result.getAngles().descendant().longitude(), 1.0,
                options.getLineColor(), 2, null));
        svg.append(line(g, mc.longitude(), 1.0, result.getAngles().imumCoeli().longitude(), 1.0,
                options.getLineColor(), 2, null));
        for (ChartAngle angle : List.of(ChartAngle.ASCENDANT, ChartAngle.MIDHEAVEN)) {
            AnglePoint point = result.getAngles().get(angle);
            double r = options.getZodiacInnerRadius() - 0.04;
            double lon = point.longitude() + 3.0;
            svg.append(String.format(Locale.US,
                    "<text x=\"%s\" y=\"%s\" font-size=\"11\" font-weight=\"bold\" text-anchor=\"middle\" dominant-baseline=\"central\" fill=\"%s\">%s</text>\n",
                    fmt(g.x(lon, r)), fmt(g.y(lon, r)), options.getTextColor(), angle.getAbbreviation()));
        }
        svg.append("</g>\n");
    }

    private void appendAspects(StringBuilder svg, WheelGeometry g, ChartResult result) {
        double r = options.getAspectRadius();
        svg.append("<g id=\"aspects\">\n");
        for (Aspect aspect : result.getAspects()) {
            double a = longitudeOf(result, aspect.getFirst());
            double b = longitudeOf(result, aspect.getSecond());
            AspectQuality quality = aspect.getQuality();
            String dash = quality == AspectQuality.MINOR ? "4 3" : null;
            svg.append(line(g, a, r, b, r, options.getAspectColor(quality), 1, dash));
        }
        svg.append("</g>\n");
    }

    private void appendBodies(StringBuilder svg, WheelGeometry g, List<CelestialBody> bodies) {
        double[] longitudes = new double[bodies.size()];
        for (int i = 0; i < bodies.size(); i++) {
            longitudes[i] = bodies.get(i).getLongitude();
        }
        List<GlyphLayout.Placement> placements = GlyphLayout.place(longitudes, g, options);
        double size = options.getGlyphSize();

        svg.append("<g id=\"bodies\">\n");
        for (GlyphLayout.Placement p : placements) {
            CelestialBody body = bodies.get(p.index());
            svg.append(String.format(Locale.US,
                    "<text class=\"body\" data-body=\"%s\" x=\"%s\" y=\"%s\" font-size=\"%s\" text-anchor=\"middle\" dominant-baseline=\"central\" fill=\"%s\">%s</text>\n",
                    body.getBody().name(), fmt(p.x()), fmt(p.y()), fmt(size * 0.8), options.getTextColor(),
                    body.getBody().getGlyph()));

            double labelRadius = p.radius() - size / g.outerRadius() * 0.75;
            String label = String.format(Locale.US, "%d°%02d'", body.getDegree(), body.getMinute());
            if (body.isRetrograde()) {
                label += " ℞";
            }
            svg.append(String.format(Locale.US,
                    "<text x=\"%s\" y=\"%s\" font-size=\"9\" text-anchor=\"middle\" dominant-baseline=\"central\" fill=\"%s\">%s</text>\n",
                    fmt(g.x(body.getLongitude(), labelRadius)), fmt(g.y(body.getLongitude(), labelRadius)),
                    options.getTextColor(), label));
        }
        svg.append("</g>\n");
    }

    private static double longitudeOf(ChartResult result, ChartPoint point) {
        if (point instanceof Body body) {
            return result.getBody(body).getLongitude();
        }
        if (point instanceof ChartAngle angle) {
            return result.getAngles().get(angle).longitude();
        }
        throw new IllegalArgumentException("Unsupported chart point: " + point);
    }

    private static String circle(WheelGeometry g, double fraction, String fill, String stroke, int width) {
        return String.format(Locale.US,
                "<circle cx=\"%s\" cy=\"%s\" r=\"%s\" fill=\"%s\" stroke=\"%s\" stroke-width=\"%d\"/>\n",
                fmt(g.cx()), fmt(g.cy()), fmt(g.outerRadius() * fraction), fill, stroke, width);
    }

    private static String line(WheelGeometry g, double lonA, double rA, double lonB, double rB,
                               String stroke, int width, String dash) {
        return String.format(Locale.US,
                "<line x1=\"%s\" y1=\"%s\" x2=\"%s\" y2=\"%s\" stroke=\"%s\" stroke-width=\"%d\"%s/>\n",
                fmt(g.x(lonA, rA)), fmt(g.y(lonA, rA)), fmt(g.x(lonB, rB)), fmt(g.y(lonB, rB)),
                stroke, width, dash != null ? " stroke-dasharray=\"" + dash + "\"" : "");
    }

    /** Two decimals, US locale, never "-0.00". */
    static String fmt(double value) {
        String s = String.format(Locale.US, "%.2f", value);
        return s.equals("-0.00") ? "0.00" : s;
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
