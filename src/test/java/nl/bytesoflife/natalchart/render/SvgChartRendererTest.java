package nl.bytesoflife.natalchart.render;

import nl.bytesoflife.natalchart.ChartCalculator;
import nl.bytesoflife.natalchart.ChartConfig;
import nl.bytesoflife.natalchart.ChartResult;
import nl.bytesoflife.natalchart.StubEphemeris;
import nl.bytesoflife.natalchart.model.AspectType;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SvgChartRendererTest {

    private static final Instant BIRTH = Instant.parse("1990-04-15T18:30:00Z");

    private final SvgChartRenderer renderer = new SvgChartRenderer();

    private static ChartResult chart(StubEphemeris stub, String label, Instant now) {
        ChartCalculator calculator = new ChartCalculator(stub, new SvgChartRenderer(), Clock.fixed(now, ZoneOffset.UTC));
        return calculator.calculateChart(new BirthInput(BIRTH, 40.7128, -74.006, label), ChartConfig.defaults());
    }

    private static ChartResult chart() {
        return chart(new StubEphemeris(), "Test chart", Instant.parse("2024-01-01T00:00:00Z"));
    }

    private static Document parse(String svg) throws Exception {
        DocumentBuilder builder = DocumentBuilderFactory.newInstance().newDocumentBuilder();
        return builder.parse(new ByteArrayInputStream(svg.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void svgIsWellFormedWithAllGroups() throws Exception {
        Document doc = parse(renderer.renderSvg(chart()));
        Element root = doc.getDocumentElement();
        assertEquals("svg", root.getTagName());
        assertEquals("800", root.getAttribute("width"));

        Set<String> groups = new HashSet<>();
        NodeList gs = doc.getElementsByTagName("g");
        for (int i = 0; i < gs.getLength(); i++) {
            groups.add(((Element) gs.item(i)).getAttribute("id"));
        }
        assertEquals(Set.of("zodiac", "houses", "axes", "aspects", "bodies"), groups);
    }

    @Test
    void drawsEveryBodyOnce() throws Exception {
        Document doc = parse(renderer.renderSvg(chart()));
        NodeList texts = doc.getElementsByTagName("text");
        Set<String> drawn = new HashSet<>();
        for (int i = 0; i < texts.getLength(); i++) {
            Element text = (Element) texts.item(i);
            if ("body".equals(text.getAttribute("class"))) {
                assertTrue(drawn.add(text.getAttribute("data-body")));
            }
        }
        assertEquals(Body.CLASSICAL.size(), drawn.size());
        assertTrue(drawn.contains("SUN"));
    }

    @Test
    void outputDependsOnlyOnChartContent() {
        ChartResult first = chart(new StubEphemeris(), "Same", Instant.parse("2024-01-01T00:00:00Z"));
        ChartResult second = chart(new StubEphemeris(), "Same", Instant.parse("2025-06-30T12:00:00Z"));

        RenderedChart a = renderer.render(first);
        RenderedChart b = renderer.render(second);
        assertEquals(a.svg(), b.svg());
        assertEquals(a.contentHash(), b.contentHash());
        assertEquals(a.html(), b.html());
        assertEquals(RenderedChart.sha256(a.svg()), a.contentHash());
    }

    @Test
    void laterOptionChangesDoNotAffectRenderer() {
        ChartSvgOptions options = new ChartSvgOptions().setSize(600);
        SvgChartRenderer configured = new SvgChartRenderer(options);
        ChartResult result = chart();
        RenderedChart before = configured.render(result);

        options.setSize(1000).setLineColor("#ff0000");
        configured.getOptions().setGlyphLevels(1);
        RenderedChart after = configured.render(result);

        assertEquals(before.svg(), after.svg());
        assertEquals(before.html(), after.html());
        assertTrue(after.svg().contains("width=\"600\""));
        assertEquals(600, configured.getOptions().getSize());
        assertEquals(3, configured.getOptions().getGlyphLevels());
    }

    @Test
    void differentChartsHashDifferently() {
        ChartResult moved = chart(new StubEphemeris().set(Body.VENUS, 200.0, 1.0), "Test chart",
                Instant.parse("2024-01-01T00:00:00Z"));
        assertNotEquals(renderer.render(chart()).contentHash(), renderer.render(moved).contentHash());
    }

    @Test
    void numbersIgnoreDefaultLocale() {
        ChartResult result = chart();
        String expected = renderer.renderSvg(result);
        Locale saved = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);
            assertEquals(expected, renderer.renderSvg(result));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void minorAspectsAreDashed() {
        StubEphemeris stub = new StubEphemeris()
                .set(Body.SUN, 0.0, 1.0)
                .set(Body.SATURN, 45.5, 0.1);
        ChartResult result = chart(stub, "Minor", Instant.parse("2024-01-01T00:00:00Z"));
        assertTrue(result.getAspects().stream().anyMatch(a -> a.getType() == AspectType.SEMISQUARE));
        assertTrue(renderer.renderSvg(result).contains("stroke-dasharray"));
    }

    @Test
    void labelIsEscaped() throws Exception {
        ChartResult result = chart(new StubEphemeris(), "Tom & Jerry <1990>", Instant.parse("2024-01-01T00:00:00Z"));
        String svg = renderer.renderSvg(result);
        assertTrue(svg.contains("<title>Tom &amp; Jerry &lt;1990&gt;</title>"));
        assertEquals("Tom & Jerry <1990>", parse(svg).getElementsByTagName("title").item(0).getTextContent());
    }

    @Test
    void htmlEmbedsSvgAndTables() {
        RenderedChart rendered = renderer.render(chart());
        String html = rendered.html();
        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains(rendered.svg()));
        assertTrue(html.contains("<table class=\"positions\">"));
        assertTrue(html.contains("<td>Sun</td>"));
        assertTrue(html.contains("<html lang=\"en\">"));
    }

    @Test
    void formatting() {
        assertEquals("0.00", SvgChartRenderer.fmt(-0.001));
        assertEquals("1234.57", SvgChartRenderer.fmt(1234.5678));
        assertEquals("-3.50", SvgChartRenderer.fmt(-3.5));
        assertEquals("a&apos;b&quot;", SvgChartRenderer.escape("a'b\""));
    }
}
