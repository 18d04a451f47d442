package nl.bytesoflife.natalchart;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import nl.bytesoflife.natalchart.ephemeris.EphemerisPosition;
import nl.bytesoflife.natalchart.ephemeris.EphemerisProvider;
import nl.bytesoflife.natalchart.ephemeris.KeplerianEphemeris;
import nl.bytesoflife.natalchart.house.HouseFrame;
import nl.bytesoflife.natalchart.model.Aspect;
import nl.bytesoflife.natalchart.model.AspectType;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.CelestialBody;
import nl.bytesoflife.natalchart.model.ChartAngle;
import nl.bytesoflife.natalchart.model.Dignity;
import nl.bytesoflife.natalchart.model.HouseSystem;
import nl.bytesoflife.natalchart.model.NodeMode;
import nl.bytesoflife.natalchart.model.ZodiacSign;
import nl.bytesoflife.natalchart.render.SvgChartRenderer;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class ChartCalculatorTest {

    private static final Instant BIRTH = Instant.parse("1990-04-15T18:30:00Z");
    private static final double NYC_LAT = 40.7128;
    private static final double NYC_LON = -74.006;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final BirthInput newYork = new BirthInput(BIRTH, NYC_LAT, NYC_LON, "New York");

    private static ChartCalculator withStub(StubEphemeris stub) {
        return new ChartCalculator(stub, new SvgChartRenderer(), CLOCK);
    }

    @Test
    void newYorkChart() {
        ChartCalculator calculator = new ChartCalculator(new KeplerianEphemeris(), new SvgChartRenderer(), CLOCK);
        ChartResult result = calculator.calculateChart(newYork, ChartConfig.defaults());

        CelestialBody sun = result.getBody(Body.SUN);
        assertEquals(ZodiacSign.ARIES, sun.getSign());
        assertEquals(25, sun.getDegree());
        assertEquals(9, sun.getHouse());
        assertEquals(Dignity.EXALTATION, sun.getDignity());
        assertFalse(sun.isRetrograde());

        assertEquals(12, result.getCusps().size());
        assertEquals(HouseSystem.PLACIDUS, result.getHouseSystemUsed());
        assertFalse(result.isFallbackOccurred());
        assertNull(result.getFallbackReason());
        assertEquals(ZodiacSign.LEO, result.getAngles().ascendant().sign());
        assertEquals(ZodiacSign.TAURUS, result.getAngles().midheaven().sign());
        assertEquals(146.17, result.getCusp(1).longitude(), 0.02);
        assertEquals(49.59, result.getCusp(10).longitude(), 0.02);

        assertEquals(ZodiacSign.ARIES, result.getSolarSet().getSunSign());
        assertEquals(ZodiacSign.SAGITTARIUS, result.getSolarSet().getFifthHouseSign());
        assertEquals(CLOCK.instant(), result.getCalculatedAt());
        assertEquals(Body.CLASSICAL.size(), result.getBodies().size());

        for (Aspect aspect : result.getAspects()) {
            assertTrue(aspect.getFirst().canonicalOrder() < aspect.getSecond().canonicalOrder());
        }
    }

    @Test
    void highLatitudeFallsBackToEqualHouses() {
        ChartCalculator calculator = withStub(new StubEphemeris());
        ChartResult result = calculator.calculateChart(new BirthInput(BIRTH, 80.0, NYC_LON), ChartConfig.defaults());

        assertEquals(HouseSystem.PLACIDUS, result.getHouseSystemRequested());
        assertEquals(HouseSystem.EQUAL, result.getHouseSystemUsed());
        assertTrue(result.isFallbackOccurred());
        assertTrue(result.getFallbackReason().contains("circumpolar"), result.getFallbackReason());
        for (int i = 1; i < 12; i++) {
            double arc = result.getCusp(i + 1).longitude() - result.getCusp(i).longitude();
            assertEquals(30.0, (arc + 360.0) % 360.0, 1e-9);
        }
    }

    @Test
    void poleIsAccepted() {
        ChartResult result = withStub(new StubEphemeris())
                .calculateChart(new BirthInput(BIRTH, 90.0, 0.0), ChartConfig.defaults());
        assertEquals(12, result.getCusps().size());
    }

    @Test
    void outsideEphemerisRange() {
        ChartCalculator calculator = withStub(new StubEphemeris());
        EphemerisRangeExceededException e = assertThrows(EphemerisRangeExceededException.class,
                () -> calculator.calculateChart(new BirthInput(Instant.parse("1850-06-01T12:00:00Z"), 0, 0),
                        ChartConfig.defaults()));
        assertEquals(CalculationStage.EPHEMERIS_RESOLVED, e.getStage());
        assertEquals(Instant.parse("1850-06-01T12:00:00Z"), e.getInstant());

        ChartCalculator keplerian = new ChartCalculator();
        assertThrows(EphemerisRangeExceededException.class,
                () -> keplerian.calculateChart(new BirthInput(Instant.parse("2300-01-01T00:00:00Z"), 0, 0),
                        ChartConfig.defaults()));
    }

    @Test
    void invalidInput() {
        ChartCalculator calculator = withStub(new StubEphemeris());
        ChartConfig config = ChartConfig.defaults();

        InvalidBirthInputException e = assertThrows(InvalidBirthInputException.class,
                () -> calculator.calculateChart(new BirthInput(BIRTH, 91.0, 0.0), config));
        assertEquals(CalculationStage.RECEIVED, e.getStage());
        assertThrows(InvalidBirthInputException.class,
                () -> calculator.calculateChart(new BirthInput(BIRTH, 0.0, -180.5), config));
        assertThrows(InvalidBirthInputException.class,
                () -> calculator.calculateChart(new BirthInput(BIRTH, Double.NaN, 0.0), config));
        assertThrows(InvalidBirthInputException.class,
                () -> calculator.calculateChart(new BirthInput(null, 0.0, 0.0), config));
        assertThrows(InvalidBirthInputException.class,
                () -> calculator.calculateChart(null, config));
    }

    @Test
    void exceedingTheBudgetTimesOut() {
        StubEphemeris slow = new StubEphemeris().withDelay(Duration.ofMillis(40));
        ChartConfig config = ChartConfig.builder().computationTimeout(Duration.ofMillis(100)).build();

        ComputationTimeoutException e = assertThrows(ComputationTimeoutException.class,
                () -> withStub(slow).calculateChart(newYork, config));
        assertEquals(CalculationStage.EPHEMERIS_RESOLVED, e.getStage());
    }

    @Test
    void unexpectedFailureNamesTheStage() {
        EphemerisProvider broken = new StubEphemeris() {
            @Override
            public EphemerisPosition positionAt(Instant instant, Body body) {
                throw new IllegalStateException("data file corrupt");
            }
        };
        ChartException e = assertThrows(ChartException.class,
                () -> new ChartCalculator(broken).calculateChart(newYork, ChartConfig.defaults()));
        assertEquals(CalculationStage.EPHEMERIS_RESOLVED, e.getStage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void optionalBodies() {
        ChartConfig config = ChartConfig.builder()
                .includeChiron(true)
                .includeLilith(true)
                .includeNodes(NodeMode.TRUE)
                .build();
        ChartResult result = withStub(new StubEphemeris()).calculateChart(newYork, config);

        assertEquals(13, result.getBodies().size());
        assertTrue(result.findBody(Body.CHIRON).isPresent());
        assertTrue(result.findBody(Body.MEAN_LILITH).isPresent());
        assertTrue(result.findBody(Body.TRUE_NODE).isPresent());
        assertTrue(result.findBody(Body.MEAN_NODE).isEmpty());
    }

    @Test
    void stubPositionsArePlaced() {
        StubEphemeris stub = new StubEphemeris().set(Body.MARS, 280.5, -0.2);
        ChartResult result = withStub(stub).calculateChart(newYork, ChartConfig.defaults());

        CelestialBody mars = result.getBody(Body.MARS);
        assertEquals(ZodiacSign.CAPRICORN, mars.getSign());
        assertEquals(10, mars.getDegree());
        assertEquals(30, mars.getMinute());
        assertTrue(mars.isRetrograde());
        assertEquals(Dignity.EXALTATION, mars.getDignity());
        // between cusp 5 (264.87) and cusp 6 (297.67)
        assertEquals(5, mars.getHouse());
    }

    @Test
    void dignitiesCanBeDisabled() {
        ChartConfig config = ChartConfig.builder().includeDignities(false).build();
        ChartResult result = withStub(new StubEphemeris()).calculateChart(newYork, config);
        for (CelestialBody body : result.getBodies()) {
            assertNull(body.getDignity());
        }
    }

    @Test
    void angleAspectsOnlyWhenRequested() {
        double asc = HouseFrame.at(BIRTH, NYC_LAT, NYC_LON).ascendant();
        StubEphemeris stub = new StubEphemeris().set(Body.SUN, asc, 1.0);

        ChartResult without = withStub(stub).calculateChart(newYork, ChartConfig.defaults());
        for (Aspect aspect : without.getAspects()) {
            assertFalse(aspect.getSecond() instanceof ChartAngle, aspect.toString());
        }

        ChartResult with = withStub(stub).calculateChart(newYork,
                ChartConfig.builder().includeAngleAspects(true).build());
        Aspect conjunction = with.getAspects().stream()
                .filter(a -> a.getFirst() == Body.SUN && a.getSecond() == ChartAngle.ASCENDANT)
                .findFirst()
                .orElseThrow();
        assertEquals(AspectType.CONJUNCTION, conjunction.getType());
        assertEquals(0.0, conjunction.getOrb(), 1e-9);
    }

    @Test
    void enabledAspectsAndOverrides() {
        StubEphemeris stub = new StubEphemeris()
                .set(Body.SUN, 10.0, 1.0)
                .set(Body.MOON, 103.0, 13.0);
        ChartConfig squaresOnly = ChartConfig.builder().enabledAspects(AspectType.SQUARE).build();
        ChartResult result = withStub(stub).calculateChart(newYork, squaresOnly);
        assertTrue(result.getAspects().stream().allMatch(a -> a.getType() == AspectType.SQUARE));
        assertTrue(result.getAspects().stream().anyMatch(a -> a.involves(Body.SUN) && a.involves(Body.MOON)));

        ChartConfig tight = squaresOnly.toBuilder().maxOrb(AspectType.SQUARE, 2.0).build();
        result = withStub(stub).calculateChart(newYork, tight);
        assertTrue(result.getAspects().stream().noneMatch(a -> a.involves(Body.SUN) && a.involves(Body.MOON)));
    }

    @Test
    void sameInputSameResultAcrossThreads() throws Exception {
        ChartCalculator calculator = new ChartCalculator(new KeplerianEphemeris(), new SvgChartRenderer(), CLOCK);
        String expected = calculator.calculateAndRender(newYork, ChartConfig.defaults()).rendered().contentHash();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<ChartArtifact>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> calculator.calculateAndRender(newYork, ChartConfig.defaults())));
            }
            for (Future<ChartArtifact> future : futures) {
                ChartArtifact artifact = future.get();
                assertEquals(expected, artifact.rendered().contentHash());
                assertEquals(Body.CLASSICAL.size(), artifact.result().getBodies().size());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void calculateAndRender() {
        ChartArtifact artifact = withStub(new StubEphemeris()).calculateAndRender(newYork, ChartConfig.defaults());
        assertTrue(artifact.rendered().svg().startsWith("<svg"));
        assertTrue(artifact.rendered().html().contains(artifact.rendered().svg()));
        assertEquals(64, artifact.rendered().contentHash().length());
    }

    @Test
    void failedRequestEndsInFailedStage() {
        ChartCalculator calculator = withStub(new StubEphemeris());
        List<String> messages = stageMessages(c -> assertThrows(InvalidBirthInputException.class,
                () -> c.calculateChart(new BirthInput(BIRTH, 95.0, 0.0), ChartConfig.defaults())), calculator);
        assertEquals(List.of("Chart request reached FAILED during RECEIVED"), messages);

        StubEphemeris slow = new StubEphemeris().withDelay(Duration.ofMillis(40));
        ChartConfig tight = ChartConfig.builder().computationTimeout(Duration.ofMillis(100)).build();
        messages = stageMessages(c -> assertThrows(ComputationTimeoutException.class,
                () -> c.calculateChart(newYork, tight)), withStub(slow));
        assertEquals("Chart request reached FAILED during EPHEMERIS_RESOLVED", messages.get(messages.size() - 1));
    }

    @Test
    void successfulRequestEndsInCompletedStage() {
        List<String> messages = stageMessages(c -> c.calculateChart(newYork, ChartConfig.defaults()),
                withStub(new StubEphemeris()));
        assertEquals(List.of(
                "Chart request reached EPHEMERIS_RESOLVED",
                "Chart request reached HOUSES_COMPUTED",
                "Chart request reached BODIES_ASSIGNED",
                "Chart request reached ASPECTS_COMPUTED",
                "Chart request reached ASSEMBLED",
                "Chart request reached COMPLETED"), messages);
    }

    /** Stage transition messages logged while {@code action} runs. */
    private static List<String> stageMessages(Consumer<ChartCalculator> action, ChartCalculator calculator) {
        Logger logger = (Logger) LoggerFactory.getLogger(ChartCalculator.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        Level saved = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        logger.addAppender(appender);
        try {
            action.accept(calculator);
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(saved);
        }
        return appender.list.stream()
                .map(ILoggingEvent::getFormattedMessage)
                .filter(m -> m.startsWith("Chart request reached"))
                .toList();
    }
}
