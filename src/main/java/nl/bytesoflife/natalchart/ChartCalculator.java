package nl.bytesoflife.natalchart;

import nl.bytesoflife.natalchart.aspect.AspectDetector;
import nl.bytesoflife.natalchart.aspect.AspectPoint;
import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.CoordinateNormalizer;
import nl.bytesoflife.natalchart.dignity.DignityEvaluator;
import nl.bytesoflife.natalchart.ephemeris.EphemerisPosition;
import nl.bytesoflife.natalchart.ephemeris.EphemerisProvider;
import nl.bytesoflife.natalchart.ephemeris.KeplerianEphemeris;
import nl.bytesoflife.natalchart.house.HouseAssigner;
import nl.bytesoflife.natalchart.house.HouseComputation;
import nl.bytesoflife.natalchart.house.HouseFrame;
import nl.bytesoflife.natalchart.house.HouseSystemCalculator;
import nl.bytesoflife.natalchart.model.Aspect;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.CelestialBody;
import nl.bytesoflife.natalchart.model.ChartAngle;
import nl.bytesoflife.natalchart.model.Dignity;
import nl.bytesoflife.natalchart.model.ZodiacPosition;
import nl.bytesoflife.natalchart.render.ChartRenderer;
import nl.bytesoflife.natalchart.render.RenderedChart;
import nl.bytesoflife.natalchart.render.SvgChartRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point: turns a {@link BirthInput} into a {@link ChartResult}, and optionally renders it.
 *
 * <p>Instances hold no mutable state and may be shared between threads. Each request walks
 * through the {@link CalculationStage}s in order; a failure in any stage ends the request with a
 * {@link ChartException} naming that stage and no result.</p>
 */
public class ChartCalculator {

    private static final Logger log = LoggerFactory.getLogger(ChartCalculator.class);

    /** Half the window over which the angles' speeds are measured. */
    private static final Duration ANGLE_SPEED_HALF_STEP = Duration.ofSeconds(30);

    private final EphemerisProvider ephemeris;
    private final ChartRenderer renderer;
    private final Clock clock;
    private final HouseSystemCalculator houseCalculator = new HouseSystemCalculator();
    private final ChartAssembler assembler = new ChartAssembler();

    public ChartCalculator() {
        this(new KeplerianEphemeris());
    }

    public ChartCalculator(EphemerisProvider ephemeris) {
        this(ephemeris, new SvgChartRenderer(), Clock.systemUTC());
    }

    public ChartCalculator(EphemerisProvider ephemeris, ChartRenderer renderer, Clock clock) {
        if (ephemeris == null || renderer == null || clock == null) {
            throw new IllegalArgumentException("Ephemeris, renderer and clock are required");
        }
        this.ephemeris = ephemeris;
        this.renderer = renderer;
        this.clock = clock;
    }

    public EphemerisProvider getEphemeris() {
        return ephemeris;
    }

    public ChartResult calculateChart(BirthInput input, ChartConfig config) {
        Request request = new Request(config);
        long start = System.nanoTime();
        ChartResult result = run(request, () -> calculate(input, request));
        request.advance(CalculationStage.COMPLETED);
        log.info("Chart calculated in {}ms ({} bodies, {} aspects, houses {})",
                elapsedMillis(start), result.getBodies().size(), result.getAspects().size(),
                result.getHouseSystemUsed());
        return result;
    }

    public ChartArtifact calculateAndRender(BirthInput input, ChartConfig config) {
        Request request = new Request(config);
        long start = System.nanoTime();
        ChartArtifact artifact = run(request, () -> {
            ChartResult result = calculate(input, request);
            RenderedChart rendered = renderer.render(result);
            request.advance(CalculationStage.RENDERED);
            log.debug("Rendered chart: {} chars SVG, hash {}", rendered.svg().length(), rendered.contentHash());
            return new ChartArtifact(result, rendered);
        });
        request.advance(CalculationStage.COMPLETED);
        log.info("Chart calculated and rendered in {}ms", elapsedMillis(start));
        return artifact;
    }

    private ChartResult calculate(BirthInput input, Request request) {
        ChartConfig config = request.config;
        validate(input);

        Map<Body, EphemerisPosition> positions = resolvePositions(input.instant(), config.bodies());
        request.advance(CalculationStage.EPHEMERIS_RESOLVED);

        HouseComputation houses = houseCalculator.compute(
                input.instant(), input.latitude(), input.longitude(), config.getHouseSystem());
        request.advance(CalculationStage.HOUSES_COMPUTED);

        List<CelestialBody> bodies = new ArrayList<>(positions.size());
        for (Map.Entry<Body, EphemerisPosition> entry : positions.entrySet()) {
            bodies.add(place(entry.getKey(), entry.getValue(), houses, config.isIncludeDignities()));
        }
        request.advance(CalculationStage.BODIES_ASSIGNED);

        List<AspectPoint> points = new ArrayList<>();
        for (CelestialBody body : bodies) {
            points.add(new AspectPoint(body.getBody(), body.getLongitude(), body.getSpeed()));
        }
        if (config.isIncludeAngleAspects()) {
            points.addAll(anglePoints(input, houses));
        }
        List<Aspect> aspects = new AspectDetector(config.effectiveOrbProfile()).detect(points);
        request.advance(CalculationStage.ASPECTS_COMPUTED);

        ChartResult result = assembler.assemble(input, config, bodies, houses, aspects, clock.instant());
        request.advance(CalculationStage.ASSEMBLED);
        return result;
    }

    private Map<Body, EphemerisPosition> resolvePositions(Instant instant, List<Body> bodies) {
        if (!ephemeris.supports(instant)) {
            throw new EphemerisRangeExceededException(instant, ephemeris.supportedStart(), ephemeris.supportedEnd());
        }
        Map<Body, EphemerisPosition> positions = new EnumMap<>(Body.class);
        for (Body body : bodies) {
            positions.put(body, ephemeris.positionAt(instant, body));
        }
        return positions;
    }

    static CelestialBody place(Body body, EphemerisPosition position, HouseComputation houses,
                               boolean includeDignities) {
        double lon = AngleMath.normalize(position.longitude());
        ZodiacPosition zodiac = CoordinateNormalizer.normalize(lon);
        int house = HouseAssigner.houseOf(lon, houses.cusps());
        Dignity dignity = includeDignities ? DignityEvaluator.evaluate(body, zodiac.sign()) : null;
        return new CelestialBody(body, lon, position.latitude(), position.distance(), position.speed(),
                zodiac, house, CoordinateNormalizer.isRetrograde(position.speed()), dignity);
    }

    /** Ascendant and Midheaven as aspect points, their speeds taken from the frames a minute apart. */
    private static List<AspectPoint> anglePoints(BirthInput input, HouseComputation houses) {
        HouseFrame before = HouseFrame.at(input.instant().minus(ANGLE_SPEED_HALF_STEP),
                input.latitude(), input.longitude());
        HouseFrame after = HouseFrame.at(input.instant().plus(ANGLE_SPEED_HALF_STEP),
                input.latitude(), input.longitude());
        double days = 2.0 * ANGLE_SPEED_HALF_STEP.getSeconds() / 86400.0;
        double ascSpeed = AngleMath.signedDifference(before.ascendant(), after.ascendant()) / days;
        double mcSpeed = AngleMath.signedDifference(before.midheaven(), after.midheaven()) / days;
        return List.of(
                new AspectPoint(ChartAngle.ASCENDANT, houses.angles().ascendant().longitude(), ascSpeed),
                new AspectPoint(ChartAngle.MIDHEAVEN, houses.angles().midheaven().longitude(), mcSpeed));
    }

    static void validate(BirthInput input) {
        if (input == null) {
            throw new InvalidBirthInputException("Birth input must not be null");
        }
        if (input.instant() == null) {
            throw new InvalidBirthInputException("Birth instant must not be null");
        }
        if (!Double.isFinite(input.latitude()) || input.latitude() < -90 || input.latitude() > 90) {
            throw new InvalidBirthInputException("Latitude must be in [-90, 90]: " + input.latitude());
        }
        if (!Double.isFinite(input.longitude()) || input.longitude() < -180 || input.longitude() > 180) {
            throw new InvalidBirthInputException("Longitude must be in [-180, 180]: " + input.longitude());
        }
    }

    private static <T> T run(Request request, Stage<T> body) {
        try {
            return body.run();
        } catch (ChartException e) {
            request.fail(e.getStage());
            log.debug("Chart request failed at {}: {}", e.getStage(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            CalculationStage failed = request.next();
            request.fail(failed);
            log.error("Unexpected failure during {}", failed, e);
            throw new ChartException("Chart calculation failed during " + failed + ": " + e.getMessage(), failed, e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @FunctionalInterface
    private interface Stage<T> {
        T run();
    }

    /** Stage bookkeeping and the wall-clock budget of one request. */
    private static final class Request {
        private final ChartConfig config;
        private final long deadline;
        private CalculationStage stage = CalculationStage.RECEIVED;

        Request(ChartConfig config) {
            this.config = config != null ? config : ChartConfig.defaults();
            this.deadline = System.nanoTime() + this.config.getComputationTimeout().toNanos();
        }

        void advance(CalculationStage reached) {
            if (!reached.isTerminal() && System.nanoTime() > deadline) {
                throw new ComputationTimeoutException(config.getComputationTimeout(), reached);
            }
            log.debug("Chart request reached {}", reached);
            stage = reached;
        }

        void fail(CalculationStage during) {
            log.debug("Chart request reached {} during {}", CalculationStage.FAILED, during);
            stage = CalculationStage.FAILED;
        }

        /** The stage being attempted: the one after the last stage reached. */
        CalculationStage next() {
            CalculationStage[] all = CalculationStage.values();
            return stage.ordinal() + 1 < all.length ? all[stage.ordinal() + 1] : stage;
        }
    }
}
