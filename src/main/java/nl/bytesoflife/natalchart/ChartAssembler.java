package nl.bytesoflife.natalchart;

import nl.bytesoflife.natalchart.house.HouseComputation;
import nl.bytesoflife.natalchart.model.Aspect;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.CelestialBody;
import nl.bytesoflife.natalchart.model.HouseCusp;
import nl.bytesoflife.natalchart.model.SolarSet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Combines the stage outputs into a {@link ChartResult}. Nothing is recalculated here; the
 * assembler only checks the parts are complete and derives the {@link SolarSet}.
 */
public class ChartAssembler {

    public ChartResult assemble(BirthInput input, ChartConfig config, List<CelestialBody> bodies,
                                HouseComputation houses, List<Aspect> aspects, Instant calculatedAt) {
        checkBodies(config.bodies(), bodies);
        checkCusps(houses.cusps());
        if (houses.angles() == null) {
            throw new IncompleteChartException("Chart angles missing");
        }

        List<CelestialBody> ordered = new ArrayList<>(bodies);
        ordered.sort(Comparator.comparingInt(b -> b.getBody().canonicalOrder()));

        SolarSet solarSet = solarSet(ordered, houses.cusps(), aspects);
        return new ChartResult(input, ordered, houses.cusps(), houses.angles(), aspects, solarSet,
                houses.requested(), houses.used(), houses.fallbackOccurred(), houses.fallbackReason(),
                config, calculatedAt);
    }

    static SolarSet solarSet(List<CelestialBody> bodies, List<HouseCusp> cusps, List<Aspect> aspects) {
        CelestialBody sun = bodies.stream()
                .filter(b -> b.getBody() == Body.SUN)
                .findFirst()
                .orElseThrow(() -> new IncompleteChartException("Sun missing, cannot derive solar set"));
        List<Aspect> hard = aspects.stream()
                .filter(a -> a.isHard() && a.involves(Body.SUN))
                .toList();
        double sunDegree = Math.min(sun.getLongitude() - sun.getSign().startLongitude(), Math.nextDown(30.0));
        return new SolarSet(sun.getSign(), sun.getHouse(), Math.max(0.0, sunDegree), cusps.get(4).sign(), hard);
    }

    private static void checkBodies(List<Body> requested, List<CelestialBody> bodies) {
        Set<Body> present = EnumSet.noneOf(Body.class);
        for (CelestialBody body : bodies) {
            if (!present.add(body.getBody())) {
                throw new IncompleteChartException("Body present twice: " + body.getBody());
            }
        }
        for (Body body : requested) {
            if (!present.contains(body)) {
                throw new IncompleteChartException("Requested body missing: " + body);
            }
        }
    }

    private static void checkCusps(List<HouseCusp> cusps) {
        if (cusps == null || cusps.size() != 12) {
            throw new IncompleteChartException("Expected 12 house cusps, got " + (cusps == null ? 0 : cusps.size()));
        }
        for (int i = 0; i < 12; i++) {
            if (cusps.get(i).number() != i + 1) {
                throw new IncompleteChartException("Cusp " + (i + 1) + " out of place: " + cusps.get(i).number());
            }
            for (int j = i + 1; j < 12; j++) {
                if (cusps.get(i).longitude() == cusps.get(j).longitude()) {
                    throw new IncompleteChartException("Cusps " + (i + 1) + " and " + (j + 1) + " coincide");
                }
            }
        }
    }
}
