package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.ChartConfig;
import nl.bytesoflife.natalchart.ChartResult;
import nl.bytesoflife.natalchart.EphemerisRangeExceededException;
import nl.bytesoflife.natalchart.aspect.AspectDetector;
import nl.bytesoflife.natalchart.aspect.AspectMatch;
import nl.bytesoflife.natalchart.aspect.AspectPoint;
import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.coordinate.CoordinateNormalizer;
import nl.bytesoflife.natalchart.ephemeris.EphemerisPosition;
import nl.bytesoflife.natalchart.ephemeris.EphemerisProvider;
import nl.bytesoflife.natalchart.house.HouseAssigner;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.CelestialBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares the sky at a given moment with a natal chart. Only transiting-to-natal pairs are
 * considered; natal points are treated as fixed when deciding whether an aspect applies.
 */
public class TransitCalculator {

    private static final Logger log = LoggerFactory.getLogger(TransitCalculator.class);

    private final EphemerisProvider ephemeris;

    public TransitCalculator(EphemerisProvider ephemeris) {
        this.ephemeris = ephemeris;
    }

    public TransitReport transitsAt(ChartResult natal, Instant instant) {
        return transitsAt(natal, instant, natal.getConfig());
    }

    public TransitReport transitsAt(ChartResult natal, Instant instant, ChartConfig config) {
        if (!ephemeris.supports(instant)) {
            throw new EphemerisRangeExceededException(instant, ephemeris.supportedStart(), ephemeris.supportedEnd());
        }

        List<TransitPosition> positions = new ArrayList<>();
        for (Body body : config.bodies()) {
            EphemerisPosition p = ephemeris.positionAt(instant, body);
            double lon = AngleMath.normalize(p.longitude());
            positions.add(new TransitPosition(body, lon, p.speed(), CoordinateNormalizer.normalize(lon),
                    HouseAssigner.houseOf(lon, natal.getCusps()), CoordinateNormalizer.isRetrograde(p.speed())));
        }

        AspectDetector detector = new AspectDetector(config.effectiveOrbProfile());
        List<TransitAspect> aspects = new ArrayList<>();
        for (TransitPosition transit : positions) {
            AspectPoint moving = new AspectPoint(transit.body(), transit.longitude(), transit.speed());
            for (CelestialBody natalBody : natal.getBodies()) {
                AspectPoint fixed = new AspectPoint(natalBody.getBody(), natalBody.getLongitude(), 0.0);
                Optional<AspectMatch> match = detector.match(moving, fixed);
                match.ifPresent(m -> aspects.add(new TransitAspect(transit.body(), natalBody.getBody(),
                        m.type(), m.quality(), m.separation(), m.orb(), m.applying())));
            }
        }
        log.debug("{} transit aspects at {}", aspects.size(), instant);
        return new TransitReport(instant, positions, aspects);
    }
}
