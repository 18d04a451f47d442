package nl.bytesoflife.natalchart;

import nl.bytesoflife.natalchart.model.Aspect;
import nl.bytesoflife.natalchart.model.BirthInput;
import nl.bytesoflife.natalchart.model.Body;
import nl.bytesoflife.natalchart.model.CelestialBody;
import nl.bytesoflife.natalchart.model.ChartAngles;
import nl.bytesoflife.natalchart.model.HouseCusp;
import nl.bytesoflife.natalchart.model.HouseSystem;
import nl.bytesoflife.natalchart.model.SolarSet;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Everything calculated for one birth moment. Built once by {@link ChartAssembler}, never mutated.
 */
public final class ChartResult {

    private final BirthInput birthInput;
    private final List<CelestialBody> bodies;
    private final List<HouseCusp> cusps;
    private final ChartAngles angles;
    private final List<Aspect> aspects;
    private final SolarSet solarSet;
    private final HouseSystem houseSystemRequested;
    private final HouseSystem houseSystemUsed;
    private final boolean fallbackOccurred;
    private final String fallbackReason;
    private final String language;
    private final ChartConfig config;
    private final Instant calculatedAt;

    ChartResult(BirthInput birthInput, List<CelestialBody> bodies, List<HouseCusp> cusps, ChartAngles angles,
                List<Aspect> aspects, SolarSet solarSet, HouseSystem houseSystemRequested,
                HouseSystem houseSystemUsed, boolean fallbackOccurred, String fallbackReason,
                ChartConfig config, Instant calculatedAt) {
        this.birthInput = birthInput;
        this.bodies = List.copyOf(bodies);
        this.cusps = List.copyOf(cusps);
        this.angles = angles;
        this.aspects = List.copyOf(aspects);
        this.solarSet = solarSet;
        this.houseSystemRequested = houseSystemRequested;
        this.houseSystemUsed = houseSystemUsed;
        this.fallbackOccurred = fallbackOccurred;
        this.fallbackReason = fallbackReason;
        this.language = config.getLanguage();
        this.config = config;
        this.calculatedAt = calculatedAt;
    }

    public BirthInput getBirthInput() { return birthInput; }
    public List<CelestialBody> getBodies() { return bodies; }
    public List<HouseCusp> getCusps() { return cusps; }
    public ChartAngles getAngles() { return angles; }
    public List<Aspect> getAspects() { return aspects; }
    public SolarSet getSolarSet() { return solarSet; }
    public HouseSystem getHouseSystemRequested() { return houseSystemRequested; }
    public HouseSystem getHouseSystemUsed() { return houseSystemUsed; }
    public boolean isFallbackOccurred() { return fallbackOccurred; }

    /** Why the requested house system was replaced, or null. */
    public String getFallbackReason() { return fallbackReason; }

    public String getLanguage() { return language; }
    public ChartConfig getConfig() { return config; }
    public Instant getCalculatedAt() { return calculatedAt; }

    public Optional<CelestialBody> findBody(Body body) {
        return bodies.stream().filter(b -> b.getBody() == body).findFirst();
    }

    public CelestialBody getBody(Body body) {
        return findBody(body).orElseThrow(() -> new IllegalArgumentException(body + " is not part of this chart"));
    }

    public HouseCusp getCusp(int number) {
        return cusps.get(number - 1);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Chart");
        if (birthInput.hasLabel()) {
            sb.append(" '").append(birthInput.label()).append('\'');
        }
        sb.append(" for ").append(birthInput.instant()).append(":\n");
        sb.append("  Houses: ").append(houseSystemUsed);
        if (fallbackOccurred) {
            sb.append(" (requested ").append(houseSystemRequested).append(": ").append(fallbackReason).append(')');
        }
        sb.append("\n");
        sb.append("  ASC ").append(angles.ascendant().position())
          .append(", MC ").append(angles.midheaven().position()).append("\n");
        for (CelestialBody body : bodies) {
            sb.append("  - ").append(body).append("\n");
        }
        sb.append("  Aspects: ").append(aspects.size()).append("\n");
        for (Aspect aspect : aspects) {
            sb.append("  - ").append(aspect).append("\n");
        }
        return sb.toString();
    }
}
