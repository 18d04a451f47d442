package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.model.AspectType;
import nl.bytesoflife.natalchart.model.Body;

import java.time.Instant;
import java.util.List;

public final class TransitReport {

    private final Instant instant;
    private final List<TransitPosition> positions;
    private final List<TransitAspect> aspects;

    public TransitReport(Instant instant, List<TransitPosition> positions, List<TransitAspect> aspects) {
        this.instant = instant;
        this.positions = List.copyOf(positions);
        this.aspects = List.copyOf(aspects);
    }

    public Instant getInstant() { return instant; }
    public List<TransitPosition> getPositions() { return positions; }
    public List<TransitAspect> getAspects() { return aspects; }

    public List<TransitAspect> aspectsTo(Body natal) {
        return aspects.stream().filter(a -> a.natal() == natal).toList();
    }

    public List<TransitAspect> aspectsOfType(AspectType type) {
        return aspects.stream().filter(a -> a.type() == type).toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Transits at ").append(instant).append(":\n");
        sb.append("  Aspects: ").append(aspects.size()).append("\n");
        for (TransitAspect aspect : aspects) {
            sb.append("  - ").append(aspect).append("\n");
        }
        return sb.toString();
    }
}
