package nl.bytesoflife.natalchart.aspect;

import nl.bytesoflife.natalchart.coordinate.AngleMath;
import nl.bytesoflife.natalchart.model.Aspect;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds aspects between points using an {@link OrbProfile}.
 *
 * <p>A pair yields at most one aspect: of all matching types the one with the smallest
 * absolute orb wins, ties going to the type declared first in the profile.</p>
 */
public class AspectDetector {

    private final OrbProfile profile;

    public AspectDetector(OrbProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("Orb profile must not be null");
        }
        this.profile = profile;
    }

    public OrbProfile getProfile() {
        return profile;
    }

    /** All aspects among {@code points}, pairs in canonical order. */
    public List<Aspect> detect(List<AspectPoint> points) {
        List<AspectPoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingInt(p -> p.point().canonicalOrder()));

        List<Aspect> aspects = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                AspectPoint a = sorted.get(i);
                AspectPoint b = sorted.get(j);
                match(a, b).ifPresent(m -> aspects.add(new Aspect(a.point(), b.point(),
                        m.type(), m.quality(), m.separation(), m.orb(), m.applying())));
            }
        }
        return aspects;
    }

    /**
     * Classifies the relation between two positions. The result does not depend on argument order.
     */
    public Optional<AspectMatch> match(AspectPoint a, AspectPoint b) {
        double separation = AngleMath.separation(a.longitude(), b.longitude());
        double factor = profile.pairFactor(PairCategory.of(a.point(), b.point()));

        AspectDefinition best = null;
        double bestOrb = 0;
        for (AspectDefinition definition : profile.getDefinitions()) {
            double orb = separation - definition.angle();
            if (Math.abs(orb) <= definition.orb() * factor
                    && (best == null || Math.abs(orb) < Math.abs(bestOrb))) {
                best = definition;
                bestOrb = orb;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        boolean applying = isApplying(a, b, separation, best.angle());
        return Optional.of(new AspectMatch(best.type(), best.quality(), separation, bestOrb, applying));
    }

    /**
     * The gap {@code |separation - angle|} shrinks as time advances. An exact aspect has no gap
     * left to close and counts as separating.
     */
    static boolean isApplying(AspectPoint a, AspectPoint b, double separation, double angle) {
        double delta = AngleMath.signedDifference(a.longitude(), b.longitude());
        double separationRate = Math.signum(delta) * (b.speed() - a.speed());
        double gapRate = Math.signum(separation - angle) * separationRate;
        return gapRate < 0;
    }
}
