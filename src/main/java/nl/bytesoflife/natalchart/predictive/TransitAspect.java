package nl.bytesoflife.natalchart.predictive;

import nl.bytesoflife.natalchart.model.AspectQuality;
import nl.bytesoflife.natalchart.model.AspectType;
import nl.bytesoflife.natalchart.model.Body;

import java.util.Locale;

/**
 * Aspect from a transiting body to a natal body. Unlike a natal {@code Aspect} both sides may
 * be the same body (transiting Sun conjunct natal Sun).
 */
public record TransitAspect(Body transiting, Body natal, AspectType type, AspectQuality quality,
                            double separation, double orb, boolean applying) {

    @Override
    public String toString() {
        return String.format(Locale.US, "transit %s %s natal %s (orb %+.2f, %s)",
                transiting.getDisplayName(), type.name().toLowerCase(), natal.getDisplayName(),
                orb, applying ? "applying" : "separating");
    }
}
