package nl.bytesoflife.natalchart.aspect;

import nl.bytesoflife.natalchart.model.AspectQuality;
import nl.bytesoflife.natalchart.model.AspectType;

/**
 * One row of an orb profile.
 *
 * @param orb base orb in degrees, before the pair category factor is applied
 */
public record AspectDefinition(AspectType type, double angle, double orb, AspectQuality quality) {

    public AspectDefinition {
        if (type == null || quality == null) {
            throw new IllegalArgumentException("Aspect type and quality are required");
        }
        if (angle < 0 || angle > 180) {
            throw new IllegalArgumentException("Aspect angle must be in [0, 180]: " + angle);
        }
        if (!(orb >= 0) || Double.isInfinite(orb)) {
            throw new IllegalArgumentException("Orb must be a non-negative number: " + orb);
        }
    }

    public AspectDefinition withOrb(double newOrb) {
        return new AspectDefinition(type, angle, newOrb, quality);
    }
}
