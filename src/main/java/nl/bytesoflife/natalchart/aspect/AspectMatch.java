package nl.bytesoflife.natalchart.aspect;

import nl.bytesoflife.natalchart.model.AspectQuality;
import nl.bytesoflife.natalchart.model.AspectType;

/**
 * The aspect found between two positions, independent of which points they belong to.
 */
public record AspectMatch(AspectType type, AspectQuality quality, double separation, double orb, boolean applying) {
}
