package nl.bytesoflife.natalchart.render;

import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.List;

/**
 * Places body glyphs on the wheel. Each glyph sits at its own longitude on one of several
 * concentric levels; a glyph moves one level inward for as long as its box overlaps a glyph
 * placed before it. Placement order is the input order, so the layout is deterministic.
 */
final class GlyphLayout {

    record Placement(int index, int level, double radius, double x, double y) {
        Envelope box(double size) {
            return envelope(x, y, size);
        }
    }

    private record Candidate(int index, int level, Envelope box) {
    }

    private GlyphLayout() {
    }

    static List<Placement> place(double[] longitudes, WheelGeometry geometry, ChartSvgOptions options) {
        int levels = options.getGlyphLevels();
        double size = options.getGlyphSize();

        GlyphIndex<Candidate> index = new GlyphIndex<>();
        Candidate[][] candidates = new Candidate[longitudes.length][levels];
        for (int i = 0; i < longitudes.length; i++) {
            for (int level = 0; level < levels; level++) {
                double r = radius(options, level);
                Envelope box = envelope(geometry.x(longitudes[i], r), geometry.y(longitudes[i], r), size);
                candidates[i][level] = new Candidate(i, level, box);
                index.insert(box, candidates[i][level]);
            }
        }

        int[] assigned = new int[longitudes.length];
        List<Placement> placements = new ArrayList<>(longitudes.length);
        for (int i = 0; i < longitudes.length; i++) {
            int chosen = -1;
            int fewest = Integer.MAX_VALUE;
            for (int level = 0; level < levels; level++) {
                int conflicts = conflicts(index, candidates[i][level], assigned);
                if (conflicts == 0) {
                    chosen = level;
                    break;
                }
                if (conflicts < fewest) {
                    fewest = conflicts;
                    chosen = level;
                }
            }
            assigned[i] = chosen;
            double r = radius(options, chosen);
            placements.add(new Placement(i, chosen, r, geometry.x(longitudes[i], r), geometry.y(longitudes[i], r)));
        }
        return placements;
    }

    /** Overlaps with glyphs already placed (lower index) at the level they were given. */
    private static int conflicts(GlyphIndex<Candidate> index, Candidate candidate, int[] assigned) {
        int count = 0;
        for (Candidate other : index.query(candidate.box())) {
            if (other.index() < candidate.index()
                    && assigned[other.index()] == other.level()
                    && other.box().intersects(candidate.box())) {
                count++;
            }
        }
        return count;
    }

    static double radius(ChartSvgOptions options, int level) {
        return options.getGlyphRadius() - level * options.getGlyphStep();
    }

    static Envelope envelope(double x, double y, double size) {
        double half = size / 2.0;
        return new Envelope(x - half, x + half, y - half, y + half);
    }
}
