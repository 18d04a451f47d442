package nl.bytesoflife.natalchart.render;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.List;

/**
 * Static spatial index over glyph boxes. Everything is inserted first; the tree is built on the
 * first query and cannot take new items afterwards.
 */
class GlyphIndex<T> {

    private final STRtree tree = new STRtree();
    private boolean built = false;

    void insert(Envelope envelope, T item) {
        if (built) {
            throw new IllegalStateException("Index already built");
        }
        tree.insert(envelope, item);
    }

    @SuppressWarnings("unchecked")
    List<T> query(Envelope envelope) {
        ensureBuilt();
        return (List<T>) tree.query(envelope);
    }

    private void ensureBuilt() {
        if (!built) {
            tree.build();
            built = true;
        }
    }
}
