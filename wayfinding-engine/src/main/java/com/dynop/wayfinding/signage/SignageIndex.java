package com.dynop.wayfinding.signage;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Spatial index answering "is there a sign (or landmark) within r of this point?".
 *
 * <p>One {@link STRtree} per kind, built eagerly so lookups are safe from concurrent agent runs.
 * The radius is inclusive.
 */
public final class SignageIndex {

    private static final Logger LOGGER = Logger.getLogger(SignageIndex.class.getName());

    private final Map<SignageKind, STRtree> trees = new EnumMap<>(SignageKind.class);
    private final Map<SignageKind, Integer> counts = new EnumMap<>(SignageKind.class);

    public SignageIndex(List<SignageElement> elements) {
        for (SignageKind kind : SignageKind.values()) {
            trees.put(kind, new STRtree());
            counts.put(kind, 0);
        }
        for (SignageElement element : elements) {
            trees.get(element.getKind()).insert(new Envelope(element.getX(), element.getX(), element.getY(), element.getY()), element);
            counts.merge(element.getKind(), 1, Integer::sum);
        }
        trees.values().forEach(STRtree::build);
        LOGGER.fine(() -> String.format("Signage indexed: %d signs, %d landmarks",
                counts.get(SignageKind.SIGN), counts.get(SignageKind.LANDMARK)));
    }

    public static SignageIndex empty() {
        return new SignageIndex(List.of());
    }

    /**
     * @return true if at least one element of the kind lies within {@code radius} of (x, y)
     */
    public boolean hasWithin(SignageKind kind, double x, double y, double radius) {
        return countWithin(kind, x, y, radius) > 0;
    }

    /**
     * @return Number of elements of the kind within {@code radius} of (x, y)
     */
    @SuppressWarnings("unchecked")
    public int countWithin(SignageKind kind, double x, double y, double radius) {
        Envelope search = new Envelope(x - radius, x + radius, y - radius, y + radius);
        List<SignageElement> candidates = trees.get(kind).query(search);
        int count = 0;
        for (SignageElement element : candidates) {
            if (Math.hypot(element.getX() - x, element.getY() - y) <= radius) {
                count++;
            }
        }
        return count;
    }

    public int size(SignageKind kind) {
        return counts.get(kind);
    }
}
