package nl.bytesoflife.lefqa.canon;

import nl.bytesoflife.lefqa.model.LayerCollection;
import nl.bytesoflife.lefqa.model.LefLayer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Comparisons between whole layers and whole PORT/OBS sections, built on
 * {@link CoordinateComparator}.
 */
public final class GeometryComparators {

    /** Fewer statements first, then statement by statement. */
    public static final Comparator<LefLayer> LAYERS = GeometryComparators::compareLayers;

    /** By sorted layer names, then layer by layer. */
    public static final Comparator<LayerCollection> COLLECTIONS = GeometryComparators::compareCollections;

    private GeometryComparators() {
    }

    public static int compareLayers(LefLayer a, LefLayer b) {
        List<String> ca = a.getCoordinates();
        List<String> cb = b.getCoordinates();
        if (ca.size() != cb.size()) {
            return Integer.compare(ca.size(), cb.size());
        }
        for (int i = 0; i < ca.size(); i++) {
            int c = CoordinateComparator.INSTANCE.compare(ca.get(i), cb.get(i));
            if (c != 0) return c;
        }
        return 0;
    }

    public static int compareCollections(LayerCollection a, LayerCollection b) {
        List<String> these = new ArrayList<>(a.getLayerNames());
        List<String> those = new ArrayList<>(b.getLayerNames());
        Collections.sort(these);
        Collections.sort(those);

        // a section with more layers sorts first
        for (int i = 0; i < these.size(); i++) {
            if (i >= those.size()) return -1;
            int c = these.get(i).compareTo(those.get(i));
            if (c != 0) return c;
        }
        if (those.size() > these.size()) return 1;

        for (String name : these) {
            int c = compareLayers(a.getLayer(name), b.getLayer(name));
            if (c != 0) return c;
        }
        return 0;
    }
}
