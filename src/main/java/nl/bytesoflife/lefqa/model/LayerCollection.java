package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of an OBS or PORT section: layers keyed by name.
 * A layer name repeated inside the same section adds its statements to the first block.
 */
public class LayerCollection {

    private final String startLine;
    private String endLine;
    private final Map<String, LefLayer> layers = new LinkedHashMap<>();

    public LayerCollection(String startLine) {
        this.startLine = startLine;
    }

    public String getStartLine() {
        return startLine;
    }

    public String getEndLine() {
        return endLine;
    }

    public void setEndLine(String endLine) {
        this.endLine = endLine;
    }

    public boolean isObstruction() {
        return startLine.trim().toUpperCase().startsWith("OBS");
    }

    public void addLayer(LefLayer layer) {
        LefLayer existing = layers.get(layer.getName());
        if (existing == null) {
            layers.put(layer.getName(), layer);
            return;
        }
        List<String> coordinates = layer.getCoordinates();
        for (int i = 0; i < coordinates.size(); i++) {
            existing.addCoordinate(coordinates.get(i), layer.lineNumberFor(i));
        }
    }

    public LefLayer getLayer(String name) {
        return layers.get(name);
    }

    public Collection<LefLayer> getLayers() {
        return Collections.unmodifiableCollection(layers.values());
    }

    public List<String> getLayerNames() {
        return List.copyOf(layers.keySet());
    }

    public void reorderLayers(Comparator<String> byName) {
        List<String> names = new ArrayList<>(layers.keySet());
        names.sort(byName);
        Map<String, LefLayer> reordered = new LinkedHashMap<>();
        for (String name : names) {
            reordered.put(name, layers.get(name));
        }
        layers.clear();
        layers.putAll(reordered);
    }

    @Override
    public String toString() {
        return "LayerCollection{" + startLine.trim() + ", layers=" + layers.keySet() + "}";
    }
}
