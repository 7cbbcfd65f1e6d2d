package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Layer names and layer roles read from a technology file (TF or TLEF).
 * Role lookups are case-insensitive; the layer name list keeps file order and case.
 */
public class TechnologyLayers {

    private final List<String> layerNames = new ArrayList<>();
    private final Map<String, LayerType> types = new LinkedHashMap<>();

    public static TechnologyLayers empty() {
        return new TechnologyLayers();
    }

    public void addLayerName(String name) {
        if (!layerNames.contains(name)) {
            layerNames.add(name);
        }
    }

    public void define(String name, LayerType type) {
        types.put(key(name), type);
    }

    public void defineIfAbsent(String name, LayerType type) {
        types.putIfAbsent(key(name), type);
    }

    public List<String> getLayerNames() {
        return Collections.unmodifiableList(layerNames);
    }

    /** Returns the recorded role, or null when the name has no entry. */
    public LayerType typeOf(String name) {
        return types.get(key(name));
    }

    public boolean hasEntry(String name) {
        return types.containsKey(key(name));
    }

    public boolean hasTypes() {
        return !types.isEmpty();
    }

    public int count(LayerType type) {
        return (int) types.values().stream().filter(t -> t == type).count();
    }

    public List<String> namesOfType(LayerType type) {
        return types.entrySet().stream()
                .filter(e -> e.getValue() == type)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "TechnologyLayers{layers=" + layerNames.size() + ", cut=" + count(LayerType.CUT)
                + ", routing=" + count(LayerType.ROUTING) + "}";
    }
}
