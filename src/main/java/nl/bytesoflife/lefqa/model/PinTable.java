package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pins of a cell, looked up by name without regard to case.
 * Keys are normalized on insert and on query; each pin is stored once.
 */
public class PinTable implements Iterable<LefPin> {

    private final Map<String, LefPin> pins = new LinkedHashMap<>();

    /** Adds the pin and returns the pin it replaced, if any name collided. */
    public LefPin put(LefPin pin) {
        return pins.put(key(pin.getName()), pin);
    }

    public LefPin get(String name) {
        return name == null ? null : pins.get(key(name));
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public int size() {
        return pins.size();
    }

    public boolean isEmpty() {
        return pins.isEmpty();
    }

    public Collection<LefPin> values() {
        return Collections.unmodifiableCollection(pins.values());
    }

    public void sort(Comparator<LefPin> order) {
        List<LefPin> sorted = new ArrayList<>(pins.values());
        sorted.sort(order);
        pins.clear();
        for (LefPin pin : sorted) {
            pins.put(key(pin.getName()), pin);
        }
    }

    @Override
    public Iterator<LefPin> iterator() {
        return values().iterator();
    }

    private static String key(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
