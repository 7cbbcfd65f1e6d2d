package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LibertyCell {

    private final String name;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private final List<LibertyPin> pins = new ArrayList<>();

    public LibertyCell(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setProperty(String key, String value) {
        properties.put(key, value);
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public void addPin(LibertyPin pin) {
        pins.add(pin);
    }

    public List<LibertyPin> getPins() {
        return Collections.unmodifiableList(pins);
    }

    /** Case-insensitive pin lookup; the last pin of that name wins. */
    public LibertyPin findPin(String pinName) {
        LibertyPin match = null;
        for (LibertyPin pin : pins) {
            if (pin.getName().equalsIgnoreCase(pinName)) {
                match = pin;
            }
        }
        return match;
    }

    /** The {@code area} attribute as a number, or null when absent or not numeric. */
    public Double getArea() {
        String area = properties.get("area");
        if (area == null) return null;
        try {
            return Double.parseDouble(area.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "LibertyCell{name='" + name + "', pins=" + pins.size() + "}";
    }
}
