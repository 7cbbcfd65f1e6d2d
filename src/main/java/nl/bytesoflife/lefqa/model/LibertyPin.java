package nl.bytesoflife.lefqa.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class LibertyPin {

    private final String name;
    private final Map<String, String> properties = new LinkedHashMap<>();

    public LibertyPin(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setProperty(String key, String value) {
        properties.put(key, value);
    }

    /** Raw value with quotes and semicolons removed, or null when the property was not present. */
    public String getProperty(String key) {
        return properties.get(key);
    }

    public Map<String, String> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    @Override
    public String toString() {
        return "LibertyPin{name='" + name + "', properties=" + properties + "}";
    }
}
