package nl.bytesoflife.lefqa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-run record of which values were seen for CLASS, SYMMETRY, SITE, DIRECTION and USE,
 * with the source reference of every occurrence.
 */
public class PropertyTally {

    private final Map<String, Map<String, List<String>>> values = new LinkedHashMap<>();

    public void record(String property, String value, String occurrence) {
        values.computeIfAbsent(property, k -> new LinkedHashMap<>())
                .computeIfAbsent(value, k -> new ArrayList<>())
                .add(occurrence);
    }

    public Map<String, List<String>> get(String property) {
        Map<String, List<String>> seen = values.get(property);
        return seen == null ? Map.of() : Collections.unmodifiableMap(seen);
    }

    public int count(String property, String value) {
        List<String> occurrences = get(property).get(value);
        return occurrences == null ? 0 : occurrences.size();
    }
}
