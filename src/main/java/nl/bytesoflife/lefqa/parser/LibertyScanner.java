package nl.bytesoflife.lefqa.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Line-oriented pre-scan of a Liberty file. Collects, with their 1-based line numbers,
 * the lines that open a cell or a pin group and the lines that set one of the attributes
 * of interest. No nesting is tracked here; {@link LibertyExtractor} assigns lines to
 * groups by line number.
 */
public class LibertyScanner {

    public static final List<String> CELL_PROPERTIES = List.of("area");

    public static final List<String> PIN_PROPERTIES = List.of(
            "direction", "pg_type", "voltage_name", "related_power_pin", "related_ground_pin", "clock");

    private static final Pattern CELL_START = Pattern.compile("^\\s*cell\\s*\\(.*\\)\\s*\\{");
    private static final Pattern PIN_START = Pattern.compile("^\\s*(pg_)?pin\\s*\\(\\S+\\)\\s*\\{");

    public record LineEntry(int lineNumber, String text) {
    }

    /** Scan result; the queues are consumed by the extractor. */
    public record LibertyScan(Deque<LineEntry> cellStarts,
                              Map<String, Deque<LineEntry>> cellProperties,
                              Deque<LineEntry> pinStarts,
                              Map<String, Deque<LineEntry>> pinProperties) {
    }

    private final Map<String, Pattern> cellPropertyPatterns = patterns(CELL_PROPERTIES);
    private final Map<String, Pattern> pinPropertyPatterns = patterns(PIN_PROPERTIES);

    public LibertyScan scan(String content) {
        Deque<LineEntry> cellStarts = new ArrayDeque<>();
        Deque<LineEntry> pinStarts = new ArrayDeque<>();
        Map<String, Deque<LineEntry>> cellProperties = queues(CELL_PROPERTIES);
        Map<String, Deque<LineEntry>> pinProperties = queues(PIN_PROPERTIES);

        int lineNumber = 0;
        for (String line : content.lines().toList()) {
            lineNumber++;
            LineEntry entry = new LineEntry(lineNumber, line);
            if (CELL_START.matcher(line).find()) {
                cellStarts.add(entry);
            }
            if (PIN_START.matcher(line).find()) {
                pinStarts.add(entry);
            }
            collect(entry, cellPropertyPatterns, cellProperties);
            collect(entry, pinPropertyPatterns, pinProperties);
        }
        return new LibertyScan(cellStarts, cellProperties, pinStarts, pinProperties);
    }

    private static void collect(LineEntry entry, Map<String, Pattern> patterns, Map<String, Deque<LineEntry>> into) {
        for (Map.Entry<String, Pattern> p : patterns.entrySet()) {
            if (p.getValue().matcher(entry.text()).find()) {
                into.get(p.getKey()).add(entry);
            }
        }
    }

    private static Map<String, Pattern> patterns(List<String> properties) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        for (String property : properties) {
            patterns.put(property, Pattern.compile("^\\s*" + Pattern.quote(property) + "\\s*:"));
        }
        return patterns;
    }

    private static Map<String, Deque<LineEntry>> queues(List<String> properties) {
        Map<String, Deque<LineEntry>> queues = new LinkedHashMap<>();
        for (String property : properties) {
            queues.put(property, new ArrayDeque<>());
        }
        return queues;
    }
}
