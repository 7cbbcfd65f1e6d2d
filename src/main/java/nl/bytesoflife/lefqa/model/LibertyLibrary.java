package nl.bytesoflife.lefqa.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class LibertyLibrary {

    private final String sourceName;
    private final Map<String, LibertyCell> cells = new LinkedHashMap<>();

    public LibertyLibrary(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void addCell(LibertyCell cell) {
        cells.put(cell.getName(), cell);
    }

    public LibertyCell getCell(String name) {
        return cells.get(name);
    }

    /** Case-insensitive cell lookup; null when no cell matches. */
    public LibertyCell findCell(String name) {
        LibertyCell exact = cells.get(name);
        if (exact != null) return exact;
        for (LibertyCell cell : cells.values()) {
            if (cell.getName().equalsIgnoreCase(name)) {
                return cell;
            }
        }
        return null;
    }

    public Collection<LibertyCell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    @Override
    public String toString() {
        return "LibertyLibrary{source='" + sourceName + "', cells=" + cells.size() + "}";
    }
}
