package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed LEF document. Header and PROPERTYDEFINITIONS text is kept verbatim apart from
 * semicolon spacing fixes; cells are modelled.
 */
public class LefLibrary {

    private final String sourceName;
    private final List<String> header = new ArrayList<>();
    private String propertyDefinitionsStart;
    private List<String> propertyDefinitions;
    private String propertyDefinitionsEnd;
    private final Map<String, LefCell> cells = new LinkedHashMap<>();
    private String endLine;

    public LefLibrary(String sourceName) {
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }

    public void addHeaderLine(String line) {
        header.add(line);
    }

    public List<String> getHeader() {
        return Collections.unmodifiableList(header);
    }

    public void startPropertyDefinitions(String startLine) {
        this.propertyDefinitionsStart = startLine;
        this.propertyDefinitions = new ArrayList<>();
    }

    public void addPropertyDefinition(String line) {
        propertyDefinitions.add(line);
    }

    public void setPropertyDefinitionsEnd(String endLine) {
        this.propertyDefinitionsEnd = endLine;
    }

    public boolean hasPropertyDefinitions() {
        return propertyDefinitions != null;
    }

    public String getPropertyDefinitionsStart() {
        return propertyDefinitionsStart;
    }

    public List<String> getPropertyDefinitions() {
        return propertyDefinitions == null ? List.of() : Collections.unmodifiableList(propertyDefinitions);
    }

    public String getPropertyDefinitionsEnd() {
        return propertyDefinitionsEnd;
    }

    public void addCell(LefCell cell) {
        cells.put(cell.getName(), cell);
    }

    public LefCell getCell(String name) {
        return cells.get(name);
    }

    /** Case-insensitive cell lookup; null when no cell matches. */
    public LefCell findCell(String name) {
        LefCell exact = cells.get(name);
        if (exact != null) return exact;
        for (LefCell cell : cells.values()) {
            if (cell.getName().equalsIgnoreCase(name)) {
                return cell;
            }
        }
        return null;
    }

    public Collection<LefCell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public List<String> getCellNames() {
        return List.copyOf(cells.keySet());
    }

    public void sortCellsByName() {
        List<String> names = new ArrayList<>(cells.keySet());
        Collections.sort(names);
        Map<String, LefCell> sorted = new LinkedHashMap<>();
        for (String name : names) {
            sorted.put(name, cells.get(name));
        }
        cells.clear();
        cells.putAll(sorted);
    }

    /** The END LIBRARY line, or null when the document ended without one. */
    public String getEndLine() {
        return endLine;
    }

    public void setEndLine(String endLine) {
        this.endLine = endLine;
    }

    @Override
    public String toString() {
        return "LefLibrary{source='" + sourceName + "', cells=" + cells.size() + "}";
    }
}
