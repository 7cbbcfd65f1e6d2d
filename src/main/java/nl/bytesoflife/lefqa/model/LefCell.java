package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * A MACRO block: simple property lines, PROPERTY lines, pins and an optional OBS section.
 */
public class LefCell {

    private final String name;
    private final String startLine;
    private final int startLineNumber;
    private String endLine;
    private final List<String> properties = new ArrayList<>();
    private final List<String> keywordProperties = new ArrayList<>();
    private final PinTable pins = new PinTable();
    private LayerCollection obstruction;

    public LefCell(String name, String startLine, int startLineNumber) {
        this.name = name;
        this.startLine = startLine;
        this.startLineNumber = startLineNumber;
    }

    public String getName() {
        return name;
    }

    public String getStartLine() {
        return startLine;
    }

    public int getStartLineNumber() {
        return startLineNumber;
    }

    /** The END line, or null when the cell was never closed. */
    public String getEndLine() {
        return endLine;
    }

    public void setEndLine(String endLine) {
        this.endLine = endLine;
    }

    public void addProperty(String line) {
        properties.add(line);
    }

    public void addKeywordProperty(String line) {
        keywordProperties.add(line);
    }

    public List<String> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public List<String> getKeywordProperties() {
        return Collections.unmodifiableList(keywordProperties);
    }

    public PinTable getPins() {
        return pins;
    }

    public LefPin getPin(String name) {
        return pins.get(name);
    }

    public LayerCollection getObstruction() {
        return obstruction;
    }

    public void setObstruction(LayerCollection obstruction) {
        this.obstruction = obstruction;
    }

    /**
     * Width times height from the last SIZE line ({@code SIZE w BY h ;}), or null without one.
     */
    public Double getArea() {
        Double area = null;
        for (String line : properties) {
            String[] tokens = line.trim().split("\\s+");
            if (tokens[0].equalsIgnoreCase("SIZE") && tokens.length >= 4) {
                try {
                    area = Double.parseDouble(tokens[1]) * Double.parseDouble(tokens[3]);
                } catch (NumberFormatException e) {
                    area = null;
                }
            }
        }
        return area;
    }

    public void sortProperties(Comparator<String> order) {
        properties.sort(order);
    }

    public void sortKeywordProperties() {
        Collections.sort(keywordProperties);
    }

    @Override
    public String toString() {
        return "LefCell{name='" + name + "', pins=" + pins.size()
                + (obstruction != null ? ", obs=" + obstruction.getLayerNames() : "") + "}";
    }
}
