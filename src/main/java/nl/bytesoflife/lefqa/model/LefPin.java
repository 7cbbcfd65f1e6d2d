package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class LefPin {

    private final String name;
    private final String startLine;
    private final int startLineNumber;
    private String endLine;
    private final List<String> properties = new ArrayList<>();
    private final List<String> keywordProperties = new ArrayList<>();
    private final List<LayerCollection> ports = new ArrayList<>();

    public LefPin(String name, String startLine, int startLineNumber) {
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

    public void addPort(LayerCollection port) {
        ports.add(port);
    }

    public List<String> getProperties() {
        return Collections.unmodifiableList(properties);
    }

    public List<String> getKeywordProperties() {
        return Collections.unmodifiableList(keywordProperties);
    }

    public List<LayerCollection> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    /**
     * Value of the first property whose keyword matches, upper-cased with quotes and
     * semicolons removed. For {@code DIRECTION INPUT ;} and keyword {@code direction} this is {@code INPUT}.
     */
    public Optional<String> propertyValue(String keyword) {
        for (String line : properties) {
            String[] tokens = line.trim().split("\\s+");
            if (tokens[0].equalsIgnoreCase(keyword) && tokens.length > 1) {
                String value = tokens[1].replaceAll("[\";]", "").trim().toUpperCase(Locale.ROOT);
                if (!value.isEmpty()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    public void sortProperties(Comparator<String> order) {
        properties.sort(order);
    }

    public void sortKeywordProperties() {
        Collections.sort(keywordProperties);
    }

    public void sortPorts(Comparator<LayerCollection> order) {
        ports.sort(order);
    }

    @Override
    public String toString() {
        return "LefPin{name='" + name + "', properties=" + properties.size() + ", ports=" + ports.size() + "}";
    }
}
