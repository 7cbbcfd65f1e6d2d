package nl.bytesoflife.lefqa.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One LAYER block inside an OBS or PORT: its header line and its geometry statements.
 * Each statement keeps the 1-based source line it came from, so diagnostics still point
 * at the input after the statements have been re-sorted.
 */
public class LefLayer {

    private final String name;
    private final String startLine;
    private final int startLineNumber;
    private final List<String> coordinates = new ArrayList<>();
    private final List<Integer> coordinateLineNumbers = new ArrayList<>();

    public LefLayer(String name, String startLine, int startLineNumber) {
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

    public void addCoordinate(String statement, int lineNumber) {
        coordinates.add(statement);
        coordinateLineNumbers.add(lineNumber);
    }

    public List<String> getCoordinates() {
        return Collections.unmodifiableList(coordinates);
    }

    /** Source line of the statement at {@code index}; the LAYER line when unknown. */
    public int lineNumberFor(int index) {
        if (index < 0 || index >= coordinateLineNumbers.size()) {
            return startLineNumber;
        }
        return coordinateLineNumbers.get(index);
    }

    /** Stable in-place sort that keeps line numbers paired with their statements. */
    public void sortCoordinates(Comparator<String> order) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < coordinates.size(); i++) {
            positions.add(i);
        }
        positions.sort((a, b) -> order.compare(coordinates.get(a), coordinates.get(b)));

        List<String> sortedCoordinates = new ArrayList<>(coordinates.size());
        List<Integer> sortedLines = new ArrayList<>(coordinates.size());
        for (int position : positions) {
            sortedCoordinates.add(coordinates.get(position));
            sortedLines.add(coordinateLineNumbers.get(position));
        }
        coordinates.clear();
        coordinates.addAll(sortedCoordinates);
        coordinateLineNumbers.clear();
        coordinateLineNumbers.addAll(sortedLines);
    }

    @Override
    public String toString() {
        return "LefLayer{name='" + name + "', coordinates=" + coordinates.size() + "}";
    }
}
