package nl.bytesoflife.lefqa.canon;

import nl.bytesoflife.lefqa.model.LayerCollection;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLayer;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;

/**
 * Renders a library as LEF text in its current order. Every line ends with {@code \n};
 * each cell is followed by one empty line.
 */
public class LefWriter {

    public String write(LefLibrary library) {
        StringBuilder out = new StringBuilder();
        for (String line : library.getHeader()) {
            line(out, line);
        }
        if (library.hasPropertyDefinitions()) {
            line(out, library.getPropertyDefinitionsStart());
            for (String line : library.getPropertyDefinitions()) {
                line(out, line);
            }
            line(out, library.getPropertyDefinitionsEnd());
        }
        for (LefCell cell : library.getCells()) {
            writeCell(out, cell);
        }
        line(out, library.getEndLine());
        return out.toString();
    }

    private void writeCell(StringBuilder out, LefCell cell) {
        line(out, cell.getStartLine());
        for (String property : cell.getProperties()) {
            line(out, property);
        }
        for (LefPin pin : cell.getPins()) {
            writePin(out, pin);
        }
        if (cell.getObstruction() != null) {
            writeCollection(out, cell.getObstruction());
        }
        for (String property : cell.getKeywordProperties()) {
            line(out, property);
        }
        line(out, cell.getEndLine());
        out.append('\n');
    }

    private void writePin(StringBuilder out, LefPin pin) {
        line(out, pin.getStartLine());
        for (String property : pin.getProperties()) {
            line(out, property);
        }
        for (LayerCollection port : pin.getPorts()) {
            writeCollection(out, port);
        }
        for (String property : pin.getKeywordProperties()) {
            line(out, property);
        }
        line(out, pin.getEndLine());
    }

    private void writeCollection(StringBuilder out, LayerCollection collection) {
        line(out, collection.getStartLine());
        for (LefLayer layer : collection.getLayers()) {
            line(out, layer.getStartLine());
            for (String coordinate : layer.getCoordinates()) {
                line(out, coordinate);
            }
        }
        line(out, collection.getEndLine());
    }

    // absent end markers are skipped
    private static void line(StringBuilder out, String line) {
        if (line != null) {
            out.append(line).append('\n');
        }
    }
}
