package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.Diagnostics;
import nl.bytesoflife.lefqa.model.DiagnosticCategory;
import nl.bytesoflife.lefqa.model.LayerClassifier;
import nl.bytesoflife.lefqa.model.LayerCollection;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLayer;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags pin geometry on CUT layers that has no OBS counterpart in the same cell.
 * Runs once the whole library is loaded, so every layer lookup sees the final technology table.
 */
public class ViaObsCheck {

    private static final Logger log = LoggerFactory.getLogger(ViaObsCheck.class);

    private final LayerClassifier classifier;

    public ViaObsCheck(LayerClassifier classifier) {
        this.classifier = classifier;
    }

    public void check(LefLibrary library, Diagnostics diagnostics) {
        for (LefCell cell : library.getCells()) {
            checkCell(cell, diagnostics);
        }
    }

    public void checkCell(LefCell cell, Diagnostics diagnostics) {
        // layer -> pin -> statement count, in first-seen order
        Map<String, Map<String, Integer>> cutUsage = new LinkedHashMap<>();
        for (LefPin pin : cell.getPins()) {
            for (LayerCollection port : pin.getPorts()) {
                for (LefLayer layer : port.getLayers()) {
                    String name = normalize(layer.getName());
                    if (name.isEmpty() || !classifier.isCut(name)) continue;
                    int statements = layer.getCoordinates().size();
                    if (statements == 0) continue;
                    cutUsage.computeIfAbsent(name, k -> new LinkedHashMap<>())
                            .merge(pin.getName(), statements, Integer::sum);
                }
            }
        }
        if (cutUsage.isEmpty()) return;

        LayerCollection obstruction = cell.getObstruction();
        if (obstruction == null) {
            cutUsage.forEach((layer, pins) -> pins.forEach((pin, count) ->
                    report(diagnostics, cell, pin, layer, " (no OBS section)", count)));
            return;
        }

        Set<String> obstructed = obstruction.getLayerNames().stream()
                .map(ViaObsCheck::normalize)
                .collect(Collectors.toSet());
        cutUsage.forEach((layer, pins) -> {
            if (obstructed.contains(layer)) return;
            pins.forEach((pin, count) -> report(diagnostics, cell, pin, layer, "", count));
        });
    }

    private void report(Diagnostics diagnostics, LefCell cell, String pin, String layer, String qualifier, int count) {
        log.debug("Cell {} pin {}: cut layer {} not covered by OBS", cell.getName(), pin, layer);
        diagnostics.add(DiagnosticCategory.MISSING_VIA_OBS,
                "Cell " + cell.getName() + ", pin " + pin + " - cut layer " + layer
                        + " missing from OBS" + qualifier + " (" + count + (count == 1 ? " via)" : " vias)"));
    }

    private static String normalize(String layerName) {
        String clean = LayerClassifier.cleanName(layerName);
        return clean == null ? "" : clean.toUpperCase(Locale.ROOT);
    }
}
