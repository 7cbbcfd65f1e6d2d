package nl.bytesoflife.lefqa.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Answers whether a layer is a CUT or ROUTING layer.
 * <p>
 * The technology table is authoritative for any name it holds, whatever role it records.
 * Names without an entry are classified by name shape; the first such lookup in a run
 * logs a warning.
 */
public class LayerClassifier {

    private static final Logger log = LoggerFactory.getLogger(LayerClassifier.class);

    private static final List<Pattern> CUT_SHAPES = List.of(
            Pattern.compile("^VI\\d*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^VIA\\d*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^V\\d+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^CUT\\d*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^CONT$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^MCON$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^CONTACT$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^CO$", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> ROUTING_SHAPES = List.of(
            Pattern.compile("^ME\\d+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^MET\\d+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^METAL\\d*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^M\\d+$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^LI\\d*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^AP\\d*$", Pattern.CASE_INSENSITIVE));

    private final TechnologyLayers table;
    private boolean fallbackWarned;

    public LayerClassifier(TechnologyLayers table) {
        this.table = table != null ? table : TechnologyLayers.empty();
    }

    public boolean isCut(String layerName) {
        return classify(layerName, LayerType.CUT, CUT_SHAPES);
    }

    public boolean isRouting(String layerName) {
        return classify(layerName, LayerType.ROUTING, ROUTING_SHAPES);
    }

    public boolean hasWarnedFallback() {
        return fallbackWarned;
    }

    public TechnologyLayers getTable() {
        return table;
    }

    private boolean classify(String layerName, LayerType wanted, List<Pattern> shapes) {
        String clean = cleanName(layerName);
        if (clean == null) return false;

        if (table.hasTypes()) {
            LayerType recorded = table.typeOf(clean);
            if (recorded != null) {
                return recorded == wanted;
            }
            warnOnce("Some layers not found in technology file (first: {}) - using fallback pattern matching for unknown layers", clean);
        } else {
            warnOnce("No technology layer types loaded - using fallback pattern matching for layer type detection", clean);
        }

        for (Pattern shape : shapes) {
            if (shape.matcher(clean).matches()) {
                return true;
            }
        }
        return false;
    }

    private void warnOnce(String message, String layerName) {
        if (!fallbackWarned) {
            log.warn(message, layerName);
            fallbackWarned = true;
        }
    }

    /** First whitespace-delimited token of the name, quotes removed; null when nothing is left. */
    public static String cleanName(String layerName) {
        if (layerName == null) return null;
        String stripped = layerName.replace("\"", "").replace("'", "").trim();
        if (stripped.isEmpty()) return null;
        return stripped.split("\\s+")[0];
    }
}
