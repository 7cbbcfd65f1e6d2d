package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.Diagnostics;
import nl.bytesoflife.lefqa.model.DiagnosticCategory;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;
import nl.bytesoflife.lefqa.model.LibertyCell;
import nl.bytesoflife.lefqa.model.LibertyLibrary;
import nl.bytesoflife.lefqa.model.LibertyPin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles LEF cells and pins with Liberty cells and pins.
 * <p>
 * Every LEF cell is looked up in every Liberty file and every Liberty cell in every LEF
 * file, ignoring case. Missing cells and pins are grouped so each cell yields one
 * diagnostic listing the files involved. Matched pins run through the registered
 * {@link PinRule}s.
 */
public class CrossValidator {

    private static final Logger log = LoggerFactory.getLogger(CrossValidator.class);

    static final double AREA_TOLERANCE = 1e-6;

    private final Map<String, PinRule> rules = new LinkedHashMap<>();

    public CrossValidator registerRule(PinRule rule) {
        rules.put(rule.getPropertyKey(), rule);
        return this;
    }

    public static CrossValidator withDefaultRules() {
        return new CrossValidator()
                .registerRule(new DirectionRule())
                .registerRule(new PgTypeRule())
                .registerRule(new ClockRule());
    }

    public void validate(List<LefLibrary> lefs, List<LibertyLibrary> liberties, Diagnostics diagnostics) {
        if (liberties.isEmpty()) {
            log.debug("No Liberty files, skipping cross-checks");
            return;
        }
        checkLefAgainstLiberty(lefs, liberties, diagnostics);
        checkLibertyAgainstLef(lefs, liberties, diagnostics);
    }

    private void checkLefAgainstLiberty(List<LefLibrary> lefs, List<LibertyLibrary> liberties, Diagnostics diagnostics) {
        Map<String, List<String>> missingCells = new LinkedHashMap<>();
        Map<String, List<String>> areaMismatches = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> missingPins = new LinkedHashMap<>();

        for (LefLibrary lef : lefs) {
            for (LefCell cell : lef.getCells()) {
                for (LibertyLibrary liberty : liberties) {
                    log.debug("Comparing {} cell {} to {}", lef.getSourceName(), cell.getName(), liberty.getSourceName());
                    LibertyCell libertyCell = liberty.findCell(cell.getName());
                    if (libertyCell == null) {
                        group(missingCells, cell.getName()).add(liberty.getSourceName());
                        continue;
                    }

                    Double lefArea = cell.getArea();
                    Double libertyArea = libertyCell.getArea();
                    if (!areasMatch(lefArea, libertyArea)) {
                        group(areaMismatches, cell.getName()).add(liberty.getSourceName()
                                + " (LEF area " + formatArea(lefArea) + ", LIB area " + formatArea(libertyArea) + ")");
                    }

                    for (LefPin pin : cell.getPins()) {
                        LibertyPin libertyPin = libertyCell.findPin(pin.getName());
                        if (libertyPin == null) {
                            group(missingPins.computeIfAbsent(cell.getName(), k -> new LinkedHashMap<>()), pin.getName())
                                    .add(liberty.getSourceName());
                            continue;
                        }
                        for (PinRule rule : rules.values()) {
                            Optional<String> mismatch = rule.check(pin, libertyPin);
                            if (mismatch.isPresent()) {
                                diagnostics.add(DiagnosticCategory.LIBERTY_INCORRECT_PIN_PROPERTY,
                                        cell.getName() + "\n\t" + mismatch.get()
                                                + "\n\tFiles: " + liberty.getSourceName() + ", " + lef.getSourceName());
                            }
                        }
                    }
                }
            }
        }

        report(diagnostics, DiagnosticCategory.LIBERTY_MISSING_CELL, missingCells);
        report(diagnostics, DiagnosticCategory.AREA_MISMATCH, areaMismatches);
        reportPins(diagnostics, DiagnosticCategory.LIBERTY_MISSING_PIN, missingPins);
    }

    private void checkLibertyAgainstLef(List<LefLibrary> lefs, List<LibertyLibrary> liberties, Diagnostics diagnostics) {
        Map<String, List<String>> missingCells = new LinkedHashMap<>();
        Map<String, Map<String, List<String>>> missingPins = new LinkedHashMap<>();

        for (LibertyLibrary liberty : liberties) {
            for (LibertyCell libertyCell : liberty.getCells()) {
                for (LefLibrary lef : lefs) {
                    LefCell cell = lef.findCell(libertyCell.getName());
                    if (cell == null) {
                        group(missingCells, libertyCell.getName()).add(liberty.getSourceName());
                        continue;
                    }
                    for (LibertyPin libertyPin : libertyCell.getPins()) {
                        if (!cell.getPins().contains(libertyPin.getName())) {
                            group(missingPins.computeIfAbsent(libertyCell.getName(), k -> new LinkedHashMap<>()),
                                    libertyPin.getName()).add(liberty.getSourceName());
                        }
                    }
                }
            }
        }

        report(diagnostics, DiagnosticCategory.LEF_MISSING_CELL, missingCells);
        reportPins(diagnostics, DiagnosticCategory.LEF_MISSING_PIN, missingPins);
    }

    /** Equal within a relative tolerance; a missing side never matches. */
    static boolean areasMatch(Double lef, Double liberty) {
        if (lef == null || liberty == null) return false;
        double scale = Math.max(1.0, Math.max(Math.abs(lef), Math.abs(liberty)));
        return Math.abs(lef - liberty) <= AREA_TOLERANCE * scale;
    }

    private static String formatArea(Double area) {
        return area == null ? "missing" : String.valueOf(area);
    }

    private static List<String> group(Map<String, List<String>> groups, String key) {
        return groups.computeIfAbsent(key, k -> new ArrayList<>());
    }

    // cell:\n\tfile...
    private static void report(Diagnostics diagnostics, DiagnosticCategory category, Map<String, List<String>> groups) {
        groups.forEach((cell, files) -> {
            StringBuilder sb = new StringBuilder(cell).append(':');
            files.forEach(file -> sb.append("\n\t").append(file));
            diagnostics.add(category, sb.toString());
        });
    }

    // cell:\n\tpin:\n\t\tfile...
    private static void reportPins(Diagnostics diagnostics, DiagnosticCategory category,
                                   Map<String, Map<String, List<String>>> groups) {
        groups.forEach((cell, pins) -> {
            StringBuilder sb = new StringBuilder(cell).append(':');
            pins.forEach((pin, files) -> {
                sb.append("\n\t").append(pin).append(':');
                files.forEach(file -> sb.append("\n\t\t").append(file));
            });
            diagnostics.add(category, sb.toString());
        });
    }
}
