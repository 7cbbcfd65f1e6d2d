package nl.bytesoflife.lefqa;

import nl.bytesoflife.lefqa.model.DiagnosticCategory;
import nl.bytesoflife.lefqa.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only ledger of diagnostic messages, grouped by category.
 * Messages are never deduplicated; a message carries no trailing newline.
 */
public class Diagnostics {

    private final Map<DiagnosticCategory, List<String>> entries = new EnumMap<>(DiagnosticCategory.class);

    public Diagnostics() {
        for (DiagnosticCategory category : DiagnosticCategory.values()) {
            entries.put(category, new ArrayList<>());
        }
    }

    public void add(DiagnosticCategory category, String message) {
        entries.get(category).add(message);
    }

    public List<String> get(DiagnosticCategory category) {
        return Collections.unmodifiableList(entries.get(category));
    }

    public int count(DiagnosticCategory category) {
        return entries.get(category).size();
    }

    public int total() {
        return entries.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return total() == 0;
    }

    public boolean hasErrors() {
        return entries.entrySet().stream()
                .anyMatch(e -> e.getKey().getSeverity() == Severity.ERROR && !e.getValue().isEmpty());
    }

    public List<DiagnosticCategory> nonEmptyCategories() {
        return entries.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Diagnostics: ").append(total()).append(" entries\n");
        for (DiagnosticCategory category : nonEmptyCategories()) {
            sb.append("  ").append(category.getKey()).append(": ").append(count(category)).append("\n");
        }
        return sb.toString();
    }
}
