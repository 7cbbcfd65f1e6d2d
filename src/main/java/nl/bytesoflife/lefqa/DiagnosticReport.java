package nl.bytesoflife.lefqa;

import nl.bytesoflife.lefqa.model.DiagnosticCategory;

import java.util.ArrayList;
import java.util.List;

/**
 * Text rendering of a {@link Diagnostics} ledger. Categories are numbered in declaration
 * order; the report holds one section per failed category.
 */
public class DiagnosticReport {

    static final String RULE = "-".repeat(62);

    private final ReportOptions options;

    public DiagnosticReport(ReportOptions options) {
        this.options = options;
    }

    /**
     * @param sortedName name of the canonical output, quoted in the semicolon section
     */
    public String render(Diagnostics diagnostics, String sortedName) {
        DiagnosticCategory[] categories = DiagnosticCategory.values();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < categories.length; i++) {
            DiagnosticCategory category = categories[i];
            List<String> messages = diagnostics.get(category);
            if (messages.isEmpty()) continue;

            sb.append('\n').append(header(i, categories.length, category, "failed")).append('\n');
            sb.append(category.getSeverity().label()).append(": ").append(category.getDescription()).append('\n');
            switch (category) {
                case LINE_ENDING_SEMICOLONS -> sb.append("These issues are fixed in ").append(sortedName).append(".\n");
                case MISSING_VIA_OBS -> sb.append("VIA layers should have matching OBS definitions for proper DRC compliance.\n");
                default -> {
                }
            }
            sb.append(RULE).append('\n');
            if (options.truncate() && messages.size() >= options.truncateThreshold()) {
                sb.append("Too many errors to print every line [").append(messages.size())
                        .append(" total error lines]\n");
            } else {
                for (String message : messages) {
                    sb.append(message).append('\n');
                }
            }
            sb.append(RULE).append('\n');
        }
        return sb.toString();
    }

    /** One pass/fail line per category, for the console. */
    public List<String> summary(Diagnostics diagnostics) {
        DiagnosticCategory[] categories = DiagnosticCategory.values();
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < categories.length; i++) {
            String outcome = diagnostics.count(categories[i]) == 0 ? "passed" : "failed";
            lines.add(header(i, categories.length, categories[i], outcome));
        }
        return lines;
    }

    private static String header(int index, int total, DiagnosticCategory category, String outcome) {
        return "Test [" + (index + 1) + "/" + total + "] '" + category.getKey() + "' " + outcome + ".";
    }
}
