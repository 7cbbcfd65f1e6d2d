package nl.bytesoflife.lefqa.canon;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Priority tables for LEF statements and the comparator that applies them.
 */
public final class PropertyOrder {

    public static final List<String> CELL = List.of(
            "CLASS", "SOURCE", "FOREIGN", "ORIGIN", "EEQ", "SIZE", "SYMMETRY", "SITE", "DENSITY", "PROPERTY");

    public static final List<String> PIN = List.of(
            "TAPERRULE", "DIRECTION", "USE", "NETEXPR", "SUPPLYSENSITIVITY",
            "GROUNDSENSITIVITY", "SHAPE", "MUSTJOIN", "PROPERTY",
            "ANTENNAPARTIALMETALAREA", "ANTENNAPARTIALMETALSIDEAREA",
            "ANTENNAPARTIALCUTAREA", "ANTENNADIFFAREA", "ANTENNAMODEL",
            "ANTENNAGATEAREA", "ANTENNAMAXAREACAR", "ANTENNAMAXSIDEAREACAR",
            "ANTENNAMAXCUTCAR");

    private static final Pattern LEADING_WORD = Pattern.compile("^\\s*(\\w+)");

    private PropertyOrder() {
    }

    /**
     * Listed keys sort by list position and before every unlisted key. Two unlisted keys,
     * or two keys at the same position, fall back to {@code tiebreak}.
     */
    public static int compare(List<String> priorities, String a, String b, int tiebreak) {
        int ia = priorities.indexOf(a);
        int ib = priorities.indexOf(b);
        if (ia >= 0 && ib >= 0) {
            return ia != ib ? Integer.compare(ia, ib) : tiebreak;
        }
        if (ia >= 0) return -1;
        if (ib >= 0) return 1;
        return tiebreak;
    }

    public static Comparator<String> byPriority(List<String> priorities, Function<String, String> keyOf,
                                                Comparator<String> tiebreak) {
        return (a, b) -> compare(priorities, keyOf.apply(a), keyOf.apply(b), tiebreak.compare(a, b));
    }

    /** Cell statements: keyed by their leading word as written, ties broken on the whole line. */
    public static Comparator<String> cellProperties() {
        return byPriority(CELL, PropertyOrder::leadingWord, Comparator.naturalOrder());
    }

    /** Pin statements: keyed by their upper-cased first token, ties broken on the whole line. */
    public static Comparator<String> pinProperties() {
        return byPriority(PIN, line -> firstToken(line).toUpperCase(Locale.ROOT), Comparator.naturalOrder());
    }

    /** Layer names: keyed by first token against the active layer order, ties broken on the name. */
    public static Comparator<String> layerNames(List<String> layerOrder) {
        return byPriority(layerOrder, PropertyOrder::firstToken, Comparator.naturalOrder());
    }

    static String leadingWord(String line) {
        Matcher m = LEADING_WORD.matcher(line);
        return m.find() ? m.group(1) : "";
    }

    public static String firstToken(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) return "";
        return trimmed.split("\\s+")[0];
    }
}
