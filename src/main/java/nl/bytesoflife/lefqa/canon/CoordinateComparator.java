package nl.bytesoflife.lefqa.canon;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Orders geometry statements such as {@code RECT 0.000 0.000 1.000 2.000 ;}: by leading
 * keyword first, then field by field as numbers. A field with no numeric prefix, or a
 * missing field, counts as zero.
 */
public class CoordinateComparator implements Comparator<String> {

    public static final CoordinateComparator INSTANCE = new CoordinateComparator();

    private static final Pattern NUMBER_PREFIX = Pattern.compile("^[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

    @Override
    public int compare(String a, String b) {
        String[] ta = a.trim().split("\\s+");
        String[] tb = b.trim().split("\\s+");
        if (!ta[0].equals(tb[0])) {
            return ta[0].compareTo(tb[0]);
        }
        int fields = Math.max(ta.length, tb.length);
        for (int i = 1; i < fields; i++) {
            double fa = i < ta.length ? numericValue(ta[i]) : 0.0;
            double fb = i < tb.length ? numericValue(tb[i]) : 0.0;
            if (fa != fb) {
                return Double.compare(fa, fb);
            }
        }
        return 0;
    }

    static double numericValue(String token) {
        Matcher m = NUMBER_PREFIX.matcher(token);
        if (!m.find()) return 0.0;
        return Double.parseDouble(m.group());
    }
}
