package nl.bytesoflife.lefqa;

/**
 * @param truncateThreshold categories with at least this many messages can be summarized
 * @param truncate          print a count instead of the messages for such categories
 */
public record ReportOptions(int truncateThreshold, boolean truncate) {

    public static final int DEFAULT_THRESHOLD = 1000;

    public static ReportOptions defaults() {
        return new ReportOptions(DEFAULT_THRESHOLD, false);
    }

    public static ReportOptions truncating() {
        return new ReportOptions(DEFAULT_THRESHOLD, true);
    }
}
