package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.model.LibertyCell;
import nl.bytesoflife.lefqa.model.LibertyLibrary;
import nl.bytesoflife.lefqa.model.LibertyPin;
import nl.bytesoflife.lefqa.parser.LibertyScanner.LibertyScan;
import nl.bytesoflife.lefqa.parser.LibertyScanner.LineEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds Liberty cell and pin records from a {@link LibertyScan}.
 * <p>
 * A cell owns every attribute line between its start and the next cell start; a pin owns
 * attribute lines between its start and the next pin or cell start. All queues only move
 * forward, so the whole file is assigned in one pass.
 */
public class LibertyExtractor {

    private static final Logger log = LoggerFactory.getLogger(LibertyExtractor.class);

    public LibertyLibrary extract(String sourceName, LibertyScan scan) {
        LibertyLibrary library = new LibertyLibrary(sourceName);
        while (!scan.cellStarts().isEmpty()) {
            LibertyCell cell = extractCell(scan);
            library.addCell(cell);
            log.debug("Liberty cell {}: {} pins", cell.getName(), cell.getPins().size());
        }
        return library;
    }

    private LibertyCell extractCell(LibertyScan scan) {
        LineEntry start = scan.cellStarts().poll();
        int cellEnd = nextLineNumber(scan.cellStarts());
        LibertyCell cell = new LibertyCell(groupName(start.text()));

        takeProperties(scan.cellProperties(), start.lineNumber(), cellEnd)
                .forEach(cell::setProperty);

        Deque<LineEntry> pinStarts = scan.pinStarts();
        advanceToLine(pinStarts, start.lineNumber());
        while (!pinStarts.isEmpty() && pinStarts.peek().lineNumber() < cellEnd) {
            LineEntry pinStart = pinStarts.poll();
            int pinEnd = Math.min(nextLineNumber(pinStarts), cellEnd);
            LibertyPin pin = new LibertyPin(groupName(pinStart.text()));
            takeProperties(scan.pinProperties(), pinStart.lineNumber(), pinEnd)
                    .forEach(pin::setProperty);
            cell.addPin(pin);
        }
        return cell;
    }

    private static Map<String, String> takeProperties(Map<String, Deque<LineEntry>> properties, int from, int until) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<LineEntry>> property : properties.entrySet()) {
            Deque<LineEntry> lines = property.getValue();
            advanceToLine(lines, from);
            if (!lines.isEmpty() && lines.peek().lineNumber() < until) {
                values.put(property.getKey(), attributeValue(lines.poll().text()));
            }
        }
        return values;
    }

    /** Drops every entry before {@code lineNumber}. */
    static void advanceToLine(Deque<LineEntry> lines, int lineNumber) {
        while (!lines.isEmpty() && lines.peek().lineNumber() < lineNumber) {
            lines.poll();
        }
    }

    private static int nextLineNumber(Deque<LineEntry> lines) {
        return lines.isEmpty() ? Integer.MAX_VALUE : lines.peek().lineNumber();
    }

    /** {@code cell ("NAND2")} and {@code pin(A)} both yield the bare name. */
    static String groupName(String line) {
        String name;
        int quote = line.indexOf('"');
        int closing = quote >= 0 ? line.indexOf('"', quote + 1) : -1;
        if (closing > quote) {
            name = line.substring(quote + 1, closing);
        } else {
            int open = line.indexOf('(');
            int close = line.indexOf(')', open + 1);
            name = open >= 0 && close > open ? line.substring(open + 1, close) : line;
        }
        return name.replace("\"", "").trim();
    }

    /** Text after the first colon, quotes and semicolons removed. */
    static String attributeValue(String line) {
        int colon = line.indexOf(':');
        String value = colon >= 0 ? line.substring(colon + 1) : "";
        return value.replaceAll("[\";]", "").trim();
    }
}
