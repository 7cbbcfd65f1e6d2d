package nl.bytesoflife.lefqa.parser;

import java.util.List;

/**
 * Forward-only view over the lines of a document that skips blank lines.
 * {@link #current()} is null once the input is exhausted.
 */
public class LineCursor {

    private final List<String> lines;
    private int index;
    private String current;

    public LineCursor(List<String> lines) {
        this.lines = lines;
        this.index = 0;
        load();
    }

    public static LineCursor of(String content) {
        return new LineCursor(content.lines().toList());
    }

    public String current() {
        return current;
    }

    public String advance() {
        if (index < lines.size()) {
            index++;
        }
        load();
        return current;
    }

    public boolean atEnd() {
        return current == null;
    }

    /** 0-based position of the current line; equals the line count at end of input. */
    public int index() {
        return index;
    }

    /** 1-based line number of the current line, for diagnostics. */
    public int lineNumber() {
        return index + 1;
    }

    private void load() {
        current = null;
        while (index < lines.size()) {
            String line = lines.get(index);
            if (!line.isBlank()) {
                current = line;
                return;
            }
            index++;
        }
    }
}
