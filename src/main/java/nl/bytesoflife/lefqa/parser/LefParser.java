package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.Diagnostics;
import nl.bytesoflife.lefqa.RunContext;
import nl.bytesoflife.lefqa.canon.PropertyOrder;
import nl.bytesoflife.lefqa.check.ViaObsCheck;
import nl.bytesoflife.lefqa.model.DiagnosticCategory;
import nl.bytesoflife.lefqa.model.LayerCollection;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLayer;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for cell-library LEF files.
 * <p>
 * Each level starts with the cursor on its start line and returns with the cursor just
 * past its end line. Structural problems that still leave the document readable are
 * recorded in the {@link Diagnostics} ledger; a line that fits no production where a cell
 * is expected throws {@link ParseException}.
 */
public class LefParser {

    private static final Logger log = LoggerFactory.getLogger(LefParser.class);

    private static final Pattern CELL_START = Pattern.compile("^MACRO\\s+\\w");
    private static final Pattern PIN_START = Pattern.compile("^\\s*PIN\\s+(.*)$");
    private static final Pattern COLLECTION_START = Pattern.compile("^\\s*(OBS|PORT)\\b");
    private static final Pattern LAYER_START = Pattern.compile("^\\s*LAYER\\b(.*)$");
    private static final Pattern PROPERTY_DEFINITIONS_START = Pattern.compile("^\\s*PROPERTYDEFINITIONS\\b");
    private static final Pattern PROPERTY_DEFINITIONS_END = Pattern.compile("^\\s*END\\s+PROPERTYDEFINITIONS\\b");
    private static final Pattern LIBRARY_END = Pattern.compile("^\\s*END\\s+LIBRARY\\b");
    private static final Pattern KEYWORD_PROPERTY = Pattern.compile("^\\s*PROPERTY\\b");

    // content touching the final semicolon, e.g. "SIZE 10 BY 5;"
    private static final Pattern TIGHT_SEMICOLON = Pattern.compile("\\S;\\s*$");
    private static final Pattern TRAILING_SEMICOLON = Pattern.compile(";\\s*$");

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    private static final Pattern EXTRA_PRECISION = Pattern.compile("\\.\\d{4}");
    private static final int COORDINATE_PRECISION = 3;

    private final RunContext context;
    private final Diagnostics diagnostics;

    public LefParser(RunContext context, Diagnostics diagnostics) {
        this.context = context;
        this.diagnostics = diagnostics;
    }

    public LefLibrary parse(String sourceName, String content) {
        return parse(sourceName, content.lines().toList());
    }

    public LefLibrary parse(String sourceName, List<String> lines) {
        LefLibrary library = parseLibrary(sourceName, new LineCursor(lines));
        new ViaObsCheck(context.getClassifier()).check(library, diagnostics);
        return library;
    }

    LefLibrary parseLibrary(String sourceName, LineCursor cursor) {
        LefLibrary library = new LefLibrary(sourceName);

        String line = cursor.current();
        while (line != null && !PROPERTY_DEFINITIONS_START.matcher(line).find()
                && !isCellStart(line) && !LIBRARY_END.matcher(line).find()) {
            library.addHeaderLine(fixSemicolon(line, cursor.lineNumber()));
            line = cursor.advance();
        }

        if (line == null) {
            diagnostics.add(DiagnosticCategory.MISSING_END_LIBRARY_TOKEN, sourceName);
            return library;
        }

        if (PROPERTY_DEFINITIONS_START.matcher(line).find()) {
            library.startPropertyDefinitions(line);
            line = cursor.advance();
            while (line != null && !PROPERTY_DEFINITIONS_END.matcher(line).find()) {
                library.addPropertyDefinition(fixSemicolon(line, cursor.lineNumber()));
                line = cursor.advance();
            }
            library.setPropertyDefinitionsEnd(line);
            line = cursor.advance();
        } else {
            diagnostics.add(DiagnosticCategory.MISSING_PROPERTY_DEFINITIONS, sourceName);
        }

        while (line != null && !LIBRARY_END.matcher(line).find()) {
            if (!isCellStart(line)) {
                throw new ParseException("Unexpected line", cursor.lineNumber(), line);
            }
            LefCell cell = parseCell(cursor);
            if (library.getCell(cell.getName()) != null) {
                log.warn("Cell {} defined more than once in {}, keeping the last definition",
                        cell.getName(), sourceName);
            }
            library.addCell(cell);
            line = cursor.current();
        }

        if (line == null) {
            diagnostics.add(DiagnosticCategory.MISSING_END_LIBRARY_TOKEN, sourceName);
        } else {
            library.setEndLine(line);
            cursor.advance();
        }

        log.debug("Parsed {}: {} cells", sourceName, library.getCells().size());
        return library;
    }

    LefCell parseCell(LineCursor cursor) {
        String line = cursor.current();
        if (!isCellStart(line)) {
            throw new ParseException("Expected MACRO", cursor.lineNumber(), line);
        }
        int startLineNumber = cursor.lineNumber();
        String name = tokens(line)[1];
        LefCell cell = new LefCell(name, line, startLineNumber);
        log.debug("Cell: {}", name);

        boolean originFound = false;
        boolean classFound = false;
        boolean sizeFound = false;
        boolean symmetryFound = false;
        boolean siteFound = false;

        line = cursor.advance();
        while (line != null && !isCellEnd(line) && !isCellStart(line) && !LIBRARY_END.matcher(line).find()) {
            if (PIN_START.matcher(line).find()) {
                LefPin pin = parsePin(cursor, name);
                if (cell.getPins().put(pin) != null) {
                    log.warn("Cell {} defines pin {} more than once (names compared without case)", name, pin.getName());
                }
            } else if (COLLECTION_START.matcher(line).find()) {
                cell.setObstruction(parseLayerCollection(cursor));
            } else {
                int lineNumber = cursor.lineNumber();
                line = fixSemicolon(line, lineNumber);
                String[] tokens = tokens(line);
                String keyword = tokens[0].toUpperCase(Locale.ROOT);

                if (keyword.equals("PROPERTY")) {
                    cell.addKeywordProperty(line);
                } else {
                    cell.addProperty(line);
                    String where = "Line " + lineNumber + ": " + name;
                    switch (keyword) {
                        case "ORIGIN" -> {
                            originFound = true;
                            if (!isZero(tokens, 1) || !isZero(tokens, 2)) {
                                diagnostics.add(DiagnosticCategory.STRANGE_ORIGIN, where);
                            }
                        }
                        case "FOREIGN" -> {
                            if (hasForeignOffset(tokens) && (!isZero(tokens, 2) || !isZero(tokens, 3))) {
                                diagnostics.add(DiagnosticCategory.STRANGE_FOREIGN, where);
                            }
                        }
                        case "CLASS" -> {
                            classFound = true;
                            context.getTally().record("CLASS", token(tokens, 1), where + " - " + token(tokens, 1));
                        }
                        case "SIZE" -> sizeFound = true;
                        case "SYMMETRY" -> {
                            symmetryFound = true;
                            context.getTally().record("SYMMETRY", token(tokens, 1), where + " - " + token(tokens, 1));
                        }
                        case "SITE" -> {
                            siteFound = true;
                            context.getTally().record("SITE", token(tokens, 1), where + " - " + token(tokens, 1));
                        }
                        default -> {
                            if (!PropertyOrder.CELL.contains(keyword)) {
                                diagnostics.add(DiagnosticCategory.UNKNOWN_CELL_PROPERTY,
                                        "Line " + lineNumber + ": " + line.trim());
                            }
                        }
                    }
                }
                cursor.advance();
            }
            line = cursor.current();
        }

        String where = "Line " + startLineNumber + ": " + name;
        if (!originFound) diagnostics.add(DiagnosticCategory.MISSING_ORIGIN, where);
        if (!classFound) diagnostics.add(DiagnosticCategory.MISSING_CLASS, where);
        if (!symmetryFound) diagnostics.add(DiagnosticCategory.MISSING_SYMMETRY, where);
        if (!siteFound) diagnostics.add(DiagnosticCategory.MISSING_SITE, where);
        if (!sizeFound) diagnostics.add(DiagnosticCategory.MISSING_SIZE, where);

        if (isCellEnd(line)) {
            line = fixSemicolon(line, cursor.lineNumber());
            cell.setEndLine(line);
            String[] endTokens = tokens(line);
            if (endTokens.length < 2 || !endTokens[1].equals(name)) {
                diagnostics.add(DiagnosticCategory.MANGLED_CELL_END, "Line " + cursor.lineNumber() + ": " + name);
            }
            cursor.advance();
        } else {
            diagnostics.add(DiagnosticCategory.MISSING_CELL_END, "Line " + cursor.lineNumber() + ": " + name);
        }
        return cell;
    }

    LefPin parsePin(LineCursor cursor, String cellName) {
        String line = cursor.current();
        Matcher start = line == null ? null : PIN_START.matcher(line);
        if (start == null || !start.find()) {
            throw new ParseException("Expected PIN", cursor.lineNumber(), line);
        }
        int startLineNumber = cursor.lineNumber();
        String name = start.group(1).replaceAll(";.*$", "").trim();
        LefPin pin = new LefPin(name, line, startLineNumber);
        log.debug("Pin: {}", name);

        boolean directionFound = false;
        boolean useFound = false;

        line = cursor.advance();
        while (line != null && !isPinEnd(line, name)) {
            if (COLLECTION_START.matcher(line).find()) {
                pin.addPort(parseLayerCollection(cursor));
            } else {
                int lineNumber = cursor.lineNumber();
                line = fixSemicolon(line, lineNumber);

                if (KEYWORD_PROPERTY.matcher(line).find()) {
                    pin.addKeywordProperty(line);
                } else {
                    pin.addProperty(line);
                    String[] tokens = tokens(line);
                    String keyword = tokens[0].toUpperCase(Locale.ROOT);
                    if (!PropertyOrder.PIN.contains(keyword)) {
                        diagnostics.add(DiagnosticCategory.UNKNOWN_PIN_PROPERTY,
                                "Line " + lineNumber + ": " + line.trim());
                    }
                    String where = "Line " + lineNumber + ": Cell " + cellName + ", pin " + name;
                    if (keyword.equals("DIRECTION")) {
                        directionFound = true;
                        context.getTally().record("DIRECTION", token(tokens, 1), where + " - " + token(tokens, 1));
                    } else if (keyword.equals("USE")) {
                        useFound = true;
                        context.getTally().record("USE", token(tokens, 1), where + " - " + token(tokens, 1));
                    }
                }
                cursor.advance();
            }
            line = cursor.current();
        }

        String where = "Line " + startLineNumber + ": Cell " + cellName + ", pin " + name;
        if (!directionFound) diagnostics.add(DiagnosticCategory.MISSING_DIRECTION, where);
        if (!useFound) diagnostics.add(DiagnosticCategory.MISSING_USE, where);

        pin.setEndLine(line == null ? null : fixSemicolon(line, cursor.lineNumber()));
        cursor.advance();
        return pin;
    }

    LayerCollection parseLayerCollection(LineCursor cursor) {
        String line = cursor.current();
        if (line == null || !COLLECTION_START.matcher(line).find()) {
            throw new ParseException("Expected OBS or PORT", cursor.lineNumber(), line);
        }
        LayerCollection collection = new LayerCollection(line);

        line = cursor.advance();
        while (line != null && LAYER_START.matcher(line).find()) {
            collection.addLayer(parseLayer(cursor));
            line = cursor.current();
        }
        collection.setEndLine(line);
        cursor.advance();
        return collection;
    }

    LefLayer parseLayer(LineCursor cursor) {
        String line = cursor.current();
        Matcher start = line == null ? null : LAYER_START.matcher(line);
        if (start == null || !start.find()) {
            throw new ParseException("Expected LAYER", cursor.lineNumber(), line);
        }
        int startLineNumber = cursor.lineNumber();
        String name = start.group(1).replaceAll(";.*$", "").trim();

        if (!context.isRecognizedLayer(name)) {
            diagnostics.add(DiagnosticCategory.UNKNOWN_LAYER, "Line " + startLineNumber + ": " + line.trim());
        }
        log.debug("{}: found layer {}", startLineNumber, name);

        LefLayer layer = new LefLayer(name, fixSemicolon(line, startLineNumber), startLineNumber);

        line = cursor.advance();
        while (line != null && !isLayerBoundary(line)) {
            int lineNumber = cursor.lineNumber();
            layer.addCoordinate(normalizeCoordinate(fixSemicolon(line, lineNumber)), lineNumber);
            line = cursor.advance();
        }
        return layer;
    }

    private String fixSemicolon(String line, int lineNumber) {
        if (!TIGHT_SEMICOLON.matcher(line).find()) {
            return line;
        }
        diagnostics.add(DiagnosticCategory.LINE_ENDING_SEMICOLONS, "Line " + lineNumber + ": " + line.trim());
        return TRAILING_SEMICOLON.matcher(line).replaceFirst(" ;");
    }

    /**
     * Rewrites every numeric field of a geometry statement to three decimals, keeping the
     * statement's indentation. Fields that already carry more than three decimals or an
     * exponent, and the mask number after {@code MASK}, are kept as written.
     */
    static String normalizeCoordinate(String line) {
        int indent = 0;
        while (indent < line.length() && Character.isWhitespace(line.charAt(indent))) {
            indent++;
        }
        String body = line.trim();
        boolean terminated = body.endsWith(";");
        if (terminated) {
            body = body.substring(0, body.length() - 1).trim();
        }

        String[] fields = body.split("\\s+");
        StringBuilder sb = new StringBuilder(line.substring(0, indent)).append(fields[0]);
        boolean maskValue = fields[0].equalsIgnoreCase("MASK");
        for (int i = 1; i < fields.length; i++) {
            String field = fields[i];
            sb.append(' ');
            if (maskValue || !NUMBER.matcher(field).matches() || EXTRA_PRECISION.matcher(field).find()
                    || field.indexOf('e') >= 0 || field.indexOf('E') >= 0) {
                sb.append(field);
            } else {
                sb.append(String.format(Locale.ROOT, "%." + COORDINATE_PRECISION + "f", Double.parseDouble(field)));
            }
            maskValue = field.equalsIgnoreCase("MASK");
        }
        if (terminated) {
            sb.append(" ;");
        }
        return sb.toString();
    }

    static boolean isCellStart(String line) {
        return line != null && CELL_START.matcher(line).find();
    }

    // "END A" and "END A;" both close pin A
    private static boolean isPinEnd(String line, String pinName) {
        String[] tokens = tokens(line);
        return tokens.length >= 2 && tokens[0].equals("END") && stripSemicolon(tokens[1]).equals(pinName);
    }

    // END LIBRARY belongs to the library, never to an unterminated cell
    private static boolean isCellEnd(String line) {
        return line != null && line.startsWith("END") && !LIBRARY_END.matcher(line).find();
    }

    private static String stripSemicolon(String token) {
        return token.endsWith(";") ? token.substring(0, token.length() - 1) : token;
    }

    private static boolean isLayerBoundary(String line) {
        String first = tokens(line)[0];
        return first.equals("LAYER") || first.equals("END");
    }

    private static boolean isZero(String[] tokens, int index) {
        if (index >= tokens.length) return false;
        try {
            return Double.parseDouble(tokens[index]) == 0.0;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // FOREIGN name [x y [orient]] ;
    private static boolean hasForeignOffset(String[] tokens) {
        return tokens.length > 2 && !tokens[2].equals(";");
    }

    private static String[] tokens(String line) {
        return line.trim().split("\\s+");
    }

    private static String token(String[] tokens, int index) {
        return index < tokens.length ? tokens[index] : "";
    }

    /**
     * A line that fits no LEF production where one is required. Aborts the run.
     */
    public static class ParseException extends RuntimeException {
        private final int lineNumber;
        private final String line;

        public ParseException(String message, int lineNumber, String line) {
            super(message + " at line " + lineNumber + ": " + (line == null ? "<end of file>" : line.trim()));
            this.lineNumber = lineNumber;
            this.line = line;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }
    }
}
