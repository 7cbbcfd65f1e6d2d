package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.Diagnostics;
import nl.bytesoflife.lefqa.RunContext;
import nl.bytesoflife.lefqa.model.DiagnosticCategory;
import nl.bytesoflife.lefqa.model.LayerCollection;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LefParserTest {

    private static final String INV = """
            VERSION 5.8 ;
            PROPERTYDEFINITIONS
            END PROPERTYDEFINITIONS
            MACRO INV
              CLASS CORE ;
              ORIGIN 0 0 ;
              SIZE 4 BY 5 ;
              SYMMETRY X Y ;
              SITE core ;
              PIN A
                DIRECTION INPUT ;
                USE SIGNAL ;
                PORT
                  LAYER ME1 ;
                    RECT 0 0 1 1 ;
                END
              END A
            END INV
            END LIBRARY
            """;

    private final RunContext context = RunContext.defaults();
    private final Diagnostics diagnostics = new Diagnostics();

    private LefLibrary parse(String text) {
        return new LefParser(context, diagnostics).parse("test.lef", text);
    }

    @Test
    void wellFormedCellParsesWithoutDiagnostics() {
        LefLibrary library = parse(INV);

        assertTrue(diagnostics.isEmpty(), diagnostics.toString());
        assertEquals(List.of("VERSION 5.8 ;"), library.getHeader());
        assertTrue(library.hasPropertyDefinitions());
        assertEquals("END LIBRARY", library.getEndLine());

        LefCell cell = library.getCell("INV");
        assertNotNull(cell);
        assertEquals(4, cell.getStartLineNumber());
        assertEquals("END INV", cell.getEndLine());
        assertEquals(5, cell.getProperties().size());
        assertEquals(20.0, cell.getArea(), 1e-9);

        LefPin pin = cell.getPin("a");
        assertNotNull(pin);
        assertEquals("  END A", pin.getEndLine());
        assertEquals(1, pin.getPorts().size());
        LayerCollection port = pin.getPorts().get(0);
        assertEquals(List.of("ME1"), port.getLayerNames());
        assertEquals(List.of("        RECT 0.000 0.000 1.000 1.000 ;"), port.getLayer("ME1").getCoordinates());
        assertEquals(15, port.getLayer("ME1").lineNumberFor(0));
    }

    @Test
    void semicolonTouchingValueIsFixedAndLogged() {
        LefLibrary library = parse(INV.replace("SIZE 4 BY 5 ;", "SIZE 4 BY 5;"));

        assertEquals(List.of("Line 7: SIZE 4 BY 5;"), diagnostics.get(DiagnosticCategory.LINE_ENDING_SEMICOLONS));
        assertTrue(library.getCell("INV").getProperties().contains("  SIZE 4 BY 5 ;"));
    }

    @Test
    void headerSemicolonIsFixedToo() {
        LefLibrary library = parse(INV.replace("VERSION 5.8 ;", "VERSION 5.8;"));
        assertEquals(List.of("VERSION 5.8 ;"), library.getHeader());
        assertEquals(1, diagnostics.count(DiagnosticCategory.LINE_ENDING_SEMICOLONS));
    }

    @Test
    void missingPropertyDefinitionsIsRecorded() {
        LefLibrary library = parse(INV.replace("PROPERTYDEFINITIONS\nEND PROPERTYDEFINITIONS\n", ""));

        assertFalse(library.hasPropertyDefinitions());
        assertEquals(List.of("test.lef"), diagnostics.get(DiagnosticCategory.MISSING_PROPERTY_DEFINITIONS));
        assertNotNull(library.getCell("INV"));
    }

    @Test
    void missingEndLibraryIsRecorded() {
        LefLibrary library = parse(INV.replace("END LIBRARY\n", ""));

        assertNull(library.getEndLine());
        assertEquals(List.of("test.lef"), diagnostics.get(DiagnosticCategory.MISSING_END_LIBRARY_TOKEN));
    }

    @Test
    void mangledCellEndIsRecorded() {
        parse(INV.replace("END INV", "END INVX"));
        assertEquals(List.of("Line 18: INV"), diagnostics.get(DiagnosticCategory.MANGLED_CELL_END));
    }

    @Test
    void cellWithoutEndIsClosedByTheNextCell() {
        String text = INV.replace("END INV\n", "").replace("END LIBRARY", """
                MACRO BUF
                  CLASS CORE ;
                  ORIGIN 0 0 ;
                  SIZE 4 BY 5 ;
                  SYMMETRY X Y ;
                  SITE core ;
                END BUF
                END LIBRARY""");
        LefLibrary library = parse(text);

        assertEquals(List.of("Line 18: INV"), diagnostics.get(DiagnosticCategory.MISSING_CELL_END));
        assertNull(library.getCell("INV").getEndLine());
        assertEquals(List.of("INV", "BUF"), library.getCellNames());
    }

    @Test
    void pinEndWithTouchingSemicolonClosesThePin() {
        String text = INV
                .replace("  END A\n", """
                          END A;
                          PIN Y
                            DIRECTION OUTPUT ;
                            USE SIGNAL ;
                          END Y
                        """)
                .replace("END LIBRARY", """
                        MACRO BUF
                          CLASS CORE ;
                          ORIGIN 0 0 ;
                          SIZE 4 BY 5 ;
                          SYMMETRY X Y ;
                          SITE core ;
                        END BUF
                        END LIBRARY""");
        LefLibrary library = parse(text);

        assertEquals(List.of("Line 17: END A;"), diagnostics.get(DiagnosticCategory.LINE_ENDING_SEMICOLONS));
        assertEquals(1, diagnostics.total(), diagnostics.toString());
        assertEquals(List.of("INV", "BUF"), library.getCellNames());
        assertEquals("END LIBRARY", library.getEndLine());

        LefCell cell = library.getCell("INV");
        assertEquals(2, cell.getPins().size());
        assertEquals("  END A ;", cell.getPin("A").getEndLine());
        assertEquals("  END Y", cell.getPin("Y").getEndLine());
    }

    @Test
    void cellEndWithTouchingSemicolonIsNotMangled() {
        LefLibrary library = parse(INV.replace("END INV\n", "END INV;\n"));

        assertEquals(List.of("Line 18: END INV;"), diagnostics.get(DiagnosticCategory.LINE_ENDING_SEMICOLONS));
        assertEquals(0, diagnostics.count(DiagnosticCategory.MANGLED_CELL_END));
        assertEquals("END INV ;", library.getCell("INV").getEndLine());
    }

    @Test
    void cellWithoutEndLeavesEndLibraryToTheLibrary() {
        LefLibrary library = parse(INV.replace("END INV\n", ""));

        assertEquals(List.of("Line 18: INV"), diagnostics.get(DiagnosticCategory.MISSING_CELL_END));
        assertEquals(0, diagnostics.count(DiagnosticCategory.MANGLED_CELL_END));
        assertEquals(0, diagnostics.count(DiagnosticCategory.MISSING_END_LIBRARY_TOKEN));
        assertNull(library.getCell("INV").getEndLine());
        assertEquals("END LIBRARY", library.getEndLine());
    }

    static Stream<Arguments> missingCellProperties() {
        return Stream.of(
                Arguments.of("  ORIGIN 0 0 ;\n", DiagnosticCategory.MISSING_ORIGIN),
                Arguments.of("  CLASS CORE ;\n", DiagnosticCategory.MISSING_CLASS),
                Arguments.of("  SIZE 4 BY 5 ;\n", DiagnosticCategory.MISSING_SIZE),
                Arguments.of("  SYMMETRY X Y ;\n", DiagnosticCategory.MISSING_SYMMETRY),
                Arguments.of("  SITE core ;\n", DiagnosticCategory.MISSING_SITE));
    }

    @ParameterizedTest
    @MethodSource("missingCellProperties")
    void missingCellPropertyIsRecordedAtCellStart(String removed, DiagnosticCategory category) {
        parse(INV.replace(removed, ""));
        assertEquals(List.of("Line 4: INV"), diagnostics.get(category));
        assertEquals(1, diagnostics.total());
    }

    @Test
    void missingDirectionAndUseAreRecordedPerPin() {
        parse(INV.replace("    DIRECTION INPUT ;\n    USE SIGNAL ;\n", ""));
        assertEquals(List.of("Line 10: Cell INV, pin A"), diagnostics.get(DiagnosticCategory.MISSING_DIRECTION));
        assertEquals(List.of("Line 10: Cell INV, pin A"), diagnostics.get(DiagnosticCategory.MISSING_USE));
    }

    @Test
    void strangeOriginAndForeignOffsetAreFlagged() {
        parse(INV.replace("  ORIGIN 0 0 ;", "  ORIGIN 0.5 0 ;\n  FOREIGN INV 0 -1 ;"));
        assertEquals(List.of("Line 6: INV"), diagnostics.get(DiagnosticCategory.STRANGE_ORIGIN));
        assertEquals(List.of("Line 7: INV"), diagnostics.get(DiagnosticCategory.STRANGE_FOREIGN));
    }

    @Test
    void foreignWithoutOffsetIsNotStrange() {
        parse(INV.replace("  ORIGIN 0 0 ;", "  ORIGIN 0.000 0.000 ;\n  FOREIGN INV ;"));
        assertEquals(0, diagnostics.count(DiagnosticCategory.STRANGE_ORIGIN));
        assertEquals(0, diagnostics.count(DiagnosticCategory.STRANGE_FOREIGN));
    }

    @Test
    void unknownPropertiesAreRecordedAndKept() {
        LefLibrary library = parse(INV
                .replace("  SITE core ;", "  SITE core ;\n  FLAVOR sweet ;")
                .replace("    USE SIGNAL ;", "    USE SIGNAL ;\n    COLOR red ;"));

        assertEquals(List.of("Line 10: FLAVOR sweet ;"), diagnostics.get(DiagnosticCategory.UNKNOWN_CELL_PROPERTY));
        assertEquals(List.of("Line 14: COLOR red ;"), diagnostics.get(DiagnosticCategory.UNKNOWN_PIN_PROPERTY));
        assertTrue(library.getCell("INV").getProperties().contains("  FLAVOR sweet ;"));
    }

    @Test
    void propertyLinesAreKeptApart() {
        LefLibrary library = parse(INV.replace("  SITE core ;", "  SITE core ;\n  PROPERTY cellType \"logic\" ;"));

        LefCell cell = library.getCell("INV");
        assertEquals(List.of("  PROPERTY cellType \"logic\" ;"), cell.getKeywordProperties());
        assertEquals(5, cell.getProperties().size());
        assertEquals(0, diagnostics.count(DiagnosticCategory.UNKNOWN_CELL_PROPERTY));
    }

    @Test
    void unknownLayerIsRecorded() {
        parse(INV.replace("LAYER ME1 ;", "LAYER M9 ;"));
        assertEquals(List.of("Line 14: LAYER M9 ;"), diagnostics.get(DiagnosticCategory.UNKNOWN_LAYER));
    }

    @Test
    void repeatedLayerInOnePortIsMerged() {
        LefLibrary library = parse(INV.replace("        RECT 0 0 1 1 ;\n",
                "        RECT 0 0 1 1 ;\n      LAYER ME1 ;\n        RECT 2 2 3 3 ;\n"));

        LayerCollection port = library.getCell("INV").getPin("A").getPorts().get(0);
        assertEquals(List.of("ME1"), port.getLayerNames());
        assertEquals(2, port.getLayer("ME1").getCoordinates().size());
        assertEquals(17, port.getLayer("ME1").lineNumberFor(1));
    }

    @Test
    void cellValuesAreTallied() {
        parse(INV);
        assertEquals(1, context.getTally().count("CLASS", "CORE"));
        assertEquals(1, context.getTally().count("SITE", "core"));
        assertEquals(1, context.getTally().count("DIRECTION", "INPUT"));
        assertEquals(List.of("Line 12: Cell INV, pin A - SIGNAL"), context.getTally().get("USE").get("SIGNAL"));
    }

    @Test
    void unexpectedLineBetweenCellsIsFatal() {
        String text = INV.replace("END INV\n", "END INV\nGARBAGE here\n");
        LefParser.ParseException e = assertThrows(LefParser.ParseException.class, () -> parse(text));
        assertEquals(19, e.getLineNumber());
        assertEquals("GARBAGE here", e.getLine());
    }

    static Stream<Arguments> coordinates() {
        return Stream.of(
                Arguments.of("        RECT 0 0.5 1 2 ;", "        RECT 0.000 0.500 1.000 2.000 ;"),
                Arguments.of("    RECT -1.25 3 4 5 ;", "    RECT -1.250 3.000 4.000 5.000 ;"),
                Arguments.of("  RECT 0.12345 1 2 3 ;", "  RECT 0.12345 1.000 2.000 3.000 ;"),
                Arguments.of("  RECT MASK 2 0 0 1 1 ;", "  RECT MASK 2 0.000 0.000 1.000 1.000 ;"),
                Arguments.of("  POLYGON 1 2 3 4 5 6", "  POLYGON 1.000 2.000 3.000 4.000 5.000 6.000"),
                Arguments.of("  VIA 1 2 via12 ;", "  VIA 1.000 2.000 via12 ;"),
                Arguments.of("  RECT 1E-5 0 2.5e3 1 ;", "  RECT 1E-5 0.000 2.5e3 1.000 ;"));
    }

    @ParameterizedTest
    @MethodSource("coordinates")
    void coordinatesAreNormalizedToThreeDecimals(String input, String expected) {
        assertEquals(expected, LefParser.normalizeCoordinate(input));
    }

    @Test
    void normalizedCoordinateIsStable() {
        String once = LefParser.normalizeCoordinate("  RECT 0 0.5 1.23456 2 ;");
        assertEquals(once, LefParser.normalizeCoordinate(once));
    }
}
