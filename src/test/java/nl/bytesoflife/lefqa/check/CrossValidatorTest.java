package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.Diagnostics;
import nl.bytesoflife.lefqa.model.DiagnosticCategory;
import nl.bytesoflife.lefqa.model.LefCell;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LefPin;
import nl.bytesoflife.lefqa.model.LibertyCell;
import nl.bytesoflife.lefqa.model.LibertyLibrary;
import nl.bytesoflife.lefqa.model.LibertyPin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CrossValidatorTest {

    private final Diagnostics diagnostics = new Diagnostics();
    private final CrossValidator validator = CrossValidator.withDefaultRules();

    private static LefPin lefPin(String name, String direction, String use) {
        LefPin pin = new LefPin(name, "  PIN " + name, 1);
        if (direction != null) pin.addProperty("    DIRECTION " + direction + " ;");
        if (use != null) pin.addProperty("    USE " + use + " ;");
        return pin;
    }

    private static LefCell lefCell(String name, String size, LefPin... pins) {
        LefCell cell = new LefCell(name, "MACRO " + name, 1);
        if (size != null) cell.addProperty("  SIZE " + size + " ;");
        for (LefPin pin : pins) {
            cell.getPins().put(pin);
        }
        return cell;
    }

    private static LefLibrary lef(String name, LefCell... cells) {
        LefLibrary library = new LefLibrary(name);
        for (LefCell cell : cells) {
            library.addCell(cell);
        }
        return library;
    }

    private static LibertyPin libPin(String name, String... keyValues) {
        LibertyPin pin = new LibertyPin(name);
        for (int i = 0; i < keyValues.length; i += 2) {
            pin.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return pin;
    }

    private static LibertyCell libCell(String name, String area, LibertyPin... pins) {
        LibertyCell cell = new LibertyCell(name);
        if (area != null) cell.setProperty("area", area);
        for (LibertyPin pin : pins) {
            cell.addPin(pin);
        }
        return cell;
    }

    private static LibertyLibrary liberty(String name, LibertyCell... cells) {
        LibertyLibrary library = new LibertyLibrary(name);
        for (LibertyCell cell : cells) {
            library.addCell(cell);
        }
        return library;
    }

    private void validate(LefLibrary lef, LibertyLibrary... liberties) {
        validator.validate(List.of(lef), List.of(liberties), diagnostics);
    }

    @Test
    void consistentLibrariesProduceNothing() {
        validate(lef("a.lef", lefCell("NAND2", "10 BY 5", lefPin("A", "INPUT", "SIGNAL"), lefPin("Y", "OUTPUT", "SIGNAL"))),
                liberty("a.lib", libCell("NAND2", "50", libPin("A", "direction", "input"), libPin("Y", "direction", "output"))));

        assertTrue(diagnostics.isEmpty(), diagnostics.toString());
    }

    @Test
    void noLibertyFilesSkipsAllChecks() {
        validator.validate(List.of(lef("a.lef", lefCell("NAND2", null))), List.of(), diagnostics);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void areaMismatchIsReportedOncePerCell() {
        validate(lef("a.lef", lefCell("NAND2", "10 BY 5", lefPin("A", "INPUT", "SIGNAL"), lefPin("B", "INPUT", "SIGNAL"))),
                liberty("a.lib", libCell("NAND2", "51", libPin("A"), libPin("B"))));

        assertEquals(List.of("NAND2:\n\ta.lib (LEF area 50.0, LIB area 51.0)"),
                diagnostics.get(DiagnosticCategory.AREA_MISMATCH));
        assertEquals(1, diagnostics.total());
    }

    @Test
    void missingAreaNeverMatches() {
        validate(lef("a.lef", lefCell("INV", null)), liberty("a.lib", libCell("INV", "20")));
        assertEquals(List.of("INV:\n\ta.lib (LEF area missing, LIB area 20.0)"),
                diagnostics.get(DiagnosticCategory.AREA_MISMATCH));
    }

    @Test
    void areaComparisonToleratesRounding() {
        assertTrue(CrossValidator.areasMatch(0.1 * 3, 0.3));
        assertTrue(CrossValidator.areasMatch(1234.5678, 1234.5678000001));
        assertFalse(CrossValidator.areasMatch(50.0, 50.01));
        assertFalse(CrossValidator.areasMatch(null, 1.0));
    }

    @Test
    void directionMismatchNamesBothValuesAndFiles() {
        validate(lef("a.lef", lefCell("INV", "4 BY 5", lefPin("A", "INPUT", "SIGNAL"))),
                liberty("a.lib", libCell("INV", "20", libPin("A", "direction", "output"))));

        List<String> messages = diagnostics.get(DiagnosticCategory.LIBERTY_INCORRECT_PIN_PROPERTY);
        assertEquals(List.of("INV\n\tPin A: DIRECTION mismatch - LIB=OUTPUT, LEF=INPUT\n\tFiles: a.lib, a.lef"), messages);
    }

    @Test
    void cellsAndPinsMatchIgnoringCase() {
        validate(lef("a.lef", lefCell("inv", "4 BY 5", lefPin("a", "INPUT", "SIGNAL"))),
                liberty("a.lib", libCell("INV", "20", libPin("A", "direction", "Input"))));

        assertTrue(diagnostics.isEmpty(), diagnostics.toString());
    }

    @Test
    void cellsMissingOnEitherSideAreGroupedByCell() {
        validate(lef("a.lef", lefCell("INV", "4 BY 5"), lefCell("BUF", "4 BY 5")),
                liberty("x.lib", libCell("INV", "20"), libCell("DFF", "30")),
                liberty("y.lib", libCell("INV", "20")));

        assertEquals(List.of("BUF:\n\tx.lib\n\ty.lib"), diagnostics.get(DiagnosticCategory.LIBERTY_MISSING_CELL));
        assertEquals(List.of("DFF:\n\tx.lib"), diagnostics.get(DiagnosticCategory.LEF_MISSING_CELL));
    }

    @Test
    void pinsMissingOnEitherSideAreGroupedByCell() {
        validate(lef("a.lef", lefCell("INV", "4 BY 5", lefPin("A", "INPUT", "SIGNAL"), lefPin("Z", "OUTPUT", "SIGNAL"))),
                liberty("a.lib", libCell("INV", "20", libPin("A"), libPin("Y"), libPin("VDD"))));

        assertEquals(List.of("INV:\n\tZ:\n\t\ta.lib"), diagnostics.get(DiagnosticCategory.LIBERTY_MISSING_PIN));
        assertEquals(List.of("INV:\n\tY:\n\t\ta.lib\n\tVDD:\n\t\ta.lib"), diagnostics.get(DiagnosticCategory.LEF_MISSING_PIN));
    }

    @Test
    void registeredRulesRunInRegistrationOrder() {
        CrossValidator custom = new CrossValidator()
                .registerRule(new PinRule() {
                    @Override
                    public String getPropertyKey() {
                        return "capacitance";
                    }

                    @Override
                    public Optional<String> check(LefPin lefPin, LibertyPin libertyPin) {
                        return Optional.of("Pin " + libertyPin.getName() + ": checked");
                    }
                })
                .registerRule(new DirectionRule());
        custom.validate(List.of(lef("a.lef", lefCell("INV", "4 BY 5", lefPin("A", "INPUT", "SIGNAL")))),
                List.of(liberty("a.lib", libCell("INV", "20", libPin("A", "direction", "output")))), diagnostics);

        List<String> messages = diagnostics.get(DiagnosticCategory.LIBERTY_INCORRECT_PIN_PROPERTY);
        assertEquals(2, messages.size());
        assertTrue(messages.get(0).contains("Pin A: checked"));
        assertTrue(messages.get(1).contains("DIRECTION mismatch"));
    }

    @ParameterizedTest
    @CsvSource({
            "true,  SIGNAL, ",
            "true,  CLOCK, ",
            "true,  POWER,  Pin CK: CLOCK mismatch - LIB clock:true but LEF USE=POWER (expected CLOCK or SIGNAL)",
            "false, CLOCK,  Pin CK: CLOCK mismatch - LIB clock:false but LEF USE=CLOCK",
            "false, SIGNAL, "
    })
    void clockRule(String clock, String use, String expected) {
        Optional<String> result = new ClockRule().check(lefPin("CK", "INPUT", use), libPin("CK", "clock", clock));
        assertEquals(Optional.ofNullable(expected), result);
    }

    @Test
    void clockRuleTreatsMissingClockAsFalseAndSkipsMissingUse() {
        ClockRule rule = new ClockRule();
        assertTrue(rule.check(lefPin("CK", "INPUT", "CLOCK"), libPin("CK")).isPresent());
        assertTrue(rule.check(lefPin("CK", "INPUT", null), libPin("CK", "clock", "true")).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
            "primary_power,   POWER, ",
            "backup_power,    POWER, ",
            "primary_ground,  GROUND, ",
            "primary_power,   GROUND, Pin VDD: PG_TYPE mismatch - LIB pg_type=PRIMARY_POWER but LEF USE=GROUND (expected POWER)",
            "primary_ground,  SIGNAL, Pin VDD: PG_TYPE mismatch - LIB pg_type=PRIMARY_GROUND but LEF USE=SIGNAL (expected GROUND)",
            "pwell,           GROUND, ",
            "pwell,           SIGNAL, Pin VDD: PG_TYPE mismatch - LIB pg_type=PWELL but LEF USE=SIGNAL (expected POWER or GROUND)"
    })
    void pgTypeRule(String pgType, String use, String expected) {
        Optional<String> result = new PgTypeRule().check(lefPin("VDD", "INOUT", use), libPin("VDD", "pg_type", pgType));
        assertEquals(Optional.ofNullable(expected), result);
    }

    @Test
    void directionRuleSkipsWhenEitherSideIsSilent() {
        DirectionRule rule = new DirectionRule();
        assertTrue(rule.check(lefPin("VDD", "INOUT", "POWER"), libPin("VDD", "pg_type", "primary_power")).isEmpty());
        assertTrue(rule.check(lefPin("A", null, "SIGNAL"), libPin("A", "direction", "input")).isEmpty());
        assertTrue(rule.check(lefPin("A", "INPUT", "SIGNAL"), libPin("A", "direction", "\"input\"")).isEmpty());
    }
}
