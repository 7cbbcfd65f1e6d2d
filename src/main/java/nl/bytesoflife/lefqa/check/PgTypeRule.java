package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.model.LefPin;
import nl.bytesoflife.lefqa.model.LibertyPin;

import java.util.Optional;
import java.util.Set;

/**
 * Supply pins: a Liberty {@code pg_type} ending in POWER needs LEF USE POWER, one ending in
 * GROUND needs USE GROUND, and any other pg_type needs one of the two.
 * Skipped when either side leaves its value out.
 */
public class PgTypeRule implements PinRule {

    private static final Set<String> SUPPLY_USES = Set.of("POWER", "GROUND");

    @Override
    public String getPropertyKey() {
        return "pg_type";
    }

    @Override
    public Optional<String> check(LefPin lefPin, LibertyPin libertyPin) {
        String pgType = PinRule.libertyValue(libertyPin, "pg_type");
        Optional<String> use = lefPin.propertyValue("USE");
        if (pgType == null || use.isEmpty()) {
            return Optional.empty();
        }

        String expected;
        boolean ok;
        if (pgType.endsWith("POWER")) {
            expected = "POWER";
            ok = use.get().equals("POWER");
        } else if (pgType.endsWith("GROUND")) {
            expected = "GROUND";
            ok = use.get().equals("GROUND");
        } else {
            expected = "POWER or GROUND";
            ok = SUPPLY_USES.contains(use.get());
        }
        if (ok) {
            return Optional.empty();
        }
        return Optional.of("Pin " + libertyPin.getName() + ": PG_TYPE mismatch - LIB pg_type=" + pgType
                + " but LEF USE=" + use.get() + " (expected " + expected + ")");
    }
}
