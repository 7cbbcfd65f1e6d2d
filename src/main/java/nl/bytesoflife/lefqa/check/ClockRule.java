package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.model.LefPin;
import nl.bytesoflife.lefqa.model.LibertyPin;

import java.util.Optional;
import java.util.Set;

/**
 * Liberty {@code clock : true} needs LEF USE CLOCK or SIGNAL; any other clock value,
 * including none, forbids USE CLOCK. Pins without a LEF USE are left to the parser's
 * missing-USE check.
 */
public class ClockRule implements PinRule {

    private static final Set<String> CLOCK_USES = Set.of("CLOCK", "SIGNAL");

    @Override
    public String getPropertyKey() {
        return "clock";
    }

    @Override
    public Optional<String> check(LefPin lefPin, LibertyPin libertyPin) {
        Optional<String> use = lefPin.propertyValue("USE");
        if (use.isEmpty()) {
            return Optional.empty();
        }
        boolean clock = "TRUE".equals(PinRule.libertyValue(libertyPin, "clock"));
        String pin = "Pin " + libertyPin.getName() + ": CLOCK mismatch - ";
        if (clock && !CLOCK_USES.contains(use.get())) {
            return Optional.of(pin + "LIB clock:true but LEF USE=" + use.get() + " (expected CLOCK or SIGNAL)");
        }
        if (!clock && use.get().equals("CLOCK")) {
            return Optional.of(pin + "LIB clock:false but LEF USE=CLOCK");
        }
        return Optional.empty();
    }
}
