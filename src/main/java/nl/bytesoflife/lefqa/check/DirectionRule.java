package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.model.LefPin;
import nl.bytesoflife.lefqa.model.LibertyPin;

import java.util.Optional;

/**
 * Liberty {@code direction} must equal LEF {@code DIRECTION}, ignoring case.
 * Skipped unless both sides state a direction.
 */
public class DirectionRule implements PinRule {

    @Override
    public String getPropertyKey() {
        return "direction";
    }

    @Override
    public Optional<String> check(LefPin lefPin, LibertyPin libertyPin) {
        String lib = PinRule.libertyValue(libertyPin, "direction");
        Optional<String> lef = lefPin.propertyValue("DIRECTION");
        if (lib == null || lef.isEmpty() || lib.equals(lef.get())) {
            return Optional.empty();
        }
        return Optional.of("Pin " + libertyPin.getName() + ": DIRECTION mismatch - LIB=" + lib + ", LEF=" + lef.get());
    }
}
