package nl.bytesoflife.lefqa.check;

import nl.bytesoflife.lefqa.model.LefPin;
import nl.bytesoflife.lefqa.model.LibertyPin;

import java.util.Locale;
import java.util.Optional;

/**
 * One LEF-versus-Liberty consistency rule for a matched pin pair.
 */
public interface PinRule {

    /** Liberty attribute the rule is about, used for registration and logging. */
    String getPropertyKey();

    /**
     * Returns the mismatch description, such as {@code Pin A: DIRECTION mismatch - LIB=OUTPUT, LEF=INPUT},
     * or empty when the pair is consistent or the rule does not apply.
     */
    Optional<String> check(LefPin lefPin, LibertyPin libertyPin);

    /** Upper-cased Liberty value with quotes and semicolons removed, or null when absent or blank. */
    static String libertyValue(LibertyPin pin, String key) {
        String raw = pin.getProperty(key);
        if (raw == null) return null;
        String value = raw.replaceAll("[\";]", "").trim().toUpperCase(Locale.ROOT);
        return value.isEmpty() ? null : value;
    }
}
