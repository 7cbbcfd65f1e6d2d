package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.model.TechnologyLayers;

import java.util.Locale;

/**
 * Reads a technology file into layer names and layer roles.
 * Input that cannot be classified yields fewer entries, never an error.
 */
public interface TechFileParser {

    TechnologyLayers parse(String content);

    /** Cadence {@code .tf} files get the TF parser, anything else is read as technology LEF. */
    static TechFileParser forFileName(String fileName) {
        if (fileName.toLowerCase(Locale.ROOT).endsWith(".tf")) {
            return new TfParser();
        }
        return new TlefParser();
    }
}
