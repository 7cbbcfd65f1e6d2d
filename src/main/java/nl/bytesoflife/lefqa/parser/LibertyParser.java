package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.model.LibertyLibrary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the cell areas and pin attributes the cross-checks need out of a Liberty file.
 * Content that matches nothing yields an empty library.
 */
public class LibertyParser {

    private static final Logger log = LoggerFactory.getLogger(LibertyParser.class);

    private final LibertyScanner scanner = new LibertyScanner();
    private final LibertyExtractor extractor = new LibertyExtractor();

    public LibertyLibrary parse(String sourceName, String content) {
        LibertyLibrary library = extractor.extract(sourceName, scanner.scan(content));
        log.info("Liberty file {}: {} cells", sourceName, library.getCells().size());
        return library;
    }
}
