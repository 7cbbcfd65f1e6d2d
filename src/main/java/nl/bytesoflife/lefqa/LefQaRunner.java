package nl.bytesoflife.lefqa;

import nl.bytesoflife.lefqa.canon.Canonicalizer;
import nl.bytesoflife.lefqa.canon.LefWriter;
import nl.bytesoflife.lefqa.check.CrossValidator;
import nl.bytesoflife.lefqa.model.LayerType;
import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LibertyLibrary;
import nl.bytesoflife.lefqa.model.TechnologyLayers;
import nl.bytesoflife.lefqa.parser.LefCommentStripper;
import nl.bytesoflife.lefqa.parser.LefParser;
import nl.bytesoflife.lefqa.parser.LibertyParser;
import nl.bytesoflife.lefqa.parser.TechFileParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole pipeline over a {@link LefQaInput}: technology file, then every LEF
 * (parse, via/OBS check, canonical rendering), then Liberty files and the cross-checks.
 * <p>
 * A {@link LefParser.ParseException} aborts the run and reaches the caller unchanged.
 */
public class LefQaRunner {

    private static final Logger log = LoggerFactory.getLogger(LefQaRunner.class);

    private final CrossValidator crossValidator;

    public LefQaRunner() {
        this(CrossValidator.withDefaultRules());
    }

    public LefQaRunner(CrossValidator crossValidator) {
        this.crossValidator = crossValidator;
    }

    public LefQaResult run(LefQaInput input) {
        RunContext.Builder builder = RunContext.builder();
        if (input.getLayerOrder() != null) {
            builder.layerOrder(input.getLayerOrder());
        }
        if (input.getTechnology() != null) {
            LefQaInput.SourceText tech = input.getTechnology();
            TechnologyLayers layers = TechFileParser.forFileName(tech.name()).parse(tech.content());
            log.info("Technology file {}: {} layers, {} CUT, {} ROUTING", tech.name(), layers.getLayerNames().size(),
                    layers.count(LayerType.CUT), layers.count(LayerType.ROUTING));
            builder.technology(layers);
        }
        RunContext context = builder.build();
        log.debug("Layer order '{}': {}", context.getLayerOrderName(), context.getLayerOrder());

        Diagnostics diagnostics = new Diagnostics();
        LefQaResult result = new LefQaResult(context, diagnostics);

        LefCommentStripper stripper = new LefCommentStripper();
        LefParser parser = new LefParser(context, diagnostics);
        Canonicalizer canonicalizer = new Canonicalizer(context);
        LefWriter writer = new LefWriter();

        for (LefQaInput.SourceText lef : input.getLefs()) {
            log.info("Parsing LEF {}", lef.name());
            LefCommentStripper.Result stripped = stripper.strip(lef.content());
            LefLibrary library = parser.parse(lef.name(), stripped.lines());
            canonicalizer.canonicalize(library);
            result.addLibrary(library, writer.write(library), stripped.comments());
        }

        LibertyParser libertyParser = new LibertyParser();
        for (LefQaInput.SourceText liberty : input.getLiberties()) {
            LibertyLibrary library = libertyParser.parse(liberty.name(), liberty.content());
            result.addLibertyLibrary(library);
        }

        crossValidator.validate(result.getLibraries(), result.getLibertyLibraries(), diagnostics);

        log.info("Run finished: {} diagnostics in {} categories",
                diagnostics.total(), diagnostics.nonEmptyCategories().size());
        return result;
    }
}
