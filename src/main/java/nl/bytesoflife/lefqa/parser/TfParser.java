package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.model.LayerType;
import nl.bytesoflife.lefqa.model.TechnologyLayers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Cadence Virtuoso technology files ({@code .tf}).
 * <p>
 * Layer names come from the {@code techLayers(...)} section. Roles come from the
 * {@code validLayers} blocks, then from the shape of names in {@code techLayers} that
 * are still unclassified.
 */
public class TfParser implements TechFileParser {

    private static final Logger log = LoggerFactory.getLogger(TfParser.class);

    private static final Pattern TECH_LAYERS_START = Pattern.compile("techLayers\\s*\\(|\\(\\s*techLayers");

    // ( LAYERNAME  NUMBER  ABBREV )
    private static final Pattern LAYER_DEF = Pattern.compile("^\\s*\\(\\s*(\\w+)\\s+(\\d+)\\s+");

    private static final Pattern VALID_LAYERS = Pattern.compile("validLayers\\s*\\(\\s*\\(([\\s\\S]*?)\\)\\s*\\)");

    // (VIA1 drawing) or a bare VIA1 / M2 / CO / CONT / AP
    private static final Pattern VALID_LAYER_TOKEN = Pattern.compile(
            "\\(?\\s*(\\w+)\\s+(?:drawing|pin|net)\\s*\\)?|\\b(VIA\\d+|M\\d+|CO|CONT|AP)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CUT_NAME = Pattern.compile("^(VIA\\d*|CO|CONT)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ROUTING_NAME = Pattern.compile("^(M\\d+|AP\\d*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern TECH_CUT_NAME = Pattern.compile("^(VIA\\d*|CO|CONT|MCON)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TECH_ROUTING_NAME = Pattern.compile("^(M\\d+|ME\\d+|AP\\d*)$", Pattern.CASE_INSENSITIVE);

    @Override
    public TechnologyLayers parse(String content) {
        TechnologyLayers layers = new TechnologyLayers();
        collectLayerNames(content.lines().toList(), layers);
        classifyValidLayers(content, layers);
        classifyTechLayers(layers);

        if (layers.hasTypes()) {
            log.info("TF parser found CUT layers: {}", String.join(", ", layers.namesOfType(LayerType.CUT)));
            log.info("TF parser found ROUTING layers: {}", String.join(", ", layers.namesOfType(LayerType.ROUTING)));
        }
        return layers;
    }

    private void collectLayerNames(List<String> lines, TechnologyLayers layers) {
        boolean inTechLayers = false;
        int depth = 0;

        for (String line : lines) {
            if (!inTechLayers) {
                if (TECH_LAYERS_START.matcher(line).find()) {
                    inTechLayers = true;
                    depth = 1;
                }
                continue;
            }

            if (line.trim().startsWith(";")) {
                continue;
            }

            Matcher m = LAYER_DEF.matcher(line);
            if (m.find()) {
                layers.addLayerName(m.group(1));
            }

            depth += count(line, '(') - count(line, ')');
            if (depth <= 0) {
                break;
            }
        }
    }

    private void classifyValidLayers(String content, TechnologyLayers layers) {
        Matcher section = VALID_LAYERS.matcher(content);
        while (section.find()) {
            Matcher token = VALID_LAYER_TOKEN.matcher(section.group(1));
            while (token.find()) {
                String name = token.group(1) != null ? token.group(1) : token.group(2);
                if (name == null || name.isEmpty()) continue;

                if (CUT_NAME.matcher(name).matches()) {
                    layers.define(name, LayerType.CUT);
                } else if (ROUTING_NAME.matcher(name).matches()) {
                    layers.define(name, LayerType.ROUTING);
                }
            }
        }
    }

    private void classifyTechLayers(TechnologyLayers layers) {
        for (String name : layers.getLayerNames()) {
            if (TECH_CUT_NAME.matcher(name).matches()) {
                layers.defineIfAbsent(name, LayerType.CUT);
            } else if (TECH_ROUTING_NAME.matcher(name).matches()) {
                layers.defineIfAbsent(name, LayerType.ROUTING);
            }
        }
    }

    private static int count(String line, char c) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) n++;
        }
        return n;
    }
}
