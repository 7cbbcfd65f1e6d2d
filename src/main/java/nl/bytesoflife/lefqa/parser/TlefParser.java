package nl.bytesoflife.lefqa.parser;

import nl.bytesoflife.lefqa.model.LayerType;
import nl.bytesoflife.lefqa.model.TechnologyLayers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for technology LEF files: every {@code LAYER <name> ... END <name>} block
 * contributes a layer name, and its {@code TYPE <value> ;} line the layer's role.
 */
public class TlefParser implements TechFileParser {

    private static final Logger log = LoggerFactory.getLogger(TlefParser.class);

    private static final Pattern BEGIN_LAYER = Pattern.compile("^\\s*LAYER\\s+(\\w+)\\s*$");
    private static final Pattern END_BLOCK = Pattern.compile("^\\s*END\\s+(\\w+)\\s*$");
    private static final Pattern TYPE = Pattern.compile("^\\s*TYPE\\s+(\\w+)\\s*;");

    @Override
    public TechnologyLayers parse(String content) {
        TechnologyLayers layers = new TechnologyLayers();
        String currentLayer = null;

        for (String line : content.lines().toList()) {
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            if (line.isBlank()) continue;

            Matcher begin = BEGIN_LAYER.matcher(line);
            if (begin.matches()) {
                currentLayer = begin.group(1);
                layers.addLayerName(currentLayer);
            }

            if (currentLayer != null) {
                Matcher type = TYPE.matcher(line);
                if (type.find()) {
                    layers.define(currentLayer, LayerType.fromName(type.group(1)));
                }
            }

            if (END_BLOCK.matcher(line).matches()) {
                currentLayer = null;
            }
        }

        log.debug("TLEF parser found {} layers", layers.getLayerNames().size());
        return layers;
    }
}
