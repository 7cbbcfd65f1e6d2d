package nl.bytesoflife.lefqa;

import nl.bytesoflife.lefqa.model.LayerClassifier;
import nl.bytesoflife.lefqa.model.TechnologyLayers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * State shared by every stage of one run: the active layer order, the technology layer
 * classifier and the property tallies. Created once per run and never shared between runs.
 */
public class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    public static final String TECHNOLOGY_ORDER = "from_technology";

    private final String layerOrderName;
    private final List<String> layerOrder;
    private final LayerClassifier classifier;
    private final PropertyTally tally = new PropertyTally();

    private RunContext(String layerOrderName, List<String> layerOrder, LayerClassifier classifier) {
        this.layerOrderName = layerOrderName;
        this.layerOrder = layerOrder;
        this.classifier = classifier;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RunContext defaults() {
        return builder().build();
    }

    public String getLayerOrderName() {
        return layerOrderName;
    }

    public List<String> getLayerOrder() {
        return layerOrder;
    }

    /** True when the first token of the name appears in the active layer order (case-sensitive). */
    public boolean isRecognizedLayer(String layerName) {
        String clean = LayerClassifier.cleanName(layerName);
        return clean != null && layerOrder.contains(clean);
    }

    public LayerClassifier getClassifier() {
        return classifier;
    }

    public PropertyTally getTally() {
        return tally;
    }

    public static class Builder {

        private String layerOrderName = BuiltinLayerOrders.DEFAULT;
        private TechnologyLayers technology;

        public Builder layerOrder(String name) {
            if (BuiltinLayerOrders.exists(name)) {
                this.layerOrderName = name;
            } else {
                log.warn("Layer order '{}' is not defined, using order '{}' instead", name, layerOrderName);
            }
            return this;
        }

        public Builder technology(TechnologyLayers technology) {
            this.technology = technology;
            return this;
        }

        public RunContext build() {
            TechnologyLayers table = technology != null ? technology : TechnologyLayers.empty();
            if (technology != null && !table.hasTypes()) {
                log.warn("No layer types found in technology file, using fallback pattern matching");
            }
            if (!table.getLayerNames().isEmpty()) {
                return new RunContext(TECHNOLOGY_ORDER, table.getLayerNames(), new LayerClassifier(table));
            }
            if (technology != null) {
                log.warn("Technology file lists no layers, keeping layer order '{}'", layerOrderName);
            }
            return new RunContext(layerOrderName, BuiltinLayerOrders.get(layerOrderName), new LayerClassifier(table));
        }
    }
}
