package nl.bytesoflife.lefqa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one run reads, already loaded as text: LEF documents, Liberty documents and
 * an optional technology file. Names are used in diagnostics and as output keys.
 */
public class LefQaInput {

    public record SourceText(String name, String content) {
    }

    private final List<SourceText> lefs = new ArrayList<>();
    private final List<SourceText> liberties = new ArrayList<>();
    private SourceText technology;
    private String layerOrder;

    public LefQaInput addLef(String name, String content) {
        lefs.add(new SourceText(name, content));
        return this;
    }

    public LefQaInput addLiberty(String name, String content) {
        liberties.add(new SourceText(name, content));
        return this;
    }

    /** The file name picks the format: {@code .tf} for TF, anything else for technology LEF. */
    public LefQaInput technology(String fileName, String content) {
        this.technology = new SourceText(fileName, content);
        return this;
    }

    public LefQaInput layerOrder(String name) {
        this.layerOrder = name;
        return this;
    }

    public List<SourceText> getLefs() {
        return Collections.unmodifiableList(lefs);
    }

    public List<SourceText> getLiberties() {
        return Collections.unmodifiableList(liberties);
    }

    public SourceText getTechnology() {
        return technology;
    }

    public String getLayerOrder() {
        return layerOrder;
    }
}
