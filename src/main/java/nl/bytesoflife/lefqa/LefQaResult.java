package nl.bytesoflife.lefqa;

import nl.bytesoflife.lefqa.model.LefLibrary;
import nl.bytesoflife.lefqa.model.LibertyLibrary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LefQaResult {

    private final RunContext context;
    private final Diagnostics diagnostics;
    private final List<LefLibrary> libraries = new ArrayList<>();
    private final List<LibertyLibrary> libertyLibraries = new ArrayList<>();
    private final Map<String, String> canonicalOutputs = new LinkedHashMap<>();
    private final Map<String, List<String>> comments = new LinkedHashMap<>();

    LefQaResult(RunContext context, Diagnostics diagnostics) {
        this.context = context;
        this.diagnostics = diagnostics;
    }

    void addLibrary(LefLibrary library, String canonicalText, List<String> strippedComments) {
        libraries.add(library);
        canonicalOutputs.put(library.getSourceName(), canonicalText);
        comments.put(library.getSourceName(), List.copyOf(strippedComments));
    }

    void addLibertyLibrary(LibertyLibrary library) {
        libertyLibraries.add(library);
    }

    public RunContext getContext() {
        return context;
    }

    /** One ledger for the whole run, shared by every input document. */
    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public List<LefLibrary> getLibraries() {
        return Collections.unmodifiableList(libraries);
    }

    public List<LibertyLibrary> getLibertyLibraries() {
        return Collections.unmodifiableList(libertyLibraries);
    }

    public String getCanonicalOutput(String lefName) {
        return canonicalOutputs.get(lefName);
    }

    public Map<String, String> getCanonicalOutputs() {
        return Collections.unmodifiableMap(canonicalOutputs);
    }

    /** Comment lines removed from the named LEF, as {@code Line N: <original line>}. */
    public List<String> getComments(String lefName) {
        return comments.getOrDefault(lefName, List.of());
    }
}
