package nl.bytesoflife.lefqa;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Provides the built-in layer orders bundled as classpath resources
 * ({@code /layer-orders/<name>.txt}, one layer per line).
 */
public class BuiltinLayerOrders {

    public static final String DEFAULT = "s40";

    private static final List<String> NAMES = List.of("s40", "abc");
    private static final Map<String, List<String>> cache = new HashMap<>();

    public static List<String> names() {
        return NAMES;
    }

    public static boolean exists(String name) {
        return name != null && NAMES.contains(name);
    }

    public static synchronized List<String> get(String name) {
        if (!exists(name)) {
            throw new IllegalArgumentException("Unknown layer order: " + name);
        }
        return cache.computeIfAbsent(name, BuiltinLayerOrders::load);
    }

    private static List<String> load(String name) {
        String resource = "/layer-orders/" + name + ".txt";
        try (InputStream is = BuiltinLayerOrders.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            List<String> layers = new ArrayList<>();
            BufferedReader reader = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                layers.add(line);
            }
            return List.copyOf(layers);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load layer order " + name, e);
        }
    }
}
