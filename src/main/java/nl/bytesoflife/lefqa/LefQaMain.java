package nl.bytesoflife.lefqa;

import nl.bytesoflife.lefqa.parser.LefParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Command-line entry point. Reads the named files, runs {@link LefQaRunner} and writes
 * {@code <lef>_sorted}, {@code <lef>_errors} and {@code <lef>_comments} next to each LEF.
 */
public class LefQaMain {

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = """
            Usage: lef-qa -s <file.lef> [-s <file.lef> ...] [options]
            Sorts LEF files into canonical order and cross-checks them against Liberty and technology files.
            Options:
              -s, --lef <file>           LEF file to check and sort (repeatable)
              -t, --tech <file>          technology file (.tf or .tlef)
              -l, --liberty <dir|file>   Liberty file, or directory of .lib files (repeatable)
              -o, --layer-order <name>   built-in layer order when no technology file is given (s40, abc)
              -i                         summarize categories with 1000 or more messages
              -d, --debug                print debugging information
              -h, --help                 print this help
            """;

    static class Options {
        final List<Path> lefs = new ArrayList<>();
        final List<Path> liberties = new ArrayList<>();
        Path technology;
        String layerOrder;
        boolean truncate;
        boolean debug;
        boolean help;
    }

    static class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Options options;
        try {
            options = parseArgs(args);
        } catch (UsageException e) {
            System.err.println(e.getMessage());
            System.err.print(USAGE);
            return EXIT_USAGE;
        }
        if (options.help) {
            System.out.print(USAGE);
            return EXIT_OK;
        }
        if (options.debug) {
            // must happen before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.log.nl.bytesoflife.lefqa", "debug");
        }
        Logger log = LoggerFactory.getLogger(LefQaMain.class);

        try {
            LefQaInput input = loadInput(options);
            LefQaResult result = new LefQaRunner().run(input);
            writeOutputs(result, options, log);
            return EXIT_OK;
        } catch (LefParser.ParseException e) {
            log.error("Fatal LEF structure error: {}", e.getMessage());
            return EXIT_PARSE_ERROR;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage(), e);
            return EXIT_PARSE_ERROR;
        }
    }

    static Options parseArgs(String[] args) {
        Options options = new Options();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-s", "--lef" -> options.lefs.add(Path.of(value(args, ++i, arg)));
                case "-t", "--tech" -> options.technology = Path.of(value(args, ++i, arg));
                case "-l", "--liberty" -> options.liberties.add(Path.of(value(args, ++i, arg)));
                case "-o", "--layer-order" -> options.layerOrder = value(args, ++i, arg);
                case "-i" -> options.truncate = true;
                case "-d", "--debug" -> options.debug = true;
                case "-h", "--help" -> options.help = true;
                default -> throw new UsageException("Unknown option: " + arg);
            }
        }
        if (!options.help && options.lefs.isEmpty()) {
            throw new UsageException("No LEF file given");
        }
        return options;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new UsageException("Option " + option + " needs a value");
        }
        return args[index];
    }

    static LefQaInput loadInput(Options options) throws IOException {
        LefQaInput input = new LefQaInput();
        for (Path lef : options.lefs) {
            input.addLef(lef.toString(), read(lef));
        }
        for (Path liberty : libertyFiles(options.liberties)) {
            input.addLiberty(liberty.toString(), read(liberty));
        }
        if (options.technology != null) {
            input.technology(options.technology.getFileName().toString(), read(options.technology));
        }
        if (options.layerOrder != null) {
            input.layerOrder(options.layerOrder);
        }
        return input;
    }

    /** Expands directories to the {@code .lib} files directly inside them, sorted by name. */
    static List<Path> libertyFiles(List<Path> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try (Stream<Path> entries = Files.list(path)) {
                    entries.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".lib"))
                            .sorted()
                            .forEach(files::add);
                }
            } else {
                files.add(path);
            }
        }
        return files;
    }

    private static String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    private static void writeOutputs(LefQaResult result, Options options, Logger log) throws IOException {
        Diagnostics diagnostics = result.getDiagnostics();
        DiagnosticReport report = new DiagnosticReport(
                options.truncate ? ReportOptions.truncating() : ReportOptions.defaults());

        for (Path lef : options.lefs) {
            String name = lef.toString();
            Path sorted = Path.of(name + "_sorted");
            Files.writeString(sorted, result.getCanonicalOutput(name), StandardCharsets.UTF_8);
            log.info("Wrote {}", sorted);

            if (!diagnostics.isEmpty()) {
                Path errors = Path.of(name + "_errors");
                Files.writeString(errors, report.render(diagnostics, sorted.toString()), StandardCharsets.UTF_8);
                log.info("Wrote {}", errors);
            }

            List<String> comments = result.getComments(name);
            if (!comments.isEmpty()) {
                Path commentFile = Path.of(name + "_comments");
                Files.writeString(commentFile, String.join("\n", comments) + "\n", StandardCharsets.UTF_8);
                log.info("Wrote {}", commentFile);
            }
        }

        for (String line : report.summary(diagnostics)) {
            System.out.println(line);
        }
    }
}
