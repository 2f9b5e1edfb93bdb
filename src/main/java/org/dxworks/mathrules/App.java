package org.dxworks.mathrules;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mathrules.engine.RuleEngine;
import org.dxworks.mathrules.output.ConversionResult;
import org.dxworks.mathrules.output.TokenStream;
import org.dxworks.mathrules.tree.JsonTreeCodec;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;
import org.dxworks.mathrules.tree.XmlTreeReader;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar mathrules.jar <input> <output-file> [config-file]");
            System.err.println("  <input>:       MathML (.xml, .mml) or JSON tree (.json) file, or a folder of them");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("  [config-file]: Rule configuration (default: " + MathRulesConfig.CONFIG_FILE_NAME + ")");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        MathRulesConfig config = args.length > 2 ? MathRulesConfig.load(Paths.get(args[2])) : MathRulesConfig.load();
        RuleEngine engine = config.createEngine();
        boolean withBraille = config.hasBrailleRules();

        System.out.println("Starting conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectInputFiles(input);
        System.out.println("Found " + files.size() + " input files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // The engine is shared; every conversion keeps its own state
            files.parallelStream().forEach(file -> {
                Optional<InputFormat> formatOpt = InputFormatDetector.detectFormat(file);
                if (formatOpt.isEmpty()) {
                    return;
                }

                InputFormat format = formatOpt.get();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting "
                            + format.getName() + ": " + file.getFileName());
                }

                try {
                    ConversionResult result = convertFile(engine, file, format, withBraille);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(result));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("format", format.getName());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static List<Path> collectInputFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> InputFormatDetector.detectFormat(p).isPresent())
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && InputFormatDetector.detectFormat(input).isPresent()) {
            files.add(input);
        }

        return files;
    }

    /**
     * Reads the input tree and gives every element without an id one, so that bookmarks can
     * always be traced back to the source.
     */
    public static Node readTree(Path filePath, InputFormat format) throws IOException {
        switch (format) {
            case JSON:
                return TreeHelper.assignIds(JsonTreeCodec.read(filePath));
            case MATHML:
            default:
                return TreeHelper.assignIds(XmlTreeReader.read(filePath));
        }
    }

    /**
     * Runs the intent and speech passes (and the braille pass when braille rules are configured).
     */
    public static ConversionResult convertFile(RuleEngine engine, Path filePath, InputFormat format,
                                               boolean withBraille) throws IOException {
        Node tree = readTree(filePath, format);

        ConversionResult result = new ConversionResult();
        result.filePath = filePath.toString();
        result.format = format.getName();
        result.intent = JsonTreeCodec.toJson(engine.toIntent(tree));

        TokenStream speech = engine.speak(tree);
        result.speech = speech.toSpeechString();
        result.speechTokens.addAll(speech.tokens());
        result.bookmarks.addAll(speech.bookmarkRanges());

        if (withBraille) {
            TokenStream braille = engine.braille(tree);
            result.braille = braille.toBrailleString();
            result.brailleTokens = new ArrayList<>(braille.tokens());
        }
        return result;
    }
}
