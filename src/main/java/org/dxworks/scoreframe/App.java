package org.dxworks.scoreframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.scoreframe.convert.ConversionException;
import org.dxworks.scoreframe.convert.ConversionResult;
import org.dxworks.scoreframe.convert.ConversionWarning;
import org.dxworks.scoreframe.lilypond.importer.ImportedScore;
import org.dxworks.scoreframe.lilypond.parser.ParseException;
import org.dxworks.scoreframe.musicxml.model.PartList;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar scoreframe.jar <input> <output.jsonl>");
            System.err.println("  <input>:        Path to a score file or a folder of score files");
            System.err.println("  <output.jsonl>: Path to output JSONL file");
            System.err.println("Supported formats: LilyPond (.ly)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting score conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        ScoreframeConfig config = ScoreframeConfig.load();
        ScoreConverter converter = new ScoreConverter(config);
        List<Path> files = collectScoreFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " score files");

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

            files.parallelStream().forEach(file -> {
                Optional<ScoreFormat> formatOpt = FormatDetector.detectFormat(file);
                if (formatOpt.isEmpty()) {
                    return;
                }

                ScoreFormat format = formatOpt.get();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting "
                            + format.getName() + ": " + file.getFileName());
                }

                Map<String, Object> record;
                String failure;
                try {
                    record = convertFile(file, converter);
                    failure = config.isFailOnWarnings() && !((List<?>) record.get("warnings")).isEmpty()
                            ? ((List<?>) record.get("warnings")).size() + " warnings with failOnWarnings set"
                            : null;
                } catch (ParseException e) {
                    record = errorRecord(file, format, e.getMessage());
                    record.put("position", e.getPosition());
                    record.put("line", e.getLine());
                    record.put("column", e.getColumn());
                    failure = e.getMessage();
                } catch (Exception e) {
                    record = errorRecord(file, format, e.getMessage());
                    failure = e.getMessage();
                }
                if (failure != null && "conversion".equals(record.get("kind"))) {
                    Map<String, Object> error = errorRecord(file, format, failure);
                    error.put("warnings", record.get("warnings"));
                    record = error;
                }

                try {
                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(record));
                        writer.newLine();
                        writer.flush();
                    }
                } catch (IOException ioException) {
                    System.err.println("Failed to write result for " + file + ": " + ioException.getMessage());
                }

                if (failure == null) {
                    successCount.incrementAndGet();
                } else {
                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + failure);
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds",
                    java.time.Duration.between(startTime, endTime).getSeconds());
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

    private static List<Path> collectScoreFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> FormatDetector.detectFormat(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (FormatDetector.detectFormat(input).isPresent() && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException e) {
            return true;
        }
    }

    /**
     * Imports one LilyPond file and reports the canonical LilyPond text, the MusicXML part list, the
     * extension store, the warnings of all three steps and the validator's diagnostics.
     */
    public static Map<String, Object> convertFile(Path filePath, ScoreConverter converter)
            throws IOException, ParseException, ConversionException {
        String source = Files.readString(filePath, StandardCharsets.UTF_8);
        if (source.startsWith("\uFEFF")) {
            source = source.substring(1);
        }

        ConversionResult<ImportedScore> imported = converter.importLilyPond(source);
        ImportedScore score = imported.value;
        ConversionResult<String> lilypond = converter.exportLilyPond(score);
        ConversionResult<PartList> partList = converter.exportPartList(score);

        List<ConversionWarning> warnings = new ArrayList<>(imported.warnings);
        warnings.addAll(lilypond.warnings);
        warnings.addAll(partList.warnings);

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "conversion");
        record.put("file", filePath.toString());
        record.put("format", ScoreFormat.LILYPOND.getName());
        record.put("lilypond", lilypond.value);
        record.put("partList", partList.value);
        record.put("store", score.store);
        record.put("warnings", warnings);
        record.put("diagnostics", converter.validate(score.document).diagnostics);
        return record;
    }

    private static Map<String, Object> errorRecord(Path file, ScoreFormat format, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", file.toString());
        error.put("format", format.getName());
        error.put("error", message);
        return error;
    }
}
