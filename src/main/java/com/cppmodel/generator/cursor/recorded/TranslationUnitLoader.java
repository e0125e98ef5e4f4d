package com.cppmodel.generator.cursor.recorded;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cppmodel.generator.diagnostics.ToolDiagnostics;

/**
 * Discovers and reads recorded translation units from a directory.
 *
 * Diagnostics are written to ToolDiagnostics; a unit that cannot be read is
 * reported there and left out.
 */
public class TranslationUnitLoader {
    private static final Logger log = LoggerFactory.getLogger(TranslationUnitLoader.class);

    public static final String DUMP_EXTENSION = ".cursors";

    private final Path inputDir;

    /** Cache of read units by file name. */
    private final Map<String, RecordedTranslationUnit> loadedUnits = new HashMap<>();

    public TranslationUnitLoader(Path inputDir) {
        this.inputDir = Objects.requireNonNull(inputDir, "inputDir");
    }

    /**
     * Read every dump in the input directory (non-recursive), in file name order.
     */
    public List<RecordedTranslationUnit> loadAll(ToolDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(diagnostics, "diagnostics");

        List<Path> dumps;
        try (Stream<Path> stream = Files.walk(inputDir, 1)) {
            dumps = stream.filter(Files::isRegularFile)
                    .filter(TranslationUnitLoader::isDumpFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        }

        if (dumps.isEmpty()) {
            diagnostics.warning(inputDir.toString(), "No " + DUMP_EXTENSION + " files found");
        }

        List<RecordedTranslationUnit> units = new ArrayList<>();
        for (Path path : dumps) {
            try {
                units.add(load(path, diagnostics));
            } catch (IOException e) {
                diagnostics.error(path.toString(), "Failed to read (" + e.getMessage() + ")");
                log.error("Failed to read cursor dump: {}", path, e);
            } catch (DumpParseException e) {
                diagnostics.error(path.toString(), e.getMessage());
                log.error("Failed to parse cursor dump {}: {}", path, e.getMessage());
            }
        }
        return units;
    }

    /**
     * Read a single dump. Uses the cache if it was read before.
     */
    public RecordedTranslationUnit load(Path path, ToolDiagnostics diagnostics) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(diagnostics, "diagnostics");

        String fileName = path.getFileName().toString();
        RecordedTranslationUnit cached = loadedUnits.get(fileName);
        if (cached != null) {
            return cached;
        }

        log.info("Reading cursor dump: {}", fileName);
        String content = Files.readString(path);
        RecordedTranslationUnit unit = CursorDumpParser.read(content, fileName, diagnostics);

        loadedUnits.put(fileName, unit);
        return unit;
    }

    static boolean isDumpFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(DUMP_EXTENSION);
    }
}
