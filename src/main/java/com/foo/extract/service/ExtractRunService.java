package com.foo.extract.service;

import com.foo.extract.config.ExtractProperties;
import com.foo.extract.match.CellMatch;
import com.foo.extract.match.CellValue;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.match.Match;
import com.foo.extract.match.MatchResult;
import com.foo.extract.match.RangeMatch;
import com.foo.extract.match.ValueComparator;
import com.foo.extract.range.Range;
import com.foo.extract.target.Target;
import com.foo.extract.util.CellValueWriter;
import com.foo.extract.util.SecureExcelUtils;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

/**
 * Runs the extract blocks found on the configuration sheet of a target workbook.
 *
 * <p>Blocks start at a cell reading {@code directory}, {@code file} or {@code name} and run
 * down to the first blank key. They are processed top to bottom. A failing block is recorded in
 * the history and the run carries on with the next one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractRunService {

    private static final String BLOCK_START = "^\\s*(directory|file|name)\\s*$";

    private final ExtractProperties properties;

    @Builder
    public record RunOptions(String configSheet, Path sourceDirectory, Path sourceFile) {}

    /** Mutable state of one run. */
    private static final class RunState {
        Path sourceDirectory;
        Workbook sourceWorkbook;
        final Map<String, CellValue> variables = new HashMap<>();
        final List<ExtractAction> history = new ArrayList<>();
    }

    /**
     * Runs every block on the configuration sheet against {@code targetWorkbook}, modifying it
     * in place.
     *
     * @return the history of actions, one or more per block
     * @throws ExtractConfigurationException if the configuration sheet does not exist
     */
    public List<ExtractAction> run(Workbook targetWorkbook, RunOptions options) {
        String configSheet = options.configSheet() != null ? options.configSheet() : properties.getConfigSheet();
        Sheet sheet = targetWorkbook.getSheet(configSheet);
        if (sheet == null) {
            throw new ExtractConfigurationException("Configuration sheet `%s` not found".formatted(configSheet));
        }

        RunState state = new RunState();
        state.sourceDirectory = options.sourceDirectory() != null
                ? options.sourceDirectory() : properties.getSourceDirectoryPath();
        state.variables.put(BlockMatchFactory.DIRECTORY, CellValue.text(state.sourceDirectory.toString()));
        CellValueWriter writer = properties.newCellValueWriter();

        if (options.sourceFile() != null) {
            loadSourceFile(state, options.sourceFile(), CellValue.text(options.sourceFile().getFileName().toString()));
        }

        RangeMatch blockMatch = RangeMatch.builder()
                .name("block")
                .sheet(ValueComparator.equalTo(configSheet))
                .startCell(CellMatch.builder()
                        .name("key")
                        .value(ValueComparator.regex(BLOCK_START))
                        .minRow(1)
                        .build())
                .build();

        Optional<MatchResult> found;
        while ((found = blockMatch.match(targetWorkbook)).isPresent()) {
            Range anchor = found.get().range();
            blockMatch = blockMatch.toBuilder()
                    .startCell(blockMatch.startCell().toBuilder().minRow(anchor.getLastRow() + 1).build())
                    .build();

            // Key, operator and value columns, whatever the header row's extent.
            Range block = Range.of(anchor.getSheet(), anchor.getFirstRow(), anchor.getFirstColumn(),
                    anchor.getLastRow(), anchor.getFirstColumn() + 2);
            runBlock(block, targetWorkbook, state, writer);
        }

        closeQuietly(state.sourceWorkbook);
        return state.history;
    }

    private void runBlock(Range blockRange, Workbook targetWorkbook, RunState state, CellValueWriter writer) {
        String label = blockRange.getValue().toDisplayString().trim();
        ConfigBlock block;
        try {
            block = ConfigBlockParser.parse(blockRange, state.variables);
        } catch (ExtractConfigurationException e) {
            record(state, ExtractAction.failed(label, e.getMessage()));
            return;
        }
        if (block.isEmpty()) {
            log.debug("Block at {} has no usable rows", blockRange.getReference(false, true, false));
            return;
        }

        if (block.has(BlockMatchFactory.DIRECTORY)) {
            runDirectory(block, state);
        }
        if (block.has(BlockMatchFactory.FILE)) {
            runFile(block, state);
        }
        if (block.has(BlockMatchFactory.NAME)) {
            runNamed(block, targetWorkbook, state, writer);
        }
    }

    private void runDirectory(ConfigBlock block, RunState state) {
        try {
            Path directory = SourceFileLocator.resolveDirectory(state.sourceDirectory,
                    block.get(BlockMatchFactory.DIRECTORY).orElseThrow());
            state.sourceDirectory = directory;
            state.variables.put(BlockMatchFactory.DIRECTORY, CellValue.text(directory.toString()));
            record(state, ExtractAction.succeeded(BlockMatchFactory.DIRECTORY, "Obtained " + directory));
        } catch (ExtractConfigurationException e) {
            record(state, ExtractAction.failed(BlockMatchFactory.DIRECTORY, e.getMessage()));
        }
    }

    private void runFile(ConfigBlock block, RunState state) {
        try {
            SourceFileLocator.LocatedFile located = SourceFileLocator.locate(state.sourceDirectory,
                    block.get(BlockMatchFactory.FILE).orElseThrow());
            loadSourceFile(state, located.path(), located.match());
        } catch (ExtractConfigurationException | IOException | SecurityException e) {
            record(state, ExtractAction.failed(BlockMatchFactory.FILE, describe(e)));
        }
    }

    private void loadSourceFile(RunState state, Path file, CellValue fileVariable) {
        try {
            Workbook workbook = SecureExcelUtils.openWorkbook(file);
            closeQuietly(state.sourceWorkbook);
            state.sourceWorkbook = workbook;
            state.variables.put(BlockMatchFactory.FILE, fileVariable);
            record(state, ExtractAction.succeeded(BlockMatchFactory.FILE, "Obtained " + file));
        } catch (IOException | SecurityException e) {
            record(state, ExtractAction.failed(BlockMatchFactory.FILE, describe(e)));
        }
    }

    private void runNamed(ConfigBlock block, Workbook targetWorkbook, RunState state, CellValueWriter writer) {
        String name;
        try {
            name = BlockMatchFactory.blockName(block);
        } catch (ExtractConfigurationException e) {
            record(state, ExtractAction.failed(BlockMatchFactory.NAME, e.getMessage()));
            return;
        }

        if (state.sourceWorkbook == null) {
            record(state, ExtractAction.failed(name, "No source file set ahead of " + name));
            return;
        }

        Match source;
        Optional<Target> target;
        try {
            source = BlockMatchFactory.buildSource(block, state.sourceWorkbook);
            target = BlockMatchFactory.buildTarget(block, source);
        } catch (ExtractConfigurationException e) {
            record(state, ExtractAction.failed(name, e.getMessage()));
            return;
        }

        Optional<MatchResult> result = target.isPresent()
                ? target.get().extract(state.sourceWorkbook, targetWorkbook, writer)
                : source.match(state.sourceWorkbook);

        if (result.isEmpty()) {
            record(state, ExtractAction.failed(name, name + " failed to match"));
            return;
        }

        Range range = result.get().range();
        record(state, ExtractAction.succeeded(name, "Matched " + range.getReference(false, true, false)));

        CellValue variable = result.get().capturedValue()
                .orElseGet(() -> range.isCell() ? range.getValue() : null);
        if (variable != null && !variable.isNull()) {
            state.variables.put(name.toLowerCase(Locale.ROOT), variable);
        }
    }

    private void record(RunState state, ExtractAction action) {
        if (action.success()) {
            log.info("{}", action);
        } else {
            log.warn("{}", action);
        }
        state.history.add(action);
    }

    private static String describe(Exception e) {
        if (e instanceof NoSuchFileException nsf) {
            String reason = nsf.getReason() != null ? nsf.getReason() : "Not found";
            return "%s: %s".formatted(reason, nsf.getFile());
        }
        return e.getMessage();
    }

    private static void closeQuietly(Workbook workbook) {
        if (workbook == null) {
            return;
        }
        try {
            workbook.close();
        } catch (IOException e) {
            log.debug("Closing previous source workbook failed: {}", e.getMessage());
        }
    }
}
