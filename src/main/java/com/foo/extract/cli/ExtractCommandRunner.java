package com.foo.extract.cli;

import com.foo.extract.config.ExtractProperties;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.service.ExtractAction;
import com.foo.extract.service.ExtractReportWriter;
import com.foo.extract.service.ExtractRunService;
import com.foo.extract.util.SecureExcelUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point:
 * {@code xlsx-extract target.xlsx [output.xlsx] [--update] [--allow-failures]
 * [--config-sheet=Config] [--source-directory=DIR] [--source-file=FILE] [--report=FILE]}.
 *
 * <p>Exit codes: 0 when every action succeeded, 1 when some failed, 2 for usage or I/O errors.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED_ACTIONS = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: xlsx-extract target.xlsx [output.xlsx] [--update] [--allow-failures] "
            + "[--config-sheet=Config] [--source-directory=DIR] [--source-file=FILE] [--report=FILE]";

    private final ExtractRunService runService;
    private final ExtractReportWriter reportWriter;
    private final ExtractProperties properties;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        boolean update = args.containsOption("update");

        if (positional.isEmpty() || positional.size() > 2
                || (update && positional.size() == 2)
                || (!update && positional.size() < 2)) {
            log.error(USAGE);
            return EXIT_USAGE;
        }

        Path targetFile = Path.of(positional.get(0));
        Path outputFile = update ? targetFile : Path.of(positional.get(1));
        Path sourceDirectory = Path.of(option(args, "source-directory", properties.getSourceDirectory()));
        String sourceFileOption = option(args, "source-file", null);
        Path sourceFile = sourceFileOption != null ? Path.of(sourceFileOption) : null;
        String configSheet = option(args, "config-sheet", properties.getConfigSheet());
        boolean allowFailures = args.containsOption("allow-failures") || properties.isAllowFailures();
        String reportOption = option(args, "report", null);

        if (!Files.isRegularFile(targetFile)) {
            log.error("Target file {} not found", targetFile);
            return EXIT_USAGE;
        }
        if (!Files.isDirectory(sourceDirectory)) {
            log.error("Source directory {} not found", sourceDirectory);
            return EXIT_USAGE;
        }
        if (sourceFile != null && !Files.isRegularFile(sourceFile)) {
            log.error("Source file {} not found", sourceFile);
            return EXIT_USAGE;
        }

        OffsetDateTime startedAt = OffsetDateTime.now();
        try (Workbook targetWorkbook = SecureExcelUtils.openWorkbook(targetFile)) {
            List<ExtractAction> history = runService.run(targetWorkbook, ExtractRunService.RunOptions.builder()
                    .configSheet(configSheet)
                    .sourceDirectory(sourceDirectory)
                    .sourceFile(sourceFile)
                    .build());

            boolean success = history.stream().allMatch(ExtractAction::success);
            boolean save = success || allowFailures;
            if (save) {
                SecureExcelUtils.saveWorkbook(targetWorkbook, outputFile);
                log.info("Saved {}", outputFile);
            } else {
                log.warn("Some actions failed; {} not written (use --allow-failures to write anyway)", outputFile);
            }

            if (reportOption != null) {
                reportWriter.write(ExtractReportWriter.Report.builder()
                        .target(targetFile.toString())
                        .output(outputFile.toString())
                        .startedAt(startedAt)
                        .finishedAt(OffsetDateTime.now())
                        .success(success)
                        .saved(save)
                        .actions(history)
                        .build(), Path.of(reportOption));
            }
            return success ? EXIT_OK : EXIT_FAILED_ACTIONS;
        } catch (ExtractConfigurationException e) {
            log.error(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException | SecurityException e) {
            log.error("Cannot process {}: {}", targetFile, e.getMessage(), e);
            return EXIT_USAGE;
        }
    }

    private static String option(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            return fallback;
        }
        return values.get(values.size() - 1);
    }
}
