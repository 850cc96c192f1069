package com.foo.extract.service;

import com.foo.extract.match.CellValue;
import com.foo.extract.match.ExtractConfigurationException;
import com.foo.extract.match.Operator;
import com.foo.extract.match.ValueComparator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves {@code directory} and {@code file} blocks to paths.
 */
@Slf4j
public final class SourceFileLocator {

    /** A located source file and the text to store as the {@code file} variable. */
    public record LocatedFile(Path path, CellValue match) {}

    private SourceFileLocator() {}

    /**
     * Resolves a directory value against the current source directory.
     *
     * @throws ExtractConfigurationException unless the comparator is an {@code is} with text
     */
    public static Path resolveDirectory(Path currentDirectory, ValueComparator comparator) {
        if (comparator.getOperator() != Operator.EQUAL || !comparator.getOperand().isText()
                || comparator.getOperand().isBlank()) {
            throw new ExtractConfigurationException("directory",
                    "Directory block must use operator `is` and a text value");
        }
        String value = comparator.getOperand().asText().trim().replace('\\', '/');
        return currentDirectory.resolve(value).normalize();
    }

    /**
     * Finds the file named by an {@code is} comparator, or the most recently modified file in
     * {@code directory} whose name satisfies a {@code matches} comparator.
     *
     * @throws ExtractConfigurationException for any other operator or a non-text value
     * @throws NoSuchFileException if the directory or file does not exist
     */
    public static LocatedFile locate(Path directory, ValueComparator comparator) throws IOException {
        Operator operator = comparator.getOperator();
        if ((operator != Operator.EQUAL && operator != Operator.REGEX) || !comparator.getOperand().isText()) {
            throw new ExtractConfigurationException("file",
                    "File block must use operator `is` or `matches` and a text value");
        }
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Directory not found");
        }

        if (operator == Operator.EQUAL) {
            String name = comparator.getOperand().asText().trim();
            Path file = directory.resolve(name);
            if (!Files.isRegularFile(file)) {
                throw new NoSuchFileException(file.toString(), null, "File not found");
            }
            return new LocatedFile(file, CellValue.text(name));
        }

        for (Path candidate : newestFirst(directory)) {
            Optional<CellValue> match = comparator.match(CellValue.text(candidate.getFileName().toString()));
            if (match.isPresent()) {
                log.debug("File pattern {} matched {}", comparator, candidate);
                return new LocatedFile(candidate, match.get());
            }
        }
        throw new NoSuchFileException(directory.toString(), null,
                "No file matching `%s`".formatted(comparator.getOperand().asText()));
    }

    private static List<Path> newestFirst(Path directory) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing.filter(Files::isRegularFile).collect(Collectors.toCollection(ArrayList::new));
        }
        Map<Path, FileTime> modified = new HashMap<>();
        for (Path file : files) {
            modified.put(file, Files.getLastModifiedTime(file));
        }
        files.sort(Comparator.comparing((Path file) -> modified.get(file)).reversed()
                .thenComparing(file -> file.getFileName().toString()));
        return files;
    }
}
