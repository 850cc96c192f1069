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
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

class SourceFileLocatorTest {

    @TempDir
    Path tempDir;

    private Path file(String name, String modified) throws IOException {
        Path file = Files.writeString(tempDir.resolve(name), name);
        Files.setLastModifiedTime(file, FileTime.from(Instant.parse(modified)));
        return file;
    }

    @Test
    void resolveDirectory_relativeToCurrent() {
        Path resolved = SourceFileLocator.resolveDirectory(tempDir, ValueComparator.equalTo("reports/../2021"));

        assertThat(resolved).isEqualTo(tempDir.resolve("2021"));
    }

    @Test
    void resolveDirectory_absoluteWins() {
        Path other = tempDir.resolve("elsewhere").toAbsolutePath();

        assertThat(SourceFileLocator.resolveDirectory(Path.of("ignored"), ValueComparator.equalTo(other.toString())))
                .isEqualTo(other);
    }

    @Test
    void resolveDirectory_nonEqualOperator_throws() {
        assertThatThrownBy(() -> SourceFileLocator.resolveDirectory(tempDir, ValueComparator.regex("^2021")))
                .isInstanceOf(ExtractConfigurationException.class)
                .hasMessageStartingWith("directory:");
    }

    @Test
    void locate_byName() throws IOException {
        Path expected = file("report.xlsx", "2021-05-01T00:00:00Z");

        SourceFileLocator.LocatedFile located = SourceFileLocator.locate(tempDir, ValueComparator.equalTo("report.xlsx"));

        assertThat(located.path()).isEqualTo(expected);
        assertThat(located.match()).isEqualTo(CellValue.text("report.xlsx"));
    }

    @Test
    void locate_byName_missing_throwsNoSuchFile() {
        assertThatThrownBy(() -> SourceFileLocator.locate(tempDir, ValueComparator.equalTo("missing.xlsx")))
                .isInstanceOf(NoSuchFileException.class)
                .hasMessageContaining("missing.xlsx");
    }

    @Test
    void locate_byPattern_picksNewestAndCaptures() throws IOException {
        file("report_2020.xlsx", "2021-01-01T00:00:00Z");
        Path newest = file("report_2021.xlsx", "2021-06-01T00:00:00Z");
        file("notes.txt", "2021-12-01T00:00:00Z");

        SourceFileLocator.LocatedFile located =
                SourceFileLocator.locate(tempDir, ValueComparator.regex("^report_(\\d{4})\\.xlsx$"));

        assertThat(located.path()).isEqualTo(newest);
        assertThat(located.match()).isEqualTo(CellValue.text("2021"));
    }

    @Test
    void locate_byPattern_noMatch_throwsNoSuchFile() throws IOException {
        file("notes.txt", "2021-12-01T00:00:00Z");

        assertThatThrownBy(() -> SourceFileLocator.locate(tempDir, ValueComparator.regex("\\.xlsx$")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void locate_missingDirectory_throwsNoSuchFile() {
        assertThatThrownBy(() -> SourceFileLocator.locate(tempDir.resolve("nope"), ValueComparator.equalTo("a.xlsx")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void locate_otherOperator_throws() {
        assertThatThrownBy(() -> SourceFileLocator.locate(tempDir, ValueComparator.of(Operator.NOT_EMPTY)))
                .isInstanceOf(ExtractConfigurationException.class)
                .hasMessageStartingWith("file:");
    }
}
