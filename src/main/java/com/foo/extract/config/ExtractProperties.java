package com.foo.extract.config;

import com.foo.extract.util.CellValueWriter;
import jakarta.validation.constraints.NotBlank;
import java.nio.file.Path;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "xlsx.extract")
public class ExtractProperties {

    /** Sheet in the target workbook holding the extract blocks. */
    @NotBlank
    private String configSheet = "Config";

    /** Where source files are looked up until a directory block says otherwise. */
    private String sourceDirectory = System.getProperty("user.dir");

    /** Save the output even when some actions failed. */
    private boolean allowFailures = false;

    @NotBlank
    private String dateFormat = CellValueWriter.DEFAULT_DATE_FORMAT;

    @NotBlank
    private String dateTimeFormat = CellValueWriter.DEFAULT_DATE_TIME_FORMAT;

    @NotBlank
    private String timeFormat = CellValueWriter.DEFAULT_TIME_FORMAT;

    public Path getSourceDirectoryPath() {
        return Path.of(sourceDirectory);
    }

    public CellValueWriter newCellValueWriter() {
        return new CellValueWriter(dateFormat, dateTimeFormat, timeFormat);
    }
}
