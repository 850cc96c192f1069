package com.foo.extract.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.Builder;
import org.springframework.stereotype.Component;

/**
 * Writes a run's history as a JSON report.
 */
@Component
public class ExtractReportWriter {

    private final ObjectMapper objectMapper;

    public ExtractReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Builder
    public record Report(
            String target,
            String output,
            OffsetDateTime startedAt,
            OffsetDateTime finishedAt,
            boolean success,
            boolean saved,
            List<ExtractAction> actions) {}

    public void write(Report report, Path file) throws IOException {
        objectMapper.writeValue(file.toFile(), report);
    }

    public String toJson(Report report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }
}
