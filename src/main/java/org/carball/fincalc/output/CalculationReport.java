package org.carball.fincalc.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.fincalc.config.EngineSettings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * JSON envelope pairing a calculation's input with its result, for storage and report generators.
 */
@Slf4j
public class CalculationReport {

    public static final String ENGINE_VERSION = "1.0.0";

    private final String calculation;
    private final Object input;
    private final Object result;
    private final EngineSettings settings;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public CalculationReport(String calculation, Object input, Object result, EngineSettings settings) {
        this(calculation, input, result, settings, Clock.systemDefaultZone());
    }

    public CalculationReport(String calculation, Object input, Object result, EngineSettings settings, Clock clock) {
        this.calculation = calculation;
        this.input = input;
        this.result = result;
        this.settings = settings;
        this.timestamp = LocalDateTime.now(clock);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public void writeTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
        log.info("Report written to {}", file);
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();
        data.setMetadata(new ReportMetadata(timestamp, calculation, ENGINE_VERSION,
                settings == null ? null : settings.getSource()));
        data.setInput(input);
        data.setResult(result);
        return data;
    }

    @Data
    private static class ReportData {
        private ReportMetadata metadata;
        private Object input;
        private Object result;
    }

    @Data
    @AllArgsConstructor
    private static class ReportMetadata {
        private LocalDateTime timestamp;
        private String calculation;
        private String engineVersion;
        private String settingsSource;
    }
}
