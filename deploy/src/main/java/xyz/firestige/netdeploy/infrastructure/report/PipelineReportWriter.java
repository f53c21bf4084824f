package xyz.firestige.netdeploy.infrastructure.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把流水线报告写成 JSON：{dir}/report-{runId}.json
 */
public class PipelineReportWriter {

    private static final Logger log = LoggerFactory.getLogger(PipelineReportWriter.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public PipelineReportWriter(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path write(PipelineReport report) {
        Path target = directory.resolve("report-" + report.runId() + ".json");
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(target.toFile(), report);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write pipeline report to " + target, e);
        }
        log.info("Pipeline report written to {}", target);
        return target;
    }

    public String toJson(PipelineReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot serialize pipeline report " + report.runId(), e);
        }
    }
}
