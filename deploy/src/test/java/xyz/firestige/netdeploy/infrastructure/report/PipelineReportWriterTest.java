package xyz.firestige.netdeploy.infrastructure.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.netdeploy.domain.deployment.DeploymentStatus;
import xyz.firestige.netdeploy.domain.pipeline.DeviceReport;
import xyz.firestige.netdeploy.domain.pipeline.PipelinePhase;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("流水线报告落盘 测试")
class PipelineReportWriterTest {

    @TempDir
    Path dir;

    private static PipelineReport report() {
        Instant start = Instant.parse("2024-05-01T10:00:00Z");
        DeviceReport d1 = new DeviceReport("D1", "GENERATED", "+2/-1", DeploymentStatus.APPLIED,
                null, null, null, null, start.plusSeconds(1), start.plusSeconds(2),
                List.of(), List.of(ValidationResult.pass("bgp-sessions", "D1", CheckCategory.BGP, ValidationPhase.POST, "ok")));
        DeviceReport d2 = new DeviceReport("D2", "GENERATED", "+1/-0", DeploymentStatus.FAILED,
                "apply", ErrorType.APPLY_REJECTED, "rejected", null, start.plusSeconds(3), start.plusSeconds(4),
                List.of(), List.of());
        DeviceReport d3 = new DeviceReport("D3", "GENERATED", null, DeploymentStatus.SKIPPED,
                null, null, null, "halted after failure of D2", null, null, List.of(), List.of());
        return new PipelineReport("run-42", start, start.plusSeconds(10), false, PipelinePhase.REPORT, null, null, null,
                List.of(d1, d2, d3));
    }

    @Test
    @DisplayName("场景 - 报告写成 report-{runId}.json，时间为 ISO-8601")
    void writesJsonReport() throws Exception {
        // When
        Path written = new PipelineReportWriter(dir.resolve("reports")).write(report());

        // Then
        assertThat(written.getFileName().toString()).isEqualTo("report-run-42.json");
        JsonNode json = new ObjectMapper().readTree(written.toFile());
        assertThat(json.get("runId").asText()).isEqualTo("run-42");
        assertThat(json.get("startedAt").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(json.get("finalPhase").asText()).isEqualTo("REPORT");
        assertThat(json.get("devices")).hasSize(3);
        assertThat(json.get("devices").get(1).get("errorType").asText()).isEqualTo("APPLY_REJECTED");
        assertThat(json.get("devices").get(2).get("skipReason").asText()).contains("D2");
    }

    @Test
    @DisplayName("场景 - 汇总计数与成功判定")
    void summaryCounts() {
        // Given
        PipelineReport report = report();

        // Then
        assertThat(report.countDeployment(DeploymentStatus.APPLIED)).isEqualTo(1);
        assertThat(report.countDeployment(DeploymentStatus.FAILED)).isEqualTo(1);
        assertThat(report.countDeployment(DeploymentStatus.SKIPPED)).isEqualTo(1);
        assertThat(report.isSuccess()).isFalse();
        assertThat(report.summary()).contains("applied=1", "failed=1", "skipped=1");
    }
}
