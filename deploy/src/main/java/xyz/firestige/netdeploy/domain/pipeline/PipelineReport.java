package xyz.firestige.netdeploy.domain.pipeline;

import xyz.firestige.netdeploy.domain.deployment.DeploymentStatus;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;

import java.time.Instant;
import java.util.List;

/**
 * 流水线最终报告。无论是否中止都会生成。
 * <p>
 * 成功 = 未中止 且 没有 FAILED 部署结果 且 部署后校验没有 FAIL。
 *
 * @param abortErrorType 中止由错误引起时的错误类型（例如部署计划的循环依赖）；人为拒绝或取消时为 null
 */
public record PipelineReport(String runId,
                             Instant startedAt,
                             Instant finishedAt,
                             boolean dryRun,
                             PipelinePhase finalPhase,
                             PipelinePhase abortedFrom,
                             String abortReason,
                             ErrorType abortErrorType,
                             List<DeviceReport> devices) {

    public PipelineReport {
        devices = devices == null ? List.of() : List.copyOf(devices);
    }

    public boolean isAborted() {
        return finalPhase == PipelinePhase.ABORTED;
    }

    public long countDeployment(DeploymentStatus status) {
        return devices.stream().filter(d -> d.deployment() == status).count();
    }

    public long countValidationFailures(ValidationPhase phase) {
        return devices.stream()
                .flatMap(d -> (phase == ValidationPhase.PRE ? d.preValidation() : d.postValidation()).stream())
                .filter(r -> r.isFailure())
                .count();
    }

    public boolean isSuccess() {
        return !isAborted()
                && countDeployment(DeploymentStatus.FAILED) == 0
                && countValidationFailures(ValidationPhase.POST) == 0;
    }

    public String summary() {
        return String.format("run=%s phase=%s success=%s applied=%d failed=%d skipped=%d postFail=%d%s",
                runId, finalPhase, isSuccess(),
                countDeployment(DeploymentStatus.APPLIED),
                countDeployment(DeploymentStatus.FAILED),
                countDeployment(DeploymentStatus.SKIPPED),
                countValidationFailures(ValidationPhase.POST),
                abortReason != null ? " abort='" + abortReason + "'" : "")
                + (abortErrorType != null ? " abortType=" + abortErrorType : "");
    }
}
