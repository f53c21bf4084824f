package xyz.firestige.netdeploy.domain.pipeline;

import xyz.firestige.netdeploy.domain.deployment.DeploymentStatus;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;

import java.time.Instant;
import java.util.List;

/**
 * 报告中单台设备的汇总。失败时给出阶段与错误类型，便于操作员在重试和回滚之间做决定。
 *
 * @param generation       GENERATED / SKIPPED
 * @param diff             预览阶段的差异摘要（+a/-r），未到达或抓取失败时为 null
 * @param deployment       部署状态，流水线未到达 DEPLOY 时为 null
 * @param errorPhase       失败发生的阶段/步骤
 * @param errorType        错误类型
 * @param errorMessage     错误详情
 * @param skipReason       SKIPPED 的原因
 */
public record DeviceReport(String device,
                           String generation,
                           String diff,
                           DeploymentStatus deployment,
                           String errorPhase,
                           ErrorType errorType,
                           String errorMessage,
                           String skipReason,
                           Instant backupAt,
                           Instant applyAttemptAt,
                           List<ValidationResult> preValidation,
                           List<ValidationResult> postValidation) {

    public DeviceReport {
        preValidation = preValidation == null ? List.of() : List.copyOf(preValidation);
        postValidation = postValidation == null ? List.of() : List.copyOf(postValidation);
    }
}
