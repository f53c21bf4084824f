package xyz.firestige.netdeploy.application.orchestration;

import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.pipeline.DeviceReport;
import xyz.firestige.netdeploy.domain.pipeline.PipelineContext;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 从流水线上下文汇总出报告：每台涉及的设备一行
 */
final class PipelineReportAssembler {

    private PipelineReportAssembler() {
    }

    static PipelineReport assemble(PipelineContext ctx, Instant finishedAt) {
        Map<String, DeploymentResult> deployments = ctx.getDeploymentResults().stream()
                .collect(Collectors.toMap(DeploymentResult::getDevice, Function.identity(), (a, b) -> b));
        Map<String, List<ValidationResult>> pre = byDevice(ctx.getPreValidation());
        Map<String, List<ValidationResult>> post = byDevice(ctx.getPostValidation());

        Set<String> names = new LinkedHashSet<>();
        names.addAll(ctx.getGenerated().keySet());
        names.addAll(ctx.getGenerationFailures().keySet());
        names.addAll(deployments.keySet());

        List<DeviceReport> devices = new ArrayList<>(names.size());
        for (String name : names) {
            DeploymentResult deployment = deployments.get(name);
            FailureInfo failure = firstFailure(ctx, name, deployment);
            devices.add(new DeviceReport(
                    name,
                    ctx.getGenerated().containsKey(name) ? "GENERATED" : "SKIPPED",
                    diffSummary(ctx, name, deployment),
                    deployment != null ? deployment.getStatus() : null,
                    failure != null ? failure.getFailedAt() : null,
                    failure != null ? failure.getErrorType() : null,
                    failure != null ? failure.getErrorMessage() : null,
                    deployment != null ? deployment.getSkipReason().orElse(null) : null,
                    deployment != null ? deployment.getBackupAt().orElse(null) : null,
                    deployment != null ? deployment.getApplyAttemptAt().orElse(null) : null,
                    pre.getOrDefault(name, List.of()),
                    post.getOrDefault(name, List.of())));
        }
        FailureInfo abortFailure = ctx.getAbortFailure();
        return new PipelineReport(ctx.getRunId(), ctx.getStartedAt(), finishedAt, ctx.isDryRun(),
                ctx.getPhase(), ctx.getAbortedFrom(), ctx.getAbortReason(),
                abortFailure != null ? abortFailure.getErrorType() : null, devices);
    }

    private static FailureInfo firstFailure(PipelineContext ctx, String name, DeploymentResult deployment) {
        FailureInfo generation = ctx.getGenerationFailures().get(name);
        if (generation != null) {
            return generation;
        }
        if (deployment != null && deployment.getFailureInfo().isPresent()) {
            return deployment.getFailureInfo().get();
        }
        return ctx.getPreviewFailures().get(name);
    }

    private static String diffSummary(PipelineContext ctx, String name, DeploymentResult deployment) {
        if (deployment != null && deployment.getDiff().isPresent()) {
            return deployment.getDiff().get().summary();
        }
        return ctx.getDiffSummaries().get(name);
    }

    private static Map<String, List<ValidationResult>> byDevice(List<ValidationResult> results) {
        return results.stream().collect(Collectors.groupingBy(ValidationResult::device));
    }
}
