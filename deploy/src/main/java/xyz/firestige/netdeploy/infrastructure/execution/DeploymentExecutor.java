package xyz.firestige.netdeploy.infrastructure.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.diff.DiffEngine;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.shared.exception.NetDeployException;
import xyz.firestige.netdeploy.infrastructure.execution.steps.ApplyStep;
import xyz.firestige.netdeploy.infrastructure.execution.steps.BackupStep;
import xyz.firestige.netdeploy.infrastructure.execution.steps.CaptureStep;
import xyz.firestige.netdeploy.infrastructure.execution.steps.DiffStep;
import xyz.firestige.netdeploy.infrastructure.execution.steps.PersistStep;
import xyz.firestige.netdeploy.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.netdeploy.infrastructure.session.SessionProvider;

import java.time.Clock;
import java.util.List;

/**
 * 单设备部署执行器
 * <p>
 * 步骤：connect → capture → backup → diff → (dry-run 到此为止) → apply → persist → disconnect（总会执行）。
 * <p>
 * 只操作一台设备；"首个失败后停止后续设备" 由编排器负责。
 * 任一步骤失败都转换为 FAILED 结果，错误类型由异常携带：
 * - 备份失败：BACKUP_FAILURE，下发从未尝试
 * - 设备拒绝：APPLY_REJECTED
 * - 连接/超时：SESSION_ERROR
 */
public class DeploymentExecutor {

    private static final Logger log = LoggerFactory.getLogger(DeploymentExecutor.class);

    private final SessionProvider sessionProvider;
    private final DeviceOperationGuard guard;
    private final MetricsRegistry metrics;
    private final List<DeviceStep> previewSteps;
    private final List<DeviceStep> liveSteps;
    private final List<DeviceStep> restoreSteps;

    public DeploymentExecutor(SessionProvider sessionProvider,
                              ConfigStore store,
                              DiffEngine diffEngine,
                              DeviceOperationGuard guard,
                              MetricsRegistry metrics,
                              Clock clock) {
        this.sessionProvider = sessionProvider;
        this.guard = guard;
        this.metrics = metrics;
        CaptureStep capture = new CaptureStep(guard);
        BackupStep backup = new BackupStep(store);
        DiffStep diff = new DiffStep(diffEngine);
        this.previewSteps = List.of(capture, backup, diff);
        PersistStep persist = new PersistStep(guard);
        this.liveSteps = List.of(capture, backup, diff, new ApplyStep(guard, clock), persist);
        this.restoreSteps = List.of(capture, backup, diff, new ApplyStep(guard, clock, true), persist);
    }

    public DeploymentResult apply(DeviceIntent device, String desiredText, boolean dryRun) {
        return apply(null, device, desiredText, dryRun);
    }

    public DeploymentResult apply(String runId, DeviceIntent device, String desiredText, boolean dryRun) {
        DeviceRuntimeContext ctx = new DeviceRuntimeContext(runId, device, desiredText, dryRun);
        return run(ctx, dryRun ? previewSteps : liveSteps);
    }

    /**
     * 原样恢复一份备份文本。恢复前同样会先备份当前现网配置。
     */
    public DeploymentResult restore(String runId, DeviceIntent device, String backupText) {
        DeviceRuntimeContext ctx = new DeviceRuntimeContext(runId, device, backupText, false);
        return run(ctx, restoreSteps);
    }

    private DeploymentResult run(DeviceRuntimeContext ctx, List<DeviceStep> steps) {
        DeviceIntent device = ctx.getDevice();
        ctx.injectMdc("connect");
        try {
            DeploymentResult result = execute(ctx, steps);
            metrics.incrementCounter("netdeploy.deploy.result", "status", result.getStatus().name());
            log.info("Device {} finished: status={}, steps={}", device.getName(), result.getStatus(), ctx.getStepResults());
            return result;
        } finally {
            ctx.clearMdc();
        }
    }

    private DeploymentResult execute(DeviceRuntimeContext ctx, List<DeviceStep> steps) {
        String name = ctx.getDeviceName();
        try {
            ctx.setSession(guard.call(name, "connect", () -> sessionProvider.connect(ctx.getDevice())));
        } catch (RuntimeException e) {
            log.error("Cannot open session to {}: {}", name, e.getMessage());
            return DeploymentResult.failed(name, toFailure(e, "connect"));
        }
        try {
            for (DeviceStep step : steps) {
                StepResult stepRes = StepResult.start(step.getStepName());
                try {
                    ctx.injectMdc(step.getStepName());
                    step.execute(ctx);
                    stepRes.finishSuccess();
                    ctx.addStepResult(stepRes);
                } catch (RuntimeException ex) {
                    log.error("Device step failed: device={}, step={}, err={}", name, step.getStepName(), ex.getMessage());
                    stepRes.finishFailure(ex.getMessage());
                    ctx.addStepResult(stepRes);
                    return DeploymentResult.failed(name, toFailure(ex, step.getStepName()),
                            ctx.getDiff(), ctx.getBackup(), ctx.getApplyAttemptAt());
                }
            }
            if (ctx.isDryRun()) {
                return DeploymentResult.preview(name, ctx.getDiff(), ctx.getBackup());
            }
            return DeploymentResult.applied(name, ctx.getDiff(), ctx.getBackup(), ctx.getApplyAttemptAt());
        } finally {
            disconnect(ctx);
        }
    }

    private void disconnect(DeviceRuntimeContext ctx) {
        ctx.injectMdc("disconnect");
        try {
            guard.run(ctx.getDeviceName(), "disconnect", ctx.getSession()::disconnect);
        } catch (RuntimeException e) {
            // 结果已确定，断开失败只记录
            log.warn("Disconnect from {} failed: {}", ctx.getDeviceName(), e.getMessage());
        }
    }

    private FailureInfo toFailure(RuntimeException e, String step) {
        if (e instanceof NetDeployException nde) {
            return FailureInfo.fromException(nde, step);
        }
        return FailureInfo.fromException(e, ErrorType.SESSION_ERROR, step);
    }
}
