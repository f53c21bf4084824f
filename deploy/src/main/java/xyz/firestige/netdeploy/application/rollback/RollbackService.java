package xyz.firestige.netdeploy.application.rollback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.netdeploy.application.plan.DeploymentPlanner;
import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.deployment.DeploymentPlan;
import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.infrastructure.execution.DeploymentExecutor;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 回滚服务，只由操作员显式触发，从不自动执行。
 * <p>
 * 选取"严格早于当前时刻"的最新备份，原样推送（逐字节一致）。推送前照常备份当前配置，
 * 因此回滚本身也可以被回滚。多台设备按部署计划的逆序依次回滚，首个失败后停止。
 */
public class RollbackService {

    private static final Logger log = LoggerFactory.getLogger(RollbackService.class);

    private final ConfigStore store;
    private final DeploymentExecutor executor;
    private final DeploymentPlanner planner;
    private final Clock clock;

    public RollbackService(ConfigStore store, DeploymentExecutor executor, DeploymentPlanner planner, Clock clock) {
        this.store = store;
        this.executor = executor;
        this.planner = planner;
        this.clock = clock;
    }

    public DeploymentResult rollback(DeviceIntent device) {
        return rollback(UUID.randomUUID().toString(), device);
    }

    private DeploymentResult rollback(String runId, DeviceIntent device) {
        String name = device.getName();
        Instant now = clock.instant();
        Optional<Backup> target = store.latestBackupBefore(name, now);
        if (target.isEmpty()) {
            log.error("No backup of {} older than {}, nothing to roll back to", name, now);
            return DeploymentResult.failed(name,
                    FailureInfo.of(ErrorType.BACKUP_FAILURE, "No backup found for " + name, "rollback"));
        }
        Backup backup = target.get();
        log.info("Rolling back {} to backup {} ({})", name, backup.capturedAt(), backup.handle().location());
        return executor.restore(runId, device, backup.text());
    }

    public List<DeploymentResult> rollback(Collection<DeviceIntent> devices) {
        DeploymentPlan order = planner.plan(devices).reverse();
        String runId = UUID.randomUUID().toString();
        MDC.put("runId", runId);
        try {
            List<DeploymentResult> results = new ArrayList<>();
            String failedDevice = null;
            for (DeviceIntent device : order.devices()) {
                if (failedDevice != null) {
                    results.add(DeploymentResult.skipped(device.getName(), "halted after rollback failure on " + failedDevice));
                    continue;
                }
                DeploymentResult result = rollback(runId, device);
                results.add(result);
                if (result.isFailed()) {
                    failedDevice = device.getName();
                }
            }
            return results;
        } finally {
            MDC.remove("runId");
        }
    }
}
