package xyz.firestige.netdeploy.application.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.shared.exception.NetDeployException;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceWorkerPool;
import xyz.firestige.netdeploy.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.netdeploy.infrastructure.session.DeviceSession;
import xyz.firestige.netdeploy.infrastructure.session.SessionProvider;

import java.util.Collection;
import java.util.List;

/**
 * 批量备份：并行抓取现网配置并写入备份，与部署无关的独立操作
 */
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final SessionProvider sessionProvider;
    private final DeviceOperationGuard guard;
    private final ConfigStore store;
    private final DeviceWorkerPool workerPool;
    private final MetricsRegistry metrics;

    public BackupService(SessionProvider sessionProvider,
                         DeviceOperationGuard guard,
                         ConfigStore store,
                         DeviceWorkerPool workerPool,
                         MetricsRegistry metrics) {
        this.sessionProvider = sessionProvider;
        this.guard = guard;
        this.store = store;
        this.workerPool = workerPool;
        this.metrics = metrics;
    }

    public List<BackupOutcome> backupAll(Collection<DeviceIntent> devices) {
        log.info("Backing up {} devices", devices.size());
        List<BackupOutcome> outcomes = workerPool.map(List.copyOf(devices), this::backupOne);
        long failed = outcomes.stream().filter(BackupOutcome::isFailed).count();
        log.info("Backup finished: ok={}, failed={}", outcomes.size() - failed, failed);
        return outcomes;
    }

    private BackupOutcome backupOne(DeviceIntent device) {
        String name = device.getName();
        MDC.put("device", name);
        MDC.put("step", "backup");
        try {
            DeviceSession session = guard.call(name, "connect", () -> sessionProvider.connect(device));
            String live;
            try {
                live = guard.call(name, "capture", session::capture);
            } finally {
                disconnect(name, session);
            }
            BackupHandle handle = store.backup(name, live != null ? live : "");
            metrics.incrementCounter("netdeploy.backup.result", "status", "OK");
            return new BackupOutcome(name, handle, null);
        } catch (NetDeployException e) {
            log.error("Backup of {} failed: {}", name, e.getMessage());
            metrics.incrementCounter("netdeploy.backup.result", "status", "FAILED");
            return new BackupOutcome(name, null, FailureInfo.fromException(e, "backup"));
        } catch (RuntimeException e) {
            log.error("Backup of {} failed", name, e);
            metrics.incrementCounter("netdeploy.backup.result", "status", "FAILED");
            return new BackupOutcome(name, null, FailureInfo.fromException(e, ErrorType.SESSION_ERROR, "backup"));
        } finally {
            MDC.remove("device");
            MDC.remove("step");
        }
    }

    private void disconnect(String name, DeviceSession session) {
        try {
            guard.run(name, "disconnect", session::disconnect);
        } catch (RuntimeException e) {
            log.warn("Disconnect from {} failed after backup capture: {}", name, e.getMessage());
        }
    }
}
