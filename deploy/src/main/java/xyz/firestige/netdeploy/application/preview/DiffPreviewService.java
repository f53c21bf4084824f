package xyz.firestige.netdeploy.application.preview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.netdeploy.domain.config.GeneratedConfig;
import xyz.firestige.netdeploy.domain.diff.ConfigDiff;
import xyz.firestige.netdeploy.domain.diff.DiffEngine;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.shared.exception.NetDeployException;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceWorkerPool;
import xyz.firestige.netdeploy.infrastructure.session.DeviceSession;
import xyz.firestige.netdeploy.infrastructure.session.SessionProvider;

import java.util.Collection;
import java.util.List;

/**
 * 差异预览
 * <p>
 * 并行抓取现网配置，与生成结果比较。只读，从不修改设备或存储；每次都重新抓取，差异不缓存。
 */
public class DiffPreviewService {

    private static final Logger log = LoggerFactory.getLogger(DiffPreviewService.class);

    private final IntentRepository intents;
    private final SessionProvider sessionProvider;
    private final DeviceOperationGuard guard;
    private final DiffEngine diffEngine;
    private final DeviceWorkerPool workerPool;

    public DiffPreviewService(IntentRepository intents,
                              SessionProvider sessionProvider,
                              DeviceOperationGuard guard,
                              DiffEngine diffEngine,
                              DeviceWorkerPool workerPool) {
        this.intents = intents;
        this.sessionProvider = sessionProvider;
        this.guard = guard;
        this.diffEngine = diffEngine;
        this.workerPool = workerPool;
    }

    public List<DiffPreview> preview(Collection<GeneratedConfig> configs) {
        List<DiffPreview> previews = workerPool.map(List.copyOf(configs), this::previewOne);
        previews.forEach(p -> {
            if (p.isFailed()) {
                log.warn("Preview {}: capture failed ({})", p.device(), p.failureInfo().getErrorMessage());
            } else {
                log.info("Preview {}: {}", p.device(), p.diff().isEmpty() ? "no changes" : p.diff().summary());
            }
        });
        return previews;
    }

    private DiffPreview previewOne(GeneratedConfig config) {
        MDC.put("device", config.device());
        MDC.put("step", "preview");
        try {
            String live = captureLive(intents.get(config.device()));
            ConfigDiff diff = diffEngine.diff(live, config.text());
            return DiffPreview.of(config.device(), diff);
        } catch (NetDeployException e) {
            return DiffPreview.failed(config.device(), FailureInfo.fromException(e, "preview"));
        } catch (RuntimeException e) {
            return DiffPreview.failed(config.device(), FailureInfo.fromException(e, ErrorType.SESSION_ERROR, "preview"));
        } finally {
            MDC.remove("device");
            MDC.remove("step");
        }
    }

    private String captureLive(DeviceIntent device) {
        String name = device.getName();
        DeviceSession session = guard.call(name, "connect", () -> sessionProvider.connect(device));
        try {
            String live = guard.call(name, "capture", session::capture);
            return live != null ? live : "";
        } finally {
            try {
                guard.run(name, "disconnect", session::disconnect);
            } catch (RuntimeException e) {
                log.warn("Disconnect from {} failed after preview capture: {}", name, e.getMessage());
            }
        }
    }
}
