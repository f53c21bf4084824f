package xyz.firestige.netdeploy.application.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.netdeploy.domain.config.ConfigRenderer;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.config.GeneratedConfig;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.shared.exception.NetDeployException;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceWorkerPool;
import xyz.firestige.netdeploy.infrastructure.metrics.MetricsRegistry;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * 配置生成服务
 * <p>
 * 并行渲染并保存每台设备的配置。单台设备的 TemplateRenderException / IntentNotFoundException
 * 或存储故障只会让该设备被跳过，不会中断整个阶段。
 */
public class ConfigGenerationService {

    private static final Logger log = LoggerFactory.getLogger(ConfigGenerationService.class);

    private final IntentRepository intents;
    private final ConfigRenderer renderer;
    private final ConfigStore store;
    private final DeviceWorkerPool workerPool;
    private final MetricsRegistry metrics;
    private final Clock clock;

    public ConfigGenerationService(IntentRepository intents,
                                   ConfigRenderer renderer,
                                   ConfigStore store,
                                   DeviceWorkerPool workerPool,
                                   MetricsRegistry metrics,
                                   Clock clock) {
        this.intents = intents;
        this.renderer = renderer;
        this.store = store;
        this.workerPool = workerPool;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<GenerationOutcome> generateAll() {
        return generate(intents.names());
    }

    /**
     * @param deviceNames 要生成的设备；不在意图库中的名字产生 INTENT_NOT_FOUND 跳过结果
     */
    public List<GenerationOutcome> generate(Collection<String> deviceNames) {
        List<String> names = List.copyOf(deviceNames);
        log.info("Generating configuration for {} devices", names.size());
        List<GenerationOutcome> outcomes = workerPool.map(names, this::generateOne);
        long generated = outcomes.stream().filter(GenerationOutcome::isGenerated).count();
        log.info("Generation finished: generated={}, skipped={}", generated, outcomes.size() - generated);
        metrics.setGauge("netdeploy.generate.skipped", outcomes.size() - generated);
        return outcomes;
    }

    private GenerationOutcome generateOne(String name) {
        MDC.put("device", name);
        MDC.put("step", "generate");
        try {
            DeviceIntent intent = intents.get(name);
            String text = renderer.render(intent);
            store.save(name, text);
            metrics.incrementCounter("netdeploy.generate.result", "status", "GENERATED");
            log.debug("Generated {} ({} chars)", name, text.length());
            return GenerationOutcome.generated(new GeneratedConfig(name, text, clock.instant()));
        } catch (NetDeployException e) {
            log.warn("Skipping {}: {} - {}", name, e.getErrorType(), e.getMessage());
            metrics.incrementCounter("netdeploy.generate.result", "status", "SKIPPED");
            return GenerationOutcome.skipped(name, FailureInfo.fromException(e, "generate"));
        } catch (RuntimeException e) {
            log.error("Skipping {}: unexpected failure during generation", name, e);
            metrics.incrementCounter("netdeploy.generate.result", "status", "SKIPPED");
            return GenerationOutcome.skipped(name,
                    FailureInfo.fromException(e, ErrorType.CONFIGURATION_ERROR, "generate"));
        } finally {
            MDC.remove("device");
            MDC.remove("step");
        }
    }
}
