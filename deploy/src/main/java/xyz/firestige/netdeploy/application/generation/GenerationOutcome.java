package xyz.firestige.netdeploy.application.generation;

import xyz.firestige.netdeploy.domain.config.GeneratedConfig;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;

import java.util.Optional;

/**
 * 单台设备的生成结果：要么有渲染文本，要么有跳过原因
 */
public final class GenerationOutcome {

    private final String device;
    private final GeneratedConfig config;
    private final FailureInfo failureInfo;

    private GenerationOutcome(String device, GeneratedConfig config, FailureInfo failureInfo) {
        this.device = device;
        this.config = config;
        this.failureInfo = failureInfo;
    }

    public static GenerationOutcome generated(GeneratedConfig config) {
        return new GenerationOutcome(config.device(), config, null);
    }

    public static GenerationOutcome skipped(String device, FailureInfo failureInfo) {
        return new GenerationOutcome(device, null, failureInfo);
    }

    public String getDevice() {
        return device;
    }

    public boolean isGenerated() {
        return config != null;
    }

    public Optional<GeneratedConfig> getConfig() {
        return Optional.ofNullable(config);
    }

    public Optional<FailureInfo> getFailureInfo() {
        return Optional.ofNullable(failureInfo);
    }

    @Override
    public String toString() {
        return isGenerated()
                ? "GenerationOutcome{device='" + device + "', generated}"
                : "GenerationOutcome{device='" + device + "', skipped=" + failureInfo.getErrorType() + "}";
    }
}
