package xyz.firestige.netdeploy.application.preview;

import xyz.firestige.netdeploy.domain.diff.ConfigDiff;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;

import java.util.Optional;

/**
 * 预览阶段单台设备的差异；抓取失败时只有 failureInfo
 */
public record DiffPreview(String device, ConfigDiff diff, FailureInfo failureInfo) {

    public static DiffPreview of(String device, ConfigDiff diff) {
        return new DiffPreview(device, diff, null);
    }

    public static DiffPreview failed(String device, FailureInfo failureInfo) {
        return new DiffPreview(device, null, failureInfo);
    }

    public boolean isFailed() {
        return failureInfo != null;
    }

    public Optional<ConfigDiff> getDiff() {
        return Optional.ofNullable(diff);
    }
}
