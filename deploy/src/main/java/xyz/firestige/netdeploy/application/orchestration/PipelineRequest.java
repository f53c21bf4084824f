package xyz.firestige.netdeploy.application.orchestration;

import java.util.List;

/**
 * @param devices 限定的设备名，空表示全部设备
 * @param dryRun  只预览不下发
 */
public record PipelineRequest(List<String> devices, boolean dryRun) {

    public PipelineRequest {
        devices = devices == null ? List.of() : List.copyOf(devices);
    }

    public static PipelineRequest all() {
        return new PipelineRequest(List.of(), false);
    }
}
