package xyz.firestige.netdeploy.domain.config;

import java.time.Instant;

/**
 * 渲染产物。每次运行每台设备一份，重新生成时覆盖，不做版本化。
 */
public record GeneratedConfig(String device, String text, Instant generatedAt) {
}
