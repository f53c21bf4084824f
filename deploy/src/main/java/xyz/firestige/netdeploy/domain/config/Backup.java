package xyz.firestige.netdeploy.domain.config;

import java.time.Instant;

/**
 * 下发前抓取的现网配置快照，只追加、不覆盖、不删除。
 */
public record Backup(String device, String text, Instant capturedAt, BackupHandle handle) {
}
