package xyz.firestige.netdeploy.domain.config;

import java.time.Instant;

/**
 * 备份定位信息
 *
 * @param location 存储相关的位置描述（文件路径或 Redis key）
 */
public record BackupHandle(String device, Instant capturedAt, String location) {
}
