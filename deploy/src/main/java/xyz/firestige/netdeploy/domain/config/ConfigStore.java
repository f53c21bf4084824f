package xyz.firestige.netdeploy.domain.config;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 配置存储
 * <p>
 * 职责：
 * 1. 保存每台设备当前的渲染结果（覆盖写）
 * 2. 保存按 设备+时间戳 寻址的备份（只追加，永不覆盖）
 * <p>
 * 不同设备的写入互不干扰；同一设备的并发备份由调用方保证不会发生。
 */
public interface ConfigStore {

    void save(String device, String text);

    Optional<String> readCurrent(String device);

    /**
     * 持久化一份备份，返回前数据必须已落盘/落库。
     *
     * @throws xyz.firestige.netdeploy.domain.shared.exception.BackupFailureException 写入失败
     */
    BackupHandle backup(String device, String text);

    Optional<Backup> latestBackup(String device);

    /**
     * 严格早于 instant 的最新备份
     */
    Optional<Backup> latestBackupBefore(String device, Instant instant);

    /**
     * 按抓取时间升序
     */
    List<BackupHandle> listBackups(String device);
}
