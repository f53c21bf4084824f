package xyz.firestige.netdeploy.infrastructure.store;

import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.config.ConfigStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * 内存配置存储，用于测试与 dry-run 演示；进程退出后数据丢失。
 */
public class InMemoryConfigStore implements ConfigStore {

    private final Clock clock;
    private final Map<String, String> generated = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<BackupTimestamps.Stamp, Backup>> backups = new ConcurrentHashMap<>();

    public InMemoryConfigStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(String device, String text) {
        generated.put(device, text);
    }

    @Override
    public Optional<String> readCurrent(String device) {
        return Optional.ofNullable(generated.get(device));
    }

    @Override
    public BackupHandle backup(String device, String text) {
        NavigableMap<BackupTimestamps.Stamp, Backup> history =
                backups.computeIfAbsent(device, d -> new ConcurrentSkipListMap<>(BackupTimestamps.Stamp.ORDER));
        Instant capturedAt = BackupTimestamps.truncate(clock.instant());
        for (int sequence = 0; ; sequence++) {
            BackupTimestamps.Stamp stamp = new BackupTimestamps.Stamp(capturedAt, sequence);
            BackupHandle handle = new BackupHandle(device, capturedAt, "memory:" + device + "/" + stamp.fileName());
            if (history.putIfAbsent(stamp, new Backup(device, text, capturedAt, handle)) == null) {
                return handle;
            }
        }
    }

    @Override
    public Optional<Backup> latestBackup(String device) {
        NavigableMap<BackupTimestamps.Stamp, Backup> history = backups.get(device);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(history.lastEntry().getValue());
    }

    @Override
    public Optional<Backup> latestBackupBefore(String device, Instant instant) {
        NavigableMap<BackupTimestamps.Stamp, Backup> history = backups.get(device);
        if (history == null) {
            return Optional.empty();
        }
        // 序号 0 是该时刻最小的标识，lowerEntry 即严格早于 instant 的最新备份
        Map.Entry<BackupTimestamps.Stamp, Backup> entry = history.lowerEntry(new BackupTimestamps.Stamp(instant, 0));
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    @Override
    public List<BackupHandle> listBackups(String device) {
        NavigableMap<BackupTimestamps.Stamp, Backup> history = backups.get(device);
        if (history == null) {
            return List.of();
        }
        return history.values().stream().map(Backup::handle).toList();
    }
}
