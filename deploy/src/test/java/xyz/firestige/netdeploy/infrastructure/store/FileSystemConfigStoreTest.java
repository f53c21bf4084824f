package xyz.firestige.netdeploy.infrastructure.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;
import xyz.firestige.netdeploy.testutil.TickingClock;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 文件系统配置存储测试
 */
@DisplayName("文件系统配置存储 测试")
class FileSystemConfigStoreTest {

    @TempDir
    Path baseDir;

    @Test
    @DisplayName("场景 - 生成配置覆盖写，可读回")
    void saveOverwritesGeneratedConfig() {
        // Given
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir, Clock.systemUTC());

        // When
        store.save("R1", "hostname R1\n");
        store.save("R1", "hostname R1\nip domain name x\n");

        // Then
        assertThat(store.readCurrent("R1")).contains("hostname R1\nip domain name x\n");
        assertThat(store.readCurrent("R2")).isEmpty();
        assertThat(baseDir.resolve("generated/R1.cfg")).exists();
    }

    @Test
    @DisplayName("场景 - 备份按时间戳命名且内容逐字节保留")
    void backupPreservesBytes() throws Exception {
        // Given
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir,
                Clock.fixed(Instant.parse("2024-01-31T23:59:59.123456Z"), ZoneOffset.UTC));
        String text = "Building configuration...\r\nhostname R1 \r\n! ünïcode\r\n";

        // When
        BackupHandle handle = store.backup("R1", text);

        // Then
        assertThat(handle.capturedAt()).isEqualTo(Instant.parse("2024-01-31T23:59:59.123Z"));
        assertThat(Path.of(handle.location()).getFileName().toString()).isEqualTo("20240131T235959.123Z.cfg");
        assertThat(Files.readAllBytes(Path.of(handle.location()))).isEqualTo(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("场景 - 同一毫秒的两份备份互不覆盖，保留真实采集时间并追加序号")
    void sameMillisecondBackupsDoNotCollide() {
        // Given
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir, Clock.fixed(now, ZoneOffset.UTC));

        // When
        BackupHandle first = store.backup("R1", "v1");
        BackupHandle second = store.backup("R1", "v2");

        // Then
        assertThat(first.capturedAt()).isEqualTo(now);
        assertThat(second.capturedAt()).isEqualTo(now);
        assertThat(Path.of(second.location()).getFileName().toString()).isEqualTo("20240501T100000.000Z-0001.cfg");
        assertThat(store.listBackups("R1")).extracting(BackupHandle::location)
                .containsExactly(first.location(), second.location());
        assertThat(store.latestBackup("R1")).map(Backup::text).contains("v2");
    }

    @Test
    @DisplayName("场景 - 同一毫秒两份备份后，回滚选中的是最新那一份")
    void rollbackChoiceAfterSameMillisecondBackupsIsNewest() {
        // Given
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir, Clock.fixed(now, ZoneOffset.UTC));
        store.backup("R1", "v1");
        store.backup("R1", "v2");

        // When
        Optional<Backup> chosen = store.latestBackupBefore("R1", now.plusMillis(1));

        // Then
        assertThat(chosen).map(Backup::text).contains("v2");
        assertThat(store.latestBackupBefore("R1", now)).isEmpty();
    }

    @Test
    @DisplayName("场景 - 取严格早于指定时刻的最新备份")
    void latestBackupBeforeIsStrict() {
        // Given
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir, TickingClock.startingAt("2024-05-01T10:00:00Z"));
        BackupHandle first = store.backup("R1", "v1");
        BackupHandle second = store.backup("R1", "v2");

        // When
        Optional<Backup> beforeSecond = store.latestBackupBefore("R1", second.capturedAt());
        Optional<Backup> beforeFirst = store.latestBackupBefore("R1", first.capturedAt());

        // Then
        assertThat(beforeSecond).map(Backup::text).contains("v1");
        assertThat(beforeFirst).isEmpty();
        assertThat(store.latestBackup("R2")).isEmpty();
    }

    @Test
    @DisplayName("场景 - 备份目录中的无关文件被忽略")
    void unrelatedFilesIgnored() throws Exception {
        // Given
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir, Clock.systemUTC());
        store.backup("R1", "v1");
        Files.writeString(baseDir.resolve("backups/R1/notes.cfg"), "x");

        // Then
        assertThat(store.listBackups("R1")).hasSize(1);
    }

    @Test
    @DisplayName("场景 - 含路径分隔符的设备名被拒绝")
    void unsafeDeviceNameRejected() {
        // Given
        FileSystemConfigStore store = new FileSystemConfigStore(baseDir, Clock.systemUTC());

        // Then
        assertThatThrownBy(() -> store.save("../etc", "x")).isInstanceOf(ConfigurationException.class);
    }
}
