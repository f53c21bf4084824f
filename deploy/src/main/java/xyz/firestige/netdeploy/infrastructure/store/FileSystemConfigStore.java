package xyz.firestige.netdeploy.infrastructure.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.shared.exception.BackupFailureException;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 文件系统配置存储
 * <pre>
 * {baseDir}/generated/{device}.cfg                        当前渲染结果（覆盖写）
 * {baseDir}/backups/{device}/{yyyyMMdd'T'HHmmss.SSS'Z'}.cfg  备份（CREATE_NEW，fsync 后返回）
 * </pre>
 * 同一毫秒内的后续备份保留采集时间，文件名追加序号（-0001），既不覆盖也不打乱时间顺序。
 */
public class FileSystemConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemConfigStore.class);

    private static final String EXTENSION = ".cfg";
    private static final int MAX_COLLISIONS = 1000;

    private final Path generatedDir;
    private final Path backupDir;
    private final Clock clock;

    public FileSystemConfigStore(Path baseDir, Clock clock) {
        this.generatedDir = baseDir.resolve("generated");
        this.backupDir = baseDir.resolve("backups");
        this.clock = clock;
    }

    @Override
    public void save(String device, String text) {
        Path target = generatedDir.resolve(DeviceNames.requireSafe(device) + EXTENSION);
        try {
            Files.createDirectories(generatedDir);
            Path tmp = Files.createTempFile(generatedDir, device, ".tmp");
            Files.writeString(tmp, text, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved generated config for {} -> {}", device, target);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot write generated config " + target, e);
        }
    }

    @Override
    public Optional<String> readCurrent(String device) {
        Path target = generatedDir.resolve(DeviceNames.requireSafe(device) + EXTENSION);
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read generated config " + target, e);
        }
    }

    @Override
    public BackupHandle backup(String device, String text) {
        Path dir = backupDir.resolve(DeviceNames.requireSafe(device));
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new BackupFailureException(device, "Cannot create backup directory " + dir + ": " + e.getMessage(), e);
        }
        Instant capturedAt = BackupTimestamps.truncate(clock.instant());
        for (int sequence = 0; sequence < MAX_COLLISIONS; sequence++) {
            Path file = dir.resolve(new BackupTimestamps.Stamp(capturedAt, sequence).fileName() + EXTENSION);
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
                log.info("Backup written for {} -> {} ({} bytes)", device, file, bytes.length);
                return new BackupHandle(device, capturedAt, file.toString());
            } catch (FileAlreadyExistsException e) {
                log.debug("Backup {} already exists, trying next sequence", file);
            } catch (IOException e) {
                throw new BackupFailureException(device, "Cannot write backup " + file + ": " + e.getMessage(), e);
            }
        }
        throw new BackupFailureException(device, "Too many backup timestamp collisions in " + dir);
    }

    @Override
    public Optional<Backup> latestBackup(String device) {
        List<BackupHandle> handles = listBackups(device);
        return handles.isEmpty() ? Optional.empty() : Optional.of(read(handles.get(handles.size() - 1)));
    }

    @Override
    public Optional<Backup> latestBackupBefore(String device, Instant instant) {
        return listBackups(device).stream()
                .filter(h -> h.capturedAt().isBefore(instant))
                .reduce((first, second) -> second)
                .map(this::read);
    }

    @Override
    public List<BackupHandle> listBackups(String device) {
        Path dir = backupDir.resolve(DeviceNames.requireSafe(device));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<StampedFile> found = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(file -> {
                String name = file.getFileName().toString();
                if (!name.endsWith(EXTENSION)) {
                    return;
                }
                BackupTimestamps.parseFileName(name.substring(0, name.length() - EXTENSION.length()))
                        .ifPresentOrElse(
                                stamp -> found.add(new StampedFile(stamp, file)),
                                () -> log.warn("Ignoring unrecognised file in backup directory: {}", file));
            });
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list backups in " + dir, e);
        }
        return found.stream()
                .sorted(Comparator.comparing(StampedFile::stamp, BackupTimestamps.Stamp.ORDER))
                .map(f -> new BackupHandle(device, f.stamp().capturedAt(), f.file().toString()))
                .toList();
    }

    private Backup read(BackupHandle handle) {
        try {
            String text = Files.readString(Path.of(handle.location()), StandardCharsets.UTF_8);
            return new Backup(handle.device(), text, handle.capturedAt(), handle);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read backup " + handle.location(), e);
        }
    }

    private record StampedFile(BackupTimestamps.Stamp stamp, Path file) {
    }
}
