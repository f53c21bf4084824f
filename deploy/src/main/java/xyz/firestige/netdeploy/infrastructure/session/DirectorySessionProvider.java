package xyz.firestige.netdeploy.infrastructure.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ApplyRejectedException;
import xyz.firestige.netdeploy.domain.shared.exception.SessionException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 目录模拟的设备会话，用于实验室/离线环境。
 * <pre>
 * {root}/{device}/running-config.cfg   现网配置；apply 以替换语义写入
 * {root}/{device}/startup-config.cfg   persist 的目标
 * {root}/{device}/REJECT               存在时 apply 被拒绝，文件内容作为拒绝原因
 * </pre>
 * 设备目录不存在视为设备不可达。
 */
public class DirectorySessionProvider implements SessionProvider {

    private static final Logger log = LoggerFactory.getLogger(DirectorySessionProvider.class);

    static final String RUNNING = "running-config.cfg";
    static final String STARTUP = "startup-config.cfg";
    static final String REJECT = "REJECT";

    private final Path root;

    public DirectorySessionProvider(Path root) {
        this.root = root;
    }

    @Override
    public DeviceSession connect(DeviceIntent device) {
        Path dir = root.resolve(device.getName());
        if (!Files.isDirectory(dir)) {
            throw new SessionException("Device " + device.getName() + " unreachable: no lab directory " + dir);
        }
        log.debug("Opened lab session for {} at {}", device.getName(), dir);
        return new DirectorySession(device.getName(), dir);
    }

    static final class DirectorySession implements DeviceSession {

        private final String device;
        private final Path dir;
        private boolean open = true;

        DirectorySession(String device, Path dir) {
            this.device = device;
            this.dir = dir;
        }

        @Override
        public String capture() {
            ensureOpen();
            Path running = dir.resolve(RUNNING);
            try {
                return Files.exists(running) ? Files.readString(running, StandardCharsets.UTF_8) : "";
            } catch (IOException e) {
                throw new SessionException("Cannot read running config of " + device + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void apply(String text) {
            ensureOpen();
            Path reject = dir.resolve(REJECT);
            try {
                if (Files.exists(reject)) {
                    String reason = Files.readString(reject, StandardCharsets.UTF_8).strip();
                    throw new ApplyRejectedException("Device " + device + " rejected configuration: "
                            + (reason.isEmpty() ? "% Invalid input detected" : reason));
                }
                Files.writeString(dir.resolve(RUNNING), text, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new SessionException("Cannot write running config of " + device + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void persist() {
            ensureOpen();
            try {
                Files.copy(dir.resolve(RUNNING), dir.resolve(STARTUP), StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                throw new SessionException("Cannot persist startup config of " + device + ": " + e.getMessage(), e);
            }
        }

        @Override
        public boolean supportsPersist() {
            return true;
        }

        @Override
        public void disconnect() {
            open = false;
        }

        private void ensureOpen() {
            if (!open) {
                throw new SessionException("Session to " + device + " already closed");
            }
        }
    }
}
