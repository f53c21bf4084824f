package xyz.firestige.netdeploy.infrastructure.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.netdeploy.domain.shared.exception.ApplyRejectedException;
import xyz.firestige.netdeploy.domain.shared.exception.SessionException;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static xyz.firestige.netdeploy.testutil.IntentFixtures.device;

@DisplayName("实验目录会话 测试")
class DirectorySessionProviderTest {

    @TempDir
    Path lab;

    @Test
    @DisplayName("场景 - capture/apply/persist 读写 running 与 startup 文件")
    void captureApplyPersist() throws Exception {
        // Given
        Path dir = Files.createDirectories(lab.resolve("R1"));
        Files.writeString(dir.resolve("running-config.cfg"), "hostname OLD\n");
        DeviceSession session = new DirectorySessionProvider(lab).connect(device("R1", 0));

        // When
        String before = session.capture();
        session.apply("hostname R1\n");
        session.persist();

        // Then
        assertThat(before).isEqualTo("hostname OLD\n");
        assertThat(Files.readString(dir.resolve("running-config.cfg"))).isEqualTo("hostname R1\n");
        assertThat(Files.readString(dir.resolve("startup-config.cfg"))).isEqualTo("hostname R1\n");
        assertThat(session.supportsPersist()).isTrue();
    }

    @Test
    @DisplayName("场景 - 设备目录不存在视为不可达")
    void missingDirectoryIsUnreachable() {
        assertThatThrownBy(() -> new DirectorySessionProvider(lab).connect(device("R9", 0)))
                .isInstanceOf(SessionException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    @DisplayName("场景 - REJECT 文件存在时 apply 被拒绝且现网不变")
    void rejectFileRejectsApply() throws Exception {
        // Given
        Path dir = Files.createDirectories(lab.resolve("R1"));
        Files.writeString(dir.resolve("running-config.cfg"), "hostname OLD\n");
        Files.writeString(dir.resolve("REJECT"), "% Invalid input detected at '^' marker.\n");
        DeviceSession session = new DirectorySessionProvider(lab).connect(device("R1", 0));

        // Then
        assertThatThrownBy(() -> session.apply("hostname R1\n"))
                .isInstanceOf(ApplyRejectedException.class)
                .hasMessageContaining("Invalid input");
        assertThat(Files.readString(dir.resolve("running-config.cfg"))).isEqualTo("hostname OLD\n");
    }

    @Test
    @DisplayName("场景 - 断开后的会话不可再使用")
    void closedSessionRejectsOperations() throws Exception {
        // Given
        Files.createDirectories(lab.resolve("R1"));
        DeviceSession session = new DirectorySessionProvider(lab).connect(device("R1", 0));

        // When
        session.disconnect();

        // Then
        assertThatThrownBy(session::capture).isInstanceOf(SessionException.class);
    }
}
