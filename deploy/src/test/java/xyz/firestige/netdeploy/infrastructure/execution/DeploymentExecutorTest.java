package xyz.firestige.netdeploy.infrastructure.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.netdeploy.domain.config.Backup;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.deployment.DeploymentStatus;
import xyz.firestige.netdeploy.domain.diff.LineSetDiffEngine;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ErrorType;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.netdeploy.infrastructure.store.InMemoryConfigStore;
import xyz.firestige.netdeploy.testutil.FakeSessionProvider;
import xyz.firestige.netdeploy.testutil.TickingClock;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static xyz.firestige.netdeploy.testutil.IntentFixtures.device;

/**
 * DeploymentExecutor 测试
 * <p>
 * 重点：备份先于下发、备份失败绝不下发、dry-run 只读、单设备超时不拖累其他设备
 */
@DisplayName("单设备部署执行器 测试")
class DeploymentExecutorTest {

    private static final String LIVE = "hostname R1\nip domain name old.example\n";
    private static final String DESIRED = "! generated\nhostname R1\n\nip domain name new.example\nend\n";

    private TickingClock clock;
    private FakeSessionProvider sessions;
    private InMemoryConfigStore store;
    private DeviceOperationGuard guard;

    @BeforeEach
    void setUp() {
        clock = TickingClock.startingAt("2024-05-01T10:00:00Z");
        sessions = new FakeSessionProvider(clock).withRunning("R1", LIVE).withRunning("R2", LIVE);
        store = new InMemoryConfigStore(clock);
        guard = new DeviceOperationGuard(Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        guard.close();
    }

    private DeploymentExecutor executor(ConfigStore configStore, DeviceOperationGuard operationGuard) {
        return new DeploymentExecutor(sessions, configStore, new LineSetDiffEngine(), operationGuard,
                new NoopMetricsRegistry(), clock);
    }

    @Test
    @DisplayName("场景 - 成功下发：先备份现网，再推送去掉注释的期望配置并持久化")
    void appliesAfterBackup() {
        // Given
        DeviceIntent r1 = device("R1", 0);

        // When
        DeploymentResult result = executor(store, guard).apply(r1, DESIRED, false);

        // Then
        assertThat(result.getStatus()).isEqualTo(DeploymentStatus.APPLIED);
        assertThat(result.getDiff()).hasValueSatisfying(diff -> {
            assertThat(diff.getLinesToAdd()).containsExactly("end", "ip domain name new.example");
            assertThat(diff.getLinesToRemove()).containsExactly("ip domain name old.example");
        });
        assertThat(store.latestBackup("R1")).map(Backup::text).contains(LIVE);
        assertThat(sessions.applyCalls()).singleElement().satisfies(call -> {
            assertThat(call.text()).isEqualTo("hostname R1\nip domain name new.example\n");
            assertThat(call.at()).isAfter(result.getBackupAt().orElseThrow());
        });
        assertThat(result.getApplyAttemptAt().orElseThrow()).isAfter(result.getBackupAt().orElseThrow());
        assertThat(sessions.persisted()).containsExactly("R1");
    }

    @Test
    @DisplayName("场景 - 备份失败：结果 FAILED(BACKUP_FAILURE)，从未调用 apply")
    void backupFailurePreventsApply() {
        // Given
        ConfigStore broken = mock(ConfigStore.class);
        when(broken.backup(anyString(), anyString())).thenThrow(new IllegalStateException("disk full"));

        // When
        DeploymentResult result = executor(broken, guard).apply(device("R1", 0), DESIRED, false);

        // Then
        assertThat(result.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(result.getFailureInfo()).map(FailureInfo::getErrorType).contains(ErrorType.BACKUP_FAILURE);
        assertThat(result.getFailureInfo()).map(FailureInfo::getFailedAt).contains("backup");
        assertThat(result.getApplyAttemptAt()).isEmpty();
        assertThat(sessions.applyCalls()).isEmpty();
    }

    @Test
    @DisplayName("场景 - dry-run：计算差异并备份，但不下发")
    void dryRunNeverApplies() {
        // When
        DeploymentResult result = executor(store, guard).apply(device("R1", 0), DESIRED, true);

        // Then
        assertThat(result.getStatus()).isEqualTo(DeploymentStatus.SKIPPED);
        assertThat(result.getSkipReason()).contains("dry-run");
        assertThat(result.getDiff()).isPresent();
        assertThat(store.listBackups("R1")).hasSize(1);
        assertThat(sessions.applyCalls()).isEmpty();
        assertThat(sessions.running("R1")).isEqualTo(LIVE);
    }

    @Test
    @DisplayName("场景 - 设备拒绝配置：FAILED(APPLY_REJECTED)，记录下发尝试时间")
    void rejectedApply() {
        // Given
        sessions.rejecting("R1", "% Invalid input detected");

        // When
        DeploymentResult result = executor(store, guard).apply(device("R1", 0), DESIRED, false);

        // Then
        assertThat(result.getStatus()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(result.getFailureInfo()).map(FailureInfo::getErrorType).contains(ErrorType.APPLY_REJECTED);
        assertThat(result.getFailureInfo()).map(FailureInfo::getErrorMessage).hasValueSatisfying(
                m -> assertThat(m).contains("Invalid input"));
        assertThat(result.getApplyAttemptAt()).isPresent();
        assertThat(sessions.persisted()).isEmpty();
    }

    @Test
    @DisplayName("场景 - 设备不可达：FAILED(SESSION_ERROR)，不产生备份")
    void unreachableDevice() {
        // Given
        sessions.unreachable("R1");

        // When
        DeploymentResult result = executor(store, guard).apply(device("R1", 0), DESIRED, false);

        // Then
        assertThat(result.getFailureInfo()).map(FailureInfo::getErrorType).contains(ErrorType.SESSION_ERROR);
        assertThat(result.getFailureInfo()).map(FailureInfo::getFailedAt).contains("connect");
        assertThat(store.listBackups("R1")).isEmpty();
    }

    @Test
    @DisplayName("场景 - 单设备操作超时只影响该设备")
    void timeoutIsolatedToDevice() {
        // Given
        DeviceOperationGuard shortGuard = new DeviceOperationGuard(Duration.ofMillis(200));
        sessions.slowCapture("R1", 5_000);
        DeploymentExecutor executor = executor(store, shortGuard);

        try {
            // When
            DeploymentResult slow = executor.apply(device("R1", 0), DESIRED, false);
            DeploymentResult healthy = executor.apply(device("R2", 0), DESIRED.replace("R1", "R2"), false);

            // Then
            assertThat(slow.getFailureInfo()).map(FailureInfo::getErrorType).contains(ErrorType.SESSION_ERROR);
            assertThat(slow.getFailureInfo()).map(FailureInfo::getErrorMessage).hasValueSatisfying(
                    m -> assertThat(m).contains("timed out"));
            assertThat(healthy.getStatus()).isEqualTo(DeploymentStatus.APPLIED);
            assertThat(sessions.appliedDevices()).containsExactly("R2");
        } finally {
            shortGuard.close();
        }
    }

    @Test
    @DisplayName("场景 - 设备不支持持久化时跳过 persist，仍为 APPLIED")
    void persistSkippedWhenUnsupported() {
        // Given
        sessions.withoutPersist("R1");

        // When
        DeploymentResult result = executor(store, guard).apply(device("R1", 0), DESIRED, false);

        // Then
        assertThat(result.getStatus()).isEqualTo(DeploymentStatus.APPLIED);
        assertThat(sessions.persisted()).isEmpty();
    }

    @Test
    @DisplayName("场景 - 恢复备份时原样推送，并先备份当前现网")
    void restorePushesBackupVerbatim() {
        // Given
        String backupText = "!\nhostname R1\nip domain name old.example\nend\n";
        sessions.withRunning("R1", "hostname R1\nip domain name broken.example\n");

        // When
        DeploymentResult result = executor(store, guard).restore("run-1", device("R1", 0), backupText);

        // Then
        assertThat(result.getStatus()).isEqualTo(DeploymentStatus.APPLIED);
        assertThat(sessions.running("R1")).isEqualTo(backupText);
        assertThat(store.latestBackup("R1")).map(Backup::text).contains("hostname R1\nip domain name broken.example\n");
    }
}
