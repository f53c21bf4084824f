package xyz.firestige.netdeploy.application.validation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import xyz.firestige.netdeploy.application.validation.checks.BgpSessionCheck;
import xyz.firestige.netdeploy.application.validation.checks.DeviceCheck;
import xyz.firestige.netdeploy.application.validation.checks.InterfaceStatusCheck;
import xyz.firestige.netdeploy.application.validation.checks.LdpNeighborCheck;
import xyz.firestige.netdeploy.application.validation.checks.OspfAdjacencyCheck;
import xyz.firestige.netdeploy.application.validation.checks.ReachabilityCheck;
import xyz.firestige.netdeploy.application.validation.checks.VrfPresenceCheck;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.domain.validation.ValidationStatus;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceWorkerPool;
import xyz.firestige.netdeploy.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.netdeploy.infrastructure.parser.StateFileOutputParser;
import xyz.firestige.netdeploy.infrastructure.session.DirectorySessionProvider;
import xyz.firestige.netdeploy.testutil.IntentFixtures;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ValidationRunner + 六项检查，基于离线实验目录（running-config.cfg / state.yaml）
 */
@DisplayName("部署前后校验 测试")
class ValidationRunnerTest {

    @TempDir
    Path lab;

    private DeviceWorkerPool pool;
    private DeviceOperationGuard guard;
    private ValidationRunner runner;

    @BeforeEach
    void setUp() {
        pool = new DeviceWorkerPool(4, 64);
        guard = new DeviceOperationGuard(Duration.ofSeconds(2));
        StateFileOutputParser parser = new StateFileOutputParser(lab);
        List<DeviceCheck> checks = List.of(
                new ReachabilityCheck(new DirectorySessionProvider(lab), guard),
                new InterfaceStatusCheck(parser, guard),
                new OspfAdjacencyCheck(parser, guard),
                new BgpSessionCheck(parser, guard),
                new LdpNeighborCheck(parser, guard),
                new VrfPresenceCheck(parser, guard));
        runner = new ValidationRunner(checks, pool, new NoopMetricsRegistry(), ValidationRunner.defaultPhaseCategories());
    }

    @AfterEach
    void tearDown() {
        pool.close();
        guard.close();
    }

    private void state(String device, String yaml) throws IOException {
        Path dir = Files.createDirectories(lab.resolve(device));
        if (yaml != null) {
            Files.writeString(dir.resolve("state.yaml"), yaml);
        }
    }

    private static ValidationStatus statusOf(List<ValidationResult> results, String device, CheckCategory category) {
        return results.stream()
                .filter(r -> r.device().equals(device) && r.category() == category)
                .map(ValidationResult::status)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("场景 - 健康的 PE：全部检查通过")
    void healthyDevicePasses() throws IOException {
        // Given
        DeviceIntent edge = IntentFixtures.edge("EDGE1", "10.255.1.11", List.of("STAFF-NET", "STUDENT-NET"));
        state("EDGE1", """
                interfaces:
                  - {name: GigabitEthernet2, state: up/up}
                ospf:
                  - {name: 10.255.0.1, state: FULL/DR}
                bgp:
                  - {name: 10.255.0.1, state: Established}
                mpls_ldp:
                  - {name: 10.255.0.1, state: Oper}
                vrf:
                  - {name: STAFF-NET, state: present}
                  - {name: STUDENT-NET, state: present}
                """);

        // When
        List<ValidationResult> results = runner.runChecks(List.of(edge), ValidationPhase.POST);

        // Then
        assertThat(results).hasSize(6);
        assertThat(results).extracting(ValidationResult::status).containsOnly(ValidationStatus.PASS);
        assertThat(results).extracting(ValidationResult::category).containsExactly(CheckCategory.values());
    }

    @Test
    @DisplayName("场景 - 接口 down、BGP Idle、缺 VRF 判为 FAIL，未配置的协议判为 SKIP")
    void failuresAndSkipsClassified() throws IOException {
        // Given
        DeviceIntent edge = IntentFixtures.edge("EDGE1", "10.255.1.11", List.of("STAFF-NET", "STUDENT-NET"));
        state("EDGE1", """
                interfaces:
                  - {name: GigabitEthernet2, state: up/down}
                bgp:
                  - {name: 10.255.0.1, state: Idle}
                vrf:
                  - {name: STAFF-NET, state: present}
                """);

        // When
        List<ValidationResult> results = runner.runChecks(List.of(edge), ValidationPhase.POST);

        // Then
        assertThat(statusOf(results, "EDGE1", CheckCategory.REACHABILITY)).isEqualTo(ValidationStatus.PASS);
        assertThat(statusOf(results, "EDGE1", CheckCategory.INTERFACES)).isEqualTo(ValidationStatus.FAIL);
        assertThat(statusOf(results, "EDGE1", CheckCategory.OSPF)).isEqualTo(ValidationStatus.SKIP);
        assertThat(statusOf(results, "EDGE1", CheckCategory.BGP)).isEqualTo(ValidationStatus.FAIL);
        assertThat(statusOf(results, "EDGE1", CheckCategory.MPLS_LDP)).isEqualTo(ValidationStatus.SKIP);
        assertThat(statusOf(results, "EDGE1", CheckCategory.VRF)).isEqualTo(ValidationStatus.FAIL);
        assertThat(results.stream().filter(r -> r.category() == CheckCategory.VRF).findFirst().orElseThrow().detail())
                .contains("STUDENT-NET");
    }

    @Test
    @DisplayName("场景 - 不可达设备只影响自身，状态文件缺失判为 SKIP")
    void unreachableDeviceIsolated() throws IOException {
        // Given
        DeviceIntent down = IntentFixtures.core("CORE9", "10.255.0.9");
        DeviceIntent up = IntentFixtures.core("CORE1", "10.255.0.1");
        state("CORE1", null);

        // When
        List<ValidationResult> results = runner.runChecks(List.of(down, up), ValidationPhase.PRE);

        // Then
        assertThat(results).extracting(ValidationResult::device).containsExactly("CORE9", "CORE9", "CORE1", "CORE1");
        assertThat(statusOf(results, "CORE9", CheckCategory.REACHABILITY)).isEqualTo(ValidationStatus.FAIL);
        assertThat(statusOf(results, "CORE9", CheckCategory.INTERFACES)).isEqualTo(ValidationStatus.FAIL);
        assertThat(statusOf(results, "CORE1", CheckCategory.REACHABILITY)).isEqualTo(ValidationStatus.PASS);
        assertThat(statusOf(results, "CORE1", CheckCategory.INTERFACES)).isEqualTo(ValidationStatus.SKIP);
    }

    @Test
    @DisplayName("场景 - 意图未声明的特性直接 SKIP")
    void featuresAbsentFromIntentAreSkipped() throws IOException {
        // Given
        DeviceIntent bare = IntentFixtures.device("R1", 0);
        state("R1", "interfaces: []\n");

        // When
        List<ValidationResult> results = runner.runChecks(List.of(bare), ValidationPhase.POST);

        // Then
        assertThat(statusOf(results, "R1", CheckCategory.INTERFACES)).isEqualTo(ValidationStatus.SKIP);
        assertThat(statusOf(results, "R1", CheckCategory.BGP)).isEqualTo(ValidationStatus.SKIP);
        assertThat(statusOf(results, "R1", CheckCategory.VRF)).isEqualTo(ValidationStatus.SKIP);
    }

    @Test
    @DisplayName("场景 - 检查自身抛出异常时转换为 FAIL")
    void crashingCheckBecomesFail() {
        // Given
        DeviceCheck crashing = new DeviceCheck() {
            @Override
            public String getName() {
                return "crashing";
            }

            @Override
            public CheckCategory getCategory() {
                return CheckCategory.OSPF;
            }

            @Override
            public ValidationResult run(DeviceIntent device, ValidationPhase phase) {
                throw new IllegalStateException("boom");
            }
        };
        ValidationRunner crashingRunner = new ValidationRunner(List.of(crashing), pool, new NoopMetricsRegistry(),
                ValidationRunner.defaultPhaseCategories());

        // When
        List<ValidationResult> results = crashingRunner.runChecks(List.of(IntentFixtures.device("R1", 0)), ValidationPhase.POST);

        // Then
        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(ValidationStatus.FAIL);
            assertThat(r.detail()).contains("boom");
        });
    }
}
