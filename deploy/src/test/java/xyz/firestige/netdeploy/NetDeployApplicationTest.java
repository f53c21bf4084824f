package xyz.firestige.netdeploy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.ActiveProfiles;
import picocli.CommandLine;
import xyz.firestige.netdeploy.application.generation.ConfigGenerationService;
import xyz.firestige.netdeploy.application.generation.GenerationOutcome;
import xyz.firestige.netdeploy.application.orchestration.PipelineOrchestrator;
import xyz.firestige.netdeploy.application.orchestration.PipelineRequest;
import xyz.firestige.netdeploy.cli.NetDeployCommand;
import xyz.firestige.netdeploy.cli.SpringCommandFactory;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.pipeline.PipelinePhase;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.infrastructure.gate.ConfirmationGate;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.store.InMemoryConfigStore;
import xyz.firestige.netdeploy.testutil.FakeSessionProvider;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Spring 上下文集成测试：装配、生成、报告落盘、命令行
 * <p>
 * 设备会话替换为内存模拟，协议状态一律视为未配置，确认门默认拒绝，配置存储为内存模式。
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("应用装配 集成测试")
class NetDeployApplicationTest {

    @TestConfiguration
    static class LabOverrides {

        @Bean
        @Primary
        FakeSessionProvider fakeSessionProvider(Clock clock) {
            return new FakeSessionProvider(clock)
                    .withRunning("LAB-CORE1", "hostname LAB-CORE1\n")
                    .withRunning("LAB-EDGE1", "hostname LAB-EDGE1\n");
        }

        @Bean
        @Primary
        OutputParser quietParser() {
            return (device, category) -> Optional.empty();
        }

        @Bean
        @Primary
        ConfirmationGate denyingGate() {
            return ConfirmationGate.deny();
        }
    }

    @Autowired
    private ApplicationContext context;

    @Autowired
    private IntentRepository intents;

    @Autowired
    private ConfigStore store;

    @Autowired
    private ConfigGenerationService generationService;

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private FakeSessionProvider sessions;

    @Test
    @DisplayName("场景 - 上下文加载测试意图并选用内存存储")
    void contextLoads() {
        assertThat(intents.names()).containsExactly("LAB-CORE1", "LAB-EDGE1", "LAB-SPARE");
        assertThat(store).isInstanceOf(InMemoryConfigStore.class);
    }

    @Test
    @DisplayName("场景 - 生成全部设备配置并写入存储")
    void generatesAllDevices() {
        // When
        List<GenerationOutcome> outcomes = generationService.generateAll();

        // Then
        assertThat(outcomes).allMatch(GenerationOutcome::isGenerated);
        assertThat(store.readCurrent("LAB-EDGE1")).hasValueSatisfying(text -> {
            assertThat(text).contains("hostname LAB-EDGE1");
            assertThat(text).contains("ip vrf STAFF-NET", "ip vrf STUDENT-NET");
            assertThat(text).contains("snmp-server community lab-ro RO");
        });
    }

    @Test
    @DisplayName("场景 - 确认门拒绝时流水线中止，报告仍然落盘")
    void abortedPipelineStillWritesReport() throws Exception {
        // When
        PipelineReport report = orchestrator.run(new PipelineRequest(List.of("LAB-CORE1"), false));

        // Then
        assertThat(report.finalPhase()).isEqualTo(PipelinePhase.ABORTED);
        Path written = Path.of("target/test-reports", "report-" + report.runId() + ".json");
        assertThat(written).exists();
        assertThat(Files.readString(written)).contains("\"finalPhase\" : \"ABORTED\"", "LAB-CORE1");
        assertThat(sessions.applyCalls()).isEmpty();
    }

    @Test
    @DisplayName("场景 - 命令行 list 按层级输出，deploy --dry-run --yes 不下发")
    void commandLine() {
        // Given
        StringWriter buffer = new StringWriter();
        CommandLine cli = new CommandLine(NetDeployCommand.class,
                new SpringCommandFactory(context.getAutowireCapableBeanFactory()));
        cli.setOut(new PrintWriter(buffer));

        // When
        int listExit = cli.execute("list");
        int deployExit = cli.execute("deploy", "--dry-run", "--yes", "-d", "LAB-EDGE1");

        // Then
        assertThat(listExit).isZero();
        String output = buffer.toString();
        assertThat(output.indexOf("tier 0")).isLessThan(output.indexOf("tier 3"));
        assertThat(output).contains("LAB-SPARE");
        assertThat(deployExit).isZero();
        assertThat(output).contains("LAB-EDGE1", "dry-run");
        assertThat(sessions.applyCalls()).isEmpty();
    }
}
