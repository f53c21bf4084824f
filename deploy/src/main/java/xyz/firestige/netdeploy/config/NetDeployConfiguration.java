package xyz.firestige.netdeploy.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import xyz.firestige.netdeploy.application.backup.BackupService;
import xyz.firestige.netdeploy.application.generation.ConfigGenerationService;
import xyz.firestige.netdeploy.application.orchestration.PipelineOrchestrator;
import xyz.firestige.netdeploy.application.orchestration.listener.PipelineEventListener;
import xyz.firestige.netdeploy.application.plan.DeploymentPlanner;
import xyz.firestige.netdeploy.application.preview.DiffPreviewService;
import xyz.firestige.netdeploy.application.rollback.RollbackService;
import xyz.firestige.netdeploy.application.validation.ValidationRunner;
import xyz.firestige.netdeploy.application.validation.checks.BgpSessionCheck;
import xyz.firestige.netdeploy.application.validation.checks.DeviceCheck;
import xyz.firestige.netdeploy.application.validation.checks.InterfaceStatusCheck;
import xyz.firestige.netdeploy.application.validation.checks.LdpNeighborCheck;
import xyz.firestige.netdeploy.application.validation.checks.OspfAdjacencyCheck;
import xyz.firestige.netdeploy.application.validation.checks.ReachabilityCheck;
import xyz.firestige.netdeploy.application.validation.checks.VrfPresenceCheck;
import xyz.firestige.netdeploy.config.properties.NetDeployProperties;
import xyz.firestige.netdeploy.domain.config.ConfigRenderer;
import xyz.firestige.netdeploy.domain.config.ConfigStore;
import xyz.firestige.netdeploy.domain.diff.DiffEngine;
import xyz.firestige.netdeploy.domain.diff.LineSetDiffEngine;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.shared.event.DomainEventPublisher;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.infrastructure.event.SpringDomainEventPublisher;
import xyz.firestige.netdeploy.infrastructure.execution.DeploymentExecutor;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceWorkerPool;
import xyz.firestige.netdeploy.infrastructure.gate.ConfirmationGate;
import xyz.firestige.netdeploy.infrastructure.gate.ConsoleConfirmationGate;
import xyz.firestige.netdeploy.infrastructure.intent.EnvironmentPlaceholderResolver;
import xyz.firestige.netdeploy.infrastructure.intent.YamlIntentLoader;
import xyz.firestige.netdeploy.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.netdeploy.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.netdeploy.infrastructure.parser.OutputParser;
import xyz.firestige.netdeploy.infrastructure.parser.StateFileOutputParser;
import xyz.firestige.netdeploy.infrastructure.report.PipelineReportWriter;
import xyz.firestige.netdeploy.infrastructure.session.DirectorySessionProvider;
import xyz.firestige.netdeploy.infrastructure.session.SessionProvider;
import xyz.firestige.netdeploy.infrastructure.template.QuteConfigRenderer;
import xyz.firestige.netdeploy.infrastructure.template.TemplateModelBuilder;

import java.nio.file.Path;
import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 部署工具装配
 * <p>
 * 意图库在启动时加载一次，之后以不可变实例注入到各组件。
 * 会话、解析器、确认门默认使用离线实验目录与终端交互，可通过自定义 Bean 替换。
 */
@Configuration
@EnableConfigurationProperties(NetDeployProperties.class)
public class NetDeployConfiguration {

    // ========== 意图与渲染 ==========

    @Bean
    public YamlIntentLoader yamlIntentLoader(ResourceLoader resourceLoader, Validator validator,
                                             NetDeployProperties properties) {
        return new YamlIntentLoader(resourceLoader, validator,
                new EnvironmentPlaceholderResolver(properties.getIntent().isAllowMissingEnv()),
                properties.getPlanner().getRoleTiers());
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentRepository intentRepository(YamlIntentLoader loader, NetDeployProperties properties) {
        return loader.load(properties.getIntent().getLocation());
    }

    @Bean
    public ConfigRenderer configRenderer(ResourceLoader resourceLoader, IntentRepository intents,
                                         NetDeployProperties properties) {
        return new QuteConfigRenderer(resourceLoader, properties.getTemplate().getLocation(),
                new TemplateModelBuilder(intents));
    }

    @Bean
    public DiffEngine diffEngine() {
        return new LineSetDiffEngine();
    }

    @Bean
    public DeploymentPlanner deploymentPlanner() {
        return new DeploymentPlanner();
    }

    // ========== 执行资源 ==========

    @Bean(destroyMethod = "close")
    public DeviceWorkerPool deviceWorkerPool(NetDeployProperties properties) {
        NetDeployProperties.Execution execution = properties.getExecution();
        return new DeviceWorkerPool(execution.getWorkerPoolSize(), execution.getQueueCapacity());
    }

    @Bean(destroyMethod = "close")
    public DeviceOperationGuard deviceOperationGuard(NetDeployProperties properties) {
        return new DeviceOperationGuard(properties.getExecution().getOperationTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry metricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        return new MicrometerMetricsRegistry(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    // ========== 外部协作方 ==========

    @Bean
    @ConditionalOnMissingBean
    public SessionProvider sessionProvider(NetDeployProperties properties) {
        return new DirectorySessionProvider(Path.of(properties.getLab().getDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean
    public OutputParser outputParser(NetDeployProperties properties) {
        return new StateFileOutputParser(Path.of(properties.getLab().getDirectory()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfirmationGate confirmationGate() {
        return new ConsoleConfirmationGate();
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher domainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    // ========== 应用服务 ==========

    @Bean
    public DeploymentExecutor deploymentExecutor(SessionProvider sessionProvider, ConfigStore store,
                                                 DiffEngine diffEngine, DeviceOperationGuard guard,
                                                 MetricsRegistry metrics, Clock clock) {
        return new DeploymentExecutor(sessionProvider, store, diffEngine, guard, metrics, clock);
    }

    @Bean
    public ValidationRunner validationRunner(SessionProvider sessionProvider, OutputParser parser,
                                             DeviceOperationGuard guard, DeviceWorkerPool workerPool,
                                             MetricsRegistry metrics, NetDeployProperties properties) {
        List<DeviceCheck> checks = List.of(
                new ReachabilityCheck(sessionProvider, guard),
                new InterfaceStatusCheck(parser, guard),
                new OspfAdjacencyCheck(parser, guard),
                new BgpSessionCheck(parser, guard),
                new LdpNeighborCheck(parser, guard),
                new VrfPresenceCheck(parser, guard));
        Map<ValidationPhase, Set<CheckCategory>> phases = new EnumMap<>(ValidationPhase.class);
        phases.put(ValidationPhase.PRE, copy(properties.getValidation().getPreChecks()));
        phases.put(ValidationPhase.POST, copy(properties.getValidation().getPostChecks()));
        return new ValidationRunner(checks, workerPool, metrics, phases);
    }

    private static Set<CheckCategory> copy(Set<CheckCategory> categories) {
        return categories.isEmpty() ? EnumSet.noneOf(CheckCategory.class) : EnumSet.copyOf(categories);
    }

    @Bean
    public ConfigGenerationService configGenerationService(IntentRepository intents, ConfigRenderer renderer,
                                                           ConfigStore store, DeviceWorkerPool workerPool,
                                                           MetricsRegistry metrics, Clock clock) {
        return new ConfigGenerationService(intents, renderer, store, workerPool, metrics, clock);
    }

    @Bean
    public DiffPreviewService diffPreviewService(IntentRepository intents, SessionProvider sessionProvider,
                                                 DeviceOperationGuard guard, DiffEngine diffEngine,
                                                 DeviceWorkerPool workerPool) {
        return new DiffPreviewService(intents, sessionProvider, guard, diffEngine, workerPool);
    }

    @Bean
    public BackupService backupService(SessionProvider sessionProvider, DeviceOperationGuard guard,
                                       ConfigStore store, DeviceWorkerPool workerPool, MetricsRegistry metrics) {
        return new BackupService(sessionProvider, guard, store, workerPool, metrics);
    }

    @Bean
    public RollbackService rollbackService(ConfigStore store, DeploymentExecutor executor,
                                           DeploymentPlanner planner, Clock clock) {
        return new RollbackService(store, executor, planner, clock);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(IntentRepository intents,
                                                     ConfigGenerationService generationService,
                                                     ValidationRunner validationRunner,
                                                     DiffPreviewService previewService,
                                                     DeploymentPlanner planner,
                                                     DeploymentExecutor executor,
                                                     ConfirmationGate gate,
                                                     DomainEventPublisher eventPublisher,
                                                     MetricsRegistry metrics,
                                                     Clock clock) {
        return new PipelineOrchestrator(intents, generationService, validationRunner, previewService, planner,
                executor, gate, eventPublisher, metrics, clock);
    }

    // ========== 报告 ==========

    @Bean
    public PipelineReportWriter pipelineReportWriter(NetDeployProperties properties) {
        return new PipelineReportWriter(Path.of(properties.getReport().getDirectory()));
    }

    @Bean
    public PipelineEventListener pipelineEventListener(PipelineReportWriter reportWriter) {
        return new PipelineEventListener(reportWriter);
    }
}
