package xyz.firestige.netdeploy.application.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.application.generation.ConfigGenerationService;
import xyz.firestige.netdeploy.application.generation.GenerationOutcome;
import xyz.firestige.netdeploy.application.plan.DeploymentPlanner;
import xyz.firestige.netdeploy.application.preview.DiffPreview;
import xyz.firestige.netdeploy.application.preview.DiffPreviewService;
import xyz.firestige.netdeploy.application.validation.ValidationRunner;
import xyz.firestige.netdeploy.domain.config.GeneratedConfig;
import xyz.firestige.netdeploy.domain.deployment.DeploymentPlan;
import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.deployment.DeploymentStatus;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.pipeline.PipelineContext;
import xyz.firestige.netdeploy.domain.pipeline.PipelinePhase;
import xyz.firestige.netdeploy.domain.pipeline.PipelineReport;
import xyz.firestige.netdeploy.domain.pipeline.event.PipelineCompletedEvent;
import xyz.firestige.netdeploy.domain.pipeline.event.PipelinePhaseChangedEvent;
import xyz.firestige.netdeploy.domain.shared.event.DomainEventPublisher;
import xyz.firestige.netdeploy.domain.shared.exception.CyclicDependencyException;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.state.PipelineStateMachine;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.infrastructure.execution.DeploymentExecutor;
import xyz.firestige.netdeploy.infrastructure.gate.ConfirmationGate;
import xyz.firestige.netdeploy.infrastructure.metrics.MetricsRegistry;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 流水线编排器
 * <p>
 * GENERATE → PRE_VALIDATE → PREVIEW → DEPLOY → POST_VALIDATE → REPORT
 * <p>
 * 1. 生成：并行；单台设备模板错误只跳过该设备
 * 2. 部署前校验：失败只报告，是否继续由确认门决定
 * 3. 预览：只读
 * 4. 部署：按计划顺序串行；live 模式下首个失败后其余设备标记 SKIPPED，不再调用 apply
 * 5. 部署后校验：只要进入过 DEPLOY 就执行，包括部署阶段被取消或计划冲突的情况
 * 6. 报告：无论成功、失败还是中止都会生成
 * <p>
 * 取消请求在阶段边界以及每台设备部署前检查。
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final IntentRepository intents;
    private final ConfigGenerationService generationService;
    private final ValidationRunner validationRunner;
    private final DiffPreviewService previewService;
    private final DeploymentPlanner planner;
    private final DeploymentExecutor executor;
    private final ConfirmationGate gate;
    private final DomainEventPublisher eventPublisher;
    private final MetricsRegistry metrics;
    private final Clock clock;

    public PipelineOrchestrator(IntentRepository intents,
                                ConfigGenerationService generationService,
                                ValidationRunner validationRunner,
                                DiffPreviewService previewService,
                                DeploymentPlanner planner,
                                DeploymentExecutor executor,
                                ConfirmationGate gate,
                                DomainEventPublisher eventPublisher,
                                MetricsRegistry metrics,
                                Clock clock) {
        this.intents = intents;
        this.generationService = generationService;
        this.validationRunner = validationRunner;
        this.previewService = previewService;
        this.planner = planner;
        this.executor = executor;
        this.gate = gate;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 同一套协作方，换一个确认门（例如命令行 --yes 时自动同意）
     */
    public PipelineOrchestrator withGate(ConfirmationGate otherGate) {
        return new PipelineOrchestrator(intents, generationService, validationRunner, previewService, planner,
                executor, otherGate, eventPublisher, metrics, clock);
    }

    public PipelineContext newContext(PipelineRequest request) {
        return new PipelineContext(UUID.randomUUID().toString(), request.devices(), request.dryRun(), clock.instant());
    }

    public PipelineReport run(PipelineRequest request) {
        return run(newContext(request));
    }

    public PipelineReport run(PipelineContext ctx) {
        ctx.injectMdc();
        try {
            PipelineStateMachine sm = newStateMachine();
            log.info("Pipeline {} started: devices={}, dryRun={}", ctx.getRunId(),
                    ctx.getDeviceFilter().isEmpty() ? "all" : ctx.getDeviceFilter(), ctx.isDryRun());

            generate(ctx);
            if (!advance(sm, ctx, PipelinePhase.PRE_VALIDATE)) {
                return finish(ctx);
            }
            preValidate(ctx);
            if (!advance(sm, ctx, PipelinePhase.PREVIEW)) {
                return finish(ctx);
            }
            preview(ctx);
            if (!advance(sm, ctx, PipelinePhase.DEPLOY)) {
                return finish(ctx);
            }
            List<DeviceIntent> deployed = deploy(ctx);
            advance(sm, ctx, PipelinePhase.POST_VALIDATE);
            ctx.addPostValidation(validationRunner.runChecks(deployed, ValidationPhase.POST));
            if (ctx.isAbortRequested()) {
                abort(sm, ctx);
            } else {
                advance(sm, ctx, PipelinePhase.REPORT);
            }
            return finish(ctx);
        } finally {
            ctx.clearMdc();
        }
    }

    private PipelineStateMachine newStateMachine() {
        PipelineStateMachine sm = new PipelineStateMachine();
        guardNotCancelled(sm, PipelinePhase.GENERATE, PipelinePhase.PRE_VALIDATE);
        guardNotCancelled(sm, PipelinePhase.PRE_VALIDATE, PipelinePhase.PREVIEW);
        guardNotCancelled(sm, PipelinePhase.PREVIEW, PipelinePhase.DEPLOY);
        sm.registerGuard(PipelinePhase.PRE_VALIDATE, PipelinePhase.PREVIEW, ctx -> confirm(ctx,
                String.format("Pre-validation finished with %d failing checks. Continue to preview?",
                        ctx.preValidationFailures())));
        sm.registerGuard(PipelinePhase.PREVIEW, PipelinePhase.DEPLOY, ctx -> confirm(ctx,
                String.format("%s %d devices %s?", ctx.isDryRun() ? "Dry-run" : "Deploy",
                        ctx.getGenerated().size(), ctx.getDiffSummaries())));
        sm.registerActionForAll(ctx -> eventPublisher.publish(
                new PipelinePhaseChangedEvent(ctx.getRunId(), ctx.getPreviousPhase(), ctx.getPhase())));
        return sm;
    }

    private void guardNotCancelled(PipelineStateMachine sm, PipelinePhase from, PipelinePhase to) {
        sm.registerGuard(from, to, ctx -> {
            if (ctx.isCancelRequested()) {
                ctx.markAbort("cancelled before " + to);
                return false;
            }
            return true;
        });
    }

    private boolean confirm(PipelineContext ctx, String prompt) {
        boolean approved = gate.confirm(prompt);
        if (!approved) {
            ctx.markAbort("declined at confirmation gate after " + ctx.getPhase());
        }
        return approved;
    }

    private boolean advance(PipelineStateMachine sm, PipelineContext ctx, PipelinePhase to) {
        PipelinePhase from = sm.getCurrent();
        if (sm.transitionTo(to, ctx) == to) {
            return true;
        }
        ctx.markAbort("transition " + from + " -> " + to + " refused");
        abort(sm, ctx);
        return false;
    }

    private void abort(PipelineStateMachine sm, PipelineContext ctx) {
        log.warn("Pipeline {} aborted during {}: {}", ctx.getRunId(), sm.getCurrent(), ctx.getAbortReason());
        sm.transitionTo(PipelinePhase.ABORTED, ctx);
    }

    private void generate(PipelineContext ctx) {
        List<String> names = ctx.getDeviceFilter().isEmpty() ? intents.names() : ctx.getDeviceFilter();
        for (GenerationOutcome outcome : generationService.generate(names)) {
            if (outcome.isGenerated()) {
                ctx.addGenerated(outcome.getDevice(), outcome.getConfig().map(GeneratedConfig::text).orElse(""));
            } else {
                ctx.addGenerationFailure(outcome.getDevice(), outcome.getFailureInfo().orElse(null));
            }
        }
    }

    private void preValidate(PipelineContext ctx) {
        ctx.addPreValidation(validationRunner.runChecks(generatedIntents(ctx), ValidationPhase.PRE));
    }

    private void preview(PipelineContext ctx) {
        List<GeneratedConfig> configs = new ArrayList<>();
        for (Map.Entry<String, String> e : ctx.getGenerated().entrySet()) {
            configs.add(new GeneratedConfig(e.getKey(), e.getValue(), clock.instant()));
        }
        for (DiffPreview p : previewService.preview(configs)) {
            if (p.isFailed()) {
                ctx.addPreviewFailure(p.device(), p.failureInfo());
            } else {
                ctx.addDiffSummary(p.device(), p.diff().summary());
            }
        }
    }

    /**
     * @return 计划内的设备（部署后校验的对象）
     */
    private List<DeviceIntent> deploy(PipelineContext ctx) {
        List<DeviceIntent> candidates = generatedIntents(ctx);
        DeploymentPlan plan;
        try {
            plan = planner.plan(candidates);
        } catch (CyclicDependencyException e) {
            FailureInfo failure = FailureInfo.fromException(e, "plan");
            ctx.markAbort("deployment plan rejected: " + e.getMessage(), failure);
            candidates.forEach(d -> ctx.addDeploymentResult(DeploymentResult.skipped(d.getName(), failure)));
            addGenerationSkips(ctx);
            return candidates;
        }

        String haltedBy = null;
        for (DeviceIntent device : plan.devices()) {
            String name = device.getName();
            if (haltedBy != null) {
                ctx.addDeploymentResult(DeploymentResult.skipped(name, "halted after failure of " + haltedBy));
                continue;
            }
            if (ctx.isCancelRequested()) {
                ctx.markAbort("cancelled during deploy");
                ctx.addDeploymentResult(DeploymentResult.skipped(name, "cancelled"));
                continue;
            }
            DeploymentResult result = executor.apply(ctx.getRunId(), device, ctx.getGenerated().get(name), ctx.isDryRun());
            ctx.addDeploymentResult(result);
            if (result.getStatus() == DeploymentStatus.FAILED && !ctx.isDryRun()) {
                haltedBy = name;
                log.error("Deployment halted: {} failed ({}), remaining devices will be skipped", name,
                        result.getFailureInfo().map(FailureInfo::getErrorType).orElse(null));
            }
        }
        addGenerationSkips(ctx);
        return plan.devices();
    }

    private void addGenerationSkips(PipelineContext ctx) {
        ctx.getGenerationFailures().forEach((name, failure) ->
                ctx.addDeploymentResult(DeploymentResult.skipped(name, failure)));
    }

    private List<DeviceIntent> generatedIntents(PipelineContext ctx) {
        return ctx.getGenerated().keySet().stream().map(intents::get).toList();
    }

    private PipelineReport finish(PipelineContext ctx) {
        PipelineReport report = PipelineReportAssembler.assemble(ctx, clock.instant());
        metrics.incrementCounter("netdeploy.pipeline.result",
                "outcome", report.isAborted() ? "ABORTED" : report.isSuccess() ? "SUCCESS" : "FAILED");
        log.info("Pipeline finished: {}", report.summary());
        eventPublisher.publish(new PipelineCompletedEvent(report));
        return report;
    }
}
