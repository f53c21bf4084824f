package xyz.firestige.netdeploy.application.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.netdeploy.application.validation.checks.DeviceCheck;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;
import xyz.firestige.netdeploy.domain.validation.ValidationPhase;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;
import xyz.firestige.netdeploy.domain.validation.ValidationStatus;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceWorkerPool;
import xyz.firestige.netdeploy.infrastructure.metrics.MetricsRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 校验执行器
 * <p>
 * 每台设备 × 每项适用检查 作为一个任务提交到有界线程池，结果按 设备输入顺序 → 检查注册顺序 返回。
 * 检查只读；单个任务的意外异常转换为该设备该项的 FAIL，不影响其他设备。
 */
public class ValidationRunner {

    private static final Logger log = LoggerFactory.getLogger(ValidationRunner.class);

    private final List<DeviceCheck> checks;
    private final DeviceWorkerPool workerPool;
    private final MetricsRegistry metrics;
    private final Map<ValidationPhase, Set<CheckCategory>> phaseCategories;

    public ValidationRunner(List<DeviceCheck> checks,
                            DeviceWorkerPool workerPool,
                            MetricsRegistry metrics,
                            Map<ValidationPhase, Set<CheckCategory>> phaseCategories) {
        this.checks = List.copyOf(checks);
        this.workerPool = workerPool;
        this.metrics = metrics;
        this.phaseCategories = new EnumMap<>(ValidationPhase.class);
        this.phaseCategories.putAll(phaseCategories);
    }

    /**
     * 默认阶段划分：pre 只做可达性与接口，post 做全部
     */
    public static Map<ValidationPhase, Set<CheckCategory>> defaultPhaseCategories() {
        Map<ValidationPhase, Set<CheckCategory>> defaults = new EnumMap<>(ValidationPhase.class);
        defaults.put(ValidationPhase.PRE, EnumSet.of(CheckCategory.REACHABILITY, CheckCategory.INTERFACES));
        defaults.put(ValidationPhase.POST, EnumSet.allOf(CheckCategory.class));
        return defaults;
    }

    public List<ValidationResult> runChecks(Collection<DeviceIntent> devices, ValidationPhase phase) {
        Set<CheckCategory> enabled = phaseCategories.getOrDefault(phase, EnumSet.allOf(CheckCategory.class));
        List<Task> tasks = new ArrayList<>();
        for (DeviceIntent device : devices) {
            for (DeviceCheck check : checks) {
                if (enabled.contains(check.getCategory())) {
                    tasks.add(new Task(device, check));
                }
            }
        }
        log.info("Running {} validation checks ({}) on {} devices", phase, enabled, devices.size());
        List<ValidationResult> results = workerPool.map(tasks, task -> runOne(task, phase));

        long failed = results.stream().filter(ValidationResult::isFailure).count();
        long skipped = results.stream().filter(r -> r.status() == ValidationStatus.SKIP).count();
        log.info("{} validation finished: total={}, fail={}, skip={}", phase, results.size(), failed, skipped);
        return results;
    }

    private ValidationResult runOne(Task task, ValidationPhase phase) {
        String device = task.device().getName();
        MDC.put("device", device);
        MDC.put("step", "validate-" + task.check().getName());
        try {
            ValidationResult result;
            try {
                result = task.check().run(task.device(), phase);
            } catch (RuntimeException e) {
                log.error("Check {} crashed on {}", task.check().getName(), device, e);
                result = ValidationResult.fail(task.check().getName(), device, task.check().getCategory(), phase,
                        "check error: " + e.getMessage());
            }
            if (result.isFailure()) {
                log.warn("[{}] {} FAIL on {}: {}", phase, result.checkName(), device, result.detail());
            } else {
                log.debug("[{}] {} {} on {}: {}", phase, result.checkName(), result.status(), device, result.detail());
            }
            metrics.incrementCounter("netdeploy.validation.result", "phase", phase.name(), "status", result.status().name());
            return result;
        } finally {
            MDC.remove("device");
            MDC.remove("step");
        }
    }

    private record Task(DeviceIntent device, DeviceCheck check) {
    }
}
