package xyz.firestige.netdeploy.domain.pipeline;

import org.slf4j.MDC;
import xyz.firestige.netdeploy.domain.deployment.DeploymentResult;
import xyz.firestige.netdeploy.domain.shared.exception.FailureInfo;
import xyz.firestige.netdeploy.domain.validation.ValidationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 一次流水线运行的上下文：请求参数、阶段间传递的数据、取消标志。
 * <p>
 * 各阶段结果由编排线程写入；取消标志可由任意线程设置，在阶段边界和每台设备部署前检查。
 */
public class PipelineContext {

    private final String runId;
    private final List<String> deviceFilter;
    private final boolean dryRun;
    private final Instant startedAt;

    private volatile boolean cancelRequested = false;

    private PipelinePhase phase = PipelinePhase.GENERATE;
    private PipelinePhase previousPhase;
    private PipelinePhase abortedFrom;
    private String abortReason;
    private FailureInfo abortFailure;

    // 设备名 -> 生成阶段的失败信息（生成成功的设备不在其中）
    private final Map<String, FailureInfo> generationFailures = new LinkedHashMap<>();
    // 设备名 -> 生成文本
    private final Map<String, String> generated = new LinkedHashMap<>();
    private final Map<String, String> diffSummaries = new LinkedHashMap<>();
    private final Map<String, FailureInfo> previewFailures = new LinkedHashMap<>();
    private final List<ValidationResult> preValidation = new ArrayList<>();
    private final List<ValidationResult> postValidation = new ArrayList<>();
    private final List<DeploymentResult> deploymentResults = new ArrayList<>();

    public PipelineContext(String runId, List<String> deviceFilter, boolean dryRun, Instant startedAt) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.deviceFilter = deviceFilter == null ? List.of() : List.copyOf(deviceFilter);
        this.dryRun = dryRun;
        this.startedAt = startedAt;
    }

    public void injectMdc() {
        MDC.put("runId", runId);
    }

    public void clearMdc() {
        MDC.remove("runId");
    }

    public void requestCancel() {
        this.cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void recordPhase(PipelinePhase from, PipelinePhase to) {
        this.previousPhase = from;
        this.phase = to;
        if (to == PipelinePhase.ABORTED && abortedFrom == null) {
            abortedFrom = from;
        }
    }

    /**
     * 记录中止原因；只保留第一次
     */
    public void markAbort(String reason) {
        markAbort(reason, null);
    }

    public void markAbort(String reason, FailureInfo failure) {
        if (abortReason == null) {
            abortReason = reason;
            abortFailure = failure;
        }
    }

    public boolean isAbortRequested() {
        return abortReason != null;
    }

    // ---- getters / collectors ----

    public String getRunId() {
        return runId;
    }

    public List<String> getDeviceFilter() {
        return deviceFilter;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public PipelinePhase getPhase() {
        return phase;
    }

    public PipelinePhase getPreviousPhase() {
        return previousPhase;
    }

    public PipelinePhase getAbortedFrom() {
        return abortedFrom;
    }

    public String getAbortReason() {
        return abortReason;
    }

    public FailureInfo getAbortFailure() {
        return abortFailure;
    }

    public void addGenerated(String device, String text) {
        generated.put(device, text);
    }

    public void addGenerationFailure(String device, FailureInfo failure) {
        generationFailures.put(device, failure);
    }

    public Map<String, String> getGenerated() {
        return Collections.unmodifiableMap(generated);
    }

    public Map<String, FailureInfo> getGenerationFailures() {
        return Collections.unmodifiableMap(generationFailures);
    }

    public void addDiffSummary(String device, String summary) {
        diffSummaries.put(device, summary);
    }

    public void addPreviewFailure(String device, FailureInfo failure) {
        previewFailures.put(device, failure);
    }

    public Map<String, String> getDiffSummaries() {
        return Collections.unmodifiableMap(diffSummaries);
    }

    public Map<String, FailureInfo> getPreviewFailures() {
        return Collections.unmodifiableMap(previewFailures);
    }

    public void addPreValidation(List<ValidationResult> results) {
        preValidation.addAll(results);
    }

    public void addPostValidation(List<ValidationResult> results) {
        postValidation.addAll(results);
    }

    public List<ValidationResult> getPreValidation() {
        return Collections.unmodifiableList(preValidation);
    }

    public List<ValidationResult> getPostValidation() {
        return Collections.unmodifiableList(postValidation);
    }

    public void addDeploymentResult(DeploymentResult result) {
        deploymentResults.add(result);
    }

    public List<DeploymentResult> getDeploymentResults() {
        return Collections.unmodifiableList(deploymentResults);
    }

    public long preValidationFailures() {
        return preValidation.stream().filter(ValidationResult::isFailure).count();
    }
}
