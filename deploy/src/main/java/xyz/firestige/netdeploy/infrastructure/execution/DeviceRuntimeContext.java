package xyz.firestige.netdeploy.infrastructure.execution;

import org.slf4j.MDC;
import xyz.firestige.netdeploy.domain.config.BackupHandle;
import xyz.firestige.netdeploy.domain.diff.ConfigDiff;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.infrastructure.session.DeviceSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 单设备部署的运行时上下文：步骤之间传递的数据 + MDC
 */
public class DeviceRuntimeContext {

    private final String runId;
    private final DeviceIntent device;
    private final String desiredText;
    private final boolean dryRun;
    private final List<StepResult> stepResults = new ArrayList<>();

    private DeviceSession session;
    private String liveText;
    private BackupHandle backup;
    private ConfigDiff diff;
    private Instant applyAttemptAt;

    public DeviceRuntimeContext(String runId, DeviceIntent device, String desiredText, boolean dryRun) {
        this.runId = runId;
        this.device = device;
        this.desiredText = desiredText;
        this.dryRun = dryRun;
    }

    public void injectMdc(String stepName) {
        if (runId != null) {
            MDC.put("runId", runId);
        }
        MDC.put("device", device.getName());
        if (stepName != null) {
            MDC.put("step", stepName);
        }
    }

    public void clearMdc() {
        MDC.remove("device");
        MDC.remove("step");
    }

    public String getRunId() {
        return runId;
    }

    public DeviceIntent getDevice() {
        return device;
    }

    public String getDeviceName() {
        return device.getName();
    }

    public String getDesiredText() {
        return desiredText;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public DeviceSession getSession() {
        return session;
    }

    public void setSession(DeviceSession session) {
        this.session = session;
    }

    public String getLiveText() {
        return liveText;
    }

    public void setLiveText(String liveText) {
        this.liveText = liveText;
    }

    public BackupHandle getBackup() {
        return backup;
    }

    public void setBackup(BackupHandle backup) {
        this.backup = backup;
    }

    public ConfigDiff getDiff() {
        return diff;
    }

    public void setDiff(ConfigDiff diff) {
        this.diff = diff;
    }

    public Instant getApplyAttemptAt() {
        return applyAttemptAt;
    }

    public void setApplyAttemptAt(Instant applyAttemptAt) {
        this.applyAttemptAt = applyAttemptAt;
    }

    public void addStepResult(StepResult result) {
        stepResults.add(result);
    }

    public List<StepResult> getStepResults() {
        return List.copyOf(stepResults);
    }
}
