package xyz.firestige.netdeploy.infrastructure.execution;

import java.time.Duration;
import java.time.Instant;

/**
 * 单个步骤执行结果
 */
public class StepResult {
    private String stepName;
    private boolean success;
    private String message;
    private Instant startTime;
    private Instant endTime;
    private long durationMillis;

    public static StepResult start(String stepName) {
        StepResult r = new StepResult();
        r.stepName = stepName;
        r.startTime = Instant.now();
        return r;
    }

    public void finishSuccess() {
        this.success = true;
        finish();
    }

    public void finishFailure(String msg) {
        this.success = false;
        this.message = msg;
        finish();
    }

    private void finish() {
        this.endTime = Instant.now();
        this.durationMillis = Duration.between(startTime, endTime).toMillis();
    }

    public String getStepName() { return stepName; }
    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public Instant getStartTime() { return startTime; }
    public Instant getEndTime() { return endTime; }
    public long getDurationMillis() { return durationMillis; }

    @Override
    public String toString() {
        return stepName + (success ? "=ok(" : "=failed(") + durationMillis + "ms)";
    }
}
