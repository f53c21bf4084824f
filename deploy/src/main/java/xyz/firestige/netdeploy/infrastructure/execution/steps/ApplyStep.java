package xyz.firestige.netdeploy.infrastructure.execution.steps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.shared.exception.SessionException;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceOperationGuard;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceRuntimeContext;
import xyz.firestige.netdeploy.infrastructure.execution.DeviceStep;

import java.time.Clock;
import java.time.Instant;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * 下发期望配置
 * <p>
 * 前置条件：备份已持久化。下发时刻必须严格晚于备份时间戳；时钟尚未越过备份时间时短暂等待。
 * 推送前去掉空行、注释行（!）和 end 行；回滚恢复备份时原样推送，保证与备份逐字节一致。
 */
public class ApplyStep implements DeviceStep {

    private static final Logger log = LoggerFactory.getLogger(ApplyStep.class);
    private static final long MAX_CLOCK_WAIT_MS = 1000;

    private final DeviceOperationGuard guard;
    private final Clock clock;
    private final boolean verbatim;

    public ApplyStep(DeviceOperationGuard guard, Clock clock) {
        this(guard, clock, false);
    }

    public ApplyStep(DeviceOperationGuard guard, Clock clock, boolean verbatim) {
        this.guard = guard;
        this.clock = clock;
        this.verbatim = verbatim;
    }

    @Override
    public String getStepName() {
        return "apply";
    }

    @Override
    public void execute(DeviceRuntimeContext ctx) {
        if (ctx.getBackup() == null) {
            throw new IllegalStateException("Refusing to apply to " + ctx.getDeviceName() + " without a persisted backup");
        }
        Instant applyAt = instantAfter(ctx.getBackup().capturedAt());
        ctx.setApplyAttemptAt(applyAt);
        String payload = verbatim ? ctx.getDesiredText() : prepareForPush(ctx.getDesiredText());
        log.info("Applying configuration to {}: diff={}, lines={}", ctx.getDeviceName(),
                ctx.getDiff() != null ? ctx.getDiff().summary() : "n/a", payload.lines().count());
        guard.run(ctx.getDeviceName(), getStepName(), () -> ctx.getSession().apply(payload));
    }

    private Instant instantAfter(Instant backupAt) {
        Instant now = clock.instant();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(MAX_CLOCK_WAIT_MS);
        while (!now.isAfter(backupAt)) {
            if (System.nanoTime() > deadline) {
                throw new IllegalStateException("Clock did not advance past backup timestamp " + backupAt);
            }
            try {
                Thread.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SessionException("Interrupted before apply", e);
            }
            now = clock.instant();
        }
        return now;
    }

    /**
     * 去掉空行、注释行和 end 行
     */
    public static String prepareForPush(String text) {
        StringJoiner joiner = new StringJoiner("\n", "", "\n");
        for (String raw : text.split("\\r?\\n|\\r")) {
            String line = raw.stripTrailing();
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("!") || trimmed.equals("end")) {
                continue;
            }
            joiner.add(line);
        }
        return joiner.toString();
    }
}
