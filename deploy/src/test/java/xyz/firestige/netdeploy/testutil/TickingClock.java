package xyz.firestige.netdeploy.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 每次读取前进固定步长的测试时钟，保证时间戳严格递增
 */
public class TickingClock extends Clock {

    private final AtomicLong nanos;
    private final long stepNanos;

    public TickingClock(Instant start, Duration step) {
        this.nanos = new AtomicLong(start.getEpochSecond() * 1_000_000_000L + start.getNano());
        this.stepNanos = step.toNanos();
    }

    public static TickingClock startingAt(String instant) {
        return new TickingClock(Instant.parse(instant), Duration.ofMillis(5));
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        long value = nanos.getAndAdd(stepNanos);
        return Instant.ofEpochSecond(0, value);
    }
}
