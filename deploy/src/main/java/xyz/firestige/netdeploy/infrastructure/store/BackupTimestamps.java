package xyz.firestige.netdeploy.infrastructure.store;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Optional;

/**
 * 备份时间戳工具：毫秒精度，UTC，文件名形如 20240131T235959.123Z
 * <p>
 * 同一毫秒内的后续备份保留真实采集时间，只追加序号：20240131T235959.123Z-0001
 */
final class BackupTimestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final int SEQUENCE_WIDTH = 4;

    private BackupTimestamps() {
    }

    /**
     * 备份标识：采集时间 + 同一毫秒内的序号（首份为 0）
     */
    record Stamp(Instant capturedAt, int sequence) {

        static final Comparator<Stamp> ORDER =
                Comparator.comparing(Stamp::capturedAt).thenComparingInt(Stamp::sequence);

        /**
         * 序号为 0 时与旧格式一致，不带后缀
         */
        String suffix() {
            return sequence == 0 ? "" : "-" + String.format("%0" + SEQUENCE_WIDTH + "d", sequence);
        }

        String fileName() {
            return format(capturedAt) + suffix();
        }

        String member() {
            return capturedAt.toEpochMilli() + suffix();
        }
    }

    static Optional<Stamp> parseFileName(String text) {
        int dash = text.lastIndexOf('-');
        if (dash < 0) {
            return parse(text).map(at -> new Stamp(at, 0));
        }
        Optional<Instant> at = parse(text.substring(0, dash));
        Optional<Integer> sequence = parseSequence(text.substring(dash + 1));
        return at.isPresent() && sequence.isPresent()
                ? Optional.of(new Stamp(at.get(), sequence.get()))
                : Optional.empty();
    }

    static Stamp parseMember(String member) {
        int dash = member.indexOf('-');
        if (dash < 0) {
            return new Stamp(Instant.ofEpochMilli(Long.parseLong(member)), 0);
        }
        return new Stamp(Instant.ofEpochMilli(Long.parseLong(member.substring(0, dash))),
                Integer.parseInt(member.substring(dash + 1)));
    }

    private static Optional<Integer> parseSequence(String text) {
        if (text.length() != SEQUENCE_WIDTH || !text.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return Optional.of(Integer.parseInt(text));
    }

    static Instant truncate(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MILLIS);
    }

    static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    static Optional<Instant> parse(String text) {
        try {
            return Optional.of(FORMAT.parse(text, Instant::from));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * 严格早于 instant 的最大毫秒值
     */
    static long lastMillisBefore(Instant instant) {
        Instant truncated = truncate(instant);
        return truncated.equals(instant) ? truncated.toEpochMilli() - 1 : truncated.toEpochMilli();
    }
}
