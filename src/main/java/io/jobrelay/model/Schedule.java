package io.jobrelay.model;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recurrence rule of a job.
 *
 * <p>Accepted descriptors: the named cadences {@code hourly}, {@code daily} and {@code weekly},
 * compact cadences such as {@code 10m}, {@code 6h} or {@code 2d}, and the one-shot marker
 * {@code once}. An explicit {@code interval_minutes} takes precedence over the descriptor.
 */
public record Schedule(Kind kind, String descriptor, Integer intervalMinutes) {
    public static final String ONCE = "once";

    private static final Pattern COMPACT = Pattern.compile("^(\\d+)([mhd])$");
    private static final long MINUTE_MS = 60_000L;

    public enum Kind {
        CADENCE,
        INTERVAL,
        ONCE
    }

    public Schedule {
        if (kind == null) {
            throw new IllegalArgumentException("schedule kind cannot be null");
        }
        if (kind != Kind.ONCE && (intervalMinutes == null || intervalMinutes <= 0)) {
            throw new IllegalArgumentException("recurring schedule needs a positive interval: " + descriptor);
        }
    }

    public static Schedule once() {
        return new Schedule(Kind.ONCE, ONCE, null);
    }

    public static Schedule everyMinutes(int minutes) {
        return new Schedule(Kind.INTERVAL, null, minutes);
    }

    public static Schedule parse(String descriptor, Integer intervalMinutes) {
        String normalized = descriptor == null ? "" : descriptor.trim().toLowerCase(Locale.ROOT);
        if (intervalMinutes != null) {
            if (intervalMinutes <= 0) {
                throw new IllegalArgumentException("interval_minutes must be positive: " + intervalMinutes);
            }
            return new Schedule(Kind.INTERVAL, normalized.isEmpty() ? null : normalized, intervalMinutes);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("schedule or interval_minutes is required");
        }
        switch (normalized) {
            case ONCE:
                return once();
            case "hourly":
                return new Schedule(Kind.CADENCE, normalized, 60);
            case "daily":
                return new Schedule(Kind.CADENCE, normalized, 24 * 60);
            case "weekly":
                return new Schedule(Kind.CADENCE, normalized, 7 * 24 * 60);
            default:
                break;
        }
        Matcher m = COMPACT.matcher(normalized);
        if (!m.matches()) {
            throw new IllegalArgumentException("Unsupported schedule: " + descriptor);
        }
        long amount = Long.parseLong(m.group(1));
        long minutes = switch (m.group(2)) {
            case "h" -> amount * 60L;
            case "d" -> amount * 24L * 60L;
            default -> amount;
        };
        if (minutes <= 0 || minutes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Unsupported schedule: " + descriptor);
        }
        return new Schedule(Kind.CADENCE, normalized, (int) minutes);
    }

    public boolean oneShot() {
        return kind == Kind.ONCE;
    }

    /**
     * Due time of the next run after a successful run at {@code nowMs}, or {@code null} for a
     * one-shot job.
     */
    public Long nextRunAfter(long nowMs) {
        if (oneShot()) {
            return null;
        }
        return nowMs + intervalMinutes * MINUTE_MS;
    }

    /**
     * Value of the {@code interval_minutes} column: only set for explicit intervals.
     */
    public Integer intervalColumn() {
        return kind == Kind.INTERVAL ? intervalMinutes : null;
    }
}
