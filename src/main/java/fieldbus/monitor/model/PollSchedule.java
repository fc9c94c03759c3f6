package fieldbus.monitor.model;

import org.jetbrains.annotations.Nullable;

/**
 * Расписание опроса. Без быстрого интервала - обычный периодический опрос, с ним - адаптивный:
 * после обнаруженных изменений опрашиваем чаще, после серии опросов без изменений возвращаемся к базовому интервалу.
 */
public class PollSchedule {
    private final long intervalMs;
    private final Long fastIntervalMs;

    private PollSchedule(long intervalMs, @Nullable Long fastIntervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (fastIntervalMs != null && (fastIntervalMs <= 0 || fastIntervalMs > intervalMs)) {
            throw new IllegalArgumentException("Fast poll interval must be positive and not above " + intervalMs);
        }
        this.intervalMs = intervalMs;
        this.fastIntervalMs = fastIntervalMs;
    }

    public static PollSchedule fixed(long intervalMs) {
        return new PollSchedule(intervalMs, null);
    }

    public static PollSchedule adaptive(long intervalMs, long fastIntervalMs) {
        return new PollSchedule(intervalMs, fastIntervalMs);
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public @Nullable Long getFastIntervalMs() {
        return fastIntervalMs;
    }

    public boolean isAdaptive() {
        return fastIntervalMs != null;
    }

    @Override
    public String toString() {
        return isAdaptive() ? intervalMs + "ms/" + fastIntervalMs + "ms" : intervalMs + "ms";
    }
}
