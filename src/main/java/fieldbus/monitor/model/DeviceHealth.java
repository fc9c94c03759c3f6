package fieldbus.monitor.model;

import fieldbus.monitor.enums.ErrorKind;
import fieldbus.monitor.enums.HealthStatus;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

public class DeviceHealth {
    private static final DeviceHealth UNKNOWN = new DeviceHealth(HealthStatus.UNKNOWN, 0, null, null, null, null);

    private final HealthStatus status;
    private final int consecutiveFailures;
    private final ErrorKind lastErrorKind;
    private final String lastError;
    private final Instant lastSuccessAt;
    private final Instant lastFailureAt;

    private DeviceHealth(
            HealthStatus status,
            int consecutiveFailures,
            @Nullable ErrorKind lastErrorKind,
            @Nullable String lastError,
            @Nullable Instant lastSuccessAt,
            @Nullable Instant lastFailureAt
    ) {
        this.status = status;
        this.consecutiveFailures = consecutiveFailures;
        this.lastErrorKind = lastErrorKind;
        this.lastError = lastError;
        this.lastSuccessAt = lastSuccessAt;
        this.lastFailureAt = lastFailureAt;
    }

    public static DeviceHealth unknown() {
        return UNKNOWN;
    }

    public DeviceHealth afterSuccess(Instant now) {
        return new DeviceHealth(HealthStatus.HEALTHY, 0, null, null, now, lastFailureAt);
    }

    /* снимок получен, но часть диапазонов не прочиталась */
    public DeviceHealth afterPartialSuccess(Instant now, ErrorKind errorKind, String error) {
        return new DeviceHealth(HealthStatus.DEGRADED, 0, errorKind, error, now, now);
    }

    public DeviceHealth afterFailure(Instant now, ErrorKind errorKind, String error) {
        return new DeviceHealth(HealthStatus.UNHEALTHY, consecutiveFailures + 1, errorKind, error, lastSuccessAt,
                now);
    }

    public HealthStatus getStatus() {
        return status;
    }

    public boolean isHealthy() {
        return status.isHealthy();
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public @Nullable ErrorKind getLastErrorKind() {
        return lastErrorKind;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    public @Nullable Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public @Nullable Instant getLastFailureAt() {
        return lastFailureAt;
    }

    @Override
    public String toString() {
        return lastError == null ? status.getTemplate() : status.getTemplate() + " (" + lastError + ")";
    }
}
