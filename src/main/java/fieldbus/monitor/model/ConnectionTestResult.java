package fieldbus.monitor.model;

import fieldbus.monitor.enums.ErrorKind;
import org.jetbrains.annotations.Nullable;

public class ConnectionTestResult {
    private final boolean success;
    private final String message;
    private final Long latencyMs;
    private final ErrorKind errorKind;

    private ConnectionTestResult(boolean success, String message, @Nullable Long latencyMs,
                                 @Nullable ErrorKind errorKind) {
        this.success = success;
        this.message = message;
        this.latencyMs = latencyMs;
        this.errorKind = errorKind;
    }

    public static ConnectionTestResult success(String message, long latencyMs) {
        return new ConnectionTestResult(true, message, latencyMs, null);
    }

    public static ConnectionTestResult failure(String message, ErrorKind errorKind) {
        return new ConnectionTestResult(false, message, null, errorKind);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public @Nullable Long getLatencyMs() {
        return latencyMs;
    }

    public @Nullable ErrorKind getErrorKind() {
        return errorKind;
    }
}
