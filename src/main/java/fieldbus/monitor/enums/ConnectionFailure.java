package fieldbus.monitor.enums;

public enum ConnectionFailure {
    REFUSED(true),

    RESET(true),

    PORT_BUSY(true),

    PORT_MISSING(false),

    UNKNOWN_HOST(false),

    TIMEOUT(true),

    IO(true);

    private final boolean retryable;

    ConnectionFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
