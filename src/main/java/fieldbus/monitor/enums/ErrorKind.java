package fieldbus.monitor.enums;

public enum ErrorKind {
    VALIDATION(false),

    CONNECTION(true),

    TIMEOUT(true),

    PROTOCOL(false),

    PARTIAL_DECODE(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
