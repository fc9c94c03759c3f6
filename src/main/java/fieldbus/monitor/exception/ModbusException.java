package fieldbus.monitor.exception;

import fieldbus.monitor.enums.ErrorKind;

public class ModbusException extends Exception {
    private final ErrorKind kind;

    public ModbusException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModbusException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
