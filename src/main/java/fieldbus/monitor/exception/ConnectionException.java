package fieldbus.monitor.exception;

import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.ErrorKind;

public class ConnectionException extends ModbusException {
    private final ConnectionFailure failure;

    public ConnectionException(ConnectionFailure failure, String message) {
        super(ErrorKind.CONNECTION, message);
        this.failure = failure;
    }

    public ConnectionException(ConnectionFailure failure, String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
        this.failure = failure;
    }

    public ConnectionFailure getFailure() {
        return failure;
    }

    @Override
    public boolean isRetryable() {
        return failure.isRetryable();
    }
}
