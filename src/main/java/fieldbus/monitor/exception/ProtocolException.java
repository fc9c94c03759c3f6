package fieldbus.monitor.exception;

import fieldbus.monitor.enums.ErrorKind;
import org.jetbrains.annotations.Nullable;

/**
 * Устройство вернуло ошибку или некорректный ответ. Повтор не выполняется.
 */
public class ProtocolException extends ModbusException {
    private final Integer exceptionCode;

    public ProtocolException(String message, @Nullable Integer exceptionCode, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
        this.exceptionCode = exceptionCode;
    }

    public ProtocolException(String message) {
        super(ErrorKind.PROTOCOL, message);
        this.exceptionCode = null;
    }

    public @Nullable Integer getExceptionCode() {
        return exceptionCode;
    }
}
