package fieldbus.monitor.exception;

import fieldbus.monitor.enums.ErrorKind;

public class ModbusTimeoutException extends ModbusException {
    public ModbusTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message);
    }

    public ModbusTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
