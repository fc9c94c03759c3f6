package fieldbus.monitor.exception;

import fieldbus.monitor.enums.ErrorKind;

/**
 * Некорректная комбинация адресов, количеств или типов. До транспорта дело не доходит, повтор не имеет смысла.
 */
public class ValidationException extends ModbusException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
