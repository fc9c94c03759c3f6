package fieldbus.monitor.exception;

import fieldbus.monitor.enums.DataType;

public class ValueOutOfRangeException extends ValidationException {
    public ValueOutOfRangeException(DataType dataType, Object value) {
        super("Value " + value + " is out of range for " + dataType);
    }
}
