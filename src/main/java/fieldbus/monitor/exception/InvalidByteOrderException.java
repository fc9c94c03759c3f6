package fieldbus.monitor.exception;

import fieldbus.monitor.enums.ByteOrder;
import fieldbus.monitor.enums.DataType;

public class InvalidByteOrderException extends ValidationException {
    public InvalidByteOrderException(DataType dataType, ByteOrder byteOrder) {
        super("Byte order " + byteOrder + " is not valid for " + dataType);
    }
}
