package fieldbus.monitor.enums;

public enum TransportKind {
    /* modbus tcp */
    STREAM,

    /* modbus rtu */
    SERIAL
}
