package fieldbus.monitor.enums;

public enum Parity {
    NONE,

    EVEN,

    ODD
}
