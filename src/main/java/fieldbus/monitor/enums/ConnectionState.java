package fieldbus.monitor.enums;

public enum ConnectionState {
    IDLE,

    CONNECTING,

    CONNECTED,

    CLOSING,

    /* транзитное состояние после ошибки, всегда возвращается в IDLE */
    FAILED
}
