package fieldbus.monitor.enums;

public enum PollStatus {
    COMPLETED,

    /* опрос этого устройства уже идет */
    SKIPPED,

    FAILED,

    /* устройство сняли с расписания, пока шел опрос */
    DISCARDED
}
