package fieldbus.monitor.event.error;

import fieldbus.monitor.enums.ErrorKind;
import org.springframework.context.ApplicationEvent;

public class DevicePollErrorEvent extends ApplicationEvent {
    private final String deviceId;
    private final ErrorKind errorKind;
    private final String message;

    public DevicePollErrorEvent(Object source, String deviceId, ErrorKind errorKind, String message) {
        super(source);
        this.deviceId = deviceId;
        this.errorKind = errorKind;
        this.message = message;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }
}
