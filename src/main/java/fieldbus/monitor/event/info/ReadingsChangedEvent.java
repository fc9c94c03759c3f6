package fieldbus.monitor.event.info;

import fieldbus.monitor.model.ReadingSnapshot;
import org.springframework.context.ApplicationEvent;

import java.util.List;

public class ReadingsChangedEvent extends ApplicationEvent {
    private final String deviceId;
    private final List<String> changedParameters;
    private final ReadingSnapshot snapshot;

    public ReadingsChangedEvent(Object source, String deviceId, List<String> changedParameters,
                                ReadingSnapshot snapshot) {
        super(source);
        this.deviceId = deviceId;
        this.changedParameters = List.copyOf(changedParameters);
        this.snapshot = snapshot;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public List<String> getChangedParameters() {
        return changedParameters;
    }

    public ReadingSnapshot getSnapshot() {
        return snapshot;
    }
}
