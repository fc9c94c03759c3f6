package fieldbus.monitor.model;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public class DeviceRecord {
    private final String deviceId;
    private final String name;
    private final boolean enabled;
    private final ConnectionConfig connectionConfig;
    private final List<RegisterRange> ranges;
    private final PollSchedule pollSchedule;

    public DeviceRecord(
            String deviceId,
            @Nullable String name,
            boolean enabled,
            ConnectionConfig connectionConfig,
            List<RegisterRange> ranges,
            @Nullable PollSchedule pollSchedule
    ) {
        this.deviceId = deviceId;
        this.name = name;
        this.enabled = enabled;
        this.connectionConfig = connectionConfig;
        this.ranges = List.copyOf(ranges);
        this.pollSchedule = pollSchedule;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public String getName() {
        return name != null ? name : deviceId;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public ConnectionConfig getConnectionConfig() {
        return connectionConfig;
    }

    public List<RegisterRange> getRanges() {
        return ranges;
    }

    public @Nullable PollSchedule getPollSchedule() {
        return pollSchedule;
    }
}
