package fieldbus.monitor.model;

import fieldbus.monitor.enums.PollStatus;
import fieldbus.monitor.exception.ModbusException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public class PollResult {
    private final String deviceId;
    private final PollStatus status;
    private final ReadingSnapshot snapshot;
    private final ModbusException error;
    private final List<String> changedParameters;

    private PollResult(
            String deviceId,
            PollStatus status,
            @Nullable ReadingSnapshot snapshot,
            @Nullable ModbusException error,
            List<String> changedParameters
    ) {
        this.deviceId = deviceId;
        this.status = status;
        this.snapshot = snapshot;
        this.error = error;
        this.changedParameters = List.copyOf(changedParameters);
    }

    public static PollResult completed(ReadingSnapshot snapshot, List<String> changedParameters) {
        return new PollResult(snapshot.getDeviceId(), PollStatus.COMPLETED, snapshot, null, changedParameters);
    }

    public static PollResult skipped(String deviceId) {
        return new PollResult(deviceId, PollStatus.SKIPPED, null, null, List.of());
    }

    public static PollResult failed(String deviceId, ModbusException error) {
        return new PollResult(deviceId, PollStatus.FAILED, null, error, List.of());
    }

    public static PollResult discarded(String deviceId) {
        return new PollResult(deviceId, PollStatus.DISCARDED, null, null, List.of());
    }

    public String getDeviceId() {
        return deviceId;
    }

    public PollStatus getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == PollStatus.COMPLETED;
    }

    public @Nullable ReadingSnapshot getSnapshot() {
        return snapshot;
    }

    public @Nullable ModbusException getError() {
        return error;
    }

    public List<String> getChangedParameters() {
        return changedParameters;
    }
}
