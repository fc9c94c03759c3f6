package fieldbus.monitor.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Неизменяемый набор значений параметров устройства на момент опроса.
 */
public class ReadingSnapshot {
    private final String deviceId;
    private final Instant timestamp;
    private final List<ParameterReading> readings;
    private final List<RangeData> rawRanges;

    public ReadingSnapshot(
            String deviceId,
            Instant timestamp,
            List<ParameterReading> readings,
            List<RangeData> rawRanges
    ) {
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.readings = List.copyOf(readings);
        this.rawRanges = List.copyOf(rawRanges);
    }

    public String getDeviceId() {
        return deviceId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public List<ParameterReading> getReadings() {
        return readings;
    }

    public List<RangeData> getRawRanges() {
        return rawRanges;
    }

    public Optional<ParameterReading> getReading(String name) {
        return readings.stream().filter(reading -> reading.getName().equals(name)).findFirst();
    }

    public boolean hasErrors() {
        return readings.stream().anyMatch(ParameterReading::isError);
    }

    @Override
    public String toString() {
        return deviceId + "@" + timestamp + " " + readings;
    }
}
