package fieldbus.monitor.service.impl;

import fieldbus.monitor.configuration.DevicesConfiguration;
import fieldbus.monitor.configuration.DevicesConfiguration.ConnectionProperties;
import fieldbus.monitor.configuration.DevicesConfiguration.DeviceProperties;
import fieldbus.monitor.configuration.DevicesConfiguration.ParameterProperties;
import fieldbus.monitor.configuration.DevicesConfiguration.RangeProperties;
import fieldbus.monitor.configuration.ModbusConfiguration;
import fieldbus.monitor.enums.FunctionCode;
import fieldbus.monitor.enums.TransportKind;
import fieldbus.monitor.model.ConnectionConfig;
import fieldbus.monitor.model.DeviceRecord;
import fieldbus.monitor.model.Parameter;
import fieldbus.monitor.model.PollSchedule;
import fieldbus.monitor.model.RegisterRange;
import fieldbus.monitor.service.DeviceRecordSource;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Устройства из секции fieldbus.devices файла настроек
 */
@Service
public class PropertiesDeviceRecordSource implements DeviceRecordSource {
    private static final Logger logger = LoggerFactory.getLogger(PropertiesDeviceRecordSource.class);
    private final Map<String, DeviceRecord> devices = new LinkedHashMap<>();

    public PropertiesDeviceRecordSource(
            DevicesConfiguration devicesConfiguration,
            ModbusConfiguration modbusConfiguration
    ) {
        for (DeviceProperties properties : devicesConfiguration.getDevices()) {
            if (devices.containsKey(properties.getId())) {
                throw new IllegalArgumentException("Duplicate device id " + properties.getId());
            }
            devices.put(properties.getId(), toDeviceRecord(properties, modbusConfiguration));
        }
        logger.info("Загружено устройств из настроек: {}", devices.size());
    }

    @Override
    public Optional<DeviceRecord> findDevice(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    @Override
    public List<DeviceRecord> findAll() {
        return List.copyOf(devices.values());
    }

    private DeviceRecord toDeviceRecord(DeviceProperties properties, ModbusConfiguration defaults) {
        return new DeviceRecord(
                properties.getId(),
                properties.getName(),
                properties.isEnabled(),
                toConnectionConfig(properties.getConnection(), defaults),
                properties.getRanges().stream().map(this::toRange).collect(Collectors.toList()),
                toSchedule(properties.getPollInterval(), properties.getFastPollInterval())
        );
    }

    private ConnectionConfig toConnectionConfig(ConnectionProperties properties, ModbusConfiguration defaults) {
        ConnectionConfig config = properties.getType() == TransportKind.SERIAL
                ? ConnectionConfig.serial(
                properties.getSerialPath(),
                properties.getBaudRate(),
                properties.getDataBits(),
                properties.getStopBits(),
                properties.getParity(),
                properties.getUnitId())
                : ConnectionConfig.stream(properties.getHost(), properties.getPort(), properties.getUnitId());
        return config.withPolicy(
                properties.getTimeout() != null ? properties.getTimeout() : defaults.getTimeout(),
                properties.getConnectTimeout() != null ? properties.getConnectTimeout() : defaults.getConnectTimeout(),
                properties.getRetries() != null ? properties.getRetries() : defaults.getRetries(),
                properties.getRetryDelay() != null ? properties.getRetryDelay() : defaults.getRetryDelay()
        );
    }

    private RegisterRange toRange(RangeProperties properties) {
        return new RegisterRange(
                properties.getStart(),
                properties.getCount(),
                FunctionCode.fromCode(properties.getFunctionCode()),
                properties.getParameters().stream().map(this::toParameter).collect(Collectors.toList())
        );
    }

    private Parameter toParameter(ParameterProperties properties) {
        return new Parameter(
                properties.getName(),
                properties.getDataType(),
                properties.getByteOrder(),
                properties.getOffset(),
                properties.getWordCount(),
                properties.getScale(),
                properties.getDecimalPrecision(),
                properties.getSigned(),
                properties.getUnit()
        );
    }

    private @Nullable PollSchedule toSchedule(@Nullable Long pollInterval, @Nullable Long fastPollInterval) {
        if (pollInterval == null || pollInterval <= 0) {
            return null;
        }
        return fastPollInterval != null
                ? PollSchedule.adaptive(pollInterval, fastPollInterval)
                : PollSchedule.fixed(pollInterval);
    }
}
