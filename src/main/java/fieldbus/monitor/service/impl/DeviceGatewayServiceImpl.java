package fieldbus.monitor.service.impl;

import fieldbus.monitor.configuration.MonitorConfiguration;
import fieldbus.monitor.connection.ConnectionManager;
import fieldbus.monitor.connection.ConnectionManagerFactory;
import fieldbus.monitor.enums.CoilType;
import fieldbus.monitor.enums.HealthStatus;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.CoilBatchWriteResult;
import fieldbus.monitor.model.CoilWriteResult;
import fieldbus.monitor.model.ConnectionConfig;
import fieldbus.monitor.model.ConnectionTestResult;
import fieldbus.monitor.model.DeviceHealth;
import fieldbus.monitor.model.DeviceRecord;
import fieldbus.monitor.model.Parameter;
import fieldbus.monitor.model.ReadResult;
import fieldbus.monitor.model.ReadingSnapshot;
import fieldbus.monitor.model.RegisterRange;
import fieldbus.monitor.model.WriteResult;
import fieldbus.monitor.service.DeviceGatewayService;
import fieldbus.monitor.service.DeviceMonitorService;
import fieldbus.monitor.service.DeviceRecordService;
import fieldbus.monitor.service.RegisterOperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class DeviceGatewayServiceImpl implements DeviceGatewayService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceGatewayServiceImpl.class);
    private final DeviceMonitorService deviceMonitorService;
    private final DeviceRecordService deviceRecordService;
    private final RegisterOperationsService registerOperations;
    private final ConnectionManagerFactory connectionManagerFactory;
    private final MonitorConfiguration monitorConfiguration;

    public DeviceGatewayServiceImpl(
            DeviceMonitorService deviceMonitorService,
            DeviceRecordService deviceRecordService,
            RegisterOperationsService registerOperations,
            ConnectionManagerFactory connectionManagerFactory,
            MonitorConfiguration monitorConfiguration
    ) {
        this.deviceMonitorService = deviceMonitorService;
        this.deviceRecordService = deviceRecordService;
        this.registerOperations = registerOperations;
        this.connectionManagerFactory = connectionManagerFactory;
        this.monitorConfiguration = monitorConfiguration;
    }

    @Override
    public ConnectionTestResult testConnection(ConnectionConfig config) {
        ConnectionManager manager = connectionManagerFactory.create(config);
        long start = System.nanoTime();
        try {
            manager.connect().close();
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            logger.info("Проверка подключения к {} успешна, {} мс", config.describe(), latencyMs);
            return ConnectionTestResult.success("Connected to " + config.describe() + " in " + latencyMs + " ms",
                    latencyMs);
        } catch (ModbusException e) {
            logger.error("Проверка подключения к {} не удалась", config.describe(), e);
            return ConnectionTestResult.failure(e.getMessage(), e.getKind());
        } finally {
            manager.disconnect();
        }
    }

    @Override
    public ReadResult readNow(String deviceId) {
        try {
            return ReadResult.fresh(deviceMonitorService.readNow(deviceId));
        } catch (ModbusException e) {
            logger.error("Ошибка чтения {}", deviceId, e);
            return ReadResult.failure("Failed to read device " + deviceId + ": " + e.getMessage(), e.getKind());
        }
    }

    @Override
    public ReadResult getCached(String deviceId, long maxAgeMs) {
        ReadingSnapshot snapshot;
        try {
            snapshot = deviceMonitorService.getCached(deviceId, maxAgeMs);
        } catch (ModbusException e) {
            logger.error("Ошибка чтения {}", deviceId, e);
            return ReadResult.failure("Failed to read device " + deviceId + ": " + e.getMessage(), e.getKind());
        }
        DeviceHealth health = deviceMonitorService.getHealth(deviceId);
        Instant lastFailureAt = health.getLastFailureAt();
        if (health.getStatus() == HealthStatus.UNHEALTHY
                && lastFailureAt != null
                && lastFailureAt.isAfter(snapshot.getTimestamp())) {
            return ReadResult.stale(snapshot, "Device " + deviceId + " is unreachable, data from "
                    + snapshot.getTimestamp() + ": " + health.getLastError(), health.getLastErrorKind());
        }
        return ReadResult.fresh(snapshot);
    }

    @Override
    public ReadResult getCached(String deviceId) {
        return getCached(deviceId, monitorConfiguration.getMaxCacheAge());
    }

    @Override
    public WriteResult writeSetpoint(String deviceId, String parameterName, Object value) {
        try {
            DeviceRecord record = deviceRecordService.getDevice(deviceId);
            RegisterRange range = findRange(record, parameterName);
            Parameter parameter = range.getParameters().stream()
                    .filter(candidate -> candidate.getName().equals(parameterName))
                    .findFirst()
                    .orElseThrow();
            /* проверка и кодирование до подключения к устройству */
            int[] words = registerOperations.encodeWrite(range, parameter, value);
            deviceMonitorService.runExclusive(deviceId, (device, handle) -> {
                registerOperations.writeEncoded(handle, range, parameter, words);
                return null;
            });
            logger.info("{} на {} записан: {}", parameterName, deviceId, value);
            deviceMonitorService.invalidate(deviceId);
            return WriteResult.success("Successfully set " + parameterName + " to " + value);
        } catch (ModbusException e) {
            logger.error("Ошибка записи {} на {}", parameterName, deviceId, e);
            return WriteResult.failure("Failed to set " + parameterName + ": " + e.getMessage(), e.getKind());
        }
    }

    private RegisterRange findRange(DeviceRecord record, String parameterName) throws ValidationException {
        for (RegisterRange range : record.getRanges()) {
            for (Parameter parameter : range.getParameters()) {
                if (parameter.getName().equals(parameterName)) {
                    return range;
                }
            }
        }
        throw new ValidationException("Unknown parameter " + parameterName + " on device " + record.getDeviceId());
    }

    @Override
    public CoilWriteResult writeCoil(String deviceId, int address, boolean value, CoilType coilType) {
        CoilWriteResult result;
        try {
            registerOperations.checkCoilWrite(address, 1);
            deviceMonitorService.runExclusive(deviceId, (device, handle) -> {
                registerOperations.writeCoil(handle, address, value);
                return null;
            });
            deviceMonitorService.invalidate(deviceId);
            result = CoilWriteResult.applied(address, value);
        } catch (ModbusException e) {
            logger.error("Ошибка записи катушки {} на {}", address, deviceId, e);
            result = CoilWriteResult.failed(address, value, e.getKind(), e.getMessage());
        }
        return result.withCoilType(coilType);
    }

    @Override
    public CoilBatchWriteResult writeCoils(String deviceId, int address, List<Boolean> values, CoilType coilType) {
        boolean[] batch = new boolean[values.size()];
        for (int i = 0; i < batch.length; i++) {
            batch[i] = Boolean.TRUE.equals(values.get(i));
        }
        List<CoilWriteResult> results;
        try {
            registerOperations.checkCoilWrite(address, batch.length);
            results = deviceMonitorService.runExclusive(deviceId,
                    (device, handle) -> registerOperations.writeCoils(handle, address, batch));
        } catch (ModbusException e) {
            logger.error("Ошибка записи катушек {} на {}", address, deviceId, e);
            results = new ArrayList<>(batch.length);
            for (int i = 0; i < batch.length; i++) {
                results.add(CoilWriteResult.failed(address + i, batch[i], e.getKind(), e.getMessage()));
            }
        }
        List<CoilWriteResult> typed = new ArrayList<>(results.size());
        results.forEach(result -> typed.add(result.withCoilType(coilType)));
        CoilBatchWriteResult batchResult = new CoilBatchWriteResult(typed);
        if (batchResult.isSuccess()) {
            deviceMonitorService.invalidate(deviceId);
        }
        return batchResult;
    }
}
