package fieldbus.monitor.service;

import fieldbus.monitor.model.DeviceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Внешний источник описаний устройств (база, файл конфигурации и т.п.)
 */
public interface DeviceRecordSource {
    Optional<DeviceRecord> findDevice(String deviceId);

    List<DeviceRecord> findAll();
}
