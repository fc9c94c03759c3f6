package fieldbus.monitor.service;

import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.DeviceRecord;

import java.util.List;

public interface DeviceRecordService {
    /**
     * Получение описания устройства. Результат кэшируется на короткое время,
     * поэтому изменения конфигурации доходят до опроса с задержкой.
     *
     * @param deviceId id устройства
     * @return описание устройства
     * @throws ValidationException если устройство неизвестно
     */
    DeviceRecord getDevice(String deviceId) throws ValidationException;

    List<DeviceRecord> getDevices();
}
