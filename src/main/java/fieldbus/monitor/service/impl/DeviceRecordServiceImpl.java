package fieldbus.monitor.service.impl;

import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.DeviceRecord;
import fieldbus.monitor.service.DeviceRecordService;
import fieldbus.monitor.service.DeviceRecordSource;
import org.springframework.cache.annotation.CacheConfig;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@CacheConfig(cacheNames = {"device_records"})
public class DeviceRecordServiceImpl implements DeviceRecordService {
    private final DeviceRecordSource deviceRecordSource;

    public DeviceRecordServiceImpl(DeviceRecordSource deviceRecordSource) {
        this.deviceRecordSource = deviceRecordSource;
    }

    @Override
    @Cacheable
    public DeviceRecord getDevice(String deviceId) throws ValidationException {
        return deviceRecordSource.findDevice(deviceId)
                .orElseThrow(() -> new ValidationException("Unknown device " + deviceId));
    }

    @Override
    public List<DeviceRecord> getDevices() {
        return deviceRecordSource.findAll();
    }
}
