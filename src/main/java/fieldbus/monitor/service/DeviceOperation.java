package fieldbus.monitor.service;

import fieldbus.monitor.connection.ConnectionHandle;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.model.DeviceRecord;

@FunctionalInterface
public interface DeviceOperation<T> {
    T apply(DeviceRecord record, ConnectionHandle handle) throws ModbusException;
}
