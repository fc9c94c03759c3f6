package fieldbus.monitor.connection;

import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.transport.ModbusTransport;

@FunctionalInterface
public interface TransportCall<T> {
    T call(ModbusTransport transport) throws ModbusException;
}
