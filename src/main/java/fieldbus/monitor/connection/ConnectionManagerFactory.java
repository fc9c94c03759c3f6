package fieldbus.monitor.connection;

import fieldbus.monitor.model.ConnectionConfig;
import fieldbus.monitor.transport.ModbusTransportFactory;
import fieldbus.monitor.transport.SerialPortRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

@Component
public class ConnectionManagerFactory {
    private final ModbusTransportFactory transportFactory;
    private final SerialPortRegistry serialPortRegistry;
    private final ExecutorService executorService;

    public ConnectionManagerFactory(
            ModbusTransportFactory transportFactory,
            SerialPortRegistry serialPortRegistry,
            @Qualifier("modbusExecutor") ExecutorService executorService
    ) {
        this.transportFactory = transportFactory;
        this.serialPortRegistry = serialPortRegistry;
        this.executorService = executorService;
    }

    public ConnectionManager create(ConnectionConfig config) {
        return new ConnectionManager(config, transportFactory, serialPortRegistry, executorService);
    }
}
