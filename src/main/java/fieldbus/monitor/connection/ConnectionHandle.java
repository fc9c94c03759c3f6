package fieldbus.monitor.connection;

import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.ErrorKind;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.model.ConnectionConfig;
import fieldbus.monitor.transport.ModbusTransport;

/**
 * Живое подключение, выданное {@link ConnectionManager} на время одной операции.
 * Закрывается через try-with-resources, повторное закрытие ничего не делает.
 */
public class ConnectionHandle implements AutoCloseable {
    private final ConnectionManager manager;
    private final ModbusTransport transport;
    private final ConnectionConfig config;
    private volatile boolean open = true;

    ConnectionHandle(ConnectionManager manager, ModbusTransport transport, ConnectionConfig config) {
        this.manager = manager;
        this.transport = transport;
        this.config = config;
    }

    /**
     * Выполнение операции на транспорте с таймаутом из настроек подключения.
     * При таймауте или обрыве связи подключение принудительно закрывается.
     *
     * @param operation название операции для сообщений об ошибках
     * @param call      операция
     */
    public <T> T call(String operation, TransportCall<T> call) throws ModbusException {
        if (!open) {
            throw new ConnectionException(ConnectionFailure.IO, "Connection to " + config.describe() + " is closed");
        }
        try {
            return manager.execute(operation, config.getTimeoutMs(), () -> call.call(transport));
        } catch (ModbusException e) {
            if (e.getKind() == ErrorKind.TIMEOUT || e.getKind() == ErrorKind.CONNECTION) {
                manager.markFailed();
            }
            throw e;
        }
    }

    public int getUnitId() {
        return config.getUnitId();
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    public boolean isOpen() {
        return open;
    }

    ModbusTransport getTransport() {
        return transport;
    }

    void invalidate() {
        open = false;
    }

    @Override
    public void close() {
        if (open) {
            manager.disconnect();
        }
    }
}
