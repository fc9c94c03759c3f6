package fieldbus.monitor.connection;

import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.ConnectionState;
import fieldbus.monitor.enums.TransportKind;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ModbusTimeoutException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.ConnectionConfig;
import fieldbus.monitor.transport.ModbusErrors;
import fieldbus.monitor.transport.ModbusTransport;
import fieldbus.monitor.transport.ModbusTransportFactory;
import fieldbus.monitor.transport.SerialPortRegistry;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Жизненный цикл одного логического подключения к одному устройству:
 * IDLE -> CONNECTING -> CONNECTED -> CLOSING -> IDLE, при ошибке CONNECTING -> FAILED -> IDLE.
 * <p>
 * Одновременно допускается одна операция, вызывающие должны упорядочивать обращения сами.
 */
public class ConnectionManager {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);
    private final ConnectionConfig config;
    private final ModbusTransportFactory transportFactory;
    private final SerialPortRegistry serialPortRegistry;
    private final ExecutorService executorService;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.IDLE);
    private ModbusTransport transport;
    private ConnectionHandle handle;
    private boolean portClaimed;

    public ConnectionManager(
            ConnectionConfig config,
            ModbusTransportFactory transportFactory,
            SerialPortRegistry serialPortRegistry,
            ExecutorService executorService
    ) {
        this.config = config;
        this.transportFactory = transportFactory;
        this.serialPortRegistry = serialPortRegistry;
        this.executorService = executorService;
    }

    public ConnectionHandle connect() throws ModbusException {
        config.validate();
        if (!state.compareAndSet(ConnectionState.IDLE, ConnectionState.CONNECTING)) {
            throw new IllegalStateException("Connection to " + config.describe() + " is busy: " + state.get());
        }
        try {
            ModbusTransport created = openTransport();
            execute("Connect", config.getConnectTimeoutMs(), () -> {
                created.connect();
                return null;
            });
            synchronized (this) {
                handle = new ConnectionHandle(this, created, config);
                state.set(ConnectionState.CONNECTED);
                return handle;
            }
        } catch (ModbusTimeoutException e) {
            fail();
            throw new ConnectionException(ConnectionFailure.TIMEOUT, "Connection to " + config.describe()
                    + " timed out after " + config.getConnectTimeoutMs() + " ms", e);
        } catch (ModbusException e) {
            fail();
            throw e;
        } catch (RuntimeException e) {
            fail();
            throw e;
        }
    }

    /**
     * Подключение с политикой повторов из настроек подключения
     */
    public ConnectionHandle connectWithRetries() throws ModbusException {
        return connectWithRetries(config.getRetries(), config.getRetryDelayMs());
    }

    /**
     * Подключение с повторами: всего retries + 1 попыток с фиксированной паузой между ними.
     * Неповторяемые ошибки (например, неверная конфигурация) возвращаются сразу.
     */
    public ConnectionHandle connectWithRetries(int retries, long retryDelayMs) throws ModbusException {
        if (retries < 0 || retryDelayMs < 0) {
            throw new ValidationException("Retry policy must not be negative");
        }
        ModbusException lastError = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (attempt > 0) {
                pause(retryDelayMs);
            }
            try {
                return connect();
            } catch (ModbusException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastError = e;
                logger.warn("Попытка {} из {} подключения к {} не удалась: {}", attempt + 1, retries + 1,
                        config.describe(), e.getMessage());
            }
        }
        throw lastError;
    }

    /**
     * Закрытие подключения. Идемпотентно и никогда не бросает исключений: ошибки закрытия только логируются.
     */
    public void disconnect() {
        synchronized (this) {
            if (state.get() == ConnectionState.IDLE) {
                return;
            }
            state.set(ConnectionState.CLOSING);
            release();
        }
    }

    /**
     * Проверка живости подключения без обращения к устройству
     */
    public boolean isHealthy(@Nullable ConnectionHandle connectionHandle) {
        synchronized (this) {
            return connectionHandle != null
                    && connectionHandle == handle
                    && connectionHandle.isOpen()
                    && state.get() == ConnectionState.CONNECTED
                    && connectionHandle.getTransport().isConnected();
        }
    }

    public ConnectionState getState() {
        return state.get();
    }

    public ConnectionConfig getConfig() {
        return config;
    }

    /* принудительный перевод в FAILED с освобождением ресурсов, вызывается после таймаута или обрыва */
    void markFailed() {
        fail();
    }

    <T> T execute(String operation, long timeoutMs, Callable<T> call) throws ModbusException {
        Future<T> future = executorService.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModbusTimeoutException(
                    operation + " to " + config.describe() + " timed out after " + timeoutMs + " ms", e);
        } catch (ExecutionException e) {
            throw ModbusErrors.translate(e.getCause(), operation + " failed for", config.describe());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ModbusTimeoutException(operation + " to " + config.describe() + " was interrupted", e);
        }
    }

    private ModbusTransport openTransport() throws ModbusException {
        synchronized (this) {
            if (config.getKind() == TransportKind.SERIAL) {
                serialPortRegistry.claim(config.getSerialPath());
                portClaimed = true;
            }
            transport = transportFactory.create(config);
            return transport;
        }
    }

    private void fail() {
        synchronized (this) {
            if (state.get() == ConnectionState.IDLE) {
                return;
            }
            state.set(ConnectionState.FAILED);
            release();
        }
    }

    private void release() {
        ConnectionHandle currentHandle = handle;
        handle = null;
        if (currentHandle != null) {
            currentHandle.invalidate();
        }
        ModbusTransport currentTransport = transport;
        transport = null;
        if (currentTransport != null) {
            try {
                currentTransport.disconnect();
            } catch (Exception e) {
                logger.warn("Ошибка закрытия подключения к {}: {}", config.describe(), e.getMessage());
            }
        }
        if (portClaimed) {
            serialPortRegistry.release(config.getSerialPath());
            portClaimed = false;
        }
        state.set(ConnectionState.IDLE);
    }

    private void pause(long retryDelayMs) throws ConnectionException {
        try {
            Thread.sleep(retryDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException(ConnectionFailure.IO,
                    "Interrupted while waiting to reconnect to " + config.describe(), e);
        }
    }
}
