package fieldbus.monitor.model;

import fieldbus.monitor.enums.Parity;
import fieldbus.monitor.enums.TransportKind;
import fieldbus.monitor.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;

import java.util.Set;

/**
 * Параметры подключения к одному устройству вместе с политикой таймаутов и повторов.
 * Неизменяемый объект, изменение политики создает копию.
 */
public class ConnectionConfig {
    public static final int DEFAULT_TCP_PORT = 502;
    public static final int DEFAULT_UNIT_ID = 1;
    public static final int DEFAULT_BAUD_RATE = 9600;
    public static final int DEFAULT_DATA_BITS = 8;
    public static final int DEFAULT_STOP_BITS = 1;
    public static final long DEFAULT_TIMEOUT_MS = 5000;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10000;
    public static final long DEFAULT_RETRY_DELAY_MS = 500;
    public static final int MAX_UNIT_ID = 247;
    public static final Set<Integer> SUPPORTED_BAUD_RATES = Set.of(4800, 9600, 19200, 38400, 57600, 115200);

    private final TransportKind kind;
    private final String host;
    private final Integer port;
    private final String serialPath;
    private final int baudRate;
    private final int dataBits;
    private final int stopBits;
    private final Parity parity;
    private final int unitId;
    private final long timeoutMs;
    private final long connectTimeoutMs;
    private final int retries;
    private final long retryDelayMs;

    private ConnectionConfig(
            TransportKind kind,
            @Nullable String host,
            @Nullable Integer port,
            @Nullable String serialPath,
            int baudRate,
            int dataBits,
            int stopBits,
            Parity parity,
            int unitId,
            long timeoutMs,
            long connectTimeoutMs,
            int retries,
            long retryDelayMs
    ) {
        this.kind = kind;
        this.host = host;
        this.port = port;
        this.serialPath = serialPath;
        this.baudRate = baudRate;
        this.dataBits = dataBits;
        this.stopBits = stopBits;
        this.parity = parity;
        this.unitId = unitId;
        this.timeoutMs = timeoutMs;
        this.connectTimeoutMs = connectTimeoutMs;
        this.retries = retries;
        this.retryDelayMs = retryDelayMs;
    }

    public static ConnectionConfig stream(@Nullable String host, @Nullable Integer port, @Nullable Integer unitId) {
        return new ConnectionConfig(
                TransportKind.STREAM,
                host,
                port != null ? port : DEFAULT_TCP_PORT,
                null,
                DEFAULT_BAUD_RATE,
                DEFAULT_DATA_BITS,
                DEFAULT_STOP_BITS,
                Parity.NONE,
                unitId != null ? unitId : DEFAULT_UNIT_ID,
                DEFAULT_TIMEOUT_MS,
                DEFAULT_CONNECT_TIMEOUT_MS,
                0,
                DEFAULT_RETRY_DELAY_MS
        );
    }

    public static ConnectionConfig serial(
            @Nullable String serialPath,
            @Nullable Integer baudRate,
            @Nullable Integer dataBits,
            @Nullable Integer stopBits,
            @Nullable Parity parity,
            @Nullable Integer unitId
    ) {
        return new ConnectionConfig(
                TransportKind.SERIAL,
                null,
                null,
                serialPath,
                baudRate != null ? baudRate : DEFAULT_BAUD_RATE,
                dataBits != null ? dataBits : DEFAULT_DATA_BITS,
                stopBits != null ? stopBits : DEFAULT_STOP_BITS,
                parity != null ? parity : Parity.NONE,
                unitId != null ? unitId : DEFAULT_UNIT_ID,
                DEFAULT_TIMEOUT_MS,
                DEFAULT_CONNECT_TIMEOUT_MS,
                0,
                DEFAULT_RETRY_DELAY_MS
        );
    }

    public ConnectionConfig withPolicy(long timeoutMs, long connectTimeoutMs, int retries, long retryDelayMs) {
        return new ConnectionConfig(kind, host, port, serialPath, baudRate, dataBits, stopBits, parity, unitId,
                timeoutMs, connectTimeoutMs, retries, retryDelayMs);
    }

    public void validate() throws ValidationException {
        if (kind == TransportKind.STREAM) {
            if (StringUtils.isBlank(host)) {
                throw new ValidationException("Missing IP address for TCP connection");
            }
            if (port == null || port < 1 || port > 65535) {
                throw new ValidationException("Invalid TCP port " + port);
            }
        } else {
            if (StringUtils.isBlank(serialPath)) {
                throw new ValidationException("Missing serial port for RTU connection");
            }
            if (!SUPPORTED_BAUD_RATES.contains(baudRate)) {
                throw new ValidationException("Unsupported baud rate " + baudRate);
            }
            if (dataBits < 5 || dataBits > 8) {
                throw new ValidationException("Invalid data bits " + dataBits);
            }
            if (stopBits != 1 && stopBits != 2) {
                throw new ValidationException("Invalid stop bits " + stopBits);
            }
        }
        if (unitId < 0 || unitId > MAX_UNIT_ID) {
            throw new ValidationException("Invalid unit id " + unitId);
        }
        if (timeoutMs <= 0 || connectTimeoutMs <= 0) {
            throw new ValidationException("Timeout must be positive");
        }
        if (retries < 0 || retryDelayMs < 0) {
            throw new ValidationException("Retry policy must not be negative");
        }
    }

    public TransportKind getKind() {
        return kind;
    }

    public @Nullable String getHost() {
        return host;
    }

    public @Nullable Integer getPort() {
        return port;
    }

    public @Nullable String getSerialPath() {
        return serialPath;
    }

    public int getBaudRate() {
        return baudRate;
    }

    public int getDataBits() {
        return dataBits;
    }

    public int getStopBits() {
        return stopBits;
    }

    public Parity getParity() {
        return parity;
    }

    public int getUnitId() {
        return unitId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public int getRetries() {
        return retries;
    }

    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    public String describe() {
        return kind == TransportKind.STREAM ? host + ":" + port : serialPath;
    }

    @Override
    public String toString() {
        return kind + " " + describe() + " unit " + unitId;
    }
}
