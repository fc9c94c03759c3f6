package fieldbus.monitor.transport;

import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.ErrorKind;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModbusErrorsTest {

    @Test
    @DisplayName("Проверка классификации сетевых ошибок")
    void checkSocketErrors() {
        ModbusException timeout = ModbusErrors.translate(
            new IOException(new SocketTimeoutException("Read timed out")), "Read failed for", "tcp://10.0.0.5:502");
        assertEquals(ErrorKind.TIMEOUT, timeout.getKind());
        assertTrue(timeout.isRetryable());

        ConnectionException refused = (ConnectionException) ModbusErrors.translate(
            new ConnectException("Connection refused"), "Connect failed for", "tcp://10.0.0.5:502");
        assertEquals(ConnectionFailure.REFUSED, refused.getFailure());
        assertTrue(refused.isRetryable());

        ConnectionException reset = (ConnectionException) ModbusErrors.translate(
            new SocketException("Connection reset"), "Read failed for", "tcp://10.0.0.5:502");
        assertEquals(ConnectionFailure.RESET, reset.getFailure());

        ConnectionException unknownHost = (ConnectionException) ModbusErrors.translate(
            new UnknownHostException("plc.local"), "Connect failed for", "tcp://plc.local:502");
        assertEquals(ConnectionFailure.UNKNOWN_HOST, unknownHost.getFailure());
        assertFalse(unknownHost.isRetryable());
    }

    @Test
    @DisplayName("Проверка классификации ошибок последовательного порта")
    void checkSerialErrors() {
        ConnectionException missing = (ConnectionException) ModbusErrors.translate(
            new IOException("/dev/ttyUSB9 (No such file or directory)"), "Open failed for", "/dev/ttyUSB9");
        assertEquals(ConnectionFailure.PORT_MISSING, missing.getFailure());
        assertEquals("Serial port /dev/ttyUSB9 does not exist", missing.getMessage());
        assertFalse(missing.isRetryable());

        ConnectionException busy = (ConnectionException) ModbusErrors.translate(
            new IOException("Device or resource busy"), "Open failed for", "/dev/ttyUSB0");
        assertEquals(ConnectionFailure.PORT_BUSY, busy.getFailure());
        assertTrue(busy.isRetryable());

        ConnectionException other = (ConnectionException) ModbusErrors.translate(
            new IOException("Input/output error"), "Read failed for", "/dev/ttyUSB0");
        assertEquals(ConnectionFailure.IO, other.getFailure());
    }

    @Test
    @DisplayName("Проверка что собственные исключения не оборачиваются")
    void checkOwnExceptions() {
        ValidationException validation = new ValidationException("Count 0 is out of range 1..125");
        assertSame(validation, ModbusErrors.translate(validation, "Read failed for", "tcp://10.0.0.5:502"));
    }
}
