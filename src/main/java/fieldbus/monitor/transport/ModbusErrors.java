package fieldbus.monitor.transport;

import com.intelligt.modbus.jlibmodbus.exception.ModbusNumberException;
import com.intelligt.modbus.jlibmodbus.exception.ModbusProtocolException;
import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ModbusTimeoutException;
import fieldbus.monitor.exception.ProtocolException;
import fieldbus.monitor.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Перевод исключений jlibmodbus и сокетов в собственную классификацию ошибок.
 */
public final class ModbusErrors {
    private ModbusErrors() {
    }

    public static ModbusException translate(Throwable e, String operation, String target) {
        if (e instanceof ModbusException) {
            return (ModbusException) e;
        }
        String reason = ExceptionUtils.getRootCauseMessage(e);
        String message = operation + " " + target + ": " + reason;
        List<Throwable> chain = ExceptionUtils.getThrowableList(e);

        if (e instanceof ModbusProtocolException) {
            return new ProtocolException(message, null, e);
        }
        if (e instanceof ModbusNumberException) {
            return new ValidationException(message);
        }
        if (chain.stream().anyMatch(t -> t instanceof SocketTimeoutException || t instanceof TimeoutException)
                || StringUtils.containsIgnoreCase(reason, "timeout")
                || StringUtils.containsIgnoreCase(reason, "timed out")) {
            return new ModbusTimeoutException(message, e);
        }
        if (chain.stream().anyMatch(t -> t instanceof UnknownHostException)) {
            return new ConnectionException(ConnectionFailure.UNKNOWN_HOST, message, e);
        }
        if (chain.stream().anyMatch(t -> t instanceof ConnectException)) {
            return new ConnectionException(ConnectionFailure.REFUSED, message, e);
        }
        if (StringUtils.containsIgnoreCase(reason, "No such file or directory")) {
            return new ConnectionException(ConnectionFailure.PORT_MISSING, "Serial port " + target + " does not exist",
                    e);
        }
        if (StringUtils.containsIgnoreCase(reason, "busy")) {
            return new ConnectionException(ConnectionFailure.PORT_BUSY, "Serial port " + target + " is busy", e);
        }
        if (chain.stream().anyMatch(t -> t instanceof SocketException)
                && (StringUtils.containsIgnoreCase(reason, "reset")
                || StringUtils.containsIgnoreCase(reason, "broken pipe"))) {
            return new ConnectionException(ConnectionFailure.RESET, message, e);
        }
        return new ConnectionException(ConnectionFailure.IO, message, e);
    }
}
