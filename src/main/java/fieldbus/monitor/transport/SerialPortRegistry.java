package fieldbus.monitor.transport;

import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.exception.ConnectionException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Учет занятых последовательных портов внутри процесса: один порт - одно подключение.
 */
@Component
public class SerialPortRegistry {
    private final Set<String> claimedPorts = ConcurrentHashMap.newKeySet();

    public void claim(String serialPath) throws ConnectionException {
        if (!claimedPorts.add(serialPath)) {
            throw new ConnectionException(ConnectionFailure.PORT_BUSY, "Serial port " + serialPath + " is busy");
        }
    }

    public void release(String serialPath) {
        claimedPorts.remove(serialPath);
    }

    public boolean isClaimed(String serialPath) {
        return claimedPorts.contains(serialPath);
    }
}
