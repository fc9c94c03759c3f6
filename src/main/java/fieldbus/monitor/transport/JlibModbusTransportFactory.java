package fieldbus.monitor.transport;

import com.intelligt.modbus.jlibmodbus.Modbus;
import com.intelligt.modbus.jlibmodbus.master.ModbusMaster;
import com.intelligt.modbus.jlibmodbus.master.ModbusMasterFactory;
import com.intelligt.modbus.jlibmodbus.serial.SerialParameters;
import com.intelligt.modbus.jlibmodbus.serial.SerialPort;
import com.intelligt.modbus.jlibmodbus.tcp.TcpParameters;
import fieldbus.monitor.configuration.ModbusConfiguration;
import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.TransportKind;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.ConnectionConfig;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class JlibModbusTransportFactory implements ModbusTransportFactory {
    private final ModbusConfiguration modbusConfiguration;

    public JlibModbusTransportFactory(ModbusConfiguration modbusConfiguration) {
        this.modbusConfiguration = modbusConfiguration;
        Modbus.setAutoIncrementTransactionId(true);
    }

    @Override
    public ModbusTransport create(ConnectionConfig config) throws ModbusException {
        ModbusMaster modbusMaster = config.getKind() == TransportKind.STREAM
                ? createTcpMaster(config)
                : createRtuMaster(config);
        modbusMaster.setResponseTimeout((int) config.getTimeoutMs());
        return new JlibModbusTransport(modbusMaster, config.describe());
    }

    private ModbusMaster createTcpMaster(ConnectionConfig config) throws ModbusException {
        try {
            TcpParameters tcpParameters = new TcpParameters();
            tcpParameters.setHost(InetAddress.getByName(config.getHost()));
            tcpParameters.setKeepAlive(modbusConfiguration.isTcpKeepAlive());
            tcpParameters.setPort(config.getPort());
            return ModbusMasterFactory.createModbusMasterTCP(tcpParameters);
        } catch (UnknownHostException e) {
            throw new ConnectionException(ConnectionFailure.UNKNOWN_HOST, "Unknown host " + config.getHost(), e);
        }
    }

    private ModbusMaster createRtuMaster(ConnectionConfig config) throws ModbusException {
        String device = config.getSerialPath();
        /* на linux порт - это файл устройства, отсутствие проверяем до открытия */
        if (device != null && device.startsWith("/") && !Files.exists(Path.of(device))) {
            throw new ConnectionException(ConnectionFailure.PORT_MISSING, "Serial port " + device + " does not exist");
        }
        try {
            SerialParameters serialParameters = new SerialParameters();
            serialParameters.setDevice(device);
            serialParameters.setBaudRate(toBaudRate(config.getBaudRate()));
            serialParameters.setDataBits(config.getDataBits());
            serialParameters.setStopBits(config.getStopBits());
            serialParameters.setParity(toParity(config));
            return ModbusMasterFactory.createModbusMasterRTU(serialParameters);
        } catch (ModbusException e) {
            throw e;
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка открытия порта", device);
        }
    }

    private SerialPort.BaudRate toBaudRate(int baudRate) throws ValidationException {
        return switch (baudRate) {
            case 4800 -> SerialPort.BaudRate.BAUD_RATE_4800;
            case 9600 -> SerialPort.BaudRate.BAUD_RATE_9600;
            case 19200 -> SerialPort.BaudRate.BAUD_RATE_19200;
            case 38400 -> SerialPort.BaudRate.BAUD_RATE_38400;
            case 57600 -> SerialPort.BaudRate.BAUD_RATE_57600;
            case 115200 -> SerialPort.BaudRate.BAUD_RATE_115200;
            default -> throw new ValidationException("Unsupported baud rate " + baudRate);
        };
    }

    private SerialPort.Parity toParity(ConnectionConfig config) {
        return switch (config.getParity()) {
            case EVEN -> SerialPort.Parity.EVEN;
            case ODD -> SerialPort.Parity.ODD;
            case NONE -> SerialPort.Parity.NONE;
        };
    }
}
