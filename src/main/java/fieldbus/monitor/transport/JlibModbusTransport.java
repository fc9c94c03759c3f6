package fieldbus.monitor.transport;

import com.intelligt.modbus.jlibmodbus.master.ModbusMaster;
import fieldbus.monitor.exception.ModbusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JlibModbusTransport implements ModbusTransport {
    private static final Logger logger = LoggerFactory.getLogger(JlibModbusTransport.class);
    private final ModbusMaster modbusMaster;
    private final String target;

    public JlibModbusTransport(ModbusMaster modbusMaster, String target) {
        this.modbusMaster = modbusMaster;
        this.target = target;
    }

    @Override
    public void connect() throws ModbusException {
        try {
            modbusMaster.connect();
            logger.debug("Подключились к {}", target);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка подключения к", target);
        }
    }

    @Override
    public void disconnect() throws ModbusException {
        try {
            modbusMaster.disconnect();
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка отключения от", target);
        }
    }

    @Override
    public boolean isConnected() {
        return modbusMaster.isConnected();
    }

    @Override
    public boolean[] readCoils(int unitId, int address, int quantity) throws ModbusException {
        try {
            return modbusMaster.readCoils(unitId, address, quantity);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка чтения состояний катушек", target);
        }
    }

    @Override
    public boolean[] readDiscreteInputs(int unitId, int address, int quantity) throws ModbusException {
        try {
            return modbusMaster.readDiscreteInputs(unitId, address, quantity);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка чтения состояния входов", target);
        }
    }

    @Override
    public int[] readHoldingRegisters(int unitId, int address, int quantity) throws ModbusException {
        try {
            return modbusMaster.readHoldingRegisters(unitId, address, quantity);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка чтения регистров", target);
        }
    }

    @Override
    public int[] readInputRegisters(int unitId, int address, int quantity) throws ModbusException {
        try {
            return modbusMaster.readInputRegisters(unitId, address, quantity);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка чтения входных регистров", target);
        }
    }

    @Override
    public void writeSingleCoil(int unitId, int address, boolean value) throws ModbusException {
        try {
            modbusMaster.writeSingleCoil(unitId, address, value);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка выставления значения катушки", target);
        }
    }

    @Override
    public void writeMultipleCoils(int unitId, int address, boolean[] values) throws ModbusException {
        try {
            modbusMaster.writeMultipleCoils(unitId, address, values);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка выставления значений катушек", target);
        }
    }

    @Override
    public void writeSingleRegister(int unitId, int address, int value) throws ModbusException {
        try {
            modbusMaster.writeSingleRegister(unitId, address, value);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка записи в регистр", target);
        }
    }

    @Override
    public void writeMultipleRegisters(int unitId, int address, int[] values) throws ModbusException {
        try {
            modbusMaster.writeMultipleRegisters(unitId, address, values);
        } catch (Exception e) {
            throw ModbusErrors.translate(e, "Ошибка записи в регистры", target);
        }
    }
}
