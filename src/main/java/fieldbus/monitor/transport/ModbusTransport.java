package fieldbus.monitor.transport;

import fieldbus.monitor.exception.ModbusException;

/**
 * Примитивы протокола modbus для одного физического подключения.
 * Реализация не потокобезопасна: одновременно выполняется не больше одной операции.
 */
public interface ModbusTransport {
    /**
     * Открытие подключения
     *
     * @throws ModbusException
     */
    void connect() throws ModbusException;

    /**
     * Закрытие подключения, повторный вызов допустим
     *
     * @throws ModbusException
     */
    void disconnect() throws ModbusException;

    /**
     * @return состояние подключения без обращения к устройству
     */
    boolean isConnected();

    /**
     * Чтение катушек (F01)
     *
     * @param unitId   modbus адрес устройства
     * @param address  адрес первой катушки
     * @param quantity количество катушек
     * @return состояния катушек
     */
    boolean[] readCoils(int unitId, int address, int quantity) throws ModbusException;

    /**
     * Чтение дискретных входов (F02)
     */
    boolean[] readDiscreteInputs(int unitId, int address, int quantity) throws ModbusException;

    /**
     * Чтение Holding Registers (F03)
     */
    int[] readHoldingRegisters(int unitId, int address, int quantity) throws ModbusException;

    /**
     * Чтение Input Registers (F04)
     */
    int[] readInputRegisters(int unitId, int address, int quantity) throws ModbusException;

    void writeSingleCoil(int unitId, int address, boolean value) throws ModbusException;

    void writeMultipleCoils(int unitId, int address, boolean[] values) throws ModbusException;

    void writeSingleRegister(int unitId, int address, int value) throws ModbusException;

    void writeMultipleRegisters(int unitId, int address, int[] values) throws ModbusException;
}
