package fieldbus.monitor.transport;

import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.model.ConnectionConfig;

public interface ModbusTransportFactory {
    /**
     * Создание нового транспорта для подключения. Сам транспорт еще не подключен.
     *
     * @param config параметры подключения
     * @return транспорт
     * @throws ModbusException если транспорт невозможно создать (неизвестный хост, нет порта и т.п.)
     */
    ModbusTransport create(ConnectionConfig config) throws ModbusException;
}
