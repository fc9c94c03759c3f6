package fieldbus.monitor.service;

import fieldbus.monitor.connection.ConnectionHandle;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.CoilWriteResult;
import fieldbus.monitor.model.Parameter;
import fieldbus.monitor.model.ParameterReading;
import fieldbus.monitor.model.RangeData;
import fieldbus.monitor.model.RegisterRange;

import java.util.List;

public interface RegisterOperationsService {
    /**
     * Чтение диапазона функцией, соответствующей коду диапазона (F01-F04). Ничего не декодирует.
     *
     * @param handle подключение
     * @param range  диапазон
     * @return сырые слова (для катушек и входов - 0/1 вместе с исходными битами)
     * @throws ValidationException если адреса или количество вне допустимых пределов, до обращения к устройству
     */
    RangeData readRange(ConnectionHandle handle, RegisterRange range) throws ModbusException;

    /**
     * Чтение диапазона и декодирование параметров. Ошибка одного параметра не мешает остальным.
     */
    List<ParameterReading> readParameters(ConnectionHandle handle, RegisterRange range, List<Parameter> parameters)
            throws ModbusException;

    /**
     * Декодирование параметров из уже прочитанного диапазона
     */
    List<ParameterReading> decodeParameters(RangeData data, List<Parameter> parameters);

    /**
     * Запись одной катушки (F05)
     */
    void writeCoil(ConnectionHandle handle, int address, boolean value) throws ModbusException;

    /**
     * Запись нескольких подряд идущих катушек одним запросом (F15). Ошибка транспорта отмечается
     * в результате каждой катушки.
     *
     * @return результат по каждой катушке в порядке адресов
     * @throws ValidationException если адрес или количество вне допустимых пределов
     */
    List<CoilWriteResult> writeCoils(ConnectionHandle handle, int address, boolean[] values)
            throws ValidationException;

    /**
     * Запись значения параметра по адресу начало диапазона + смещение параметра (F06/F16, для катушек F05)
     */
    void writeParameter(ConnectionHandle handle, RegisterRange range, Parameter parameter, Object value)
            throws ModbusException;

    /**
     * Проверка адреса и количества катушек для записи, без обращения к устройству
     */
    void checkCoilWrite(int address, int count) throws ValidationException;

    /**
     * Проверка записи параметра и кодирование значения, без обращения к устройству
     *
     * @return слова для записи (для катушки - одно слово 0/1)
     * @throws ValidationException если параметр только для чтения, значение вне диапазона типа
     *                             или адреса вне допустимых пределов
     */
    int[] encodeWrite(RegisterRange range, Parameter parameter, Object value) throws ValidationException;

    /**
     * Запись уже закодированного значения параметра
     *
     * @param words результат {@link #encodeWrite}
     */
    void writeEncoded(ConnectionHandle handle, RegisterRange range, Parameter parameter, int[] words)
            throws ModbusException;
}
