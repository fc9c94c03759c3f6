package fieldbus.monitor.service;

import fieldbus.monitor.enums.CoilType;
import fieldbus.monitor.model.CoilBatchWriteResult;
import fieldbus.monitor.model.CoilWriteResult;
import fieldbus.monitor.model.ConnectionConfig;
import fieldbus.monitor.model.ConnectionTestResult;
import fieldbus.monitor.model.ReadResult;
import fieldbus.monitor.model.WriteResult;

import java.util.List;

/**
 * Операции для внешних потребителей. Ничего не бросают, ошибки возвращаются в результатах.
 */
public interface DeviceGatewayService {
    /**
     * Пробное подключение и отключение
     */
    ConnectionTestResult testConnection(ConnectionConfig config);

    ReadResult readNow(String deviceId);

    ReadResult getCached(String deviceId, long maxAgeMs);

    /**
     * То же, с возрастом кэша из настроек
     */
    ReadResult getCached(String deviceId);

    WriteResult writeSetpoint(String deviceId, String parameterName, Object value);

    CoilWriteResult writeCoil(String deviceId, int address, boolean value, CoilType coilType);

    CoilBatchWriteResult writeCoils(String deviceId, int address, List<Boolean> values, CoilType coilType);
}
