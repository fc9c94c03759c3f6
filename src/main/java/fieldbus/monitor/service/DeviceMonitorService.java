package fieldbus.monitor.service;

import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.DeviceHealth;
import fieldbus.monitor.model.PollResult;
import fieldbus.monitor.model.PollSchedule;
import fieldbus.monitor.model.ReadingSnapshot;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

public interface DeviceMonitorService {
    /**
     * Опрос устройства. Если опрос этого устройства уже идет, сразу возвращает SKIPPED.
     * Ошибки не бросаются, а попадают в результат и в состояние здоровья устройства.
     */
    PollResult poll(String deviceId);

    /**
     * Внеочередной опрос мимо кэша. Если опрос уже идет, дожидается его результата.
     *
     * @throws ModbusException если опрос не удался
     */
    ReadingSnapshot readNow(String deviceId) throws ModbusException;

    /**
     * Последний снимок, если он не старше maxAgeMs, иначе новый опрос.
     * Если новый опрос не удался, но старый снимок есть, возвращается старый.
     *
     * @throws ModbusException если нет ни свежих, ни старых данных
     */
    ReadingSnapshot getCached(String deviceId, long maxAgeMs) throws ModbusException;

    /**
     * @return имена параметров, значения которых изменились сильнее порога точности
     */
    List<String> detectChanges(@Nullable ReadingSnapshot previous, ReadingSnapshot current);

    void schedule(String deviceId, long intervalMs) throws ValidationException;

    void schedule(String deviceId, PollSchedule schedule) throws ValidationException;

    /**
     * Снятие с расписания. Идущий опрос не прерывается, но его результат отбрасывается.
     */
    void unschedule(String deviceId);

    boolean isScheduled(String deviceId);

    /**
     * @return текущий интервал опроса по расписанию (для адаптивного расписания меняется), пусто если не на опросе
     */
    OptionalLong getPollInterval(String deviceId);

    /**
     * @return идет ли сейчас опрос устройства
     */
    boolean isPolling(String deviceId);

    /**
     * Снятие с расписания и удаление всего состояния устройства
     */
    void forget(String deviceId);

    /**
     * Выполнение операции на устройстве с монопольным доступом к нему: опросы и другие операции ждут.
     */
    <T> T runExclusive(String deviceId, DeviceOperation<T> operation) throws ModbusException;

    /**
     * Пометка кэша устройства как устаревшего, следующий getCached выполнит опрос
     */
    void invalidate(String deviceId);

    Optional<ReadingSnapshot> getLastSnapshot(String deviceId);

    DeviceHealth getHealth(String deviceId);

    Map<String, DeviceHealth> getHealthByDevice();
}
