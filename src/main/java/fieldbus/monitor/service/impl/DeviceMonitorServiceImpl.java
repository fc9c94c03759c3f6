package fieldbus.monitor.service.impl;

import fieldbus.monitor.configuration.MonitorConfiguration;
import fieldbus.monitor.connection.ConnectionHandle;
import fieldbus.monitor.connection.ConnectionManager;
import fieldbus.monitor.connection.ConnectionManagerFactory;
import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.ErrorKind;
import fieldbus.monitor.enums.HealthStatus;
import fieldbus.monitor.enums.PollStatus;
import fieldbus.monitor.event.error.DevicePollErrorEvent;
import fieldbus.monitor.event.info.ReadingsChangedEvent;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ModbusTimeoutException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.DeviceHealth;
import fieldbus.monitor.model.DeviceRecord;
import fieldbus.monitor.model.ParameterReading;
import fieldbus.monitor.model.PollResult;
import fieldbus.monitor.model.PollSchedule;
import fieldbus.monitor.model.RangeData;
import fieldbus.monitor.model.ReadingSnapshot;
import fieldbus.monitor.model.RegisterRange;
import fieldbus.monitor.service.DeviceMonitorService;
import fieldbus.monitor.service.DeviceOperation;
import fieldbus.monitor.service.DeviceRecordService;
import fieldbus.monitor.service.RegisterOperationsService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@Service
public class DeviceMonitorServiceImpl implements DeviceMonitorService {
    private static final Logger logger = LoggerFactory.getLogger(DeviceMonitorServiceImpl.class);
    private final Map<String, DeviceState> devices = new ConcurrentHashMap<>();
    private final DeviceRecordService deviceRecordService;
    private final RegisterOperationsService registerOperations;
    private final ConnectionManagerFactory connectionManagerFactory;
    private final MonitorConfiguration monitorConfiguration;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final MeterRegistry meterRegistry;
    private final TaskScheduler taskScheduler;
    private final ExecutorService pollExecutor;
    private final Clock clock;

    public DeviceMonitorServiceImpl(
            DeviceRecordService deviceRecordService,
            RegisterOperationsService registerOperations,
            ConnectionManagerFactory connectionManagerFactory,
            MonitorConfiguration monitorConfiguration,
            ApplicationEventPublisher applicationEventPublisher,
            MeterRegistry meterRegistry,
            @Qualifier("pollScheduler") TaskScheduler taskScheduler,
            @Qualifier("pollExecutor") ExecutorService pollExecutor,
            Clock clock
    ) {
        this.deviceRecordService = deviceRecordService;
        this.registerOperations = registerOperations;
        this.connectionManagerFactory = connectionManagerFactory;
        this.monitorConfiguration = monitorConfiguration;
        this.applicationEventPublisher = applicationEventPublisher;
        this.meterRegistry = meterRegistry;
        this.taskScheduler = taskScheduler;
        this.pollExecutor = pollExecutor;
        this.clock = clock;
    }

    @EventListener(ContextRefreshedEvent.class)
    public void scheduleConfiguredDevices() {
        if (!monitorConfiguration.isAutoStart()) {
            return;
        }
        for (DeviceRecord record : deviceRecordService.getDevices()) {
            if (record.isEnabled() && record.getPollSchedule() != null) {
                try {
                    schedule(record.getDeviceId(), record.getPollSchedule());
                } catch (ValidationException e) {
                    logger.error("Не удалось поставить на опрос {}: {}", record.getDeviceId(), e.getMessage());
                }
            }
        }
    }

    @PreDestroy
    public void stop() {
        devices.keySet().forEach(this::unschedule);
    }

    @Override
    public PollResult poll(String deviceId) {
        DeviceState state;
        try {
            state = stateFor(deviceId);
        } catch (ValidationException e) {
            return PollResult.failed(deviceId, e);
        }
        return runPoll(state, null);
    }

    @Override
    public ReadingSnapshot readNow(String deviceId) throws ModbusException {
        PollResult result = pollOrJoin(stateFor(deviceId));
        if (result.isCompleted()) {
            return result.getSnapshot();
        }
        throw errorOf(result);
    }

    @Override
    public ReadingSnapshot getCached(String deviceId, long maxAgeMs) throws ModbusException {
        DeviceState state = stateFor(deviceId);
        ReadingSnapshot cached = state.lastSnapshot.get();
        if (cached != null && !state.invalidated
                && Duration.between(cached.getTimestamp(), clock.instant()).toMillis() <= maxAgeMs) {
            return cached;
        }
        PollResult result = pollOrJoin(state);
        if (result.isCompleted()) {
            return result.getSnapshot();
        }
        /* устаревшие данные лучше, чем никаких: ошибка уже отражена в состоянии здоровья */
        ReadingSnapshot stale = state.lastSnapshot.get();
        if (stale != null) {
            logger.debug("{} - опрос не удался, отдаем снимок от {}", deviceId, stale.getTimestamp());
            return stale;
        }
        throw errorOf(result);
    }

    @Override
    public List<String> detectChanges(@Nullable ReadingSnapshot previous, ReadingSnapshot current) {
        if (previous == null) {
            return current.getReadings().stream().map(ParameterReading::getName).collect(Collectors.toList());
        }
        Map<String, ParameterReading> before = new LinkedHashMap<>();
        previous.getReadings().forEach(reading -> before.put(reading.getName(), reading));

        List<String> changed = new ArrayList<>();
        for (ParameterReading reading : current.getReadings()) {
            ParameterReading old = before.remove(reading.getName());
            if (old == null || isChanged(old, reading)) {
                changed.add(reading.getName());
            }
        }
        /* пропавшие параметры тоже считаются изменением */
        changed.addAll(before.keySet());
        return changed;
    }

    private boolean isChanged(ParameterReading old, ParameterReading current) {
        if (old.isError() || current.isError()) {
            return old.getErrorKind() != current.getErrorKind();
        }
        Object oldValue = old.getValue();
        Object newValue = current.getValue();
        if (oldValue instanceof Number && newValue instanceof Number) {
            double difference = Math.abs(((Number) oldValue).doubleValue() - ((Number) newValue).doubleValue());
            return difference > epsilon(current.getDecimalPrecision());
        }
        return !Objects.equals(oldValue, newValue);
    }

    private double epsilon(@Nullable Integer decimalPrecision) {
        if (decimalPrecision == null) {
            return monitorConfiguration.getChangeEpsilon();
        }
        return Math.pow(10, -decimalPrecision) / 2;
    }

    @Override
    public void schedule(String deviceId, long intervalMs) throws ValidationException {
        schedule(deviceId, PollSchedule.fixed(intervalMs));
    }

    @Override
    public void schedule(String deviceId, PollSchedule schedule) throws ValidationException {
        DeviceState state = stateFor(deviceId);
        synchronized (state) {
            cancelTask(state);
            long generation = state.generation + 1;
            state.generation = generation;
            state.schedule = schedule;
            state.currentIntervalMs = schedule.getIntervalMs();
            state.quietPolls = 0;
            state.task = taskScheduler.schedule(() -> trigger(state, generation), clock.instant());
        }
        logger.info("{} поставлено на опрос каждые {}", deviceId, schedule);
    }

    /* у каждого устройства свой таймер: следующий запуск планируется сразу, опрос уходит в пул */
    private void trigger(DeviceState state, long generation) {
        synchronized (state) {
            if (state.generation != generation) {
                return;
            }
            state.task = taskScheduler.schedule(() -> trigger(state, generation),
                    clock.instant().plusMillis(state.currentIntervalMs));
        }
        try {
            pollExecutor.execute(() -> runPoll(state, generation));
        } catch (RejectedExecutionException e) {
            logger.warn("{} - опрос не запущен, пул остановлен", state.deviceId);
        }
    }

    @Override
    public void unschedule(String deviceId) {
        DeviceState state = devices.get(deviceId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            if (state.schedule == null) {
                return;
            }
            state.generation++;
            cancelTask(state);
            state.schedule = null;
        }
        logger.info("{} снято с опроса", deviceId);
    }

    private void cancelTask(DeviceState state) {
        if (state.task != null) {
            state.task.cancel(false);
            state.task = null;
        }
    }

    @Override
    public boolean isScheduled(String deviceId) {
        DeviceState state = devices.get(deviceId);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return state.schedule != null;
        }
    }

    @Override
    public OptionalLong getPollInterval(String deviceId) {
        DeviceState state = devices.get(deviceId);
        if (state == null) {
            return OptionalLong.empty();
        }
        synchronized (state) {
            return state.schedule != null ? OptionalLong.of(state.currentIntervalMs) : OptionalLong.empty();
        }
    }

    @Override
    public boolean isPolling(String deviceId) {
        DeviceState state = devices.get(deviceId);
        return state != null && state.isInFlight();
    }

    @Override
    public void forget(String deviceId) {
        unschedule(deviceId);
        DeviceState state = devices.remove(deviceId);
        if (state != null) {
            state.meters.forEach(meterRegistry::remove);
        }
    }

    @Override
    public <T> T runExclusive(String deviceId, DeviceOperation<T> operation) throws ModbusException {
        DeviceState state = stateFor(deviceId);
        DeviceRecord record = enabledRecord(deviceId);
        lockSession(state);
        ConnectionManager manager = connectionManagerFactory.create(record.getConnectionConfig());
        try (ConnectionHandle handle = manager.connectWithRetries()) {
            return operation.apply(record, handle);
        } finally {
            manager.disconnect();
            state.sessionLock.unlock();
        }
    }

    @Override
    public void invalidate(String deviceId) {
        DeviceState state = devices.get(deviceId);
        if (state != null) {
            state.invalidated = true;
        }
    }

    @Override
    public Optional<ReadingSnapshot> getLastSnapshot(String deviceId) {
        DeviceState state = devices.get(deviceId);
        return state != null ? Optional.ofNullable(state.lastSnapshot.get()) : Optional.empty();
    }

    @Override
    public DeviceHealth getHealth(String deviceId) {
        DeviceState state = devices.get(deviceId);
        return state != null ? state.health.get() : DeviceHealth.unknown();
    }

    @Override
    public Map<String, DeviceHealth> getHealthByDevice() {
        Map<String, DeviceHealth> health = new LinkedHashMap<>();
        devices.forEach((deviceId, state) -> health.put(deviceId, state.health.get()));
        return health;
    }

    private PollResult runPoll(DeviceState state, @Nullable Long generation) {
        CompletableFuture<PollResult> pending = new CompletableFuture<>();
        if (!state.inFlight.compareAndSet(null, pending)) {
            logger.debug("{} - опрос уже выполняется, пропускаем", state.deviceId);
            return PollResult.skipped(state.deviceId);
        }
        PollResult result = null;
        try {
            try {
                result = doPoll(state, generation);
            } catch (RuntimeException e) {
                logger.error("{} - непредвиденная ошибка опроса", state.deviceId, e);
                result = failPoll(state, generation,
                        new ConnectionException(ConnectionFailure.IO, "Unexpected poll error: " + e.getMessage(), e));
            }
            /* результат отдается ожидающим до освобождения inFlight */
            pending.complete(result);
        } finally {
            if (result == null) {
                pending.cancel(false);
            }
            state.inFlight.set(null);
        }
        return result;
    }

    private PollResult doPoll(DeviceState state, @Nullable Long generation) {
        String deviceId = state.deviceId;
        logger.debug("Запущен опрос {}", deviceId);
        DeviceRecord record;
        try {
            record = enabledRecord(deviceId);
            lockSession(state);
        } catch (ModbusException e) {
            return failPoll(state, generation, e);
        }
        state.record = record;

        List<ParameterReading> readings = new ArrayList<>();
        List<RangeData> rawRanges = new ArrayList<>();
        ModbusException rangeError = null;
        int failedRanges = 0;
        ConnectionManager manager = connectionManagerFactory.create(record.getConnectionConfig());
        try (ConnectionHandle handle = manager.connectWithRetries()) {
            ModbusException fatal = null;
            for (RegisterRange range : record.getRanges()) {
                if (fatal != null) {
                    failedRanges++;
                    readings.addAll(rangeFailure(range, fatal));
                    continue;
                }
                try {
                    RangeData data = registerOperations.readRange(handle, range);
                    rawRanges.add(data);
                    readings.addAll(registerOperations.decodeParameters(data, range.getParameters()));
                } catch (ModbusException e) {
                    logger.warn("{} - ошибка чтения диапазона {}: {}", deviceId, range, e.getMessage());
                    failedRanges++;
                    rangeError = e;
                    readings.addAll(rangeFailure(range, e));
                    /* после таймаута или обрыва подключение уже закрыто */
                    if (e.getKind() == ErrorKind.TIMEOUT || e.getKind() == ErrorKind.CONNECTION) {
                        fatal = e;
                    }
                }
            }
        } catch (ModbusException e) {
            return failPoll(state, generation, e);
        } finally {
            manager.disconnect();
            state.sessionLock.unlock();
        }

        if (rangeError != null && failedRanges == record.getRanges().size()) {
            return failPoll(state, generation, rangeError);
        }
        ReadingSnapshot snapshot = new ReadingSnapshot(deviceId, clock.instant(), readings, rawRanges);
        return completePoll(state, generation, snapshot, rangeError);
    }

    private List<ParameterReading> rangeFailure(RegisterRange range, ModbusException e) {
        return range.getParameters().stream()
                .map(parameter -> ParameterReading.failure(parameter, e.getKind(),
                        "Failed to read range: " + e.getMessage()))
                .collect(Collectors.toList());
    }

    private PollResult completePoll(
            DeviceState state,
            @Nullable Long generation,
            ReadingSnapshot snapshot,
            @Nullable ModbusException partialError
    ) {
        if (isDiscarded(state, generation)) {
            logger.debug("{} - снято с опроса во время опроса, результат отброшен", state.deviceId);
            return PollResult.discarded(state.deviceId);
        }
        ReadingSnapshot previous = state.lastSnapshot.getAndSet(snapshot);
        state.lastPollTime = snapshot.getTimestamp();
        state.invalidated = false;
        HealthStatus before = state.health.get().getStatus();
        DeviceHealth health = state.health.updateAndGet(current -> partialError == null
                ? current.afterSuccess(snapshot.getTimestamp())
                : current.afterPartialSuccess(snapshot.getTimestamp(), partialError.getKind(),
                partialError.getMessage()));
        logTransition(state.deviceId, before, health);

        List<String> changed = detectChanges(previous, snapshot);
        if (generation != null) {
            adaptInterval(state, generation, !changed.isEmpty());
        }
        if (!changed.isEmpty()) {
            logger.debug("{} - изменились параметры {}", state.deviceId, changed);
            try {
                applicationEventPublisher.publishEvent(
                        new ReadingsChangedEvent(this, state.deviceId, changed, snapshot));
            } catch (RuntimeException e) {
                logger.warn("{} - ошибка доставки уведомления об изменениях: {}", state.deviceId, e.getMessage());
            }
        }
        return PollResult.completed(snapshot, changed);
    }

    private PollResult failPoll(DeviceState state, @Nullable Long generation, ModbusException e) {
        if (isDiscarded(state, generation)) {
            return PollResult.discarded(state.deviceId);
        }
        HealthStatus before = state.health.get().getStatus();
        DeviceHealth health = state.health.updateAndGet(
                current -> current.afterFailure(clock.instant(), e.getKind(), e.getMessage()));
        logTransition(state.deviceId, before, health);
        logger.error("{} - ошибка опроса: {}", state.deviceId, e.getMessage());
        logger.debug("Отправляем событие об ошибке опроса {}", state.deviceId);
        try {
            applicationEventPublisher.publishEvent(
                    new DevicePollErrorEvent(this, state.deviceId, e.getKind(), e.getMessage()));
        } catch (RuntimeException publishError) {
            logger.warn("{} - ошибка доставки события об ошибке: {}", state.deviceId, publishError.getMessage());
        }
        return PollResult.failed(state.deviceId, e);
    }

    private boolean isDiscarded(DeviceState state, @Nullable Long generation) {
        return generation != null && state.generation != generation;
    }

    private void adaptInterval(DeviceState state, long generation, boolean changed) {
        synchronized (state) {
            PollSchedule schedule = state.schedule;
            if (state.generation != generation || schedule == null || !schedule.isAdaptive()) {
                return;
            }
            if (changed) {
                state.quietPolls = 0;
                long fastIntervalMs = schedule.getFastIntervalMs();
                if (state.currentIntervalMs != fastIntervalMs) {
                    /* следующий запуск уже запланирован по базовому интервалу, переносим его */
                    state.currentIntervalMs = fastIntervalMs;
                    cancelTask(state);
                    state.task = taskScheduler.schedule(() -> trigger(state, generation),
                            clock.instant().plusMillis(fastIntervalMs));
                    logger.debug("{} - обнаружены изменения, опрос каждые {} мс", state.deviceId, fastIntervalMs);
                }
            } else if (++state.quietPolls >= monitorConfiguration.getQuietPollsBeforeSlowdown()) {
                state.currentIntervalMs = schedule.getIntervalMs();
            }
        }
    }

    private void logTransition(String deviceId, HealthStatus before, DeviceHealth after) {
        if (before == after.getStatus()) {
            return;
        }
        if (after.getStatus() == HealthStatus.HEALTHY) {
            logger.info("{} - связь {}", deviceId, after);
        } else {
            logger.warn("{} - связь {}", deviceId, after);
        }
    }

    private PollResult pollOrJoin(DeviceState state) throws ModbusException {
        PollResult result = runPoll(state, null);
        if (result.getStatus() != PollStatus.SKIPPED) {
            return result;
        }
        CompletableFuture<PollResult> pending = state.inFlight.get();
        if (pending == null) {
            return runPoll(state, null);
        }
        try {
            PollResult joined = pending.get(monitorConfiguration.getJoinTimeout(), TimeUnit.MILLISECONDS);
            return joined.getStatus() == PollStatus.DISCARDED ? runPoll(state, null) : joined;
        } catch (TimeoutException e) {
            throw new ModbusTimeoutException("Timed out waiting for poll of " + state.deviceId, e);
        } catch (ExecutionException | CancellationException e) {
            throw new ConnectionException(ConnectionFailure.IO, "Poll of " + state.deviceId + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModbusTimeoutException("Interrupted while waiting for poll of " + state.deviceId, e);
        }
    }

    private ModbusException errorOf(PollResult result) {
        if (result.getError() != null) {
            return result.getError();
        }
        return new ConnectionException(ConnectionFailure.IO,
                "Poll of " + result.getDeviceId() + " did not complete: " + result.getStatus());
    }

    private DeviceRecord enabledRecord(String deviceId) throws ValidationException {
        DeviceRecord record = deviceRecordService.getDevice(deviceId);
        if (!record.isEnabled()) {
            throw new ValidationException("Device " + deviceId + " is disabled");
        }
        return record;
    }

    private void lockSession(DeviceState state) throws ModbusTimeoutException {
        try {
            if (!state.sessionLock.tryLock(monitorConfiguration.getJoinTimeout(), TimeUnit.MILLISECONDS)) {
                throw new ModbusTimeoutException("Device " + state.deviceId + " is busy");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ModbusTimeoutException("Interrupted while waiting for device " + state.deviceId, e);
        }
    }

    private DeviceState stateFor(String deviceId) throws ValidationException {
        DeviceState state = devices.get(deviceId);
        if (state != null) {
            return state;
        }
        deviceRecordService.getDevice(deviceId);
        return devices.computeIfAbsent(deviceId, this::createState);
    }

    private DeviceState createState(String deviceId) {
        DeviceState state = new DeviceState(deviceId);
        List<Meter> meters = state.meters;
        meters.add(Gauge.builder("device_health", () -> state.health.get().getStatus().getGaugeValue())
                .tag("system", "fieldbus_monitor")
                .tag("device", deviceId)
                .description("Состояние связи с устройством")
                .register(meterRegistry));
        meters.add(Gauge.builder("device_snapshot_age_ms", () -> snapshotAgeMs(state))
                .tag("system", "fieldbus_monitor")
                .tag("device", deviceId)
                .description("Возраст последнего снимка")
                .register(meterRegistry));
        return state;
    }

    private double snapshotAgeMs(DeviceState state) {
        Instant lastPollTime = state.lastPollTime;
        if (lastPollTime == null) {
            return Double.NaN;
        }
        return Duration.between(lastPollTime, clock.instant()).toMillis();
    }
}
