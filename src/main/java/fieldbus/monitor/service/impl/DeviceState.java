package fieldbus.monitor.service.impl;

import fieldbus.monitor.model.DeviceHealth;
import fieldbus.monitor.model.DeviceRecord;
import fieldbus.monitor.model.PollResult;
import fieldbus.monitor.model.PollSchedule;
import fieldbus.monitor.model.ReadingSnapshot;
import io.micrometer.core.instrument.Meter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Состояние одного устройства в реестре монитора.
 * <p>
 * inFlight - неблокирующий признак идущего опроса: занятое устройство пропускается, а не ставится в очередь.
 * sessionLock упорядочивает все обращения к устройству (опрос и записи), последовательный порт не делится.
 * Поля расписания меняются только под монитором самого объекта.
 */
class DeviceState {
    final String deviceId;
    final AtomicReference<CompletableFuture<PollResult>> inFlight = new AtomicReference<>();
    final AtomicReference<ReadingSnapshot> lastSnapshot = new AtomicReference<>();
    final AtomicReference<DeviceHealth> health = new AtomicReference<>(DeviceHealth.unknown());
    final ReentrantLock sessionLock = new ReentrantLock();
    final List<Meter> meters = new ArrayList<>();
    volatile DeviceRecord record;
    volatile Instant lastPollTime;
    volatile boolean invalidated;
    volatile long generation;
    PollSchedule schedule;
    ScheduledFuture<?> task;
    long currentIntervalMs;
    int quietPolls;

    DeviceState(String deviceId) {
        this.deviceId = deviceId;
    }

    boolean isInFlight() {
        return inFlight.get() != null;
    }
}
