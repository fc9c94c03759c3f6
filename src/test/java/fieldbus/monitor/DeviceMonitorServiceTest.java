package fieldbus.monitor;

import fieldbus.monitor.enums.ConnectionFailure;
import fieldbus.monitor.enums.DataType;
import fieldbus.monitor.enums.ErrorKind;
import fieldbus.monitor.enums.HealthStatus;
import fieldbus.monitor.enums.PollStatus;
import fieldbus.monitor.event.error.DevicePollErrorEvent;
import fieldbus.monitor.event.info.ReadingsChangedEvent;
import fieldbus.monitor.exception.ConnectionException;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ProtocolException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.DeviceHealth;
import fieldbus.monitor.model.Parameter;
import fieldbus.monitor.model.ParameterReading;
import fieldbus.monitor.model.PollResult;
import fieldbus.monitor.model.PollSchedule;
import fieldbus.monitor.model.ReadingSnapshot;
import fieldbus.monitor.service.DeviceMonitorService;
import fieldbus.monitor.transport.ModbusTransport;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.event.ApplicationEvents;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DirtiesContext(classMode = ClassMode.BEFORE_EACH_TEST_METHOD)
public class DeviceMonitorServiceTest extends AbstractTest {
    private static final String BOILER = "boiler-1";

    @Autowired
    DeviceMonitorService deviceMonitorService;

    @Autowired
    MeterRegistry meterRegistry;

    @Autowired
    private ApplicationEvents applicationEvents;

    private ModbusTransport transport;

    @BeforeEach
    void setUp() throws ModbusException {
        transport = Mockito.mock(ModbusTransport.class);
        Mockito.when(transportFactory.create(ArgumentMatchers.any())).thenReturn(transport);
        /* 21.9 C, 1.0 bar в порядке CDAB, уставка 60 */
        Mockito.when(transport.readHoldingRegisters(1, 0, 4)).thenReturn(new int[]{0x00DB, 0x0000, 0x3F80, 60});
        Mockito.when(transport.readCoils(1, 10, 3)).thenReturn(new boolean[]{true, false, false});
    }

    @Test
    @DisplayName("Проверка опроса всех диапазонов устройства")
    void checkReadNow() throws ModbusException {
        ReadingSnapshot snapshot = deviceMonitorService.readNow(BOILER);

        assertEquals(BOILER, snapshot.getDeviceId());
        assertEquals(21.9, snapshot.getReading("temperature").orElseThrow().getValue());
        assertEquals(1.0, snapshot.getReading("pressure").orElseThrow().getValue());
        assertEquals(60L, snapshot.getReading("setpoint").orElseThrow().getValue());
        assertEquals(true, snapshot.getReading("pump").orElseThrow().getValue());
        assertEquals(false, snapshot.getReading("burner").orElseThrow().getValue());
        assertEquals(2, snapshot.getRawRanges().size());
        assertEquals(HealthStatus.HEALTHY, deviceMonitorService.getHealth(BOILER).getStatus());

        /* первый снимок - изменились все параметры */
        List<ReadingsChangedEvent> events = applicationEvents.stream(ReadingsChangedEvent.class).toList();
        assertEquals(1, events.size());
        assertEquals(List.of("temperature", "pressure", "setpoint", "pump", "burner"),
            events.get(0).getChangedParameters());

        /* после опроса подключение закрыто */
        Mockito.verify(transport, Mockito.times(1)).connect();
        Mockito.verify(transport, Mockito.times(1)).disconnect();
    }

    @Test
    @DisplayName("Проверка что повторный опрос без изменений не отправляет событие")
    void checkNoEventWithoutChanges() throws ModbusException {
        deviceMonitorService.readNow(BOILER);
        PollResult result = deviceMonitorService.poll(BOILER);

        assertEquals(PollStatus.COMPLETED, result.getStatus());
        assertTrue(result.getChangedParameters().isEmpty());
        assertEquals(1, applicationEvents.stream(ReadingsChangedEvent.class).count());

        Mockito.when(transport.readHoldingRegisters(1, 0, 4)).thenReturn(new int[]{0x00DC, 0x0000, 0x3F80, 60});
        result = deviceMonitorService.poll(BOILER);
        assertEquals(List.of("temperature"), result.getChangedParameters());
        assertEquals(2, applicationEvents.stream(ReadingsChangedEvent.class).count());
    }

    @Test
    @DisplayName("Проверка что данные из кэша не вызывают лишних обращений к устройству")
    void checkGetCached() throws ModbusException {
        ReadingSnapshot first = deviceMonitorService.getCached(BOILER, 5000);
        ReadingSnapshot second = deviceMonitorService.getCached(BOILER, 5000);
        ReadingSnapshot third = deviceMonitorService.getCached(BOILER, 5000);

        assertSame(first, second);
        assertSame(first, third);
        Mockito.verify(transport, Mockito.times(1)).readHoldingRegisters(1, 0, 4);
    }

    @Test
    @DisplayName("Проверка что запись сбрасывает кэш")
    void checkInvalidate() throws ModbusException {
        ReadingSnapshot first = deviceMonitorService.getCached(BOILER, 5000);
        deviceMonitorService.invalidate(BOILER);
        ReadingSnapshot second = deviceMonitorService.getCached(BOILER, 5000);

        assertFalse(first == second);
        Mockito.verify(transport, Mockito.times(2)).readHoldingRegisters(1, 0, 4);
    }

    @Test
    @DisplayName("Проверка что неудачный опрос сохраняет последний снимок и отмечает устройство неисправным")
    void checkFailedPollKeepsSnapshot() throws ModbusException {
        ReadingSnapshot snapshot = deviceMonitorService.readNow(BOILER);

        Mockito.doThrow(new ConnectionException(ConnectionFailure.REFUSED, "Connection refused"))
            .when(transport).connect();
        PollResult result = deviceMonitorService.poll(BOILER);

        assertEquals(PollStatus.FAILED, result.getStatus());
        assertEquals(ErrorKind.CONNECTION, result.getError().getKind());
        assertSame(snapshot, deviceMonitorService.getLastSnapshot(BOILER).orElseThrow());

        DeviceHealth health = deviceMonitorService.getHealth(BOILER);
        assertEquals(HealthStatus.UNHEALTHY, health.getStatus());
        assertFalse(health.isHealthy());
        assertEquals(1, health.getConsecutiveFailures());
        assertEquals(ErrorKind.CONNECTION, health.getLastErrorKind());
        assertEquals(1, applicationEvents.stream(DevicePollErrorEvent.class).count());

        /* при недоступном устройстве getCached отдает старые данные, а не ошибку */
        deviceMonitorService.invalidate(BOILER);
        assertSame(snapshot, deviceMonitorService.getCached(BOILER, 0));
        assertEquals(2, deviceMonitorService.getHealth(BOILER).getConsecutiveFailures());
    }

    @Test
    @DisplayName("Проверка что ошибка одного диапазона не мешает остальным")
    void checkRangeFailureIsolation() throws ModbusException {
        Mockito.when(transport.readCoils(1, 10, 3)).thenThrow(new ProtocolException("Illegal function"));

        PollResult result = deviceMonitorService.poll(BOILER);

        assertEquals(PollStatus.COMPLETED, result.getStatus());
        ReadingSnapshot snapshot = result.getSnapshot();
        assertEquals(21.9, snapshot.getReading("temperature").orElseThrow().getValue());
        ParameterReading pump = snapshot.getReading("pump").orElseThrow();
        assertEquals(ErrorKind.PROTOCOL, pump.getErrorKind());
        assertEquals("Failed to read range: Illegal function", pump.getError());
        assertEquals(HealthStatus.DEGRADED, deviceMonitorService.getHealth(BOILER).getStatus());
    }

    @Test
    @DisplayName("Проверка что после обрыва связи оставшиеся диапазоны не читаются")
    void checkAllRangesFailed() throws ModbusException {
        Mockito.when(transport.readHoldingRegisters(1, 0, 4))
            .thenThrow(new ConnectionException(ConnectionFailure.RESET, "Connection reset"));

        PollResult result = deviceMonitorService.poll(BOILER);

        assertEquals(PollStatus.FAILED, result.getStatus());
        Mockito.verify(transport, Mockito.never()).readCoils(
            ArgumentMatchers.anyInt(), ArgumentMatchers.anyInt(), ArgumentMatchers.anyInt());
        assertFalse(deviceMonitorService.getLastSnapshot(BOILER).isPresent());
        assertEquals(HealthStatus.UNHEALTHY, deviceMonitorService.getHealth(BOILER).getStatus());
    }

    @Test
    @DisplayName("Проверка что одновременные опросы дают один цикл чтения")
    void checkConcurrentPoll() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Mockito.when(transport.readHoldingRegisters(1, 0, 4)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new int[]{0x00DB, 0x0000, 0x3F80, 60};
        });

        CompletableFuture<PollResult> first = CompletableFuture.supplyAsync(() -> deviceMonitorService.poll(BOILER));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertEquals(PollStatus.SKIPPED, deviceMonitorService.poll(BOILER).getStatus());
        CompletableFuture<ReadingSnapshot> joined = CompletableFuture.supplyAsync(() -> {
            try {
                return deviceMonitorService.readNow(BOILER);
            } catch (ModbusException e) {
                throw new RuntimeException(e);
            }
        });

        release.countDown();
        PollResult result = first.get(5, TimeUnit.SECONDS);
        assertEquals(PollStatus.COMPLETED, result.getStatus());
        assertNotNull(joined.get(5, TimeUnit.SECONDS));
        Mockito.verify(transport, Mockito.atMost(2)).readHoldingRegisters(1, 0, 4);
        Mockito.verify(transport, Mockito.atLeast(1)).readHoldingRegisters(1, 0, 4);
    }

    @Test
    @DisplayName("Проверка что ожидающее чтение получает результат идущего опроса")
    void checkReadNowJoinsPoll() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Mockito.when(transport.readHoldingRegisters(1, 0, 4)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new int[]{0x00DB, 0x0000, 0x3F80, 60};
        });

        CompletableFuture<PollResult> first = CompletableFuture.supplyAsync(() -> deviceMonitorService.poll(BOILER));
        assertTrue(started.await(5, TimeUnit.SECONDS));
        CompletableFuture<ReadingSnapshot> joined = CompletableFuture.supplyAsync(() -> {
            try {
                return deviceMonitorService.readNow(BOILER);
            } catch (ModbusException e) {
                throw new RuntimeException(e);
            }
        });
        /* чтение должно успеть встать в ожидание */
        Thread.sleep(300);
        release.countDown();

        ReadingSnapshot polled = first.get(5, TimeUnit.SECONDS).getSnapshot();
        assertSame(polled, joined.get(5, TimeUnit.SECONDS));
        Mockito.verify(transport, Mockito.times(1)).readHoldingRegisters(1, 0, 4);
        assertFalse(deviceMonitorService.isPolling(BOILER));
    }

    @Test
    @DisplayName("Проверка что результат опроса, идущего во время снятия с расписания, отбрасывается")
    void checkUnscheduleDuringPoll() throws Exception {
        ReadingSnapshot before = deviceMonitorService.readNow(BOILER);

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Mockito.when(transport.readHoldingRegisters(1, 0, 4)).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return new int[]{0x00DC, 0x0000, 0x3F80, 60};
        });
        deviceMonitorService.schedule(BOILER, 60000);
        assertTrue(started.await(5, TimeUnit.SECONDS));

        deviceMonitorService.unschedule(BOILER);
        release.countDown();
        waitFor(() -> !deviceMonitorService.isPolling(BOILER));

        assertSame(before, deviceMonitorService.getLastSnapshot(BOILER).orElseThrow());
        assertEquals(21.9, deviceMonitorService.getLastSnapshot(BOILER).orElseThrow()
            .getReading("temperature").orElseThrow().getValue());
        assertFalse(deviceMonitorService.isScheduled(BOILER));
        assertFalse(deviceMonitorService.getPollInterval(BOILER).isPresent());
    }

    @Test
    @DisplayName("Проверка адаптивного расписания: частый опрос после изменений и возврат к базовому")
    void checkAdaptiveSchedule() throws Exception {
        deviceMonitorService.schedule(BOILER, PollSchedule.adaptive(60000, 50));

        /* первый снимок - изменения, дальше опрос каждые 50 мс вместо минуты */
        Mockito.verify(transport, Mockito.timeout(3000).atLeast(4)).readHoldingRegisters(1, 0, 4);

        /* три опроса без изменений - возврат к базовому интервалу */
        waitFor(() -> deviceMonitorService.getPollInterval(BOILER).orElse(0) == 60000);
        Thread.sleep(200);
        Mockito.clearInvocations(transport);
        Thread.sleep(300);
        Mockito.verify(transport, Mockito.never()).readHoldingRegisters(1, 0, 4);

        deviceMonitorService.unschedule(BOILER);
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("Условие не выполнилось за 3 секунды");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Проверка сравнения снимков с учетом точности")
    void checkDetectChanges() {
        Parameter temperature = new Parameter("temperature", DataType.INT16, null, 0, null, 0.1, 1, null, null);
        Parameter flow = new Parameter("flow", DataType.FLOAT32, null, 1);
        Parameter mode = new Parameter("mode", DataType.UINT16, null, 3);
        Instant now = Instant.now();

        ReadingSnapshot previous = new ReadingSnapshot(BOILER, now, List.of(
            ParameterReading.success(temperature, 21.9),
            ParameterReading.success(flow, 1.000),
            ParameterReading.success(mode, 2L)), List.of());
        ReadingSnapshot same = new ReadingSnapshot(BOILER, now.plusSeconds(1), List.of(
            ParameterReading.success(temperature, 21.9),
            ParameterReading.success(flow, 1.004),
            ParameterReading.success(mode, 2L)), List.of());
        ReadingSnapshot changed = new ReadingSnapshot(BOILER, now.plusSeconds(2), List.of(
            ParameterReading.success(temperature, 22.0),
            ParameterReading.success(flow, 1.004),
            ParameterReading.success(mode, 2L)), List.of());
        ReadingSnapshot broken = new ReadingSnapshot(BOILER, now.plusSeconds(3), List.of(
            ParameterReading.success(temperature, 21.9),
            ParameterReading.failure(flow, ErrorKind.PARTIAL_DECODE, "Non-finite value")), List.of());

        assertTrue(deviceMonitorService.detectChanges(previous, previous).isEmpty());
        assertTrue(deviceMonitorService.detectChanges(previous, same).isEmpty());
        assertEquals(List.of("temperature"), deviceMonitorService.detectChanges(previous, changed));
        assertEquals(List.of("flow", "mode"), deviceMonitorService.detectChanges(previous, broken));
        assertEquals(List.of("temperature", "flow", "mode"), deviceMonitorService.detectChanges(null, previous));
    }

    @Test
    @DisplayName("Проверка периодического опроса и снятия с расписания")
    void checkSchedule() throws ModbusException {
        deviceMonitorService.schedule(BOILER, 100);
        assertTrue(deviceMonitorService.isScheduled(BOILER));

        Mockito.verify(transport, Mockito.timeout(3000).atLeast(3)).readHoldingRegisters(1, 0, 4);

        deviceMonitorService.unschedule(BOILER);
        assertFalse(deviceMonitorService.isScheduled(BOILER));
        assertTrue(deviceMonitorService.getLastSnapshot(BOILER).isPresent());
        assertEquals(HealthStatus.HEALTHY, deviceMonitorService.getHealth(BOILER).getStatus());

        assertThrows(ValidationException.class, () -> deviceMonitorService.schedule("unknown", 100));
    }

    @Test
    @DisplayName("Проверка отказа для выключенного и неизвестного устройства")
    void checkDisabledAndUnknownDevice() throws ModbusException {
        PollResult disabled = deviceMonitorService.poll("disabled-1");
        assertEquals(PollStatus.FAILED, disabled.getStatus());
        assertEquals(ErrorKind.VALIDATION, disabled.getError().getKind());
        assertEquals("Device disabled-1 is disabled", disabled.getError().getMessage());

        PollResult unknown = deviceMonitorService.poll("unknown");
        assertEquals(PollStatus.FAILED, unknown.getStatus());
        assertEquals(ErrorKind.VALIDATION, unknown.getError().getKind());

        assertThrows(ValidationException.class, () -> deviceMonitorService.readNow("unknown"));
        Mockito.verify(transportFactory, Mockito.never()).create(ArgumentMatchers.any());
    }

    @Test
    @DisplayName("Проверка метрик состояния устройства")
    void checkGauges() throws ModbusException {
        deviceMonitorService.readNow(BOILER);

        assertEquals(1.0, meterRegistry.get("device_health").tag("device", BOILER).gauge().value());
        assertNotNull(meterRegistry.find("device_snapshot_age_ms").tag("device", BOILER).gauge());

        deviceMonitorService.forget(BOILER);
        assertNull(meterRegistry.find("device_health").tag("device", BOILER).gauge());
        assertFalse(deviceMonitorService.getLastSnapshot(BOILER).isPresent());
        assertEquals(HealthStatus.UNKNOWN, deviceMonitorService.getHealth(BOILER).getStatus());
    }
}
