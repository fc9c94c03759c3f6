package fieldbus.monitor.service.impl;

import fieldbus.monitor.enums.HealthStatus;
import fieldbus.monitor.enums.SelfMonitoringStatus;
import fieldbus.monitor.event.error.DevicePollErrorEvent;
import fieldbus.monitor.model.DeviceHealth;
import fieldbus.monitor.service.DeviceMonitorService;
import fieldbus.monitor.service.HealthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class HealthServiceImpl implements HealthService {
    private static final Logger logger = LoggerFactory.getLogger(HealthServiceImpl.class);
    private final DeviceMonitorService deviceMonitorService;
    private final Set<String> devicePollErrorEvents = ConcurrentHashMap.newKeySet();
    private volatile SelfMonitoringStatus lastStatus = SelfMonitoringStatus.OK;

    public HealthServiceImpl(DeviceMonitorService deviceMonitorService) {
        this.deviceMonitorService = deviceMonitorService;
    }

    @Scheduled(fixedRateString = "${health.controlInterval}")
    void control() {
        calculateHealthStatus(true);
    }

    private synchronized SelfMonitoringStatus calculateHealthStatus(boolean clear) {
        logger.debug("Запущена задача селфмониторинга");
        Map<String, DeviceHealth> healthByDevice = deviceMonitorService.getHealthByDevice();
        Collection<DeviceHealth> known = healthByDevice.values().stream()
                .filter(health -> health.getStatus() != HealthStatus.UNKNOWN)
                .toList();

        SelfMonitoringStatus newStatus = SelfMonitoringStatus.OK;
        if (!devicePollErrorEvents.isEmpty()
                || known.stream().anyMatch(health -> health.getStatus() != HealthStatus.HEALTHY)) {
            newStatus = SelfMonitoringStatus.MINOR_PROBLEMS;
        }
        if (!known.isEmpty() && known.stream().allMatch(health -> health.getStatus() == HealthStatus.UNHEALTHY)) {
            newStatus = SelfMonitoringStatus.EMERGENCY;
        }
        notifyAndSetLastStatus(newStatus, healthByDevice);

        if (clear) {
            devicePollErrorEvents.clear();
        }
        return newStatus;
    }

    private void notifyAndSetLastStatus(SelfMonitoringStatus newStatus, Map<String, DeviceHealth> healthByDevice) {
        if (newStatus == lastStatus) {
            return;
        }
        if (newStatus == SelfMonitoringStatus.OK) {
            logger.info("Ситуация нормализована");
        } else {
            logger.warn(formatProblemMessage(newStatus, healthByDevice));
        }
        lastStatus = newStatus;
    }

    @EventListener
    public void onDevicePollErrorEvent(DevicePollErrorEvent event) {
        devicePollErrorEvents.add(event.getDeviceId());
    }

    @Override
    public SelfMonitoringStatus getStatus() {
        return calculateHealthStatus(false);
    }

    @Override
    public String getFormattedStatus() {
        SelfMonitoringStatus status = calculateHealthStatus(false);
        Set<String> failing = failingDevices(deviceMonitorService.getHealthByDevice());
        if (failing.isEmpty()) {
            return status.getTemplate();
        }
        return status.getTemplate() + ": " + String.join(", ", failing);
    }

    private Set<String> failingDevices(Map<String, DeviceHealth> healthByDevice) {
        Set<String> failing = new TreeSet<>(devicePollErrorEvents);
        healthByDevice.forEach((deviceId, health) -> {
            if (health.getStatus() == HealthStatus.UNHEALTHY || health.getStatus() == HealthStatus.DEGRADED) {
                failing.add(deviceId);
            }
        });
        return failing;
    }

    private String formatProblemMessage(SelfMonitoringStatus status, Map<String, DeviceHealth> healthByDevice) {
        StringBuilder message = new StringBuilder(
                status == SelfMonitoringStatus.EMERGENCY ? "Аварийная ситуация:\n" : "Неполадки:\n");
        for (String deviceId : failingDevices(healthByDevice)) {
            DeviceHealth health = healthByDevice.get(deviceId);
            message.append("* ").append(deviceId).append(" - ");
            message.append(health != null ? health.toString() : "ошибка опроса");
            message.append("\n");
        }
        return message.toString();
    }
}
