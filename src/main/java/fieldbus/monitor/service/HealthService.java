package fieldbus.monitor.service;

import fieldbus.monitor.enums.SelfMonitoringStatus;

public interface HealthService {
    SelfMonitoringStatus getStatus();

    String getFormattedStatus();
}
