package fieldbus.monitor.enums;

public enum HealthStatus {
    UNKNOWN("нет данных", -1),

    HEALTHY("в норме", 1),

    DEGRADED("частичный отказ", 0.5),

    UNHEALTHY("нет связи", 0);

    private final String template;
    private final double gaugeValue;

    HealthStatus(String template, double gaugeValue) {
        this.template = template;
        this.gaugeValue = gaugeValue;
    }

    public String getTemplate() {
        return template;
    }

    public double getGaugeValue() {
        return gaugeValue;
    }

    public boolean isHealthy() {
        return this == HEALTHY || this == DEGRADED;
    }
}
