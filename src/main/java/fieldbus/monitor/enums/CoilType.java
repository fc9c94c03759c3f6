package fieldbus.monitor.enums;

public enum CoilType {
    CONTROL("control"),

    SCHEDULE("schedule"),

    STATUS("status");

    private final String template;

    CoilType(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
