package io.jobrelay.model;

public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy");

    private final String dbValue;

    HealthStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static HealthStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return HEALTHY;
        }
        for (HealthStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.dbValue.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + raw);
    }
}
