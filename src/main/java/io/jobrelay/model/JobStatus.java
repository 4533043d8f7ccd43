package io.jobrelay.model;

public enum JobStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    FAILED("failed");

    private final String dbValue;

    JobStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static JobStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Job status cannot be empty");
        }
        for (JobStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.dbValue.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + raw);
    }
}
