package com.company.incidentrisk.domain.enums;

public enum Severity {
    MEDIUM(2, "Medium risk - requires attention"),
    HIGH(3, "High risk - urgent attention needed"),
    CRITICAL(4, "Critical risk - incident likely, act now");

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    public boolean isHigherThan(Severity other) {
        return this.level > other.level;
    }

    public static Severity fromString(String severity) {
        if (severity == null) {
            return MEDIUM;
        }
        try {
            return Severity.valueOf(severity.toUpperCase());
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
