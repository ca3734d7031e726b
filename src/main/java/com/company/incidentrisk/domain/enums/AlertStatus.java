package com.company.incidentrisk.domain.enums;

public enum AlertStatus {
    OPEN("Alert raised and awaiting an operator"),
    ACKNOWLEDGED("An operator has taken ownership"),
    RESOLVED("Risk no longer relevant or incident handled");

    private final String description;

    AlertStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == RESOLVED;
    }

    /**
     * OPEN may move to ACKNOWLEDGED or RESOLVED, ACKNOWLEDGED only to RESOLVED.
     */
    public boolean canTransitionTo(AlertStatus target) {
        return switch (this) {
            case OPEN -> target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED -> target == RESOLVED;
            case RESOLVED -> false;
        };
    }

    public static AlertStatus fromString(String status) {
        if (status == null) {
            return OPEN;
        }
        try {
            return AlertStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return OPEN;
        }
    }
}
