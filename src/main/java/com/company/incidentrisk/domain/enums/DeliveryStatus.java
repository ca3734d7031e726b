package com.company.incidentrisk.domain.enums;

public enum DeliveryStatus {
    PENDING("Alert is pending to be delivered"),
    SENT("Alert has been delivered successfully"),
    FAILED("Alert delivery failed");

    private final String description;

    DeliveryStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFinal() {
        return this == SENT;
    }

    public static DeliveryStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        try {
            return DeliveryStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
