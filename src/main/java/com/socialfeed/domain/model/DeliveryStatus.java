package com.socialfeed.domain.model;

/**
 * Per-recipient delivery state of a message. Transitions only move forward: sent, delivered, read.
 */
public enum DeliveryStatus {
    SENT("sent"),
    DELIVERED("delivered"),
    READ("read");

    private final String wireName;

    DeliveryStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public int rank() {
        return ordinal();
    }

    public boolean canAdvanceTo(DeliveryStatus target) {
        return target.rank() > rank();
    }

    /**
     * Returns the state after applying {@code target}; a backwards or repeated update keeps the current state.
     */
    public DeliveryStatus advance(DeliveryStatus target) {
        return canAdvanceTo(target) ? target : this;
    }

    public static DeliveryStatus fromWireName(String value) {
        for (DeliveryStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown delivery status: " + value);
    }
}
