package io.nextrun.notify;

/**
 * Outcome reported in a job notification.
 */
public enum NotificationStatus {
    SUCCESS("success"),
    ERROR("error");

    private final String value;

    NotificationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
