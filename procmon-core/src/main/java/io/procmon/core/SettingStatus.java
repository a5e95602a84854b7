package io.procmon.core;

public enum SettingStatus {

    RESERVED(-2),
    INVALID(-1),
    SUCCESS(0),
    NO_CHANGE(1);

    private final int value;

    SettingStatus(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * Negative statuses mean the request itself was malformed.
     */
    public boolean isError() {
        return value < 0;
    }
}
