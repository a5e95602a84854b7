package io.procmon.core;

public enum MonitorError {
    ALREADY_RUNNING,
    NOT_RUNNING,
    NOT_FOUND,
    DUPLICATE,
    INVALID_SCHEDULE,
    COMMAND_REJECTED
}
