package io.procmon.core;

import java.util.Objects;

/**
 * Failure of a monitor or registry operation. The message is meant for the console user.
 */
public class MonitorException extends RuntimeException {

    private final MonitorError error;
    private final int existingId;

    public MonitorException(MonitorError error, String message) {
        this(error, message, -1);
    }

    private MonitorException(MonitorError error, String message, int existingId) {
        super(message);
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.existingId = existingId;
    }

    public static MonitorException alreadyRunning(int id, String name) {
        return new MonitorException(MonitorError.ALREADY_RUNNING,
                "Monitor #" + id + " '" + name + "' is already running.");
    }

    public static MonitorException notRunning(int id, String name) {
        return new MonitorException(MonitorError.NOT_RUNNING,
                "Monitor #" + id + " '" + name + "' is not running.");
    }

    public static MonitorException notFound(int id) {
        return new MonitorException(MonitorError.NOT_FOUND, "No monitor with id #" + id + " was found.");
    }

    public static MonitorException duplicate(int existingId, String name) {
        return new MonitorException(MonitorError.DUPLICATE,
                "Monitor #" + existingId + " already repeats '" + name + "'.", existingId);
    }

    public static MonitorException invalidSchedule(String message) {
        return new MonitorException(MonitorError.INVALID_SCHEDULE, message);
    }

    public static MonitorException commandRejected(String command) {
        return new MonitorException(MonitorError.COMMAND_REJECTED,
                "'" + command + "' cannot be repeated by a monitor.");
    }

    public MonitorError error() {
        return error;
    }

    /**
     * Id of the monitor that caused a {@link MonitorError#DUPLICATE} failure, -1 otherwise.
     */
    public int existingId() {
        return existingId;
    }
}
