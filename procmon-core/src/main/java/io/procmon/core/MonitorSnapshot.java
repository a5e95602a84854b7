package io.procmon.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a monitor's state, safe to read from any thread.
 */
public record MonitorSnapshot(
        int id,
        String name,
        List<String> command,
        Duration dueTime,
        Duration period,
        Repetitions repetitions,
        boolean echo,
        MonitorState state,
        Instant createdAt
) {
    public boolean running() {
        return state == MonitorState.RUNNING;
    }
}
