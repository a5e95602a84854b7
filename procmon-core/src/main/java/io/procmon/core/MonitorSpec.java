package io.procmon.core;

import java.time.Duration;
import java.util.List;

/**
 * Immutable monitor definition produced by MonitorBuilder.build().
 * This is a pure data object with no scheduling logic.
 */
public record MonitorSpec(

        // identity
        String name,
        List<String> command,

        // scheduling
        Duration dueTime,
        Duration period,
        Repetitions repetitions,

        // behaviour
        boolean echo,
        boolean autostart
) {
}
