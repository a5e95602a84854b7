package io.procmon.internal.command;

import io.procmon.Monitors;
import io.procmon.Output;
import io.procmon.ProcessControl;
import io.procmon.Settings;

import java.util.Objects;

/**
 * Collaborators a console command may touch. Passed explicitly; there is no ambient state.
 */
public record CommandContext(
        Settings settings,
        Monitors monitors,
        ProcessControl processes,
        Output output
) {
    public CommandContext {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(monitors, "monitors must not be null");
        Objects.requireNonNull(processes, "processes must not be null");
        Objects.requireNonNull(output, "output must not be null");
    }
}
