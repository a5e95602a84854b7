package io.procmon;

import io.procmon.core.MonitorSnapshot;
import io.procmon.core.MonitorState;
import io.procmon.core.Repetitions;

import java.time.Duration;
import java.util.List;

/**
 * One scheduled, repeatable command execution.
 *
 * <p>State changing operations fail with a {@link io.procmon.core.MonitorException} rather than
 * being silently ignored: {@code start()} on a running monitor reports {@code ALREADY_RUNNING}
 * and {@code stop()} on a stopped one reports {@code NOT_RUNNING}.
 */
public interface Monitor {
    int id();

    String name();

    List<String> command();

    void start();

    void stop();

    /**
     * Stop if running, start otherwise.
     *
     * @return the state after the toggle
     */
    MonitorState toggle();

    boolean isRunning();

    /**
     * Replace the schedule. A running monitor is re-armed and stays running.
     */
    void changeInterval(Duration dueTime, Duration period);

    void changeRepetitions(Repetitions repetitions);

    MonitorSnapshot snapshot();
}
