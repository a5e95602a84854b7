package io.procmon;

import io.procmon.core.MonitorSpec;
import io.procmon.core.Repetitions;

import java.time.Duration;

/**
 * Fluent builder for configuring a monitor before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory monitor spec</li>
 *   <li>save(): build() + validate + register (+ start when autostart)</li>
 * </ul>
 */
public interface MonitorBuilder {

    /**
     * Delay before the first trigger. Defaults to zero.
     */
    MonitorBuilder dueTime(Duration dueTime);

    /**
     * Time between triggers after the first one.
     */
    MonitorBuilder period(Duration period);

    /**
     * Sets the period and leaves the due time untouched.
     */
    MonitorBuilder interval(Duration period);

    MonitorBuilder repetitions(Repetitions repetitions);

    /**
     * Print a status line before each trigger runs its command.
     */
    MonitorBuilder echo(boolean echo);

    MonitorBuilder autostart(boolean autostart);

    MonitorSpec build();

    Monitor save();
}
