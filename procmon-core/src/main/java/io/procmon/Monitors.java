package io.procmon;

import io.procmon.core.BulkResult;
import io.procmon.core.MonitorSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Registry of recurring command monitors.
 *
 * <p>Every monitor re-executes one command on its own timer thread. The registry owns
 * identity (sequential ids starting at 1, never reused), deduplication by command string,
 * and the aggregate operations of the console.
 *
 * <p>Typical usage:
 * <pre>{@code
 * monitors.start();
 *
 * Monitor m = monitors.create("killall", List.of("killall"), executor)
 *         .interval(Duration.ofSeconds(30))
 *         .repetitions(Repetitions.UNBOUNDED)
 *         .save();
 *
 * monitors.stopAll();
 * monitors.shutdown();
 * }</pre>
 */
public interface Monitors {
    void start();

    /**
     * Stop every monitor and release all trigger threads. Should be idempotent.
     */
    void shutdown();

    /**
     * Create a monitor builder. Nothing is registered until save() is called.
     */
    MonitorBuilder create(String name, List<String> command, CommandExecutor executor);

    /**
     * Shorthand for a monitor named after its own command string.
     */
    MonitorBuilder create(List<String> command, CommandExecutor executor);

    /**
     * Id of the monitor whose name equals {@code name}, if any.
     */
    OptionalInt findByName(String name);

    Optional<Monitor> findById(int id);

    /**
     * Same as {@link #findById(int)} but fails with {@code NOT_FOUND}.
     */
    Monitor require(int id);

    /**
     * Stop (if running) and detach a monitor. Once this returns the monitor never triggers again.
     */
    void remove(int id);

    BulkResult startAll();

    BulkResult stopAll();

    /**
     * Point-in-time view of all monitors in insertion order.
     */
    List<MonitorSnapshot> list();

    /**
     * Render the monitor table with its running/stopped summary.
     */
    String display();
}
