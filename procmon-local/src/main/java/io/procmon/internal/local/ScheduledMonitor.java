package io.procmon.internal.local;

import io.procmon.CommandExecutor;
import io.procmon.Monitor;
import io.procmon.Output;
import io.procmon.core.MonitorException;
import io.procmon.core.MonitorSnapshot;
import io.procmon.core.MonitorSpec;
import io.procmon.core.MonitorState;
import io.procmon.core.Repetitions;
import io.procmon.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A monitor armed on its own single trigger thread.
 *
 * <p>The trigger thread lives as long as the monitor, so triggers of one monitor never overlap,
 * even across stop/start cycles. Every arming gets a new generation number; a trigger whose
 * generation is stale (the monitor was stopped or re-armed after it was queued) does nothing.
 *
 * <p>{@code (future, generation, repetitions, dueTime, period)} are guarded by {@code lock}.
 * The command itself runs outside the lock, so {@code stop()} never waits for a slow command.
 *
 * <p>The trigger thread is created on the first start and is only released by {@link #close()}
 * (registry {@code remove} or {@code shutdown}). A stopped or finished monitor keeps its idle thread
 * so a later restart cannot overlap a trigger that is still finishing.
 */
class ScheduledMonitor implements Monitor {
    private static final Logger log = LoggerFactory.getLogger(ScheduledMonitor.class);

    private final int id;
    private final String name;
    private final List<String> command;
    private final boolean echo;
    private final Instant createdAt;
    private final CommandExecutor executor;
    private final Output output;

    private final Object lock = new Object();

    private Duration dueTime;
    private Duration period;
    private Repetitions repetitions;
    private ScheduledFuture<?> future;
    private long generation;
    private ScheduledExecutorService trigger;
    private boolean closed;

    ScheduledMonitor(int id, MonitorSpec spec, CommandExecutor executor, Output output, Instant createdAt) {
        Objects.requireNonNull(spec, "spec must not be null");
        this.id = id;
        this.name = spec.name();
        this.command = List.copyOf(spec.command());
        this.echo = spec.echo();
        this.dueTime = spec.dueTime();
        this.period = spec.period();
        this.repetitions = spec.repetitions();
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> command() {
        return command;
    }

    @Override
    public void start() {
        synchronized (lock) {
            if (closed) {
                throw MonitorException.notFound(id);
            }
            if (future != null) {
                throw MonitorException.alreadyRunning(id, name);
            }
            if (repetitions.isExhausted()) {
                throw MonitorException.invalidSchedule(
                        "Monitor #" + id + " '" + name + "' has no repetitions remaining; change its repetitions first.");
            }
            armLocked();
        }
        log.info("Monitor started id={} name={} dueTime={} period={}", id, name, dueTime, period);
    }

    @Override
    public void stop() {
        synchronized (lock) {
            if (future == null) {
                throw MonitorException.notRunning(id, name);
            }
            disarmLocked();
        }
        log.info("Monitor stopped id={} name={}", id, name);
    }

    @Override
    public MonitorState toggle() {
        synchronized (lock) {
            if (future != null) {
                stop();
                return MonitorState.STOPPED;
            }
            start();
            return MonitorState.RUNNING;
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return future != null;
        }
    }

    @Override
    public void changeInterval(Duration newDueTime, Duration newPeriod) {
        validateSchedule(newDueTime, newPeriod);
        synchronized (lock) {
            this.dueTime = newDueTime;
            this.period = newPeriod;
            if (future != null) {
                disarmLocked();
                armLocked();
            }
        }
        log.info("Monitor interval changed id={} dueTime={} period={}", id, newDueTime, newPeriod);
    }

    @Override
    public void changeRepetitions(Repetitions newRepetitions) {
        Objects.requireNonNull(newRepetitions, "repetitions must not be null");
        if (newRepetitions.isExhausted()) {
            throw MonitorException.invalidSchedule("Repetitions must be a positive number or 'inf'.");
        }
        synchronized (lock) {
            this.repetitions = newRepetitions;
        }
        log.info("Monitor repetitions changed id={} repetitions={}", id, newRepetitions);
    }

    @Override
    public MonitorSnapshot snapshot() {
        synchronized (lock) {
            return new MonitorSnapshot(
                    id,
                    name,
                    command,
                    dueTime,
                    period,
                    repetitions,
                    echo,
                    future != null ? MonitorState.RUNNING : MonitorState.STOPPED,
                    createdAt
            );
        }
    }

    boolean isExhausted() {
        synchronized (lock) {
            return repetitions.isExhausted();
        }
    }

    /**
     * Disarm and release the trigger thread. In-flight triggers are allowed to finish.
     *
     * @return the released trigger executor, or null if the monitor was never started
     */
    ScheduledExecutorService close() {
        ScheduledExecutorService released;
        synchronized (lock) {
            if (future != null) {
                disarmLocked();
            }
            closed = true;
            released = trigger;
            trigger = null;
        }
        if (released != null) {
            released.shutdown();
        }
        return released;
    }

    static void validateSchedule(Duration dueTime, Duration period) {
        if (dueTime == null || dueTime.isNegative()) {
            throw MonitorException.invalidSchedule("Monitor due time must not be negative.");
        }
        if (period == null || period.isZero() || period.isNegative()) {
            throw MonitorException.invalidSchedule("Monitor interval must be positive.");
        }
        // the trigger executor counts in nanoseconds
        requireNanos(dueTime, "due time");
        requireNanos(period, "interval");
    }

    private static void requireNanos(Duration duration, String what) {
        try {
            duration.toNanos();
        } catch (ArithmeticException e) {
            throw MonitorException.invalidSchedule("Monitor " + what + " is too long: " + IntervalParser.format(duration) + ".");
        }
    }

    private void armLocked() {
        final long armed = ++generation;
        future = triggerLocked().scheduleAtFixedRate(
                () -> fire(armed),
                dueTime.toNanos(),
                period.toNanos(),
                TimeUnit.NANOSECONDS
        );
    }

    private void disarmLocked() {
        generation++;
        future.cancel(false);
        future = null;
    }

    private ScheduledExecutorService triggerLocked() {
        if (trigger == null) {
            ScheduledThreadPoolExecutor executorService = new ScheduledThreadPoolExecutor(1, r -> {
                Thread t = new Thread(r);
                t.setName("procmon.monitor-" + id);
                t.setDaemon(true);
                return t;
            });
            executorService.setRemoveOnCancelPolicy(true);
            trigger = executorService;
        }
        return trigger;
    }

    private void fire(long armed) {
        Repetitions remaining;
        synchronized (lock) {
            if (armed != generation || future == null) {
                return;
            }
            if (repetitions.isExhausted()) {
                disarmLocked();
                return;
            }
            repetitions = repetitions.decrement();
            remaining = repetitions;
        }

        log.debug("Monitor trigger id={} remaining={}", id, remaining);
        if (echo) {
            output.println("Monitor #" + id + " (" + remaining + " repetitions remaining):");
        }

        runCommand();

        boolean selfStopped = false;
        synchronized (lock) {
            if (future != null && repetitions.isExhausted()) {
                disarmLocked();
                selfStopped = true;
            }
        }
        if (selfStopped) {
            log.info("Monitor finished its repetitions id={} name={}", id, name);
            if (echo) {
                output.println("Monitor #" + id + " '" + name + "' stopped.");
            }
        }
    }

    private void runCommand() {
        try {
            if (!executor.execute(command, echo, true)) {
                log.warn("Monitor command not recognized id={} command={}", id, name);
                if (echo) {
                    output.println("Monitor #" + id + ": command '" + name + "' not recognized.");
                }
            }
        } catch (Exception e) {
            log.error("Monitor command failed id={} command={} msg={}", id, name, e.getMessage(), e);
            if (echo) {
                output.println("Monitor #" + id + " FAILURE:" + System.lineSeparator() + "\t" + e.getMessage());
            }
        }
    }
}
