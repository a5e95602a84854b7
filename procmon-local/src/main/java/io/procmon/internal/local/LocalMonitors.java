package io.procmon.internal.local;

import io.procmon.CommandExecutor;
import io.procmon.Monitor;
import io.procmon.MonitorBuilder;
import io.procmon.Monitors;
import io.procmon.Output;
import io.procmon.config.ProcmonProperties;
import io.procmon.core.BulkResult;
import io.procmon.core.MonitorException;
import io.procmon.core.MonitorSnapshot;
import io.procmon.core.MonitorSpec;
import io.procmon.internal.SimpleMonitorBuilder;
import io.procmon.utils.CommandLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process monitor registry.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Sequential ids (starting at 1, never reused within this registry)</li>
 *   <li>Deduplication by monitor name, which is by convention the repeated command string</li>
 *   <li>Validation before registration: a rejected monitor leaves no state behind</li>
 *   <li>Synchronous removal: a removed monitor never triggers again</li>
 * </ul>
 *
 * <p>The map is guarded by {@code this}; each monitor guards its own timer state, and no monitor
 * lock is taken while holding the registry lock.
 */
public class LocalMonitors implements Monitors {
    private static final Logger log = LoggerFactory.getLogger(LocalMonitors.class);

    private final ProcmonProperties props;
    private final Output output;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger ids = new AtomicInteger();
    private final Map<Integer, ScheduledMonitor> monitors = new LinkedHashMap<>();

    public LocalMonitors(ProcmonProperties props, Output output) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.output = Objects.requireNonNull(output, "output must not be null");
    }

    /**
     * Accept new monitors. Should be idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Monitors started with shutdownTimeout={}", props.getShutdownTimeout());
    }

    /**
     * Stop all monitors and wait for their trigger threads. Should be idempotent.
     */
    @Override
    public void shutdown() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Monitors stopping...");

        List<ScheduledMonitor> all;
        synchronized (this) {
            all = new ArrayList<>(monitors.values());
            monitors.clear();
        }

        List<ScheduledExecutorService> released = new ArrayList<>();
        for (ScheduledMonitor m : all) {
            ScheduledExecutorService trigger = m.close();
            if (trigger != null) {
                released.add(trigger);
            }
        }

        long deadline = System.nanoTime() + props.getShutdownTimeout().toNanos();
        for (ScheduledExecutorService trigger : released) {
            try {
                long left = Math.max(0, deadline - System.nanoTime());
                if (!trigger.awaitTermination(left, TimeUnit.NANOSECONDS)) {
                    trigger.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                trigger.shutdownNow();
            }
        }
        log.info("Monitors stopped successfully. released={}", all.size());
    }

    @Override
    public MonitorBuilder create(String name, List<String> command, CommandExecutor executor) {
        Objects.requireNonNull(executor, "executor must not be null");
        return new SimpleMonitorBuilder(name, command, spec -> register(spec, executor));
    }

    @Override
    public MonitorBuilder create(List<String> command, CommandExecutor executor) {
        Objects.requireNonNull(command, "command must not be null");
        return create(CommandLines.join(command), command, executor);
    }

    @Override
    public synchronized OptionalInt findByName(String name) {
        for (ScheduledMonitor m : monitors.values()) {
            if (m.name().equals(name)) {
                return OptionalInt.of(m.id());
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public synchronized Optional<Monitor> findById(int id) {
        return Optional.ofNullable(monitors.get(id));
    }

    @Override
    public Monitor require(int id) {
        return findById(id).orElseThrow(() -> MonitorException.notFound(id));
    }

    @Override
    public void remove(int id) {
        ScheduledMonitor removed;
        synchronized (this) {
            removed = monitors.remove(id);
        }
        if (removed == null) {
            throw MonitorException.notFound(id);
        }
        removed.close();
        log.info("Monitor removed id={} name={}", id, removed.name());
    }

    @Override
    public BulkResult startAll() {
        List<ScheduledMonitor> all = snapshotMonitors();
        int affected = 0;
        for (ScheduledMonitor m : all) {
            if (m.isRunning() || m.isExhausted()) {
                continue;
            }
            try {
                m.start();
                affected++;
            } catch (MonitorException e) {
                // started or removed concurrently
                log.debug("startAll skipped id={} reason={}", m.id(), e.error());
            }
        }
        return new BulkResult(all.size(), affected);
    }

    @Override
    public BulkResult stopAll() {
        List<ScheduledMonitor> all = snapshotMonitors();
        int affected = 0;
        for (ScheduledMonitor m : all) {
            if (!m.isRunning()) {
                continue;
            }
            try {
                m.stop();
                affected++;
            } catch (MonitorException e) {
                // finished its repetitions in the meantime
                log.debug("stopAll skipped id={} reason={}", m.id(), e.error());
            }
        }
        return new BulkResult(all.size(), affected);
    }

    @Override
    public List<MonitorSnapshot> list() {
        List<MonitorSnapshot> snapshots = new ArrayList<>();
        for (ScheduledMonitor m : snapshotMonitors()) {
            snapshots.add(m.snapshot());
        }
        return snapshots;
    }

    @Override
    public String display() {
        return MonitorTable.render(list(), zone());
    }

    /**
     * Utility: creation time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    protected ZoneId zone() {
        return ZoneId.systemDefault();
    }

    private Monitor register(MonitorSpec spec, CommandExecutor executor) {
        validate(spec, executor);

        ScheduledMonitor monitor;
        synchronized (this) {
            if (!started.get()) {
                throw new IllegalStateException("Monitors must be started before monitors can be created");
            }
            OptionalInt existing = findByName(spec.name());
            if (existing.isPresent()) {
                throw MonitorException.duplicate(existing.getAsInt(), spec.name());
            }
            monitor = new ScheduledMonitor(ids.incrementAndGet(), spec, executor, output, nowInstant());
            monitors.put(monitor.id(), monitor);
        }

        log.info("Monitor created id={} name={} dueTime={} period={} repetitions={} echo={}",
                monitor.id(), spec.name(), spec.dueTime(), spec.period(), spec.repetitions(), spec.echo());

        if (spec.autostart()) {
            monitor.start();
        }
        return monitor;
    }

    private static void validate(MonitorSpec spec, CommandExecutor executor) {
        Duration dueTime = spec.dueTime();
        ScheduledMonitor.validateSchedule(dueTime, spec.period());
        if (spec.repetitions() == null || spec.repetitions().isExhausted()) {
            throw MonitorException.invalidSchedule("Repetitions must be a positive number or 'inf'.");
        }

        List<String> command = spec.command();
        if (command.isEmpty()
                || !executor.isSchedulable(command)
                || !executor.execute(command, false, false)) {
            throw MonitorException.commandRejected(CommandLines.join(command));
        }
    }

    private synchronized List<ScheduledMonitor> snapshotMonitors() {
        return new ArrayList<>(monitors.values());
    }
}
