package io.procmon.internal;

import io.procmon.Monitor;
import io.procmon.MonitorBuilder;
import io.procmon.core.MonitorSpec;
import io.procmon.core.Repetitions;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link MonitorBuilder} implementation used by the in-process registry.
 */
public class SimpleMonitorBuilder implements MonitorBuilder {

    private final String name;
    private final List<String> command;
    private final Function<MonitorSpec, Monitor> registrar;

    private Duration dueTime = Duration.ZERO;
    private Duration period;
    private Repetitions repetitions = Repetitions.UNBOUNDED;
    private boolean echo = true;
    private boolean autostart = true;

    public SimpleMonitorBuilder(String name, List<String> command, Function<MonitorSpec, Monitor> registrar) {
        this.name = Objects.requireNonNull(name, "monitor name must not be null");
        this.command = List.copyOf(Objects.requireNonNull(command, "command must not be null"));
        this.registrar = Objects.requireNonNull(registrar, "registrar must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("monitor name must not be blank");
        }
    }

    @Override
    public MonitorBuilder dueTime(Duration dueTime) {
        this.dueTime = Objects.requireNonNull(dueTime, "dueTime must not be null");
        return this;
    }

    @Override
    public MonitorBuilder period(Duration period) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        return this;
    }

    @Override
    public MonitorBuilder interval(Duration period) {
        return period(period);
    }

    @Override
    public MonitorBuilder repetitions(Repetitions repetitions) {
        this.repetitions = Objects.requireNonNull(repetitions, "repetitions must not be null");
        return this;
    }

    @Override
    public MonitorBuilder echo(boolean echo) {
        this.echo = echo;
        return this;
    }

    @Override
    public MonitorBuilder autostart(boolean autostart) {
        this.autostart = autostart;
        return this;
    }

    @Override
    public MonitorSpec build() {
        return new MonitorSpec(
                name,
                command,
                dueTime,
                period,
                repetitions,
                echo,
                autostart
        );
    }

    @Override
    public Monitor save() {
        return registrar.apply(this.build());
    }
}
