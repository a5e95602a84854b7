package io.procmon.internal;

import io.procmon.core.MonitorSpec;
import io.procmon.core.Repetitions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimpleMonitorBuilderTest {

    @Test
    void buildShouldApplyDefaults() {
        MonitorSpec spec = new SimpleMonitorBuilder("ls", List.of("ls"), s -> null)
                .period(Duration.ofSeconds(10))
                .build();

        assertThat(spec.dueTime()).isZero();
        assertThat(spec.repetitions()).isEqualTo(Repetitions.UNBOUNDED);
        assertThat(spec.echo()).isTrue();
        assertThat(spec.autostart()).isTrue();
    }

    @Test
    void intervalShouldLeaveDueTimeUntouched() {
        MonitorSpec spec = new SimpleMonitorBuilder("ls", List.of("ls"), s -> null)
                .dueTime(Duration.ofSeconds(3))
                .interval(Duration.ofSeconds(10))
                .build();

        assertThat(spec.dueTime()).isEqualTo(Duration.ofSeconds(3));
        assertThat(spec.period()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void saveShouldHandBuiltSpecToRegistrar() {
        List<MonitorSpec> registered = new ArrayList<>();

        new SimpleMonitorBuilder("kill notepad", List.of("kill", "notepad"), s -> {
            registered.add(s);
            return null;
        }).period(Duration.ofMinutes(1)).repetitions(Repetitions.of(2)).echo(false).save();

        assertThat(registered).hasSize(1);
        assertThat(registered.get(0).command()).containsExactly("kill", "notepad");
        assertThat(registered.get(0).repetitions().count()).isEqualTo(2);
        assertThat(registered.get(0).echo()).isFalse();
    }

    @Test
    void commandShouldBeCopied() {
        List<String> tokens = new ArrayList<>(List.of("ls"));
        SimpleMonitorBuilder builder = new SimpleMonitorBuilder("ls", tokens, s -> null);
        tokens.add("true");

        assertThat(builder.period(Duration.ofSeconds(1)).build().command()).containsExactly("ls");
    }

    @Test
    void blankNameShouldBeRejected() {
        assertThatThrownBy(() -> new SimpleMonitorBuilder(" ", List.of("ls"), s -> null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
