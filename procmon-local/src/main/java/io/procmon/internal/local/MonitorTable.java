package io.procmon.internal.local;

import io.procmon.core.MonitorSnapshot;
import io.procmon.utils.IntervalParser;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * Renders the console table shown by the {@code monitors} command.
 */
public final class MonitorTable {

    static final String HEADER = "# | running | name | interval | repetitions | echo | created";
    static final String RULE = "--------------------------------------------------------------------------------------";

    private static final DateTimeFormatter CREATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private MonitorTable() {
    }

    public static String render(List<MonitorSnapshot> monitors, ZoneId zone) {
        Objects.requireNonNull(monitors, "monitors must not be null");
        Objects.requireNonNull(zone, "zone must not be null");

        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder("Monitors:").append(nl);
        int running = 0;
        if (!monitors.isEmpty()) {
            sb.append(HEADER).append(nl).append(RULE).append(nl);
            for (MonitorSnapshot m : monitors) {
                sb.append(m.id())
                        .append(" | ").append(m.running())
                        .append(" | ").append(m.name())
                        .append(" | ").append(IntervalParser.format(m.period()))
                        .append(" | ").append(m.repetitions())
                        .append(" | ").append(m.echo())
                        .append(" | ").append(CREATED.format(m.createdAt().atZone(zone)))
                        .append(nl);
                if (m.running()) {
                    running++;
                }
            }
            sb.append(RULE).append(nl);
        }
        sb.append(running).append(" running, ").append(monitors.size() - running).append(" stopped.");
        return sb.toString();
    }
}
