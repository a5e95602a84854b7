package io.procmon.config;

import io.procmon.Monitors;
import io.procmon.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.io.UncheckedIOException;

/**
 * Bridges settings loading and the monitor registry lifecycle with the Spring container lifecycle.
 */
public class ProcmonLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ProcmonLifecycle.class);

    private final Settings settings;
    private final Monitors monitors;
    private volatile boolean running = false;

    public ProcmonLifecycle(Settings settings, Monitors monitors) {
        this.settings = settings;
        this.monitors = monitors;
    }

    @Override
    public void start() {
        try {
            settings.load();
        } catch (UncheckedIOException e) {
            // keep running with empty lists; the next save rewrites the file
            log.error("Settings could not be loaded path={} msg={}", settings.location(), e.getMessage(), e);
        }
        monitors.start();
        running = true;
    }

    @Override
    public void stop() {
        monitors.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
