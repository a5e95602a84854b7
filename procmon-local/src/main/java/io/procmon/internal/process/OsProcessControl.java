package io.procmon.internal.process;

import io.procmon.ProcessControl;
import io.procmon.core.KillResult;
import io.procmon.core.ProcessInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ProcessControl} backed by {@link ProcessHandle}.
 *
 * <p>A process name is the base name of its executable without an ".exe" suffix. Processes whose
 * executable is not visible to this user are listed as "?" and can only be killed by pid.
 * The JVM running the console is never terminated.
 */
public class OsProcessControl implements ProcessControl {
    private static final Logger log = LoggerFactory.getLogger(OsProcessControl.class);

    static final String UNKNOWN_NAME = "?";

    @Override
    public List<ProcessInfo> list() {
        return ProcessHandle.allProcesses()
                .map(ph -> new ProcessInfo(ph.pid(), nameOf(ph)))
                .collect(Collectors.toList());
    }

    @Override
    public List<ProcessInfo> findByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return list().stream()
                .filter(p -> p.name().equals(name))
                .collect(Collectors.toList());
    }

    @Override
    public KillResult kill(long pid) {
        if (pid == ProcessHandle.current().pid()) {
            log.warn("Refusing to kill the console's own process pid={}", pid);
            return KillResult.FAILED;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return KillResult.NOT_FOUND;
        }
        try {
            if (handle.get().destroyForcibly()) {
                log.info("Terminated process pid={}", pid);
                return KillResult.TERMINATED;
            }
            log.warn("Process refused termination pid={}", pid);
            return KillResult.FAILED;
        } catch (SecurityException | UnsupportedOperationException e) {
            log.warn("Cannot terminate process pid={} msg={}", pid, e.getMessage());
            return KillResult.FAILED;
        }
    }

    @Override
    public int killByName(String name) {
        int terminated = 0;
        for (ProcessInfo p : findByName(name)) {
            if (kill(p.pid()) == KillResult.TERMINATED) {
                terminated++;
            }
        }
        return terminated;
    }

    static String nameOf(ProcessHandle ph) {
        return ph.info().command()
                .map(OsProcessControl::baseName)
                .orElse(UNKNOWN_NAME);
    }

    static String baseName(String command) {
        Path fileName = Paths.get(command).getFileName();
        String name = fileName == null ? command : fileName.toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(".exe")) {
            name = name.substring(0, name.length() - 4);
        }
        return name;
    }
}
