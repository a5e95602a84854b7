package io.procmon.internal.command;

import io.procmon.CommandExecutor;
import io.procmon.Monitor;
import io.procmon.Settings;
import io.procmon.core.BulkResult;
import io.procmon.core.KillResult;
import io.procmon.core.MonitorError;
import io.procmon.core.MonitorException;
import io.procmon.core.MonitorState;
import io.procmon.core.ProcessInfo;
import io.procmon.core.Repetitions;
import io.procmon.core.SettingStatus;
import io.procmon.utils.CommandLines;
import io.procmon.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The console's command set.
 *
 * <p>Every command is parsed completely before anything is done, so {@code apply == false}
 * answers "is this a legal command" without side effects. Monitors call back into this class
 * from their trigger threads; it holds no mutable state of its own.
 */
public class ProcessCommandExecutor implements CommandExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

    static final String IGNORE_LIST_NAME = "Ignore list";
    static final String KILL_LIST_NAME = "Kill list";

    /**
     * Commands a monitor may not repeat: monitors never create or manage monitors.
     */
    private static final Set<String> NOT_SCHEDULABLE = Set.of("monitor", "monitors", "help", "save");

    private static final String HELP = String.join(System.lineSeparator(),
            "[required arg] (optional arg)",
            "   ls (sort by pid = false) (use ignore list = true)\tList all running processes. Sorts by name and ignores those on the ignore list by default.",
            "   ig\tList all processes in the ignore list.",
            "   ig add [name]\tAdd a process name to the ignore list (won't list with ls).",
            "   ig rm [name]\tRemove a process from the ignore list.",
            "   killall\tTerminate all running processes on the kill list.",
            "   kill [name]\tTerminate a named process, if running.",
            "   killpid [pid]\tTerminate a process with specified id, if running.",
            "   ki (true/false)\tList all processes in the kill list. true = list only running processes; false = list only non-running processes.",
            "   ki add [name]\tAdd a process name to the kill list.",
            "   ki rm [name]\tRemove a process from the kill list.",
            "   monitor [hh:mm:ss(.fff)] [repetitions|inf] [echo true/false] [command...]\tRepeat a command every interval.",
            "   monitors\tList all monitors.",
            "   monitor start|stop|toggle|rm [id]\tControl one monitor.",
            "   monitor startall|stopall\tStart or stop every monitor.",
            "   monitor interval [id] [hh:mm:ss(.fff)]\tChange how often a monitor repeats.",
            "   monitor reps [id] [repetitions|inf]\tChange how many repetitions a monitor has left.",
            "   settings\tList the location on disk where settings are stored.",
            "   save\tSave settings now.",
            "   q\tSave settings and quit.");

    private final CommandContext ctx;

    public ProcessCommandExecutor(CommandContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
    }

    @Override
    public boolean execute(List<String> tokens, boolean outputEnabled, boolean apply) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty()) {
            return false;
        }
        List<String> args = tokens.subList(1, tokens.size());
        return switch (tokens.get(0)) {
            case "help" -> help(args, outputEnabled, apply);
            case "ls" -> listProcesses(args, outputEnabled, apply);
            case "ig" -> ignoreList(args, outputEnabled, apply);
            case "ki" -> killList(args, outputEnabled, apply);
            case "kill" -> killByName(args, outputEnabled, apply);
            case "killpid" -> killByPid(args, outputEnabled, apply);
            case "killall" -> killAll(args, outputEnabled, apply);
            case "settings" -> showSettingsLocation(args, outputEnabled, apply);
            case "save" -> saveSettings(args, outputEnabled, apply);
            case "monitors" -> displayMonitors(args, outputEnabled, apply);
            case "monitor" -> monitor(args, outputEnabled, apply);
            default -> false;
        };
    }

    @Override
    public boolean isSchedulable(List<String> tokens) {
        return !tokens.isEmpty() && !NOT_SCHEDULABLE.contains(tokens.get(0));
    }

    /* ================= general ================= */

    private boolean help(List<String> args, boolean out, boolean apply) {
        if (!args.isEmpty()) {
            return false;
        }
        if (apply) {
            say(out, HELP);
        }
        return true;
    }

    private boolean showSettingsLocation(List<String> args, boolean out, boolean apply) {
        if (!args.isEmpty()) {
            return false;
        }
        if (apply) {
            say(out, ctx.settings().location().toString());
        }
        return true;
    }

    private boolean saveSettings(List<String> args, boolean out, boolean apply) {
        if (!args.isEmpty()) {
            return false;
        }
        if (!apply) {
            return true;
        }
        try {
            ctx.settings().save();
            say(out, "Saved settings successfully.");
        } catch (IOException e) {
            log.error("Saving settings failed path={} msg={}", ctx.settings().location(), e.getMessage(), e);
            say(out, "SAVE SETTINGS FAILURE: " + e.getMessage());
        }
        return true;
    }

    /* ================= processes ================= */

    private boolean listProcesses(List<String> args, boolean out, boolean apply) {
        boolean sortByPid = false;
        boolean useIgnoreList = true;
        if (!args.isEmpty()) {
            // both optional args or none
            if (args.size() != 2) {
                return false;
            }
            Boolean pid = parseBoolean(args.get(0));
            Boolean ignore = parseBoolean(args.get(1));
            if (pid == null || ignore == null) {
                return false;
            }
            sortByPid = pid;
            useIgnoreList = ignore;
        }
        if (!apply) {
            return true;
        }

        List<ProcessInfo> running = ctx.processes().list();
        Comparator<ProcessInfo> order = sortByPid
                ? Comparator.comparingLong(ProcessInfo::pid)
                : Comparator.comparing(ProcessInfo::name).thenComparingLong(ProcessInfo::pid);
        List<String> ignoreList = useIgnoreList ? ctx.settings().get(Settings.IGNORE) : List.of();

        say(out, "pid | name" + System.lineSeparator() + "----------------");
        int ignored = 0;
        for (ProcessInfo p : running.stream().sorted(order).collect(Collectors.toList())) {
            if (ignoreList.contains(p.name())) {
                ignored++;
                continue;
            }
            say(out, p.pid() + " | " + p.name());
        }
        say(out, "----------------" + System.lineSeparator() + running.size() + " processes running locally.");
        if (useIgnoreList) {
            say(out, (running.size() - ignored) + " listed, " + ignored + " ignored.");
        }
        return true;
    }

    private boolean killByName(List<String> args, boolean out, boolean apply) {
        if (args.isEmpty()) {
            return false;
        }
        if (apply) {
            killNames(List.of(String.join(" ", args)), out);
        }
        return true;
    }

    private boolean killByPid(List<String> args, boolean out, boolean apply) {
        if (args.size() != 1) {
            return false;
        }
        long pid;
        try {
            pid = Long.parseLong(args.get(0));
        } catch (NumberFormatException e) {
            return false;
        }
        if (pid < 0) {
            return false;
        }
        if (!apply) {
            return true;
        }

        KillResult result = ctx.processes().kill(pid);
        switch (result) {
            case NOT_FOUND -> say(out, "No process with pid " + pid + " found.");
            case TERMINATED -> say(out, "Process with pid " + pid + " found. Terminating..."
                    + System.lineSeparator() + "Terminated process successfully.");
            case FAILED -> say(out, "FAILURE:" + System.lineSeparator() + "\tCould not terminate process with pid " + pid + ".");
        }
        return true;
    }

    private boolean killAll(List<String> args, boolean out, boolean apply) {
        if (!args.isEmpty()) {
            return false;
        }
        if (apply) {
            killNames(ctx.settings().get(Settings.KILL), out);
        }
        return true;
    }

    private void killNames(List<String> names, boolean out) {
        boolean exists = false;
        int terminated = 0;
        for (String name : names) {
            List<ProcessInfo> found = ctx.processes().findByName(name);
            if (found.isEmpty()) {
                continue;
            }
            if (!exists) {
                say(out, "Terminating...");
            }
            exists = true;
            say(out, "   " + name + " (" + found.size() + ")");
            terminated += ctx.processes().killByName(name);
        }
        if (exists) {
            say(out, "Terminated " + terminated + " process(es) successfully.");
        } else {
            say(out, "Nothing to kill: no processes specified were running.");
        }
    }

    /* ================= settings lists ================= */

    private boolean ignoreList(List<String> args, boolean out, boolean apply) {
        if (args.isEmpty()) {
            if (apply) {
                displayList(Settings.IGNORE, IGNORE_LIST_NAME, null, out);
            }
            return true;
        }
        return editList(Settings.IGNORE, IGNORE_LIST_NAME, args, out, apply);
    }

    private boolean killList(List<String> args, boolean out, boolean apply) {
        if (args.isEmpty()) {
            if (apply) {
                displayList(Settings.KILL, KILL_LIST_NAME, null, out);
            }
            return true;
        }
        if (args.size() == 1 && ("true".equals(args.get(0)) || "false".equals(args.get(0)))) {
            if (apply) {
                boolean running = Boolean.parseBoolean(args.get(0));
                displayList(Settings.KILL, KILL_LIST_NAME + (running ? " (running)" : " (non-running)"), running, out);
            }
            return true;
        }
        return editList(Settings.KILL, KILL_LIST_NAME, args, out, apply);
    }

    private boolean editList(String listName, String displayName, List<String> args, boolean out, boolean apply) {
        if (args.size() < 2) {
            return false;
        }
        String value = String.join(" ", args.subList(1, args.size()));
        SettingStatus status;
        switch (args.get(0)) {
            case "add" -> {
                status = ctx.settings().add(listName, value, apply);
                if (apply) {
                    switch (status) {
                        case SUCCESS -> say(out, "Added process '" + value + "' to the " + displayName + ".");
                        case NO_CHANGE -> say(out, "Process '" + value + "' is already in the " + displayName + ".");
                        case RESERVED -> say(out, value + " is a reserved keyword and cannot be a process name.");
                        default -> {
                        }
                    }
                }
            }
            case "rm" -> {
                status = ctx.settings().remove(listName, value, apply);
                if (apply) {
                    switch (status) {
                        case SUCCESS -> say(out, "Removed process '" + value + "' from the " + displayName + ".");
                        case NO_CHANGE -> say(out, "Process '" + value + "' not found in " + displayName + ".");
                        default -> {
                        }
                    }
                }
            }
            default -> {
                return false;
            }
        }
        return !status.isError();
    }

    /**
     * @param runningFilter null lists everything; true only running names; false only non-running names
     */
    private void displayList(String listName, String displayName, Boolean runningFilter, boolean out) {
        String nl = System.lineSeparator();
        say(out, displayName + ":" + nl + "#  | name" + nl + "----------");
        List<String> values = ctx.settings().get(listName);
        int matched = 0;
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            if (runningFilter != null) {
                boolean running = !ctx.processes().findByName(value).isEmpty();
                if (running != runningFilter) {
                    continue;
                }
                matched++;
            }
            say(out, "#" + i + " | " + value);
        }
        if (runningFilter != null) {
            int running = runningFilter ? matched : values.size() - matched;
            say(out, "----------" + nl + running + " running, " + (values.size() - running) + " non-running.");
        }
    }

    /* ================= monitors ================= */

    private boolean displayMonitors(List<String> args, boolean out, boolean apply) {
        if (!args.isEmpty()) {
            return false;
        }
        if (apply) {
            say(out, ctx.monitors().display());
        }
        return true;
    }

    private boolean monitor(List<String> args, boolean out, boolean apply) {
        if (args.isEmpty()) {
            return false;
        }
        String sub = args.get(0);
        List<String> rest = args.subList(1, args.size());
        return switch (sub) {
            case "start", "stop", "toggle", "rm" -> monitorById(sub, rest, out, apply);
            case "startall" -> rest.isEmpty() && startAll(out, apply);
            case "stopall" -> rest.isEmpty() && stopAll(out, apply);
            case "interval" -> changeInterval(rest, out, apply);
            case "reps" -> changeRepetitions(rest, out, apply);
            default -> createMonitor(args, out, apply);
        };
    }

    private boolean monitorById(String action, List<String> args, boolean out, boolean apply) {
        if (args.size() != 1) {
            return false;
        }
        Integer id = parseId(args.get(0));
        if (id == null) {
            return false;
        }
        if (!apply) {
            return true;
        }
        try {
            if ("rm".equals(action)) {
                String name = ctx.monitors().require(id).name();
                ctx.monitors().remove(id);
                say(out, "Monitor #" + id + " '" + name + "' removed from monitors successfully.");
                return true;
            }
            Monitor m = ctx.monitors().require(id);
            switch (action) {
                case "start" -> {
                    m.start();
                    say(out, "Monitor #" + id + " '" + m.name() + "' started.");
                }
                case "stop" -> {
                    m.stop();
                    say(out, "Monitor #" + id + " '" + m.name() + "' stopped.");
                }
                default -> {
                    MonitorState state = m.toggle();
                    say(out, "Monitor #" + id + " '" + m.name() + "' "
                            + (state == MonitorState.RUNNING ? "started." : "stopped."));
                }
            }
        } catch (MonitorException e) {
            say(out, e.getMessage());
        }
        return true;
    }

    private boolean startAll(boolean out, boolean apply) {
        if (!apply) {
            return true;
        }
        BulkResult result = ctx.monitors().startAll();
        if (result.isEmpty()) {
            say(out, "Cannot start monitors; no monitors have been created yet.");
        } else if (!result.hasEffect()) {
            say(out, "No monitors were started; all " + result.total() + " are currently running or finished.");
        } else {
            say(out, result.affected() + " monitor(s) started.");
        }
        return true;
    }

    private boolean stopAll(boolean out, boolean apply) {
        if (!apply) {
            return true;
        }
        BulkResult result = ctx.monitors().stopAll();
        if (result.isEmpty()) {
            say(out, "Cannot stop monitors; no monitors have been created yet.");
        } else if (!result.hasEffect()) {
            say(out, "No monitors were stopped; all " + result.total() + " are currently stopped.");
        } else {
            say(out, result.affected() + " monitor(s) stopped.");
        }
        return true;
    }

    private boolean changeInterval(List<String> args, boolean out, boolean apply) {
        if (args.size() < 2) {
            return false;
        }
        Integer id = parseId(args.get(0));
        Duration period = parseInterval(String.join(" ", args.subList(1, args.size())), out);
        if (id == null || period == null) {
            return false;
        }
        if (!apply) {
            return true;
        }
        try {
            Monitor m = ctx.monitors().require(id);
            m.changeInterval(period, period);
            say(out, "Monitor #" + id + " '" + m.name() + "' interval changed to " + IntervalParser.format(period) + ".");
        } catch (MonitorException e) {
            say(out, e.getMessage());
        }
        return true;
    }

    private boolean changeRepetitions(List<String> args, boolean out, boolean apply) {
        if (args.size() != 2) {
            return false;
        }
        Integer id = parseId(args.get(0));
        Repetitions repetitions = parseRepetitions(args.get(1), out);
        if (id == null || repetitions == null) {
            return false;
        }
        if (!apply) {
            return true;
        }
        try {
            Monitor m = ctx.monitors().require(id);
            m.changeRepetitions(repetitions);
            say(out, "Monitor #" + id + " '" + m.name() + "' repetitions changed to " + repetitions + ".");
        } catch (MonitorException e) {
            say(out, e.getMessage());
        }
        return true;
    }

    /**
     * monitor [interval] [repetitions] [echo] [command...]
     */
    private boolean createMonitor(List<String> args, boolean out, boolean apply) {
        if (args.size() < 4) {
            return false;
        }
        Duration period = parseInterval(args.get(0), out);
        if (period == null) {
            return false;
        }
        Repetitions repetitions = parseRepetitions(args.get(1), out);
        if (repetitions == null) {
            return false;
        }
        Boolean echo = parseBoolean(args.get(2));
        if (echo == null) {
            return false;
        }
        List<String> command = List.copyOf(args.subList(3, args.size()));
        if (!isSchedulable(command) || !execute(command, false, false)) {
            say(out, MonitorException.commandRejected(CommandLines.join(command)).getMessage());
            return false;
        }
        if (!apply) {
            return true;
        }

        try {
            Monitor m = ctx.monitors().create(command, this)
                    .dueTime(Duration.ZERO)
                    .interval(period)
                    .repetitions(repetitions)
                    .echo(echo)
                    .autostart(true)
                    .save();
            say(out, "Monitor #" + m.id() + " '" + m.name() + "' created and started.");
        } catch (MonitorException e) {
            say(out, e.getMessage());
            return e.error() != MonitorError.INVALID_SCHEDULE && e.error() != MonitorError.COMMAND_REJECTED;
        }
        return true;
    }

    /* ================= helpers ================= */

    private void say(boolean out, String text) {
        if (out) {
            ctx.output().println(text);
        }
    }

    private Duration parseInterval(String spec, boolean out) {
        try {
            return IntervalParser.parsePositiveInterval(spec);
        } catch (IllegalArgumentException e) {
            say(out, "Invalid interval: " + e.getMessage());
            return null;
        }
    }

    private Repetitions parseRepetitions(String spec, boolean out) {
        try {
            return Repetitions.parse(spec);
        } catch (IllegalArgumentException e) {
            say(out, "Invalid repetitions: " + e.getMessage());
            return null;
        }
    }

    private static Boolean parseBoolean(String s) {
        if ("true".equalsIgnoreCase(s)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(s)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static Integer parseId(String s) {
        try {
            int id = Integer.parseInt(s);
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
