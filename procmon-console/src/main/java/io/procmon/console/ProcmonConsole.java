package io.procmon.console;

import io.procmon.CommandExecutor;
import io.procmon.Settings;
import io.procmon.config.ProcmonProperties;
import io.procmon.utils.CommandLines;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Interactive prompt. Reads one command per line until {@code q}, end of input or CTRL+C.
 *
 * <p>Quitting is handled here and never by the {@link CommandExecutor}, so a monitor can't end the session.
 */
public class ProcmonConsole implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProcmonConsole.class);

    static final String NOT_RECOGNIZED = "Command not recognized." + System.lineSeparator()
            + "(Note: for multiple optional arguments, either all or none must be specified)";

    static final int EXIT_INTERRUPTED = 130;

    private static final Set<String> QUIT = Set.of("q", "quit");

    private static final String BANNER = String.join(System.lineSeparator(),
            "PROCESS MONITOR",
            "Press CTRL+C to force exit at any time (however, settings won't be saved).",
            "Enter a command ('help' for more info, 'q' to quit).",
            "--------------------------------------------------------------------------");

    private final CommandExecutor executor;
    private final Settings settings;
    private final ConsoleOutput output;
    private final ProcmonProperties props;

    private volatile int exitCode = 0;

    public ProcmonConsole(CommandExecutor executor, Settings settings, ConsoleOutput output, ProcmonProperties props) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.output = Objects.requireNonNull(output, "output must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
    }

    @Override
    public void run(String... args) throws IOException {
        try (Terminal terminal = buildTerminal()) {
            exitCode = run(terminal);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int run(Terminal terminal) {
        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("procmon")
                .build();
        output.attach(reader);
        try {
            output.println(BANNER);
            return loop(reader);
        } finally {
            output.detach();
        }
    }

    private int loop(LineReader reader) {
        while (true) {
            String line;
            try {
                line = reader.readLine(props.getConsole().getPrompt());
            } catch (UserInterruptException e) {
                log.info("Console interrupted; exiting without saving settings");
                output.println("Exiting without saving settings.");
                return EXIT_INTERRUPTED;
            } catch (EndOfFileException e) {
                log.info("Console input closed");
                quit(reader);
                return 0;
            }

            List<String> tokens = CommandLines.tokenize(line);
            if (tokens.isEmpty()) {
                continue;
            }
            if (tokens.size() == 1 && QUIT.contains(tokens.get(0))) {
                quit(reader);
                return 0;
            }
            dispatch(tokens);
        }
    }

    private void dispatch(List<String> tokens) {
        try {
            if (!executor.execute(tokens, true, true)) {
                output.println(NOT_RECOGNIZED);
            }
        } catch (RuntimeException e) {
            log.error("Command failed command={} msg={}", CommandLines.join(tokens), e.getMessage(), e);
            output.println("FAILURE:" + System.lineSeparator() + "\t" + e.getMessage());
        }
    }

    /**
     * Save settings, asking whether to retry while saving fails.
     */
    private void quit(LineReader reader) {
        while (true) {
            try {
                settings.save();
                output.println("Saved settings successfully.");
                return;
            } catch (IOException e) {
                log.error("Saving settings failed path={} msg={}", settings.location(), e.getMessage(), e);
                output.println("SAVE SETTINGS FAILURE: " + e.getMessage());
            }
            if (!askRetry(reader)) {
                output.println("Aborting.");
                return;
            }
        }
    }

    private boolean askRetry(LineReader reader) {
        while (true) {
            String answer;
            try {
                answer = reader.readLine("Try again (Y/N)? ");
            } catch (UserInterruptException | EndOfFileException e) {
                return false;
            }
            switch (answer.trim().toUpperCase(Locale.ROOT)) {
                case "Y":
                    return true;
                case "N":
                    return false;
                default:
                    break;
            }
        }
    }

    /**
     * Some hosts (IDE consoles, redirected input) have no usable system terminal; fall back to a dumb one.
     */
    private static Terminal buildTerminal() throws IOException {
        try {
            return TerminalBuilder.builder()
                    .name("procmon")
                    .system(true)
                    .dumb(false)
                    .build();
        } catch (IOException | IllegalStateException e) {
            log.warn("System terminal unavailable, using a dumb terminal msg={}", e.getMessage());
        }
        return TerminalBuilder.builder()
                .name("procmon")
                .system(true)
                .dumb(true)
                .build();
    }
}
