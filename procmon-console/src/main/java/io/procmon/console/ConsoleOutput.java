package io.procmon.console;

import io.procmon.Output;
import org.jline.reader.LineReader;

import java.io.PrintStream;

/**
 * Console {@link Output}. While a prompt is active, lines are printed above it so trigger
 * threads never garble what the user is typing.
 */
public class ConsoleOutput implements Output {

    private final Output fallback;
    private volatile LineReader reader;

    public ConsoleOutput(PrintStream stream) {
        this.fallback = Output.of(stream);
    }

    @Override
    public void println(String line) {
        LineReader r = reader;
        if (r != null) {
            r.printAbove(line);
            return;
        }
        fallback.println(line);
    }

    void attach(LineReader reader) {
        this.reader = reader;
    }

    void detach() {
        this.reader = null;
    }
}
