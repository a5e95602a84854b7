package io.procmon;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Line sink for user-facing console text. Implementations must be safe to call from trigger threads.
 */
@FunctionalInterface
public interface Output {
    void println(String line);

    static Output of(PrintStream stream) {
        Objects.requireNonNull(stream, "stream must not be null");
        return line -> {
            synchronized (stream) {
                stream.println(line);
            }
        };
    }
}
