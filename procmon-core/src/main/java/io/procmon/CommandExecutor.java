package io.procmon;

import java.util.List;

/**
 * Executes one tokenized console command.
 */
public interface CommandExecutor {

    /**
     * @param tokens        command name followed by its arguments
     * @param outputEnabled print what the command does
     * @param apply         false validates only; nothing is executed
     * @return true if {@code tokens} form a recognized, well-formed command
     */
    boolean execute(List<String> tokens, boolean outputEnabled, boolean apply);

    /**
     * Whether a monitor may repeat this command. Checked before a monitor is created.
     */
    default boolean isSchedulable(List<String> tokens) {
        return true;
    }
}
