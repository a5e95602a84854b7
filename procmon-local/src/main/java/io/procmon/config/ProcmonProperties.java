package io.procmon.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the process monitor console.
 */
@ConfigurationProperties(prefix = "procmon")
public class ProcmonProperties {
    private Path settingsDir = Paths.get(System.getProperty("user.home"), ".procmon");
    private String settingsFile = "settings.json";
    private Duration shutdownTimeout = Duration.ofSeconds(5); // wait for in-flight triggers
    private final Console console = new Console();

    public Path getSettingsDir() {
        return settingsDir;
    }

    public void setSettingsDir(Path settingsDir) {
        this.settingsDir = settingsDir;
    }

    public String getSettingsFile() {
        return settingsFile;
    }

    public void setSettingsFile(String settingsFile) {
        this.settingsFile = settingsFile;
    }

    public Path getSettingsPath() {
        return settingsDir.resolve(settingsFile);
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Console getConsole() {
        return console;
    }

    public static class Console {
        private boolean enabled = true;
        private String prompt = "> ";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPrompt() {
            return prompt;
        }

        public void setPrompt(String prompt) {
            this.prompt = prompt;
        }
    }
}
