package io.procmon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.procmon.CommandExecutor;
import io.procmon.Monitors;
import io.procmon.Output;
import io.procmon.ProcessControl;
import io.procmon.Settings;
import io.procmon.console.ConsoleOutput;
import io.procmon.console.ProcmonConsole;
import io.procmon.internal.command.CommandContext;
import io.procmon.internal.command.ProcessCommandExecutor;
import io.procmon.internal.local.LocalMonitors;
import io.procmon.internal.process.OsProcessControl;
import io.procmon.internal.settings.JsonSettingsStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for procmon components.
 */
@AutoConfiguration
@ConditionalOnClass(Monitors.class)
@EnableConfigurationProperties(ProcmonProperties.class)
@ConditionalOnProperty(prefix = "procmon", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ProcmonConfig {

    @Bean
    @ConditionalOnMissingBean(Output.class)
    public ConsoleOutput procmonOutput() {
        return new ConsoleOutput(System.out);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessControl processControl() {
        return new OsProcessControl();
    }

    @Bean
    @ConditionalOnMissingBean
    public Settings settings(ProcmonProperties props, ObjectProvider<ObjectMapper> objectMapperProvider) {
        return new JsonSettingsStore(props.getSettingsPath(), objectMapperProvider.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public Monitors monitors(ProcmonProperties props, Output output) {
        return new LocalMonitors(props, output);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandExecutor commandExecutor(Settings settings, Monitors monitors, ProcessControl processes, Output output) {
        return new ProcessCommandExecutor(new CommandContext(settings, monitors, processes, output));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcmonLifecycle procmonLifecycle(Settings settings, Monitors monitors) {
        return new ProcmonLifecycle(settings, monitors);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ConsoleOutput.class)
    @ConditionalOnProperty(prefix = "procmon.console", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ProcmonConsole procmonConsole(CommandExecutor executor, Settings settings,
                                        ConsoleOutput output, ProcmonProperties props) {
        return new ProcmonConsole(executor, settings, output, props);
    }
}
