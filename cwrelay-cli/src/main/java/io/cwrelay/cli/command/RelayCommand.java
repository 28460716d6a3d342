package io.cwrelay.cli.command;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A command the CLI can run.
 */
public interface RelayCommand {

    /**
     * JCommander parameter object; populated before {@link #execute()} is called.
     */
    Object arguments();

    /**
     * Runs the command. Failures are reported by throwing.
     *
     * @return process exit status
     */
    int execute();

    String helpText();

    /**
     * Settings the command runs with; the {@code logging} block configures Logback.
     */
    default Config settings() {
        return ConfigFactory.load();
    }
}
