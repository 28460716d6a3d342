package io.cwrelay.cli.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps command names to factories.
 */
public class CommandRegistry {

    private final Map<String, Supplier<? extends RelayCommand>> factories = new LinkedHashMap<>();

    public static CommandRegistry defaults() {
        return new CommandRegistry()
                .register(AwsMetricsCommand.NAME, AwsMetricsCommand::new);
    }

    public CommandRegistry register(String name, Supplier<? extends RelayCommand> factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Command already registered: " + name);
        }
        return this;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    /**
     * A fresh instance of every registered command, in registration order.
     */
    public Map<String, RelayCommand> createAll() {
        Map<String, RelayCommand> commands = new LinkedHashMap<>();
        factories.forEach((name, factory) -> commands.put(name, factory.get()));
        return commands;
    }
}
