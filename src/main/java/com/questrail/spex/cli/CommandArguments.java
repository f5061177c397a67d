package com.questrail.spex.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Options of one subcommand: {@code --name value} pairs (repeatable) and
 * bare {@code --flag}s. Every option and flag must be declared.
 */
final class CommandArguments
{
    private final Map<String, List<String>> options = new LinkedHashMap<>();
    private final List<String> flags = new ArrayList<>();

    private CommandArguments() {}

    static CommandArguments parse(List<String> args, Set<String> optionNames, Set<String> flagNames) {
        CommandArguments parsed = new CommandArguments();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (flagNames.contains(arg)) {
                parsed.flags.add(arg);
            } else if (optionNames.contains(arg)) {
                if (i + 1 >= args.size() || args.get(i + 1).startsWith("--")) {
                    throw new UsageException("Option " + arg + " requires a value");
                }
                parsed.options.computeIfAbsent(arg, k -> new ArrayList<>()).add(args.get(++i));
            } else {
                throw new UsageException("Unknown argument: " + arg);
            }
        }
        return parsed;
    }

    boolean flag(String name) {
        return flags.contains(name);
    }

    Optional<String> option(String name) {
        List<String> values = options.getOrDefault(name, List.of());
        if (values.size() > 1) {
            throw new UsageException("Option " + name + " given more than once");
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    String required(String name) {
        return option(name).orElseThrow(() -> new UsageException("Missing required option " + name));
    }

    List<String> all(String name) {
        return List.copyOf(options.getOrDefault(name, List.of()));
    }

    int intOption(String name, int fallback) {
        Optional<String> value = option(name);
        if (value.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.get());
        } catch (NumberFormatException ex) {
            throw new UsageException("Option " + name + " expects an integer, got " + value.get());
        }
    }
}
