package com.deepansh.mq.cli;

import com.deepansh.mq.exception.UserException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed arguments of one subcommand: positionals in order, plus flags and options.
 *
 * Options are declared up front through {@link Options}; each has a canonical long name
 * and any number of aliases. {@code --name=value} and {@code --name value} are both
 * accepted, and {@code --} ends option parsing.
 */
final class CliArgs {

    private final String usage;
    private final List<String> positionals;
    private final Map<String, String> values;
    private final Set<String> switches;

    private CliArgs(String usage, List<String> positionals, Map<String, String> values, Set<String> switches) {
        this.usage = usage;
        this.positionals = positionals;
        this.values = values;
        this.switches = switches;
    }

    static Options options(String help) {
        return new Options(help);
    }

    /** @throws UserException when the count of positionals differs */
    CliArgs expect(String... names) {
        if (positionals.size() < names.length) {
            throw new UserException("missing argument <" + names[positionals.size()] + ">\n" + usage);
        }
        if (positionals.size() > names.length) {
            throw new UserException("unrecognized arguments: "
                    + String.join(" ", positionals.subList(names.length, positionals.size())) + "\n" + usage);
        }
        return this;
    }

    String positional(int index) {
        return positionals.get(index);
    }

    Optional<String> value(String name) {
        return Optional.ofNullable(values.get(name));
    }

    String required(String name) {
        String value = values.get(name);
        if (value == null) {
            throw new UserException("the following arguments are required: " + name + "\n" + usage);
        }
        return value;
    }

    boolean has(String name) {
        return switches.contains(name);
    }

    Optional<Integer> intValue(String name) {
        return value(name).map(v -> {
            try {
                return Integer.parseInt(v.strip());
            } catch (NumberFormatException e) {
                throw new UserException("argument " + name + ": invalid int value: '" + v + "'");
            }
        });
    }

    static final class Options {

        private final String usage;
        private final Map<String, String> canonical = new HashMap<>();
        private final Set<String> valued = new HashSet<>();

        private Options(String help) {
            this.usage = help.lines().findFirst().orElse("");
        }

        Options flag(String name, String... aliases) {
            register(name, aliases);
            return this;
        }

        Options option(String name, String... aliases) {
            register(name, aliases);
            valued.add(name);
            return this;
        }

        private void register(String name, String... aliases) {
            canonical.put(name, name);
            for (String alias : aliases) canonical.put(alias, name);
        }

        CliArgs parse(List<String> args) {
            List<String> positionals = new ArrayList<>();
            Map<String, String> values = new HashMap<>();
            Set<String> switches = new HashSet<>();

            for (int i = 0; i < args.size(); i++) {
                String token = args.get(i);
                if (token.equals("--")) {
                    positionals.addAll(args.subList(i + 1, args.size()));
                    break;
                }
                if (!token.startsWith("-") || token.equals("-")) {
                    positionals.add(token);
                    continue;
                }

                String key = token;
                String inline = null;
                int eq = token.indexOf('=');
                if (token.startsWith("--") && eq > 0) {
                    key = token.substring(0, eq);
                    inline = token.substring(eq + 1);
                }
                String name = canonical.get(key);
                if (name == null) {
                    throw new UserException("unrecognized arguments: " + token + "\n" + usage);
                }

                if (valued.contains(name)) {
                    if (inline == null) {
                        if (i + 1 >= args.size()) {
                            throw new UserException("argument " + name + ": expected one argument\n" + usage);
                        }
                        inline = args.get(++i);
                    }
                    values.put(name, inline);
                } else {
                    if (inline != null) {
                        throw new UserException("argument " + name + ": ignored explicit argument '" + inline + "'");
                    }
                    switches.add(name);
                }
            }
            return new CliArgs(usage, positionals, values, switches);
        }
    }
}
