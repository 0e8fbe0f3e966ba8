package com.vidnyan.semacro.adapter.in.cli;

import com.vidnyan.semacro.domain.graph.GraphFormat;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A parsed command line: global options, the subcommand and its options.
 */
public record CliCommand(
    Command command,
    String includePath,
    boolean color,
    boolean json,
    List<String> positionals,
    boolean expand,
    boolean rules,
    boolean tree,
    boolean transition,
    Integer depth,
    String category,
    String objectClass,
    String filename,
    GraphFormat format
) {

    public enum Command {
        LOOKUP,
        FIND,
        LIST,
        CALLERS,
        WHICH,
        EXPAND,
        DEPS,
        VERSION,
        HELP;

        public static Optional<Command> fromName(String name) {
            return switch (name.toLowerCase(Locale.ROOT)) {
                case "lookup" -> Optional.of(LOOKUP);
                case "find" -> Optional.of(FIND);
                case "list" -> Optional.of(LIST);
                case "callers" -> Optional.of(CALLERS);
                case "which" -> Optional.of(WHICH);
                case "expand" -> Optional.of(EXPAND);
                case "deps" -> Optional.of(DEPS);
                default -> Optional.empty();
            };
        }

        public String cliName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public CliCommand {
        positionals = positionals == null ? List.of() : List.copyOf(positionals);
    }

    /**
     * Commands that never touch the policy tree.
     */
    public boolean needsCatalog() {
        return command != Command.VERSION && command != Command.HELP;
    }

    public Optional<String> positional(int i) {
        return i < positionals.size() ? Optional.of(positionals.get(i)) : Optional.empty();
    }

    public int depthOr(int fallback) {
        return depth == null ? fallback : depth;
    }
}
