package com.vidnyan.semacro.adapter.in.cli;

import com.vidnyan.semacro.adapter.in.cli.CliCommand.Command;
import com.vidnyan.semacro.domain.UsageException;
import com.vidnyan.semacro.domain.graph.GraphFormat;
import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.parser.DefinitionParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-rolled parser for {@code semacro [global options] <command> [options] [args]}.
 *
 * <p>Every option conflict is rejected here with a {@link UsageException}, before any policy
 * file is read. Spring-style {@code --spring.*}, {@code --logging.*} and {@code --semacro.*}
 * arguments are left to Spring Boot and skipped.
 */
public class CommandLineParser {

    public static final String USAGE = """
            usage: semacro [--include-path DIR] [--no-color] [--json] [--version] <command> [options]

            commands:
              lookup [-e | -r] [-d N] <name|call|->   show, expand (-e) or flatten (-r) a macro
              find <pattern|->                        search macro names by regex
              list [-c CATEGORY]                      list macros, optionally by policy group
              callers <name|->                        macros that call the given macro
              which [-T] [-C CLASS] [-N NAME] <source> <target> <perms|new_type>
                                                      macros granting an access or transition
              expand [-t] [-d N] <file.te|->          expand every macro call of a module
              deps [-d N] [-f dot|mermaid] <name|->   callee graph of a macro

            policy path resolution (highest priority first):
              1. --include-path flag
              2. SEMACRO_INCLUDE_PATH environment variable
              3. /usr/share/selinux/devel/include (requires selinux-policy-devel)
            """;

    public CliCommand parse(String... args) {
        List<String> tokens = new ArrayList<>();
        for (String arg : args) {
            if (!isFrameworkArgument(arg)) {
                tokens.add(arg);
            }
        }

        Builder b = new Builder();
        int i = 0;
        // Global options up to the command name
        while (i < tokens.size() && b.command == null) {
            String token = tokens.get(i++);
            switch (token) {
                case "--no-color" -> b.color = false;
                case "--json" -> b.json = true;
                case "--version", "-V" -> b.command = Command.VERSION;
                case "--help", "-h" -> b.command = Command.HELP;
                case "--include-path" -> b.includePath = value(tokens, i++, token);
                default -> {
                    if (token.startsWith("--include-path=")) {
                        b.includePath = token.substring("--include-path=".length());
                    } else if (token.startsWith("-")) {
                        throw new UsageException("unknown option " + token);
                    } else {
                        b.command = Command.fromName(token)
                                .orElseThrow(() -> new UsageException("unknown command '" + token + "'"));
                    }
                }
            }
        }
        if (b.command == null) {
            throw new UsageException("no command given");
        }

        // Command options and positionals; "-" is a positional meaning stdin
        while (i < tokens.size()) {
            String token = tokens.get(i++);
            if (token.equals("-") || !token.startsWith("-")) {
                b.positionals.add(token);
                continue;
            }
            switch (token) {
                case "-e", "--expand" -> b.expand = true;
                case "-r", "--rules" -> b.rules = true;
                case "-t", "--tree" -> b.tree = true;
                case "-T", "--transition" -> b.transition = true;
                case "-d", "--depth" -> b.depth = depth(value(tokens, i++, token));
                case "-c", "--category" -> b.category = value(tokens, i++, token);
                case "-C", "--class" -> b.objectClass = value(tokens, i++, token);
                case "-N", "--name" -> b.filename = value(tokens, i++, token);
                case "-f", "--format" -> {
                    String name = value(tokens, i++, token);
                    b.format = GraphFormat.fromName(name)
                            .orElseThrow(() -> new UsageException("unknown graph format '" + name + "'"));
                }
                case "--no-color" -> b.color = false;
                case "--json" -> b.json = true;
                default -> throw new UsageException("unknown option " + token + " for " + b.command.cliName());
            }
        }

        validate(b);
        return b.build();
    }

    private static void validate(Builder b) {
        if (b.expand && b.rules) {
            throw new UsageException("lookup: --expand and --rules are mutually exclusive");
        }
        if (b.filename != null && !b.transition) {
            throw new UsageException("--name only applies with --transition");
        }
        if (b.command == Command.WHICH && b.positionals.size() != 3) {
            throw new UsageException("which: expected <source> <target> <perms|new_type>");
        }
        if (b.command == Command.EXPAND && b.positionals.isEmpty()) {
            throw new UsageException("expand: missing module file (use - for stdin)");
        }
        if (b.category != null && !DefinitionIndex.ALL_CATEGORIES.equals(b.category)
                && !DefinitionParser.KNOWN_CATEGORIES.contains(b.category)) {
            throw new UsageException("list: unknown category '" + b.category + "', expected one of "
                    + String.join(", ", DefinitionParser.KNOWN_CATEGORIES) + ", all");
        }
        int maxPositionals = switch (b.command) {
            case WHICH -> 3;
            case LIST, VERSION, HELP -> 0;
            default -> 1;
        };
        if (b.positionals.size() > maxPositionals) {
            throw new UsageException(b.command.cliName() + ": unexpected argument '"
                    + b.positionals.get(maxPositionals) + "'");
        }
    }

    private static Integer depth(String value) {
        int depth;
        try {
            depth = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException("--depth expects a number, got '" + value + "'");
        }
        if (depth < 1) {
            throw new UsageException("--depth must be at least 1");
        }
        return depth;
    }

    private static String value(List<String> tokens, int index, String option) {
        if (index >= tokens.size()) {
            throw new UsageException(option + " requires a value");
        }
        return tokens.get(index);
    }

    private static boolean isFrameworkArgument(String arg) {
        return arg.startsWith("--spring.") || arg.startsWith("--logging.") || arg.startsWith("--semacro.");
    }

    private static final class Builder {
        private Command command;
        private String includePath;
        private boolean color = true;
        private boolean json;
        private final List<String> positionals = new ArrayList<>();
        private boolean expand;
        private boolean rules;
        private boolean tree;
        private boolean transition;
        private Integer depth;
        private String category;
        private String objectClass;
        private String filename;
        private GraphFormat format;

        private CliCommand build() {
            return new CliCommand(command, includePath, color, json, positionals, expand, rules, tree,
                    transition, depth, category, objectClass, filename, format);
        }
    }
}
