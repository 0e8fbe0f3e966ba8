package com.vidnyan.semacro.adapter.in.cli;

import com.vidnyan.semacro.SemacroProperties;
import com.vidnyan.semacro.adapter.in.cli.CliCommand.Command;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.CallerEntry;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.DepsRequest;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.DepsResult;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.LookupRequest;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.LookupResult;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.ModuleExpansion;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.ModuleRequest;
import com.vidnyan.semacro.application.port.in.QueryResult;
import com.vidnyan.semacro.application.service.IncludePathResolver;
import com.vidnyan.semacro.application.service.PolicyCatalogLoader;
import com.vidnyan.semacro.domain.PolicyLoadException;
import com.vidnyan.semacro.domain.UsageException;
import com.vidnyan.semacro.domain.expansion.ExpansionNode;
import com.vidnyan.semacro.domain.graph.GraphFormat;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.PolicyCatalog;
import com.vidnyan.semacro.domain.rule.Rule;
import com.vidnyan.semacro.domain.search.WhichMatch;
import com.vidnyan.semacro.domain.search.WhichQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Command line entry point. Parses the arguments, loads the policy tree once and prints the
 * answer to one query on stdout. Diagnostics go to stderr.
 *
 * <p>Exit codes: 0 success, 1 query failed (not found, bad pattern, bad call), 2 no usable
 * policy tree, 64 usage error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "semacro.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SemacroCliRunner implements CommandLineRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_QUERY_FAILED = 1;
    public static final int EXIT_FATAL = 2;
    public static final int EXIT_USAGE = 64;

    private final MacroQueryUseCase queryUseCase;
    private final PolicyCatalogLoader catalogLoader;
    private final IncludePathResolver includePathResolver;
    private final SemacroProperties properties;
    private final JsonOutputWriter jsonWriter;
    private final CommandLineParser commandLineParser = new CommandLineParser();

    @Value("${semacro.version:dev}")
    private String version;

    private int exitCode;

    @Override
    public void run(String... args) {
        boolean interactive = System.console() != null;
        exitCode = execute(args, System.in, System.out, System.err, interactive);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Run one command against the given streams.
     * @param interactive true when stdin and stdout are a terminal: enables color, disables stdin arguments
     */
    public int execute(String[] args, InputStream in, PrintStream out, PrintStream err, boolean interactive) {
        CliCommand command;
        try {
            command = commandLineParser.parse(args);
        } catch (UsageException e) {
            err.println("semacro: " + e.getMessage());
            err.print(CommandLineParser.USAGE);
            return EXIT_USAGE;
        }

        if (!command.needsCatalog()) {
            if (command.command() == Command.VERSION) {
                out.println("semacro " + version);
            } else {
                out.print(CommandLineParser.USAGE);
            }
            return EXIT_OK;
        }

        BufferedReader stdin = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String argument;
        String moduleContent = null;
        try {
            argument = resolveArgument(command, stdin, interactive);
            if (command.command() == Command.EXPAND && "-".equals(argument)) {
                moduleContent = stdin.lines().collect(Collectors.joining("\n"));
            }
        } catch (UsageException e) {
            err.println("semacro " + command.command().cliName() + ": " + e.getMessage());
            return EXIT_USAGE;
        } catch (UncheckedIOException e) {
            err.println("semacro: cannot read stdin: " + e.getMessage());
            return EXIT_FATAL;
        }

        PolicyCatalog catalog;
        try {
            List<Path> roots = includePathResolver.resolve(command.includePath());
            catalog = catalogLoader.load(roots);
        } catch (PolicyLoadException e) {
            err.println("semacro: " + e.getMessage());
            return EXIT_FATAL;
        }

        Printer printer = new Printer(out, err, new TreeRenderer(command.color() && interactive), command.json());
        try {
            return switch (command.command()) {
                case LOOKUP -> lookup(catalog, command, argument, printer);
                case FIND -> find(catalog, argument, printer);
                case LIST -> list(catalog, command, printer);
                case CALLERS -> callers(catalog, argument, printer);
                case WHICH -> which(catalog, command, printer);
                case EXPAND -> expand(catalog, command, argument, moduleContent, printer);
                case DEPS -> deps(catalog, command, argument, printer);
                case VERSION, HELP -> EXIT_OK;
            };
        } catch (UsageException e) {
            err.println("semacro: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /**
     * The single positional argument of lookup, find, callers, deps and expand. A missing value or
     * {@code -} is read as one line from stdin, except for expand which reads the whole stream.
     */
    private String resolveArgument(CliCommand command, BufferedReader stdin, boolean interactive) {
        Command c = command.command();
        if (c == Command.LIST || c == Command.WHICH) {
            return null;
        }
        String value = command.positional(0).orElse(null);
        if (value != null && !value.equals("-")) {
            return value;
        }
        if (c == Command.EXPAND) {
            return "-";
        }
        if (!interactive) {
            try {
                String line = stdin.readLine();
                if (line != null && !line.isBlank()) {
                    return line.strip();
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        throw new UsageException("missing required argument (provide it or pipe via stdin)");
    }

    private int lookup(PolicyCatalog catalog, CliCommand command, String nameOrCall, Printer printer) {
        LookupRequest request = LookupRequest.of(nameOrCall, command.expand(), command.rules(),
                command.depthOr(properties.getDefaultDepth()));
        QueryResult<LookupResult> result = queryUseCase.lookup(catalog, request);
        if (!result.isSuccess()) {
            int paren = nameOrCall.indexOf('(');
            return printer.failure(result, paren < 0 ? nameOrCall : nameOrCall.substring(0, paren).strip());
        }
        LookupResult lookup = result.value();
        if (lookup.warning() != null) {
            printer.err.println("semacro: warning: " + lookup.warning());
            printer.err.println("  Try: semacro lookup " + (command.rules() ? "--rules" : "--expand")
                    + " \"" + lookup.definition().name() + "(type1, type2, ...)\"");
        }

        switch (request.mode()) {
            case RAW -> {
                MacroDefinition definition = lookup.definition();
                TreeRenderer r = printer.renderer;
                printer.out.println(r.colored(definition.kind().keyword(), TreeRenderer.DIM) + " "
                        + r.colored(definition.name(), TreeRenderer.BOLD, TreeRenderer.CYAN) + "  "
                        + r.colored("# " + definition.location().format(), TreeRenderer.DIM));
                for (MacroDefinition other : lookup.duplicates().subList(1, lookup.duplicates().size())) {
                    printer.out.println(r.colored("# also defined at " + other.location().format(), TreeRenderer.DIM));
                }
                printer.out.println(definition.displayText(lookup.renderedBody()));
            }
            case EXPAND -> {
                if (printer.json) {
                    printer.json(jsonWriter.tree(lookup.tree()));
                } else {
                    printer.out.println(printer.renderer.render(lookup.tree()));
                }
            }
            case RULES -> printer.rules(lookup.rules());
        }
        return EXIT_OK;
    }

    private int find(PolicyCatalog catalog, String pattern, Printer printer) {
        QueryResult<List<MacroDefinition>> result = queryUseCase.find(catalog, pattern);
        if (!result.isSuccess()) {
            if (result.status() == QueryResult.Status.NOT_FOUND) {
                printer.err.println("semacro: " + result.message());
                printer.err.println("  Patterns are case-sensitive Java regular expressions. Try a broader pattern.");
                return EXIT_QUERY_FAILED;
            }
            return printer.failure(result, pattern);
        }
        printer.definitions(result.value(), false, "result(s)");
        return EXIT_OK;
    }

    private int list(PolicyCatalog catalog, CliCommand command, Printer printer) {
        QueryResult<List<MacroDefinition>> result = queryUseCase.list(catalog, command.category());
        if (!result.isSuccess()) {
            return printer.failure(result, command.category());
        }
        printer.definitions(result.value(), true, "macro(s)");
        return EXIT_OK;
    }

    private int callers(PolicyCatalog catalog, String name, Printer printer) {
        QueryResult<List<CallerEntry>> result = queryUseCase.callers(catalog, name);
        if (!result.isSuccess()) {
            return printer.failure(result, name);
        }
        List<CallerEntry> callers = result.value();
        if (callers.isEmpty()) {
            printer.err.println("semacro: " + result.message());
            return EXIT_OK;
        }
        printer.definitions(callers.stream().map(CallerEntry::definition).toList(), false, "caller(s)");
        return EXIT_OK;
    }

    private int which(PolicyCatalog catalog, CliCommand command, Printer printer) {
        List<String> p = command.positionals();
        WhichQuery query = new WhichQuery(p.get(0), p.get(1), p.get(2), command.objectClass(),
                command.filename(), command.transition(), properties.getWhichDepth());
        QueryResult<List<WhichMatch>> result = queryUseCase.which(catalog, query);
        if (!result.isSuccess()) {
            return printer.failure(result, null);
        }
        if (printer.json) {
            printer.json(jsonWriter.matches(result.value()));
            return EXIT_OK;
        }
        TreeRenderer r = printer.renderer;
        for (WhichMatch match : result.value()) {
            printer.out.println("  " + r.colored(match.signature(), TreeRenderer.BOLD, TreeRenderer.CYAN) + "  "
                    + r.colored(match.definition().location().format(), TreeRenderer.DIM));
        }
        printer.out.println(r.colored("\n" + result.value().size() + " result(s)", TreeRenderer.DIM));
        return EXIT_OK;
    }

    private int expand(PolicyCatalog catalog, CliCommand command, String file, String content, Printer printer) {
        int depth = command.depthOr(properties.getDefaultDepth());
        ModuleRequest request = content != null
                ? ModuleRequest.forContent(content, depth, command.tree())
                : ModuleRequest.forPath(Path.of(file), depth, command.tree());
        QueryResult<ModuleExpansion> result = queryUseCase.expandModule(catalog, request);
        if (!result.isSuccess()) {
            return printer.failure(result, file);
        }
        ModuleExpansion expansion = result.value();
        if (printer.json) {
            printer.json(jsonWriter.moduleExpansion(expansion));
        } else if (command.tree()) {
            for (ExpansionNode tree : expansion.trees()) {
                printer.out.println(printer.renderer.render(tree));
                printer.out.println();
            }
        } else {
            printer.rules(expansion.rules());
        }
        return EXIT_OK;
    }

    private int deps(PolicyCatalog catalog, CliCommand command, String name, Printer printer) {
        GraphFormat format = command.format() == null ? GraphFormat.DOT : command.format();
        QueryResult<DepsResult> result = queryUseCase.deps(catalog,
                new DepsRequest(name, command.depthOr(properties.getDefaultDepth()), format));
        if (!result.isSuccess()) {
            return printer.failure(result, name);
        }
        if (printer.json) {
            printer.json(jsonWriter.graph(result.value().graph()));
        } else {
            printer.out.print(result.value().document());
        }
        return EXIT_OK;
    }

    /**
     * Output streams and rendering mode of one invocation.
     */
    private final class Printer {
        private final PrintStream out;
        private final PrintStream err;
        private final TreeRenderer renderer;
        private final boolean json;

        private Printer(PrintStream out, PrintStream err, TreeRenderer renderer, boolean json) {
            this.out = out;
            this.err = err;
            this.renderer = renderer;
            this.json = json;
        }

        private void json(Object value) {
            out.println(jsonWriter.write(value));
        }

        private void rules(List<Rule> rules) {
            if (json) {
                json(jsonWriter.rules(rules));
                return;
            }
            rules.forEach(rule -> out.println(rule.render()));
        }

        private void definitions(List<MacroDefinition> definitions, boolean numbered, String noun) {
            if (json) {
                json(jsonWriter.definitions(definitions));
                return;
            }
            int width = String.valueOf(definitions.size()).length();
            int i = 0;
            for (MacroDefinition d : definitions) {
                i++;
                String tag = renderer.colored(d.kind().tag(), TreeRenderer.YELLOW);
                String source = renderer.colored(d.sourcePath(), TreeRenderer.DIM);
                String name = renderer.colored(d.name(), TreeRenderer.BOLD);
                if (numbered) {
                    String num = renderer.colored(String.format("%" + width + "d", i), TreeRenderer.DIM);
                    out.println("  " + num + "  " + tag + " " + name + "  " + source);
                } else {
                    out.println("  " + tag + " " + source + ": " + name);
                }
            }
            out.println(renderer.colored("\n" + definitions.size() + " " + noun, TreeRenderer.DIM));
        }

        private int failure(QueryResult<?> result, String subject) {
            err.println("semacro: " + result.message());
            if (result.status() == QueryResult.Status.NOT_FOUND && subject != null) {
                if (!result.suggestions().isEmpty()) {
                    err.println("  Did you mean: " + String.join(", ", result.suggestions()));
                } else if (result.message().startsWith("macro ")) {
                    err.println("  Try: semacro find \"" + subject + "\"");
                }
            }
            log.debug("Query failed with {}", result.status());
            return result.status() == QueryResult.Status.USAGE_ERROR ? EXIT_USAGE : EXIT_QUERY_FAILED;
        }
    }
}
