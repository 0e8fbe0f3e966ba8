package com.vidnyan.semacro.application.service;

import com.vidnyan.semacro.SemacroProperties;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase;
import com.vidnyan.semacro.application.port.in.QueryResult;
import com.vidnyan.semacro.domain.expansion.ArgumentSubstitutor;
import com.vidnyan.semacro.domain.expansion.DeclarationStripper;
import com.vidnyan.semacro.domain.expansion.DefineResolver;
import com.vidnyan.semacro.domain.expansion.ExpansionEngine;
import com.vidnyan.semacro.domain.expansion.ExpansionNode;
import com.vidnyan.semacro.domain.expansion.Statement;
import com.vidnyan.semacro.domain.expansion.StatementClassifier;
import com.vidnyan.semacro.domain.graph.DependencyGraph;
import com.vidnyan.semacro.domain.graph.GraphRenderer;
import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.domain.index.InvalidPatternException;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.PolicyCatalog;
import com.vidnyan.semacro.domain.rule.Rule;
import com.vidnyan.semacro.domain.rule.RuleMerger;
import com.vidnyan.semacro.domain.rule.RuleParser;
import com.vidnyan.semacro.domain.search.RuleSearch;
import com.vidnyan.semacro.domain.search.WhichMatch;
import com.vidnyan.semacro.domain.search.WhichQuery;
import com.vidnyan.semacro.parser.CallParseException;
import com.vidnyan.semacro.parser.CallParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Answers queries against a loaded {@link PolicyCatalog}.
 * Implements the primary use case; holds no per-catalog state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MacroQueryService implements MacroQueryUseCase {

    // Module-level statements that declare rather than grant
    private static final Pattern MODULE_DECLARATION = Pattern.compile(
            "^(type|attribute|typeattribute|typealias|bool|role)\\s");
    private static final String POLICY_MODULE = "policy_module";

    private final SemacroProperties properties;

    @Override
    public QueryResult<LookupResult> lookup(PolicyCatalog catalog, LookupRequest request) {
        MacroCall call;
        try {
            call = CallParser.parse(request.nameOrCall());
        } catch (CallParseException e) {
            return QueryResult.parseError(e.getMessage());
        }

        DefinitionIndex index = catalog.index();
        Optional<MacroDefinition> found = index.lookup(call.name());
        if (found.isEmpty()) {
            return notFound(index, call.name());
        }
        MacroDefinition definition = found.get();
        List<MacroDefinition> duplicates = index.duplicatesOf(call.name());

        String warning = null;
        if (request.mode() != LookupRequest.Mode.RAW && !call.hasArguments()) {
            warning = "no arguments provided, output will contain raw $N references.";
        }

        return switch (request.mode()) {
            case RAW -> {
                String body = call.hasArguments()
                        ? ArgumentSubstitutor.substitute(definition.body(), call.arguments())
                        : definition.body();
                yield QueryResult.success(new LookupResult(definition, call, duplicates, body, null, null, warning));
            }
            case EXPAND -> {
                ExpansionNode tree = new ExpansionEngine(index).expand(call, request.depth());
                yield QueryResult.success(new LookupResult(definition, call, duplicates, null, tree, null, warning));
            }
            case RULES -> {
                ExpansionNode tree = new ExpansionEngine(index).expand(call, request.depth());
                List<Rule> rules = RuleMerger.mergedRules(tree);
                yield QueryResult.success(new LookupResult(definition, call, duplicates, null, null, rules, warning));
            }
        };
    }

    @Override
    public QueryResult<List<MacroDefinition>> find(PolicyCatalog catalog, String pattern) {
        List<MacroDefinition> matches;
        try {
            matches = catalog.index().find(pattern).toList();
        } catch (InvalidPatternException e) {
            return QueryResult.invalidPattern(e.getMessage());
        }
        if (matches.isEmpty()) {
            return QueryResult.notFound("no macros matching '" + pattern + "'");
        }
        return QueryResult.success(matches);
    }

    @Override
    public QueryResult<List<MacroDefinition>> list(PolicyCatalog catalog, String category) {
        List<MacroDefinition> entries = catalog.index().list(category).toList();
        if (entries.isEmpty()) {
            return QueryResult.notFound("no macros found for category '" + category + "'");
        }
        return QueryResult.success(entries);
    }

    @Override
    public QueryResult<List<CallerEntry>> callers(PolicyCatalog catalog, String name) {
        DefinitionIndex index = catalog.index();
        if (!index.contains(name)) {
            return notFound(index, name);
        }
        List<CallerEntry> callers = catalog.callGraph().callersOf(name).stream()
                .map(edge -> new CallerEntry(edge.caller(),
                        index.lookup(edge.caller()).orElseThrow(), edge.location()))
                .toList();
        if (callers.isEmpty()) {
            return QueryResult.success(callers, "no macros call '" + name + "'");
        }
        return QueryResult.success(callers);
    }

    @Override
    public QueryResult<List<WhichMatch>> which(PolicyCatalog catalog, WhichQuery query) {
        List<WhichMatch> matches = new RuleSearch(catalog.index()).search(query);
        if (matches.isEmpty()) {
            String verb = query.transition() ? "that create " : "granting ";
            return QueryResult.notFound("no macros found " + verb + query.describe());
        }
        return QueryResult.success(matches);
    }

    @Override
    public QueryResult<ModuleExpansion> expandModule(PolicyCatalog catalog, ModuleRequest request) {
        String content = request.content();
        if (content == null) {
            try {
                content = Files.readString(request.path());
            } catch (IOException e) {
                return QueryResult.readError("cannot read '" + request.path() + "': " + e.getMessage());
            }
        }

        DefinitionIndex index = catalog.index();
        ExpansionEngine engine = new ExpansionEngine(index);
        DefineResolver resolver = engine.defineResolver();
        List<ExpansionNode> trees = new ArrayList<>();
        List<Rule> rules = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();

        for (Statement statement : new StatementClassifier().classifyBody(DeclarationStripper.strip(content))) {
            switch (statement.kind()) {
                case ALLOW_RULE, TRANSITION_RULE -> rules.add(parseLiteral(resolver, statement.text()));
                case POLICY_STATEMENT -> {
                    if (!MODULE_DECLARATION.matcher(statement.text()).lookingAt()) {
                        rules.add(parseLiteral(resolver, statement.text()));
                    }
                }
                case CALL -> {
                    MacroCall call = statement.call();
                    if (POLICY_MODULE.equals(call.name())) {
                        continue;
                    }
                    if (!index.contains(call.name())) {
                        unresolved.add(call.format());
                        continue;
                    }
                    ExpansionNode tree = engine.expand(call, request.depth());
                    if (request.tree()) {
                        trees.add(tree);
                    }
                    rules.addAll(RuleMerger.flatten(tree));
                }
                case DECLARATION_BLOCK, PLAIN_TEXT -> {
                    // nothing to expand
                }
            }
        }

        if (!unresolved.isEmpty()) {
            log.debug("{} calls in {} are not defined in the policy tree: {}",
                    unresolved.size(), request.origin(), unresolved);
        }
        return QueryResult.success(new ModuleExpansion(trees, RuleMerger.merge(rules), unresolved));
    }

    @Override
    public QueryResult<DepsResult> deps(PolicyCatalog catalog, DepsRequest request) {
        if (!catalog.index().contains(request.name())) {
            return notFound(catalog.index(), request.name());
        }
        DependencyGraph graph = DependencyGraph.build(catalog.callGraph(), request.name(), request.depth());
        return QueryResult.success(new DepsResult(graph, request.format(),
                GraphRenderer.render(graph, request.format())));
    }

    private <T> QueryResult<T> notFound(DefinitionIndex index, String name) {
        return QueryResult.notFound("macro '" + name + "' not found",
                index.suggest(name, properties.getSuggestionLimit()));
    }

    private static Rule parseLiteral(DefineResolver resolver, String text) {
        String resolved = resolver.resolve(text);
        return RuleParser.parse(resolved.endsWith(";") ? resolved : resolved + ";");
    }
}
