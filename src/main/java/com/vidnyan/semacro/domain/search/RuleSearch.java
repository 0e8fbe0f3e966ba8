package com.vidnyan.semacro.domain.search;

import com.vidnyan.semacro.domain.expansion.ExpansionEngine;
import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.AllowRule;
import com.vidnyan.semacro.domain.rule.Rule;
import com.vidnyan.semacro.domain.rule.RuleMerger;
import com.vidnyan.semacro.domain.rule.TypeTransitionRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds the macros whose expansion produces a requested allow rule or type transition.
 *
 * <p>Each candidate is expanded with trial argument lists derived from its arity and the query,
 * then flattened and merged exactly like {@code lookup --rules}. Expansions are memoised per
 * call within one search.
 */
@Slf4j
public class RuleSearch {

    static final List<String> CLASS_GUESSES = List.of("file", "dir", "sock_file", "lnk_file");

    private final DefinitionIndex index;
    private final ExpansionEngine engine;
    private final Map<MacroCall, List<Rule>> memo = new HashMap<>();

    public RuleSearch(DefinitionIndex index) {
        this.index = index;
        this.engine = new ExpansionEngine(index);
    }

    /**
     * Matching macros sorted by name, one per macro.
     */
    public List<WhichMatch> search(WhichQuery query) {
        List<MacroDefinition> candidates = candidates(query);
        log.debug("Searching {} candidate macros for {}", candidates.size(), query.describe());

        List<WhichMatch> matches = new ArrayList<>();
        for (MacroDefinition candidate : candidates) {
            evaluate(candidate, query).ifPresent(matches::add);
        }
        matches.sort(Comparator.comparing(WhichMatch::name));
        return matches;
    }

    /**
     * Non-literal macros whose name or body mentions the target, or the new type in transition mode.
     */
    List<MacroDefinition> candidates(WhichQuery query) {
        return index.definitions()
                .filter(d -> !d.isLiteralDefine())
                .filter(d -> mentions(d, query.target()) || (query.transition() && mentions(d, query.newType())))
                .toList();
    }

    private static boolean mentions(MacroDefinition definition, String term) {
        return definition.name().contains(term) || definition.body().contains(term);
    }

    private Optional<WhichMatch> evaluate(MacroDefinition candidate, WhichQuery query) {
        for (List<String> arguments : trials(candidate.arity(), query)) {
            MacroCall call = new MacroCall(candidate.name(), arguments);
            for (Rule rule : rulesOf(call, query.maxDepth())) {
                if (matches(rule, query)) {
                    return Optional.of(new WhichMatch(candidate, call, rule));
                }
            }
        }
        return Optional.empty();
    }

    private List<Rule> rulesOf(MacroCall call, int maxDepth) {
        return memo.computeIfAbsent(call, c -> RuleMerger.mergedRules(engine.expand(c, maxDepth)));
    }

    static boolean matches(Rule rule, WhichQuery query) {
        if (query.transition()) {
            return rule instanceof TypeTransitionRule tt
                    && tt.source().equals(query.source())
                    && tt.target().equals(query.target())
                    && tt.newType().equals(query.newType())
                    && (query.objectClass() == null || tt.objectClass().equals(query.objectClass()))
                    && (query.filename() == null || query.filename().equals(tt.filename()));
        }
        return rule instanceof AllowRule av
                && av.kind() == AllowRule.AccessKind.ALLOW
                && av.source().equals(query.source())
                && av.target().equals(query.target())
                && (query.objectClass() == null || av.objectClass().equals(query.objectClass()))
                && av.grantsAll(query.permissions());
    }

    /**
     * Argument lists to try for a macro of the given arity, padded with empty strings.
     */
    static List<List<String>> trials(int arity, WhichQuery query) {
        if (!query.transition()) {
            List<String> args = new ArrayList<>();
            args.add(query.source());
            if (arity >= 2) {
                args.add(query.target());
            }
            if (arity >= 3) {
                args.add(query.third());
            }
            return List.of(pad(args, arity));
        }

        String source = query.source();
        String parent = query.target();
        String newType = query.newType();
        List<List<String>> trials = new ArrayList<>();
        if (arity <= 1) {
            trials.add(pad(List.of(source), arity));
        } else if (arity == 2) {
            trials.add(pad(List.of(source, newType), arity));
            trials.add(pad(List.of(source, parent), arity));
        } else if (arity == 3) {
            for (String guess : classGuesses(query)) {
                trials.add(pad(List.of(source, newType, guess), arity));
            }
            trials.add(pad(List.of(source, parent, newType), arity));
        } else {
            for (String guess : classGuesses(query)) {
                trials.add(pad(List.of(source, newType, guess), arity));
                trials.add(pad(List.of(source, parent, newType, guess), arity));
            }
            trials.add(pad(List.of(source, newType), arity));
            trials.add(pad(List.of(source, parent, newType), arity));
        }
        return trials;
    }

    private static List<String> classGuesses(WhichQuery query) {
        return query.objectClass() != null ? List.of(query.objectClass()) : CLASS_GUESSES;
    }

    private static List<String> pad(List<String> args, int arity) {
        List<String> padded = new ArrayList<>(args);
        while (padded.size() < arity) {
            padded.add("");
        }
        return List.copyOf(padded);
    }

    int memoSize() {
        return memo.size();
    }
}
