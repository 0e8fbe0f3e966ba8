package com.vidnyan.semacro.domain.index;

import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.MacroKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * All macro definitions of a policy tree, keyed by name.
 * Immutable and safe to share between queries.
 *
 * <p>Names are not globally unique. The first definition in load order wins; the others stay
 * reachable through {@link #duplicatesOf(String)} so callers can report file:line for each.
 */
public final class DefinitionIndex {

    public static final String ALL_CATEGORIES = "all";

    private final Map<String, List<MacroDefinition>> byName;

    private DefinitionIndex(Map<String, List<MacroDefinition>> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    /**
     * Build the index from definitions in load order.
     */
    public static DefinitionIndex of(List<MacroDefinition> definitions) {
        Map<String, List<MacroDefinition>> byName = new LinkedHashMap<>();
        for (MacroDefinition definition : definitions) {
            byName.computeIfAbsent(definition.name(), k -> new ArrayList<>()).add(definition);
        }
        byName.replaceAll((name, list) -> List.copyOf(list));
        return new DefinitionIndex(byName);
    }

    /**
     * First definition with this name in load order.
     */
    public Optional<MacroDefinition> lookup(String name) {
        List<MacroDefinition> matches = byName.get(name);
        return matches == null ? Optional.empty() : Optional.of(matches.get(0));
    }

    public boolean contains(String name) {
        return byName.containsKey(name);
    }

    /**
     * Every definition sharing this name, in load order. Empty when the name is unknown.
     */
    public List<MacroDefinition> duplicatesOf(String name) {
        return byName.getOrDefault(name, List.of());
    }

    /**
     * Names defined more than once.
     */
    public Map<String, List<MacroDefinition>> duplicates() {
        Map<String, List<MacroDefinition>> result = new LinkedHashMap<>();
        byName.forEach((name, list) -> {
            if (list.size() > 1) {
                result.put(name, list);
            }
        });
        return result;
    }

    /**
     * Effective definitions (first per name) in load order.
     */
    public Stream<MacroDefinition> definitions() {
        return byName.values().stream().map(list -> list.get(0));
    }

    /**
     * Definitions whose name matches a regular expression, case-sensitive, sorted by name.
     *
     * @throws InvalidPatternException when the expression does not compile
     */
    public Stream<MacroDefinition> find(String regex) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(regex, e);
        }
        return definitions()
                .filter(d -> pattern.matcher(d.name()).find())
                .sorted(Comparator.comparing(MacroDefinition::name));
    }

    /**
     * Definitions in a category, sorted by name. {@code null}, blank or "all" lists everything.
     */
    public Stream<MacroDefinition> list(String category) {
        Stream<MacroDefinition> stream = definitions();
        if (category != null && !category.isBlank() && !ALL_CATEGORIES.equals(category)) {
            stream = stream.filter(d -> category.equals(d.category()));
        }
        return stream.sorted(Comparator.comparing(MacroDefinition::name));
    }

    /**
     * Names containing the requested one, ignoring case. Used for "did you mean" hints.
     */
    public List<String> suggest(String name, int limit) {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        String needle = name.toLowerCase(Locale.ROOT);
        return byName.keySet().stream()
                .filter(n -> !n.equals(name) && n.toLowerCase(Locale.ROOT).contains(needle))
                .sorted()
                .limit(limit)
                .toList();
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    /**
     * Get index statistics.
     */
    public Stats stats() {
        long interfaces = definitions().filter(d -> d.kind() == MacroKind.INTERFACE).count();
        long templates = definitions().filter(d -> d.kind() == MacroKind.TEMPLATE).count();
        long defines = definitions().filter(d -> d.kind() == MacroKind.DEFINE).count();
        return new Stats(byName.size(), interfaces, templates, defines, duplicates().size());
    }

    public record Stats(int names, long interfaces, long templates, long defines, int duplicateNames) {}
}
