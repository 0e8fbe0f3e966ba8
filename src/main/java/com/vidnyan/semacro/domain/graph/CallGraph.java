package com.vidnyan.semacro.domain.graph;

import com.vidnyan.semacro.domain.index.DefinitionIndex;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Precomputed macro call graph.
 * Bidirectional index: caller → callees, callee → callers.
 * Immutable and thread-safe.
 *
 * <p>Edges come from a lexical scan of every effective body: each identifier immediately
 * followed by {@code (} that names an indexed macro is a call. Names that look like calls but
 * are absent from the index are kept per caller as dangling references and never traversed.
 */
public final class CallGraph {

    private static final Pattern CALL_TOKEN = Pattern.compile("\\b([A-Za-z_]\\w*)\\(");

    // Policy statements and m4 builtins that share the call shape
    private static final Set<String> KEYWORDS = Set.of(
            "allow", "dontaudit", "auditallow", "neverallow",
            "type_transition", "type_change", "type_member",
            "role_transition", "range_transition",
            "gen_require", "optional_policy", "tunable_policy",
            "require", "type", "role", "attribute", "bool",
            "ifdef", "ifndef", "ifelse", "refpolicywarn", "dnl");

    private final Map<String, List<CallEdge>> outgoing;
    private final Map<String, List<CallEdge>> incoming;
    private final Map<String, Set<String>> dangling;

    private CallGraph(
            Map<String, List<CallEdge>> outgoing,
            Map<String, List<CallEdge>> incoming,
            Map<String, Set<String>> dangling
    ) {
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
        this.dangling = Collections.unmodifiableMap(dangling);
    }

    /**
     * Build call graph from the definition index.
     */
    public static CallGraph build(DefinitionIndex index) {
        Map<String, List<CallEdge>> outgoing = new LinkedHashMap<>();
        Map<String, List<CallEdge>> incoming = new HashMap<>();
        Map<String, Set<String>> dangling = new LinkedHashMap<>();

        index.definitions().forEach(definition -> {
            Set<String> seen = new HashSet<>();
            Matcher m = CALL_TOKEN.matcher(definition.body());
            while (m.find()) {
                String name = m.group(1);
                if (KEYWORDS.contains(name) || !seen.add(name)) {
                    continue;
                }
                if (!index.contains(name)) {
                    dangling.computeIfAbsent(definition.name(), k -> new TreeSet<>()).add(name);
                    continue;
                }
                CallEdge edge = CallEdge.builder()
                        .caller(definition.name())
                        .callee(name)
                        .location(definition.location())
                        .build();
                outgoing.computeIfAbsent(edge.caller(), k -> new ArrayList<>()).add(edge);
                incoming.computeIfAbsent(edge.callee(), k -> new ArrayList<>()).add(edge);
            }
        });

        return new CallGraph(outgoing, incoming, dangling);
    }

    /**
     * Get all outgoing call edges from a macro, in body order.
     */
    public List<CallEdge> getOutgoingCalls(String name) {
        return outgoing.getOrDefault(name, List.of());
    }

    /**
     * Get all incoming call edges to a macro.
     */
    public List<CallEdge> getIncomingCalls(String name) {
        return incoming.getOrDefault(name, List.of());
    }

    /**
     * Direct callers of a macro, one edge per caller, sorted by caller name.
     * A macro calling itself is not its own caller.
     */
    public List<CallEdge> callersOf(String name) {
        return getIncomingCalls(name).stream()
                .filter(edge -> !edge.isSelfCall())
                .sorted(Comparator.comparing(CallEdge::caller))
                .toList();
    }

    /**
     * Call-shaped names in a body that are not defined anywhere in the index.
     */
    public Set<String> danglingReferences(String name) {
        return dangling.getOrDefault(name, Set.of());
    }

    /**
     * Get graph statistics.
     */
    public Stats stats() {
        return new Stats(
                outgoing.size(),
                outgoing.values().stream().mapToInt(List::size).sum(),
                dangling.values().stream().mapToInt(Set::size).sum()
        );
    }

    public record Stats(int callers, int edgeCount, int danglingReferences) {}
}
