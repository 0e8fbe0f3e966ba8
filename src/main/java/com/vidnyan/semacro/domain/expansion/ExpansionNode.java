package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.Rule;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * One point of an expansion tree. Built fresh per query and owned by it.
 *
 * <p>{@link Kind#MACRO} nodes hold the expansions of every call and rule of their substituted
 * body, in body order. {@code truncated} is set on a macro node whose nested calls were cut off by
 * the depth limit; the cut calls appear as {@link Kind#DEPTH_LIMIT} children.
 */
public record ExpansionNode(
    Kind kind,
    MacroCall call,
    MacroDefinition definition,
    Rule rule,
    List<ExpansionNode> children,
    int depth,
    boolean truncated
) {

    public enum Kind {
        MACRO,          // resolved call
        RULE,           // terminal rule
        UNRESOLVED,     // call to a name missing from the index
        DEPTH_LIMIT,    // nested call not expanded, maximum depth reached
        CYCLE           // nested call already active on this path
    }

    public ExpansionNode {
        Objects.requireNonNull(kind, "kind");
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ExpansionNode macro(MacroCall call, MacroDefinition definition,
                                      List<ExpansionNode> children, int depth, boolean truncated) {
        return new ExpansionNode(Kind.MACRO, call, definition, null, children, depth, truncated);
    }

    public static ExpansionNode rule(Rule rule, int depth) {
        return new ExpansionNode(Kind.RULE, null, null, rule, List.of(), depth, false);
    }

    public static ExpansionNode unresolved(MacroCall call, int depth) {
        return new ExpansionNode(Kind.UNRESOLVED, call, null, null, List.of(), depth, false);
    }

    public static ExpansionNode depthLimit(MacroCall call, int depth) {
        return new ExpansionNode(Kind.DEPTH_LIMIT, call, null, null, List.of(), depth, false);
    }

    public static ExpansionNode cycle(MacroCall call, int depth) {
        return new ExpansionNode(Kind.CYCLE, call, null, null, List.of(), depth, false);
    }

    public boolean isRule() {
        return kind == Kind.RULE;
    }

    /**
     * Display text: the call for macro and marker nodes, the policy text for rules.
     */
    public String text() {
        return switch (kind) {
            case RULE -> rule.render();
            case MACRO, UNRESOLVED -> call.format();
            case DEPTH_LIMIT -> call.format() + " ... (max depth reached)";
            case CYCLE -> call.format() + " ... (recursive call)";
        };
    }

    /**
     * This node and all its descendants, depth-first.
     */
    public Stream<ExpansionNode> walk() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(ExpansionNode::walk));
    }
}
