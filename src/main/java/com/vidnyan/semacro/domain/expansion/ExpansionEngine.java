package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.RuleParser;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Recursively expands a macro call into an {@link ExpansionNode} tree.
 *
 * <p>Expansion is bounded by {@code maxDepth} (root = depth 0) and by the set of call names active
 * on the current path, so self-referential chains stop immediately. The result depends only on
 * the call, the index and the depth limit.
 */
@Slf4j
public class ExpansionEngine {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private final DefinitionIndex index;
    private final DefineResolver defineResolver;
    private final StatementClassifier classifier;

    public ExpansionEngine(DefinitionIndex index) {
        this.index = index;
        this.defineResolver = new DefineResolver(index);
        this.classifier = new StatementClassifier();
    }

    public ExpansionNode expand(MacroCall call) {
        return expand(call, DEFAULT_MAX_DEPTH);
    }

    public ExpansionNode expand(MacroCall call, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        return expandCall(call, 0, maxDepth, new ArrayDeque<>());
    }

    /**
     * Body of a definition as expansion sees it: declarations removed, arguments substituted.
     * A call without arguments keeps its {@code $N} references visible.
     */
    public static String effectiveBody(MacroDefinition definition, MacroCall call) {
        String body = DeclarationStripper.strip(definition.body());
        return call.hasArguments() ? ArgumentSubstitutor.substitute(body, call.arguments()) : body;
    }

    public DefineResolver defineResolver() {
        return defineResolver;
    }

    private ExpansionNode expandCall(MacroCall call, int depth, int maxDepth, Deque<String> activePath) {
        Optional<MacroDefinition> definition = index.lookup(call.name());
        if (definition.isEmpty()) {
            return ExpansionNode.unresolved(call, depth);
        }

        activePath.push(call.name());
        try {
            List<ExpansionNode> children = new ArrayList<>();
            boolean truncated = expandStatements(
                    effectiveBody(definition.get(), call), depth, maxDepth, activePath, children);
            return ExpansionNode.macro(call, definition.get(), children, depth, truncated);
        } finally {
            activePath.pop();
        }
    }

    /**
     * Expand every statement of a body into {@code out}.
     *
     * @return true when a nested call was cut off by the depth limit
     */
    private boolean expandStatements(String body, int depth, int maxDepth,
                                     Deque<String> activePath, List<ExpansionNode> out) {
        boolean truncated = false;
        for (Statement statement : classifier.classifyBody(body)) {
            switch (statement.kind()) {
                case ALLOW_RULE, TRANSITION_RULE, POLICY_STATEMENT -> out.add(ExpansionNode.rule(
                        RuleParser.parse(defineResolver.resolve(statement.text())), depth + 1));
                case CALL -> truncated |= expandNested(statement.call(), depth, maxDepth, activePath, out);
                case DECLARATION_BLOCK, PLAIN_TEXT -> {
                    // grants nothing
                }
            }
        }
        return truncated;
    }

    private boolean expandNested(MacroCall call, int depth, int maxDepth,
                                 Deque<String> activePath, List<ExpansionNode> out) {
        Optional<MacroDefinition> target = index.lookup(call.name());
        if (target.isEmpty()) {
            out.add(ExpansionNode.unresolved(call, depth + 1));
            return false;
        }
        if (activePath.contains(call.name())) {
            log.debug("Recursive reference to {} below {}", call.name(), activePath.peek());
            out.add(ExpansionNode.cycle(call, depth + 1));
            return false;
        }
        MacroDefinition definition = target.get();
        if (definition.isLiteralDefine() && !call.hasArguments()) {
            // Pure text substitution: splice the define's statements into the caller
            activePath.push(call.name());
            try {
                return expandStatements(
                        DeclarationStripper.strip(definition.body()), depth, maxDepth, activePath, out);
            } finally {
                activePath.pop();
            }
        }
        if (depth + 1 > maxDepth) {
            out.add(ExpansionNode.depthLimit(call, depth + 1));
            return true;
        }
        out.add(expandCall(call, depth + 1, maxDepth, activePath));
        return false;
    }
}
