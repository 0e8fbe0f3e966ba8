package com.vidnyan.semacro.domain.rule;

import com.vidnyan.semacro.domain.expansion.ExpansionNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens expansion trees and merges the resulting rules.
 *
 * <p>Output order is the order of first appearance. Access-vector rules sharing
 * (kind, source, target, class) collapse into the first one, with permissions unioned.
 * Type transitions and other statements are deduplicated by equality.
 */
public final class RuleMerger {

    private RuleMerger() {
    }

    /**
     * Depth-first collection of rule leaves. Unresolved, depth-limit and cycle markers are skipped.
     */
    public static List<Rule> flatten(ExpansionNode root) {
        List<Rule> rules = new ArrayList<>();
        collect(root, rules);
        return rules;
    }

    private static void collect(ExpansionNode node, List<Rule> rules) {
        if (node.isRule()) {
            rules.add(node.rule());
        }
        for (ExpansionNode child : node.children()) {
            collect(child, rules);
        }
    }

    /**
     * Merge rules preserving first-occurrence order. Idempotent.
     */
    public static List<Rule> merge(List<? extends Rule> rules) {
        Map<Object, Rule> merged = new LinkedHashMap<>();
        for (Rule rule : rules) {
            if (rule instanceof AllowRule allow) {
                merged.merge(allow.mergeKey(), allow,
                        (existing, added) -> ((AllowRule) existing).union(((AllowRule) added).permissions()));
            } else {
                merged.putIfAbsent(rule, rule);
            }
        }
        return List.copyOf(merged.values());
    }

    /**
     * Flatten then merge.
     */
    public static List<Rule> mergedRules(ExpansionNode root) {
        return merge(flatten(root));
    }

    /**
     * Render rules one per line.
     */
    public static List<String> render(List<? extends Rule> rules) {
        return rules.stream().map(Rule::render).toList();
    }
}
