package com.vidnyan.semacro.adapter.in.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.semacro.application.port.in.MacroQueryUseCase.ModuleExpansion;
import com.vidnyan.semacro.domain.SemacroException;
import com.vidnyan.semacro.domain.expansion.ExpansionNode;
import com.vidnyan.semacro.domain.graph.CallEdge;
import com.vidnyan.semacro.domain.graph.DependencyGraph;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.rule.AllowRule;
import com.vidnyan.semacro.domain.rule.Rule;
import com.vidnyan.semacro.domain.rule.TypeTransitionRule;
import com.vidnyan.semacro.domain.search.WhichMatch;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON rendering of query results for scripting ({@code --json}).
 */
@Component
@RequiredArgsConstructor
public class JsonOutputWriter {

    private final ObjectMapper objectMapper;

    public ObjectNode tree(ExpansionNode node) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("kind", node.kind().name());
        json.put("text", node.text());
        json.put("depth", node.depth());
        if (node.truncated()) {
            json.put("truncated", true);
        }
        if (node.definition() != null) {
            json.put("source", node.definition().location().format());
        }
        if (node.rule() != null) {
            json.set("rule", rule(node.rule()));
        }
        if (!node.children().isEmpty()) {
            ArrayNode children = json.putArray("children");
            node.children().forEach(child -> children.add(tree(child)));
        }
        return json;
    }

    public ObjectNode rule(Rule rule) {
        ObjectNode json = objectMapper.createObjectNode();
        if (rule instanceof AllowRule av) {
            json.put("type", av.kind().keyword());
            json.put("source", av.source());
            json.put("target", av.target());
            json.put("class", av.objectClass());
            ArrayNode perms = json.putArray("permissions");
            av.permissions().forEach(perms::add);
        } else if (rule instanceof TypeTransitionRule tt) {
            json.put("type", "type_transition");
            json.put("source", tt.source());
            json.put("target", tt.target());
            json.put("class", tt.objectClass());
            json.put("newType", tt.newType());
            tt.optionalFilename().ifPresent(f -> json.put("filename", f));
        } else {
            json.put("type", "statement");
        }
        json.put("text", rule.render());
        return json;
    }

    public ArrayNode rules(List<? extends Rule> rules) {
        ArrayNode array = objectMapper.createArrayNode();
        rules.forEach(r -> array.add(rule(r)));
        return array;
    }

    public ArrayNode trees(List<ExpansionNode> trees) {
        ArrayNode array = objectMapper.createArrayNode();
        trees.forEach(t -> array.add(tree(t)));
        return array;
    }

    public ObjectNode definition(MacroDefinition definition) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("name", definition.name());
        json.put("kind", definition.kind().keyword());
        json.put("source", definition.location().format());
        json.put("category", definition.category());
        return json;
    }

    public ArrayNode definitions(List<MacroDefinition> definitions) {
        ArrayNode array = objectMapper.createArrayNode();
        definitions.forEach(d -> array.add(definition(d)));
        return array;
    }

    public ArrayNode matches(List<WhichMatch> matches) {
        ArrayNode array = objectMapper.createArrayNode();
        for (WhichMatch match : matches) {
            ObjectNode json = definition(match.definition());
            json.put("call", match.signature());
            json.set("rule", rule(match.matchedRule()));
            array.add(json);
        }
        return array;
    }

    public ObjectNode moduleExpansion(ModuleExpansion expansion) {
        ObjectNode json = objectMapper.createObjectNode();
        json.set("trees", trees(expansion.trees()));
        json.set("rules", rules(expansion.rules()));
        ArrayNode unresolved = json.putArray("unresolved");
        expansion.unresolvedCalls().forEach(unresolved::add);
        return json;
    }

    public ObjectNode graph(DependencyGraph graph) {
        ObjectNode json = objectMapper.createObjectNode();
        json.put("start", graph.getStart());
        json.put("maxDepth", graph.getMaxDepth());
        ArrayNode nodes = json.putArray("nodes");
        graph.getNodes().forEach((name, depth) -> nodes.addObject().put("name", name).put("depth", depth));
        ArrayNode edges = json.putArray("edges");
        for (CallEdge edge : graph.getEdges()) {
            edges.addObject().put("caller", edge.caller()).put("callee", edge.callee());
        }
        ArrayNode cycles = json.putArray("cycles");
        graph.findCycles().forEach(cycle -> {
            ArrayNode c = cycles.addArray();
            cycle.forEach(c::add);
        });
        return json;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SemacroException("cannot render JSON output", e);
        }
    }
}
