package com.vidnyan.semacro.domain.model;

import com.vidnyan.semacro.domain.graph.CallGraph;
import com.vidnyan.semacro.domain.index.DefinitionIndex;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything loaded from one policy tree: the definition index, the call graph built over it,
 * and the problems found while scanning. Read-only once constructed; every query receives it
 * explicitly.
 */
public record PolicyCatalog(
    DefinitionIndex index,
    CallGraph callGraph,
    List<ParseError> parseErrors,
    List<Path> roots,
    LoadStats stats
) {

    public PolicyCatalog {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(callGraph, "callGraph");
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
        roots = roots == null ? List.of() : List.copyOf(roots);
    }

    /**
     * Catalog over an in-memory definition list, with no backing files.
     */
    public static PolicyCatalog of(List<MacroDefinition> definitions) {
        DefinitionIndex index = DefinitionIndex.of(definitions);
        return new PolicyCatalog(index, CallGraph.build(index), List.of(), List.of(),
                new LoadStats(0, 0, definitions.size(), 0));
    }

    /**
     * True when no define was loaded.
     */
    public boolean missingDefines() {
        return index.definitions().noneMatch(d -> d.kind() == MacroKind.DEFINE);
    }

    /**
     * True when no definition came from the kernel module group.
     */
    public boolean missingKernelInterfaces() {
        return index.definitions().noneMatch(d -> "kernel".equals(d.category())
                || d.sourcePath().contains("kernel"));
    }

    public boolean isIncomplete() {
        return missingDefines() || missingKernelInterfaces();
    }

    public record LoadStats(int filesScanned, int filesSkipped, int definitions, long durationMs) {}
}
