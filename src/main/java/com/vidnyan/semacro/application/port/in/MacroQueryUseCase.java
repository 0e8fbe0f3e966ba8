package com.vidnyan.semacro.application.port.in;

import com.vidnyan.semacro.domain.UsageException;
import com.vidnyan.semacro.domain.expansion.ExpansionNode;
import com.vidnyan.semacro.domain.graph.DependencyGraph;
import com.vidnyan.semacro.domain.graph.GraphFormat;
import com.vidnyan.semacro.domain.model.Location;
import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.PolicyCatalog;
import com.vidnyan.semacro.domain.rule.Rule;
import com.vidnyan.semacro.domain.search.WhichMatch;
import com.vidnyan.semacro.domain.search.WhichQuery;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: answer questions about a loaded policy catalog.
 * Every query receives the catalog explicitly and never modifies it.
 */
public interface MacroQueryUseCase {

    /**
     * Show a definition, its substituted body, its expansion tree or its merged rules.
     */
    QueryResult<LookupResult> lookup(PolicyCatalog catalog, LookupRequest request);

    /**
     * Definitions whose name matches a regular expression, sorted by name.
     */
    QueryResult<List<MacroDefinition>> find(PolicyCatalog catalog, String pattern);

    /**
     * Definitions in a category (or all), sorted by name.
     */
    QueryResult<List<MacroDefinition>> list(PolicyCatalog catalog, String category);

    /**
     * Direct callers of a macro, sorted by caller name.
     */
    QueryResult<List<CallerEntry>> callers(PolicyCatalog catalog, String name);

    /**
     * Macros producing a requested allow rule or type transition.
     */
    QueryResult<List<WhichMatch>> which(PolicyCatalog catalog, WhichQuery query);

    /**
     * Expand every macro call of a policy module.
     */
    QueryResult<ModuleExpansion> expandModule(PolicyCatalog catalog, ModuleRequest request);

    /**
     * Bounded callee graph of a macro, rendered as DOT or Mermaid.
     */
    QueryResult<DepsResult> deps(PolicyCatalog catalog, DepsRequest request);

    /**
     * Lookup parameters.
     */
    record LookupRequest(
        String nameOrCall,
        Mode mode,
        int depth
    ) {
        public enum Mode {
            RAW,        // definition with arguments substituted
            EXPAND,     // expansion tree
            RULES       // flat merged rules
        }

        public LookupRequest {
            if (depth < 1) {
                throw new UsageException("--depth must be at least 1");
            }
        }

        /**
         * Build a request from the two mutually exclusive flags.
         * @throws UsageException when both are set
         */
        public static LookupRequest of(String nameOrCall, boolean expand, boolean rules, int depth) {
            if (expand && rules) {
                throw new UsageException("--expand and --rules are mutually exclusive");
            }
            Mode mode = expand ? Mode.EXPAND : rules ? Mode.RULES : Mode.RAW;
            return new LookupRequest(nameOrCall, mode, depth);
        }

        public static LookupRequest raw(String nameOrCall) {
            return new LookupRequest(nameOrCall, Mode.RAW, 10);
        }
    }

    /**
     * Lookup result. Only the part matching the request mode is populated.
     */
    record LookupResult(
        MacroDefinition definition,
        MacroCall call,
        List<MacroDefinition> duplicates,
        String renderedBody,
        ExpansionNode tree,
        List<Rule> rules,
        String warning
    ) {}

    /**
     * One direct caller.
     */
    record CallerEntry(
        String caller,
        MacroDefinition definition,
        Location location
    ) {}

    /**
     * Module expansion parameters. {@code content} wins over {@code path} when set.
     */
    record ModuleRequest(
        Path path,
        String content,
        int depth,
        boolean tree
    ) {
        public ModuleRequest {
            if (depth < 1) {
                throw new UsageException("--depth must be at least 1");
            }
            if (path == null && content == null) {
                throw new UsageException("expand needs a module file or its content");
            }
        }

        public static ModuleRequest forPath(Path path, int depth, boolean tree) {
            return new ModuleRequest(path, null, depth, tree);
        }

        public static ModuleRequest forContent(String content, int depth, boolean tree) {
            return new ModuleRequest(null, content, depth, tree);
        }

        public String origin() {
            return path != null && content == null ? path.toString() : "-";
        }
    }

    /**
     * Expansion of a module: one tree per call in tree mode, merged rules otherwise.
     */
    record ModuleExpansion(
        List<ExpansionNode> trees,
        List<Rule> rules,
        List<String> unresolvedCalls
    ) {}

    /**
     * Dependency graph parameters.
     */
    record DepsRequest(
        String name,
        int depth,
        GraphFormat format
    ) {
        public DepsRequest {
            if (depth < 1) {
                throw new UsageException("--depth must be at least 1");
            }
            format = format == null ? GraphFormat.DOT : format;
        }
    }

    /**
     * Dependency graph with its rendered document.
     */
    record DepsResult(
        DependencyGraph graph,
        GraphFormat format,
        String document
    ) {}
}
