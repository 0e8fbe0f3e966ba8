package com.vidnyan.semacro.application.service;

import com.vidnyan.semacro.application.port.out.PolicySourceLoader;
import com.vidnyan.semacro.application.port.out.PolicySourceLoader.FileRole;
import com.vidnyan.semacro.application.port.out.PolicySourceLoader.SourceFile;
import com.vidnyan.semacro.domain.PolicyLoadException;
import com.vidnyan.semacro.domain.graph.CallGraph;
import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.MacroKind;
import com.vidnyan.semacro.domain.model.ParseError;
import com.vidnyan.semacro.domain.model.PolicyCatalog;
import com.vidnyan.semacro.parser.DefinitionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link PolicyCatalog} once per run: scan, parse, index, call graph.
 *
 * <p>Load order is roots in priority order, then files by relative path, then position in
 * file; the index keeps the first definition of each name in that order. A file that cannot be
 * read or a definition that does not parse is logged and skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyCatalogLoader {

    private final PolicySourceLoader sourceLoader;
    private final DefinitionParser definitionParser;

    public PolicyCatalog load(List<Path> roots) {
        Instant startTime = Instant.now();
        List<MacroDefinition> definitions = new ArrayList<>();
        List<ParseError> parseErrors = new ArrayList<>();
        Map<FileRole, Integer> loadedByRole = new EnumMap<>(FileRole.class);
        int scanned = 0;
        int skipped = 0;

        for (Path root : roots) {
            List<SourceFile> files;
            try {
                files = sourceLoader.listSources(root);
            } catch (IOException e) {
                throw new PolicyLoadException("cannot read include path '" + root + "': " + e.getMessage(), e);
            }
            log.debug("Found {} policy files under {}", files.size(), root);

            for (SourceFile file : files) {
                scanned++;
                String text;
                try {
                    text = sourceLoader.read(file);
                } catch (IOException e) {
                    skipped++;
                    log.warn("Skipping unreadable file {}: {}", file.absolutePath(), e.getMessage());
                    continue;
                }
                DefinitionParser.ParsedFile parsed = definitionParser.parse(file.relativePath(), text);
                loadedByRole.merge(file.role(), 1, Integer::sum);
                reportMisplaced(file, parsed.definitions());
                definitions.addAll(parsed.definitions());
                for (ParseError error : parsed.errors()) {
                    log.warn("Skipping definition: {}", error.format());
                }
                parseErrors.addAll(parsed.errors());
            }
        }

        if (definitions.isEmpty()) {
            throw new PolicyLoadException("no macros found under '" + describe(roots) + "'");
        }

        DefinitionIndex index = DefinitionIndex.of(definitions);
        CallGraph callGraph = CallGraph.build(index);
        long duration = Duration.between(startTime, Instant.now()).toMillis();

        DefinitionIndex.Stats stats = index.stats();
        log.info("Loaded {} macros ({} interfaces, {} templates, {} defines) from {} interface and {} define files in {}ms",
                stats.names(), stats.interfaces(), stats.templates(), stats.defines(),
                loadedByRole.getOrDefault(FileRole.INTERFACES, 0), loadedByRole.getOrDefault(FileRole.DEFINES, 0),
                duration);
        if (stats.duplicateNames() > 0) {
            log.debug("{} names are defined more than once; first definition wins", stats.duplicateNames());
        }
        log.debug("Call graph: {} edges, {} dangling references",
                callGraph.stats().edgeCount(), callGraph.stats().danglingReferences());

        PolicyCatalog catalog = new PolicyCatalog(index, callGraph, parseErrors, roots,
                new PolicyCatalog.LoadStats(scanned, skipped, definitions.size(), duration));
        warnIfIncomplete(catalog);
        return catalog;
    }

    /**
     * Definitions whose kind does not match the file they live in, e.g. an interface in a
     * {@code .spt} file. They are still indexed.
     *
     * @return number of misplaced definitions
     */
    static int reportMisplaced(SourceFile file, List<MacroDefinition> definitions) {
        int misplaced = 0;
        for (MacroDefinition definition : definitions) {
            boolean isDefine = definition.kind() == MacroKind.DEFINE;
            if (isDefine != (file.role() == FileRole.DEFINES)) {
                misplaced++;
                log.debug("{} {} found in {} file {}", definition.kind().keyword(), definition.name(),
                        file.role() == FileRole.DEFINES ? "define" : "interface", definition.location().format());
            }
        }
        return misplaced;
    }

    private void warnIfIncomplete(PolicyCatalog catalog) {
        if (!catalog.isIncomplete()) {
            return;
        }
        List<String> missing = new ArrayList<>();
        if (catalog.missingDefines()) {
            missing.add("support/*.spt (defines)");
        }
        if (catalog.missingKernelInterfaces()) {
            missing.add("kernel/*.if (core interfaces)");
        }
        log.warn("incomplete policy tree, missing {}. Install the full selinux-policy-devel package "
                + "or point --include-path to a complete policy source tree.", String.join(", ", missing));
    }

    private static String describe(List<Path> roots) {
        return String.join(", ", roots.stream().map(Path::toString).toList());
    }
}
