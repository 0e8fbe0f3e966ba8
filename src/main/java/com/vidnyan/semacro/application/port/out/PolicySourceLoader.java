package com.vidnyan.semacro.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port for discovering and reading policy source files under an include root.
 * Implemented by adapters (e.g., the file system adapter).
 */
public interface PolicySourceLoader {

    /**
     * List the policy files under a root, sorted by relative path.
     * @param root Include root directory
     * @return Files in lexicographic relative-path order
     * @throws IOException when the root itself cannot be walked
     */
    List<SourceFile> listSources(Path root) throws IOException;

    /**
     * Read one file. Failures are reported per file so the caller can skip it.
     */
    String read(SourceFile file) throws IOException;

    /**
     * True when the directory tree contains at least one policy file.
     */
    boolean containsPolicyFiles(Path root);

    /**
     * A policy file located under an include root.
     */
    record SourceFile(
        Path root,
        String relativePath,
        Path absolutePath,
        FileRole role
    ) {}

    /**
     * What a file contributes, decided by its suffix.
     */
    enum FileRole {
        INTERFACES,
        DEFINES
    }
}
