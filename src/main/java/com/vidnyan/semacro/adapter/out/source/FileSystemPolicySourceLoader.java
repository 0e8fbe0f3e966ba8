package com.vidnyan.semacro.adapter.out.source;

import com.vidnyan.semacro.SemacroProperties;
import com.vidnyan.semacro.application.port.out.PolicySourceLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Scans an include root for policy sources.
 * Discovers all interface and define files by suffix, never by content.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemPolicySourceLoader implements PolicySourceLoader {

    private final SemacroProperties properties;

    @Override
    public List<SourceFile> listSources(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .map(p -> toSourceFile(root, p))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(SourceFile::relativePath))
                    .toList();
        }
    }

    @Override
    public String read(SourceFile file) throws IOException {
        // Policy trees occasionally carry stray Latin-1 bytes in comments
        byte[] bytes = Files.readAllBytes(file.absolutePath());
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    @Override
    public boolean containsPolicyFiles(Path root) {
        if (!Files.isDirectory(root)) {
            return false;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            return paths.filter(Files::isRegularFile)
                    .anyMatch(p -> roleOf(p.getFileName().toString()).isPresent());
        } catch (IOException e) {
            log.debug("Cannot scan {}: {}", root, e.getMessage());
            return false;
        }
    }

    private Optional<SourceFile> toSourceFile(Path root, Path file) {
        return roleOf(file.getFileName().toString())
                .map(role -> new SourceFile(root, relativize(root, file), file, role));
    }

    Optional<FileRole> roleOf(String fileName) {
        if (properties.getInterfaceSuffixes().stream().anyMatch(fileName::endsWith)) {
            return Optional.of(FileRole.INTERFACES);
        }
        if (properties.getDefineSuffixes().stream().anyMatch(fileName::endsWith)) {
            return Optional.of(FileRole.DEFINES);
        }
        return Optional.empty();
    }

    private static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
