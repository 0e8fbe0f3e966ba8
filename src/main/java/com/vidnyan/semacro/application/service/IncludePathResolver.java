package com.vidnyan.semacro.application.service;

import com.vidnyan.semacro.SemacroProperties;
import com.vidnyan.semacro.application.port.out.PolicySourceLoader;
import com.vidnyan.semacro.domain.PolicyLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Decides which include roots to load, highest priority first:
 * explicit option, environment variable, configured defaults.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IncludePathResolver {

    private final SemacroProperties properties;
    private final PolicySourceLoader sourceLoader;

    public List<Path> resolve(String explicitPath) {
        return resolve(explicitPath, System::getenv);
    }

    /**
     * @param explicitPath value of {@code --include-path}, may be null
     * @param environment environment lookup
     * @throws PolicyLoadException when no root is found or a chosen root is not a directory
     */
    public List<Path> resolve(String explicitPath, UnaryOperator<String> environment) {
        String chosen = firstNonBlank(explicitPath, properties.getIncludePath());
        if (chosen == null) {
            chosen = firstNonBlank(environment.apply(properties.getIncludePathEnv()));
        }
        if (chosen != null) {
            List<Path> roots = split(chosen);
            for (Path root : roots) {
                if (!Files.isDirectory(root)) {
                    throw new PolicyLoadException("include path '" + root + "' does not exist");
                }
            }
            log.debug("Using include roots {}", roots);
            return roots;
        }

        for (String candidate : properties.getDefaultIncludePaths()) {
            Path root = Path.of(candidate);
            if (sourceLoader.containsPolicyFiles(root)) {
                log.debug("Using default include root {}", root);
                return List.of(root);
            }
        }

        throw new PolicyLoadException("""
                cannot find SELinux policy include directory.
                  Options:
                    1. Install selinux-policy-devel (provides the default path)
                    2. export %s=/path/to/policy
                    3. semacro --include-path /path/to/policy ...""".formatted(properties.getIncludePathEnv()));
    }

    private static List<Path> split(String value) {
        return Arrays.stream(value.split(File.pathSeparator))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(Path::of)
                .toList();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
