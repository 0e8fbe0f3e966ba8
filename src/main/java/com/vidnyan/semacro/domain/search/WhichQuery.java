package com.vidnyan.semacro.domain.search;

import com.vidnyan.semacro.domain.UsageException;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A "which macro grants this" question.
 *
 * <p>In access-vector mode {@code third} holds one or more whitespace-separated permissions;
 * in transition mode it is the new type and {@code target} is the parent directory type.
 */
public record WhichQuery(
    String source,
    String target,
    String third,
    String objectClass,
    String filename,
    boolean transition,
    int maxDepth
) {

    public static final int DEFAULT_MAX_DEPTH = 5;

    public WhichQuery {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(third, "third");
        objectClass = blankToNull(objectClass);
        filename = blankToNull(filename);
        if (filename != null && !transition) {
            throw new UsageException("--name only applies with --transition");
        }
        if (maxDepth < 1) {
            throw new UsageException("--depth must be at least 1");
        }
    }

    public static WhichQuery access(String source, String target, String permissions) {
        return new WhichQuery(source, target, permissions, null, null, false, DEFAULT_MAX_DEPTH);
    }

    public static WhichQuery transition(String source, String parent, String newType) {
        return new WhichQuery(source, parent, newType, null, null, true, DEFAULT_MAX_DEPTH);
    }

    public WhichQuery withClass(String objectClass) {
        return new WhichQuery(source, target, third, objectClass, filename, transition, maxDepth);
    }

    public WhichQuery withFilename(String filename) {
        return new WhichQuery(source, target, third, objectClass, filename, transition, maxDepth);
    }

    public WhichQuery withMaxDepth(int maxDepth) {
        return new WhichQuery(source, target, third, objectClass, filename, transition, maxDepth);
    }

    /**
     * Requested permissions, access-vector mode only.
     */
    public Set<String> permissions() {
        Set<String> result = new LinkedHashSet<>();
        Arrays.stream(third.strip().split("\\s+"))
                .filter(p -> !p.isEmpty())
                .forEach(result::add);
        return result;
    }

    public String newType() {
        return third;
    }

    /**
     * Human readable description used in "nothing found" messages.
     */
    public String describe() {
        return transition
                ? "type_transition " + source + " " + target + " -> " + third
                : source + " " + third + " on " + target;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
