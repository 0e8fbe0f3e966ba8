package com.vidnyan.semacro.application.port.in;

import java.util.List;

/**
 * Outcome of one query: a value on success, or a typed failure with a message.
 * Failures here are per-query and never fatal for the process.
 */
public record QueryResult<T>(
    Status status,
    T value,
    String message,
    List<String> suggestions
) {

    public enum Status {
        SUCCESS,
        NOT_FOUND,
        INVALID_PATTERN,
        PARSE_ERROR,
        READ_ERROR,
        USAGE_ERROR
    }

    public QueryResult {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Create a successful result.
     */
    public static <T> QueryResult<T> success(T value) {
        return new QueryResult<>(Status.SUCCESS, value, null, List.of());
    }

    /**
     * Create a successful result carrying an informational message.
     */
    public static <T> QueryResult<T> success(T value, String message) {
        return new QueryResult<>(Status.SUCCESS, value, message, List.of());
    }

    /**
     * Create a not-found result with "did you mean" suggestions.
     */
    public static <T> QueryResult<T> notFound(String message, List<String> suggestions) {
        return new QueryResult<>(Status.NOT_FOUND, null, message, suggestions);
    }

    public static <T> QueryResult<T> notFound(String message) {
        return notFound(message, List.of());
    }

    public static <T> QueryResult<T> invalidPattern(String message) {
        return new QueryResult<>(Status.INVALID_PATTERN, null, message, List.of());
    }

    public static <T> QueryResult<T> parseError(String message) {
        return new QueryResult<>(Status.PARSE_ERROR, null, message, List.of());
    }

    public static <T> QueryResult<T> readError(String message) {
        return new QueryResult<>(Status.READ_ERROR, null, message, List.of());
    }

    public static <T> QueryResult<T> usageError(String message) {
        return new QueryResult<>(Status.USAGE_ERROR, null, message, List.of());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
