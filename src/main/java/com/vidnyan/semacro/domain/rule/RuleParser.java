package com.vidnyan.semacro.domain.rule;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a terminal policy statement into a structured {@link Rule}.
 * Expects defines to be resolved already, so permission sets are plain brace lists.
 */
public final class RuleParser {

    // A single name or a flat brace set
    private static final String TOKEN = "(\\{[^{}]*\\}|[^\\s{}:;]+)";

    private static final Pattern ACCESS_VECTOR = Pattern.compile(
            "^(allow|dontaudit|auditallow|neverallow)\\s+" + TOKEN + "\\s+" + TOKEN + ":" + TOKEN
                    + "\\s+(\\{[^{}]*\\}|[^\\s{};~]+)\\s*;$");

    private static final Pattern TYPE_TRANSITION = Pattern.compile(
            "^type_transition\\s+" + TOKEN + "\\s+" + TOKEN + ":" + TOKEN
                    + "\\s+([^\\s{};\"]+)(?:\\s+(\"[^\"]*\"|[^\\s;\"]+))?\\s*;$");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private RuleParser() {
    }

    /**
     * Parse a statement. Anything that is not a well-formed access-vector rule or type
     * transition becomes a {@link PolicyStatement}.
     */
    public static Rule parse(String statement) {
        String text = normalize(statement);
        return parseAccessVector(text)
                .or(() -> parseTypeTransition(text))
                .orElseGet(() -> new PolicyStatement(text));
    }

    public static Optional<Rule> parseAccessVector(String statement) {
        Matcher m = ACCESS_VECTOR.matcher(normalize(statement));
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new AllowRule(
                AllowRule.AccessKind.fromKeyword(m.group(1)),
                m.group(2), m.group(3), m.group(4),
                permissions(m.group(5))));
    }

    public static Optional<Rule> parseTypeTransition(String statement) {
        Matcher m = TYPE_TRANSITION.matcher(normalize(statement));
        if (!m.matches()) {
            return Optional.empty();
        }
        String filename = m.group(5);
        if (filename != null && filename.length() >= 2 && filename.startsWith("\"") && filename.endsWith("\"")) {
            filename = filename.substring(1, filename.length() - 1);
        }
        return Optional.of(new TypeTransitionRule(m.group(1), m.group(2), m.group(3), m.group(4), filename));
    }

    /**
     * Collapse whitespace and pad braces so equal statements compare equal as text.
     */
    public static String normalize(String statement) {
        String text = statement.strip()
                .replace("{", " { ")
                .replace("}", " } ");
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        // Tighten the separators that the padding loosened. A space after ':' is kept: it marks an
        // empty class slot left by a missing argument.
        return text.replace(" ;", ";")
                .replace(" :", ":")
                .replace("~ {", "~{");
    }

    private static Set<String> permissions(String text) {
        String inner = text.startsWith("{") ? text.substring(1, text.length() - 1) : text;
        Set<String> result = new LinkedHashSet<>();
        Arrays.stream(WHITESPACE.split(inner.strip()))
                .filter(p -> !p.isEmpty())
                .forEach(result::add);
        return result;
    }
}
