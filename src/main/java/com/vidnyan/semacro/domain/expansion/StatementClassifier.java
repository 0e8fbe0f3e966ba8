package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.domain.model.MacroCall;
import com.vidnyan.semacro.parser.CallParseException;
import com.vidnyan.semacro.parser.CallParser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a macro body into logical statements and tags each one with a {@link Statement.Kind}.
 *
 * <p>Conditional wrappers ({@code optional_policy}, {@code tunable_policy}, {@code ifdef},
 * {@code ifndef}, {@code ifelse}) are unwrapped: their opening and closing lines are plain text
 * and the statements inside are classified in place. Physical lines are joined while parentheses
 * or braces remain open, so a call or rule spanning several lines is one statement.
 */
public class StatementClassifier {

    private static final Pattern WRAPPER = Pattern.compile(
            "^(optional_policy|tunable_policy|ifdef|ifndef|ifelse)\\s*\\(");
    private static final Pattern LEADING_QUOTES = Pattern.compile("^['`][\\s'`,)]*");
    private static final Pattern TRAILING_CLOSE = Pattern.compile("(?:'\\s*\\)?\\s*)+$");
    private static final Pattern ACCESS_VECTOR = Pattern.compile("^(allow|dontaudit|auditallow|neverallow)\\s");
    private static final Pattern TYPE_TRANSITION = Pattern.compile("^type_transition\\s");
    private static final Pattern DECLARATION = Pattern.compile("^(gen_require|require)\\b");
    private static final Pattern CALL_START = Pattern.compile("^[A-Za-z_]\\w*\\s*\\(");
    private static final Pattern BARE_NAME = Pattern.compile("^[A-Za-z_]\\w*$");

    /**
     * Split and classify a whole body, in body order.
     */
    public List<Statement> classifyBody(String body) {
        return split(body).stream().map(this::classify).toList();
    }

    /**
     * Classify one logical statement.
     */
    public Statement classify(String statement) {
        String text = statement.strip();
        if (text.isEmpty() || text.startsWith("#") || text.equals("dnl") || text.startsWith("dnl ")) {
            return Statement.of(Statement.Kind.PLAIN_TEXT, text);
        }
        if (DECLARATION.matcher(text).lookingAt()) {
            return Statement.of(Statement.Kind.DECLARATION_BLOCK, text);
        }
        if (ACCESS_VECTOR.matcher(text).lookingAt()) {
            return Statement.of(Statement.Kind.ALLOW_RULE, text);
        }
        if (TYPE_TRANSITION.matcher(text).lookingAt()) {
            return Statement.of(Statement.Kind.TRANSITION_RULE, text);
        }
        if (CALL_START.matcher(text).lookingAt()) {
            try {
                MacroCall call = CallParser.parse(text);
                return Statement.call(text, call);
            } catch (CallParseException e) {
                return text.endsWith(";")
                        ? Statement.of(Statement.Kind.POLICY_STATEMENT, text)
                        : Statement.of(Statement.Kind.PLAIN_TEXT, text);
            }
        }
        if (BARE_NAME.matcher(text).matches()) {
            return Statement.call(text, new MacroCall(text, List.of()));
        }
        if (text.endsWith(";")) {
            return Statement.of(Statement.Kind.POLICY_STATEMENT, text);
        }
        return Statement.of(Statement.Kind.PLAIN_TEXT, text);
    }

    /**
     * Logical statements of a body, with comments and wrapper punctuation removed.
     */
    public List<String> split(String body) {
        List<String> statements = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        int balance = 0;

        for (String raw : body.split("\\R")) {
            String line = cleanLine(raw);
            if (line.isEmpty()) {
                continue;
            }
            if (pending.length() > 0) {
                pending.append(' ');
            }
            pending.append(line);
            balance += balance(line);
            if (balance <= 0) {
                statements.add(pending.toString());
                pending.setLength(0);
                balance = 0;
            }
        }
        if (pending.length() > 0) {
            statements.add(pending.toString());
        }
        return statements;
    }

    static String cleanLine(String raw) {
        String line = stripComment(raw).strip();
        if (line.startsWith("refpolicywarn(")) {
            return "";
        }
        if (WRAPPER.matcher(line).lookingAt()) {
            int lastOpen = line.lastIndexOf('`');
            line = lastOpen < 0 ? "" : line.substring(lastOpen + 1);
        }
        line = LEADING_QUOTES.matcher(line).replaceFirst("");
        line = TRAILING_CLOSE.matcher(line).replaceFirst("");
        return line.strip();
    }

    private static String stripComment(String line) {
        boolean inLiteral = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inLiteral = !inLiteral;
            } else if (c == '#' && !inLiteral) {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private static int balance(String line) {
        int balance = 0;
        boolean inLiteral = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                inLiteral = !inLiteral;
            } else if (!inLiteral) {
                if (c == '(' || c == '{') {
                    balance++;
                } else if (c == ')' || c == '}') {
                    balance--;
                }
            }
        }
        return balance;
    }
}
