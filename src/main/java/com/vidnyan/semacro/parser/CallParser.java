package com.vidnyan.semacro.parser;

import com.vidnyan.semacro.domain.model.MacroCall;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses a macro invocation such as {@code files_pid_filetrans(ntpd_t, ntpd_var_run_t, file)}
 * into a {@link MacroCall}.
 *
 * <p>Commas separate arguments only at parenthesis depth 0 and outside a double-quoted literal.
 * A literal keeps its quotes and any embedded commas. Each argument is trimmed.
 */
public final class CallParser {

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final char LITERAL_QUOTE = '"';

    private CallParser() {
    }

    /**
     * Parse a call string. A bare name yields an empty argument list.
     *
     * @throws CallParseException on unbalanced parentheses or quotes, or text after the call
     */
    public static MacroCall parse(String input) {
        if (input == null || input.isBlank()) {
            throw new CallParseException(String.valueOf(input), "empty macro call");
        }
        String text = input.strip();
        int open = text.indexOf('(');
        String name = (open < 0 ? text : text.substring(0, open)).strip();
        if (!NAME.matcher(name).matches()) {
            throw new CallParseException(input, "invalid macro name '" + name + "'");
        }
        if (open < 0) {
            if (text.indexOf(')') >= 0) {
                throw new CallParseException(input, "unbalanced parentheses");
            }
            return new MacroCall(name, List.of());
        }
        return new MacroCall(name, splitArguments(input, text, open));
    }

    private static List<String> splitArguments(String input, String text, int open) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 1;
        boolean inLiteral = false;
        int close = -1;

        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inLiteral) {
                current.append(c);
                if (c == LITERAL_QUOTE) {
                    inLiteral = false;
                }
                continue;
            }
            if (c == LITERAL_QUOTE) {
                inLiteral = true;
                current.append(c);
            } else if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    close = i;
                    break;
                }
                current.append(c);
            } else if (c == ',' && depth == 1) {
                arguments.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }

        if (inLiteral) {
            throw new CallParseException(input, "unterminated quoted literal");
        }
        if (close < 0) {
            throw new CallParseException(input, "unbalanced parentheses");
        }
        if (close != text.length() - 1) {
            throw new CallParseException(input, "unexpected text after closing parenthesis");
        }

        String last = current.toString().strip();
        if (!arguments.isEmpty() || !last.isEmpty()) {
            arguments.add(last);
        }
        return arguments;
    }
}
