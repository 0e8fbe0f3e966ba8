package com.vidnyan.semacro.domain.expansion;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces positional parameters {@code $1}, {@code $2}, ... and {@code $*} in a macro body.
 *
 * <p>One pass only: text produced by an argument is never scanned again. A parameter beyond the
 * supplied arguments becomes the empty string, as M4 does; digits after {@code $} are read as one
 * number, so {@code $10} is the tenth argument. {@code $*} becomes all arguments joined by commas,
 * which lets wrapper interfaces forward their call unchanged. {@code $0}, {@code $@} and a
 * {@code $} not followed by a digit or {@code *} are left untouched.
 */
public final class ArgumentSubstitutor {

    private static final Pattern PARAMETER = Pattern.compile("\\$(\\d+|\\*)");

    private ArgumentSubstitutor() {
    }

    public static String substitute(String body, List<String> arguments) {
        Matcher matcher = PARAMETER.matcher(body);
        StringBuilder result = new StringBuilder(body.length());
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement(matcher, arguments)));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String replacement(Matcher matcher, List<String> arguments) {
        String parameter = matcher.group(1);
        if (parameter.equals("*")) {
            return String.join(",", arguments);
        }
        int index = parseIndex(parameter);
        if (index == 0) {
            return matcher.group();
        }
        return index <= arguments.size() ? arguments.get(index - 1) : "";
    }

    // Any run of digits past the argument list is simply missing
    private static int parseIndex(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
