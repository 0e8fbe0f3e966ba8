package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.parser.QuoteScanner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes declaration blocks from a macro body: {@code gen_require(`...')} and
 * {@code require { ... }}. They declare types and attributes but grant nothing.
 */
public final class DeclarationStripper {

    private static final Pattern GEN_REQUIRE = Pattern.compile("\\bgen_require\\(\\s*`");
    private static final Pattern REQUIRE = Pattern.compile("(?m)^[ \\t]*require\\s*\\{");

    private DeclarationStripper() {
    }

    public static String strip(String body) {
        return stripRequireBraces(stripGenRequire(body));
    }

    private static String stripGenRequire(String body) {
        StringBuilder result = new StringBuilder(body.length());
        Matcher matcher = GEN_REQUIRE.matcher(body);
        int copied = 0;
        while (matcher.find(copied)) {
            int close = QuoteScanner.findClosingQuote(body, matcher.end());
            if (close < 0) {
                // Leave a broken block in place, the classifier ignores its lines
                break;
            }
            int end = skipPast(body, close + 1, ')');
            result.append(body, copied, matcher.start());
            copied = skipNewline(body, end);
        }
        result.append(body, copied, body.length());
        return result.toString();
    }

    private static String stripRequireBraces(String body) {
        StringBuilder result = new StringBuilder(body.length());
        Matcher matcher = REQUIRE.matcher(body);
        int copied = 0;
        while (matcher.find(copied)) {
            int close = body.indexOf('}', matcher.end());
            if (close < 0) {
                break;
            }
            result.append(body, copied, matcher.start());
            copied = skipNewline(body, close + 1);
        }
        result.append(body, copied, body.length());
        return result.toString();
    }

    /**
     * Position after {@code expected} when only whitespace precedes it, otherwise {@code from}.
     */
    private static int skipPast(String text, int from, char expected) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i < text.length() && text.charAt(i) == expected ? i + 1 : from;
    }

    private static int skipNewline(String text, int from) {
        int i = from;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t' || text.charAt(i) == '\r')) {
            i++;
        }
        return i < text.length() && text.charAt(i) == '\n' ? i + 1 : from;
    }
}
