package com.vidnyan.semacro.domain.expansion;

import com.vidnyan.semacro.domain.index.DefinitionIndex;
import com.vidnyan.semacro.domain.model.MacroDefinition;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves literal defines (permission sets such as {@code search_dir_perms}) inside rule text.
 *
 * <p>Chained defines ({@code read_file_perms} referring to {@code read_inherited_file_perms}) are
 * resolved round by round until nothing changes or {@value #MAX_ROUNDS} rounds have run. Nested
 * brace sets are then flattened: {@code { a { b c } d }} becomes {@code { a b c d }}.
 */
public class DefineResolver {

    static final int MAX_ROUNDS = 10;

    private static final Pattern WORD = Pattern.compile("\\b[A-Za-z_]\\w*\\b");
    private static final Pattern NESTED_BRACES = Pattern.compile("\\{([^{}]*)\\{([^{}]*)\\}([^{}]*)\\}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final DefinitionIndex index;

    public DefineResolver(DefinitionIndex index) {
        this.index = index;
    }

    public String resolve(String text) {
        String current = text;
        for (int round = 0; round < MAX_ROUNDS; round++) {
            String next = resolveOnce(current);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }
        return flattenBraces(current);
    }

    private String resolveOnce(String text) {
        Matcher matcher = WORD.matcher(text);
        StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = index.lookup(matcher.group())
                    .filter(MacroDefinition::isLiteralDefine)
                    .map(d -> d.body().strip())
                    .orElse(matcher.group());
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    static String flattenBraces(String text) {
        String current = text;
        Matcher matcher = NESTED_BRACES.matcher(current);
        while (matcher.find()) {
            current = matcher.replaceAll("{ $1 $2 $3 }");
            matcher = NESTED_BRACES.matcher(current);
        }
        return WHITESPACE.matcher(current).replaceAll(" ").strip();
    }
}
