package com.vidnyan.semacro.parser;

import com.vidnyan.semacro.domain.model.MacroDefinition;
import com.vidnyan.semacro.domain.model.MacroKind;
import com.vidnyan.semacro.domain.model.ParseError;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code interface}, {@code template} and {@code define} definitions from the text of a
 * {@code .if} or {@code .spt} file.
 *
 * <p>Headers are recognised at the start of a line, both at top level and inside quoted wrappers
 * such as {@code ifdef(`x',`...')}. The body runs from the backtick after the name to the
 * apostrophe that brings quote nesting back to zero. A body that never closes is recorded as a
 * {@link ParseError} and the rest of the file is still scanned.
 */
@Slf4j
public class DefinitionParser {

    /**
     * Policy groups recognised as categories, in refpolicy layout order.
     */
    public static final List<String> KNOWN_CATEGORIES = List.of(
            "kernel", "system", "admin", "apps", "roles",
            "services", "contrib", "distributed", "support");

    private static final Pattern HEADER = Pattern.compile(
            "[ \\t]*(interface|template|define)\\(\\s*`([^`']+)'\\s*,\\s*`");

    /**
     * Result of parsing one file.
     */
    public record ParsedFile(
        String sourcePath,
        List<MacroDefinition> definitions,
        List<ParseError> errors
    ) {}

    /**
     * Parse all definitions in one file.
     *
     * @param sourcePath path relative to the include root, used for category and reporting
     * @param text raw file contents
     */
    public ParsedFile parse(String sourcePath, String text) {
        String path = normalizePath(sourcePath);
        String category = categoryOf(path);
        List<MacroDefinition> definitions = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        LineCounter lines = new LineCounter(text);

        QuoteScanner scanner = new QuoteScanner(text);
        Matcher header = HEADER.matcher(text);

        while (scanner.hasNext()) {
            if (scanner.mode() != QuoteScanner.Mode.COMMENT && scanner.atLineStart()) {
                header.region(scanner.position(), text.length());
                if (header.lookingAt()) {
                    int headerLine = lines.lineAt(scanner.position());
                    MacroKind kind = MacroKind.fromKeyword(header.group(1)).orElseThrow();
                    String name = header.group(2).trim();
                    int bodyStart = header.end();
                    int bodyEnd = QuoteScanner.findClosingQuote(text, bodyStart);

                    if (bodyEnd < 0) {
                        errors.add(new ParseError(path, headerLine,
                                "unbalanced quotes in " + kind.keyword() + " '" + name + "'"));
                        scanner.skipTo(bodyStart);
                        continue;
                    }

                    definitions.add(new MacroDefinition(
                            name, kind, path, headerLine, category,
                            trimBody(text.substring(bodyStart, bodyEnd))));
                    scanner.skipTo(bodyEnd + 1);
                    continue;
                }
            }
            scanner.advance();
        }

        log.debug("Parsed {}: {} definitions, {} errors", path, definitions.size(), errors.size());
        return new ParsedFile(path, List.copyOf(definitions), List.copyOf(errors));
    }

    /**
     * Derive the category from the path segments: the first known policy group, otherwise the
     * first directory, otherwise empty.
     */
    public static String categoryOf(String sourcePath) {
        String[] parts = normalizePath(sourcePath).split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if (KNOWN_CATEGORIES.contains(parts[i])) {
                return parts[i];
            }
        }
        return parts.length > 1 ? parts[0] : "";
    }

    private static String normalizePath(String path) {
        return path == null ? "" : path.replace('\\', '/');
    }

    /**
     * Strip one leading and one trailing newline, as written in the sources.
     */
    private static String trimBody(String body) {
        String result = body;
        if (result.startsWith("\r\n")) {
            result = result.substring(2);
        } else if (result.startsWith("\n")) {
            result = result.substring(1);
        }
        if (result.endsWith("\r\n")) {
            result = result.substring(0, result.length() - 2);
        } else if (result.endsWith("\n")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    /**
     * Incremental line counter. Positions must be requested in increasing order.
     */
    private static final class LineCounter {
        private final String text;
        private int position;
        private int line = 1;

        LineCounter(String text) {
            this.text = text;
        }

        int lineAt(int target) {
            for (; position < target && position < text.length(); position++) {
                if (text.charAt(position) == '\n') {
                    line++;
                }
            }
            return line;
        }
    }
}
