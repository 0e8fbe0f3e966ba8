package com.vidnyan.semacro.parser;

/**
 * Character-level state machine for M4 quoting.
 *
 * <p>The scanner keeps three pieces of state: the current {@link Mode}, the quote nesting depth and
 * the position in the input. A backtick opens a quote (or nests one level deeper when already
 * quoted), an apostrophe closes one level. Outside of quotes a {@code #} starts a comment that runs
 * to the end of the line; quote characters inside a comment are inert. Inside quotes nothing is a
 * comment, which matches how M4 itself treats quoted text.
 *
 * <pre>
 *   TEXT    -- '`'  --> QUOTED (depth = 1)
 *   TEXT    -- '#'  --> COMMENT
 *   COMMENT -- '\n' --> TEXT
 *   QUOTED  -- '`'  --> QUOTED (depth + 1)
 *   QUOTED  -- '\'' --> QUOTED (depth - 1) or TEXT when depth reaches 0
 * </pre>
 */
public final class QuoteScanner {

    public static final char OPEN_QUOTE = '`';
    public static final char CLOSE_QUOTE = '\'';

    public enum Mode {
        // Unquoted text, macro headers and calls live here
        TEXT,
        // Inside at least one backtick/apostrophe pair
        QUOTED,
        // After an unquoted '#', until end of line
        COMMENT
    }

    private final String text;
    private int position;
    private int depth;
    private Mode mode;

    public QuoteScanner(String text) {
        this(text, 0, Mode.TEXT, 0);
    }

    private QuoteScanner(String text, int position, Mode mode, int depth) {
        this.text = text;
        this.position = position;
        this.mode = mode;
        this.depth = depth;
    }

    /**
     * Scanner positioned just after an opening backtick, at nesting depth 1.
     */
    public static QuoteScanner insideQuote(String text, int afterOpenQuote) {
        return new QuoteScanner(text, afterOpenQuote, Mode.QUOTED, 1);
    }

    /**
     * Find the apostrophe that balances the backtick preceding {@code afterOpenQuote}.
     *
     * @return index of the closing apostrophe, or -1 when the quote never closes
     */
    public static int findClosingQuote(String text, int afterOpenQuote) {
        QuoteScanner scanner = insideQuote(text, afterOpenQuote);
        while (scanner.hasNext()) {
            int index = scanner.position();
            scanner.advance();
            if (scanner.mode() == Mode.TEXT) {
                return index;
            }
        }
        return -1;
    }

    public boolean hasNext() {
        return position < text.length();
    }

    /**
     * Consume one character and apply its transition.
     */
    public char advance() {
        char c = text.charAt(position++);
        switch (mode) {
            case TEXT -> {
                if (c == OPEN_QUOTE) {
                    mode = Mode.QUOTED;
                    depth = 1;
                } else if (c == '#') {
                    mode = Mode.COMMENT;
                }
            }
            case COMMENT -> {
                if (c == '\n') {
                    mode = Mode.TEXT;
                }
            }
            case QUOTED -> {
                if (c == OPEN_QUOTE) {
                    depth++;
                } else if (c == CLOSE_QUOTE) {
                    depth--;
                    if (depth == 0) {
                        mode = Mode.TEXT;
                    }
                }
            }
        }
        return c;
    }

    /**
     * Jump forward to {@code target}, keeping the current mode and depth.
     * Used after a nested construct has been consumed by another scanner.
     */
    public void skipTo(int target) {
        if (target < position) {
            throw new IllegalArgumentException("cannot move backwards from " + position + " to " + target);
        }
        position = Math.min(target, text.length());
    }

    public int position() {
        return position;
    }

    public int depth() {
        return mode == Mode.QUOTED ? depth : 0;
    }

    public Mode mode() {
        return mode;
    }

    /**
     * True when the scanner sits on the first character of a line.
     */
    public boolean atLineStart() {
        return position == 0 || (position <= text.length() && text.charAt(position - 1) == '\n');
    }
}
