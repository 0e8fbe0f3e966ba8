package com.vidnyan.semacro.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuoteScannerTest {

    @Test
    void findClosingQuote_ShouldTrackNesting() {
        String text = "`outer `inner' still outer' after";

        int close = QuoteScanner.findClosingQuote(text, 1);

        assertEquals(text.indexOf("' after"), close);
    }

    @Test
    void findClosingQuote_ShouldReturnMinusOneWhenUnbalanced() {
        assertEquals(-1, QuoteScanner.findClosingQuote("`never `closed'", 1));
    }

    @Test
    void hashInsideQuote_ShouldNotStartComment() {
        // Inside quotes a '#' is ordinary text, so the apostrophe after it still closes
        String text = "`a # b' c";

        assertEquals(6, QuoteScanner.findClosingQuote(text, 1));
    }

    @Test
    void quotesInsideComment_ShouldBeInert() {
        QuoteScanner scanner = new QuoteScanner("# don`t\nx");

        while (scanner.position() < 8) {
            scanner.advance();
        }

        assertEquals(QuoteScanner.Mode.TEXT, scanner.mode());
        assertEquals(0, scanner.depth());
        assertTrue(scanner.atLineStart());
    }

    @Test
    void advance_ShouldFollowStateDiagram() {
        QuoteScanner scanner = new QuoteScanner("`a`b''#c\n");

        scanner.advance();
        assertEquals(QuoteScanner.Mode.QUOTED, scanner.mode());
        assertEquals(1, scanner.depth());

        scanner.advance();
        scanner.advance();
        assertEquals(2, scanner.depth());

        scanner.advance();
        scanner.advance();
        assertEquals(1, scanner.depth());

        scanner.advance();
        assertEquals(QuoteScanner.Mode.TEXT, scanner.mode());

        scanner.advance();
        assertEquals(QuoteScanner.Mode.COMMENT, scanner.mode());

        scanner.advance();
        scanner.advance();
        assertEquals(QuoteScanner.Mode.TEXT, scanner.mode());
        assertFalse(scanner.hasNext());
    }

    @Test
    void skipTo_ShouldRejectMovingBackwards() {
        QuoteScanner scanner = new QuoteScanner("abc");
        scanner.skipTo(2);

        assertThrows(IllegalArgumentException.class, () -> scanner.skipTo(1));
    }
}
