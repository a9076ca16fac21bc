package com.rsparser.ast;

import com.rsparser.token.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PunctuatedTest {

    private static final Span COMMA = Span.of(1, 1, 1);

    @Test
    @DisplayName("separators are either one fewer than the values or equal in number")
    void testConsistency() {
        assertFalse(new Punctuated<>(List.of("a", "b"), List.of(COMMA)).trailingSeparator());
        assertTrue(new Punctuated<>(List.of("a", "b"), List.of(COMMA, COMMA)).trailingSeparator());

        assertThrows(IllegalArgumentException.class, () -> new Punctuated<>(List.of("a"), List.of(COMMA, COMMA)));
        assertThrows(IllegalArgumentException.class, () -> new Punctuated<>(List.of(), List.of(COMMA)));
        assertThrows(IllegalArgumentException.class, () -> new Punctuated<>(List.of("a", "b", "c"), List.of(COMMA)));
    }

    @Test
    @DisplayName("emptyOrTrailing tells whether a value can follow without a separator")
    void testEmptyOrTrailing() {
        assertTrue(Punctuated.empty().emptyOrTrailing());
        assertFalse(Punctuated.of("a").emptyOrTrailing());
        assertTrue(new Punctuated<>(List.of("a"), List.of(COMMA)).emptyOrTrailing());
    }

    @Test
    @DisplayName("last is the final value, or null when empty")
    void testLast() {
        assertEquals("c", Punctuated.of("a", "b", "c").last());
        assertNull(Punctuated.empty().last());
    }
}
