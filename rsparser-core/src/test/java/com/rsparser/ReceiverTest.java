package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ReceiverTest {

    private static Receiver receiver(String source) {
        return assertInstanceOf(Receiver.class, Parser.parseFnArg(source));
    }

    @Test
    @DisplayName("self by value, optionally mutable")
    void testByValue() {
        Reference.None plain = assertInstanceOf(Reference.None.class, receiver("self").reference());
        assertNull(plain.mutability());

        Reference.None mutable = assertInstanceOf(Reference.None.class, receiver("mut self").reference());
        assertNotNull(mutable.mutability());
    }

    @Test
    @DisplayName("self by reference with optional lifetime and mutability")
    void testByReference() {
        Reference.Full shared = assertInstanceOf(Reference.Full.class, receiver("&self").reference());
        assertNull(shared.lifetime());
        assertNull(shared.mutability());

        Reference.Full full = assertInstanceOf(Reference.Full.class, receiver("&'a mut self").reference());
        assertEquals("a", full.lifetime().ident().name());
        assertNotNull(full.mutability());
    }

    @Test
    @DisplayName("partial borrow lists each field with its mutability")
    void testPartialBorrow() {
        Reference.Partial partial = assertInstanceOf(Reference.Partial.class,
            receiver("self.{mut a, b}").reference());
        Punctuated<PartialBorrow> borrows = partial.borrows().borrows();
        assertEquals(2, borrows.size());
        assertNotNull(borrows.get(0).mutability());
        assertEquals("a", borrows.get(0).ident().name());
        assertNull(borrows.get(1).mutability());
        assertEquals("b", borrows.get(1).ident().name());
        assertFalse(borrows.trailingSeparator());
    }

    @Test
    @DisplayName("partial borrow lists may be empty or end with a comma")
    void testPartialBorrowEdges() {
        Reference.Partial empty = assertInstanceOf(Reference.Partial.class, receiver("self.{}").reference());
        assertTrue(empty.borrows().borrows().isEmpty());

        Reference.Partial trailing = assertInstanceOf(Reference.Partial.class, receiver("self.{a,}").reference());
        assertEquals(1, trailing.borrows().borrows().size());
        assertTrue(trailing.borrows().borrows().trailingSeparator());
    }

    @Test
    @DisplayName("partial borrow receiver prints back to the same tokens")
    void testPartialBorrowPrints() {
        String source = "#[cfg(x)] self.{mut first, second,}";
        FnArg arg = Parser.parseFnArg(source);
        assertTrue(Printer.print(arg).sameTokens(Lexer.tokenize(source)));
        assertEquals(1, arg.attrs().size());
        System.out.println("Printed: " + Printer.toSource(arg));
    }

    @Test
    @DisplayName("self followed by a type annotation is a typed parameter")
    void testTypedSelf() {
        Signature sig = Parser.parseSignature("fn consume(self: Box<Self>)");
        PatType typed = assertInstanceOf(PatType.class, sig.inputs().get(0));
        assertTrue(typed.pat().bindsSelf());
        assertSame(typed, sig.receiver());

        Signature mutable = Parser.parseSignature("fn f(mut self: Pin<&mut Self>)");
        assertInstanceOf(PatType.class, mutable.receiver());
    }

    @Test
    @DisplayName("parameters that start like a receiver fall back to patterns")
    void testReceiverFallback() {
        PatType reference = assertInstanceOf(PatType.class, Parser.parseFnArg("&x: &u8"));
        assertTrue(reference.pat().tokens().sameTokens(Lexer.tokenize("&x")));

        PatType mutable = assertInstanceOf(PatType.class, Parser.parseFnArg("mut count: usize"));
        assertTrue(mutable.pat().tokens().sameTokens(Lexer.tokenize("mut count")));

        PatType tuple = assertInstanceOf(PatType.class, Parser.parseFnArg("(a, b): (u8, u8)"));
        assertEquals(1, tuple.pat().tokens().size());
    }

    @Test
    @DisplayName("free functions have no receiver")
    void testNoReceiver() {
        assertNull(Parser.parseSignature("fn f(x: u8)").receiver());
        assertNull(Parser.parseSignature("fn f()").receiver());
        assertNotNull(Parser.parseSignature("fn f(&mut self, x: u8)").receiver());
    }

    @Test
    @DisplayName("a malformed partial borrow is rejected")
    void testMalformedPartialBorrow() {
        assertThrows(ParseException.class, () -> Parser.parseFnArg("self.{mut}"));
        assertThrows(ParseException.class, () -> Parser.parseFnArg("self.{a b}"));
    }
}
