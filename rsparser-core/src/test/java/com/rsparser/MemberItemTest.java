package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Delimiter;
import com.rsparser.token.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Members of trait bodies, impl bodies and extern blocks.
 */
public class MemberItemTest {

    @Test
    @DisplayName("trait constants, with and without a default")
    void testTraitConst() {
        TraitItemConst required = assertInstanceOf(TraitItemConst.class, Parser.parseTraitItem("const ID: u32;"));
        assertNull(required.defaultValue());

        TraitItemConst defaulted = assertInstanceOf(TraitItemConst.class, Parser.parseTraitItem("const ID: u32 = 7;"));
        assertNotNull(defaulted.eq());
        assertTrue(defaulted.defaultValue().tokens().sameTokens(Lexer.tokenize("7")));
    }

    @Test
    @DisplayName("trait methods, with and without a default body")
    void testTraitMethod() {
        TraitItemMethod required = assertInstanceOf(TraitItemMethod.class,
            Parser.parseTraitItem("fn len(&self) -> usize;"));
        assertNull(required.defaultBody());
        assertNotNull(required.semi());

        TraitItemMethod provided = assertInstanceOf(TraitItemMethod.class,
            Parser.parseTraitItem("fn is_empty(&self) -> bool { self.len() == 0 }"));
        assertNotNull(provided.defaultBody());
        assertNull(provided.semi());

        TraitItemMethod constMethod = assertInstanceOf(TraitItemMethod.class,
            Parser.parseTraitItem("const fn zero() -> Self;"));
        assertNotNull(constMethod.sig().constness());
    }

    @Test
    @DisplayName("associated types with bounds, where clause and default")
    void testTraitType() {
        TraitItemType type = assertInstanceOf(TraitItemType.class,
            Parser.parseTraitItem("type Item<'a>: Debug + 'a where Self: 'a = &'a u8;"));
        assertEquals(1, type.generics().params().size());
        assertEquals(2, type.bounds().size());
        assertNotNull(type.generics().whereClause());
        assertTrue(type.defaultType().tokens().sameTokens(Lexer.tokenize("&'a u8")));

        TraitItemType bare = assertInstanceOf(TraitItemType.class, Parser.parseTraitItem("type Output;"));
        assertNull(bare.colon());
        assertTrue(bare.bounds().isEmpty());
    }

    @Test
    @DisplayName("macro invocations inside traits and impls")
    void testMemberMacros() {
        TraitItemMacro traitMacro = assertInstanceOf(TraitItemMacro.class, Parser.parseTraitItem("declare! { x }"));
        assertEquals(Delimiter.BRACE, traitMacro.mac().delimiter());
        assertNull(traitMacro.semi());

        ImplItemMacro implMacro = assertInstanceOf(ImplItemMacro.class, Parser.parseImplItem("forward!(len);"));
        assertNotNull(implMacro.semi());

        assertThrows(ParseException.class, () -> Parser.parseImplItem("forward!(len)"));
    }

    @Test
    @DisplayName("impl members with visibility and defaultness")
    void testImplMembers() {
        ImplItemConst constant = assertInstanceOf(ImplItemConst.class,
            Parser.parseImplItem("pub const ID: u32 = 1;"));
        assertInstanceOf(Visibility.Public.class, constant.vis());

        ImplItemMethod method = assertInstanceOf(ImplItemMethod.class,
            Parser.parseImplItem("default fn describe(&self) -> String { String::new() }"));
        assertNotNull(method.defaultness());
        assertNotNull(method.sig().receiver());

        ImplItemType type = assertInstanceOf(ImplItemType.class,
            Parser.parseImplItem("pub(crate) type Output = Vec<u8>;"));
        assertInstanceOf(Visibility.Restricted.class, type.vis());

        ImplItemMethod partial = assertInstanceOf(ImplItemMethod.class,
            Parser.parseImplItem("fn tick(self.{mut frame, clock}) { frame += clock.step(); }"));
        Receiver receiver = assertInstanceOf(Receiver.class, partial.sig().receiver());
        assertInstanceOf(Reference.Partial.class, receiver.reference());

        ImplItemMethod constFn = assertInstanceOf(ImplItemMethod.class,
            Parser.parseImplItem("const fn new() -> Self { Self }"));
        assertNotNull(constFn.sig().constness());
    }

    @Test
    @DisplayName("existential types in impls are kept verbatim")
    void testImplExistential() {
        String source = "existential type Iter: Iterator<Item = u8>;";
        ImplItemVerbatim verbatim = assertInstanceOf(ImplItemVerbatim.class, Parser.parseImplItem(source));
        assertTrue(verbatim.tokens().sameTokens(Lexer.tokenize(source)));
    }

    @Test
    @DisplayName("foreign statics, types and macros")
    void testForeignItems() {
        ForeignItemStatic global = assertInstanceOf(ForeignItemStatic.class,
            Parser.parseForeignItem("pub static mut environ: *const *const c_char;"));
        assertNotNull(global.mutability());

        ForeignItemType opaque = assertInstanceOf(ForeignItemType.class, Parser.parseForeignItem("type Handle;"));
        assertEquals("Handle", opaque.ident().name());

        ForeignItemMacro mac = assertInstanceOf(ForeignItemMacro.class, Parser.parseForeignItem("generate!(a, b);"));
        assertEquals(Delimiter.PARENTHESIS, mac.mac().delimiter());
    }

    @Test
    @DisplayName("member visitors dispatch to the right method")
    void testVisitor() {
        ItemTrait trait = (ItemTrait) Parser.parseItem(
            "trait T { const A: u8; type B; fn c(); m!(); }");
        StringBuilder kinds = new StringBuilder();
        for (TraitItem member : trait.items()) {
            kinds.append(member.accept(new TraitItem.Visitor<String>() {
                @Override
                public String visitConst(TraitItemConst item) {
                    return "const ";
                }

                @Override
                public String visitMethod(TraitItemMethod item) {
                    return "method ";
                }

                @Override
                public String visitType(TraitItemType item) {
                    return "type ";
                }

                @Override
                public String visitMacro(TraitItemMacro item) {
                    return "macro ";
                }

                @Override
                public String visitVerbatim(TraitItemVerbatim item) {
                    return "verbatim ";
                }
            }));
        }
        assertEquals("const type method macro ", kinds.toString());
    }
}
