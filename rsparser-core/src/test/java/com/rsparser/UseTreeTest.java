package com.rsparser;

import com.rsparser.ast.*;
import com.rsparser.token.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UseTreeTest {

    @Test
    @DisplayName("nested groups with globs and renames")
    void testNestedGroup() {
        UseTree tree = Parser.parseUseTree("std::{io::{self, Write}, fmt::*, collections::HashMap as Map,}");
        UseTree.UsePath std = assertInstanceOf(UseTree.UsePath.class, tree);
        assertEquals("std", std.ident().name());

        UseTree.UseGroup group = assertInstanceOf(UseTree.UseGroup.class, std.tree());
        assertEquals(3, group.items().size());
        assertTrue(group.items().trailingSeparator());

        UseTree.UsePath io = assertInstanceOf(UseTree.UsePath.class, group.items().get(0));
        UseTree.UseGroup ioItems = assertInstanceOf(UseTree.UseGroup.class, io.tree());
        assertEquals("self", assertInstanceOf(UseTree.UseName.class, ioItems.items().get(0)).ident().name());

        UseTree.UsePath fmt = assertInstanceOf(UseTree.UsePath.class, group.items().get(1));
        assertInstanceOf(UseTree.UseGlob.class, fmt.tree());

        UseTree.UsePath collections = assertInstanceOf(UseTree.UsePath.class, group.items().get(2));
        UseTree.UseRename rename = assertInstanceOf(UseTree.UseRename.class, collections.tree());
        assertEquals("HashMap", rename.ident().name());
        assertEquals("Map", rename.rename().name());
    }

    @Test
    @DisplayName("path keywords and underscore renames")
    void testKeywords() {
        UseTree.UsePath path = assertInstanceOf(UseTree.UsePath.class, Parser.parseUseTree("crate::super_module::Trait as _"));
        assertEquals("crate", path.ident().name());

        assertInstanceOf(UseTree.UsePath.class, Parser.parseUseTree("super::*"));
        assertInstanceOf(UseTree.UseGroup.class, Parser.parseUseTree("{}"));
    }

    @Test
    @DisplayName("visitors see every tree shape")
    void testVisitor() {
        UseTree tree = Parser.parseUseTree("a::{b, c as d, e::*}");
        int names = tree.accept(new UseTree.Visitor<Integer>() {
            @Override
            public Integer visitPath(UseTree.UsePath path) {
                return path.tree().accept(this);
            }

            @Override
            public Integer visitName(UseTree.UseName name) {
                return 1;
            }

            @Override
            public Integer visitRename(UseTree.UseRename rename) {
                return 1;
            }

            @Override
            public Integer visitGlob(UseTree.UseGlob glob) {
                return 0;
            }

            @Override
            public Integer visitGroup(UseTree.UseGroup group) {
                int total = 0;
                for (UseTree item : group.items().values()) {
                    total += item.accept(this);
                }
                return total;
            }
        });
        assertEquals(2, names);
    }

    @Test
    @DisplayName("use trees print back to their tokens")
    void testPrint() {
        String source = "a::{b::{self, c}, d as _, *}";
        UseTree tree = Parser.parseUseTree(source);
        assertTrue(Printer.print(tree).sameTokens(Lexer.tokenize(source)));
    }

    @Test
    @DisplayName("a use tree cannot start with punctuation other than *")
    void testInvalid() {
        ExpectedTokenException e = assertThrows(ExpectedTokenException.class, () -> Parser.parseUseTree("a::;"));
        assertTrue(e.getExpected().contains("identifier"));
        assertTrue(e.getExpected().contains("`*`"));
        assertTrue(e.getExpected().contains("curly braces"));
    }
}
