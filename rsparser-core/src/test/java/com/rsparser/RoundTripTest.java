package com.rsparser;

import com.rsparser.ast.SourceFile;
import com.rsparser.token.Lexer;
import com.rsparser.token.TokenStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parsing then printing gives back the source tokens, and printed output parses to the
 * same tree.
 */
public class RoundTripTest {

    @ParameterizedTest
    @DisplayName("print(parse(source)) has the tokens of source")
    @ValueSource(strings = {
        "#![allow(dead_code)]\n//! Crate docs\n",
        "use std::{collections::HashMap, io::{self, Read as _}};",
        "pub(crate) const LIMIT: usize = 4 * 1024;\nstatic mut STATE: Option<&'static str> = None;",
        "extern crate alloc;\nextern crate self as this;",
        "/// Point in space\n#[derive(Debug, Clone)]\npub struct Point<T = f64> where T: Copy { pub x: T, pub y: T, }",
        "struct Wrapper<'a, T: ?Sized + 'a>(&'a T) where T: Display;\nstruct Empty<>;",
        "enum Shape { Circle { r: f64 }, Square(f64), #[default] Nothing = 0, }",
        "union IntOrFloat { i: u32, f: f32 }",
        "enum Code { A = f::<u8, u16>(), B = size_of::<Vec<u8>>() as isize, C }",
        "type Callback<T> = Box<dyn Fn(T) -> Result<(), Error> + Send + 'static>;",
        "fn main() { println!(\"hi\"); }\nasync unsafe fn run<const N: usize>(buf: [u8; N]) -> io::Result<()> where [u8; N]: Sized {}",
        "mod a;\npub mod b { #![allow(unused)] use super::a; mod c {} }",
        "extern \"C\" {\n    fn printf(fmt: *const c_char, ...) -> c_int;\n    static errno: c_int;\n    type FILE;\n    link!();\n}",
        "pub unsafe trait Backend<E>: Send + Sync where E: Error {\n"
            + "    const NAME: &'static str;\n"
            + "    type Conn<'a>: Connection + 'a where Self: 'a;\n"
            + "    fn connect(&self, url: &str) -> Result<Self::Conn<'_>, E>;\n"
            + "    fn close(self) {}\n"
            + "    backend_methods! {}\n"
            + "}",
        "trait Alias<T> = Iterator<Item = T> + Clone where T: Copy;\nauto trait Marker {}",
        "impl<'a, T> Iterator for Iter<'a, T> where T: 'a {\n"
            + "    type Item = &'a T;\n"
            + "    #[inline] fn next(&mut self) -> Option<Self::Item> { self.inner.next() }\n"
            + "    pub(crate) const STEP: usize = 1;\n"
            + "    default fn size_hint(&self) -> (usize, Option<usize>) { (0, None) }\n"
            + "}",
        "impl !Sync for Cell {}\nunsafe impl<T: Send> Send for Arc<T> {}\nimpl <T as Trait>::Assoc {}",
        "impl Counter { fn bump(self.{mut count, step}) { count += step; } fn peek(self.{}) {} }",
        "macro_rules! vec { ($($x:expr),*) => { [$($x),*].to_vec() }; }\nlazy_static! { static ref X: u8 = 1; }\nthread_local!(static Y: u8 = 2);",
        "pub macro m($e:expr) { $e }\nmacro n { () => {} }",
        "#[cfg(test)] existential type Hidden: Debug;",
        "pub(in crate::util) fn helper() {}\ncrate fn legacy() {}\npub(self) struct Private;",
    })
    void testTokensPreserved(String source) {
        SourceFile file = Parser.parseFile(source);
        TokenStream printed = Printer.print(file);
        assertTrue(printed.sameTokens(Lexer.tokenize(source)),
            () -> "printed:\n" + printed + "\nsource:\n" + source);
    }

    @ParameterizedTest
    @DisplayName("parse(print(tree)) equals tree, through tokens and through text")
    @ValueSource(strings = {
        "use a::{b, c::*};\nfn f<T: Clone>(x: T) -> T { x.clone() }",
        "struct S<T>(T) where T: Copy;\nenum E { A, B(u8) }",
        "enum E { A = f::<u8, u16>(), B }",
        "extern \"C\" { fn v(n: i32, args: ...); }",
        "trait T: A + B { fn m(&'a mut self); type X: Y; }",
        "impl<T> T for X<T> { fn a(self.{mut p, q}) {} }",
        "#[a] mod m { #![b] const C: u8 = 1; }",
    })
    void testReparse(String source) {
        SourceFile file = Parser.parseFile(source);

        SourceFile fromTokens = new Parser(Printer.print(file)).parseFile();
        assertEquals(file, fromTokens);

        String text = Printer.toSource(file);
        SourceFile fromText = Parser.parseFile(text);
        assertTrue(Printer.print(fromText).sameTokens(Printer.print(file)), text);
        System.out.println("Printed: " + text);
    }
}
