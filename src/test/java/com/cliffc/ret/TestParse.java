package com.cliffc.ret;

import com.cliffc.ret.ast.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestParse {

  private static Def def( String src, String name ) {
    Unit unit = Unit.parse("t.ret",src);
    assertEquals(unit._errs.toString(),0,unit._errs.size());
    return unit.def(name);
  }
  private static String body( String src ) {
    return ((Block)def(src,"f").body()).stmts();
  }
  private static ErrMsg syntax( String src ) {
    Unit unit = Unit.parse("t.ret",src);
    assertEquals(1,unit._errs.size());
    ErrMsg err = unit._errs.errors().at(0);
    assertEquals(ErrMsg.Level.Syntax,err._lvl);
    assertEquals(0,unit._defs._len);
    return err;
  }

  @Test public void testStmts() {
    assertEquals("let y = x + 1; if y > 10 { return y }; let z = y * 2; z + y",
                 body("fn f(x) { let y = x + 1; if y > 10 { return y } let z = y * 2; z + y }"));
    assertEquals("print(1); 2",body("fn f() {\n  print(1)\n  2\n}"));
    assertEquals("",body("fn f() { }"));
  }

  @Test public void testPrecedence() {
    assertEquals("(a + b) * 2 - -a",body("fn f(a, b) { (a + b) * 2 - -a }"));
    assertEquals("a || b && c == d",body("fn f(a, b, c, d) { a || (b && (c == d)) }"));
    assertEquals("a - (b - c)",body("fn f(a, b, c) { a - (b - c) }"));
    assertEquals("a - b - c",body("fn f(a, b, c) { a - b - c }"));
    assertEquals("\"a\" <> \"b\\\"\"",body("fn f() { \"a\" <> \"b\\\"\" }"));
  }

  @Test public void testIf() {
    assertEquals("if n < 0 { \"neg\" } else if n == 0 { \"zero\" } else { \"pos\" }",
                 body("fn f(n) { if n < 0 { \"neg\" } else if n == 0 { \"zero\" } else { \"pos\" } }"));
  }

  @Test public void testCase() {
    assertEquals("case n { 0 -> \"zero\", -1 -> \"neg\", True -> Nil, m -> m, _ -> \"many\" }",
                 body("fn f(n) { case n { 0 -> \"zero\", -1 -> \"neg\", True -> Nil, m -> m, _ -> \"many\" } }"));
  }

  @Test public void testGuards() {
    assertEquals("case x { n if n > 10 -> n * 2, n if n > 5 && n < 8 -> n + 1, _ -> 0 }",
                 body("fn f(x) { case x { n if n > 10 -> n * 2, n if n > 5 && n < 8 -> n + 1, _ -> 0 } }"));
    Case c = (Case)((Block)def("fn f(x) { case x { 0 -> 1, n if n > 0 -> 2 } }","f").body()).at(0);
    assertNull(c.guard(0));
    assertEquals("n > 0",c.guard(1).toString());
    assertEquals("2",c.arm(1).toString());
  }

  // Pipelines bind loosest; a stage's own arguments follow the piped value
  @Test public void testPipe() {
    assertEquals("x + 1 |> g(2) |> h",body("fn f(x) { x + 1 |> g(2) |> h }"));
    assertEquals("(x |> h) + 1",body("fn f(x) { (x |> h) + 1 }"));
    assertEquals("return x |> h",body("fn f(x) { return x |> h }"));
    Pipe p = (Pipe)((Block)def("fn f(x) { x |> g(2) |> h }","f").body()).at(0);
    assertEquals(2,p.nstages());
    Ident x = new Ident("y");
    assertEquals("g(y, 2)",p.call(0,x).toString());
    assertEquals("h(y)",p.call(1,x).toString());
  }

  @Test public void testLambda() {
    assertEquals("let g = fn(x: Int, y) -> Int { x }; g(1, 2)",
                 body("fn f() { let g = fn(x: Int, y) -> Int { x }; g(1, 2) }"));
    assertEquals("(fn() { 1 })()",body("fn f() { (fn() { 1 })() }"));
  }

  // use x <- f(a); rest   ==>   f(a, fn(x) { rest })
  @Test public void testUse() {
    assertEquals("print(0); with(1, fn(x) { x + 1 })",body("fn f() { print(0); use x <- with(1); x + 1 }"));
    assertEquals("g(fn() { 2 })",body("fn f(g) { use <- g(); 2 }"));
    Call call = (Call)((Block)def("fn f() { use x <- with(1)\n x }","f").body()).at(0);
    Lambda cb = (Lambda)call.arg(1);
    assertTrue(cb._use);
  }

  @Test public void testDefs() {
    Unit unit = Unit.parse("t.ret","const k: Int = 3\nfn f(x: Int, g: fn(Int) -> a) -> a { g(x) }");
    assertEquals(2,unit._defs._len);
    assertEquals("const k: Int = 3",unit.def("k").toString());
    assertEquals("fn f(x: Int, g: fn(Int) -> a) -> a { g(x) }",unit.def("f").toString());
  }

  @Test public void testLoc() {
    Def f = def("fn f() {\n  print(1)\n  return 2\n}","f");
    AST ret = ((Block)f.body()).at(1);
    assertEquals(3,ret._loc.line());
    assertEquals("return 2",new String("fn f() {\n  print(1)\n  return 2\n}".getBytes(),ret._loc._x,ret._loc._end-ret._loc._x));
  }

  @Test public void testNumbers() {
    assertEquals("9223372036854775807",body("fn f() { 9223372036854775807 }"));
    assertEquals(Long.MAX_VALUE,((Con)((Block)def("fn f() { 9223372036854775807 }","f").body()).at(0))._con);
    assertEquals("Integer literal too large",syntax("fn f() { 9223372036854775808 }")._msg);
    assertEquals("Integer literal too large",syntax("fn f() { 18446744073709551616 }")._msg);
    assertEquals("Integer literal too large",syntax("fn f(x) { case x { 99999999999999999999 -> 1, _ -> 2 } }")._msg);
  }

  @Test public void testErrors() {
    assertEquals("t.ret:1: Expected an identifier\nfn f( { 1 }\n      ^",syntax("fn f( { 1 }").toString());
    assertEquals("Expected 'fn' or 'const'",syntax("let x = 1")._msg);
    assertEquals("Expected an identifier",syntax("fn f() { let if = 1 }")._msg);
    assertEquals("Duplicate definition 'f'",syntax("fn f() { 1 }\nfn f() { 2 }")._msg);
    assertEquals("Expected closing '}' but ran out of text",syntax("fn f() { 1")._msg);
    assertEquals("Unknown type 'Float'",syntax("fn f(x: Float) { 1 }")._msg);
    assertEquals("Expected a call after '<-'",syntax("fn f() { use x <- 1 }")._msg);
    assertEquals(3,syntax("fn f() {\n  1 +\n}")._loc.line());
  }
}
