package com.cliffc.ret.lower;

import com.cliffc.ret.*;
import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestCps {

  private static Lowered lower( String src, String name ) {
    Unit unit = Unit.parse("t.ret",src);
    unit.compile(Target.RESTRICTED);
    assertFalse(unit._errs.toString(),unit._errs.has_errors());
    Lowered low = unit.lowered(name);
    assertFalse(low.failed());
    assertEquals(0,TestScopes.rets(low._body)._len);
    return low;
  }
  private static void test( String src, String lowered ) {
    assertEquals(lowered,((Block)lower(src,"f")._body).stmts());
  }

  @Test public void testEarlyExit() {
    test("fn f(x) { let y = x + 1; if y > 10 { return y }; let z = y * 2; z + y }",
         "let y = x + 1; if y > 10 { y } else { let z = y * 2; z + y }");
    test("fn f(x) { if x { return 1 }; print(2); 3 }",
         "if x { 1 } else { print(2); 3 }");
    test("fn f(x) { if x > 0 { return 1 } else if x < 0 { return 2 }; 3 }",
         "if x > 0 { 1 } else if x < 0 { 2 } else { 3 }");
  }

  // A final return is just the value
  @Test public void testFinalReturn() {
    test("fn f(x) { print(x); return x }","print(x); x");
    Unit unit = Unit.parse("t.ret","fn f() { return 1; 2 }").compile(Target.RESTRICTED);
    assertEquals(1,unit._errs.warnings()._len);
    assertEquals("1",((Block)unit.lowered("f")._body).stmts());
  }

  // No return, nothing to do
  @Test public void testIdempotent() {
    Lowered low = lower("fn f(x) { let y = x + 1; if y > 0 { y } else { 0 } }","f");
    assertSame(low._def.body(),low._body);
    assertFalse(low.has_ret());
  }

  // The original tree is left alone
  @Test public void testCopy() {
    Lowered low = lower("fn f(x) { if x { return 1 }; 2 }","f");
    assertNotSame(low._def.body(),low._body);
    assertEquals(1,TestScopes.rets(low._def.body())._len);
    assertEquals("fn f(x) { if x { return 1 }; 2 }",low._def.toString());
  }

  @Test public void testClosure() {
    test("fn f(xs) { let g = fn(y) { if y > 0 { return y }; 0 - y }; g(xs) }",
         "let g = fn(y) { if y > 0 { y } else { 0 - y } }; g(xs)");
    // Both scopes return
    test("fn f(x) { let g = fn(y) { return y + 1 }; if x > 0 { return g(x) }; 0 }",
         "let g = fn(y) { y + 1 }; if x > 0 { g(x) } else { 0 }");
  }

  @Test public void testUse() {
    test("fn f(x) { use y <- with(x); if y > 0 { return y }; 0 - y }",
         "with(x, fn(y) { if y > 0 { y } else { 0 - y } })");
  }

  // Operands evaluated before the return are kept, in order
  @Test public void testTemps() {
    Lowered low = lower("fn g(x) { x }\nfn f(x) { g(1) + (if x > 0 { return 5 } else { 2 }) }","f");
    assertEquals("let _cps1 = g(1); if x > 0 { 5 } else { _cps1 + 2 }",((Block)low._body).stmts());
    // Constants and variables need no temporary
    test("fn f(x) { x + (if x > 0 { return 5 } else { 2 }) }",
         "if x > 0 { 5 } else { x + 2 }");
  }

  @Test public void testShortCircuit() {
    test("fn f(x, y) { x && (return y) }","if x { y } else { False }");
    test("fn f(x, y) { x || (return y) }","if x { True } else { y }");
  }

  @Test public void testBind() {
    test("fn f(x) { let y = if x > 0 { return 0 } else { x * 2 }; y + 1 }",
         "if x > 0 { 0 } else { let y = x * 2; y + 1 }");
  }

  @Test public void testCase() {
    test("fn f(x) { let s = case x { 0 -> return \"zero\", n -> int_to_string(n) }; s <> \"!\" }",
         "case x { 0 -> \"zero\", n -> { let s = int_to_string(n); s <> \"!\" } }");
  }

  // Guards stay with their arm; a false one falls through as before
  @Test public void testGuards() {
    test("fn f(x) { case x { n if n > 10 -> return n * 2, n if n > 5 -> return n + 1, _ -> 0 } }",
         "case x { n if n > 10 -> n * 2, n if n > 5 -> n + 1, _ -> 0 }");
    // A renamed pattern variable is renamed in its guard too
    test("fn f(x) { let n = 1; case x { n if n > 0 -> return n, _ -> print(x) }; n }",
         "let n = 1; case x { n_1 if n_1 > 0 -> n_1, _ -> { print(x); n } }");
  }

  @Test public void testPipe() {
    test("fn double(n) { n * 2 }\nfn f(x) { case x > 0 { True -> return x |> double, _ -> 0 } }",
         "case x > 0 { True -> x |> double, _ -> 0 }");
    // Stages run before the return are bound in order
    test("fn g(a, b) { a + b }\nfn h(a) { a * 2 }\nfn f(x) { x |> h |> g(if x > 0 { return 0 } else { 1 }) |> h }",
         "let _cps1 = h(x); if x > 0 { 0 } else { let _cps2 = g(_cps1, 1); h(_cps2) }");
  }

  // Bindings moved in front of the rest are renamed rather than capture
  @Test public void testHygiene() {
    test("fn f(c) { let z = 5; if c { let z = 1; print(z) } else { return 0 }; z }",
         "let z = 5; if c { let z_1 = 1; print(z_1); z } else { 0 }");
    test("fn f(x) { let n = 1; case x { 0 -> return 0, n -> print(n) }; n }",
         "let n = 1; case x { 0 -> 0, n_1 -> { print(n_1); n } }");
  }

  // A Return that was never typed is an upstream failure
  @Test public void testInternalFault() {
    Def f = TestScopes.def("fn f(x) { if x { return 1 }; 2 }","f");
    Errs errs = new Errs();
    Ary<FunScope> scopes = Scopes.resolve(f,errs);
    Flow.flow(f,errs);
    try {
      Cps.lower(f,scopes);
      fail();
    } catch( InternalFault e ) {
      assertTrue(e.getMessage(),e.getMessage().startsWith("Untyped"));
    }
  }
}
