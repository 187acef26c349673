package com.cliffc.ret.lower;

import com.cliffc.ret.ErrMsg;
import com.cliffc.ret.Errs;
import com.cliffc.ret.ast.*;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestFlow {

  private Errs _errs;
  private Block flow( String src ) {
    Def f = TestScopes.def(src,"f");
    _errs = new Errs();
    Flow.flow(f,_errs);
    return (Block)f.body();
  }
  private int warnings() {
    assertEquals(0,_errs.errors()._len);
    return _errs.warnings()._len;
  }

  // One warning spans the whole trailing run
  @Test public void testTrailing() {
    String src = "fn f(x) { return 1; print(x); x }";
    Block b = flow(src);
    assertEquals(1,warnings());
    ErrMsg w = _errs.warnings().at(0);
    assertEquals(ErrMsg.Level.UnreachableCode,w._lvl);
    assertEquals(src.indexOf("print"),w._loc._x);
    assertEquals(src.lastIndexOf("x }")+1,w._loc._end);
    assertTrue(b._div);
    assertFalse(b.at(0)._dead);
    assertTrue(b.at(1)._dead);
    assertTrue(b.at(2)._dead);
    assertEquals(1,b.live()._len);
  }

  @Test public void testFinalReturn() {
    Block b = flow("fn f(x) { print(x); return x }");
    assertEquals(0,warnings());
    assertTrue(b._div);
  }

  @Test public void testTwoReturns() {
    flow("fn f() { return 1; return 2 }");
    assertEquals(1,warnings());
  }

  // A return inside a function literal does not end the caller's sequence
  @Test public void testClosure() {
    Block b = flow("fn f(x) { let g = fn(y) { return y }; g(x); with(x, fn(y) { return y }); x + 1 }");
    assertEquals(0,warnings());
    assertFalse(b._div);
    assertFalse(b.at(0)._div);
    assertFalse(b.at(2)._div);
    Lambda g = (Lambda)((Let)b.at(0)).val();
    assertTrue(g.body()._div);
  }

  @Test public void testIf() {
    assertEquals(0,warn("fn f(x) { if x { return 1 }; x }"));
    assertEquals(0,warn("fn f(x) { if x { return 1 } else { 2 }; x }"));
    assertEquals(1,warn("fn f(x) { if x { return 1 } else { return 2 }; x }"));
    assertEquals(1,warn("fn f(x) { if x { return 1 } else if x { return 2 } else { return 3 }; x }"));
    assertEquals(0,warn("fn f(x) { if x { return 1 } else if x { 2 } else { return 3 }; x }"));
    // Diverging condition
    assertEquals(1,warn("fn f(x) { if return x { 1 }; x }"));
  }

  @Test public void testCase() {
    assertEquals(1,warn("fn f(x) { case x { 0 -> return 1, _ -> return 2 }; x }"));
    assertEquals(0,warn("fn f(x) { case x { 0 -> return 1, _ -> 2 }; x }"));
    assertEquals(1,warn("fn f(x) { case (return x) { _ -> 2 }; x }"));
  }

  // A false guard falls through to a later arm, so only the arm bodies count
  @Test public void testGuards() {
    Block b = flow("fn f(x) { case x { n if n > 0 -> return n, _ -> return 0 }; print(x) }");
    assertEquals(1,warnings());
    assertTrue(b.at(0)._div);
    assertTrue(b.at(1)._dead);
    Case c = (Case)b.at(0);
    assertFalse(c.guard(0)._div);
    assertEquals(0,warn("fn f(x) { case x { n if n > 0 -> return n, n -> n }; x }"));
  }

  // Every stage runs, first to last
  @Test public void testPipe() {
    Block b = flow("fn f(x) { (return x) |> print; x }");
    assertEquals(1,warnings());
    assertTrue(b.at(0)._div);
    assertEquals(1,warn("fn f(x) { x |> g(return 1) |> print; x }"));
    assertEquals(0,warn("fn f(x) { x |> g(fn(y) { return y }) |> print; x }"));
  }

  // Only the left side of && and || always runs
  @Test public void testShortCircuit() {
    assertEquals(0,warn("fn f(x) { x && (return False); 1 }"));
    assertEquals(1,warn("fn f(x) { (return False) || x; 1 }"));
    assertEquals(1,warn("fn f(x) { x + (return 1); 1 }"));
    assertEquals(1,warn("fn f(x) { let y = g(x, return 1); y }"));
  }

  // Dead code is not analyzed again
  @Test public void testNestedDead() {
    assertEquals(1,warn("fn f() { return 1; { return 2; 3 } }"));
    assertEquals(2,warn("fn f(x) { if x { return 1; 2 } else { 3 }; { return 4; 5 } }"));
  }

  @Test public void testNestedBlock() {
    Block b = flow("fn f(x) { { print(x); return x }; 2 }");
    assertEquals(1,warnings());
    assertTrue(b.at(0)._div);
    assertTrue(b.at(1)._dead);
  }

  private int warn( String src ) { flow(src); return warnings(); }
}
