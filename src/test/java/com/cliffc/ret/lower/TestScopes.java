package com.cliffc.ret.lower;

import com.cliffc.ret.ErrMsg;
import com.cliffc.ret.Errs;
import com.cliffc.ret.Unit;
import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestScopes {

  static Def def( String src, String name ) {
    Unit unit = Unit.parse("t.ret",src);
    assertEquals(unit._errs.toString(),0,unit._errs.size());
    return unit.def(name);
  }
  // All Returns, in textual order
  static Ary<Return> rets( AST ast ) {
    Ary<Return> rets = new Ary<>(Return.class);
    ast.visit(a -> { if( a instanceof Return r ) rets.push(r); return null; },(a,b) -> null);
    return rets;
  }

  @Test public void testFunction() {
    Def f = def("fn f(x) { if x > 0 { return 1 } return 2 }","f");
    Errs errs = new Errs();
    Ary<FunScope> scopes = Scopes.resolve(f,errs);
    assertEquals(1,scopes._len);
    assertTrue(scopes.at(0)._has_ret);
    assertEquals(-1,scopes.at(0)._par);
    for( Return r : rets(f.body()) ) assertEquals(0,r._sid);
    assertEquals(0,errs.size());
  }

  @Test public void testNoReturn() {
    Def f = def("fn f(x) { let g = fn(y) { y }; g(x) }","f");
    Ary<FunScope> scopes = Scopes.resolve(f,new Errs());
    assertEquals(2,scopes._len);
    assertFalse(scopes.at(0)._has_ret);
    assertFalse(scopes.at(1)._has_ret);
  }

  // A return inside a function literal belongs to the literal
  @Test public void testClosure() {
    Def f = def("fn f(x) {\n  let g = fn(y) { if y > 0 { return y } y + 1 }\n  if x > 0 { return g(x) }\n  x\n}","f");
    Ary<FunScope> scopes = Scopes.resolve(f,new Errs());
    assertEquals(2,scopes._len);
    assertTrue(scopes.at(0)._has_ret);
    assertTrue(scopes.at(1)._has_ret);
    assertEquals(0,scopes.at(1)._par);
    Ary<Return> rets = rets(f.body());
    assertEquals(1,rets.at(0)._sid);
    assertEquals(0,rets.at(1)._sid);
  }

  // Pre-order numbering; only the literal with the return is marked
  @Test public void testNesting() {
    Def f = def("fn f() { let a = fn() { fn() { return 1 } }; let b = fn() { 2 }; use x <- with(3); return x }","f");
    Ary<FunScope> scopes = Scopes.resolve(f,new Errs());
    assertEquals(5,scopes._len);
    assertEquals(-1,scopes.at(0)._par);
    assertEquals( 0,scopes.at(1)._par);
    assertEquals( 1,scopes.at(2)._par);
    assertEquals( 0,scopes.at(3)._par);
    assertEquals( 0,scopes.at(4)._par);
    assertFalse(scopes.at(0)._has_ret);
    assertFalse(scopes.at(1)._has_ret);
    assertTrue (scopes.at(2)._has_ret);
    assertFalse(scopes.at(3)._has_ret);
    assertTrue (scopes.at(4)._has_ret); // The use callback
    assertTrue(scopes.at(4)._lam._use);
  }

  @Test public void testConst() {
    Def c = def("const c = fn() { return 1 }","c");
    Ary<FunScope> scopes = Scopes.resolve(c,new Errs());
    assertEquals(1,scopes._len);
    assertEquals(-1,scopes.at(0)._par);
    assertTrue(scopes.at(0)._has_ret);
  }

  // Every misplaced return is reported
  @Test public void testInvalidContext() {
    Def c = def("const c = { print(return 1); return 2 }","c");
    Errs errs = new Errs();
    assertNull(Scopes.resolve(c,errs));
    assertEquals(2,errs.size());
    for( ErrMsg err : errs.sorted() ) {
      assertEquals(ErrMsg.Level.InvalidContext,err._lvl);
      assertEquals("Return outside of a function",err._msg);
    }
  }

  // A guard decides the arm; it cannot leave the function
  @Test public void testGuard() {
    Def f = def("fn f(x) { case x { n if return True -> 1, _ -> 0 } }","f");
    Errs errs = new Errs();
    assertNull(Scopes.resolve(f,errs));
    assertEquals(1,errs.size());
    ErrMsg err = errs.sorted().at(0);
    assertEquals(ErrMsg.Level.InvalidContext,err._lvl);
    assertEquals("Return inside a case guard",err._msg);
    // A function literal in a guard returns from itself
    f = def("fn f(x) { case x { n if (fn() { return n > 0 })() -> return 1, _ -> 0 } }","f");
    errs = new Errs();
    Ary<FunScope> scopes = Scopes.resolve(f,errs);
    assertEquals(0,errs.size());
    assertEquals(2,scopes._len);
    Ary<Return> rets = rets(f.body());
    assertEquals(1,rets.at(0)._sid);
    assertEquals(0,rets.at(1)._sid);
  }
}
