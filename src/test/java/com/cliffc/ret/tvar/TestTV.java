package com.cliffc.ret.tvar;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestTV {

  @Test public void testLeafBase() {
    TV a = new TVLeaf();
    a.unify(TVBase.tint());
    assertTrue(a.unified());
    assertEquals("Int",a.p());
    assertTrue(a.find() instanceof TVBase);
  }

  @Test public void testPrint() {
    TV a = new TVLeaf(), b = new TVLeaf();
    assertEquals("fn(A, Int) -> B",new TVLambda(b,a,TVBase.tint()).p());
    assertEquals("fn() -> Nil",new TVLambda(TVBase.tnil()).p());
    // Shared leaves print the same letter
    assertEquals("fn(A, fn(A) -> B) -> B",new TVLambda(b,a,new TVLambda(b,a)).p());
  }

  @Test public void testBaseMismatch() {
    assertFalse(TVBase.tint().unify_ok(TVBase.tstr()));
    assertTrue (TVBase.tint().unify_ok(TVBase.tint()));
  }

  // A failed unify leaves both sides as they were
  @Test public void testRollback() {
    TV a = new TVLeaf();
    TVLambda l = new TVLambda(a,a);                               // fn(A) -> A
    TVLambda r = new TVLambda(TVBase.tstr(),TVBase.tint());       // fn(Int) -> String
    try {
      l.unify(r);
      fail();
    } catch( UnifyErr e ) {
      assertEquals("Cannot unify fn(A) -> A and fn(Int) -> String",e.getMessage());
    }
    assertEquals("fn(A) -> A",l.p());
    assertFalse(l.unified());
    assertFalse(a.unified());
  }

  @Test public void testArity() {
    TV a = new TVLeaf();
    assertFalse(new TVLambda(a,a).unify_ok(new TVLambda(a,a,a)));
  }

  @Test(expected = UnifyErr.class)
  public void testOccurs() {
    TV a = new TVLeaf();
    a.unify(new TVLambda(TVBase.tint(),a));
  }

  @Test public void testFresh() {
    TV a = new TVLeaf();
    TVLambda id = new TVLambda(a,a);
    TVLambda f = (TVLambda)id.fresh();
    f.arg(0).unify(TVBase.tint());
    assertEquals("fn(Int) -> Int",f.p());
    assertEquals("fn(A) -> A",id.p());
    assertFalse(a.unified());
  }

  @Test public void testUnifyStructure() {
    TV a = new TVLeaf(), b = new TVLeaf();
    TVLambda l = new TVLambda(b,a);
    l.unify(new TVLambda(TVBase.tstr(),TVBase.tbool()));
    assertEquals("fn(Bool) -> String",l.p());
    assertEquals("Bool",a.p());
    assertEquals("String",b.p());
  }
}
