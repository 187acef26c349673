package com.cliffc.ret.tvar;

// Failed unification.  Both sides are unchanged when this is thrown.
public class UnifyErr extends RuntimeException {
  public final transient TV _t0, _t1;
  UnifyErr( TV t0, TV t1 ) {
    super("Cannot unify "+t0.p()+" and "+t1.p(),null,false,false);
    _t0=t0; _t1=t1;
  }
}
