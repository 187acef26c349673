package com.cliffc.ret.lower;

import com.cliffc.ret.Loc;

// Upstream data broke an invariant the lowering relies on.  Not user facing.
public class InternalFault extends RuntimeException {
  public final transient Loc _loc;
  public InternalFault( Loc loc, String msg ) { super(msg); _loc = loc; }
}
