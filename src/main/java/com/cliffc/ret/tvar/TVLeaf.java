package com.cliffc.ret.tvar;

import com.cliffc.ret.util.SB;
import com.cliffc.ret.util.Util;

import java.util.IdentityHashMap;

// An unconstrained type; unifies with anything not containing itself.
public class TVLeaf extends TV {
  public TVLeaf() { super(); }
  // Leafs always fold into the other side before this is reached
  @Override boolean _unify_impl( TV that ) { throw new IllegalStateException(); }
  @Override TV _copy() { return new TVLeaf(); }
  @Override SB _str( SB sb, IdentityHashMap<TV,String> names ) {
    return sb.p(names.computeIfAbsent(this, k -> Util.vname(names.size())));
  }
}
