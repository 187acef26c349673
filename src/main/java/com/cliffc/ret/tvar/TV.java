package com.cliffc.ret.tvar;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

import java.util.IdentityHashMap;

/** Type variable base class
 *
 * Type variables can unify (ala Tarjan Union-Find), and can have structure
 * such as "fn(A, Int) -> A".  Monomorphic within one definition; references to
 * sibling definitions get a fresh copy of the sibling's signature.
 *
 * Unification is all-or-nothing: a failed unify rolls back every union it
 * made and throws UnifyErr, so both sides still print as they were.  Inside
 * unify no path compression happens, which keeps the rollback log to union
 * edges only.
 *
 * BNF for the pretty-printed types:
 *    T = A | B | ...           // Leaf, named in printing order
 *        Int | Bool | String | Nil
 *        fn(T*) -> T           // Lambda, arg count is significant
 */
abstract public class TV {
  // Disjoint Set Union set-leader.  Null if self is leader.
  TV _uf;

  // Outgoing edges for structural recursion.
  final TV[] _args;

  TV( TV... args ) { _args = args; }

  // True if this a set member not leader.
  public boolean unified() { return _uf!=null; }

  // Find the leader, without rollup.  Safe on types shared across threads.
  public TV debug_find() {
    TV u = this;
    while( u._uf!=null ) u = u._uf;
    return u;
  }

  // Find the leader, with rollup.  Only on types owned by the caller.
  public TV find() {
    if( _uf    ==null ) return this; // Shortcut
    if( _uf._uf==null ) return _uf;  // Unrolled once shortcut
    TV leader = debug_find();
    TV u = this;
    while( u!=leader ) { TV next = u._uf; u._uf=leader; u=next; }
    return leader;
  }

  // Fetch a specific arg index, with rollups
  public TV arg( int i ) { return _args[i].find(); }

  // -------------------------------------------------------------
  // Unify this and that, or throw UnifyErr and leave both unchanged.
  public void unify( TV that ) {
    Ary<TV> log = new Ary<>(TV.class);
    if( _unify(that,log) ) return;
    for( int i=log._len-1; i>=0; i-- )
      log.at(i)._uf = null;     // Roll back
    throw new UnifyErr(this,that);
  }
  // True if unify would succeed; no side effects
  public boolean unify_ok( TV that ) {
    Ary<TV> log = new Ary<>(TV.class);
    boolean ok = _unify(that,log);
    for( int i=log._len-1; i>=0; i-- )
      log.at(i)._uf = null;
    return ok;
  }

  private boolean _unify( TV that, Ary<TV> log ) {
    TV a = debug_find(), b = that.debug_find();
    if( a==b ) return true;
    if( a instanceof TVLeaf ) return a._union(b,log);
    if( b instanceof TVLeaf ) return b._union(a,log);
    if( a.getClass()!=b.getClass() || !a._unify_impl(b) ) return false;
    // Union before recursing, so cycles through this pair stop at a==b
    a._union(b,log);
    for( int i=0; i<a._args.length; i++ )
      if( !a._args[i]._unify(b._args[i],log) )
        return false;
    return true;
  }
  private boolean _union( TV that, Ary<TV> log ) {
    assert _uf==null && that._uf==null;
    if( this instanceof TVLeaf && that._occurs(this) )
      return false;             // Recursive type
    _uf = that;
    log.push(this);
    return true;
  }
  // Subclass specific check that the two structures are alike
  abstract boolean _unify_impl( TV that );

  // True if leaf appears in this type
  boolean _occurs( TV leaf ) {
    TV t = debug_find();
    if( t==leaf ) return true;
    for( TV arg : t._args )
      if( arg._occurs(leaf) )
        return true;
    return false;
  }

  // -------------------------------------------------------------
  // A structural copy with new leaves.  Reads only, so it is safe on types
  // shared between threads.  The copy has no union edges at all.
  public TV fresh() { return _fresh(new IdentityHashMap<>()); }
  private TV _fresh( IdentityHashMap<TV,TV> vars ) {
    TV t = debug_find();
    TV f = vars.get(t);
    if( f!=null ) return f;
    vars.put(t,f = t._copy());
    for( int i=0; i<t._args.length; i++ )
      f._args[i] = t._args[i]._fresh(vars);
    return f;
  }
  // Same kind, args unfilled
  abstract TV _copy();

  // -------------------------------------------------------------
  // Pretty print, naming leaves in order of appearance
  public final String p() { return str(new SB(),new IdentityHashMap<>()).toString(); }
  @Override public final String toString() { return p(); }
  public final SB str( SB sb, IdentityHashMap<TV,String> names ) {
    return debug_find()._str(sb,names);
  }
  abstract SB _str( SB sb, IdentityHashMap<TV,String> names );
}
