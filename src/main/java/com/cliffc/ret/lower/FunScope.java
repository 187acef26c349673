package com.cliffc.ret.lower;

import com.cliffc.ret.Loc;
import com.cliffc.ret.ast.Lambda;
import com.cliffc.ret.tvar.TV;

/** A function-like scope: the top-level function (id 0) or a function
 *  literal.  Ids are dense per definition, numbered in pre-order. */
public class FunScope {
  public final int _id;
  public final int _par;        // Enclosing scope id, or -1
  public final Lambda _lam;     // Null for the top-level function
  public boolean _has_ret;      // Some Return exits this scope
  public TV _tv;                // Result type, set by Unify
  Loc _first;                   // First Return that typed the result, set by Unify
  FunScope( int id, int par, Lambda lam ) { _id = id; _par = par; _lam = lam; }
  @Override public String toString() {
    return "scope"+_id+(_par==-1 ? "" : "^"+_par)+(_has_ret ? " returns" : "")+(_tv==null ? "" : " "+_tv.p());
  }
}
