package com.cliffc.ret.ast;

import com.cliffc.ret.tvar.TV;
import com.cliffc.ret.tvar.TVBase;
import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// Literal: Long, String, Boolean or Nil
public class Con extends AST {
  public final Object _con;
  public Con( Object con ) {
    assert con instanceof Long || con instanceof String || con instanceof Boolean || con instanceof Nil;
    _con = con;
  }
  public static Con nil() { return new Con(Nil.NIL); }

  public TV tv() {
    if( _con instanceof Long    ) return TVBase.tint ();
    if( _con instanceof String  ) return TVBase.tstr ();
    if( _con instanceof Boolean ) return TVBase.tbool();
    return TVBase.tnil();
  }

  @Override public SB str( SB sb ) { return str(sb,_con); }
  static SB str( SB sb, Object con ) {
    if( con instanceof String s ) return sb.pq(s);
    if( con instanceof Boolean b ) return sb.p(b ? "True" : "False");
    return sb.p(con.toString());
  }
  @Override AST make( Ary<AST> kids ) { return new Con(_con); }
}
