package com.cliffc.ret.ast;

import com.cliffc.ret.util.SB;

// Case pattern: a literal, a binding variable, or the wildcard
public class Pat {
  public final Object _con;     // Literal to match, or null
  public final String _var;     // Variable to bind, or null
  public Pat( Object con, String var ) { _con = con; _var = var; }
  public static final Pat WILD = new Pat(null,null);
  public Pat rename( String var ) { return new Pat(null,var); }
  public SB str( SB sb ) {
    if( _con!=null ) return Con.str(sb,_con);
    return sb.p(_var==null ? "_" : _var);
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
