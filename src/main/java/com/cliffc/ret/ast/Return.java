package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

/** Early return.  Exits the innermost enclosing function scope, top-level
 *  function or function literal, with the value. */
public class Return extends AST {
  public int _sid = -1;         // Owning scope id, stamped by Scopes
  public Return( AST val ) { super(val); }
  public AST val() { return _kids.at(0); }
  @Override public boolean has_ret() { return true; }
  @Override public SB str( SB sb ) { return val().str(sb.p("return ")); }
  @Override AST make( Ary<AST> kids ) {
    Return ret = new Return(kids.at(0));
    ret._sid = _sid;
    return ret;
  }
}
