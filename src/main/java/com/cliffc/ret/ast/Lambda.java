package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

/** Anonymous function literal, "fn(x, y: Int) -> T { body }".  A new function
 *  scope: returns inside exit this literal, never the enclosing function.  The
 *  callback of a "use" statement is one of these, flagged '_use'. */
public class Lambda extends AST {
  public final Ary<String> _args;
  public final Ary<TypeAnn> _anns; // Per-arg annotation, null entries if absent
  public final TypeAnn _ret;       // Optional result annotation
  public final boolean _use;       // Desugared "use" callback
  public int _sid = -1;            // Scope id, stamped by Scopes

  public Lambda( Ary<String> args, Ary<TypeAnn> anns, TypeAnn ret, Block body, boolean use ) {
    super(body);
    assert args._len==anns._len;
    _args = args;  _anns = anns;  _ret = ret;  _use = use;
  }
  public Block body() { return (Block)_kids.at(0); }
  public int nargs() { return _args._len; }

  // Function literals are their own scope
  @Override public boolean has_ret() { return false; }

  @Override public SB str( SB sb ) {
    params(sb.p("fn"),_args,_anns);
    if( _ret!=null ) _ret.str(sb.p(" -> "));
    return body().str(sb.p(' '));
  }
  static SB params( SB sb, Ary<String> args, Ary<TypeAnn> anns ) {
    sb.p('(');
    for( int i=0; i<args._len; i++ ) {
      sb.p(args.at(i));
      if( anns.at(i)!=null ) anns.at(i).str(sb.p(": "));
      sb.p(", ");
    }
    if( args._len>0 ) sb.unchar(2);
    return sb.p(')');
  }
  @Override AST make( Ary<AST> kids ) {
    Lambda lam = new Lambda(_args,_anns,_ret,(Block)kids.at(0),_use);
    lam._sid = _sid;
    return lam;
  }
}
