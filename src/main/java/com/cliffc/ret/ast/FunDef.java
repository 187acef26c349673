package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// "fn name(args) [-> T] { body }"
public class FunDef extends Def {
  public final Ary<String> _args;
  public final Ary<TypeAnn> _anns; // Per-arg annotation, null entries if absent
  public final TypeAnn _ret;       // Optional result annotation
  public FunDef( String name, Ary<String> args, Ary<TypeAnn> anns, TypeAnn ret, Block body ) {
    super(name,body);
    assert args._len==anns._len;
    _args = args;  _anns = anns;  _ret = ret;
  }
  @Override public Block body() { return (Block)_kids.at(0); }
  public int nargs() { return _args._len; }

  @Override public SB str( SB sb ) {
    Lambda.params(sb.p("fn ").p(_name),_args,_anns);
    if( _ret!=null ) _ret.str(sb.p(" -> "));
    return body().str(sb.p(' '));
  }
  @Override AST make( Ary<AST> kids ) { return new FunDef(_name,_args,_anns,_ret,(Block)kids.at(0)); }
}
