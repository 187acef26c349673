package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// "const name [: T] = expr".  Not a function scope: a bare return here is an error.
public class ConstDef extends Def {
  public final TypeAnn _ann;
  public ConstDef( String name, TypeAnn ann, AST expr ) { super(name,expr); _ann = ann; }
  @Override public SB str( SB sb ) {
    sb.p("const ").p(_name);
    if( _ann!=null ) _ann.str(sb.p(": "));
    return body().str(sb.p(" = "));
  }
  @Override AST make( Ary<AST> kids ) { return new ConstDef(_name,_ann,kids.at(0)); }
}
