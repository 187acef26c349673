package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// Statement only: "let x [: T] = val"; the rest of the sequence sees x
public class Let extends AST {
  public final String _name;
  public final TypeAnn _ann;    // Optional
  public Let( String name, TypeAnn ann, AST val ) { super(val); _name = name; _ann = ann; }
  public AST val() { return _kids.at(0); }
  @Override public SB str( SB sb ) {
    sb.p("let ").p(_name);
    if( _ann!=null ) _ann.str(sb.p(": "));
    return val().str(sb.p(" = "));
  }
  @Override AST make( Ary<AST> kids ) { return new Let(_name,_ann,kids.at(0)); }
}
