package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// Local, argument or top-level definition reference
public class Ident extends AST {
  public final String _name;
  public Ident( String name ) { _name = name; }
  @Override public SB str( SB sb ) { return sb.p(_name); }
  @Override AST make( Ary<AST> kids ) { return new Ident(_name); }
}
