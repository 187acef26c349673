package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// Prefix "-" (Int) and "!" (Bool)
public class Unary extends AST {
  static final int PREC = 7;
  public final String _op;
  public Unary( String op, AST kid ) { super(kid); _op = op; }
  public AST kid() { return _kids.at(0); }
  @Override int prec() { return PREC; }
  @Override public SB str( SB sb ) { return kid().pwrap(sb.p(_op),PREC+1); }
  @Override AST make( Ary<AST> kids ) { return new Unary(_op,kids.at(0)); }
}
