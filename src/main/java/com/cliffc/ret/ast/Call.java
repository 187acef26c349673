package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// fun(args...).  Kid 0 is the callee, evaluated first; then args left to right.
public class Call extends AST {
  public Call( Ary<AST> kids ) { super(kids); }
  public AST fun() { return _kids.at(0); }
  public int nargs() { return _kids._len-1; }
  public AST arg( int i ) { return _kids.at(i+1); }

  @Override public SB str( SB sb ) {
    fun().pwrap(sb,Unary.PREC+1).p('(');
    for( int i=0; i<nargs(); i++ )
      arg(i).str(sb).p(", ");
    if( nargs()>0 ) sb.unchar(2);
    return sb.p(')');
  }
  @Override AST make( Ary<AST> kids ) { return new Call(kids); }
}
