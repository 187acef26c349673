package com.cliffc.ret.ast;

import com.cliffc.ret.tvar.TV;
import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// "first |> stage |> ...".  Kid 0 is the first value, kid i+1 is stage i.  A
// stage is called with the value so far in front of its own arguments:
// "x |> f(b)" is f(x, b) and "x |> f" is f(x).  Left to right, the callee
// and arguments of a stage are evaluated after the value piped into it.
public class Pipe extends AST {
  public TV[] _outs;            // Result type of each stage, set by Unify
  public Pipe( Ary<AST> kids ) { super(kids); assert kids._len > 1; }
  public AST first() { return _kids.at(0); }
  public int nstages() { return _kids._len-1; }
  public AST stage( int i ) { return _kids.at(i+1); }

  // Stage i as a plain call on 'prev', typed as the stage result
  public Call call( int i, AST prev ) {
    AST s = stage(i);
    Ary<AST> kids = new Ary<>(AST.class);
    if( s instanceof Call c ) {
      kids.push(c.fun()).push(prev);
      for( int j=0; j<c.nargs(); j++ ) kids.push(c.arg(j));
    } else kids.push(s).push(prev);
    Call call = new Call(kids).loc(s._loc);
    if( _outs!=null ) call._tv = _outs[i];
    return call;
  }

  @Override public SB str( SB sb ) {
    first().pwrap(sb,1);
    for( int i=0; i<nstages(); i++ )
      stage(i).pwrap(sb.p(" |> "),Unary.PREC+1);
    return sb;
  }
  @Override AST make( Ary<AST> kids ) {
    Pipe pipe = new Pipe(kids);
    pipe._outs = _outs;
    return pipe;
  }
}
