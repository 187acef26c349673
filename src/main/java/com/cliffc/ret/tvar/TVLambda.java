package com.cliffc.ret.tvar;

import com.cliffc.ret.util.SB;

import java.util.IdentityHashMap;

/** A function type.  Args in slots 0 to nargs-1, the return in the last slot. */
public class TVLambda extends TV {
  public TVLambda( TV ret, TV... args ) {
    super(new TV[args.length+1]);
    System.arraycopy(args,0,_args,0,args.length);
    _args[args.length] = ret;
  }
  private TVLambda( int len ) { super(new TV[len]); }

  public int nargs() { return _args.length-1; }
  public TV ret() { return arg(nargs()); }

  @Override boolean _unify_impl( TV that ) { return _args.length==that._args.length; }
  @Override TV _copy() { return new TVLambda(_args.length); }
  @Override SB _str( SB sb, IdentityHashMap<TV,String> names ) {
    sb.p("fn(");
    for( int i=0; i<nargs(); i++ )
      _args[i].str(sb,names).p(", ");
    if( nargs()>0 ) sb.unchar(2);
    return _args[nargs()].str(sb.p(") -> "),names);
  }
}
