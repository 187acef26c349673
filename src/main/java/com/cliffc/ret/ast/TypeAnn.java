package com.cliffc.ret.ast;

import com.cliffc.ret.tvar.*;
import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

import java.util.HashMap;

/** A written type annotation.  Ground names, lowercase type variables, or
 *  "fn" with the parameter types followed by the result type as args. */
public class TypeAnn {
  public final String _name;
  public final Ary<TypeAnn> _args; // Only for fn
  public TypeAnn( String name ) { this(name,null); }
  public TypeAnn( String name, Ary<TypeAnn> args ) { _name = name; _args = args; }

  public boolean is_fn() { return _args!=null; }
  public boolean is_var() { return Character.isLowerCase(_name.charAt(0)) && !is_fn(); }

  // Build a type; same-named type variables share a leaf through 'vars'
  public TV tv( HashMap<String,TV> vars ) {
    if( is_fn() ) {
      TV[] args = new TV[_args._len-1];
      for( int i=0; i<args.length; i++ ) args[i] = _args.at(i).tv(vars);
      return new TVLambda(_args.last().tv(vars),args);
    }
    if( is_var() ) return vars.computeIfAbsent(_name, k -> new TVLeaf());
    return TVBase.make(_name);
  }

  public SB str( SB sb ) {
    if( !is_fn() ) return sb.p(_name);
    sb.p("fn(");
    for( int i=0; i<_args._len-1; i++ ) _args.at(i).str(sb).p(", ");
    if( _args._len>1 ) sb.unchar(2);
    return _args.last().str(sb.p(") -> "));
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
