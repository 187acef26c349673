package com.cliffc.ret;

import com.cliffc.ret.tvar.*;

// Primitive functions visible to every definition, unless shadowed
public enum Prim {
  PRINT("print"),               // fn(a) -> Nil, records an effect
  INT_TO_STRING("int_to_string"), // fn(Int) -> String
  WITH("with");                 // fn(a, fn(a) -> b) -> b, the canonical "use" target

  public final String _name;
  Prim( String name ) { _name = name; }

  public static Prim find( String name ) {
    for( Prim p : values() )
      if( p._name.equals(name) )
        return p;
    return null;
  }

  // A new signature per use
  public TV sig() {
    switch( this ) {
    case PRINT: return new TVLambda(TVBase.tnil(),new TVLeaf());
    case INT_TO_STRING: return new TVLambda(TVBase.tstr(),TVBase.tint());
    case WITH: {
      TV a = new TVLeaf(), b = new TVLeaf();
      return new TVLambda(b,a,new TVLambda(b,a));
    }
    default: throw RET.TODO();
    }
  }
}
