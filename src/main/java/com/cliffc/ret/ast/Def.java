package com.cliffc.ret.ast;

import com.cliffc.ret.tvar.TV;

/** Top-level definition.  Kid 0 is the body or initializer.  '_sig' is the
 *  type later definitions see, published once the definition's group is
 *  typed; it is never unified in place, only copied. */
public abstract class Def extends AST {
  public final String _name;
  public TV _sig;
  Def( String name, AST body ) { super(body); _name = name; }
  public AST body() { return _kids.at(0); }
}
