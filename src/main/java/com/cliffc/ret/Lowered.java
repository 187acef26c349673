package com.cliffc.ret;

import com.cliffc.ret.ast.AST;
import com.cliffc.ret.ast.Def;
import com.cliffc.ret.lower.FunScope;
import com.cliffc.ret.util.Ary;

/** Per-definition output, handed to an emitter.  Under the native target the
 *  body is the original typed AST; under the restricted target it has no
 *  Return nodes.  A definition with errors has no body. */
public class Lowered {
  public final Def _def;
  public final AST _body;               // Null if the definition failed
  public final Ary<FunScope> _scopes;   // Function scopes by id, null if failed
  public final Target _target;
  Lowered( Def def, AST body, Ary<FunScope> scopes, Target target ) {
    _def = def;  _body = body;  _scopes = scopes;  _target = target;
  }
  public boolean failed() { return _body==null; }
  // Some scope of the definition has an early return
  public boolean has_ret() { return _scopes!=null && _scopes.any(fs -> fs._has_ret); }

  @Override public String toString() {
    return failed() ? _def._name+": failed" : _def.with(0,_body).toString();
  }
}
