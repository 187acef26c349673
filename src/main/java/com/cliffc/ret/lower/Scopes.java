package com.cliffc.ret.lower;

import com.cliffc.ret.ErrMsg;
import com.cliffc.ret.Errs;
import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;

/** Scope resolver.  Stamps each Return with the id of the innermost enclosing
 *  function scope, and each function literal with its own id.  if, case and
 *  blocks make no scopes.  A case guard may not return from its function,
 *  though a function literal inside one may return from itself. */
public abstract class Scopes {

  // Returns the scopes of the definition, index by id; null if any Return is
  // outside every function scope (all such are reported).
  public static Ary<FunScope> resolve( Def def, Errs errs ) {
    Ary<FunScope> scopes = new Ary<>(FunScope.class);
    Ary<FunScope> stk = new Ary<>(FunScope.class);
    if( def instanceof FunDef )
      stk.push(scopes.push(new FunScope(0,-1,null)).last());
    int bad = walk(def.body(),scopes,stk,false,errs);
    return bad==0 ? scopes : null;
  }

  // Returns the count of misplaced Returns
  private static int walk( AST ast, Ary<FunScope> scopes, Ary<FunScope> stk, boolean guard, Errs errs ) {
    int bad = 0;
    if( ast instanceof Return ret ) {
      if( stk.isEmpty() ) { errs.add(ErrMsg.invalid_context(ret._loc)); bad++; }
      else if( guard ) { errs.add(ErrMsg.guard_return(ret._loc)); bad++; }
      else {
        FunScope fs = stk.last();
        ret._sid = fs._id;
        fs._has_ret = true;
      }
    }
    if( ast instanceof Lambda lam ) {
      FunScope fs = new FunScope(scopes._len,stk.isEmpty() ? -1 : stk.last()._id,lam);
      lam._sid = fs._id;
      stk.push(scopes.push(fs).last());
      guard = false;
    }
    for( int i=0; i<ast.len(); i++ )
      if( ast.at(i)!=null )
        bad += walk(ast.at(i),scopes,stk,guard || (ast instanceof Case && Case.is_guard(i)),errs);
    if( ast instanceof Lambda ) stk.pop();
    return bad;
  }
}
