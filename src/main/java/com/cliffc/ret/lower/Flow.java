package com.cliffc.ret.lower;

import com.cliffc.ret.ErrMsg;
import com.cliffc.ret.Errs;
import com.cliffc.ret.ast.*;

/** Control-flow analyzer.  Sets '_div' on every reachable node, and '_dead'
 *  on every statement following the first diverging statement of its
 *  sequence.  One UnreachableCode warning covers each dead run. */
public abstract class Flow {

  public static void flow( Def def, Errs errs ) { div(def.body(),errs); }

  // Compute divergence bottom-up; true if this node always exits its scope
  static boolean div( AST ast, Errs errs ) {
    boolean d;
    if( ast instanceof Block blk ) d = block(blk,errs);
    else if( ast instanceof Return ret ) { div(ret.val(),errs); d = true; }
    else if( ast instanceof Lambda lam ) { div(lam.body(),errs); d = false; }
    else if( ast instanceof If iff ) {
      boolean c = div(iff.cond(),errs);
      boolean t = div(iff.then(),errs);
      boolean f = iff.els()!=null && div(iff.els(),errs);
      d = c || (t && f);
    } else if( ast instanceof Case kase ) {
      // Guards hold no Return; a false one only falls through to the next arm
      d = div(kase.subject(),errs);
      boolean all = kase.narms()>0;
      for( int i=0; i<kase.narms(); i++ ) {
        if( kase.guard(i)!=null ) div(kase.guard(i),errs);
        all &= div(kase.arm(i),errs);
      }
      d |= all;
    } else if( ast instanceof BinOp bin && bin.is_short() ) {
      d = div(bin.lhs(),errs);
      div(bin.rhs(),errs);      // Only sometimes evaluated
    } else {
      // Let, Call, Pipe, BinOp, Unary: every kid is evaluated unconditionally
      d = false;
      for( AST kid : ast._kids )
        d |= div(kid,errs);
    }
    return ast._div = d;
  }

  // A sequence diverges if its last live statement does
  private static boolean block( Block blk, Errs errs ) {
    int i=0;
    for( ; i<blk.len(); i++ )
      if( div(blk.at(i),errs) ) break;
    if( i >= blk.len()-1 ) return i < blk.len();
    // Trailing run is dead, one warning covers all of it
    for( int j=i+1; j<blk.len(); j++ )
      blk.at(j)._dead = true;
    errs.add(ErrMsg.unreachable(blk.at(i+1)._loc.to(blk.at(blk.len()-1)._loc)));
    return true;
  }
}
