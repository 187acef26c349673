package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

/** "if cond { then } [else { else } | else if ...]".  The else arm is a Block,
 *  a nested If, or missing; without an else the value is Nil. */
public class If extends AST {
  public If( AST cond, Block t, AST f ) {
    super(cond,t,f);
    assert f==null || f instanceof Block || f instanceof If;
  }
  public AST cond() { return _kids.at(0); }
  public Block then() { return (Block)_kids.at(1); }
  public AST els() { return _kids.at(2); }

  @Override public SB str( SB sb ) {
    then().str(cond().str(sb.p("if ")).p(' '));
    return els()==null ? sb : els().str(sb.p(" else "));
  }
  @Override AST make( Ary<AST> kids ) { return new If(kids.at(0),(Block)kids.at(1),kids.at(2)); }
}
