package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

/** A statement sequence; evaluates to its last statement, or Nil when empty.
 *  Function bodies, if arms and nested blocks. */
public class Block extends AST {
  public Block( Ary<AST> stmts ) { super(stmts); }
  public Block( AST... stmts ) { super(stmts); }

  // Statements in the live prefix; unreachable trailing statements dropped
  public Ary<AST> live() {
    Ary<AST> live = new Ary<>(AST.class);
    for( AST stmt : _kids )
      if( !stmt._dead )
        live.push(stmt);
    return live;
  }
  // The last live statement, or null
  public AST last_live() {
    for( int i=len()-1; i>=0; i-- )
      if( !at(i)._dead )
        return at(i);
    return null;
  }

  @Override public SB str( SB sb ) {
    return len()==0 ? sb.p("{ }") : stmts(sb.p("{ ")).p(" }");
  }
  // Statements only, separated by "; "
  public SB stmts( SB sb ) {
    for( AST stmt : _kids )
      stmt.str(sb).p("; ");
    return len()==0 ? sb : sb.unchar(2);
  }
  public String stmts() { return stmts(new SB()).toString(); }
  @Override AST make( Ary<AST> kids ) { return new Block(kids); }
}
