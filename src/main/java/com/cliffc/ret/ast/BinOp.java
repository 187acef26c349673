package com.cliffc.ret.ast;

import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

// Infix operators, left associative
public class BinOp extends AST {
  public final String _op;
  public BinOp( String op, AST l, AST r ) { super(l,r); _op = op; assert prec(op)>0 : op; }
  public AST lhs() { return _kids.at(0); }
  public AST rhs() { return _kids.at(1); }

  // Operator precedence, higher binds tighter; 0 if not a binary operator
  public static int prec( String op ) {
    switch( op ) {
    case "||": return 1;
    case "&&": return 2;
    case "==": case "!=": return 3;
    case "<": case "<=": case ">": case ">=": return 4;
    case "+": case "-": case "<>": return 5;
    case "*": case "/": case "%": return 6;
    default: return 0;
    }
  }
  // Short-circuit operators only evaluate the right side sometimes
  public boolean is_short() { return _op.equals("&&") || _op.equals("||"); }

  @Override int prec() { return prec(_op); }
  @Override public SB str( SB sb ) {
    lhs().pwrap(sb,prec()).p(' ').p(_op).p(' ');
    return rhs().pwrap(sb,prec()+1);
  }
  @Override AST make( Ary<AST> kids ) { return new BinOp(_op,kids.at(0),kids.at(1)); }
}
