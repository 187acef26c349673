package com.cliffc.ret.ast;

import com.cliffc.ret.Loc;
import com.cliffc.ret.tvar.TV;
import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

import java.util.function.BiFunction;
import java.util.function.Function;

public abstract class AST {
  // AST is a Abstract Syntax *TREE*.  Missing kids (an absent else) are null.
  public final Ary<AST> _kids;
  public Loc _loc = Loc.NONE;   // Source span
  public TV _tv;                // Inferred type, set by Unify
  public boolean _div;          // Diverges, set by Flow
  public boolean _dead;         // Unreachable statement, set by Flow

  AST( Ary<AST> kids ) { _kids = kids; }
  AST( AST... kids ) { this(new Ary<>(kids)); }

  public AST at( int i ) { return _kids.at(i); }
  public int len() { return _kids._len; }

  @SuppressWarnings("unchecked")
  public <A extends AST> A loc( Loc loc ) { _loc = loc; return (A)this; }

  // Default toString
  @Override public final String toString() { return str(new SB()).toString(); }

  // Everybody has to have a pretty print
  abstract public SB str( SB sb );

  // Shallow rebuild around new kids; node-specific fields are kept
  abstract AST make( Ary<AST> kids );

  // Rebuild with new kids, keeping location and analysis results
  public final AST rebuild( Ary<AST> kids ) {
    AST ast = make(kids);
    ast._loc = _loc;  ast._tv = _tv;
    ast._div = _div;  ast._dead = _dead;
    return ast;
  }
  // Same node with kid i replaced
  public final AST with( int i, AST kid ) {
    Ary<AST> kids = _kids.copy();
    kids.set(i,kid);
    return rebuild(kids);
  }
  // Deep copy
  public AST copy() {
    Ary<AST> kids = new Ary<>(AST.class);
    for( AST kid : _kids ) kids.push(kid==null ? null : kid.copy());
    return rebuild(kids);
  }

  // Visit whole tree recursively, applying 'map' to self, and reducing that
  // with the recursive value from all children.
  public <T> T visit( Function<AST,T> map, BiFunction<T,T,T> reduce ) {
    T rez = map.apply(this);
    for( AST kid : _kids )
      if( kid!=null )
        rez = reduce.apply(rez,kid.visit(map,reduce));
    return rez;
  }

  // True if a Return for the current function scope is beneath.  Function
  // literals are their own scope, and stop the search.
  public boolean has_ret() {
    for( AST kid : _kids )
      if( kid!=null && kid.has_ret() )
        return true;
    return false;
  }
  // True if any Return at all is beneath, including inside function literals
  public boolean any_ret() { return visit(ast -> ast instanceof Return, (a,b) -> a||b); }

  // Binding precedence for printing operands; 0 is "needs no parens"
  int prec() { return 0; }
  // Print, wrapped in parens if a binary operator at this level would misparse
  final SB pwrap( SB sb, int prec ) {
    boolean wrap = (prec() > 0 && prec() < prec) || this instanceof If || this instanceof Case
      || this instanceof Return || this instanceof Lambda || this instanceof Pipe;
    if( wrap ) sb.p('(');
    str(sb);
    return wrap ? sb.p(')') : sb;
  }
}
