package com.cliffc.ret.lower;

import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;

import java.util.HashSet;

/** The rest of the computation after a value is produced, at compile time
 *  only.  Applying a continuation to a value splices the remaining
 *  statements after it; it is never a runtime closure. */
abstract class Cont {
  private HashSet<String> _names;
  // Every name the rest of the computation mentions.  A binding spliced in
  // front of it must not capture any of these.
  final HashSet<String> names() {
    if( _names==null ) { _names = new HashSet<>(); names(_names); }
    return _names;
  }
  abstract void names( HashSet<String> names );

  static void names( AST ast, HashSet<String> names ) {
    ast.visit(a -> {
        if( a instanceof Ident id ) names.add(id._name);
        if( a instanceof Let let ) names.add(let._name);
        if( a instanceof Lambda lam ) for( String arg : lam._args ) names.add(arg);
        if( a instanceof Case kase ) for( Pat pat : kase._pats ) if( pat._var!=null ) names.add(pat._var);
        return null;
      }, (x,y) -> null);
  }

  // The value is the scope's result
  static final class Ret extends Cont {
    static final Ret RET = new Ret();
    @Override void names( HashSet<String> names ) { }
    @Override public String toString() { return "ret"; }
  }

  // Discard the value, then run statements [_i,len) of '_ss', then '_next'
  static final class Seq extends Cont {
    final Ary<AST> _ss;  final int _i;  final Cont _next;
    Seq( Ary<AST> ss, int i, Cont next ) { assert i < ss._len; _ss = ss; _i = i; _next = next; }
    @Override void names( HashSet<String> names ) {
      for( int i=_i; i<_ss._len; i++ ) names(_ss.at(i),names);
      names.addAll(_next.names());
    }
    @Override public String toString() { return "seq"+_i+"."+_next; }
  }

  // Bind the value as '_let' does, then run statements [_i,len) of '_ss',
  // then '_next'.  With no statements left the bound value flows to '_next'.
  static final class Bind extends Cont {
    final Let _let;  final Ary<AST> _ss;  final int _i;  final Cont _next;
    Bind( Let let, Ary<AST> ss, int i, Cont next ) { _let = let; _ss = ss; _i = i; _next = next; }
    @Override void names( HashSet<String> names ) {
      names.add(_let._name);
      for( int i=_i; i<_ss._len; i++ ) names(_ss.at(i),names);
      names.addAll(_next.names());
    }
    @Override public String toString() { return "let "+_let._name+"."+_next; }
  }

  // Discard the value, then hand Nil to '_next'.  The then-arm of an if with no else.
  static final class Drop extends Cont {
    final Cont _next;
    Drop( Cont next ) { _next = next; }
    @Override void names( HashSet<String> names ) { names.addAll(_next.names()); }
    @Override public String toString() { return "drop."+_next; }
  }

  // Put the value in kid '_idx' of '_tmpl', continue evaluating '_tmpl', then '_next'
  static final class Plug extends Cont {
    final AST _tmpl;  final int _idx;  final Cont _next;
    Plug( AST tmpl, int idx, Cont next ) { _tmpl = tmpl; _idx = idx; _next = next; }
    @Override void names( HashSet<String> names ) {
      for( int i=0; i<_tmpl.len(); i++ )
        if( i!=_idx && _tmpl.at(i)!=null )
          names(_tmpl.at(i),names);
      if( _tmpl instanceof Case kase )
        for( Pat pat : kase._pats ) if( pat._var!=null ) names.add(pat._var);
      names.addAll(_next.names());
    }
    @Override public String toString() { return "plug"+_idx+"."+_next; }
  }
}
