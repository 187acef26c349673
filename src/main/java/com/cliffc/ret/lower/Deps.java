package com.cliffc.ret.lower;

import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;

/** Typing order of top-level definitions.
 *
 *  Groups are the strongly connected components of the reference graph
 *  (Tarjan), listed dependencies first.  A group's level is one more than the
 *  highest level of any group it references, so groups of one level never
 *  reference each other and can be typed in parallel once the lower levels
 *  are done.  A constant never depends on itself or a later constant; such
 *  references stay unknown.
 */
public class Deps {
  public static class Group {
    public final Ary<Def> _defs = new Ary<>(Def.class); // Definition order
    public int _level;
    @Override public String toString() {
      StringBuilder sb = new StringBuilder().append(_level).append(':');
      for( Def def : _defs ) sb.append(' ').append(def._name);
      return sb.toString();
    }
  }

  private final Ary<Def> _defs;
  private final int[][] _edges;
  private final int[] _index, _low;
  private final boolean[] _on;
  private final Group[] _group;
  private final Ary<Integer> _stk = new Ary<>(Integer.class);
  private final Ary<Group> _groups = new Ary<>(Group.class);
  private int _cnt;

  private Deps( Ary<Def> defs ) {
    _defs = defs;
    int n = defs._len;
    HashMap<String,Integer> idx = new HashMap<>();
    for( int i=0; i<n; i++ ) idx.put(defs.at(i)._name,i);
    _edges = new int[n][];
    for( int i=0; i<n; i++ ) {
      Def def = defs.at(i);
      Ary<Integer> es = new Ary<>(Integer.class);
      for( String ref : refs(def) ) {
        Integer j = idx.get(ref);
        if( j==null ) continue;   // Primitive or unknown
        if( def instanceof ConstDef && defs.at(j) instanceof ConstDef && j >= i ) continue;
        es.push(j);
      }
      _edges[i] = new int[es._len];
      for( int k=0; k<es._len; k++ ) _edges[i][k] = es.at(k);
    }
    _index = new int[n];
    _low = new int[n];
    _on = new boolean[n];
    _group = new Group[n];
  }

  public static Ary<Group> groups( Ary<Def> defs ) {
    Deps deps = new Deps(defs);
    for( int i=0; i<defs._len; i++ )
      if( deps._index[i]==0 )
        deps.visit(i);
    return deps._groups;
  }

  private void visit( int v ) {
    _index[v] = _low[v] = ++_cnt;
    _stk.push(v);
    _on[v] = true;
    for( int w : _edges[v] ) {
      if( _index[w]==0 ) { visit(w); _low[v] = Math.min(_low[v],_low[w]); }
      else if( _on[w] ) _low[v] = Math.min(_low[v],_index[w]);
    }
    if( _low[v]!=_index[v] ) return;
    // v roots a component; everything it references is already grouped
    Group grp = new Group();
    Ary<Integer> mems = new Ary<>(Integer.class);
    int w;
    do {
      w = _stk.pop();
      _on[w] = false;
      _group[w] = grp;
      mems.push(w);
    } while( w!=v );
    Arrays.sort(mems._es,0,mems._len);
    for( int m : mems ) {
      grp._defs.push(_defs.at(m));
      for( int x : _edges[m] )
        if( _group[x]!=grp )
          grp._level = Math.max(grp._level,_group[x]._level+1);
    }
    _groups.push(grp);
  }

  // Top-level names used free in the definition
  public static HashSet<String> refs( Def def ) {
    HashSet<String> bound = new HashSet<>(), refs = new HashSet<>();
    if( def instanceof FunDef fd )
      for( String arg : fd._args ) bound.add(arg);
    free(def.body(),bound,refs);
    return refs;
  }
  private static void free( AST ast, HashSet<String> bound, HashSet<String> refs ) {
    if( ast instanceof Ident id ) {
      if( !bound.contains(id._name) ) refs.add(id._name);
      return;
    }
    if( ast instanceof Block blk ) {
      HashSet<String> b = new HashSet<>(bound);
      for( AST stmt : blk._kids ) {
        free(stmt,b,refs);      // A let value does not see its own name
        if( stmt instanceof Let let ) b.add(let._name);
      }
      return;
    }
    if( ast instanceof Lambda lam ) {
      HashSet<String> b = new HashSet<>(bound);
      for( String arg : lam._args ) b.add(arg);
      free(lam.body(),b,refs);
      return;
    }
    if( ast instanceof Case kase ) {
      free(kase.subject(),bound,refs);
      for( int i=0; i<kase.narms(); i++ ) {
        HashSet<String> b = bound;
        if( kase.pat(i)._var!=null ) { b = new HashSet<>(bound); b.add(kase.pat(i)._var); }
        if( kase.guard(i)!=null ) free(kase.guard(i),b,refs);
        free(kase.arm(i),b,refs);
      }
      return;
    }
    for( AST kid : ast._kids )
      if( kid!=null )
        free(kid,bound,refs);
  }
}
