package com.cliffc.ret;

import com.cliffc.ret.ast.*;
import com.cliffc.ret.exe.Eval;
import com.cliffc.ret.lower.*;
import com.cliffc.ret.tvar.TV;
import com.cliffc.ret.tvar.TVLeaf;
import com.cliffc.ret.util.Ary;
import org.cliffc.high_scale_lib.NonBlockingHashMap;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.HashMap;

/** A compilation unit: the top-level definitions of one source.
 *
 *  Compiling runs Scopes, Flow, Unify and, for the restricted target, Cps
 *  over each definition.  Definitions are typed in dependency order (see
 *  {@link Deps}): a group of mutually referencing definitions shares its
 *  function signatures while being typed, then publishes the inferred ones.
 *  Groups of the same level lower in parallel, one group per worker.  A
 *  definition with errors fails alone.  Later duplicates of a name are
 *  reported and dropped.
 */
public class Unit {
  public final String _name;
  public final Ary<Def> _defs;
  public final Errs _errs = new Errs();
  private final HashMap<String,Def> _byname = new HashMap<>();
  private final NonBlockingHashMap<String,Lowered> _out = new NonBlockingHashMap<>();
  private volatile boolean _cancel;
  private Target _target;

  public Unit( String name, Ary<Def> defs ) {
    _name = name;
    _defs = new Ary<>(Def.class);
    for( Def def : defs )
      if( _byname.putIfAbsent(def._name,def)==null ) _defs.push(def);
      else _errs.add(ErrMsg.syntax(def._loc,"Duplicate definition '"+def._name+"'"));
  }

  // Parse a source; a syntax error leaves a unit with no definitions
  public static @NotNull Unit parse( String name, String src ) {
    try {
      return new Unit(name,new Parse(name,src).unit());
    } catch( Parse.Err e ) {
      Unit unit = new Unit(name,new Ary<>(Def.class));
      unit._errs.add(e._err);
      return unit;
    }
  }

  public Unit compile( Target target ) {
    if( _target!=null ) throw new IllegalStateException("Unit "+_name+" already compiled");
    _target = target;
    Ary<Deps.Group> groups = Deps.groups(_defs);
    int levels = 0;
    for( Deps.Group grp : groups ) levels = Math.max(levels,grp._level+1);
    // Each level only reads signatures published by the levels below
    for( int l=0; l<levels && !_cancel; l++ ) {
      final int level = l;
      Arrays.stream(groups.asAry())
        .parallel()
        .filter(grp -> grp._level==level)
        .forEach(grp -> { if( !_cancel ) lower(grp); });
    }
    return this;
  }

  // Groups not yet started are skipped; started ones finish
  public void cancel() { _cancel = true; }

  private void lower( Deps.Group grp ) {
    HashMap<String,TV> self = new HashMap<>();
    for( Def def : grp._defs ) {
      if( def instanceof FunDef fd ) self.put(fd._name,Unify.sig(fd));
      else if( grp._defs._len>1 ) {
        _errs.add(ErrMsg.cyclic(def._loc,def._name));
        def._sig = new TVLeaf();
      }
    }
    Lowered[] lows = new Lowered[grp._defs._len];
    for( int i=0; i<lows.length; i++ ) {
      Def def = grp._defs.at(i);
      lows[i] = def instanceof ConstDef && grp._defs._len>1
        ? done(def,new Lowered(def,null,null,_target),System.currentTimeMillis())
        : lower(def,self);
    }
    // Publish: the shared signature if typed, else what the annotations say
    for( int i=0; i<lows.length; i++ ) {
      Def def = grp._defs.at(i);
      if( def instanceof FunDef fd ) fd._sig = lows[i].failed() ? Unify.sig(fd) : self.get(fd._name);
    }
  }

  private Lowered lower( Def def, HashMap<String,TV> self ) {
    long t0 = System.currentTimeMillis();
    Lowered low = null;
    try {
      low = lower0(def,self);
    } catch( InternalFault f ) {
      _errs.add(ErrMsg.internal(f._loc,f.getMessage()));
    }
    if( low==null ) low = new Lowered(def,null,null,_target);
    if( def instanceof ConstDef )
      def._sig = low.failed() ? new TVLeaf() : def._tv.fresh();
    return done(def,low,t0);
  }

  private Lowered done( Def def, Lowered low, long t0 ) {
    _out.put(def._name,low);
    RET.p(low,"Lowered "+def._name+" in "+(System.currentTimeMillis()-t0)+"msecs"+(low.failed() ? ", failed" : ""));
    return low;
  }

  private Lowered lower0( Def def, HashMap<String,TV> self ) {
    Ary<FunScope> scopes = Scopes.resolve(def,_errs);
    if( scopes==null ) return null;
    Flow.flow(def,_errs);
    if( !Unify.type(def,scopes,name -> global(name,def,self),_errs) ) return null;
    AST body = _target._native_exit ? def.body() : Cps.lower(def,scopes);
    return new Lowered(def,body,scopes,_target);
  }

  // Type of a top-level name as seen from 'from', or null if unknown.  Names
  // in the same group share one type; finished definitions and primitives
  // are copied fresh.  A constant sees only earlier constants.
  private TV global( String name, Def from, HashMap<String,TV> self ) {
    TV t = self.get(name);
    if( t!=null ) return t;
    Def def = _byname.get(name);
    if( def!=null ) {
      if( from instanceof ConstDef && def instanceof ConstDef && _defs.find(def) >= _defs.find(from) )
        return null;
      return def._sig==null ? null : def._sig.fresh();
    }
    Prim prim = Prim.find(name);
    return prim==null ? null : prim.sig();
  }

  public Def def( String name ) { return _byname.get(name); }
  public Lowered lowered( String name ) { return _out.get(name); }
  // Outputs in definition order; cancelled definitions have none
  public Ary<Lowered> lowered() {
    Ary<Lowered> lows = new Ary<>(Lowered.class);
    for( Def def : _defs ) {
      Lowered low = _out.get(def._name);
      if( low!=null ) lows.push(low);
    }
    return lows;
  }

  // Evaluator over the compiled bodies
  public Eval eval() {
    return new Eval(_byname::get,def -> {
        Lowered low = _out.get(def._name);
        if( low==null || low.failed() ) throw RET.TODO("No code for "+def._name);
        return low._body;
      });
  }
  // Evaluator over the original source bodies, with native early exit
  public Eval eval_source() { return new Eval(_byname::get,Def::body); }
}
