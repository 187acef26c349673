package com.cliffc.ret.lower;

import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;

import java.util.HashSet;

/** Lowers early returns into structured control flow, for targets with no
 *  native non-local exit.
 *
 *  Each function scope with a Return is rewritten against a continuation
 *  (see Cont): a Return drops its continuation and yields its value; any
 *  other value is handed to the continuation, which splices in the rest of
 *  the sequence.  Conditionals with a Return in an arm get a copy of the
 *  continuation in every arm that does not return.  Function literals are
 *  lowered first, each on its own; an enclosing call then sees an ordinary
 *  return-free statement.
 *
 *  Evaluation order is kept: operands already evaluated when a Return may
 *  happen are first bound to temporaries.  Bindings spliced in front of a
 *  continuation are renamed when they would capture a name it uses.
 *
 *  Bodies without any Return come back unchanged; the original AST is never
 *  modified.
 */
public class Cps {
  private final HashSet<String> _used; // All names in the definition, plus those made here
  private int _tmp;                    // Temporary counter
  private int _sid;                    // Scope being lowered

  private Cps( Def def ) {
    _used = new HashSet<>();
    Cont.names(def.body(),_used);
    if( def instanceof FunDef fd ) for( String arg : fd._args ) _used.add(arg);
  }

  // The lowered body of 'def', or the body itself when it has no Return
  public static AST lower( Def def, Ary<FunScope> scopes ) {
    AST body = def.body();
    if( !body.any_ret() ) return body;
    Cps cps = new Cps(def);
    AST copy = cps.lambdas(body.copy(),scopes);
    if( def instanceof FunDef && scopes.at(0)._has_ret )
      copy = cps.scope((Block)copy,0);
    AST ret = copy.visit(a -> a instanceof Return ? a : null, (a,b) -> a!=null ? a : b);
    if( ret!=null ) throw new InternalFault(ret._loc,"Return survived lowering");
    return copy;
  }

  // Lower function literals bottom-up, in place on the private copy
  private AST lambdas( AST ast, Ary<FunScope> scopes ) {
    for( int i=0; i<ast.len(); i++ )
      if( ast.at(i)!=null )
        ast._kids.set(i,lambdas(ast.at(i),scopes));
    if( ast instanceof Lambda lam ) {
      if( lam._sid < 0 ) throw new InternalFault(lam._loc,"Function literal without a scope");
      if( scopes.at(lam._sid)._has_ret )
        lam._kids.set(0,scope(lam.body(),lam._sid));
    }
    return ast;
  }

  // Lower one function scope body
  private Block scope( Block body, int sid ) {
    _sid = sid;
    return block(stmts(body.live(),0,Cont.Ret.RET),body);
  }

  // Statements [i,len) of 'ss', followed by continuation 'k'
  private Ary<AST> stmts( Ary<AST> ss, int i, Cont k ) {
    Ary<AST> out = new Ary<>(AST.class);
    if( i==ss._len ) return out.addAll(apply(k,Con.nil()));
    for( int j=i; j<ss._len; j++ ) {
      AST s = ss.at(j);
      boolean last = j==ss._len-1;
      if( s instanceof Let let ) {
        if( k.names().contains(let._name) ) {
          ss = rename_rest(ss,j,fresh(let._name));
          let = (Let)ss.at(j);
        }
        if( let.val().has_ret() )
          return out.addAll(expr(let.val(),new Cont.Bind(let,ss,j+1,k)));
        out.push(let);
        if( last ) return k instanceof Cont.Ret ? out : out.addAll(apply(k,ident(let)));
      } else if( !s.has_ret() ) {
        if( last ) return out.addAll(apply(k,s));
        out.push(s);
      } else
        return out.addAll(expr(s,last ? k : new Cont.Seq(ss,j+1,k)));
    }
    throw new IllegalStateException();
  }

  // Evaluate 'e', handing its value to 'k'
  private Ary<AST> expr( AST e, Cont k ) {
    if( !e.has_ret() ) return apply(k,e);
    if( e._tv==null ) throw new InternalFault(e._loc,"Untyped "+e.getClass().getSimpleName());
    if( e instanceof Return ret ) {
      if( ret._sid < 0 ) throw new InternalFault(ret._loc,"Return without a scope");
      if( ret._sid != _sid ) throw new InternalFault(ret._loc,"Return for scope "+ret._sid+" found in scope "+_sid);
      return expr(ret.val(),Cont.Ret.RET); // The continuation is dropped
    }
    if( e instanceof Block blk ) return stmts(blk.live(),0,k);
    if( e instanceof If iff ) return iff(iff,k);
    if( e instanceof Case kase ) return kase(kase,k);
    if( e instanceof Pipe pipe ) return expr(pipe(pipe),k);
    if( e instanceof BinOp bin && bin.is_short() && !bin.lhs().has_ret() ) {
      // a && r  ==>  if a { r } else { False }
      // a || r  ==>  if a { True } else { r }
      boolean and = bin._op.equals("&&");
      Block r = new Block(bin.rhs()), c = new Block(con(!and,bin));
      If iff = new If(bin.lhs(),and ? r : c,and ? c : r).loc(bin._loc);
      iff._tv = bin._tv;
      return expr(iff,k);
    }
    if( e instanceof Let ) throw new InternalFault(e._loc,"let outside a block");
    return plug(e,k);
  }

  private Ary<AST> iff( If iff, Cont k ) {
    if( iff.cond().has_ret() ) return expr(iff.cond(),new Cont.Plug(iff,0,k));
    // Without an else the then-arm value is discarded
    Block t = arm(iff.then(),iff.els()==null ? new Cont.Drop(k) : k);
    AST f;
    if( iff.els()==null ) f = block(apply(k,Con.nil()),iff.then());
    else if( iff.els() instanceof If elif ) {
      Ary<AST> ss = expr(elif,k);
      f = ss._len==1 && ss.at(0) instanceof If ? ss.at(0) : block(ss,elif);
    } else f = arm((Block)iff.els(),k);
    If x = new If(iff.cond(),t,f).loc(iff._loc);
    x._tv = iff._tv;
    return one(x);
  }

  private Ary<AST> kase( Case kase, Cont k ) {
    if( kase.subject().has_ret() ) return expr(kase.subject(),new Cont.Plug(kase,0,k));
    Case c = kase;
    for( int i=0; i<kase.narms(); i++ ) {
      Pat pat = kase.pat(i);
      AST guard = kase.guard(i), arm = kase.arm(i);
      if( pat._var!=null && k.names().contains(pat._var) ) {
        String nn = fresh(pat._var);
        if( guard!=null ) guard = rename(guard,pat._var,nn);
        arm = rename(arm,pat._var,nn);
        pat = pat.rename(nn);
      }
      Ary<AST> ss = expr(arm,k);
      c = c.with_arm(i,pat,guard,ss._len==1 && !(ss.at(0) instanceof Let) ? ss.at(0) : block(ss,arm));
    }
    return one(c);
  }

  // a |> f |> g(b)  ==>  { let _cps1 = a; let _cps2 = f(_cps1); g(_cps2, b) }
  private Block pipe( Pipe pipe ) {
    Ary<AST> ss = new Ary<>(AST.class);
    AST v = pipe.first();
    for( int i=0; i<pipe.nstages(); i++ ) {
      if( !pure(v) ) {
        Let tmp = new Let(fresh_tmp(),null,v).loc(v._loc);
        tmp._tv = v._tv;
        ss.push(tmp);
        v = ident(tmp);
      }
      v = pipe.call(i,v);
    }
    return block(ss.push(v),pipe);
  }

  // Calls and operators: evaluate up to the first kid with a Return, binding
  // earlier kids with effects to temporaries, then continue with the rest.
  private Ary<AST> plug( AST e, Cont k ) {
    int i=0;
    while( !e.at(i).has_ret() ) i++;
    Ary<AST> out = new Ary<>(AST.class);
    AST tmpl = e;
    for( int j=0; j<i; j++ ) {
      AST kid = e.at(j);
      if( pure(kid) ) continue;
      Let tmp = new Let(fresh_tmp(),null,kid).loc(kid._loc);
      tmp._tv = kid._tv;
      out.push(tmp);
      tmpl = tmpl.with(j,ident(tmp));
    }
    return out.addAll(expr(tmpl.at(i),new Cont.Plug(tmpl,i,k)));
  }

  // Hand value 'v' to continuation 'k'
  private Ary<AST> apply( Cont k, AST v ) {
    if( k instanceof Cont.Ret ) return one(v);
    if( k instanceof Cont.Seq seq )
      return drop(v).addAll(stmts(seq._ss,seq._i,seq._next));
    if( k instanceof Cont.Bind bind ) {
      Let let = new Let(bind._let._name,bind._let._ann,v).loc(bind._let._loc);
      let._tv = bind._let._tv;
      Ary<AST> out = one(let);
      if( bind._i < bind._ss._len ) return out.addAll(stmts(bind._ss,bind._i,bind._next));
      return bind._next instanceof Cont.Ret ? out : out.addAll(apply(bind._next,ident(let)));
    }
    if( k instanceof Cont.Drop drop )
      return drop(v).addAll(apply(drop._next,Con.nil()));
    Cont.Plug plug = (Cont.Plug)k;
    return expr(plug._tmpl.with(plug._idx,v),plug._next);
  }

  // --------------------------------------------------------------------------
  // Rename the Let at j and its uses in the following statements
  private static Ary<AST> rename_rest( Ary<AST> ss, int j, String nn ) {
    Let let = (Let)ss.at(j);
    Ary<AST> rs = ss.copy();
    Let nlet = new Let(nn,let._ann,let.val()).loc(let._loc);
    nlet._tv = let._tv;  nlet._div = let._div;
    rs.set(j,nlet);
    rename_stmts(rs,j+1,let._name,nn);
    return rs;
  }
  // Rename free uses of 'old' in statements [i,len), until 'old' is rebound
  private static void rename_stmts( Ary<AST> ss, int i, String old, String nn ) {
    for( ; i<ss._len; i++ ) {
      AST s = ss.at(i);
      if( s instanceof Let let ) {
        ss.set(i,let.with(0,rename(let.val(),old,nn)));
        if( let._name.equals(old) ) return; // Shadowed from here on
      } else ss.set(i,rename(s,old,nn));
    }
  }
  // Rename free uses of 'old' in 'ast'
  static AST rename( AST ast, String old, String nn ) {
    if( ast instanceof Ident id ) {
      if( !id._name.equals(old) ) return id;
      Ident x = new Ident(nn).loc(id._loc);
      x._tv = id._tv;
      return x;
    }
    if( ast instanceof Lambda lam && lam._args.find(old)!=-1 ) return ast;
    if( ast instanceof Block blk ) {
      Ary<AST> ss = blk._kids.copy();
      rename_stmts(ss,0,old,nn);
      return blk.rebuild(ss);
    }
    Ary<AST> kids = ast._kids.copy();
    for( int i=0; i<kids._len; i++ ) {
      if( kids.at(i)==null ) continue;
      // Arm binding the same name shadows it, in its guard and body
      if( ast instanceof Case kase && i>0 && old.equals(kase.pat(Case.arm_of(i))._var) ) continue;
      kids.set(i,rename(kids.at(i),old,nn));
    }
    return ast.rebuild(kids);
  }

  private String fresh( String base ) {
    for( int i=1; ; i++ )
      if( _used.add(base+"_"+i) )
        return base+"_"+i;
  }
  private String fresh_tmp() {
    while( true )
      if( _used.add("_cps"+(++_tmp)) )
        return "_cps"+_tmp;
  }

  // No effects, and evaluates the same anywhere in the sequence
  private static boolean pure( AST ast ) {
    return ast instanceof Con || ast instanceof Ident || ast instanceof Lambda;
  }
  private static Ary<AST> one( AST ast ) { return new Ary<>(AST.class).push(ast); }
  private static Ary<AST> drop( AST v ) { return pure(v) ? new Ary<>(AST.class) : one(v); }
  private static Ident ident( Let let ) {
    Ident id = new Ident(let._name).loc(let._loc);
    id._tv = let._tv;
    return id;
  }
  private static Con con( boolean b, AST like ) {
    Con c = new Con(b).loc(like._loc);
    c._tv = like._tv;
    return c;
  }
  private static Block block( Ary<AST> ss, AST like ) {
    Block b = new Block(ss).loc(like._loc);
    b._tv = like._tv;
    return b;
  }
  private Block arm( Block b, Cont k ) { return block(stmts(b.live(),0,k),b); }
}
