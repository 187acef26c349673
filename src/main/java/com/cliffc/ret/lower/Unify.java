package com.cliffc.ret.lower;

import com.cliffc.ret.ErrMsg;
import com.cliffc.ret.Errs;
import com.cliffc.ret.ast.*;
import com.cliffc.ret.tvar.*;
import com.cliffc.ret.util.Ary;

import java.util.HashMap;
import java.util.function.Function;

/** Type unifier.  Monomorphic inference over one definition; every reachable
 *  node gets a '_tv'.  Each function scope's result type is unified with,
 *  in textual order: its annotation, each of its Return values, and the
 *  trailing expression of the body when the body does not diverge first.
 *
 *  The first error stops typing the definition.  A result-type conflict is
 *  always pinned to a Return: the offending one, or the first one when the
 *  trailing expression is what conflicts.
 */
public class Unify {
  private final Ary<FunScope> _scopes;
  private final Function<String,TV> _globals; // Type of a top-level name, or null
  private final HashMap<String,TV> _tvars = new HashMap<>(); // Annotation type variables, per definition

  private Unify( Ary<FunScope> scopes, Function<String,TV> globals ) { _scopes = scopes; _globals = globals; }

  // Stops typing the definition; the message is recorded once
  private static class Abort extends RuntimeException {
    final ErrMsg _err;
    Abort( ErrMsg err ) { super(err._msg,null,false,false); _err = err; }
  }
  private static Abort err( ErrMsg err ) { return new Abort(err); }

  // Lexical environment, linked list
  private static class Env {
    final String _name;  final TV _tv;  final Env _par;
    Env( String name, TV tv, Env par ) { _name = name; _tv = tv; _par = par; }
  }

  // True if the definition types without error; errors go to 'errs'
  public static boolean type( Def def, Ary<FunScope> scopes, Function<String,TV> globals, Errs errs ) {
    try {
      new Unify(scopes,globals).def(def);
      return true;
    } catch( Abort a ) {
      errs.add(a._err);
      return false;
    }
  }

  // Signature from annotations alone; unannotated parts are leaves
  public static TV sig( FunDef fd ) { return sig(fd,new HashMap<>()); }
  private static TVLambda sig( FunDef fd, HashMap<String,TV> vars ) {
    TV[] args = new TV[fd.nargs()];
    for( int i=0; i<args.length; i++ )
      args[i] = fd._anns.at(i)==null ? new TVLeaf() : fd._anns.at(i).tv(vars);
    return new TVLambda(fd._ret==null ? new TVLeaf() : fd._ret.tv(vars),args);
  }

  private void def( Def def ) {
    if( def instanceof FunDef fd ) {
      TVLambda lam = sig(fd,_tvars);
      // Shared with the callers in the same group, who may have constrained it
      TV self = _globals.apply(fd._name);
      if( self!=null ) expect(fd,lam,self);
      FunScope fs = _scopes.at(0);
      fs._tv = lam.ret();
      Env env = null;
      for( int i=0; i<fd.nargs(); i++ )
        env = new Env(fd._args.at(i),lam.arg(i),env);
      finish(fs,fd.body(),block(fd.body(),env));
      fd._tv = lam;
    } else {
      ConstDef cd = (ConstDef)def;
      TV t = expr(cd.body(),null);
      if( cd._ann!=null ) expect(cd.body(),t,cd._ann.tv(_tvars));
      cd._tv = t;
    }
  }

  // Unify the trailing expression with the scope result
  private void finish( FunScope fs, Block body, TV t ) {
    if( body._div ) return;     // Trailing expression never reached
    try {
      fs._tv.unify(t);
    } catch( UnifyErr e ) {
      if( fs._first!=null )
        throw err(ErrMsg.return_mismatch(fs._first,fs._tv.p(),t.p()));
      AST last = body.last_live();
      throw err(ErrMsg.typerr(last==null ? body._loc : last._loc,t,fs._tv));
    }
  }

  private static TV set( AST ast, TV tv ) { ast._tv = tv; return tv; }

  // Unify actual with expected, or blame 'site'
  private static void expect( AST site, TV actual, TV expected ) {
    try {
      actual.unify(expected);
    } catch( UnifyErr e ) {
      throw err(ErrMsg.typerr(site._loc,actual,expected));
    }
  }

  private TV block( Block blk, Env env ) {
    TV last = null;
    for( AST stmt : blk._kids ) {
      if( stmt._dead ) break;   // Unreachable statements are not typed
      if( stmt instanceof Let let ) {
        TV t = expr(let.val(),env);
        if( let._ann!=null ) expect(let.val(),t,let._ann.tv(_tvars));
        env = new Env(let._name,t,env);
        last = set(let,t);
      } else last = expr(stmt,env);
    }
    return set(blk, blk._div ? new TVLeaf() : (last==null ? TVBase.tnil() : last));
  }

  private TV expr( AST ast, Env env ) {
    if( ast instanceof Con con ) return set(con,con.tv());
    if( ast instanceof Ident id ) return set(id,ident(id,env));
    if( ast instanceof Block blk ) return block(blk,env);
    if( ast instanceof Return ret ) return ret(ret,env);
    if( ast instanceof Lambda lam ) return lambda(lam,env);
    if( ast instanceof If iff ) {
      expect(iff.cond(),expr(iff.cond(),env),TVBase.tbool());
      TV t = expr(iff.then(),env);
      if( iff.els()==null ) return set(iff,TVBase.tnil());
      expect(iff.els(),expr(iff.els(),env),t);
      return set(iff,t);
    }
    if( ast instanceof Case kase ) return kase(kase,env);
    if( ast instanceof BinOp bin ) return binop(bin,env);
    if( ast instanceof Unary un ) {
      TV t = un._op.equals("-") ? TVBase.tint() : TVBase.tbool();
      expect(un.kid(),expr(un.kid(),env),t);
      return set(un,t);
    }
    if( ast instanceof Call call ) return call(call,env);
    if( ast instanceof Pipe pipe ) {
      TV t = expr(pipe.first(),env);
      pipe._outs = new TV[pipe.nstages()];
      for( int i=0; i<pipe.nstages(); i++ )
        t = pipe._outs[i] = stage(pipe,i,t,env);
      return set(pipe,t);
    }
    throw new InternalFault(ast._loc,"Unexpected "+ast.getClass().getSimpleName()+" in expression position");
  }

  private TV ident( Ident id, Env env ) {
    for( Env e = env; e!=null; e = e._par )
      if( e._name.equals(id._name) )
        return e._tv;
    TV t = _globals.apply(id._name);
    if( t==null ) throw err(ErrMsg.unknown_ref(id._loc,id._name));
    return t;
  }

  private TV ret( Return ret, Env env ) {
    TV t = expr(ret.val(),env);
    if( ret._sid < 0 ) throw new InternalFault(ret._loc,"Return without a scope");
    FunScope fs = _scopes.at(ret._sid);
    try {
      fs._tv.unify(t);
    } catch( UnifyErr e ) {
      throw err(ErrMsg.return_mismatch(ret._loc,fs._tv.p(),t.p()));
    }
    if( fs._first==null ) fs._first = ret._loc;
    // Never produces a value, so fits any context
    return set(ret,new TVLeaf());
  }

  private TV lambda( Lambda lam, Env env ) {
    TV[] args = new TV[lam.nargs()];
    for( int i=0; i<args.length; i++ ) {
      args[i] = lam._anns.at(i)==null ? new TVLeaf() : lam._anns.at(i).tv(_tvars);
      env = new Env(lam._args.at(i),args[i],env);
    }
    TV ret = lam._ret==null ? new TVLeaf() : lam._ret.tv(_tvars);
    FunScope fs = _scopes.at(lam._sid);
    fs._tv = ret;
    TVLambda tl = new TVLambda(ret,args);
    finish(fs,lam.body(),block(lam.body(),env));
    return set(lam,tl);
  }

  private TV kase( Case kase, Env env ) {
    TV s = expr(kase.subject(),env);
    TV rez = null;
    for( int i=0; i<kase.narms(); i++ ) {
      Pat pat = kase.pat(i);
      Env e = env;
      if( pat._con!=null ) expect(kase.arm(i),new Con(pat._con).tv(),s);
      else if( pat._var!=null ) e = new Env(pat._var,s,env);
      if( kase.guard(i)!=null ) expect(kase.guard(i),expr(kase.guard(i),e),TVBase.tbool());
      TV a = expr(kase.arm(i),e);
      if( rez==null ) rez = a;
      else expect(kase.arm(i),a,rez);
    }
    return set(kase,rez==null ? new TVLeaf() : rez);
  }

  private TV binop( BinOp bin, Env env ) {
    TV l = expr(bin.lhs(),env);
    switch( bin._op ) {
    case "+": case "-": case "*": case "/": case "%":
      return both(bin,l,TVBase.tint(),env,TVBase.tint());
    case "<": case "<=": case ">": case ">=":
      return both(bin,l,TVBase.tint(),env,TVBase.tbool());
    case "<>":
      return both(bin,l,TVBase.tstr(),env,TVBase.tstr());
    case "&&": case "||":
      return both(bin,l,TVBase.tbool(),env,TVBase.tbool());
    case "==": case "!=":
      expect(bin.rhs(),expr(bin.rhs(),env),l);
      return set(bin,TVBase.tbool());
    default: throw new InternalFault(bin._loc,"Unknown operator "+bin._op);
    }
  }
  // Both operands of 'arg' type, result of 'rez' type
  private TV both( BinOp bin, TV l, TV arg, Env env, TV rez ) {
    expect(bin.lhs(),l,arg);
    expect(bin.rhs(),expr(bin.rhs(),env),arg);
    return set(bin,rez);
  }

  private TV call( Call call, Env env ) {
    TV f = expr(call.fun(),env);
    TV[] args = new TV[call.nargs()];
    AST[] sites = new AST[args.length];
    for( int i=0; i<args.length; i++ )
      args[i] = expr(sites[i] = call.arg(i),env);
    return set(call,apply(call,f,args,sites));
  }

  // Pipeline stage i on a value of type 'prev'; blame for the piped value
  // goes to the stage
  private TV stage( Pipe pipe, int i, TV prev, Env env ) {
    AST s = pipe.stage(i);
    Call c = s instanceof Call call ? call : null;
    TV f = expr(c==null ? s : c.fun(),env);
    int n = c==null ? 0 : c.nargs();
    TV[] args = new TV[n+1];
    AST[] sites = new AST[n+1];
    args[0] = prev;  sites[0] = s;
    for( int j=0; j<n; j++ )
      args[j+1] = expr(sites[j+1] = c.arg(j),env);
    return apply(s,f,args,sites);
  }

  private TV apply( AST call, TV f, TV[] args, AST[] sites ) {
    AST fun = call instanceof Call c ? c.fun() : call;
    TV fn = f.find();
    if( fn instanceof TVLeaf ) {
      TVLambda lam = new TVLambda(new TVLeaf(),args);
      expect(fun,fn,lam);
      return lam.ret();
    }
    if( !(fn instanceof TVLambda lam) )
      throw err(ErrMsg.typerr(fun._loc,fn.p(),"function"));
    if( lam.nargs()!=args.length )
      throw err(ErrMsg.arity(call._loc,lam.nargs(),args.length));
    for( int i=0; i<args.length; i++ )
      expect(sites[i],args[i],lam.arg(i));
    return lam.ret();
  }
}
