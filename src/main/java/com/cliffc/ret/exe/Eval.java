package com.cliffc.ret.exe;

import com.cliffc.ret.Prim;
import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

import java.util.HashMap;
import java.util.function.Function;

import static com.cliffc.ret.RET.TODO;

/** Tree-walking evaluator, to check lowering keeps behavior.
 *
 *  Values are Long, String, Boolean, Nil, or a Fun.  A Return unwinds to the
 *  innermost function or function literal invocation, the native early exit.
 *  Every unwind is counted; a lowered body must never unwind.  Each "print"
 *  is appended to the effect log, in order.
 */
public class Eval {
  private final Function<String,Def> _defs; // Top-level definitions by name
  private final Function<Def,AST> _bodies;  // Body to run for a definition
  private final HashMap<String,Object> _consts = new HashMap<>();
  public final Ary<String> _log = new Ary<>(String.class); // Effects, in order
  public int _unwinds;                                     // Returns taken

  public Eval( Function<String,Def> defs, Function<Def,AST> bodies ) { _defs = defs; _bodies = bodies; }

  // --- Values ------------------------
  public interface Fun { Object call( Eval e, Object[] args ); }

  // Function literal with its captured environment
  static final class Closure implements Fun {
    final Lambda _lam;  final Env _env;
    Closure( Lambda lam, Env env ) { _lam = lam; _env = env; }
    @Override public Object call( Eval e, Object[] args ) {
      Env env = _env;
      for( int i=0; i<args.length; i++ ) env = new Env(_lam._args.at(i),args[i],env);
      return e.invoke(_lam.body(),env);
    }
  }
  // Top-level function
  static final class FunRef implements Fun {
    final FunDef _fd;
    FunRef( FunDef fd ) { _fd = fd; }
    @Override public Object call( Eval e, Object[] args ) {
      Env env = null;
      for( int i=0; i<args.length; i++ ) env = new Env(_fd._args.at(i),args[i],env);
      return e.invoke(e._bodies.apply(_fd),env);
    }
  }
  static final class PrimFun implements Fun {
    final Prim _prim;
    PrimFun( Prim prim ) { _prim = prim; }
    @Override public Object call( Eval e, Object[] args ) {
      switch( _prim ) {
      case PRINT: e._log.push(str(args[0])); return Nil.NIL;
      case INT_TO_STRING: return Long.toString((Long)args[0]);
      case WITH: return ((Fun)args[1]).call(e,new Object[]{args[0]});
      default: throw TODO();
      }
    }
  }

  // Environment, linked list
  static final class Env {
    final String _name;  final Object _val;  final Env _par;
    Env( String name, Object val, Env par ) { _name = name; _val = val; _par = par; }
  }

  // Unwinds a Return to the nearest invocation
  private static final class Ret extends RuntimeException {
    final Object _val;
    Ret( Object val ) { super(null,null,false,false); _val = val; }
  }

  // Run a function or function literal body, catching its Returns
  Object invoke( AST body, Env env ) {
    try {
      return eval(body,env);
    } catch( Ret ret ) {
      _unwinds++;
      return ret._val;
    }
  }

  // Call a top-level function by name
  public Object call( String fname, Object... args ) {
    Def def = _defs.apply(fname);
    if( !(def instanceof FunDef fd) ) throw TODO("No function '"+fname+"'");
    if( fd.nargs()!=args.length ) throw TODO("Expected "+fd.nargs()+" args, found "+args.length);
    return new FunRef(fd).call(this,args);
  }

  // Printable value
  public static String str( Object v ) {
    if( v instanceof Boolean b ) return b ? "True" : "False";
    if( v instanceof Fun ) return "fn";
    return v.toString();
  }
  // Printable value, strings quoted
  public static String pstr( Object v ) {
    return v instanceof String s ? new SB().pq(s).toString() : str(v);
  }

  // --------------------------------------------------------------------------
  Object eval( AST ast, Env env ) {
    if( ast instanceof Con con ) return con._con;
    if( ast instanceof Ident id ) return lookup(id,env);
    if( ast instanceof Block blk ) {
      Object v = Nil.NIL;
      for( AST stmt : blk._kids ) {
        if( stmt instanceof Let let ) {
          v = eval(let.val(),env);
          env = new Env(let._name,v,env);
        } else v = eval(stmt,env);
      }
      return v;
    }
    if( ast instanceof Return ret ) throw new Ret(eval(ret.val(),env));
    if( ast instanceof Lambda lam ) return new Closure(lam,env);
    if( ast instanceof If iff ) {
      if( (Boolean)eval(iff.cond(),env) ) {
        Object v = eval(iff.then(),env);
        return iff.els()==null ? Nil.NIL : v;
      }
      return iff.els()==null ? Nil.NIL : eval(iff.els(),env);
    }
    if( ast instanceof Case kase ) {
      Object s = eval(kase.subject(),env);
      for( int i=0; i<kase.narms(); i++ ) {
        Pat pat = kase.pat(i);
        if( pat._con!=null && !pat._con.equals(s) ) continue;
        Env e = pat._var==null ? env : new Env(pat._var,s,env);
        if( kase.guard(i)!=null && !(Boolean)eval(kase.guard(i),e) ) continue;
        return eval(kase.arm(i),e);
      }
      throw TODO("No case arm matches "+str(s));
    }
    if( ast instanceof BinOp bin ) return binop(bin,env);
    if( ast instanceof Unary un ) {
      Object v = eval(un.kid(),env);
      if( un._op.equals("-") ) return -(Long)v;
      return !(Boolean)v;
    }
    if( ast instanceof Call call ) {
      Fun fun = (Fun)eval(call.fun(),env);
      Object[] args = new Object[call.nargs()];
      for( int i=0; i<args.length; i++ )
        args[i] = eval(call.arg(i),env);
      return fun.call(this,args);
    }
    if( ast instanceof Pipe pipe ) {
      Object v = eval(pipe.first(),env);
      for( int i=0; i<pipe.nstages(); i++ ) {
        AST s = pipe.stage(i);
        Call c = s instanceof Call call ? call : null;
        Fun fun = (Fun)eval(c==null ? s : c.fun(),env);
        Object[] args = new Object[c==null ? 1 : c.nargs()+1];
        args[0] = v;
        for( int j=1; j<args.length; j++ )
          args[j] = eval(c.arg(j-1),env);
        v = fun.call(this,args);
      }
      return v;
    }
    throw TODO("Cannot evaluate "+ast.getClass().getSimpleName());
  }

  private Object lookup( Ident id, Env env ) {
    for( Env e = env; e!=null; e = e._par )
      if( e._name.equals(id._name) )
        return e._val;
    Def def = _defs.apply(id._name);
    if( def instanceof FunDef fd ) return new FunRef(fd);
    if( def instanceof ConstDef cd ) {
      Object v = _consts.get(cd._name);
      if( v==null ) _consts.put(cd._name,v = eval(_bodies.apply(cd),null));
      return v;
    }
    Prim prim = Prim.find(id._name);
    if( prim!=null ) return new PrimFun(prim);
    throw TODO("Unknown ref '"+id._name+"'");
  }

  private Object binop( BinOp bin, Env env ) {
    Object l = eval(bin.lhs(),env);
    switch( bin._op ) {
    case "&&": return (Boolean)l ? eval(bin.rhs(),env) : Boolean.FALSE;
    case "||": return (Boolean)l ? Boolean.TRUE : eval(bin.rhs(),env);
    default: break;
    }
    Object r = eval(bin.rhs(),env);
    switch( bin._op ) {
    case "==": return  l.equals(r);
    case "!=": return !l.equals(r);
    case "<>": return (String)l+r;
    default: break;
    }
    long x = (Long)l, y = (Long)r;
    switch( bin._op ) {
    case "+": return x+y;
    case "-": return x-y;
    case "*": return x*y;
    case "/": return y==0 ? 0L : x/y;
    case "%": return y==0 ? 0L : x%y;
    case "<": return x< y;
    case "<=":return x<=y;
    case ">": return x> y;
    case ">=":return x>=y;
    default: throw TODO("Unknown operator "+bin._op);
    }
  }
}
