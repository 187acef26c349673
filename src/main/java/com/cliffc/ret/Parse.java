package com.cliffc.ret;

import com.cliffc.ret.ast.*;
import com.cliffc.ret.util.Ary;
import com.cliffc.ret.util.SB;

import java.util.HashSet;

/*** Parser for the RET language
 *
 *  GRAMMAR:
 *  unit = def* END
 *  def  = fn id ( params ) [-> type] block   // Top-level function
 *  def  = const id [: type] = expr           // Module constant
 *  params= [id[:type] [, id[:type]]*]
 *  block= { stmt* }                          // ';' between statements is optional
 *  stmt = let id [: type] = expr
 *  stmt = use [id [, id]*] <- call           // Rest of the block becomes a callback arg
 *  stmt = expr
 *  expr = bin [|> post]*                     // Pipeline, stage called with the value first
 *  bin  = unary [binop unary]*               // Precedence climbing, left associative
 *  unary= - unary | ! unary | post
 *  post = fact [( [expr [, expr]*] )]*       // Calls
 *  fact = return expr                        // Early exit from the innermost function
 *  fact = if expr block [else block | else if ...]
 *  fact = case expr { [pat [if expr] -> expr [,]]+ }
 *  fact = fn ( params ) [-> type] block      // Anonymous function
 *  fact = block | ( expr ) | num | "str" | True | False | Nil | id
 *  pat  = [-]num | "str" | True | False | Nil | _ | id
 *  type = Int | Bool | String | Nil | lowercase-id | fn ( [type [, type]*] ) -> type
 *  binop= || && == != < <= > >= + - <> * / %
 */
public class Parse {
  public final String _name;    // Source name, for errors
  private final byte[] _buf;    // Bytes being parsed
  private int _x;               // Parser index
  private final int[] _lines;   // Offsets of line starts

  private static final String[] OPS = new String[]{"||","&&","==","!=","<=",">=","<>","<",">","+","-","*","/","%"};
  private static final HashSet<String> KEYWORDS = new HashSet<>(){{
      add("fn"); add("const"); add("let"); add("use"); add("return"); add("if"); add("else");
      add("case"); add("True"); add("False"); add("Nil");
    }};

  // A syntax error; fatal for the whole unit
  public static class Err extends RuntimeException {
    public final ErrMsg _err;
    Err( ErrMsg err ) { super(err._msg); _err = err; }
  }

  public Parse( String name, String src ) {
    _name = name;
    _buf = src.getBytes();
    int n=1;
    for( byte b : _buf ) if( b=='\n' ) n++;
    _lines = new int[n];
    for( int i=0, l=1; i<_buf.length; i++ )
      if( _buf[i]=='\n' ) _lines[l++] = i+1;
  }

  // Parse a whole unit
  public Ary<Def> unit() {
    Ary<Def> defs = new Ary<>(Def.class);
    HashSet<String> names = new HashSet<>();
    while( skipWS() != -1 ) {
      int x = _x;
      Def def;
      if( peek_kw("fn") ) def = fundef(x);
      else if( peek_kw("const") ) def = constdef(x);
      else throw err(x,"Expected 'fn' or 'const'");
      if( !names.add(def._name) ) throw err(x,"Duplicate definition '"+def._name+"'");
      defs.push(def);
    }
    return defs;
  }

  private FunDef fundef( int x ) {
    String name = id();
    Ary<String> args = new Ary<>(String.class);
    Ary<TypeAnn> anns = new Ary<>(TypeAnn.class);
    params(args,anns);
    TypeAnn ret = peek("->") ? type() : null;
    return new FunDef(name,args,anns,ret,block()).loc(loc(x));
  }
  private ConstDef constdef( int x ) {
    String name = id();
    TypeAnn ann = peek(':') ? type() : null;
    require('=');
    return new ConstDef(name,ann,expr()).loc(loc(x));
  }
  private void params( Ary<String> args, Ary<TypeAnn> anns ) {
    require('(');
    if( peek(')') ) return;
    do {
      args.push(id());
      anns.push(peek(':') ? type() : null);
    } while( peek(',') );
    require(')');
  }

  // { stmts }
  private Block block() {
    skipWS();
    int x = _x;
    require('{');
    return block_rest(x);
  }
  // Statements up to and including the closing '}'
  private Block block_rest( int x ) {
    Ary<AST> stmts = new Ary<>(AST.class);
    while( !peek('}') ) {
      if( skipWS() == -1 ) throw err(x,"Expected closing '}' but ran out of text");
      int sx = _x;
      if( peek_kw("use") ) {
        stmts.push(use(sx));
        return new Block(stmts).loc(loc(x));
      }
      stmts.push(stmt());
      peek(';');
    }
    return new Block(stmts).loc(loc(x));
  }

  private AST stmt() {
    int x = _x;
    if( peek_kw("let") ) {
      String name = id();
      TypeAnn ann = peek(':') ? type() : null;
      require('=');
      return new Let(name,ann,expr()).loc(loc(x));
    }
    return expr();
  }

  // use a, b <- f(args); rest   ==>   f(args, fn(a, b) { rest })
  private AST use( int x ) {
    Ary<String> args = new Ary<>(String.class);
    Ary<TypeAnn> anns = new Ary<>(TypeAnn.class);
    if( !peek("<-") ) {
      do { args.push(id()); anns.push(null); } while( peek(',') );
      require("<-");
    }
    AST call = expr();
    if( !(call instanceof Call) ) throw err(call._loc._x,"Expected a call after '<-'");
    peek(';');
    skipWS();
    int lx = _x;
    Block rest = block_rest(lx);
    Lambda cb = new Lambda(args,anns,null,rest,true).loc(rest._loc);
    return new Call(call._kids.copy().push(cb)).loc(loc(x));
  }

  // Pipelines bind loosest
  private AST expr() {
    AST first = binop(1);
    if( !peek("|>") ) return first;
    Ary<AST> kids = new Ary<>(AST.class).push(first);
    do {
      skipWS();
      kids.push(post(_x));
    } while( peek("|>") );
    return new Pipe(kids).loc(first._loc.to(kids.last()._loc));
  }
  // Precedence climbing
  private AST binop( int min ) {
    AST lhs = unary();
    while( true ) {
      int x = _x;
      String op = peek_op();
      if( op==null ) return lhs;
      int prec = BinOp.prec(op);
      if( prec < min ) { _x = x; return lhs; }
      AST rhs = binop(prec+1);
      lhs = new BinOp(op,lhs,rhs).loc(lhs._loc.to(rhs._loc));
    }
  }
  private AST unary() {
    skipWS();
    int x = _x;
    if( peek('-') ) return new Unary("-",unary()).loc(loc(x));
    if( peek_not('!','=') ) return new Unary("!",unary()).loc(loc(x));
    return post(x);
  }
  private AST post( int x ) {
    AST ast = fact();
    while( peek('(') ) {
      Ary<AST> kids = new Ary<>(AST.class).push(ast);
      if( !peek(')') ) {
        do kids.push(expr()); while( peek(',') );
        require(')');
      }
      ast = new Call(kids).loc(loc(x));
    }
    return ast;
  }

  private AST fact() {
    byte c = skipWS();
    int x = _x;
    if( c == -1 ) throw err(x,"Expected an expression but ran out of text");
    if( isDigit(c) ) return new Con(number()).loc(loc(x));
    if( c=='"' ) return new Con(string()).loc(loc(x));
    if( peek('(') ) { AST e = expr(); require(')'); return e; }
    if( c=='{' ) return block();
    if( peek_kw("return") ) return new Return(expr()).loc(loc(x));
    if( peek_kw("if") ) return iff(x);
    if( peek_kw("case") ) return kase(x);
    if( peek_kw("fn") ) {
      Ary<String> args = new Ary<>(String.class);
      Ary<TypeAnn> anns = new Ary<>(TypeAnn.class);
      params(args,anns);
      TypeAnn ret = peek("->") ? type() : null;
      return new Lambda(args,anns,ret,block(),false).loc(loc(x));
    }
    if( peek_kw("True" ) ) return new Con(Boolean.TRUE ).loc(loc(x));
    if( peek_kw("False") ) return new Con(Boolean.FALSE).loc(loc(x));
    if( peek_kw("Nil"  ) ) return Con.nil().loc(loc(x));
    if( isAlpha0(c) ) return new Ident(id()).loc(loc(x));
    throw err(x,"Expected an expression but found '"+(char)c+"'");
  }

  private If iff( int x ) {
    AST cond = expr();
    Block t = block();
    AST f = null;
    if( peek_kw("else") ) {
      skipWS();
      int ex = _x;
      f = peek_kw("if") ? iff(ex) : block();
    }
    return new If(cond,t,f).loc(loc(x));
  }

  private Case kase( int x ) {
    AST subject = expr();
    require('{');
    Ary<AST> guards = new Ary<>(AST.class);
    Ary<AST> arms = new Ary<>(AST.class);
    Ary<Pat> pats = new Ary<>(Pat.class);
    do {
      pats.push(pat());
      guards.push(peek_kw("if") ? expr() : null);
      require("->");
      arms.push(expr());
      peek(',');
    } while( !peek('}') );
    return new Case(subject,guards,arms,pats).loc(loc(x));
  }

  private Pat pat() {
    byte c = skipWS();
    int x = _x;
    if( peek('-') ) {
      if( !isDigit(skipWS()) ) throw err(x,"Expected a pattern");
      return new Pat(-number(),null);
    }
    if( c != -1 && isDigit(c) ) return new Pat(number(),null);
    if( c=='"' ) return new Pat(string(),null);
    if( peek_kw("True" ) ) return new Pat(Boolean.TRUE ,null);
    if( peek_kw("False") ) return new Pat(Boolean.FALSE,null);
    if( peek_kw("Nil"  ) ) return new Pat(Nil.NIL,null);
    if( peek_kw("_") ) return Pat.WILD;
    if( c != -1 && isAlpha0(c) ) return new Pat(null,id());
    throw err(x,"Expected a pattern");
  }

  private TypeAnn type() {
    skipWS();
    int x = _x;
    if( peek_kw("fn") ) {
      Ary<TypeAnn> args = new Ary<>(TypeAnn.class);
      require('(');
      if( !peek(')') ) {
        do args.push(type()); while( peek(',') );
        require(')');
      }
      require("->");
      args.push(type());
      return new TypeAnn("fn",args);
    }
    String tok = token();
    switch( tok ) {
    case "Int": case "Bool": case "String": case "Nil": return new TypeAnn(tok);
    default:
      if( !tok.isEmpty() && Character.isLowerCase(tok.charAt(0)) && !KEYWORDS.contains(tok) )
        return new TypeAnn(tok);
      throw err(x,"Unknown type '"+tok+"'");
    }
  }

  // --------------------------------------------------------------------------
  private String id() {
    skipWS();
    int x = _x;
    String tok = token();
    if( tok.isEmpty() || KEYWORDS.contains(tok) || tok.equals("_") )
      throw err(x,"Expected an identifier");
    return tok;
  }
  private String token() {
    skipWS();
    int x = _x;
    while( _x < _buf.length && isAlpha1(_buf[_x]) ) _x++;
    return new String(_buf,x,_x-x);
  }
  private long number() {
    int x = _x;
    long sum=0;
    while( _x < _buf.length && isDigit(_buf[_x]) ) {
      int d = _buf[_x++]-'0';
      if( sum > (Long.MAX_VALUE-d)/10 ) throw err(x,"Integer literal too large");
      sum = sum*10+d;
    }
    return sum;
  }
  private String string() {
    int x = _x++;               // Skip open quote
    SB sb = new SB();
    while( true ) {
      if( _x >= _buf.length || _buf[_x]=='\n' ) throw err(x,"Unterminated string");
      byte c = _buf[_x++];
      if( c=='"' ) return sb.toString();
      if( c=='\\' && _x < _buf.length ) {
        c = _buf[_x++];
        sb.p(c=='n' ? '\n' : c=='t' ? '\t' : (char)c);
      } else sb.p((char)c);
    }
  }
  private String peek_op() {
    skipWS();
    for( String op : OPS )
      if( peek1(op) ) {
        // Not the start of "->" or "<-"
        if( op.equals("-") && _x+1 < _buf.length && _buf[_x+1]=='>' ) return null;
        if( op.equals("<") && _x+1 < _buf.length && _buf[_x+1]=='-' ) return null;
        _x += op.length();
        return op;
      }
    return null;
  }

  // Require a character (after skipping WS) or polite error
  private void require( char c ) {
    if( peek(c) ) return;
    throw err(_x,"Expected '"+c+"' but "+(_x>=_buf.length?"ran out of text":"found '"+(char)(_buf[_x])+"' instead"));
  }
  private void require( String s ) {
    if( peek(s) ) return;
    throw err(_x,"Expected '"+s+"'");
  }
  // Skip WS, return true&skip if match, false & do not skip if miss.
  private boolean peek( char c ) {
    if( skipWS()!=c ) return false;
    _x++;
    return true;
  }
  private boolean peek( String s ) {
    skipWS();
    if( !peek1(s) ) return false;
    _x += s.length();
    return true;
  }
  // Peek 'c' and NOT followed by 'no'
  private boolean peek_not( char c, char no ) {
    byte c0 = skipWS();
    if( c0 != c || (_x+1 < _buf.length && _buf[_x+1] == no) ) return false;
    _x++;
    return true;
  }
  // Keyword, not a prefix of a longer identifier
  private boolean peek_kw( String kw ) {
    skipWS();
    if( !peek1(kw) ) return false;
    int e = _x+kw.length();
    if( e < _buf.length && isAlpha1(_buf[e]) ) return false;
    _x = e;
    return true;
  }
  private boolean peek1( String tok ) {
    for( int i=0; i<tok.length(); i++ )
      if( _x+i >= _buf.length || _buf[_x+i] != tok.charAt(i) )
        return false;
    return true;
  }

  /** Advance parse pointer to the first non-whitespace character, and return
   *  that character, -1 otherwise.  */
  private byte skipWS() {
    while( _x < _buf.length ) {
      byte c = _buf[_x];
      if( c=='/' && _x+1 < _buf.length && _buf[_x+1]=='/' ) { skipEOL(); continue; }
      if( !isWS(c) ) return c;
      _x++;
    }
    return -1;
  }
  private void skipEOL() { while( _x < _buf.length && _buf[_x] != '\n' ) _x++; }

  private static boolean isWS    (byte c) { return c == ' ' || c == '\t' || c == '\n' || c == '\r'; }
  private static boolean isAlpha0(byte c) { return ('a'<=c && c <= 'z') || ('A'<=c && c <= 'Z') || (c=='_'); }
  private static boolean isAlpha1(byte c) { return isAlpha0(c) || ('0'<=c && c <= '9'); }
  private static boolean isDigit (byte c) { return '0' <= c && c <= '9'; }

  // Span from x to the end of the last token
  private Loc loc( int x ) {
    int e = _x;
    while( e > x && isWS(_buf[e-1]) ) e--;
    return new Loc(this,x,e);
  }
  private Err err( int x, String msg ) { return new Err(ErrMsg.syntax(new Loc(this,x,x),msg)); }

  // 1-based line number of offset x
  public int line( int x ) {
    int lo=0, hi=_lines.length-1;
    while( lo < hi ) {
      int mid = (lo+hi+1)>>>1;
      if( _lines[mid] <= x ) lo = mid; else hi = mid-1;
    }
    return lo+1;
  }

  // Build a string of the given message, the source line, and a caret under
  // the offset.
  public String errLocMsg( int x, String s ) {
    x = Math.min(x,_buf.length);
    // find line start
    int a=x;
    while( a > 0 && _buf[a-1] != '\n' ) --a;
    // find line end
    int b=x;
    while( b < _buf.length && _buf[b] != '\n' ) b++;
    if( b > a && _buf[b-1]=='\r' ) b--; // do not include trailing \r
    SB sb = new SB().p(_name).p(':').p(line(x)).p(':').p(' ').p(s).nl();
    sb.p(new String(_buf,a,b-a)).nl();
    for( int i=a; i<x; i++ )
      sb.p(_buf[i]=='\t' ? '\t' : ' ');
    return sb.p('^').toString();
  }
  @Override public String toString() { return _name; }
}
