package com.cliffc.ret;

import com.cliffc.ret.ast.Nil;
import com.cliffc.ret.exe.Eval;
import com.cliffc.ret.util.Ary;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/** Early-return lowering for the RET language.
 *
 *  Usage: RET [-native|-restricted] [-debug] file [-eval fn args...]
 *
 *  Prints each lowered definition, then the diagnostics sorted by source
 *  location.  With -eval, and no errors, calls the named function on the
 *  arguments and prints its effects and result.
 */
public abstract class RET {
  public static RuntimeException TODO() { return TODO("unimplemented"); }
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  // Debug printers
  public static boolean DEBUG = false;
  public static <T> T p(T x, String s) {
    if( !RET.DEBUG ) return x;
    System.err.println(s);
    return x;
  }

  public static void main( String[] args ) throws IOException {
    Target target = Target.RESTRICTED;
    String file = null, efun = null;
    Ary<Object> eargs = new Ary<>(Object.class);
    for( int i=0; i<args.length; i++ ) {
      String arg = args[i];
      if( efun!=null ) eargs.push(arg(arg));
      else if( arg.equals("-native"    ) ) target = Target.NATIVE;
      else if( arg.equals("-restricted") ) target = Target.RESTRICTED;
      else if( arg.equals("-debug"     ) ) DEBUG = true;
      else if( arg.equals("-eval") && i+1<args.length ) efun = args[++i];
      else if( file==null && !arg.startsWith("-") ) file = arg;
      else { usage(); return; }
    }
    if( file==null ) { usage(); return; }
    String src = new String(Files.readAllBytes(Paths.get(file)));
    run(file,src,target,efun,eargs.asAry());
  }
  private static void usage() {
    System.err.println("Usage: RET [-native|-restricted] [-debug] file [-eval fn args...]");
  }

  // Compile and print; then optionally evaluate
  public static Unit run( String name, String src, Target target, String efun, Object... eargs ) {
    Unit unit = Unit.parse(name,src).compile(target);
    for( Lowered low : unit.lowered() )
      if( !low.failed() )
        System.out.println(low);
    System.out.print(unit._errs);
    if( efun!=null && !unit._errs.has_errors() ) {
      Eval e = unit.eval();
      Object v = e.call(efun,eargs);
      for( String s : e._log ) System.out.println(s);
      System.out.println("=> "+Eval.pstr(v));
    }
    return unit;
  }

  // Command-line value: Int, Bool, Nil, else String
  static Object arg( String s ) {
    switch( s ) {
    case "True":  return Boolean.TRUE;
    case "False": return Boolean.FALSE;
    case "Nil":   return Nil.NIL;
    default: break;
    }
    try {
      return Long.parseLong(s);
    } catch( NumberFormatException e ) {
      return s;
    }
  }
}
