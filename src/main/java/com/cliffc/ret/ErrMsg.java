package com.cliffc.ret;

import com.cliffc.ret.tvar.TV;
import org.jetbrains.annotations.NotNull;

// Error messages
public class ErrMsg implements Comparable<ErrMsg> {

  // Error levels
  public enum Level {
    Syntax,                   // Syntax, from the parser; fatal for the whole unit
    InvalidContext,           // Return outside any function
    UnknownRef,               // Unknown identifier
    TypeErr,                  // Type errors
    ReturnTypeMismatch,       // Return value fails to unify with the function result
    InternalFault,            // Upstream data broke an invariant of the lowering
    UnreachableCode;          // Code after a diverging statement; the only warning
    public boolean warn() { return this==UnreachableCode; }
  }

  public final Loc _loc;      // Point in code to blame
  public final String _msg;   // Printable error message, minus code context
  public final Level _lvl;    // Priority for printing
  public ErrMsg(Loc loc, String msg, Level lvl) { _loc=loc==null ? Loc.NONE : loc; _msg=msg; _lvl=lvl; }

  public static ErrMsg syntax(Loc loc, String msg) {
    return new ErrMsg(loc,msg,Level.Syntax);
  }
  public static ErrMsg invalid_context(Loc loc) {
    return new ErrMsg(loc,"Return outside of a function",Level.InvalidContext);
  }
  public static ErrMsg guard_return(Loc loc) {
    return new ErrMsg(loc,"Return inside a case guard",Level.InvalidContext);
  }
  public static ErrMsg unknown_ref(Loc loc, String name) {
    return new ErrMsg(loc,"Unknown ref '"+name+"'",Level.UnknownRef);
  }
  public static ErrMsg typerr( Loc loc, String actual, String expected ) {
    return new ErrMsg(loc,actual+" is not a "+expected,Level.TypeErr);
  }
  public static ErrMsg typerr( Loc loc, TV actual, TV expected ) {
    return typerr(loc,actual.p(),expected.p());
  }
  public static ErrMsg arity( Loc loc, int expected, int found ) {
    return new ErrMsg(loc,"Expected "+expected+" args, found "+found,Level.TypeErr);
  }
  public static ErrMsg cyclic( Loc loc, String name ) {
    return new ErrMsg(loc,"Constant '"+name+"' depends on itself",Level.TypeErr);
  }
  public static ErrMsg return_mismatch( Loc loc, String expected, String found ) {
    return new ErrMsg(loc,"Expected "+expected+" but found "+found,Level.ReturnTypeMismatch);
  }
  public static ErrMsg unreachable( Loc loc ) {
    return new ErrMsg(loc,"Unreachable code",Level.UnreachableCode);
  }
  public static ErrMsg internal( Loc loc, String msg ) {
    return new ErrMsg(loc,"Internal consistency fault: "+msg,Level.InternalFault);
  }

  public boolean warn() { return _lvl.warn(); }

  @Override public String toString() {
    return _loc.errLocMsg((warn() ? "warning: " : "")+_msg);
  }
  // Sorted by source location; level and text break ties
  @Override public int compareTo(@NotNull ErrMsg msg) {
    int cmp = _loc.compareTo(msg._loc);
    if( cmp != 0 ) return cmp;
    cmp = _lvl.compareTo(msg._lvl);
    if( cmp != 0 ) return cmp;
    return _msg.compareTo(msg._msg);
  }
  @Override public boolean equals(Object obj) {
    if( this==obj ) return true;
    if( !(obj instanceof ErrMsg err) ) return false;
    return _lvl==err._lvl && _msg.equals(err._msg) && _loc.equals(err._loc);
  }
  @Override public int hashCode() {
    return _loc.hashCode()+_msg.hashCode()+_lvl.hashCode();
  }
}
