package com.cliffc.ret.tvar;

import com.cliffc.ret.util.SB;

import java.util.IdentityHashMap;

// Ground types, by name.  Never shared: every use makes a new one.
public class TVBase extends TV {
  public static final String INT="Int", BOOL="Bool", STR="String", NIL="Nil";
  public final String _name;
  private TVBase( String name ) { super(); _name = name; }
  public static TVBase make( String name ) {
    assert name.equals(INT) || name.equals(BOOL) || name.equals(STR) || name.equals(NIL) : name;
    return new TVBase(name);
  }
  public static TVBase tint () { return make(INT ); }
  public static TVBase tbool() { return make(BOOL); }
  public static TVBase tstr () { return make(STR ); }
  public static TVBase tnil () { return make(NIL ); }

  @Override boolean _unify_impl( TV that ) { return _name.equals(((TVBase)that)._name); }
  @Override TV _copy() { return new TVBase(_name); }
  @Override SB _str( SB sb, IdentityHashMap<TV,String> names ) { return sb.p(_name); }
}
