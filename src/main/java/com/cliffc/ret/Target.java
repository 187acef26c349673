package com.cliffc.ret;

/** Code generation targets.  The only property the lowering core cares about
 *  is whether the target has its own non-local exit; such targets get the
 *  original AST and map each return directly.  Restricted targets get the
 *  CPS-lowered, return-free AST. */
public enum Target {
  NATIVE    (true ),
  RESTRICTED(false);

  public final boolean _native_exit;
  Target( boolean native_exit ) { _native_exit = native_exit; }
}
