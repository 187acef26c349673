package com.cliffc.ret.ast;

// The unit value
public enum Nil {
  NIL;
  @Override public String toString() { return "Nil"; }
}
