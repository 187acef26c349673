package com.cliffc.ret.util;

public class Util {
  // Letter names for type variables: A,B,...,Z,A1,B1,...
  public static String vname( int n ) {
    String s = String.valueOf((char)('A'+(n%26)));
    return n<26 ? s : s+(n/26);
  }
}
