package com.cliffc.ret.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  // Quoted string literal, escaping quotes, backslashes and newlines
  public SB pq( String s ) {
    _sb.append('"');
    for( int i=0; i<s.length(); i++ ) {
      char c = s.charAt(i);
      switch( c ) {
      case '"':  _sb.append("\\\""); break;
      case '\\': _sb.append("\\\\"); break;
      case '\n': _sb.append("\\n" ); break;
      default:   _sb.append(c);
      }
    }
    _sb.append('"');
    return this;
  }
  public SB nl( ) { return p('\n'); }

  // Delete the last x chars, e.g. a trailing separator
  public SB unchar(int x) { _sb.setLength(_sb.length()-x); return this; }

  @Override public String toString() { return _sb.toString(); }
}
