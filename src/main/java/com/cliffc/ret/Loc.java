package com.cliffc.ret;

import org.jetbrains.annotations.NotNull;

/** A source span: byte offsets [_x,_end) into the parsed source.  ASTs built
 *  by hand have no source, and print only the offsets. */
public final class Loc implements Comparable<Loc> {
  public final Parse _src;      // Source, for printing; null for hand-built ASTs
  public final int _x, _end;    // Start and end offsets
  public Loc( Parse src, int x, int end ) { _src=src; _x=x; _end=Math.max(x,end); }

  public static final Loc NONE = new Loc(null,0,0);

  // Span from the start of this to the end of that
  public Loc to( Loc that ) { return new Loc(_src,_x,Math.max(_end,that._end)); }

  public String src() { return _src==null ? "" : _src._name; }
  public int line() { return _src==null ? 0 : _src.line(_x); }

  public String errLocMsg( String msg ) {
    return _src==null ? "@"+_x+": "+msg : _src.errLocMsg(_x,msg);
  }

  @Override public int compareTo( @NotNull Loc loc ) {
    int cmp = src().compareTo(loc.src());
    if( cmp != 0 ) return cmp;
    if( _x != loc._x ) return Integer.compare(_x,loc._x);
    return Integer.compare(_end,loc._end);
  }
  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Loc loc && _src==loc._src && _x==loc._x && _end==loc._end;
  }
  @Override public int hashCode() { return (_x*31+_end)*31+src().hashCode(); }
  @Override public String toString() { return src()+"@"+_x+".."+_end; }
}
