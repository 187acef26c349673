package com.cliffc.ret.util;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

// ArrayList with saner syntax
public class Ary<E> implements Iterable<E> {
  public E[] _es;
  public int _len;
  public Ary(E[] es) { this(es,es.length); }
  public Ary(E[] es, int len) { _es=es; _len=len; }
  @SuppressWarnings("unchecked")
  public Ary(Class<E> clazz) { this((E[]) Array.newInstance(clazz, 1),0); }

  /** @return list is empty */
  public boolean isEmpty() { return _len==0; }
  /** @param i element index
   *  @return element being returned; throws if OOB */
  public E at( int i ) {
    range_check(i);
    return _es[i];
  }
  /** @return last element */
  public E last( ) {
    range_check(0);
    return _es[_len-1];
  }

  /** @return remove and return last element */
  public E pop( ) {
    range_check(0);
    return _es[--_len];
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> push( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  /** Replace element i; throws if OOB */
  public E set( int i, E e ) {
    range_check(i);
    return (_es[i] = e);
  }

  /** @param c Collection to be added */
  public Ary<E> addAll( Ary<? extends E> c ) {
    if( c._len==0 ) return this;
    while( _len+c._len > _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    System.arraycopy(c._es,0,_es,_len,c._len);
    _len += c._len;
    return this;
  }

  /** @return A shallow copy */
  public Ary<E> copy() { return new Ary<>(Arrays.copyOf(_es,Math.max(1,_len)),_len); }

  /** @return compact array version, using the internal base array where possible. */
  public E[] asAry() { return _len==_es.length ? _es : Arrays.copyOf(_es,_len); }

  /** Find the first element matching predicate P, or -1 if none.
   *  @param P Predicate to match
   *  @return index of first matching element, or -1 if none */
  public int find( Predicate<E> P ) {
    for( int i=0; i<_len; i++ )  if( P.test(_es[i]) )  return i;
    return -1;
  }
  /** Find the first element equal to e, or -1 if none. */
  public int find( E e ) {
    for( int i=0; i<_len; i++ )  if( e==null ? _es[i]==null : e.equals(_es[i]) )  return i;
    return -1;
  }
  /** @return true if any element matches P */
  public boolean any( Predicate<E> P ) { return find(P) != -1; }

  /** @return an iterator */
  @Override public Iterator<E> iterator() { return new Iter(); }
  private class Iter implements Iterator<E> {
    int _i=0;
    @Override public boolean hasNext() { return _i<_len; }
    @Override public E next() {
      if( _i>=_len ) throw new NoSuchElementException();
      return _es[_i++];
    }
  }

  @Override public String toString() {
    SB sb = new SB().p('{');
    for( int i=0; i<_len; i++ ) {
      if( i>0 ) sb.p(',');
      if( _es[i] != null ) sb.p(_es[i].toString());
    }
    return sb.p('}').toString();
  }

  private void range_check( int i ) {
    if( i < 0 || i>=_len )
      throw new ArrayIndexOutOfBoundsException(""+i+" >= "+_len);
  }
}
