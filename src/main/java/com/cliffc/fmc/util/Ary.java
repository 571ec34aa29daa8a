package com.cliffc.fmc.util;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;

// ArrayList with saner syntax, used as a stack of binder names
@SuppressWarnings("unchecked")
public class Ary<E> {
  public E[] _es;
  public int _len;
  public Ary(Class<E> clazz) { _es = (E[]) Array.newInstance(clazz, 1); _len = 0; }

  /** @param i index counted back from the end; 0 is the last element
   *  @return element being returned, or null if OOB */
  public E up( int i ) {
    return 0 <= i && i < _len ? _es[_len-1-i] : null;
  }

  /** @return remove and return last element */
  public E pop( ) {
    range_check(0);
    return _es[--_len];
  }
  /** Remove the last n elements */
  public void pop( int n ) {
    assert n <= _len;
    _len -= n;
  }

  /** Add element in amortized constant time
   *  @param e Element to add at end of list
   *  @return 'this' for flow-coding */
  public Ary<E> push( E e ) {
    if( _len >= _es.length ) _es = Arrays.copyOf(_es,Math.max(1,_es.length<<1));
    _es[_len++] = e;
    return this;
  }

  /** Distance from the end of the last element equal to e, or -1 if none.
   *  With binder names pushed in order, this is the de Bruijn index. */
  public int find_up( E e ) {
    for( int i=_len-1; i>=0; i-- )  if( Objects.equals(_es[i],e) )  return _len-1-i;
    return -1;
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
