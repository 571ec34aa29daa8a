package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;
import com.cliffc.fmc.util.Util;

// Bound variable, by de Bruijn index
public class Var extends Term {
  public final int _idx;
  public Var( int idx ) { _idx = idx; }

  @Override public Term shift( int inc, int dep ) {
    return _idx < dep || inc==0 ? this : new Var(_idx+inc);
  }
  @Override public Term subst( Term v, int dep ) {
    if( _idx == dep ) return v;
    return _idx > dep ? new Var(_idx-1) : this;
  }
  @Override public Term erase() { return this; }
  @Override public int hash() { return Util.hash(1,_idx); }
  @Override public boolean refs( String name ) { return false; }

  @Override public SB str( SB sb, Ary<String> vs ) {
    String n = vs.up(_idx);
    // Out of scope, or an unnamed self binder
    return n==null || n.isEmpty() ? sb.p('^').p(_idx) : sb.p(n);
  }
  @Override public boolean equals( Object o ) { return o instanceof Var v && v._idx==_idx; }
  @Override public int hashCode() { return _idx; }
}
