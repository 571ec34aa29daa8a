package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;
import com.cliffc.fmc.util.Util;

import java.util.Objects;

// Type annotation: term :: type.  No runtime content.
public class Ann extends Term {
  public final boolean _done;   // Already checked
  public final Term _type, _term;
  public Ann( boolean done, Term type, Term term ) { _done = done; _type = type; _term = term; }

  @Override public Term shift( int inc, int dep ) {
    return new Ann(_done,_type.shift(inc,dep),_term.shift(inc,dep));
  }
  @Override public Term subst( Term v, int dep ) {
    return new Ann(_done,_type.subst(v,dep),_term.subst(v,dep));
  }
  @Override public Term erase() { return _term.erase(); }
  @Override public int hash() { return Util.hash(7,_type.hash(),_term.hash()); }
  @Override public boolean refs( String name ) { return _type.refs(name) || _term.refs(name); }

  @Override boolean open_ended() { return true; }
  @Override public SB str( SB sb, Ary<String> vs ) {
    _term.str_paren(sb,vs).p(" :: ");
    return _type.str(sb,vs);
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Ann a && _done==a._done && _type.equals(a._type) && _term.equals(a._term);
  }
  @Override public int hashCode() { return Objects.hash(_done,_type,_term); }
}
