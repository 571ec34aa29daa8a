package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;
import com.cliffc.fmc.util.Util;

import java.util.Objects;

// Function value: (name) => body.  The body sees one new binder.
public class Lam extends Term {
  public final boolean _eras;
  public final String _name;
  public final Term _body;
  public Lam( boolean eras, String name, Term body ) { _eras = eras; _name = name; _body = body; }

  @Override public Term shift( int inc, int dep ) {
    return new Lam(_eras,_name,_body.shift(inc,dep+1));
  }
  @Override public Term subst( Term v, int dep ) {
    return new Lam(_eras,_name,_body.subst(v.shift(1,0),dep+1));
  }
  // An erased lambda disappears; uses of its parameter become inert
  @Override public Term erase() {
    return _eras
      ? _body.subst(ERASED_REF,0).erase()
      : new Lam(false,_name,_body.erase());
  }
  @Override public int hash() { return Util.hash(_eras ? 51 : 5,_body.hash()); }
  @Override public boolean refs( String name ) { return _body.refs(name); }

  @Override boolean open_ended() { return true; }
  @Override public SB str( SB sb, Ary<String> vs ) {
    String name = bind_name(_name,vs,_body,null);
    sb.p('(').p(name);
    if( _eras ) sb.p(';');
    _body.str(sb.p(") => "),vs.push(name));
    vs.pop();
    return sb;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof Lam l && _eras==l._eras && _name.equals(l._name) && _body.equals(l._body);
  }
  @Override public int hashCode() { return Objects.hash(_eras,_name,_body); }
}
