package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;
import com.cliffc.fmc.util.Util;

import java.util.Objects;

/** Dependent function type with a self binder: {@code self(name : dom) -> cod}.

 The domain sees one new binder (self, index 0).  The codomain sees two: self at
 index 1 and the parameter at index 0.  All depth arithmetic below is +1 for the
 domain and +2 for the codomain.
*/
public class All extends Term {
  public final boolean _eras;   // Parameter is computationally irrelevant
  public final String _self;    // Self name; empty when not written
  public final String _name;    // Parameter name
  public final Term _dom, _cod;
  public All( boolean eras, String self, String name, Term dom, Term cod ) {
    _eras = eras; _self = self; _name = name; _dom = dom; _cod = cod;
  }

  @Override public Term shift( int inc, int dep ) {
    return new All(_eras,_self,_name,_dom.shift(inc,dep+1),_cod.shift(inc,dep+2));
  }
  @Override public Term subst( Term v, int dep ) {
    return new All(_eras,_self,_name,
                   _dom.subst(v.shift(1,0),dep+1),
                   _cod.subst(v.shift(2,0),dep+2));
  }
  @Override public Term erase() {
    return new All(_eras,_self,_name,_dom.erase(),_cod.erase());
  }
  @Override public int hash() { return Util.hash(_eras ? 41 : 4,_dom.hash(),_cod.hash()); }
  @Override public boolean refs( String name ) { return _dom.refs(name) || _cod.refs(name); }

  @Override boolean open_ended() { return true; }
  @Override public SB str( SB sb, Ary<String> vs ) {
    String self = bind_name(_self,vs,_dom,_cod);
    String name = bind_name(_name,vs.push(self),_cod,null);
    sb.p(self).p('(').p(name).p(" : ");
    _dom.str(sb,vs);
    vs.pop();
    if( _eras ) sb.p(';');
    sb.p(") -> ");
    _cod.str(sb,vs.push(self).push(name));
    vs.pop(2);
    return sb;
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof All a && _eras==a._eras && _self.equals(a._self) && _name.equals(a._name) &&
      _dom.equals(a._dom) && _cod.equals(a._cod);
  }
  @Override public int hashCode() { return Objects.hash(_eras,_self,_name,_dom,_cod); }
}
