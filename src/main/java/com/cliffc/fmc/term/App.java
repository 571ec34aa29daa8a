package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;
import com.cliffc.fmc.util.Util;

import java.util.Objects;

// Application: fun(arg), or fun(arg;) when the argument is erased
public class App extends Term {
  public final boolean _eras;
  public final Term _fun, _arg;
  public App( boolean eras, Term fun, Term arg ) { _eras = eras; _fun = fun; _arg = arg; }

  @Override public Term shift( int inc, int dep ) {
    return new App(_eras,_fun.shift(inc,dep),_arg.shift(inc,dep));
  }
  @Override public Term subst( Term v, int dep ) {
    return new App(_eras,_fun.subst(v,dep),_arg.subst(v,dep));
  }
  @Override public Term erase() {
    return _eras ? _fun.erase() : new App(false,_fun.erase(),_arg.erase());
  }
  @Override public int hash() { return Util.hash(_eras ? 61 : 6,_fun.hash(),_arg.hash()); }
  @Override public boolean refs( String name ) { return _fun.refs(name) || _arg.refs(name); }

  @Override public SB str( SB sb, Ary<String> vs ) {
    if( _fun instanceof Ref || _fun instanceof Var || _fun instanceof App ) _fun.str(sb,vs);
    else _fun.str(sb.p('('),vs).p(')');
    _arg.str(sb.p('('),vs);
    if( _eras ) sb.p(';');
    return sb.p(')');
  }

  @Override public boolean equals( Object o ) {
    if( this==o ) return true;
    return o instanceof App a && _eras==a._eras && _fun.equals(a._fun) && _arg.equals(a._arg);
  }
  @Override public int hashCode() { return Objects.hash(_eras,_fun,_arg); }
}
