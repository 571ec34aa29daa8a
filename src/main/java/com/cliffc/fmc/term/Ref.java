package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;
import com.cliffc.fmc.util.Util;
import org.jetbrains.annotations.NotNull;

// Free reference to a Module definition
public class Ref extends Term {
  public final String _name;
  public Ref( @NotNull String name ) { _name = name; }

  @Override public Term shift( int inc, int dep ) { return this; }
  @Override public Term subst( Term v, int dep ) { return this; }
  @Override public Term erase() { return this; }
  @Override public int hash() { return Util.hash(2,_name.hashCode()); }
  @Override public boolean refs( String name ) { return _name.equals(name); }
  @Override public SB str( SB sb, Ary<String> vs ) { return sb.p(_name); }
  @Override public boolean equals( Object o ) { return o instanceof Ref r && r._name.equals(_name); }
  @Override public int hashCode() { return _name.hashCode(); }
}
