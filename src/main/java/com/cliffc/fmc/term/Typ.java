package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;

// The type of types
public class Typ extends Term {
  public static final Typ TYP = new Typ();
  private Typ() { }
  @Override public Term shift( int inc, int dep ) { return this; }
  @Override public Term subst( Term v, int dep ) { return this; }
  @Override public Term erase() { return this; }
  @Override public int hash() { return 3; }
  @Override public boolean refs( String name ) { return false; }
  @Override public SB str( SB sb, Ary<String> vs ) { return sb.p("Type"); }
  @Override public boolean equals( Object o ) { return o instanceof Typ; }
  @Override public int hashCode() { return 3; }
}
