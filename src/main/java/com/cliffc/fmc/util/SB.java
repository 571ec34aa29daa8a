package com.cliffc.fmc.util;

/** Tight/tiny StringBuilder wrapper.
 *  Short short names on purpose; so they don't obscure the printing. */
public final class SB {
  public final StringBuilder _sb;
  public SB(        ) { _sb = new StringBuilder( ); }
  public SB p( String s ) { _sb.append(s); return this; }
  public SB p( char   s ) { _sb.append(s); return this; }
  public SB p( int    s ) { _sb.append(s); return this; }
  // Not spelled "p" on purpose: too easy to accidentally call the autoboxed version.
  public SB pobj( Object s ) { _sb.append(s.toString()); return this; }

  public SB nl( ) { return p('\n'); }

  // Remove last N chars
  public SB unchar( int n ) { _sb.setLength(_sb.length()-n); return this; }

  @Override public String toString() { return _sb.toString(); }
}
