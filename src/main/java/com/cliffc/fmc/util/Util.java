package com.cliffc.fmc.util;

public class Util {
  // Mixing steps from http://burtleburtle.net/bob/c/lookup3.c, without the
  // global state so calls nest inside recursive hashing.
  private static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }
  static public int hash( int a, int b, int c ) {
    c ^= b; c -= rot(b,14);
    a ^= c; a -= rot(c,11);
    b ^= a; b -= rot(a,25);
    c ^= b; c -= rot(b,16);
    a ^= c; a -= rot(c, 4);
    b ^= a; b -= rot(a,14);
    c ^= b; c -= rot(b,24);
    return c==0 ? 0xcafebabe : c;
  }
  static public int hash( int a, int b ) { return hash(a,b,0x9e3779b9); }
}
