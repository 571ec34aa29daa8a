package com.cliffc.fmc.uf;

// One union-find slot: a representative (rank, descriptor) or a link
final class Elem<D> {
  final int _link;              // -1 for a representative
  final int _rank;
  final D _desc;
  private Elem( int link, int rank, D desc ) { _link = link; _rank = rank; _desc = desc; }
  static <D> Elem<D> rep ( int rank, D desc ) { return new Elem<>(-1,rank,desc); }
  static <D> Elem<D> link( int to ) { return new Elem<>(to,0,null); }
  boolean is_link() { return _link != -1; }
}
