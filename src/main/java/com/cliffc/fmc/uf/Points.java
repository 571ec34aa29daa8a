package com.cliffc.fmc.uf;

import com.cliffc.fmc.util.SB;
import io.lacuna.bifurcan.IntMap;

import static com.cliffc.fmc.FMC.TODO;

/** Persistent disjoint-set (union-find) over integer handles.

 Handles are handed out sequentially by {@link #fresh} and never reused.  Each
 handle maps to an {@link Elem}: either a class representative holding a rank
 and a descriptor, or a link to another handle.  Links form a forest.

 Every update returns a new store and leaves this one untouched; callers decide
 which versions to keep.  No path compression: a find walks the whole link
 chain, which union-by-rank keeps logarithmic.

 {@link #rep} answers a lookup in one walk: the representative handle, its rank
 and its descriptor together.  {@link #find}, {@link #rank} and
 {@link #descriptor} are the single-field views.

 Used by term-equality checks, with descriptors keyed by structural term hashes.
*/
public final class Points<D> {
  private final int _next;              // Next handle to hand out
  private final IntMap<Elem<D>> _eqs;   // Handle to rep or link

  private Points( int next, IntMap<Elem<D>> eqs ) { _next = next; _eqs = eqs; }
  public static <D> Points<D> make() { return new Points<>(0,new IntMap<>()); }

  /** @return number of handles allocated */
  public int size() { return _next; }
  /** @return the handle allocated by the most recent fresh */
  public int last() {
    if( _next==0 ) throw TODO("No handles allocated");
    return _next-1;
  }

  /** New store with the next handle as a singleton class, rank 0 */
  public Points<D> fresh( D desc ) {
    return new Points<>(_next+1,_eqs.put(_next,Elem.rep(0,desc)));
  }

  private Elem<D> elem( int p ) {
    Elem<D> e = _eqs.get(p,null);
    if( e==null ) throw new IllegalArgumentException("Unknown handle "+p);
    return e;
  }

  /** @return representative handle of p's class */
  public int find( int p ) {
    Elem<D> e;
    while( (e = elem(p)).is_link() ) p = e._link;
    return p;
  }
  public int rank( int p ) { return rep(p)._rank; }
  public D descriptor( int p ) { return rep(p)._desc; }

  /** @return p's class representative, with its rank and descriptor */
  public Rep<D> rep( int p ) {
    int r = find(p);
    Elem<D> e = elem(r);
    return new Rep<>(r,e._rank,e._desc);
  }

  // Result of a full lookup
  public static final class Rep<D> {
    public final int _id, _rank;
    public final D _desc;
    Rep( int id, int rank, D desc ) { _id = id; _rank = rank; _desc = desc; }
    @Override public String toString() { return _id+":r"+_rank+"="+_desc; }
  }
  public boolean equivalent( int p1, int p2 ) { return find(p1)==find(p2); }

  /** Merge the classes of p1 and p2, by rank.  The lower-ranked representative
   *  links under the higher, which is unchanged.  On a tie p1's representative
   *  links under p2's, which gains a rank and keeps p2's descriptor. */
  public Points<D> union( int p1, int p2 ) {
    int i1 = find(p1), i2 = find(p2);
    if( i1==i2 ) return this;
    Elem<D> e1 = elem(i1), e2 = elem(i2);
    if( e1._rank < e2._rank ) return new Points<>(_next,_eqs.put(i1,Elem.link(i2)));
    if( e1._rank > e2._rank ) return new Points<>(_next,_eqs.put(i2,Elem.link(i1)));
    IntMap<Elem<D>> eqs = _eqs.put(i1,Elem.link(i2)).put(i2,Elem.rep(e2._rank+1,e2._desc));
    return new Points<>(_next,eqs);
  }

  // Debug printer
  @Override public String toString() {
    SB sb = new SB().p('{');
    for( int i=0; i<_next; i++ ) {
      Elem<D> e = elem(i);
      sb.p(i).p(e.is_link() ? "->" : ":");
      if( e.is_link() ) sb.p(e._link);
      else sb.p('r').p(e._rank).p('=').pobj(String.valueOf(e._desc));
      sb.p(", ");
    }
    if( _next > 0 ) sb.unchar(2);
    return sb.p('}').toString();
  }
}
