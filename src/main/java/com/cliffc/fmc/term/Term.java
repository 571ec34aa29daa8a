package com.cliffc.fmc.term;

import com.cliffc.fmc.util.Ary;
import com.cliffc.fmc.util.SB;

/** Formality-Core terms.

 Immutable trees; variables are de Bruijn indices, counting binders between the
 use and its binder.  Every transformation makes a new tree.

 Binder depths:
   Lam body        - one new binder (the parameter, index 0)
   All domain      - one new binder (self, index 0)
   All codomain    - two new binders (self at index 1, parameter at index 0)

 Erased (computationally irrelevant) parameters and arguments are flagged and
 dropped by {@link #erase}.
*/
public abstract class Term {
  // Opaque stand-in for an erased binder; never looked up in a Module
  public static final String ERASED = "<erased>";
  public static final Ref ERASED_REF = new Ref(ERASED);

  /** Add inc to every free index at or above dep. */
  public abstract Term shift( int inc, int dep );

  /** Replace index dep with v, lowering the free indices above dep by one.  The
   *  value is shifted as it passes under binders so its free indices are never
   *  captured. */
  public abstract Term subst( Term v, int dep );

  /** Strip computationally irrelevant content. */
  public abstract Term erase();

  // Alpha-invariant structural hash; binder names do not participate.
  public abstract int hash();

  /** True if a free reference to name appears anywhere inside. */
  public abstract boolean refs( String name );

  // Pretty print, using the binder names in scope.  The innermost binder is
  // the last pushed name.
  public abstract SB str( SB sb, Ary<String> vs );

  // Needs parens when printed at an application head or annotated
  boolean open_ended() { return false; }
  SB str_paren( SB sb, Ary<String> vs ) {
    return open_ended() ? str(sb.p('('),vs).p(')') : str(sb,vs);
  }

  // Printed name for a binder.  A name already in scope, or used by a free
  // reference in the binder's scope, would capture on reparse: suffix it.
  static String bind_name( String name, Ary<String> vs, Term a, Term b ) {
    if( name.isEmpty() ) return name;
    String n = name;
    for( int k=1; vs.find_up(n) != -1 || a.refs(n) || (b != null && b.refs(n)); k++ )
      n = name+"_"+k;
    return n;
  }

  static Ary<String> names() { return new Ary<>(String.class); }
  @Override public final String toString() { return str(new SB(),names()).toString(); }
}
