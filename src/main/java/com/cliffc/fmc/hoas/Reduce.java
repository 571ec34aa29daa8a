package com.cliffc.fmc.hoas;

import com.cliffc.fmc.eval.Eval;
import com.cliffc.fmc.term.*;
import com.cliffc.fmc.term.Module;
import com.cliffc.fmc.hoas.TermH.*;
import org.jetbrains.annotations.NotNull;

/** Reduction and normalization over higher-order terms.

 A beta step calls the lambda's body function with the argument: no shifting,
 no copying.  Erased lambdas are instantiated with an opaque placeholder and
 erased arguments are dropped unread, so erased content is never inspected.

 For terms with no erasure marks, {@link #reduce} agrees with
 {@link Eval#eval_term}.
*/
public abstract class Reduce {
  private static final RefH ERASED = new RefH(Term.ERASED);

  /** Weak-head normal form */
  public static TermH reduce_termh( Module mod, TermH t ) {
    while( true ) {
      if( t instanceof RefH ref ) {
        if( ref._name.equals(Term.ERASED) ) return ref; // Opaque, never looked up
        Term x = Eval.deref(ref._name,mod);
        if( x instanceof Ref ref2 && ref2._name.equals(ref._name) ) return ref;
        t = HOAS.to_termh(x);
      } else if( t instanceof LamH lam && lam._eras ) {
        t = lam.apply(ERASED);
      } else if( t instanceof AppH app && app._eras ) {
        t = app._fun;
      } else if( t instanceof AppH app ) {
        TermH fun = reduce_termh(mod,app._fun);
        if( !(fun instanceof LamH lam) )
          return new AppH(false,fun,reduce_termh(mod,app._arg));
        t = lam.apply(app._arg); // Argument passed unreduced
      } else if( t instanceof AnnH ann ) {
        t = ann._term;
      } else
        return t;               // VarH, TypH, AllH, non-erased LamH
    }
  }

  /** Full normal form: head rules first, then every child, under binders too.
   *  Binder bodies are normalized lazily, when the binder function is called. */
  public static TermH normalize_termh( Module mod, TermH t ) {
    TermH h = reduce_termh(mod,t);
    if( h instanceof AllH all )
      return new AllH(all._eras,all._self,all._name,
                      self        -> normalize_termh(mod,all._dom.apply(self)),
                      (self,parm) -> normalize_termh(mod,all._cod.apply(self,parm)));
    if( h instanceof LamH lam )
      return new LamH(lam._eras,lam._name, x -> normalize_termh(mod,lam.apply(x)));
    if( h instanceof AppH app )
      return new AppH(app._eras,normalize_termh(mod,app._fun),normalize_termh(mod,app._arg));
    return h;
  }

  public static Term reduce( @NotNull Module mod, @NotNull Term t ) {
    return HOAS.from_termh(reduce_termh(mod,HOAS.to_termh(t)));
  }

  public static Term normalize( @NotNull Module mod, @NotNull Term t ) {
    return HOAS.from_termh(normalize_termh(mod,HOAS.to_termh(t)));
  }
}
