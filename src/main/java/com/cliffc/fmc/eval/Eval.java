package com.cliffc.fmc.eval;

import com.cliffc.fmc.term.*;
import com.cliffc.fmc.term.Module;
import org.jetbrains.annotations.NotNull;

/** Lower-order interpreter: call-by-name weak-head reduction directly on de
 *  Bruijn terms, using substitution for beta steps.

 Arguments consumed by a beta step are passed unreduced; only the argument of a
 stuck application is reduced.  Does not reduce under binders.  May not
 terminate on self-referential or non-normalizing terms.
*/
public abstract class Eval {

  /** Look up the stored term for a name, or a reference to the name itself if
   *  undefined.  The erased placeholder is never looked up. */
  public static Term deref( String name, Module mod ) {
    Def def = name.equals(Term.ERASED) ? null : mod.get(name);
    return def == null ? new Ref(name) : def._term;
  }

  public static Term eval_term( @NotNull Term term, @NotNull Module mod ) {
    if( term instanceof App app ) {
      Term fun = eval_term(app._fun,mod);
      if( fun instanceof Lam lam )
        return eval_term(lam._body.subst(app._arg,0),mod);
      return new App(app._eras,fun,eval_term(app._arg,mod));
    }
    if( term instanceof Ann ann )
      return eval_term(ann._term,mod);
    if( term instanceof Ref ref ) {
      Term x = deref(ref._name,mod);
      // A name aliased to itself is stuck.  Longer cycles are not caught.
      if( x instanceof Ref ref2 && ref2._name.equals(ref._name) ) return ref2;
      return eval_term(x,mod);
    }
    return term;               // Var, Typ, All, Lam
  }
}
