package com.cliffc.fmc.hoas;

import com.cliffc.fmc.term.*;
import com.cliffc.fmc.hoas.TermH.*;
import org.jetbrains.annotations.NotNull;

import static com.cliffc.fmc.FMC.TODO;

/** Conversions between de Bruijn terms and higher-order terms.

 Converting in keeps an immutable scope of the substitutes for the binders
 currently open; binder bodies are converted lazily, when their function is
 called.  Converting out calls each binder with a fresh level marker and turns
 levels back into indices.  from_termh(to_termh(t)) equals t.
*/
public abstract class HOAS {

  // Immutable cons-list scope; head is the innermost binder.  Captured by the
  // binder functions, so never mutated.
  static final class Scope {
    final TermH _val;
    final Scope _next;
    final int _len;
    Scope( TermH val, Scope next ) { _val = val; _next = next; _len = next==null ? 1 : next._len+1; }
    static int len( Scope s ) { return s==null ? 0 : s._len; }
    static TermH at( Scope s, int i ) {
      for( ; i>0; i-- ) s = s._next;
      return s._val;
    }
  }

  public static TermH to_termh( @NotNull Term t ) { return to_termh(t,null); }

  static TermH to_termh( Term t, Scope vs ) {
    if( t instanceof Var v ) {
      int len = Scope.len(vs);
      // Free in the whole term: keep by index, as a negative level
      return v._idx < len ? Scope.at(vs,v._idx) : new VarH(len-v._idx-1);
    }
    if( t instanceof Ref r ) return new RefH(r._name);
    if( t instanceof Typ   ) return TypH.TYP;
    if( t instanceof All a ) return new AllH(a._eras,a._self,a._name,
                                             self        -> to_termh(a._dom,new Scope(self,vs)),
                                             (self,parm) -> to_termh(a._cod,new Scope(parm,new Scope(self,vs))));
    if( t instanceof Lam l ) return new LamH(l._eras,l._name, x -> to_termh(l._body,new Scope(x,vs)));
    if( t instanceof App a ) return new AppH(a._eras,to_termh(a._fun,vs),to_termh(a._arg,vs));
    if( t instanceof Ann a ) return new AnnH(a._done,to_termh(a._type,vs),to_termh(a._term,vs));
    throw TODO("Unknown term "+t.getClass().getSimpleName());
  }

  public static Term from_termh( @NotNull TermH t ) { return from_termh(t,0); }

  // dep is the number of binders entered so far, and the level of the next marker
  static Term from_termh( TermH t, int dep ) {
    if( t instanceof VarH v ) return new Var(dep-v._lvl-1);
    if( t instanceof RefH r ) return new Ref(r._name);
    if( t instanceof TypH   ) return Typ.TYP;
    if( t instanceof AllH a ) return new All(a._eras,a._self,a._name,
                                             from_termh(a._dom.apply(new VarH(dep)),dep+1),
                                             from_termh(a._cod.apply(new VarH(dep),new VarH(dep+1)),dep+2));
    if( t instanceof LamH l ) return new Lam(l._eras,l._name,from_termh(l.apply(new VarH(dep)),dep+1));
    if( t instanceof AppH a ) return new App(a._eras,from_termh(a._fun,dep),from_termh(a._arg,dep));
    if( t instanceof AnnH a ) return new Ann(a._done,from_termh(a._type,dep),from_termh(a._term,dep));
    throw TODO("Unknown term "+t.getClass().getSimpleName());
  }
}
