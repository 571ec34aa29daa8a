package com.cliffc.fmc.hoas;

import java.util.function.BiFunction;
import java.util.function.Function;

/** Higher-order terms.  Binders are Java functions from already-built
 *  subterms to subterms, so a beta step is a single call with no index
 *  bookkeeping.  Only live for one reduce or normalize call.
 */
public abstract class TermH {

  // --- VarH ------------------------
  // A variable by de Bruijn *level*, counted from the outermost binder of the
  // quote.  Markers handed to binders while quoting have levels 0,1,2...;
  // variables free in the converted term get negative levels, -1 being the
  // nearest enclosing binder outside the term.
  public static class VarH extends TermH {
    public final int _lvl;
    public VarH( int lvl ) { _lvl = lvl; }
  }

  // --- RefH ------------------------
  public static class RefH extends TermH {
    public final String _name;
    public RefH( String name ) { _name = name; }
  }

  // --- TypH ------------------------
  public static class TypH extends TermH {
    public static final TypH TYP = new TypH();
    private TypH() { }
  }

  // --- AllH ------------------------
  // Domain is a function of self; codomain of self then the parameter
  public static class AllH extends TermH {
    public final boolean _eras;
    public final String _self, _name;
    public final Function<TermH,TermH> _dom;
    public final BiFunction<TermH,TermH,TermH> _cod;
    public AllH( boolean eras, String self, String name, Function<TermH,TermH> dom, BiFunction<TermH,TermH,TermH> cod ) {
      _eras = eras; _self = self; _name = name; _dom = dom; _cod = cod;
    }
  }

  // --- LamH ------------------------
  public static class LamH extends TermH {
    public final boolean _eras;
    public final String _name;
    public final Function<TermH,TermH> _body;
    public LamH( boolean eras, String name, Function<TermH,TermH> body ) { _eras = eras; _name = name; _body = body; }
    public TermH apply( TermH arg ) { return _body.apply(arg); }
  }

  // --- AppH ------------------------
  public static class AppH extends TermH {
    public final boolean _eras;
    public final TermH _fun, _arg;
    public AppH( boolean eras, TermH fun, TermH arg ) { _eras = eras; _fun = fun; _arg = arg; }
  }

  // --- AnnH ------------------------
  public static class AnnH extends TermH {
    public final boolean _done;
    public final TermH _type, _term;
    public AnnH( boolean done, TermH type, TermH term ) { _done = done; _type = type; _term = term; }
  }

  // Debug printer; quotes back to a lower-order term
  @Override public String toString() { return HOAS.from_termh(this).toString(); }
}
