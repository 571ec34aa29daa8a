package com.cliffc.fmc.term;

import com.cliffc.fmc.util.SB;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

// A named, typed top-level definition.  Both terms are closed.
public class Def {
  public final String _name;
  public final Term _type, _term;
  public Def( @NotNull String name, @NotNull Term type, @NotNull Term term ) {
    _name = name; _type = type; _term = term;
  }

  // Persisted form: "name : type\nterm"
  public SB str( SB sb ) {
    _type.str(sb.p(_name).p(" : "),Term.names()).nl();
    return _term.str(sb,Term.names());
  }
  @Override public String toString() { return str(new SB()).toString(); }

  @Override public boolean equals( Object o ) {
    return o instanceof Def d && _name.equals(d._name) && _type.equals(d._type) && _term.equals(d._term);
  }
  @Override public int hashCode() { return Objects.hash(_name,_type,_term); }
}
