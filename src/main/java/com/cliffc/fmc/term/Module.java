package com.cliffc.fmc.term;

import com.cliffc.fmc.util.SB;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;

/** Named definitions, in insertion order.  Printing never reorders.

 Re-adding a name replaces the definition but keeps its original position.
 Undefined names are not an error: evaluation leaves them as stuck references.
*/
public class Module {
  private final LinkedHashMap<String,Def> _defs = new LinkedHashMap<>();

  public Module add( @NotNull Def def ) { _defs.put(def._name,def); return this; }

  // Definition by name, or null
  public @Nullable Def get( String name ) { return _defs.get(name); }

  public boolean has( String name ) { return _defs.containsKey(name); }
  public int len() { return _defs.size(); }
  // Read-only, in insertion order
  public Collection<Def> defs() { return Collections.unmodifiableCollection(_defs.values()); }

  // Definitions separated by blank lines
  public SB str( SB sb ) {
    boolean first = true;
    for( Def def : _defs.values() ) {
      if( !first ) sb.nl().nl();
      first = false;
      def.str(sb);
    }
    return sb;
  }
  @Override public String toString() { return str(new SB()).toString(); }
}
