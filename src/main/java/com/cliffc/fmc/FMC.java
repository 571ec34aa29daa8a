package com.cliffc.fmc;

import com.cliffc.fmc.hoas.Reduce;
import com.cliffc.fmc.term.Def;
import com.cliffc.fmc.term.Module;
import com.cliffc.fmc.term.Term;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/** Formality-Core: a minimal dependently-typed lambda calculus.

 Command line: each argument is a module file.  Every definition is printed
 with its term in full normal form.
*/
public abstract class FMC {
  public static RuntimeException TODO( String msg) { throw new RuntimeException(msg); }

  private static final String ANSI_RESET = "\u001B[0m";
  private static final String RED_BACK   = "\u001B[41m";

  public static void main( String[] args ) throws IOException {
    for( String arg : args ) {
      String src = Files.readString(Paths.get(arg));
      String rez = run(src);
      if( rez==null ) System.err.println(RED_BACK+"Parse error:"+ANSI_RESET+" "+arg);
      else System.out.println(rez);
    }
  }

  /** Parse a module and print it with every term normalized, or null if the
   *  source does not parse. */
  public static @Nullable String run( String src ) {
    Module mod = Parse.parse_module(src);
    if( mod==null ) return null;
    return normalize(mod).toString();
  }

  // Same definitions, same order, terms in normal form.  Types are kept as written.
  public static Module normalize( Module mod ) {
    Module nmod = new Module();
    for( Def def : mod.defs() ) {
      Term nf = Reduce.normalize(mod,def._term);
      nmod.add(new Def(def._name,def._type,nf));
    }
    return nmod;
  }
}
