package com.cliffc.fmc;

import com.cliffc.fmc.term.*;
import com.cliffc.fmc.term.Module;
import com.cliffc.fmc.util.Ary;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;

/** Recursive-descent parser for Formality-Core source text.

 Every production returns null on a miss and the caller rewinds; there are no
 error messages and no partial results.

 BNF:
   term = (all | lam | "Type" | id | "(" term ")") app* [":: " term]
   all  = [id] "(" id ":" term [;] ")" "->" term
   lam  = "(" id [;] ")" "=>" term
   app  = "(" term [;] ")"          // no whitespace before the "("
   def  = id ":" term term
   mod  = def*

 A ';' marks the binder or argument before it erased.  Names bound by an
 enclosing binder become de Bruijn Vars, all others module Refs.  An All
 domain sees the self name, the codomain sees self then the parameter.
*/
public class Parse {
  private final byte[] _buf;    // Bytes being parsed
  private int _x;               // Parser index
  private final Ary<String> _vs = new Ary<>(String.class); // Binder names in scope, innermost last

  Parse( String prog ) {
    _buf = prog.getBytes(StandardCharsets.UTF_8);
    _x   = 0;
  }

  // Handy for the debugger to print
  @Override public String toString() { return new String(_buf,_x,_buf.length-_x,StandardCharsets.UTF_8); }

  public static @Nullable Term parse_term( String prog ) {
    Parse P = new Parse(prog);
    Term t = P.term();
    return t==null || P.skipWS() != -1 ? null : t;
  }

  public static @Nullable Def parse_def( String prog ) {
    Parse P = new Parse(prog);
    Def d = P.def();
    return d==null || P.skipWS() != -1 ? null : d;
  }

  public static @Nullable Module parse_module( String prog ) {
    Parse P = new Parse(prog);
    Module mod = new Module();
    while( P.skipWS() != -1 ) {
      Def d = P.def();
      if( d==null ) return null;
      mod.add(d);
    }
    return mod;
  }

  // def = id ":" term term
  private Def def() {
    skipWS();
    String name = id();
    if( name==null || !peek(':') ) return null;
    Term type = term();
    if( type==null ) return null;
    Term term = term();
    return term==null ? null : new Def(name,type,term);
  }

  /** Parse a term, then any applications and a trailing annotation. */
  private Term term() {
    skipWS();
    int oldx = _x;
    Term t = all();
    if( t==null ) { _x = oldx; t = lam(); }
    if( t==null ) { _x = oldx; t = typ(); }
    if( t==null ) { _x = oldx; t = var(); }
    if( t==null ) { _x = oldx; t = par(); }
    if( t==null ) { _x = oldx; return null; }
    return ann(apps(t));
  }

  // [self]( name : dom [;] ) -> cod
  private Term all() {
    String self = id();
    if( self==null ) self = "";
    if( !peek_noWS('(') ) return null;
    skipWS();
    String name = id();
    if( name==null || !peek(':') ) return null;
    _vs.push(self);
    Term dom = term();
    _vs.pop();
    if( dom==null ) return null;
    boolean eras = peek(';');
    if( !peek(')') || !peek("->") ) return null;
    _vs.push(self).push(name);
    Term cod = term();
    _vs.pop(2);
    return cod==null ? null : new All(eras,self,name,dom,cod);
  }

  // ( name [;] ) => body
  private Term lam() {
    if( !peek_noWS('(') ) return null;
    skipWS();
    String name = id();
    if( name==null ) return null;
    boolean eras = peek(';');
    if( !peek(')') || !peek("=>") ) return null;
    _vs.push(name);
    Term body = term();
    _vs.pop();
    return body==null ? null : new Lam(eras,name,body);
  }

  private Term typ() {
    String id = id();
    return "Type".equals(id) ? Typ.TYP : null;
  }

  private Term var() {
    String id = id();
    if( id==null ) return null;
    int idx = _vs.find_up(id);
    return idx == -1 ? new Ref(id) : new Var(idx);
  }

  private Term par() {
    if( !peek_noWS('(') ) return null;
    Term t = term();
    return t != null && peek(')') ? t : null;
  }

  // Curried applications f(a)(b;)(c); stops at the first miss
  private Term apps( Term fun ) {
    while( true ) {
      int oldx = _x;
      if( !peek_noWS('(') ) return fun;
      Term arg = term();
      boolean eras = arg != null && peek(';');
      if( arg==null || !peek(')') ) { _x = oldx; return fun; }
      fun = new App(eras,fun,arg);
    }
  }

  // Trailing "term :: type"
  private Term ann( Term t ) {
    int oldx = _x;
    if( !peek("::") ) { _x = oldx; return t; }
    Term type = term();
    if( type==null ) { _x = oldx; return t; }
    return new Ann(false,type,t);
  }

  // ------------ LEXER -----------------------------------------------

  // An identifier, or null.  No whitespace skipping.
  private String id() {
    int x = _x;
    while( _x < _buf.length && isName(_buf[_x]) ) _x++;
    return x==_x ? null : new String(_buf,x,_x-x,StandardCharsets.UTF_8);
  }

  // Skip WS, return true&skip if match, false & do not skip if miss.
  private boolean peek( char c ) { return peek1(skipWS(),c); }
  private boolean peek_noWS( char c ) { return peek1(_x >= _buf.length ? -1 : _buf[_x],c); }
  private boolean peek1( byte c0, char c ) {
    if( c0!=c ) return false;
    _x++;                       // Skip peeked character
    return true;
  }
  private boolean peek( String s ) {
    if( !peek(s.charAt(0)) ) return false;
    if( !peek_noWS(s.charAt(1)) ) {  _x--; return false; }
    return true;
  }

  /** Advance parse pointer to the first non-whitespace character, and return
   *  that character, -1 otherwise.  Skips line and block comments. */
  private byte skipWS() {
    while( _x < _buf.length ) {
      byte c = _buf[_x];
      if( c=='/' && _x+1 < _buf.length && _buf[_x+1]=='/' ) { skipEOL()  ; continue; }
      if( c=='/' && _x+1 < _buf.length && _buf[_x+1]=='*' ) { skipBlock(); continue; }
      if( !isWS(c) )
        return c;
      _x++;
    }
    return -1;
  }
  private void skipEOL  () { while( _x < _buf.length && _buf[_x] != '\n' ) _x++; }
  // Unterminated block comments run to the end of the text
  private void skipBlock() {
    int start = _x += 2;
    while( _x < _buf.length && !(_x > start && _buf[_x-1]=='*' && _buf[_x]=='/') ) _x++;
    _x = Math.min(_x+1,_buf.length);
  }

  private static boolean isWS  (byte c) { return c == ' ' || c == '\t' || c == '\n' || c == '\r'; }
  private static boolean isName(byte c) { return ('a'<=c && c <= 'z') || ('A'<=c && c <= 'Z') || ('0'<=c && c <= '9') || c=='_'; }
}
