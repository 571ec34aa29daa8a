package com.cliffc.fmc.hoas;

import com.cliffc.fmc.Parse;
import com.cliffc.fmc.eval.Eval;
import com.cliffc.fmc.hoas.TermH.*;
import com.cliffc.fmc.term.*;
import com.cliffc.fmc.term.Module;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Random;

import static org.junit.Assert.*;

public class TestHOAS {
  static final String CHURCH =
    "Nat : Type\n"+
    "(P : Type) -> (s : (x : P) -> P) -> (z : P) -> P\n"+
    "\n"+
    "zero : Nat\n"+
    "(P) => (s) => (z) => z\n"+
    "\n"+
    "succ : (n : Nat) -> Nat\n"+
    "(n) => (P) => (s) => (z) => s(n(P)(s)(z))\n"+
    "\n"+
    "two : Nat\n"+
    "succ(succ(zero))\n"+
    "\n"+
    "add : (m : Nat) -> (n : Nat) -> Nat\n"+
    "(m) => (n) => (P) => (s) => (z) => m(P)(s)(n(P)(s)(z))\n"+
    "\n"+
    "four : Nat\n"+
    "add(two)(two)\n"+
    "\n"+
    "identity : (A : Type) -> (a : A) -> A\n"+
    "(A) => (a) => a\n"+
    "\n"+
    "loop : Type\n"+
    "loop\n";

  // Erasure-free terms with terminating reductions
  static final String[] CORPUS = {
    "Type",
    "four",
    "two(Nat)",
    "add(two)",
    "identity(Type)(Type)",
    "identity(Nat)",
    "(x) => identity(Type)(x)",
    "(x : identity(Type)(Type)) -> x",
    "f(identity(Type)(Type))",
    "loop(two)",
    "loop",
    "missing",
    "(Type :: Type)(four)",
    "((a) => (b) => a)(succ)(zero)",
    "s(x : s) -> x",
  };

  private static Module church() {
    Module mod = Parse.parse_module(CHURCH);
    assertNotNull(mod);
    return mod;
  }
  private static Term parse( String s ) {
    Term t = Parse.parse_term(s);
    assertNotNull(s,t);
    return t;
  }

  @Test public void testRoundTrip() {
    Random R = new Random(1234);
    for( int i=0; i<1000; i++ ) {
      Term t = TermGen.gen(R,0,10,true);
      assertEquals(t,HOAS.from_termh(HOAS.to_termh(t)));
    }
  }

  // Free indices survive the trip unchanged
  @Test public void testRoundTripOpen() {
    Random R = new Random(99);
    for( int i=0; i<1000; i++ ) {
      Term t = TermGen.gen(R,0,10,false);
      assertEquals(t,HOAS.from_termh(HOAS.to_termh(t)));
    }
    Term t = new Lam(false,"x",new App(false,new Var(0),new Var(3)));
    assertEquals(t,HOAS.from_termh(HOAS.to_termh(t)));
  }

  // Calling a binder function is the same as index substitution
  @Test public void testBetaIsSubst() {
    Random R = new Random(7);
    for( int i=0; i<500; i++ ) {
      Term body = TermGen.gen(R,1,8,false);
      Term arg  = TermGen.gen(R,0,4,false);
      LamH lam = (LamH)HOAS.to_termh(new Lam(false,"x",body));
      assertEquals(body.subst(arg,0),HOAS.from_termh(lam.apply(HOAS.to_termh(arg))));
    }
  }

  // Self then parameter for the codomain, self alone for the domain
  @Test public void testAllBinders() {
    Term all = new All(false,"s","x",new Var(0),new App(false,new Var(1),new Var(0)));
    AllH h = (AllH)HOAS.to_termh(all);
    TermH self = new RefH("me"), parm = new RefH("arg");
    assertEquals(new Ref("me"),HOAS.from_termh(h._dom.apply(self)));
    assertEquals(new App(false,new Ref("me"),new Ref("arg")),HOAS.from_termh(h._cod.apply(self,parm)));
    assertEquals(all,HOAS.from_termh(h));
  }

  @Test public void testScenarioIdentity() {
    Module mod = church();
    assertEquals(Typ.TYP,Reduce.normalize(mod,parse("identity(Type)(Type)")));
    assertEquals(Typ.TYP,Reduce.reduce   (mod,parse("identity(Type)(Type)")));
  }

  @Test public void testNormalize() {
    Module mod = church();
    assertEquals("(P) => (s) => (z) => s(s(z))"      ,Reduce.normalize(mod,parse("two" )).toString());
    assertEquals("(P) => (s) => (z) => s(s(s(s(z))))",Reduce.normalize(mod,parse("four")).toString());
    assertEquals("(x) => x"                          ,Reduce.normalize(mod,parse("(x) => identity(Type)(x)")).toString());
    assertEquals("(x : Type) -> x"                   ,Reduce.normalize(mod,parse("(x : identity(Type)(Type)) -> x")).toString());
    assertEquals("f(Type)"                           ,Reduce.normalize(mod,parse("f(identity(Type)(Type))")).toString());
  }

  // Weak-head reduction stops at the first lambda
  @Test public void testReduceWeakHead() {
    Module mod = church();
    assertEquals("(P) => (s) => (z) => s(succ(zero)(P)(s)(z))",Reduce.reduce(mod,parse("two")).toString());
    assertEquals("(x) => identity(Type)(x)",Reduce.reduce(mod,parse("(x) => identity(Type)(x)")).toString());
  }

  // Both evaluators give the same weak-head results
  @Test public void testAgreesWithEval() {
    Module mod = church();
    for( String s : CORPUS ) {
      Term t = parse(s);
      assertEquals(s,Eval.eval_term(t,mod),Reduce.reduce(mod,t));
    }
  }

  @Test public void testIdempotent() {
    Module mod = church();
    for( String s : CORPUS ) {
      Term n = Reduce.normalize(mod,parse(s));
      assertEquals(s,n,Reduce.normalize(mod,n));
    }
  }

  @Test public void testSelfAlias() {
    Module mod = church();
    assertEquals(new Ref("loop"),Reduce.reduce(mod,parse("loop")));
    assertEquals("loop((P) => (s) => (z) => s(s(z)))",Reduce.normalize(mod,parse("loop(two)")).toString());
  }

  @Test public void testErasure() {
    Module mod = church();
    // Erased lambda at the head takes the placeholder
    assertEquals(Typ.TYP,Reduce.reduce(mod,parse("(A;) => Type")));
    assertEquals(Term.ERASED_REF,Reduce.reduce(mod,parse("(A;) => A")));
    // Erased application drops its argument
    assertEquals(Typ.TYP,Reduce.reduce(mod,parse("((A;) => Type)(four;)")));
    assertEquals(new Ref("f"),Reduce.normalize(mod,parse("f(two;)")));
    // Agrees with erasing first
    Term t = parse("(x) => ((A;) => (a) => a)(Nat;)(x)");
    assertEquals(Reduce.normalize(mod,t.erase()),Reduce.normalize(mod,t));
    assertEquals("(x) => x",Reduce.normalize(mod,t).toString());
  }

  // Erased arguments are never inspected, not even to look up a name
  @Test public void testErasedArgNeverLookedUp() {
    ArrayList<String> lookups = new ArrayList<>();
    Module spy = new Module() {
      @Override public Def get( String name ) { lookups.add(name); return super.get(name); }
    };
    Term t = parse("((x;) => Type)(missing;)");
    assertEquals(Typ.TYP,Reduce.reduce   (spy,t));
    assertEquals(Typ.TYP,Reduce.normalize(spy,t));
    assertEquals(Term.ERASED_REF,Reduce.normalize(spy,parse("((x;) => x)(missing;)")));
    assertTrue(lookups.isEmpty());
  }
}
