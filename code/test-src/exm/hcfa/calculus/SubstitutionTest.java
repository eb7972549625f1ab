package exm.hcfa.calculus;

import static exm.hcfa.calculus.TermBuilders.alt;
import static exm.hcfa.calculus.TermBuilders.app;
import static exm.hcfa.calculus.TermBuilders.caseOf;
import static exm.hcfa.calculus.TermBuilders.lam;
import static exm.hcfa.calculus.TermBuilders.let;
import static exm.hcfa.calculus.TermBuilders.lit;
import static exm.hcfa.calculus.TermBuilders.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.VariableTerm;

public class SubstitutionTest {

  @Test
  public void testReplaceFree() {
    Term<String> t = app(var("f"), var("x"), var("f"));
    assertEquals(app(lit(1), var("x"), lit(1)),
                 Substitution.replace("f", lit(1), t));
  }

  @Test
  public void testAbstractionShadows() {
    Term<String> t = app(var("x"), lam("x", var("x")));
    assertEquals(app(var("y"), lam("x", var("x"))),
                 Substitution.replace("x", var("y"), t));
  }

  @Test
  public void testLetShadowsBoundTermToo() {
    // Recursive let scope covers the bound term
    Term<String> t = let("x", app(var("g"), var("x")), var("x"));
    assertSame(t, Substitution.replace("x", lit(3), t));
    Term<String> other = let("y", var("x"), var("x"));
    assertEquals(let("y", lit(3), lit(3)),
                 Substitution.replace("x", lit(3), other));
  }

  @Test
  public void testCasePatternShadows() {
    Term<String> t = caseOf(var("x"),
        alt(Pattern.constructor("Just", "x"), var("x")),
        alt(Pattern.variable("v"), app(var("x"), var("v"))));
    Term<String> expected = caseOf(var("z"),
        alt(Pattern.constructor("Just", "x"), var("x")),
        alt(Pattern.variable("v"), app(var("z"), var("v"))));
    assertEquals(expected, Substitution.replace("x", var("z"), t));
  }

  @Test
  public void testReplaceCaptures() {
    // Plain replacement is not capture-avoiding
    Term<String> t = lam("x", var("y"));
    assertEquals(lam("x", var("x")), Substitution.replace("y", var("x"), t));
  }

  @Test
  public void testAvoidCaptureAbstraction() {
    Term<String> t = lam("x", app(var("y"), var("x")));
    assertEquals(lam("x'", app(var("x"), var("x'"))),
                 Substitution.replaceAvoidingCapture("y", var("x"), t));
  }

  @Test
  public void testAvoidCaptureFreshNameUnused() {
    // x' is already used inside, so x'' is chosen
    Term<String> t = lam("x", app(var("y"), var("x"), var("x'")));
    assertEquals(lam("x''", app(var("x"), var("x''"), var("x'"))),
                 Substitution.replaceAvoidingCapture("y", var("x"), t));
  }

  @Test
  public void testAvoidCaptureLetAndCase() {
    Term<String> t = let("a", var("y"), app(var("a"), var("y")));
    assertEquals(let("a'", var("a"), app(var("a'"), var("a"))),
                 Substitution.replaceAvoidingCapture("y", var("a"), t));

    Term<String> c = caseOf(var("s"),
        alt(Pattern.constructor("Pair", "a", "b"),
            app(var("y"), var("a"), var("b"))));
    Term<String> expected = caseOf(var("s"),
        alt(Pattern.constructor("Pair", "a'", "b"),
            app(var("a"), var("a'"), var("b"))));
    assertEquals(expected,
                 Substitution.replaceAvoidingCapture("y", var("a"), c));
  }

  @Test
  public void testAvoidCaptureLeavesUnaffectedBinders() {
    // Binder clashes with replacement but target does not occur below it
    Term<String> t = app(var("y"), lam("x", var("x")));
    assertEquals(app(var("x"), lam("x", var("x"))),
                 Substitution.replaceAvoidingCapture("y", var("x"), t));
  }

  @Test
  public void testRenameKeepsFlag() {
    Term<String> t = lam("z", app(new VariableTerm<String>("a", true, "x"),
                                  var("z")));
    Term<String> renamed = Substitution.rename("x", "w", t);
    assertEquals(lam("z", app(new VariableTerm<String>("a", true, "w"),
                              var("z"))), renamed);
    assertSame(t, Substitution.rename("z", "q", lam("z", var("z"))));
  }

  @Test
  public void testOccursFree() {
    assertTrue(Substitution.occursFree("f", app(var("f"), lit(2))));
    assertFalse(Substitution.occursFree("f", lam("f", var("f"))));
    assertFalse(Substitution.occursFree("f", let("f", lit(1), var("f"))));
  }
}
