package exm.hcfa.calculus;

import static exm.hcfa.calculus.TermBuilders.U;
import static exm.hcfa.calculus.TermBuilders.app;
import static exm.hcfa.calculus.TermBuilders.bind;
import static exm.hcfa.calculus.TermBuilders.lam;
import static exm.hcfa.calculus.TermBuilders.let;
import static exm.hcfa.calculus.TermBuilders.lit;
import static exm.hcfa.calculus.TermBuilders.var;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.hcfa.calculus.Terms.LetInTerm;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.TermKind;
import exm.hcfa.common.Logging;

public class LetGroupsTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/LetGroupsTest.hcfa.log", true);
  }

  @Test
  public void testFirstBindingOutermost() {
    Term<String> t = LetGroups.namedTermsToLets(Arrays.asList(
        bind("a", lit(1)), bind("b", var("a"))), var("b"), U);
    assertEquals(let("a", lit(1), let("b", var("a"), var("b"))), t);
  }

  @Test
  public void testEmptyGroup() {
    assertEquals(var("x"), LetGroups.letGroup(
        Collections.<Binding<String>>emptyList(), var("x"), U));
  }

  @Test
  public void testLetGroupOrdersDependencies() {
    Term<String> t = LetGroups.letGroup(Arrays.asList(
        bind("b", app(var("a"), lit(2))), bind("a", lam("x", var("x")))),
        app(var("b"), var("a")), U);
    assertEquals(let("a", lam("x", var("x")),
                   let("b", app(var("a"), lit(2)),
                     app(var("b"), var("a")))), t);
  }

  @Test
  public void testLetGroupRecursive() {
    Term<String> t = LetGroups.letGroup(Arrays.asList(
        bind("f", lam("x", app(var("g"), var("x")))),
        bind("g", lam("y", app(var("f"), var("y"))))),
        app(var("f"), lit(0)), U);
    String names[] = new String[] {"@f@", "@g@", "f", "g"};
    Term<String> cur = t;
    for (String name: names) {
      assertEquals(TermKind.LET_IN, cur.kind());
      LetInTerm<String> let = (LetInTerm<String>)cur;
      assertEquals(name, let.boundName());
      cur = let.body();
    }
    assertEquals(app(var("f"), lit(0)), cur);
    // Two fixed points for f, three for g
    assertEquals(5, TermWalk.count(t, TermKind.FIX));
  }
}
