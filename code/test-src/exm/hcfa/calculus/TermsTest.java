package exm.hcfa.calculus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.base.Function;
import com.google.common.base.Functions;

import exm.hcfa.calculus.Terms.ApplicationTerm;
import exm.hcfa.calculus.Terms.CaseAlternative;
import exm.hcfa.calculus.Terms.CaseTerm;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.TermKind;
import exm.hcfa.calculus.Terms.VariableTerm;

public class TermsTest {

  /**
   * Annotations numbered 1..n in pre-order
   */
  private Term<Integer> numbered() {
    // let f = \x -> x in case f 'c' of { C a -> a; v -> fix v }
    Term<Integer> lambda = Terms.abstraction(2, "x",
                                  Terms.<Integer>variable(3, "x"));
    Term<Integer> scrutinee = Terms.application(5,
                  Terms.<Integer>variable(6, "f"),
                  Terms.<Integer>literal(7, Literal.character('c')));
    List<CaseAlternative<Integer>> alts = Arrays.asList(
        new CaseAlternative<Integer>(Pattern.constructor("C", "a"),
                                     Terms.<Integer>variable(8, "a")),
        new CaseAlternative<Integer>(Pattern.variable("v"),
            Terms.fix(9, new VariableTerm<Integer>(10, true, "v"))));
    Term<Integer> body = new CaseTerm<Integer>(4, scrutinee, alts);
    return Terms.letIn(1, "f", lambda, body);
  }

  @Test
  public void testIdentityMap() {
    Term<Integer> term = numbered();
    Term<Integer> mapped = term.map(Functions.<Integer>identity());
    assertEquals(term, mapped);
    assertEquals(term.hashCode(), mapped.hashCode());
    assertEquals(term.toString(true), mapped.toString(true));
  }

  @Test
  public void testPreOrder() {
    assertEquals(Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10),
                 TermWalk.annotations(numbered()));
  }

  @Test
  public void testMapVisitsPreOrder() {
    final int counter[] = new int[] {0};
    Term<String> mapped = numbered().map(new Function<Integer, String>() {
      @Override
      public String apply(Integer ann) {
        counter[0]++;
        return counter[0] + ":" + ann;
      }
    });
    assertEquals(10, counter[0]);
    List<String> anns = TermWalk.annotations(mapped);
    for (int i = 0; i < anns.size(); i++) {
      assertEquals((i + 1) + ":" + (i + 1), anns.get(i));
    }
    // Payload unchanged
    assertEquals(numbered().toString(), mapped.toString());
  }

  @Test
  public void testFoldDeterministic() {
    Combiner<String> concat = new Combiner<String>() {
      @Override
      public String identity() {
        return "";
      }

      @Override
      public String combine(String left, String right) {
        return left + right;
      }
    };
    Function<Integer, String> show = new Function<Integer, String>() {
      @Override
      public String apply(Integer ann) {
        return "<" + ann + ">";
      }
    };
    String first = TermWalk.foldMap(numbered(), show, concat);
    String second = TermWalk.foldMap(numbered(), show, concat);
    assertEquals("<1><2><3><4><5><6><7><8><9><10>", first);
    assertEquals(first, second);
  }

  @Test
  public void testFlagPreserved() {
    Term<String> mapped = numbered().map(Functions.toStringFunction());
    final boolean found[] = new boolean[] {false};
    TermWalk.walk(mapped, new TermWalk.TermWalker<String>() {
      @Override
      public void visit(VariableTerm<String> var) {
        if (var.name().equals("v")) {
          assertTrue(var.flag());
          found[0] = true;
        } else {
          assertFalse(var.flag());
        }
      }
    });
    assertTrue(found[0]);
  }

  @Test
  public void testWithAnnotationSharesChildren() {
    ApplicationTerm<Integer> app = (ApplicationTerm<Integer>)
        Terms.application(1, Terms.<Integer>variable(2, "f"),
                          Terms.<Integer>variable(3, "x"));
    ApplicationTerm<Integer> reannotated =
                    (ApplicationTerm<Integer>)app.withAnnotation(42);
    assertEquals(42, (int)reannotated.annotation());
    assertSame(app.function(), reannotated.function());
    assertSame(app.argument(), reannotated.argument());
    assertNotEquals(app, reannotated);
  }

  @Test
  public void testToString() {
    assertEquals("(let f = (\\x -> x) in (case (f 'c') of " +
                 "{(C a) -> a; v -> (fix v)}))", numbered().toString());
    Term<Integer> small = Terms.application(1,
            Terms.<Integer>hardwired(2, HardwiredValue.tupleCon(1)),
            Terms.<Integer>hardwired(3, HardwiredValue.LIST_NIL));
    assertEquals("((,) [])", small.toString());
    assertEquals("((,){2} []{3}){1}", small.toString(true));
  }

  @Test
  public void testChildrenAndKinds() {
    Term<Integer> term = numbered();
    assertEquals(TermKind.LET_IN, term.kind());
    assertEquals(2, term.children().size());
    assertEquals(TermKind.CASE, term.children().get(1).kind());
    // Scrutinee plus two alternatives
    assertEquals(3, term.children().get(1).children().size());
    assertEquals(1, TermWalk.count(term, TermKind.FIX));
    assertEquals(4, TermWalk.count(term, TermKind.VARIABLE));
  }

  @Test
  public void testApplicationsLeftNested() {
    Term<String> t = TermBuilders.app(TermBuilders.var("f"),
                      TermBuilders.var("a"), TermBuilders.var("b"));
    assertEquals("((f a) b)", t.toString());
  }
}
