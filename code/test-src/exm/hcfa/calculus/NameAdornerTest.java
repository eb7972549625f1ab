package exm.hcfa.calculus;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import exm.hcfa.calculus.NameAdornment.Depth;
import exm.hcfa.calculus.Terms.Term;

public class NameAdornerTest {

  private static final NameAdornment NONE = NameAdornment.NONE;

  private static List<NameAdornment> adornments(Term<Integer> term) {
    List<NameAdornment> result = new ArrayList<NameAdornment>();
    int expectedAnn = 1;
    for (Adorned<Integer> a: TermWalk.annotations(NameAdorner.adorn(term))) {
      // Original annotations are kept alongside
      assertEquals(expectedAnn++, (int)a.annotation);
      result.add(a.adornment);
    }
    return result;
  }

  @Test
  public void testLetBoundLambda() {
    // let f = \x -> g x in f 1
    Term<Integer> term = Terms.letIn(1, "f",
        Terms.abstraction(2, "x", Terms.application(3,
            Terms.<Integer>variable(4, "g"), Terms.<Integer>variable(5, "x"))),
        Terms.application(6, Terms.<Integer>variable(7, "f"),
            Terms.<Integer>literal(8, Literal.integer(1))));
    NameAdornment f = NameAdornment.shallow("f");
    NameAdornment insideF = NameAdornment.deep("f");
    assertEquals(Arrays.asList(NONE, f, insideF, insideF, insideF,
                               NONE, NONE, NONE), adornments(term));
  }

  @Test
  public void testNestedLet() {
    // let f = (let y = z in y) in f
    Term<Integer> term = Terms.letIn(1, "f",
        Terms.letIn(2, "y", Terms.<Integer>variable(3, "z"),
                            Terms.<Integer>variable(4, "y")),
        Terms.<Integer>variable(5, "f"));
    assertEquals(Arrays.asList(NONE, NameAdornment.shallow("f"),
          NameAdornment.shallow("y"), NameAdornment.deep("f"), NONE),
        adornments(term));
  }

  @Test
  public void testCaseAndFix() {
    // let h = case s of { v -> fix v } in h
    Term<Integer> term = Terms.letIn(1, "h",
        new Terms.CaseTerm<Integer>(2, Terms.<Integer>variable(3, "s"),
          Collections.singletonList(new Terms.CaseAlternative<Integer>(
              Pattern.variable("v"),
              Terms.fix(4, Terms.<Integer>variable(5, "v"))))),
        Terms.<Integer>variable(6, "h"));
    NameAdornment h = NameAdornment.shallow("h");
    NameAdornment insideH = NameAdornment.deep("h");
    assertEquals(Arrays.asList(NONE, h, insideH, insideH, insideH, NONE),
                 adornments(term));
  }

  @Test
  public void testDeeper() {
    NameAdornment f = NameAdornment.shallow("f");
    assertEquals(NameAdornment.deep("f"), f.deeper());
    assertEquals(NameAdornment.deep("f"), f.deeper().deeper());
    assertSame(NONE, NONE.deeper());
    assertFalse(NONE.hasName());
    assertEquals(Depth.DEEP, f.deeper().depth());
    assertEquals("f", f.toString());
    assertEquals("{inside f}", f.deeper().toString());
  }

  @Test(expected=IllegalStateException.class)
  public void testNoneHasNoName() {
    NONE.name();
  }

  @Test
  public void testOrdering() {
    List<NameAdornment> list = new ArrayList<NameAdornment>(Arrays.asList(
        NONE, NameAdornment.deep("a"), NameAdornment.shallow("b"),
        NameAdornment.shallow("a")));
    Collections.sort(list);
    assertEquals(Arrays.asList(NameAdornment.shallow("a"),
        NameAdornment.shallow("b"), NameAdornment.deep("a"), NONE), list);
    assertTrue(NameAdornment.shallow("a").compareTo(
               NameAdornment.deep("a")) < 0);
  }
}
