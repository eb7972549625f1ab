package exm.hcfa.calculus;

import static exm.hcfa.calculus.TermBuilders.alt;
import static exm.hcfa.calculus.TermBuilders.app;
import static exm.hcfa.calculus.TermBuilders.bind;
import static exm.hcfa.calculus.TermBuilders.caseOf;
import static exm.hcfa.calculus.TermBuilders.lam;
import static exm.hcfa.calculus.TermBuilders.let;
import static exm.hcfa.calculus.TermBuilders.lit;
import static exm.hcfa.calculus.TermBuilders.var;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.BeforeClass;
import org.junit.Test;

import com.google.common.collect.SetMultimap;

import exm.hcfa.common.Logging;

public class CallGraphTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/CallGraphTest.hcfa.log", true);
  }

  @Test
  public void testReferencedNamesDuplicates() {
    assertEquals(Arrays.asList("f", "x", "f"),
        CallGraph.referencedNames(app(var("f"), var("x"), var("f"))));
    assertEquals(Collections.emptyList(),
        CallGraph.referencedNames(lit(4)));
  }

  @Test
  public void testBinderRemovesAllOccurrences() {
    assertEquals(Arrays.asList("y"),
        CallGraph.referencedNames(lam("x", app(var("x"), var("y"),
                                                var("x")))));
    assertEquals(Arrays.asList("y"),
        CallGraph.referencedNames(let("x", var("x"),
                                       app(var("x"), var("y")))));
    assertEquals(Arrays.asList("e", "c", "d"),
        CallGraph.referencedNames(caseOf(var("e"),
            alt(Pattern.constructor("C", "a", "b"), app(var("a"), var("c"))),
            alt(Pattern.variable("v"), app(var("v"), var("d"))))));
  }

  @Test
  public void testEdges() {
    CallGraph<String> graph = CallGraph.build(Arrays.asList(
        bind("f", lam("x", app(var("g"), var("outside")))),
        bind("g", lam("y", app(var("f"), var("g")))),
        bind("h", lam("f", var("f")))));
    assertEquals(3, graph.size());
    assertEquals("g", graph.get(1).name());
    assertEquals(Arrays.asList("f", "g"), graph.get(1).references());

    SetMultimap<Integer, Integer> edges = graph.internalEdges();
    assertEquals(Collections.singleton(1), edges.get(0));
    assertEquals(Arrays.asList(0, 1), Arrays.asList(
                 edges.get(1).toArray(new Integer[0])));
    // h only mentions its own parameter
    assertTrue(edges.get(2).isEmpty());
  }

  @Test
  public void testDuplicateNameUsesFirst() {
    CallGraph<String> graph = CallGraph.build(Arrays.asList(
        bind("a", var("b")),
        bind("b", lit(1)),
        bind("b", lit(2))));
    SetMultimap<Integer, Integer> edges = graph.internalEdges();
    assertEquals(Collections.singleton(1), edges.get(0));
  }
}
