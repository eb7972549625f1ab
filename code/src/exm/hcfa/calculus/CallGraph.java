/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.hcfa.calculus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;

import exm.hcfa.calculus.Terms.AbstractionTerm;
import exm.hcfa.calculus.Terms.ApplicationTerm;
import exm.hcfa.calculus.Terms.CaseAlternative;
import exm.hcfa.calculus.Terms.CaseTerm;
import exm.hcfa.calculus.Terms.FixTerm;
import exm.hcfa.calculus.Terms.LetInTerm;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.VariableTerm;
import exm.hcfa.common.Logging;
import exm.hcfa.common.exceptions.HCFARuntimeError;

/**
 * Graph of references between the bindings of one let group.
 *
 * The reference list of a node may contain names that are not nodes of
 * the graph (variables bound further out).  Graph algorithms must ignore
 * those.
 * @param <A>
 */
public class CallGraph<A> implements Iterable<CallGraph.Node<A>> {

  public static class Node<A> {
    private final Term<A> term;
    private final String name;
    private final List<String> references;

    public Node(Term<A> term, String name, List<String> references) {
      this.term = term;
      this.name = name;
      this.references = ImmutableList.copyOf(references);
    }

    public Term<A> term() {
      return term;
    }

    public String name() {
      return name;
    }

    /**
     * @return free variable occurrences of the term, in order,
     *         duplicates included
     */
    public List<String> references() {
      return references;
    }

    @Override
    public String toString() {
      return name + " -> " + references;
    }
  }

  private final List<Node<A>> nodes;

  public CallGraph(List<Node<A>> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  /**
   * One node per binding, in binding order
   * @param bindings
   * @return
   */
  public static <A> CallGraph<A> build(List<Binding<A>> bindings) {
    List<Node<A>> nodes = new ArrayList<Node<A>>(bindings.size());
    for (Binding<A> binding: bindings) {
      nodes.add(new Node<A>(binding.term(), binding.name(),
                            referencedNames(binding.term())));
    }
    return new CallGraph<A>(nodes);
  }

  public List<Node<A>> nodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  public Node<A> get(int i) {
    return nodes.get(i);
  }

  @Override
  public Iterator<Node<A>> iterator() {
    return nodes.iterator();
  }

  /**
   * Edges between nodes, by index, ignoring references to names outside
   * the graph.  If a name is bound by several nodes, the first one is used.
   * @return map from node index to indices of referenced nodes,
   *         in order of first reference
   */
  public SetMultimap<Integer, Integer> internalEdges() {
    Logger logger = Logging.getHCFALogger();
    Map<String, Integer> index = new HashMap<String, Integer>();
    for (int i = 0; i < nodes.size(); i++) {
      String name = nodes.get(i).name();
      if (index.containsKey(name)) {
        Logging.uniqueWarn("Name " + name + " bound more than once in " +
                           "let group, using first binding");
      } else {
        index.put(name, i);
      }
    }

    SetMultimap<Integer, Integer> edges = LinkedHashMultimap.create();
    for (int i = 0; i < nodes.size(); i++) {
      for (String ref: nodes.get(i).references()) {
        Integer target = index.get(ref);
        if (target != null) {
          edges.put(i, target);
        }
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Call graph edges: " + edges);
    }
    return edges;
  }

  /**
   * Variable occurrences of term that are not bound within term.
   * A binder removes every occurrence of its name in its scope.
   * @param term
   * @return names in order of occurrence, with duplicates
   */
  @SuppressWarnings("unchecked")
  public static <A> List<String> referencedNames(Term<A> term) {
    switch (term.kind()) {
      case LITERAL:
      case HARDWIRED:
        return new ArrayList<String>();
      case VARIABLE: {
        List<String> result = new ArrayList<String>(1);
        result.add(((VariableTerm<A>)term).name());
        return result;
      }
      case APPLICATION: {
        ApplicationTerm<A> app = (ApplicationTerm<A>)term;
        List<String> result = referencedNames(app.function());
        result.addAll(referencedNames(app.argument()));
        return result;
      }
      case ABSTRACTION: {
        AbstractionTerm<A> abs = (AbstractionTerm<A>)term;
        // Do not include the scoped variable
        return removeAll(abs.boundName(), referencedNames(abs.body()));
      }
      case LET_IN: {
        LetInTerm<A> let = (LetInTerm<A>)term;
        List<String> result = referencedNames(let.boundTerm());
        result.addAll(referencedNames(let.body()));
        return removeAll(let.boundName(), result);
      }
      case CASE: {
        CaseTerm<A> caseTerm = (CaseTerm<A>)term;
        List<String> result = referencedNames(caseTerm.scrutinee());
        for (CaseAlternative<A> alt: caseTerm.alternatives()) {
          List<String> altNames = referencedNames(alt.rhs());
          for (String bound: alt.pattern().boundNames()) {
            removeAll(bound, altNames);
          }
          result.addAll(altNames);
        }
        return result;
      }
      case FIX:
        return referencedNames(((FixTerm<A>)term).term());
      default:
        throw new HCFARuntimeError("Unknown term kind " + term.kind());
    }
  }

  private static List<String> removeAll(String name, List<String> names) {
    names.removeAll(Collections.singleton(name));
    return names;
  }

  @Override
  public String toString() {
    return nodes.toString();
  }
}
