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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.log4j.Logger;

import com.google.common.collect.SetMultimap;

import exm.hcfa.calculus.CallGraph.Node;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.common.Logging;
import exm.hcfa.common.Settings;
import exm.hcfa.common.exceptions.HCFARuntimeError;
import exm.hcfa.common.exceptions.InvalidOptionException;

/**
 * Removes implicit recursion from a let group.
 *
 * The strongly connected components of the call graph are found and
 * emitted dependencies first.  A non-recursive binding is kept as is.
 * Each member n of a recursive component gets a lambda-lifted helper
 * {@code @n@} taking every member of the component as a parameter, and is
 * then redefined with an explicit fixed point over the helpers.  In the
 * resulting list no binding refers to a binding positioned later, so
 * consumers can process it in a single pass.
 */
public class RecursionLinearizer {

  private static final Logger logger = Logging.getHCFALogger();

  /**
   * @param graph call graph of one let group
   * @param ann annotation for synthesized term nodes
   * @return bindings in an order safe for sequential processing
   */
  public static <A> List<Binding<A>> fixRecursion(CallGraph<A> graph,
                                                  A ann) {
    SetMultimap<Integer, Integer> edges = graph.internalEdges();
    List<List<Integer>> components = new Tarjan(graph.size(), edges).run();

    List<Binding<A>> result = new ArrayList<Binding<A>>();
    for (List<Integer> component: components) {
      if (component.size() == 1 &&
          !edges.containsEntry(component.get(0), component.get(0))) {
        Node<A> node = graph.get(component.get(0));
        result.add(Binding.create(node.name(), node.term()));
      } else {
        List<Node<A>> members = new ArrayList<Node<A>>(component.size());
        for (Integer i: component) {
          members.add(graph.get(i));
        }
        result.addAll(linearizeCycle(members, ann));
      }
    }

    if (verifyEnabled()) {
      checkNoForwardRefs(result);
    }
    return result;
  }

  public static String helperName(String name) {
    return "@" + name + "@";
  }

  private static boolean verifyEnabled() {
    try {
      return Settings.getBoolean(Settings.LINEARIZE_VERIFY);
    } catch (InvalidOptionException e) {
      throw new HCFARuntimeError("Linearizer setting not correct: " +
                                 e.getMessage());
    }
  }

  private static <A> List<Binding<A>> linearizeCycle(List<Node<A>> members,
                                                     A ann) {
    List<String> group = new ArrayList<String>(members.size());
    for (Node<A> member: members) {
      group.add(member.name());
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Recursive binding group: " + group);
    }

    // Every fixed point may use every helper, so helpers go first
    List<Binding<A>> helpers = new ArrayList<Binding<A>>(group.size());
    for (Node<A> member: members) {
      helpers.add(Binding.create(helperName(member.name()),
                    abstracted(group, member.name(), member.term(), ann)));
    }

    List<Binding<A>> finals = new ArrayList<Binding<A>>(group.size());
    for (int i = 0; i < group.size(); i++) {
      FixBuilder<A> builder = new FixBuilder<A>(group, group.get(i), ann);
      finals.add(Binding.create(group.get(i), builder.counted(0, i)));
    }
    if (refersToLaterMember(group, finals)) {
      if (logger.isDebugEnabled()) {
        logger.debug("Counted fixed points leave forward references in " +
                     group + ", rebuilding from bound member sets");
      }
      finals.clear();
      for (int i = 0; i < group.size(); i++) {
        FixBuilder<A> builder = new FixBuilder<A>(group, group.get(i), ann);
        finals.add(Binding.create(group.get(i),
                        builder.fixed(Collections.<Integer>emptySet(), i)));
      }
    }
    helpers.addAll(finals);
    return helpers;
  }

  /**
   * @return true if final definition i mentions member i or a later one
   */
  private static <A> boolean refersToLaterMember(List<String> group,
                                                 List<Binding<A>> finals) {
    for (int i = 0; i < finals.size(); i++) {
      List<String> refs = CallGraph.referencedNames(finals.get(i).term());
      for (int m = i; m < group.size(); m++) {
        if (refs.contains(group.get(m))) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Lambda-lift every member of the group out of term, the first member
   * becoming the outermost parameter.  The parameter for member m is
   * named {@code m@name}.
   */
  private static <A> Term<A> abstracted(List<String> group, String name,
                                        Term<A> term, A ann) {
    Term<A> result = term;
    for (int j = group.size() - 1; j >= 0; j--) {
      String param = group.get(j) + "@" + name;
      result = Terms.abstraction(ann, param, Substitution.replace(
                group.get(j), Terms.variable(ann, param), result));
    }
    return result;
  }

  /**
   * Builds the fixed point definitions for one member of a group.
   * Self-parameters are named {@code @F<i>@name} after the member
   * being defined.
   */
  private static class FixBuilder<A> {
    private final List<String> group;
    private final String name;
    private final A ann;

    FixBuilder(List<String> group, String name, A ann) {
      this.group = group;
      this.name = name;
      this.ann = ann;
    }

    String fixName(int i) {
      return "@F" + i + "@" + name;
    }

    /**
     * Fixed point for member i, where the first defCount members may be
     * used by name.  Members from defCount up to i are defined inline,
     * later members are nested one level deeper with member i bound to
     * the self-parameter.  Groups of four or more members can be left
     * referring to members defined later; see {@link #fixed}.
     */
    Term<A> counted(int defCount, int i) {
      String self = fixName(i);
      List<Term<A>> args = new ArrayList<Term<A>>(group.size());
      for (int m = 0; m < defCount; m++) {
        args.add(Terms.variable(ann, group.get(m)));
      }
      for (int m = defCount; m < i; m++) {
        args.add(counted(defCount, m));
      }
      args.add(Terms.variable(ann, self));
      for (int m = i + 1; m < group.size(); m++) {
        args.add(Substitution.replace(group.get(i),
                    Terms.variable(ann, self), counted(defCount + 1, m)));
      }
      Term<A> helper = Terms.variable(ann, helperName(group.get(i)));
      return Terms.fix(ann, Terms.abstraction(ann, self,
                                Terms.applications(ann, helper, args)));
    }

    /**
     * Fixed point for member i.
     * @param bound members whose name may be used directly: each is
     *      replaced by an enclosing fixed point's self-parameter
     * @param i
     */
    Term<A> fixed(Set<Integer> bound, int i) {
      String self = fixName(i);
      List<Term<A>> args = new ArrayList<Term<A>>(group.size());
      for (int m = 0; m < group.size(); m++) {
        if (bound.contains(m)) {
          args.add(Terms.variable(ann, group.get(m)));
        } else if (m < i) {
          args.add(fixed(bound, m));
        } else if (m == i) {
          args.add(Terms.variable(ann, self));
        } else {
          Set<Integer> inner = new TreeSet<Integer>(bound);
          inner.add(i);
          args.add(Substitution.replace(group.get(i),
                      Terms.variable(ann, self), fixed(inner, m)));
        }
      }
      Term<A> helper = Terms.variable(ann, helperName(group.get(i)));
      return Terms.fix(ann, Terms.abstraction(ann, self,
                                Terms.applications(ann, helper, args)));
    }
  }

  /**
   * Check that no binding refers to a name first bound at or after its
   * own position in the list
   */
  public static <A> void checkNoForwardRefs(List<Binding<A>> bindings) {
    Map<String, Integer> position = new HashMap<String, Integer>();
    for (int i = 0; i < bindings.size(); i++) {
      String name = bindings.get(i).name();
      if (!position.containsKey(name)) {
        position.put(name, i);
      }
    }

    for (int i = 0; i < bindings.size(); i++) {
      Binding<A> binding = bindings.get(i);
      for (String ref: CallGraph.referencedNames(binding.term())) {
        Integer refPos = position.get(ref);
        if (refPos != null && refPos >= i) {
          throw new HCFARuntimeError("Binding " + binding.name() +
                " at position " + i + " refers to " + ref +
                " bound at position " + refPos);
        }
      }
    }
  }

  /**
   * Tarjan's strongly connected components algorithm.
   * Components come out in reverse topological order: every component
   * is emitted after all components it can reach.
   */
  private static class Tarjan {
    private final int size;
    private final SetMultimap<Integer, Integer> edges;

    private int nextIndex = 0;
    private final int index[];
    private final int lowLink[];
    private final boolean onStack[];
    private final Deque<Integer> stack = new ArrayDeque<Integer>();
    private final List<List<Integer>> components =
                                  new ArrayList<List<Integer>>();

    Tarjan(int size, SetMultimap<Integer, Integer> edges) {
      this.size = size;
      this.edges = edges;
      this.index = new int[size];
      this.lowLink = new int[size];
      this.onStack = new boolean[size];
      for (int i = 0; i < size; i++) {
        index[i] = -1;
      }
    }

    List<List<Integer>> run() {
      for (int v = 0; v < size; v++) {
        if (index[v] < 0) {
          strongConnect(v);
        }
      }
      return components;
    }

    private void strongConnect(int v) {
      index[v] = nextIndex;
      lowLink[v] = nextIndex;
      nextIndex++;
      stack.push(v);
      onStack[v] = true;

      for (int w: edges.get(v)) {
        if (index[w] < 0) {
          strongConnect(w);
          lowLink[v] = Math.min(lowLink[v], lowLink[w]);
        } else if (onStack[w]) {
          lowLink[v] = Math.min(lowLink[v], index[w]);
        }
      }

      if (lowLink[v] == index[v]) {
        List<Integer> component = new ArrayList<Integer>();
        int w;
        do {
          w = stack.pop();
          onStack[w] = false;
          component.add(w);
        } while (w != v);
        // Members in binding order
        Collections.sort(component);
        components.add(component);
      }
    }
  }
}
