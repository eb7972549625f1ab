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

import java.util.List;

import exm.hcfa.calculus.Terms.Term;

/**
 * Construction of nested let terms from groups of bindings
 */
public class LetGroups {

  /**
   * Nest bindings around body, the first binding outermost
   * @param ann annotation for the let nodes
   */
  public static <A> Term<A> namedTermsToLets(List<Binding<A>> bindings,
                                             Term<A> body, A ann) {
    Term<A> result = body;
    for (int i = bindings.size() - 1; i >= 0; i--) {
      Binding<A> binding = bindings.get(i);
      result = Terms.letIn(ann, binding.name(), binding.term(), result);
    }
    return result;
  }

  /**
   * Multiple lets in one expression that may refer to each other in
   * any order, including (mutual) recursion.  Ordering and recursion
   * are resolved with {@link RecursionLinearizer}.
   * @param bindings the group, in source order
   * @param body
   * @param ann annotation for synthesized nodes
   */
  public static <A> Term<A> letGroup(List<Binding<A>> bindings, Term<A> body,
                                     A ann) {
    CallGraph<A> graph = CallGraph.build(bindings);
    return namedTermsToLets(RecursionLinearizer.fixRecursion(graph, ann),
                            body, ann);
  }
}
