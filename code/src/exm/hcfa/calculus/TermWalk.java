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
import java.util.Deque;
import java.util.List;

import com.google.common.base.Function;

import exm.hcfa.calculus.Terms.AbstractionTerm;
import exm.hcfa.calculus.Terms.ApplicationTerm;
import exm.hcfa.calculus.Terms.CaseTerm;
import exm.hcfa.calculus.Terms.FixTerm;
import exm.hcfa.calculus.Terms.HardwiredTerm;
import exm.hcfa.calculus.Terms.LetInTerm;
import exm.hcfa.calculus.Terms.LiteralTerm;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.VariableTerm;
import exm.hcfa.common.exceptions.HCFARuntimeError;

public class TermWalk {

  /**
   * Walk pre-order: each node, then its children left to right.
   * Uses an explicit stack so deeply nested terms are safe.
   * @param term
   * @param walker
   */
  public static <A> void walk(Term<A> term, TermWalker<A> walker) {
    Deque<Term<A>> stack = new ArrayDeque<Term<A>>();
    stack.push(term);
    while (!stack.isEmpty()) {
      Term<A> curr = stack.pop();
      dispatch(curr, walker);

      List<Term<A>> children = curr.children();
      // Push in reverse so leftmost child is visited first
      for (int i = children.size() - 1; i >= 0; i--) {
        stack.push(children.get(i));
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static <A> void dispatch(Term<A> term, TermWalker<A> walker) {
    walker.visitAny(term);
    switch (term.kind()) {
      case LITERAL:
        walker.visit((LiteralTerm<A>)term);
        break;
      case VARIABLE:
        walker.visit((VariableTerm<A>)term);
        break;
      case HARDWIRED:
        walker.visit((HardwiredTerm<A>)term);
        break;
      case APPLICATION:
        walker.visit((ApplicationTerm<A>)term);
        break;
      case ABSTRACTION:
        walker.visit((AbstractionTerm<A>)term);
        break;
      case LET_IN:
        walker.visit((LetInTerm<A>)term);
        break;
      case CASE:
        walker.visit((CaseTerm<A>)term);
        break;
      case FIX:
        walker.visit((FixTerm<A>)term);
        break;
      default:
        throw new HCFARuntimeError("Unknown term kind " + term.kind());
    }
  }

  /**
   * Fold annotation summaries: node first, then children left to right.
   * @param term
   * @param f summary of a single annotation
   * @param combiner associative combination
   */
  public static <A, M> M foldMap(Term<A> term,
        final Function<? super A, ? extends M> f, final Combiner<M> combiner) {
    final List<M> acc = new ArrayList<M>(1);
    acc.add(combiner.identity());
    walk(term, new TermWalker<A>() {
      @Override
      public void visitAny(Term<A> node) {
        acc.set(0, combiner.combine(acc.get(0), f.apply(node.annotation())));
      }
    });
    return acc.get(0);
  }

  /**
   * @return all annotations in pre-order
   */
  public static <A> List<A> annotations(Term<A> term) {
    final List<A> result = new ArrayList<A>();
    walk(term, new TermWalker<A>() {
      @Override
      public void visitAny(Term<A> node) {
        result.add(node.annotation());
      }
    });
    return result;
  }

  /**
   * @return number of nodes of the given kind in the term
   */
  public static <A> int count(Term<A> term, final Terms.TermKind kind) {
    final int counter[] = new int[] {0};
    walk(term, new TermWalker<A>() {
      @Override
      public void visitAny(Term<A> node) {
        if (node.kind() == kind) {
          counter[0]++;
        }
      }
    });
    return counter[0];
  }

  public static abstract class TermWalker<A> {
    /**
     * Called for every node before the kind-specific hook
     */
    public void visitAny(Term<A> term) {
      // Nothing
    }

    public void visit(LiteralTerm<A> term) {
      // Nothing
    }

    public void visit(VariableTerm<A> term) {
      // Nothing
    }

    public void visit(HardwiredTerm<A> term) {
      // Nothing
    }

    public void visit(ApplicationTerm<A> term) {
      // Nothing
    }

    public void visit(AbstractionTerm<A> term) {
      // Nothing
    }

    public void visit(LetInTerm<A> term) {
      // Nothing
    }

    public void visit(CaseTerm<A> term) {
      // Nothing
    }

    public void visit(FixTerm<A> term) {
      // Nothing
    }
  }
}
