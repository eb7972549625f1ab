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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.hcfa.calculus.Pattern.ConstructorPattern;
import exm.hcfa.calculus.Terms.AbstractionTerm;
import exm.hcfa.calculus.Terms.ApplicationTerm;
import exm.hcfa.calculus.Terms.CaseAlternative;
import exm.hcfa.calculus.Terms.CaseTerm;
import exm.hcfa.calculus.Terms.FixTerm;
import exm.hcfa.calculus.Terms.LetInTerm;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.VariableTerm;
import exm.hcfa.calculus.TermWalk.TermWalker;
import exm.hcfa.common.exceptions.HCFARuntimeError;

/**
 * Replacement of free variables in terms.
 *
 * {@link #replace} is shadow-aware but NOT capture-avoiding: a free variable
 * of the replacement can be captured by a binder between the root and a
 * replaced occurrence.  The IR passes rely on these exact semantics;
 * callers that need safety should use {@link #replaceAvoidingCapture}
 * or rename beforehand.
 */
public class Substitution {

  /**
   * Replace each free occurrence of variable target in term.
   * Subtrees under a binder of target are returned unchanged.
   * @param target
   * @param replacement
   * @param term
   * @return
   */
  @SuppressWarnings("unchecked")
  public static <A> Term<A> replace(String target, Term<A> replacement,
                                    Term<A> term) {
    switch (term.kind()) {
      case LITERAL:
      case HARDWIRED:
        return term;
      case VARIABLE:
        if (((VariableTerm<A>)term).name().equals(target)) {
          return replacement;
        }
        return term;
      case APPLICATION: {
        ApplicationTerm<A> app = (ApplicationTerm<A>)term;
        return new ApplicationTerm<A>(app.annotation(),
                  replace(target, replacement, app.function()),
                  replace(target, replacement, app.argument()));
      }
      case ABSTRACTION: {
        AbstractionTerm<A> abs = (AbstractionTerm<A>)term;
        if (abs.boundName().equals(target)) {
          // Shadowed
          return term;
        }
        return new AbstractionTerm<A>(abs.annotation(), abs.boundName(),
                  replace(target, replacement, abs.body()));
      }
      case LET_IN: {
        LetInTerm<A> let = (LetInTerm<A>)term;
        if (let.boundName().equals(target)) {
          return term;
        }
        return new LetInTerm<A>(let.annotation(), let.boundName(),
                  replace(target, replacement, let.boundTerm()),
                  replace(target, replacement, let.body()));
      }
      case CASE: {
        CaseTerm<A> caseTerm = (CaseTerm<A>)term;
        List<CaseAlternative<A>> alts = new ArrayList<CaseAlternative<A>>(
                                          caseTerm.alternatives().size());
        for (CaseAlternative<A> alt: caseTerm.alternatives()) {
          if (alt.pattern().binds(target)) {
            alts.add(alt);
          } else {
            alts.add(alt.withRhs(replace(target, replacement, alt.rhs())));
          }
        }
        return new CaseTerm<A>(caseTerm.annotation(),
                  replace(target, replacement, caseTerm.scrutinee()), alts);
      }
      case FIX: {
        FixTerm<A> fix = (FixTerm<A>)term;
        return new FixTerm<A>(fix.annotation(),
                  replace(target, replacement, fix.term()));
      }
      default:
        throw new HCFARuntimeError("Unknown term kind " + term.kind());
    }
  }

  /**
   * Like {@link #replace}, but binders that would capture a free variable
   * of replacement are renamed first.  Fresh names are formed by priming
   * the original name.
   */
  public static <A> Term<A> replaceAvoidingCapture(String target,
                                  Term<A> replacement, Term<A> term) {
    Set<String> replacementFree =
              new HashSet<String>(CallGraph.referencedNames(replacement));
    return replaceAvoidingCapture(target, replacement, replacementFree, term);
  }

  @SuppressWarnings("unchecked")
  private static <A> Term<A> replaceAvoidingCapture(String target,
          Term<A> replacement, Set<String> replacementFree, Term<A> term) {
    switch (term.kind()) {
      case LITERAL:
      case HARDWIRED:
      case VARIABLE:
        return replace(target, replacement, term);
      case APPLICATION: {
        ApplicationTerm<A> app = (ApplicationTerm<A>)term;
        return new ApplicationTerm<A>(app.annotation(),
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   app.function()),
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   app.argument()));
      }
      case ABSTRACTION: {
        AbstractionTerm<A> abs = (AbstractionTerm<A>)term;
        String bound = abs.boundName();
        if (bound.equals(target)) {
          return term;
        }
        Term<A> body = abs.body();
        if (replacementFree.contains(bound) && occursFree(target, body)) {
          String fresh = freshName(bound, replacementFree, body);
          body = rename(bound, fresh, body);
          bound = fresh;
        }
        return new AbstractionTerm<A>(abs.annotation(), bound,
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   body));
      }
      case LET_IN: {
        LetInTerm<A> let = (LetInTerm<A>)term;
        String bound = let.boundName();
        if (bound.equals(target)) {
          return term;
        }
        Term<A> boundTerm = let.boundTerm();
        Term<A> body = let.body();
        if (replacementFree.contains(bound) &&
            (occursFree(target, boundTerm) || occursFree(target, body))) {
          Set<String> avoid = new HashSet<String>(replacementFree);
          avoid.addAll(allNames(boundTerm));
          String fresh = freshName(bound, avoid, body);
          boundTerm = rename(bound, fresh, boundTerm);
          body = rename(bound, fresh, body);
          bound = fresh;
        }
        return new LetInTerm<A>(let.annotation(), bound,
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   boundTerm),
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   body));
      }
      case CASE: {
        CaseTerm<A> caseTerm = (CaseTerm<A>)term;
        List<CaseAlternative<A>> alts = new ArrayList<CaseAlternative<A>>(
                                          caseTerm.alternatives().size());
        for (CaseAlternative<A> alt: caseTerm.alternatives()) {
          if (alt.pattern().binds(target)) {
            alts.add(alt);
            continue;
          }
          CaseAlternative<A> safeAlt = alt;
          if (occursFree(target, alt.rhs())) {
            safeAlt = renameCapturing(alt, replacementFree);
          }
          alts.add(safeAlt.withRhs(replaceAvoidingCapture(target,
                        replacement, replacementFree, safeAlt.rhs())));
        }
        return new CaseTerm<A>(caseTerm.annotation(),
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   caseTerm.scrutinee()), alts);
      }
      case FIX: {
        FixTerm<A> fix = (FixTerm<A>)term;
        return new FixTerm<A>(fix.annotation(),
            replaceAvoidingCapture(target, replacement, replacementFree,
                                   fix.term()));
      }
      default:
        throw new HCFARuntimeError("Unknown term kind " + term.kind());
    }
  }

  /**
   * Rename pattern variables of alt that are free in the replacement
   */
  private static <A> CaseAlternative<A> renameCapturing(
                    CaseAlternative<A> alt, Set<String> replacementFree) {
    Pattern pattern = alt.pattern();
    Term<A> rhs = alt.rhs();
    Set<String> avoid = new HashSet<String>(replacementFree);
    avoid.addAll(pattern.boundNames());

    List<String> newNames = new ArrayList<String>();
    boolean changed = false;
    for (String name: pattern.boundNames()) {
      if (replacementFree.contains(name)) {
        String fresh = freshName(name, avoid, rhs);
        avoid.add(fresh);
        rhs = rename(name, fresh, rhs);
        newNames.add(fresh);
        changed = true;
      } else {
        newNames.add(name);
      }
    }
    if (!changed) {
      return alt;
    }

    Pattern newPattern;
    if (pattern instanceof ConstructorPattern) {
      newPattern = Pattern.constructor(
              ((ConstructorPattern)pattern).ctorName(), newNames);
    } else {
      newPattern = Pattern.variable(newNames.get(0));
    }
    return new CaseAlternative<A>(newPattern, rhs);
  }

  /**
   * Rename free occurrences of a variable, keeping each occurrence's
   * annotation and flag
   */
  @SuppressWarnings("unchecked")
  public static <A> Term<A> rename(String from, String to, Term<A> term) {
    switch (term.kind()) {
      case LITERAL:
      case HARDWIRED:
        return term;
      case VARIABLE: {
        VariableTerm<A> var = (VariableTerm<A>)term;
        if (var.name().equals(from)) {
          return new VariableTerm<A>(var.annotation(), var.flag(), to);
        }
        return term;
      }
      case APPLICATION: {
        ApplicationTerm<A> app = (ApplicationTerm<A>)term;
        return new ApplicationTerm<A>(app.annotation(),
                  rename(from, to, app.function()),
                  rename(from, to, app.argument()));
      }
      case ABSTRACTION: {
        AbstractionTerm<A> abs = (AbstractionTerm<A>)term;
        if (abs.boundName().equals(from)) {
          return term;
        }
        return new AbstractionTerm<A>(abs.annotation(), abs.boundName(),
                  rename(from, to, abs.body()));
      }
      case LET_IN: {
        LetInTerm<A> let = (LetInTerm<A>)term;
        if (let.boundName().equals(from)) {
          return term;
        }
        return new LetInTerm<A>(let.annotation(), let.boundName(),
                  rename(from, to, let.boundTerm()),
                  rename(from, to, let.body()));
      }
      case CASE: {
        CaseTerm<A> caseTerm = (CaseTerm<A>)term;
        List<CaseAlternative<A>> alts = new ArrayList<CaseAlternative<A>>(
                                          caseTerm.alternatives().size());
        for (CaseAlternative<A> alt: caseTerm.alternatives()) {
          if (alt.pattern().binds(from)) {
            alts.add(alt);
          } else {
            alts.add(alt.withRhs(rename(from, to, alt.rhs())));
          }
        }
        return new CaseTerm<A>(caseTerm.annotation(),
                  rename(from, to, caseTerm.scrutinee()), alts);
      }
      case FIX: {
        FixTerm<A> fix = (FixTerm<A>)term;
        return new FixTerm<A>(fix.annotation(),
                  rename(from, to, fix.term()));
      }
      default:
        throw new HCFARuntimeError("Unknown term kind " + term.kind());
    }
  }

  public static <A> boolean occursFree(String name, Term<A> term) {
    return CallGraph.referencedNames(term).contains(name);
  }

  /**
   * Prime name until it clashes with nothing in avoid or in scope
   */
  private static <A> String freshName(String name, Set<String> avoid,
                                      Term<A> scope) {
    Set<String> used = allNames(scope);
    String candidate = name + "'";
    while (avoid.contains(candidate) || used.contains(candidate)) {
      candidate = candidate + "'";
    }
    return candidate;
  }

  /**
   * @return every variable and binder name appearing in term
   */
  private static <A> Set<String> allNames(Term<A> term) {
    final Set<String> names = new HashSet<String>();
    TermWalk.walk(term, new TermWalker<A>() {
      @Override
      public void visit(VariableTerm<A> var) {
        names.add(var.name());
      }

      @Override
      public void visit(AbstractionTerm<A> abs) {
        names.add(abs.boundName());
      }

      @Override
      public void visit(LetInTerm<A> let) {
        names.add(let.boundName());
      }

      @Override
      public void visit(CaseTerm<A> caseTerm) {
        for (CaseAlternative<A> alt: caseTerm.alternatives()) {
          names.addAll(alt.pattern().boundNames());
        }
      }
    });
    return names;
  }
}
