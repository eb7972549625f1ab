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
import java.util.List;

import exm.hcfa.calculus.Terms.AbstractionTerm;
import exm.hcfa.calculus.Terms.ApplicationTerm;
import exm.hcfa.calculus.Terms.CaseAlternative;
import exm.hcfa.calculus.Terms.CaseTerm;
import exm.hcfa.calculus.Terms.FixTerm;
import exm.hcfa.calculus.Terms.HardwiredTerm;
import exm.hcfa.calculus.Terms.LetInTerm;
import exm.hcfa.calculus.Terms.LiteralTerm;
import exm.hcfa.calculus.Terms.Term;
import exm.hcfa.calculus.Terms.VariableTerm;
import exm.hcfa.common.exceptions.HCFARuntimeError;

/**
 * Decorates every node with the let-bound name it belongs to.
 *
 * Entering the right-hand side of a let resets the context to that
 * binding's name.  Every other step down the tree, abstraction bodies
 * included, only deepens the current context, so flow information is
 * attributed to the let binding rather than to an enclosing lambda.
 */
public class NameAdorner {

  public static <A> Term<Adorned<A>> adorn(Term<A> term) {
    return adorn(NameAdornment.NONE, term);
  }

  /**
   * @param context naming context of term's own node
   */
  @SuppressWarnings("unchecked")
  public static <A> Term<Adorned<A>> adorn(NameAdornment context,
                                           Term<A> term) {
    Adorned<A> ann = new Adorned<A>(context, term.annotation());
    NameAdornment inner = context.deeper();
    switch (term.kind()) {
      case LITERAL:
        return new LiteralTerm<Adorned<A>>(ann,
                          ((LiteralTerm<A>)term).literal());
      case VARIABLE: {
        VariableTerm<A> var = (VariableTerm<A>)term;
        return new VariableTerm<Adorned<A>>(ann, var.flag(), var.name());
      }
      case HARDWIRED:
        return new HardwiredTerm<Adorned<A>>(ann,
                          ((HardwiredTerm<A>)term).value());
      case APPLICATION: {
        ApplicationTerm<A> app = (ApplicationTerm<A>)term;
        Term<Adorned<A>> function = adorn(inner, app.function());
        Term<Adorned<A>> argument = adorn(inner, app.argument());
        return new ApplicationTerm<Adorned<A>>(ann, function, argument);
      }
      case ABSTRACTION: {
        AbstractionTerm<A> abs = (AbstractionTerm<A>)term;
        return new AbstractionTerm<Adorned<A>>(ann, abs.boundName(),
                                    adorn(inner.deeper(), abs.body()));
      }
      case LET_IN: {
        LetInTerm<A> let = (LetInTerm<A>)term;
        Term<Adorned<A>> bound = adorn(
                    NameAdornment.shallow(let.boundName()), let.boundTerm());
        Term<Adorned<A>> body = adorn(inner, let.body());
        return new LetInTerm<Adorned<A>>(ann, let.boundName(), bound, body);
      }
      case CASE: {
        CaseTerm<A> caseTerm = (CaseTerm<A>)term;
        Term<Adorned<A>> scrutinee = adorn(inner, caseTerm.scrutinee());
        List<CaseAlternative<Adorned<A>>> alts =
            new ArrayList<CaseAlternative<Adorned<A>>>(
                                      caseTerm.alternatives().size());
        for (CaseAlternative<A> alt: caseTerm.alternatives()) {
          alts.add(new CaseAlternative<Adorned<A>>(alt.pattern(),
                                              adorn(inner, alt.rhs())));
        }
        return new CaseTerm<Adorned<A>>(ann, scrutinee, alts);
      }
      case FIX:
        return new FixTerm<Adorned<A>>(ann,
                          adorn(inner, ((FixTerm<A>)term).term()));
      default:
        throw new HCFARuntimeError("Unknown term kind " + term.kind());
    }
  }
}
