package exm.hcfa.calculus;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import exm.hcfa.calculus.Terms.CaseAlternative;
import exm.hcfa.calculus.Terms.CaseTerm;
import exm.hcfa.calculus.Terms.Term;

/**
 * Shorthands for building unannotated (empty string) terms in tests
 */
public class TermBuilders {
  public static final String U = "";

  public static Term<String> var(String name) {
    return Terms.variable(U, name);
  }

  public static Term<String> lit(long value) {
    return Terms.literal(U, Literal.integer(value));
  }

  public static Term<String> app(Term<String> f, Term<String> ...args) {
    return Terms.applications(U, f, Arrays.asList(args));
  }

  public static Term<String> lam(String x, Term<String> body) {
    return Terms.abstraction(U, x, body);
  }

  public static Term<String> let(String x, Term<String> bound,
                                 Term<String> body) {
    return Terms.letIn(U, x, bound, body);
  }

  public static Term<String> fix(Term<String> term) {
    return Terms.fix(U, term);
  }

  public static CaseAlternative<String> alt(Pattern p, Term<String> rhs) {
    return new CaseAlternative<String>(p, rhs);
  }

  public static Term<String> caseOf(Term<String> scrutinee,
                                    CaseAlternative<String> ...alts) {
    return new CaseTerm<String>(U, scrutinee, Arrays.asList(alts));
  }

  public static Binding<String> bind(String name, Term<String> term) {
    return Binding.create(name, term);
  }

  public static List<String> names(List<Binding<String>> bindings) {
    List<String> result = new ArrayList<String>();
    for (Binding<String> b: bindings) {
      result.add(b.name());
    }
    return result;
  }
}
