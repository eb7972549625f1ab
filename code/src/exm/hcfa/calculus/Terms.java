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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Function;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Lambda calculus terms of the analyzer IR.
 *
 * Every node carries exactly one annotation of type A.  The core never
 * inspects annotations: it only carries them through transformations.
 * Terms are immutable and may share subtrees.
 */
public class Terms {

  public enum TermKind {
    LITERAL,
    VARIABLE,
    HARDWIRED,
    APPLICATION,
    ABSTRACTION,
    LET_IN,
    CASE,
    FIX,
  }

  public static abstract class Term<A> {
    protected final A annotation;

    protected Term(A annotation) {
      this.annotation = annotation;
    }

    public A annotation() {
      return annotation;
    }

    public abstract TermKind kind();

    /**
     * Map annotations over the whole tree.  f is applied exactly once per
     * node, in pre-order: a node's own annotation first, then its children
     * left to right.
     */
    public abstract <B> Term<B> map(Function<? super A, ? extends B> f);

    /**
     * @return copy of this node with a new annotation, sharing children
     */
    public abstract Term<A> withAnnotation(A ann);

    /**
     * @return immediate subterms, left to right
     */
    public abstract List<Term<A>> children();

    protected abstract void prettyPrint(StringBuilder sb,
                                        boolean annotations);

    protected void printAnnotation(StringBuilder sb, boolean annotations) {
      if (annotations) {
        sb.append('{');
        sb.append(annotation);
        sb.append('}');
      }
    }

    /**
     * @param annotations include the annotation of every node
     */
    public String toString(boolean annotations) {
      StringBuilder sb = new StringBuilder();
      prettyPrint(sb, annotations);
      return sb.toString();
    }

    @Override
    public String toString() {
      return toString(false);
    }

    protected boolean sameNode(Object obj) {
      if (obj == null || obj.getClass() != this.getClass()) {
        return false;
      }
      return Objects.equal(annotation, ((Term<?>)obj).annotation);
    }

    protected int nodeHash() {
      return getClass().hashCode() * 31 +
            (annotation == null ? 0 : annotation.hashCode());
    }
  }

  public static class LiteralTerm<A> extends Term<A> {
    private final Literal literal;

    public LiteralTerm(A annotation, Literal literal) {
      super(annotation);
      this.literal = Preconditions.checkNotNull(literal);
    }

    public Literal literal() {
      return literal;
    }

    @Override
    public TermKind kind() {
      return TermKind.LITERAL;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      return new LiteralTerm<B>(f.apply(annotation), literal);
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new LiteralTerm<A>(ann, literal);
    }

    @Override
    public List<Term<A>> children() {
      return Collections.emptyList();
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append(literal);
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      return sameNode(obj) && literal.equals(((LiteralTerm<?>)obj).literal);
    }

    @Override
    public int hashCode() {
      return nodeHash() * 13 + literal.hashCode();
    }
  }

  public static class VariableTerm<A> extends Term<A> {
    /** Opaque to the core: preserved by every transformation */
    private final boolean flag;
    private final String name;

    public VariableTerm(A annotation, boolean flag, String name) {
      super(annotation);
      this.flag = flag;
      this.name = Preconditions.checkNotNull(name);
    }

    public boolean flag() {
      return flag;
    }

    public String name() {
      return name;
    }

    @Override
    public TermKind kind() {
      return TermKind.VARIABLE;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      return new VariableTerm<B>(f.apply(annotation), flag, name);
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new VariableTerm<A>(ann, flag, name);
    }

    @Override
    public List<Term<A>> children() {
      return Collections.emptyList();
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append(name);
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      if (!sameNode(obj)) {
        return false;
      }
      VariableTerm<?> other = (VariableTerm<?>)obj;
      return flag == other.flag && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return (nodeHash() * 13 + name.hashCode()) * 2 + (flag ? 1 : 0);
    }
  }

  public static class HardwiredTerm<A> extends Term<A> {
    private final HardwiredValue value;

    public HardwiredTerm(A annotation, HardwiredValue value) {
      super(annotation);
      this.value = Preconditions.checkNotNull(value);
    }

    public HardwiredValue value() {
      return value;
    }

    @Override
    public TermKind kind() {
      return TermKind.HARDWIRED;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      return new HardwiredTerm<B>(f.apply(annotation), value);
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new HardwiredTerm<A>(ann, value);
    }

    @Override
    public List<Term<A>> children() {
      return Collections.emptyList();
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append(value);
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      return sameNode(obj) && value.equals(((HardwiredTerm<?>)obj).value);
    }

    @Override
    public int hashCode() {
      return nodeHash() * 13 + value.hashCode();
    }
  }

  public static class ApplicationTerm<A> extends Term<A> {
    private final Term<A> function;
    private final Term<A> argument;

    public ApplicationTerm(A annotation, Term<A> function, Term<A> argument) {
      super(annotation);
      this.function = Preconditions.checkNotNull(function);
      this.argument = Preconditions.checkNotNull(argument);
    }

    public Term<A> function() {
      return function;
    }

    public Term<A> argument() {
      return argument;
    }

    @Override
    public TermKind kind() {
      return TermKind.APPLICATION;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      B ann = f.apply(annotation);
      Term<B> newFunction = function.map(f);
      Term<B> newArgument = argument.map(f);
      return new ApplicationTerm<B>(ann, newFunction, newArgument);
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new ApplicationTerm<A>(ann, function, argument);
    }

    @Override
    public List<Term<A>> children() {
      return Arrays.asList(function, argument);
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append('(');
      function.prettyPrint(sb, annotations);
      sb.append(' ');
      argument.prettyPrint(sb, annotations);
      sb.append(')');
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      if (!sameNode(obj)) {
        return false;
      }
      ApplicationTerm<?> other = (ApplicationTerm<?>)obj;
      return function.equals(other.function) &&
             argument.equals(other.argument);
    }

    @Override
    public int hashCode() {
      return (nodeHash() * 13 + function.hashCode()) * 13 +
             argument.hashCode();
    }
  }

  public static class AbstractionTerm<A> extends Term<A> {
    private final String boundName;
    private final Term<A> body;

    public AbstractionTerm(A annotation, String boundName, Term<A> body) {
      super(annotation);
      this.boundName = Preconditions.checkNotNull(boundName);
      this.body = Preconditions.checkNotNull(body);
    }

    public String boundName() {
      return boundName;
    }

    public Term<A> body() {
      return body;
    }

    @Override
    public TermKind kind() {
      return TermKind.ABSTRACTION;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      B ann = f.apply(annotation);
      return new AbstractionTerm<B>(ann, boundName, body.map(f));
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new AbstractionTerm<A>(ann, boundName, body);
    }

    @Override
    public List<Term<A>> children() {
      return Collections.singletonList(body);
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append("(\\");
      sb.append(boundName);
      sb.append(" -> ");
      body.prettyPrint(sb, annotations);
      sb.append(')');
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      if (!sameNode(obj)) {
        return false;
      }
      AbstractionTerm<?> other = (AbstractionTerm<?>)obj;
      return boundName.equals(other.boundName) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return (nodeHash() * 13 + boundName.hashCode()) * 13 + body.hashCode();
    }
  }

  public static class LetInTerm<A> extends Term<A> {
    private final String boundName;
    private final Term<A> boundTerm;
    private final Term<A> body;

    public LetInTerm(A annotation, String boundName, Term<A> boundTerm,
                     Term<A> body) {
      super(annotation);
      this.boundName = Preconditions.checkNotNull(boundName);
      this.boundTerm = Preconditions.checkNotNull(boundTerm);
      this.body = Preconditions.checkNotNull(body);
    }

    public String boundName() {
      return boundName;
    }

    public Term<A> boundTerm() {
      return boundTerm;
    }

    public Term<A> body() {
      return body;
    }

    @Override
    public TermKind kind() {
      return TermKind.LET_IN;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      B ann = f.apply(annotation);
      Term<B> newBound = boundTerm.map(f);
      Term<B> newBody = body.map(f);
      return new LetInTerm<B>(ann, boundName, newBound, newBody);
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new LetInTerm<A>(ann, boundName, boundTerm, body);
    }

    @Override
    public List<Term<A>> children() {
      return Arrays.asList(boundTerm, body);
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append("(let ");
      sb.append(boundName);
      sb.append(" = ");
      boundTerm.prettyPrint(sb, annotations);
      sb.append(" in ");
      body.prettyPrint(sb, annotations);
      sb.append(')');
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      if (!sameNode(obj)) {
        return false;
      }
      LetInTerm<?> other = (LetInTerm<?>)obj;
      return boundName.equals(other.boundName) &&
             boundTerm.equals(other.boundTerm) &&
             body.equals(other.body);
    }

    @Override
    public int hashCode() {
      int hash = nodeHash() * 13 + boundName.hashCode();
      hash = hash * 13 + boundTerm.hashCode();
      return hash * 13 + body.hashCode();
    }
  }

  /**
   * One alternative of a case term: pattern and right-hand side
   */
  public static class CaseAlternative<A> {
    private final Pattern pattern;
    private final Term<A> rhs;

    public CaseAlternative(Pattern pattern, Term<A> rhs) {
      this.pattern = Preconditions.checkNotNull(pattern);
      this.rhs = Preconditions.checkNotNull(rhs);
    }

    public Pattern pattern() {
      return pattern;
    }

    public Term<A> rhs() {
      return rhs;
    }

    public CaseAlternative<A> withRhs(Term<A> newRhs) {
      return new CaseAlternative<A>(pattern, newRhs);
    }

    public <B> CaseAlternative<B> map(Function<? super A, ? extends B> f) {
      return new CaseAlternative<B>(pattern, rhs.map(f));
    }

    @Override
    public String toString() {
      return pattern + " -> " + rhs;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof CaseAlternative)) {
        return false;
      }
      CaseAlternative<?> other = (CaseAlternative<?>)obj;
      return pattern.equals(other.pattern) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
      return pattern.hashCode() * 13 + rhs.hashCode();
    }
  }

  public static class CaseTerm<A> extends Term<A> {
    private final Term<A> scrutinee;
    private final List<CaseAlternative<A>> alternatives;

    public CaseTerm(A annotation, Term<A> scrutinee,
                    List<CaseAlternative<A>> alternatives) {
      super(annotation);
      this.scrutinee = Preconditions.checkNotNull(scrutinee);
      this.alternatives = ImmutableList.copyOf(alternatives);
    }

    public Term<A> scrutinee() {
      return scrutinee;
    }

    public List<CaseAlternative<A>> alternatives() {
      return alternatives;
    }

    @Override
    public TermKind kind() {
      return TermKind.CASE;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      B ann = f.apply(annotation);
      Term<B> newScrutinee = scrutinee.map(f);
      List<CaseAlternative<B>> newAlts =
              new ArrayList<CaseAlternative<B>>(alternatives.size());
      for (CaseAlternative<A> alt: alternatives) {
        newAlts.add(alt.map(f));
      }
      return new CaseTerm<B>(ann, newScrutinee, newAlts);
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new CaseTerm<A>(ann, scrutinee, alternatives);
    }

    @Override
    public List<Term<A>> children() {
      List<Term<A>> result = new ArrayList<Term<A>>(alternatives.size() + 1);
      result.add(scrutinee);
      for (CaseAlternative<A> alt: alternatives) {
        result.add(alt.rhs());
      }
      return result;
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append("(case ");
      scrutinee.prettyPrint(sb, annotations);
      sb.append(" of {");
      boolean first = true;
      for (CaseAlternative<A> alt: alternatives) {
        if (first) {
          first = false;
        } else {
          sb.append("; ");
        }
        sb.append(alt.pattern());
        sb.append(" -> ");
        alt.rhs().prettyPrint(sb, annotations);
      }
      sb.append("})");
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      if (!sameNode(obj)) {
        return false;
      }
      CaseTerm<?> other = (CaseTerm<?>)obj;
      return scrutinee.equals(other.scrutinee) &&
             alternatives.equals(other.alternatives);
    }

    @Override
    public int hashCode() {
      return (nodeHash() * 13 + scrutinee.hashCode()) * 13 +
             alternatives.hashCode();
    }
  }

  /**
   * Explicit fixed point.  Only introduced by the recursion linearizer.
   */
  public static class FixTerm<A> extends Term<A> {
    private final Term<A> term;

    public FixTerm(A annotation, Term<A> term) {
      super(annotation);
      this.term = Preconditions.checkNotNull(term);
    }

    public Term<A> term() {
      return term;
    }

    @Override
    public TermKind kind() {
      return TermKind.FIX;
    }

    @Override
    public <B> Term<B> map(Function<? super A, ? extends B> f) {
      B ann = f.apply(annotation);
      return new FixTerm<B>(ann, term.map(f));
    }

    @Override
    public Term<A> withAnnotation(A ann) {
      return new FixTerm<A>(ann, term);
    }

    @Override
    public List<Term<A>> children() {
      return Collections.singletonList(term);
    }

    @Override
    protected void prettyPrint(StringBuilder sb, boolean annotations) {
      sb.append("(fix ");
      term.prettyPrint(sb, annotations);
      sb.append(')');
      printAnnotation(sb, annotations);
    }

    @Override
    public boolean equals(Object obj) {
      return sameNode(obj) && term.equals(((FixTerm<?>)obj).term);
    }

    @Override
    public int hashCode() {
      return nodeHash() * 13 + term.hashCode();
    }
  }

  public static <A> Term<A> literal(A ann, Literal literal) {
    return new LiteralTerm<A>(ann, literal);
  }

  /**
   * Variable with the flag unset, as synthesized by IR passes
   */
  public static <A> Term<A> variable(A ann, String name) {
    return new VariableTerm<A>(ann, false, name);
  }

  public static <A> Term<A> hardwired(A ann, HardwiredValue value) {
    return new HardwiredTerm<A>(ann, value);
  }

  public static <A> Term<A> abstraction(A ann, String boundName,
                                        Term<A> body) {
    return new AbstractionTerm<A>(ann, boundName, body);
  }

  public static <A> Term<A> letIn(A ann, String boundName, Term<A> boundTerm,
                                  Term<A> body) {
    return new LetInTerm<A>(ann, boundName, boundTerm, body);
  }

  public static <A> Term<A> fix(A ann, Term<A> term) {
    return new FixTerm<A>(ann, term);
  }

  public static <A> Term<A> application(A ann, Term<A> function,
                                        Term<A> argument) {
    return new ApplicationTerm<A>(ann, function, argument);
  }

  /**
   * Left-nested application of head to each argument in turn:
   * ((head a1) a2) ... an
   * @param ann annotation for every application node created
   */
  public static <A> Term<A> applications(A ann, Term<A> head,
                                         List<Term<A>> args) {
    Term<A> result = head;
    for (Term<A> arg: args) {
      result = new ApplicationTerm<A>(ann, result, arg);
    }
    return result;
  }
}
