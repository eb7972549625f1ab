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

import com.google.common.base.Preconditions;

import exm.hcfa.calculus.Terms.Term;

/**
 * A name bound to a term, as in one equation of a let group
 * @param <A>
 */
public class Binding<A> {
  private final String name;
  private final Term<A> term;

  public Binding(String name, Term<A> term) {
    this.name = Preconditions.checkNotNull(name);
    this.term = Preconditions.checkNotNull(term);
  }

  public static <A> Binding<A> create(String name, Term<A> term) {
    return new Binding<A>(name, term);
  }

  public String name() {
    return name;
  }

  public Term<A> term() {
    return term;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Binding)) {
      return false;
    }
    Binding<?> other = (Binding<?>)obj;
    return name.equals(other.name) && term.equals(other.term);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + term.hashCode();
  }

  @Override
  public String toString() {
    return name + " = " + term;
  }
}
