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

import com.google.common.base.Objects;

/**
 * An annotation paired with the naming context of its node
 * @param <A>
 */
public class Adorned<A> {
  public final NameAdornment adornment;
  public final A annotation;

  public Adorned(NameAdornment adornment, A annotation) {
    this.adornment = adornment;
    this.annotation = annotation;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Adorned)) {
      return false;
    }
    Adorned<?> other = (Adorned<?>)obj;
    return adornment.equals(other.adornment) &&
           Objects.equal(annotation, other.annotation);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(adornment, annotation);
  }

  @Override
  public String toString() {
    return "(" + adornment + ", " + annotation + ")";
  }
}
