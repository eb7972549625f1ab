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
package exm.hcfa.types;

import com.google.common.base.Preconditions;

import exm.hcfa.calculus.Terms.Term;

/**
 * A program in the supported Haskell subset: all functions are nested
 * lets in the top-level expression, next to the declared data types.
 * @param <A> term annotation
 */
public class HaskellProgram<A> {
  private final DataEnv dataTypes;
  private final Term<A> topExpr;

  public HaskellProgram(DataEnv dataTypes, Term<A> topExpr) {
    this.dataTypes = Preconditions.checkNotNull(dataTypes);
    this.topExpr = Preconditions.checkNotNull(topExpr);
  }

  public DataEnv dataTypes() {
    return dataTypes;
  }

  public Term<A> topExpr() {
    return topExpr;
  }

  /**
   * @return program with the same data types and a new top expression,
   *         e.g. after re-annotating
   */
  public <B> HaskellProgram<B> withTopExpr(Term<B> newTopExpr) {
    return new HaskellProgram<B>(dataTypes, newTopExpr);
  }

  @Override
  public String toString() {
    return dataTypes + "\n" + topExpr;
  }
}
