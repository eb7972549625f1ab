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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.hcfa.types.Types.Type;

/**
 * Result of a constructor lookup: the data type the constructor builds
 * and the types of its arguments
 */
public class ConstructorSignature {
  public final Type dataType;
  public final List<Type> memberTypes;

  public ConstructorSignature(Type dataType, List<Type> memberTypes) {
    this.dataType = dataType;
    this.memberTypes = ImmutableList.copyOf(memberTypes);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ConstructorSignature)) {
      return false;
    }
    ConstructorSignature other = (ConstructorSignature)obj;
    return dataType.equals(other.dataType) &&
           memberTypes.equals(other.memberTypes);
  }

  @Override
  public int hashCode() {
    return dataType.hashCode() * 13 + memberTypes.hashCode();
  }

  @Override
  public String toString() {
    return "(" + dataType + ", " + memberTypes + ")";
  }
}
