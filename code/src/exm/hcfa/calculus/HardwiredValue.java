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
import com.google.common.base.Strings;

/**
 * Built-in constructors that are not user-definable:
 * tuples of any arity and the two list constructors.
 */
public class HardwiredValue {

  public enum HardwiredKind {
    TUPLE_CON,
    LIST_CONS,
    LIST_NIL,
  }

  public static final HardwiredValue LIST_CONS =
                        new HardwiredValue(HardwiredKind.LIST_CONS, 0);
  public static final HardwiredValue LIST_NIL =
                        new HardwiredValue(HardwiredKind.LIST_NIL, 0);

  private final HardwiredKind kind;

  /** Number of commas for a tuple constructor, 0 otherwise */
  private final int commas;

  private HardwiredValue(HardwiredKind kind, int commas) {
    this.kind = kind;
    this.commas = commas;
  }

  /**
   * @param commas the constructor for an n-tuple has n-1 commas
   */
  public static HardwiredValue tupleCon(int commas) {
    Preconditions.checkArgument(commas >= 0, "Negative tuple constructor size");
    return new HardwiredValue(HardwiredKind.TUPLE_CON, commas);
  }

  public HardwiredKind kind() {
    return kind;
  }

  public int tupleCommas() {
    Preconditions.checkState(kind == HardwiredKind.TUPLE_CON,
                             "Not a tuple constructor: %s", this);
    return commas;
  }

  @Override
  public String toString() {
    switch (kind) {
      case TUPLE_CON:
        return "(" + Strings.repeat(",", commas) + ")";
      case LIST_CONS:
        return "(:)";
      case LIST_NIL:
        return "[]";
      default:
        throw new IllegalStateException("Unknown hardwired kind " + kind);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof HardwiredValue)) {
      return false;
    }
    HardwiredValue other = (HardwiredValue)obj;
    return kind == other.kind && commas == other.commas;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 13 + commas;
  }
}
