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

/**
 * Lexical naming context of a term node: the let-bound name whose
 * definition the node belongs to.
 */
public class NameAdornment implements Comparable<NameAdornment> {

  public enum Depth {
    /** Directly inside the named binding */
    SHALLOW,
    /** Nested further inside the named binding */
    DEEP,
    /** No enclosing named scope */
    NONE,
  }

  /**
   * Sentinel used at the program root.  Should never be queried
   * for a name.
   */
  public static final NameAdornment NONE =
                        new NameAdornment(Depth.NONE, null);

  private final Depth depth;
  private final String name;

  private NameAdornment(Depth depth, String name) {
    this.depth = depth;
    this.name = name;
  }

  public static NameAdornment shallow(String name) {
    return new NameAdornment(Depth.SHALLOW, Preconditions.checkNotNull(name));
  }

  public static NameAdornment deep(String name) {
    return new NameAdornment(Depth.DEEP, Preconditions.checkNotNull(name));
  }

  public Depth depth() {
    return depth;
  }

  public boolean hasName() {
    return depth != Depth.NONE;
  }

  public String name() {
    Preconditions.checkState(hasName(), "No enclosing name");
    return name;
  }

  /**
   * Shallow names become deep; deep names and NONE are unchanged
   */
  public NameAdornment deeper() {
    if (depth == Depth.SHALLOW) {
      return deep(name);
    }
    return this;
  }

  @Override
  public int compareTo(NameAdornment o) {
    int cmp = depth.compareTo(o.depth);
    if (cmp != 0 || depth == Depth.NONE) {
      return cmp;
    }
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    switch (depth) {
      case SHALLOW:
        return name;
      case DEEP:
        return "{inside " + name + "}";
      default:
        return "{no enclosing name}";
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NameAdornment)) {
      return false;
    }
    return compareTo((NameAdornment)obj) == 0;
  }

  @Override
  public int hashCode() {
    return depth.hashCode() * 31 + (name == null ? 0 : name.hashCode());
  }
}
