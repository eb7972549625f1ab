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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * Left-hand side of a case alternative.
 *
 * A variable pattern binds the scrutinee unconditionally.  A constructor
 * pattern matches one data constructor and binds its arguments in order.
 * Constructor arity is checked by the consumer, not here.
 */
public abstract class Pattern {

  public static VariablePattern variable(String name) {
    return new VariablePattern(name);
  }

  public static ConstructorPattern constructor(String ctorName,
                                               List<String> argNames) {
    return new ConstructorPattern(ctorName, argNames);
  }

  public static ConstructorPattern constructor(String ctorName,
                                               String ...argNames) {
    return new ConstructorPattern(ctorName, ImmutableList.copyOf(argNames));
  }

  /**
   * @return names bound in the alternative's right-hand side
   */
  public abstract List<String> boundNames();

  public boolean binds(String name) {
    return boundNames().contains(name);
  }

  public static class VariablePattern extends Pattern {
    private final String name;

    private VariablePattern(String name) {
      this.name = name;
    }

    public String name() {
      return name;
    }

    @Override
    public List<String> boundNames() {
      return Collections.singletonList(name);
    }

    @Override
    public String toString() {
      return name;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof VariablePattern)) {
        return false;
      }
      return name.equals(((VariablePattern)obj).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode() ^ VariablePattern.class.hashCode();
    }
  }

  public static class ConstructorPattern extends Pattern {
    private final String ctorName;
    private final List<String> argNames;

    private ConstructorPattern(String ctorName, List<String> argNames) {
      this.ctorName = ctorName;
      this.argNames = ImmutableList.copyOf(argNames);
    }

    public String ctorName() {
      return ctorName;
    }

    public List<String> argNames() {
      return argNames;
    }

    @Override
    public List<String> boundNames() {
      return argNames;
    }

    @Override
    public String toString() {
      if (argNames.isEmpty()) {
        return ctorName;
      }
      return "(" + ctorName + " " + Joiner.on(' ').join(argNames) + ")";
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ConstructorPattern)) {
        return false;
      }
      ConstructorPattern other = (ConstructorPattern)obj;
      return ctorName.equals(other.ctorName) &&
             argNames.equals(other.argNames);
    }

    @Override
    public int hashCode() {
      return ctorName.hashCode() * 13 + argNames.hashCode();
    }
  }
}
