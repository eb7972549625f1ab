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

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Definition of a user algebraic data type.
 *
 * Data types are regular and have no type parameters.  A type may refer
 * to itself; well-formedness is left to the inference engine.
 */
public class DataDef {

  /**
   * Bool is an ordinary data type, but must always be present for
   * if-expressions and guards
   */
  public static final DataDef BOOL = new DataDef("Bool",
                      new DataCon("True"), new DataCon("False"));

  private final String name;
  private final List<DataCon> constructors;

  public DataDef(String name, List<DataCon> constructors) {
    this.name = Preconditions.checkNotNull(name);
    this.constructors = ImmutableList.copyOf(constructors);
  }

  public DataDef(String name, DataCon ...constructors) {
    this(name, ImmutableList.copyOf(constructors));
  }

  public String name() {
    return name;
  }

  public List<DataCon> constructors() {
    return constructors;
  }

  public Optional<DataCon> constructor(String conName) {
    for (DataCon con: constructors) {
      if (con.name().equals(conName)) {
        return Optional.of(con);
      }
    }
    return Optional.absent();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DataDef)) {
      return false;
    }
    DataDef other = (DataDef)obj;
    return name.equals(other.name) && constructors.equals(other.constructors);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 13 + constructors.hashCode();
  }

  @Override
  public String toString() {
    return "data " + name + " = " + Joiner.on(" | ").join(constructors);
  }
}
