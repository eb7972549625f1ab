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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.hcfa.types.Types.Type;

/**
 * One constructor of a data type and the types of its members
 */
public class DataCon {
  private final String name;
  private final List<Type> members;

  public DataCon(String name, List<Type> members) {
    this.name = Preconditions.checkNotNull(name);
    this.members = ImmutableList.copyOf(members);
  }

  public DataCon(String name, Type ...members) {
    this(name, ImmutableList.copyOf(members));
  }

  public String name() {
    return name;
  }

  public List<Type> members() {
    return members;
  }

  public int arity() {
    return members.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DataCon)) {
      return false;
    }
    DataCon other = (DataCon)obj;
    return name.equals(other.name) && members.equals(other.members);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 13 + members.hashCode();
  }

  @Override
  public String toString() {
    if (members.isEmpty()) {
      return name;
    }
    return name + " " + Joiner.on(' ').join(members);
  }
}
