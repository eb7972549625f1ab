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

import java.util.Map;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;

import exm.hcfa.types.Types.Type;

/**
 * Immutable mapping from variable names to types.
 */
public class TyEnv {

  /**
   * Signatures of the built-in operations on basic types
   */
  public static final TyEnv INITIAL = new TyEnv(
      ImmutableMap.<String, Type>builder()
        .put("negate", Types.function(Types.INTEGER, Types.INTEGER))
        .put("+", Types.function(Types.INTEGER, Types.INTEGER, Types.INTEGER))
        .put("-", Types.function(Types.INTEGER, Types.INTEGER, Types.INTEGER))
        .put("*", Types.function(Types.INTEGER, Types.INTEGER, Types.INTEGER))
        .put("div", Types.function(Types.INTEGER, Types.INTEGER,
                                   Types.INTEGER))
        .put("ord", Types.function(Types.CHAR, Types.INTEGER))
        .put("chr", Types.function(Types.INTEGER, Types.CHAR))
        .put("round", Types.function(Types.DOUBLE, Types.INTEGER))
        .put("fromIntegral", Types.function(Types.INTEGER, Types.DOUBLE))
        .put("/", Types.function(Types.DOUBLE, Types.DOUBLE, Types.DOUBLE))
        .build());

  public static final TyEnv EMPTY =
                  new TyEnv(ImmutableMap.<String, Type>of());

  private final ImmutableMap<String, Type> types;

  private TyEnv(ImmutableMap<String, Type> types) {
    this.types = types;
  }

  public Optional<Type> lookup(String name) {
    return Optional.fromNullable(types.get(name));
  }

  public boolean contains(String name) {
    return types.containsKey(name);
  }

  /**
   * @return new environment with name bound to type, replacing any
   *         previous binding
   */
  public TyEnv extend(String name, Type type) {
    ImmutableMap.Builder<String, Type> builder = ImmutableMap.builder();
    for (Map.Entry<String, Type> e: types.entrySet()) {
      if (!e.getKey().equals(name)) {
        builder.put(e);
      }
    }
    builder.put(name, type);
    return new TyEnv(builder.build());
  }

  public Set<String> names() {
    return types.keySet();
  }

  public Map<String, Type> asMap() {
    return types;
  }

  @Override
  public String toString() {
    return types.toString();
  }
}
