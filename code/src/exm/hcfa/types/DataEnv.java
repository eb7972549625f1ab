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

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;

import exm.hcfa.common.Logging;

/**
 * Environment of user-defined data types, with a reverse index from
 * constructor names to the data type defining them.
 *
 * Immutable: adding a definition returns a new environment in which
 * both maps are updated together.
 */
public class DataEnv {

  public static final DataEnv EMPTY = new DataEnv(
      ImmutableMap.<String, DataDef>of(), ImmutableMap.<String, String>of());

  /**
   * Initial environment containing only Bool
   */
  public static final DataEnv INITIAL = EMPTY.addDataDef(DataDef.BOOL);

  private final ImmutableMap<String, DataDef> dataDefs;

  /** Constructor name -> data type name */
  private final ImmutableMap<String, String> conNameMap;

  private DataEnv(ImmutableMap<String, DataDef> dataDefs,
                  ImmutableMap<String, String> conNameMap) {
    this.dataDefs = dataDefs;
    this.conNameMap = conNameMap;
  }

  public Optional<DataDef> lookupDataDef(String name) {
    return Optional.fromNullable(dataDefs.get(name));
  }

  /**
   * Look up the data type containing a constructor, and the types of the
   * constructor arguments
   * @param conName
   * @return absent if no registered type has such a constructor
   */
  public Optional<ConstructorSignature> lookupConstructorTypes(
                                                      String conName) {
    String dataName = conNameMap.get(conName);
    if (dataName == null) {
      return Optional.absent();
    }
    DataDef def = dataDefs.get(dataName);
    if (def == null) {
      return Optional.absent();
    }
    Optional<DataCon> con = def.constructor(conName);
    if (!con.isPresent()) {
      return Optional.absent();
    }
    return Optional.of(new ConstructorSignature(
              new Types.DataType(null, dataName), con.get().members()));
  }

  /**
   * Add or replace a data definition.
   *
   * Constructor names are assumed to be unique across the environment.
   * If a constructor name is already mapped to another type, the new
   * definition takes it over and a warning is logged.
   * @param def
   * @return new environment
   */
  public DataEnv addDataDef(DataDef def) {
    Logger logger = Logging.getHCFALogger();
    Map<String, DataDef> newDefs = new LinkedHashMap<String, DataDef>(dataDefs);
    newDefs.put(def.name(), def);

    Map<String, String> newCons = new LinkedHashMap<String, String>(conNameMap);
    for (DataCon con: def.constructors()) {
      String prev = newCons.put(con.name(), def.name());
      if (prev != null && !prev.equals(def.name())) {
        Logging.uniqueWarn("Constructor " + con.name() + " of data type " +
            def.name() + " overrides constructor of data type " + prev);
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Added data type: " + def);
    }
    return new DataEnv(ImmutableMap.copyOf(newDefs),
                       ImmutableMap.copyOf(newCons));
  }

  public Map<String, DataDef> dataDefs() {
    return dataDefs;
  }

  /**
   * @return map from constructor name to owning data type name
   */
  public Map<String, String> constructorOwners() {
    return conNameMap;
  }

  @Override
  public String toString() {
    return dataDefs.values().toString();
  }
}
