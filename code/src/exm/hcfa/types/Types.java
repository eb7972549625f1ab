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

import com.google.common.base.Objects;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.hcfa.common.exceptions.HCFARuntimeError;

/**
 * Types of the analyzed language.
 *
 * Every type except a type variable has a slot for an annotation
 * variable, used by the flow analysis to tag that position.  The slot is
 * null when unannotated.  Lists and tuples are built in since parametrized
 * data types cannot be user-defined.
 */
public class Types {

  public enum StructureType {
    BASIC,
    DATA,
    LIST,
    TUPLE,
    ARROW,
    TYPE_VARIABLE,
  }

  /**
   * Built-in primitive types
   */
  public enum BasicKind {
    INTEGER("Integer"),
    CHAR("Char"),
    DOUBLE("Double");

    private final String typeName;

    private BasicKind(String typeName) {
      this.typeName = typeName;
    }

    public String typeName() {
      return typeName;
    }

    /**
     * @return kind with exactly this name, or null
     */
    public static BasicKind fromName(String name) {
      for (BasicKind kind: values()) {
        if (kind.typeName.equals(name)) {
          return kind;
        }
      }
      return null;
    }

    @Override
    public String toString() {
      return typeName;
    }
  }

  /** Precedence at which a function domain is rendered */
  private static final int ARROW_DOMAIN_PREC = 10;

  public static abstract class Type {
    /** Annotation variable, null if none */
    protected final String annVar;

    protected Type(String annVar) {
      this.annVar = annVar;
    }

    public abstract StructureType structureType();

    /**
     * @return annotation variable of this position, or null
     */
    public String annVar() {
      return annVar;
    }

    public boolean hasAnnVar() {
      return annVar != null;
    }

    /**
     * @return same type with the annotation slot of the outermost
     *         constructor replaced
     */
    public abstract Type withAnnVar(String annVar);

    /**
     * Render at the given precedence: arrows are parenthesized when
     * prec is greater than zero
     */
    protected abstract void showsPrec(int prec, StringBuilder sb);

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      showsPrec(0, sb);
      return sb.toString();
    }

    protected boolean sameSlot(Type other) {
      return other.structureType() == structureType() &&
             Objects.equal(annVar, other.annVar);
    }

    protected int slotHash() {
      return structureType().hashCode() * 31 +
             (annVar == null ? 0 : annVar.hashCode());
    }
  }

  public static class BasicType extends Type {
    private final BasicKind kind;

    public BasicType(String annVar, BasicKind kind) {
      super(annVar);
      this.kind = Preconditions.checkNotNull(kind);
    }

    public BasicKind kind() {
      return kind;
    }

    @Override
    public StructureType structureType() {
      return StructureType.BASIC;
    }

    @Override
    public Type withAnnVar(String newAnnVar) {
      return new BasicType(newAnnVar, kind);
    }

    @Override
    protected void showsPrec(int prec, StringBuilder sb) {
      sb.append(kind.typeName());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof BasicType)) {
        return false;
      }
      BasicType other = (BasicType)obj;
      return sameSlot(other) && kind == other.kind;
    }

    @Override
    public int hashCode() {
      return slotHash() * 13 + kind.hashCode();
    }
  }

  /**
   * User-defined data type, referred to by name
   */
  public static class DataType extends Type {
    private final String name;

    public DataType(String annVar, String name) {
      super(annVar);
      this.name = Preconditions.checkNotNull(name);
    }

    public String name() {
      return name;
    }

    @Override
    public StructureType structureType() {
      return StructureType.DATA;
    }

    @Override
    public Type withAnnVar(String newAnnVar) {
      return new DataType(newAnnVar, name);
    }

    @Override
    protected void showsPrec(int prec, StringBuilder sb) {
      sb.append(name);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof DataType)) {
        return false;
      }
      DataType other = (DataType)obj;
      return sameSlot(other) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return slotHash() * 13 + name.hashCode();
    }
  }

  public static class ListType extends Type {
    private final Type elemType;

    public ListType(String annVar, Type elemType) {
      super(annVar);
      this.elemType = Preconditions.checkNotNull(elemType);
    }

    public Type elemType() {
      return elemType;
    }

    @Override
    public StructureType structureType() {
      return StructureType.LIST;
    }

    @Override
    public Type withAnnVar(String newAnnVar) {
      return new ListType(newAnnVar, elemType);
    }

    @Override
    protected void showsPrec(int prec, StringBuilder sb) {
      sb.append('[');
      elemType.showsPrec(0, sb);
      sb.append(']');
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ListType)) {
        return false;
      }
      ListType other = (ListType)obj;
      return sameSlot(other) && elemType.equals(other.elemType);
    }

    @Override
    public int hashCode() {
      return slotHash() * 13 + elemType.hashCode();
    }
  }

  public static class TupleType extends Type {
    private final List<Type> fields;

    public TupleType(String annVar, List<Type> fields) {
      super(annVar);
      this.fields = ImmutableList.copyOf(fields);
    }

    public List<Type> fields() {
      return fields;
    }

    public int numFields() {
      return fields.size();
    }

    @Override
    public StructureType structureType() {
      return StructureType.TUPLE;
    }

    @Override
    public Type withAnnVar(String newAnnVar) {
      return new TupleType(newAnnVar, fields);
    }

    @Override
    protected void showsPrec(int prec, StringBuilder sb) {
      boolean first = true;
      sb.append("(");
      for (Type field: fields) {
        if (first) {
          first = false;
        } else {
          sb.append(", ");
        }
        field.showsPrec(0, sb);
      }
      sb.append(")");
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof TupleType)) {
        return false;
      }
      TupleType other = (TupleType)obj;
      return sameSlot(other) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
      int hash = slotHash();
      for (Type field: fields) {
        hash = hash * 13 + field.hashCode();
      }
      return hash;
    }
  }

  /**
   * Function type.  The annotation slot belongs to the arrow itself,
   * not to the domain or codomain.
   */
  public static class ArrowType extends Type {
    /** Opaque to the IR, carried through unchanged */
    private final boolean flag;
    private final Type domain;
    private final Type codomain;

    public ArrowType(String annVar, boolean flag, Type domain, Type codomain) {
      super(annVar);
      this.flag = flag;
      this.domain = Preconditions.checkNotNull(domain);
      this.codomain = Preconditions.checkNotNull(codomain);
    }

    public boolean flag() {
      return flag;
    }

    public Type domain() {
      return domain;
    }

    public Type codomain() {
      return codomain;
    }

    @Override
    public StructureType structureType() {
      return StructureType.ARROW;
    }

    @Override
    public Type withAnnVar(String newAnnVar) {
      return new ArrowType(newAnnVar, flag, domain, codomain);
    }

    @Override
    protected void showsPrec(int prec, StringBuilder sb) {
      if (prec > 0) {
        sb.append('(');
      }
      domain.showsPrec(ARROW_DOMAIN_PREC, sb);
      sb.append(" -> ");
      codomain.showsPrec(0, sb);
      if (prec > 0) {
        sb.append(')');
      }
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ArrowType)) {
        return false;
      }
      ArrowType other = (ArrowType)obj;
      return sameSlot(other) && flag == other.flag &&
             domain.equals(other.domain) && codomain.equals(other.codomain);
    }

    @Override
    public int hashCode() {
      int hash = slotHash() * 2 + (flag ? 1 : 0);
      hash = hash * 13 + domain.hashCode();
      return hash * 13 + codomain.hashCode();
    }
  }

  /**
   * Unresolved type variable.  Never annotated.
   */
  public static class TypeVariable extends Type {
    private final String typeVarName;

    public TypeVariable(String typeVarName) {
      super(null);
      this.typeVarName = Preconditions.checkNotNull(typeVarName);
    }

    public String typeVarName() {
      return typeVarName;
    }

    @Override
    public StructureType structureType() {
      return StructureType.TYPE_VARIABLE;
    }

    @Override
    public Type withAnnVar(String newAnnVar) {
      if (newAnnVar != null) {
        throw new HCFARuntimeError("Annotating type variable " +
                                   typeVarName + " with " + newAnnVar);
      }
      return this;
    }

    @Override
    protected void showsPrec(int prec, StringBuilder sb) {
      sb.append(typeVarName);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof TypeVariable)) {
        return false;
      }
      return typeVarName.equals(((TypeVariable)obj).typeVarName);
    }

    @Override
    public int hashCode() {
      return typeVarName.hashCode() ^ TypeVariable.class.hashCode();
    }
  }

  public static final Type INTEGER = new BasicType(null, BasicKind.INTEGER);
  public static final Type CHAR = new BasicType(null, BasicKind.CHAR);
  public static final Type DOUBLE = new BasicType(null, BasicKind.DOUBLE);

  /**
   * Unannotated arrow with flag unset
   */
  public static Type arrow(Type domain, Type codomain) {
    return new ArrowType(null, false, domain, codomain);
  }

  /**
   * Unannotated curried function type: t1 -> t2 -> ... -> tn
   */
  public static Type function(Type first, Type ...rest) {
    if (rest.length == 0) {
      return first;
    }
    Type result = rest[rest.length - 1];
    for (int i = rest.length - 2; i >= 0; i--) {
      result = arrow(rest[i], result);
    }
    return arrow(first, result);
  }

  /**
   * Type for a type name in source.  "Integer", "Char" and "Double" are
   * the basic types; any other name is taken to be a data type.  Whether
   * the data type exists is not checked.
   */
  public static Type typeFromName(String name) {
    BasicKind kind = BasicKind.fromName(name);
    if (kind != null) {
      return new BasicType(null, kind);
    }
    return new DataType(null, name);
  }

  /**
   * @return annotation variable of a function type; absent for every
   *         other type
   */
  public static Optional<String> typeAnn(Type type) {
    if (type.structureType() == StructureType.ARROW) {
      return Optional.fromNullable(type.annVar());
    }
    return Optional.absent();
  }
}
