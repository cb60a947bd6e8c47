/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.javascript.modconv.types;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;

/**
 * A structural description of a type, independent of any concrete syntax. Produced by the oracle
 * and rendered to Closure type expressions by the type translator.
 *
 * <p>The set of variants is closed; consumers switch over {@link #getKind()}.
 */
public interface TypeDescriptor {

  /** The variant of a descriptor. */
  enum Kind {
    PRIMITIVE,
    REFERENCE,
    UNION,
    ARRAY,
    FUNCTION,
    GENERIC,
    UNKNOWN
  }

  /** The built-in types with a fixed spelling. */
  enum PrimitiveType {
    STRING,
    NUMBER,
    BOOLEAN,
    BIGINT,
    SYMBOL,
    VOID,
    UNDEFINED,
    NULL,
    ANY,
    UNKNOWN,
    NEVER,
    OBJECT
  }

  Kind getKind();

  /** A built-in type. */
  record Primitive(PrimitiveType type) implements TypeDescriptor {
    public Primitive {
      checkNotNull(type);
    }

    @Override
    public Kind getKind() {
      return Kind.PRIMITIVE;
    }
  }

  /** A named type: class, interface, enum, type alias or type parameter. */
  record Reference(JsSymbol symbol) implements TypeDescriptor {
    public Reference {
      checkNotNull(symbol);
    }

    @Override
    public Kind getKind() {
      return Kind.REFERENCE;
    }
  }

  /** A union of two or more types. */
  record Union(ImmutableList<TypeDescriptor> members) implements TypeDescriptor {
    public Union {
      checkArgument(!members.isEmpty(), "empty union");
    }

    @Override
    public Kind getKind() {
      return Kind.UNION;
    }
  }

  /** An array with a single element type, {@code T[]}. */
  record ArrayType(TypeDescriptor elementType) implements TypeDescriptor {
    public ArrayType {
      checkNotNull(elementType);
    }

    @Override
    public Kind getKind() {
      return Kind.ARRAY;
    }
  }

  /** A function type. More than one signature means the function is overloaded. */
  record FunctionType(ImmutableList<Signature> signatures) implements TypeDescriptor {
    public FunctionType {
      checkArgument(!signatures.isEmpty(), "function type without signatures");
    }

    @Override
    public Kind getKind() {
      return Kind.FUNCTION;
    }
  }

  /** An instantiation of a generic type, {@code Base<A, B>}. */
  record Generic(TypeDescriptor base, ImmutableList<TypeDescriptor> typeArguments)
      implements TypeDescriptor {
    public Generic {
      checkNotNull(base);
      checkArgument(!typeArguments.isEmpty(), "generic without type arguments");
    }

    @Override
    public Kind getKind() {
      return Kind.GENERIC;
    }
  }

  /** A type the resolver could not work out. */
  record Unknown(String reason) implements TypeDescriptor {
    public Unknown {
      checkNotNull(reason);
    }

    @Override
    public Kind getKind() {
      return Kind.UNKNOWN;
    }
  }

  static TypeDescriptor primitive(PrimitiveType type) {
    return new Primitive(type);
  }

  static TypeDescriptor string() {
    return new Primitive(PrimitiveType.STRING);
  }

  static TypeDescriptor number() {
    return new Primitive(PrimitiveType.NUMBER);
  }

  static TypeDescriptor booleanType() {
    return new Primitive(PrimitiveType.BOOLEAN);
  }

  static TypeDescriptor voidType() {
    return new Primitive(PrimitiveType.VOID);
  }

  static TypeDescriptor any() {
    return new Primitive(PrimitiveType.ANY);
  }

  static TypeDescriptor reference(JsSymbol symbol) {
    return new Reference(symbol);
  }

  static TypeDescriptor union(TypeDescriptor... members) {
    return new Union(ImmutableList.copyOf(members));
  }

  static TypeDescriptor arrayOf(TypeDescriptor elementType) {
    return new ArrayType(elementType);
  }

  static TypeDescriptor function(Signature... signatures) {
    return new FunctionType(ImmutableList.copyOf(signatures));
  }

  static TypeDescriptor generic(TypeDescriptor base, TypeDescriptor... typeArguments) {
    return new Generic(base, ImmutableList.copyOf(Arrays.asList(typeArguments)));
  }

  static TypeDescriptor unknown(String reason) {
    return new Unknown(reason);
  }
}
