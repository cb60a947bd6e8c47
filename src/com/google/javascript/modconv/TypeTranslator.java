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

package com.google.javascript.modconv;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.types.JsSymbol;
import com.google.javascript.modconv.types.Signature;
import com.google.javascript.modconv.types.SymbolKind;
import com.google.javascript.modconv.types.TypeDescriptor;
import com.google.javascript.modconv.types.TypeDescriptor.ArrayType;
import com.google.javascript.modconv.types.TypeDescriptor.FunctionType;
import com.google.javascript.modconv.types.TypeDescriptor.Generic;
import com.google.javascript.modconv.types.TypeDescriptor.Primitive;
import com.google.javascript.modconv.types.TypeDescriptor.PrimitiveType;
import com.google.javascript.modconv.types.TypeDescriptor.Reference;
import com.google.javascript.modconv.types.TypeDescriptor.Union;
import com.google.javascript.modconv.types.TypeDescriptor.Unknown;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Renders {@link TypeDescriptor}s as Closure type expressions.
 *
 * <p>Results are cached per (context node, descriptor). A descriptor that cannot be rendered
 * becomes {@code ?} and a {@link #UNKNOWN_TYPE} warning; translation itself never fails.
 */
public final class TypeTranslator {

  static final DiagnosticType UNKNOWN_TYPE =
      DiagnosticType.warning("JSC_UNKNOWN_TYPE", "Could not resolve the type of {0}: {1}");

  static final String UNKNOWN_TYPE_TEXT = "?";

  private static final ImmutableMap<PrimitiveType, String> PRIMITIVE_NAMES =
      ImmutableMap.<PrimitiveType, String>builder()
          .put(PrimitiveType.STRING, "string")
          .put(PrimitiveType.NUMBER, "number")
          .put(PrimitiveType.BOOLEAN, "boolean")
          .put(PrimitiveType.BIGINT, "bigint")
          .put(PrimitiveType.SYMBOL, "symbol")
          .put(PrimitiveType.VOID, "void")
          .put(PrimitiveType.UNDEFINED, "undefined")
          .put(PrimitiveType.NULL, "null")
          .put(PrimitiveType.ANY, "?")
          .put(PrimitiveType.UNKNOWN, "*")
          .put(PrimitiveType.NEVER, "?")
          .put(PrimitiveType.OBJECT, "!Object")
          .buildOrThrow();

  private static final Joiner UNION_JOINER = Joiner.on('|');

  private record CacheKey(Node context, @Nullable TypeDescriptor type) {}

  private final ConversionContext conversionContext;
  private final Map<CacheKey, String> cache = new HashMap<>();

  TypeTranslator(ConversionContext conversionContext) {
    this.conversionContext = checkNotNull(conversionContext);
  }

  /**
   * Returns the Closure type expression for {@code type} as seen from {@code context}.
   *
   * @param context the node the type is attached to; used for diagnostics and as cache key
   * @param type the descriptor to render, or null when the oracle had none
   */
  public String translate(Node context, @Nullable TypeDescriptor type) {
    CacheKey key = new CacheKey(context, type);
    String cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    String text = translateUncached(context, type);
    cache.put(key, text);
    return text;
  }

  /** Renders the element type of a variadic parameter declared with type {@code restType}. */
  public String translateRestElement(Node context, TypeDescriptor restType) {
    return translate(context, unwrapRest(restType));
  }

  /**
   * Drops the array wrapper from a variadic parameter's type. {@code T[]}, {@code Array<T>} and
   * {@code ReadonlyArray<T>} all become {@code T}; anything else is returned as is.
   */
  static TypeDescriptor unwrapRest(TypeDescriptor restType) {
    switch (restType.getKind()) {
      case ARRAY:
        return ((ArrayType) restType).elementType();
      case GENERIC:
        Generic generic = (Generic) restType;
        if (generic.typeArguments().size() == 1
            && generic.base() instanceof Reference
            && isArrayName(((Reference) generic.base()).symbol().getName())) {
          return generic.typeArguments().get(0);
        }
        return restType;
      default:
        return restType;
    }
  }

  private static boolean isArrayName(String name) {
    return name.equals("Array") || name.equals("ReadonlyArray");
  }

  private String translateUncached(Node context, @Nullable TypeDescriptor type) {
    if (type == null) {
      return reportUnknown(context, "no type information");
    }
    return switch (type.getKind()) {
      case PRIMITIVE -> PRIMITIVE_NAMES.get(((Primitive) type).type());
      case REFERENCE -> translateReference(((Reference) type).symbol());
      case UNION -> translateUnion(context, (Union) type);
      case ARRAY -> "!Array<" + translate(context, ((ArrayType) type).elementType()) + ">";
      case FUNCTION -> translateFunction(context, (FunctionType) type);
      case GENERIC -> translateGeneric(context, (Generic) type);
      case UNKNOWN -> reportUnknown(context, ((Unknown) type).reason());
    };
  }

  private String translateReference(JsSymbol symbol) {
    if (symbol.getKind() == SymbolKind.TYPE_PARAMETER) {
      return symbol.getName();
    }
    String name = symbol.getName();
    String declaringFile = symbol.getDeclaringFile();
    if (declaringFile != null && !declaringFile.equals(conversionContext.getFileName())) {
      String alias = conversionContext.getAliasTable().lookupSymbolAlias(symbol);
      if (alias != null) {
        name = alias;
      }
    }
    return symbol.getKind().isNominalObjectType() ? "!" + name : name;
  }

  private String translateUnion(Node context, Union union) {
    Set<String> members = new LinkedHashSet<>();
    for (TypeDescriptor member : union.members()) {
      members.add(translate(context, member));
    }
    return joinUnion(members);
  }

  private String translateGeneric(Node context, Generic generic) {
    List<String> arguments = new ArrayList<>();
    for (TypeDescriptor argument : generic.typeArguments()) {
      arguments.add(translate(context, argument));
    }
    return translate(context, generic.base()) + "<" + Joiner.on(',').join(arguments) + ">";
  }

  private String translateFunction(Node context, FunctionType function) {
    Set<String> signatures = new LinkedHashSet<>();
    for (Signature signature : function.signatures()) {
      signatures.add(translateSignature(context, signature));
    }
    return joinUnion(signatures);
  }

  private String translateSignature(Node context, Signature signature) {
    List<String> parts = new ArrayList<>();
    if (signature.isConstructor()) {
      parts.add("new:" + translate(context, signature.returnType()));
    } else if (signature.thisType() != null) {
      parts.add("this:" + translate(context, signature.thisType()));
    }
    for (Signature.Parameter parameter : signature.parameters()) {
      if (parameter.rest()) {
        parts.add("..." + translateRestElement(context, parameter.type()));
      } else {
        String text = translate(context, parameter.type());
        parts.add(parameter.optional() ? text + "=" : text);
      }
    }
    StringBuilder sb = new StringBuilder("function(").append(Joiner.on(", ").join(parts));
    sb.append(')');
    if (!signature.isConstructor()) {
      TypeDescriptor returnType = signature.returnType();
      sb.append(": ").append(returnType == null ? "void" : translate(context, returnType));
    }
    return sb.toString();
  }

  private static String joinUnion(Set<String> members) {
    if (members.size() == 1) {
      return members.iterator().next();
    }
    return "(" + UNION_JOINER.join(members) + ")";
  }

  private String reportUnknown(Node context, String reason) {
    String description = context.getQualifiedName();
    if (description == null && context.isMemberFunctionDef()) {
      description = context.getString();
    }
    if (description == null) {
      description = context.getToken().toString();
    }
    conversionContext.report(context, UNKNOWN_TYPE, description, reason);
    return UNKNOWN_TYPE_TEXT;
  }
}
