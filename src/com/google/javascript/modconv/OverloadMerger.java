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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.javascript.modconv.ast.AnnotationTag;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.types.Signature;
import com.google.javascript.modconv.types.Signature.Parameter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the signatures of an overloaded function into one annotation block.
 *
 * <p>Parameters are merged by position. At each position the distinct names are joined with
 * {@code _or_} and the distinct types with {@code |}. A position some signature does not have, or
 * declares optional, is optional, and so is every position after it. A position stays variadic
 * only when every signature having it declares it variadic; otherwise variadic contributions turn
 * into array types and the parameter becomes optional. The return type is the union of all return
 * types, with a missing one counting as {@code void}.
 */
public final class OverloadMerger {

  private static final Joiner OR_JOINER = Joiner.on("_or_");
  private static final Joiner UNION_JOINER = Joiner.on('|');

  private final TypeTranslator translator;

  public OverloadMerger(TypeTranslator translator) {
    this.translator = checkNotNull(translator);
  }

  public MergedSignature merge(Node context, List<Signature> signatures) {
    checkArgument(!signatures.isEmpty(), "nothing to merge");
    ImmutableList.Builder<AnnotationTag> tags = ImmutableList.builder();
    ImmutableList.Builder<String> parameterNames = ImmutableList.builder();

    Set<String> typeParameters = new LinkedHashSet<>();
    int parameterCount = 0;
    boolean isConstructor = false;
    for (Signature signature : signatures) {
      typeParameters.addAll(signature.typeParameters());
      parameterCount = Math.max(parameterCount, signature.parameters().size());
      isConstructor |= signature.isConstructor();
    }
    if (!typeParameters.isEmpty()) {
      tags.add(AnnotationTag.template(Joiner.on(", ").join(typeParameters)));
    }
    for (Signature signature : signatures) {
      if (signature.thisType() != null) {
        tags.add(AnnotationTag.thisTag(translator.translate(context, signature.thisType())));
        break;
      }
    }

    boolean optionalFromHere = false;
    for (int i = 0; i < parameterCount; i++) {
      Set<String> names = new LinkedHashSet<>();
      boolean optional = optionalFromHere;
      boolean anyRest = false;
      boolean allRest = true;
      for (Signature signature : signatures) {
        if (i >= signature.parameters().size()) {
          optional = true;
          continue;
        }
        Parameter parameter = signature.parameters().get(i);
        names.add(parameter.name());
        optional |= parameter.optional();
        if (parameter.rest()) {
          anyRest = true;
        } else {
          allRest = false;
        }
      }
      boolean variadic = anyRest && allRest;
      if (anyRest && !variadic) {
        optional = true;
      }

      Set<String> types = new LinkedHashSet<>();
      for (Signature signature : signatures) {
        if (i >= signature.parameters().size()) {
          continue;
        }
        Parameter parameter = signature.parameters().get(i);
        if (parameter.rest()) {
          String element = translator.translateRestElement(context, parameter.type());
          types.add(variadic ? element : "!Array<" + element + ">");
        } else {
          types.add(translator.translate(context, parameter.type()));
        }
      }

      String typeText = UNION_JOINER.join(types);
      if (variadic) {
        typeText = "..." + (types.size() > 1 ? "(" + typeText + ")" : typeText);
      } else if (optional) {
        typeText = typeText + "=";
      }
      String name = OR_JOINER.join(names);
      tags.add(AnnotationTag.param(typeText, name));
      parameterNames.add(name);
      optionalFromHere = optional;
    }

    if (!isConstructor) {
      Set<String> returnTypes = new LinkedHashSet<>();
      for (Signature signature : signatures) {
        returnTypes.add(
            signature.returnType() == null
                ? "void"
                : translator.translate(context, signature.returnType()));
      }
      tags.add(AnnotationTag.returnTag(UNION_JOINER.join(returnTypes)));
    }
    return new MergedSignature(tags.build(), parameterNames.build());
  }
}
