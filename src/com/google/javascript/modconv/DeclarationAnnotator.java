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
import com.google.common.collect.ImmutableList;
import com.google.javascript.modconv.ast.AnnotationTag;
import com.google.javascript.modconv.ast.IR;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.types.Signature;
import com.google.javascript.modconv.types.TypeDescriptor;
import com.google.javascript.modconv.types.TypeDescriptor.FunctionType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Attaches Closure annotation blocks to top-level function, class and variable declarations.
 *
 * <p>An overloaded function is emitted once, so its parameters are renamed to the merged names;
 * when that renames a parameter the body starts with {@code var original = merged;} so it keeps
 * seeing the name it was written against.
 */
final class DeclarationAnnotator {

  private final ConversionContext context;
  private final TypeTranslator translator;
  private final OverloadMerger merger;

  DeclarationAnnotator(ConversionContext context) {
    this.context = checkNotNull(context);
    this.translator = context.getTypeTranslator();
    this.merger = new OverloadMerger(translator);
  }

  /** Annotates {@code statement} if it is a declaration without an annotation block. */
  void annotate(Node statement) {
    if (statement.isClass()) {
      annotateClass(statement);
      return;
    }
    if (statement.getAnnotation() != null) {
      return;
    }
    if (statement.isFunction()) {
      annotateFunction(statement);
    } else if (statement.isNameDeclaration()) {
      annotateVariable(statement);
    }
  }

  private void annotateVariable(Node declaration) {
    if (!declaration.hasOneChild() || !declaration.getFirstChild().isName()) {
      return;
    }
    Node name = declaration.getFirstChild();
    String type = translator.translate(name, context.getOracle().typeOf(name));
    AnnotationTag tag =
        declaration.isConst() ? AnnotationTag.constTag(type) : AnnotationTag.type(type);
    declaration.setAnnotation(ImmutableList.of(tag));
  }

  private void annotateFunction(Node function) {
    Node name = function.getFirstChild();
    FunctionType type = functionTypeOf(name);
    if (type == null) {
      return;
    }
    ImmutableList<AnnotationTag> tags = mergeInto(name, function, type.signatures());
    if (tags != null) {
      function.setAnnotation(tags);
    }
  }

  /**
   * Annotates a class as a struct constructor and each of its methods with its merged signature.
   * The construct signatures go on the {@code constructor} method, their type parameters on the
   * class.
   */
  private void annotateClass(Node classNode) {
    @Nullable Node constructor = null;
    for (Node member : classNode.getLastChild().children()) {
      if (member.getString().equals("constructor")) {
        constructor = member;
      } else if (member.getAnnotation() == null) {
        annotateMethod(member);
      }
    }
    if (classNode.getAnnotation() != null) {
      return;
    }

    List<Signature> constructSignatures = new ArrayList<>();
    Node name = classNode.getFirstChild();
    if (name.isName() && !name.getString().isEmpty()) {
      FunctionType type = functionTypeOf(name);
      if (type != null) {
        for (Signature signature : type.signatures()) {
          if (signature.isConstructor()) {
            constructSignatures.add(signature);
          }
        }
      }
    }

    ImmutableList.Builder<AnnotationTag> classTags = ImmutableList.builder();
    Set<String> typeParameters = new LinkedHashSet<>();
    for (Signature signature : constructSignatures) {
      typeParameters.addAll(signature.typeParameters());
    }
    if (!typeParameters.isEmpty()) {
      classTags.add(AnnotationTag.template(Joiner.on(", ").join(typeParameters)));
    }
    classTags.add(AnnotationTag.constructorTag()).add(AnnotationTag.struct());
    classNode.setAnnotation(classTags.build());

    if (constructor == null
        || constructor.getAnnotation() != null
        || constructSignatures.isEmpty()) {
      return;
    }
    ImmutableList<AnnotationTag> tags =
        mergeInto(constructor, constructor.getFirstChild(), constructSignatures);
    if (tags == null) {
      return;
    }
    ImmutableList.Builder<AnnotationTag> constructorTags = ImmutableList.builder();
    for (AnnotationTag tag : tags) {
      if (tag.kind() != AnnotationTag.Kind.TEMPLATE) {
        constructorTags.add(tag);
      }
    }
    ImmutableList<AnnotationTag> built = constructorTags.build();
    if (!built.isEmpty()) {
      constructor.setAnnotation(built);
    }
  }

  private void annotateMethod(Node member) {
    FunctionType type = functionTypeOf(member);
    if (type == null) {
      return;
    }
    ImmutableList<AnnotationTag> tags =
        mergeInto(member, member.getFirstChild(), type.signatures());
    if (tags != null) {
      member.setAnnotation(tags);
    }
  }

  /** The function type of {@code n}, reporting a missing type. Null if {@code n} has none. */
  private @Nullable FunctionType functionTypeOf(Node n) {
    TypeDescriptor type = context.getOracle().typeOf(n);
    if (type == null || type.getKind() == TypeDescriptor.Kind.UNKNOWN) {
      // Reports the missing type.
      translator.translate(n, type);
      return null;
    }
    if (type.getKind() != TypeDescriptor.Kind.FUNCTION) {
      return null;
    }
    return (FunctionType) type;
  }

  /**
   * Merges {@code signatures} and renames the parameters of {@code function} to match. Returns
   * the tags, or null when the parameters cannot be brought in line with them.
   */
  private @Nullable ImmutableList<AnnotationTag> mergeInto(
      Node location, Node function, List<Signature> signatures) {
    MergedSignature merged = merger.merge(location, signatures);
    ImmutableList<String> canonical = merged.parameterNames();

    Node paramList = function.getSecondChild();
    List<@Nullable String> ownNames = new ArrayList<>();
    boolean allPlain = true;
    for (Node param : paramList.children()) {
      allPlain &= param.isName();
      ownNames.add(plainNameOf(param));
    }

    if (!allPlain) {
      return ownNames.equals(canonical) ? merged.tags() : null;
    }
    if (!renameParameters(function, ownNames, canonical)) {
      return null;
    }
    return withExtraParameters(merged.tags(), ownNames, canonical.size());
  }

  /**
   * Renames the parameters of {@code function} to {@code canonical}, aliasing renamed ones at the
   * top of the body. Returns false, leaving the function alone, when a merged name would shadow a
   * different parameter.
   */
  private static boolean renameParameters(
      Node function, List<@Nullable String> ownNames, ImmutableList<String> canonical) {
    Set<String> own = new HashSet<>();
    for (String ownName : ownNames) {
      own.add(ownName);
    }
    for (int i = 0; i < canonical.size() && i < ownNames.size(); i++) {
      String canonicalName = canonical.get(i);
      if (!canonicalName.equals(ownNames.get(i)) && own.contains(canonicalName)) {
        return false;
      }
    }

    Node paramList = function.getSecondChild();
    Node body = function.getLastChild();
    ImmutableList<Node> oldParams = paramList.detachChildren();
    List<Node> aliases = new ArrayList<>();
    for (int i = 0; i < Math.max(canonical.size(), oldParams.size()); i++) {
      if (i >= canonical.size()) {
        paramList.addChildToBack(oldParams.get(i));
        continue;
      }
      Node param = IR.name(canonical.get(i));
      if (i < oldParams.size()) {
        Node oldParam = oldParams.get(i);
        param.srcref(oldParam);
        if (!oldParam.getString().equals(canonical.get(i))) {
          aliases.add(
              IR.var(IR.name(oldParam.getString()), IR.name(canonical.get(i)))
                  .srcrefTree(oldParam));
        }
      } else {
        param.srcref(paramList);
      }
      paramList.addChildToBack(param);
    }
    for (int i = aliases.size() - 1; i >= 0; i--) {
      body.addChildToFront(aliases.get(i));
    }
    return true;
  }

  /** Declares parameters the implementation has beyond the merged ones as optional unknowns. */
  private static ImmutableList<AnnotationTag> withExtraParameters(
      ImmutableList<AnnotationTag> tags, List<@Nullable String> ownNames, int mergedCount) {
    if (ownNames.size() <= mergedCount) {
      return tags;
    }
    ImmutableList.Builder<AnnotationTag> result = ImmutableList.builder();
    @Nullable AnnotationTag returnTag = null;
    for (AnnotationTag tag : tags) {
      if (tag.kind() == AnnotationTag.Kind.RETURN) {
        returnTag = tag;
      } else {
        result.add(tag);
      }
    }
    for (int i = mergedCount; i < ownNames.size(); i++) {
      result.add(AnnotationTag.param(TypeTranslator.UNKNOWN_TYPE_TEXT + "=", ownNames.get(i)));
    }
    if (returnTag != null) {
      result.add(returnTag);
    }
    return result.build();
  }

  /** The name a parameter binds, or null for destructuring parameters. */
  private static @Nullable String plainNameOf(Node param) {
    switch (param.getToken()) {
      case NAME:
        return param.getString();
      case ITER_REST:
      case DEFAULT_VALUE:
        Node target = param.getFirstChild();
        return target.isName() ? target.getString() : null;
      default:
        return null;
    }
  }
}
