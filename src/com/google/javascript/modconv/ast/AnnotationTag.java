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

package com.google.javascript.modconv.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/**
 * One tag of a declaration's annotation block, e.g. {@code @param {string=} a}.
 *
 * <p>Type text is stored already rendered, including the optional ({@code =}) and variadic
 * ({@code ...}) markers.
 *
 * @param kind which tag this is
 * @param type the rendered type expression without braces, or null for tags without a type
 * @param parameterName the parameter name, only set for {@link Kind#PARAM}
 * @param text free text following the tag, such as a description or template names
 */
@Immutable
public record AnnotationTag(
    Kind kind, @Nullable String type, @Nullable String parameterName, @Nullable String text) {

  /** The tags the converter emits. */
  public enum Kind {
    CONSTRUCTOR("constructor"),
    STRUCT("struct"),
    TEMPLATE("template"),
    THIS("this"),
    PARAM("param"),
    RETURN("return"),
    TYPE("type"),
    CONST("const");

    private final String tagName;

    Kind(String tagName) {
      this.tagName = tagName;
    }

    public String getTagName() {
      return tagName;
    }
  }

  public AnnotationTag {
    checkArgument(parameterName == null || kind == Kind.PARAM, "only @param tags carry a name");
  }

  public static AnnotationTag constructorTag() {
    return new AnnotationTag(Kind.CONSTRUCTOR, null, null, null);
  }

  public static AnnotationTag struct() {
    return new AnnotationTag(Kind.STRUCT, null, null, null);
  }

  public static AnnotationTag param(String type, String parameterName) {
    return new AnnotationTag(Kind.PARAM, type, parameterName, null);
  }

  public static AnnotationTag returnTag(String type) {
    return new AnnotationTag(Kind.RETURN, type, null, null);
  }

  public static AnnotationTag template(String typeParameterNames) {
    return new AnnotationTag(Kind.TEMPLATE, null, null, typeParameterNames);
  }

  public static AnnotationTag thisTag(String type) {
    return new AnnotationTag(Kind.THIS, type, null, null);
  }

  public static AnnotationTag type(String type) {
    return new AnnotationTag(Kind.TYPE, type, null, null);
  }

  public static AnnotationTag constTag(@Nullable String type) {
    return new AnnotationTag(Kind.CONST, type, null, null);
  }

  /** Renders this tag the way it appears inside a JSDoc block, without the leading {@code *}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("@").append(kind.getTagName());
    if (type != null) {
      sb.append(" {").append(type).append('}');
    }
    if (parameterName != null) {
      sb.append(' ').append(parameterName);
    }
    if (text != null) {
      sb.append(' ').append(text);
    }
    return sb.toString();
  }
}
