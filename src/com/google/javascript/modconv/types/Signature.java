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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * One call signature of a function.
 *
 * @param parameters the declared parameters, in order
 * @param returnType the declared return type, or null when the declaration has none
 * @param typeParameters names of the signature's template types
 * @param thisType the declared type of {@code this}, if any
 * @param isConstructor whether this is a construct signature
 */
public record Signature(
    ImmutableList<Parameter> parameters,
    @Nullable TypeDescriptor returnType,
    ImmutableList<String> typeParameters,
    @Nullable TypeDescriptor thisType,
    boolean isConstructor) {

  public Signature {
    checkNotNull(parameters);
    checkNotNull(typeParameters);
    for (int i = 0; i < parameters.size() - 1; i++) {
      checkArgument(!parameters.get(i).rest(), "only the last parameter may be variadic");
    }
  }

  /**
   * A declared parameter.
   *
   * @param name the parameter name
   * @param type the declared type; for a variadic parameter this is the array type
   * @param optional whether the parameter may be omitted
   * @param rest whether the parameter is variadic
   */
  public record Parameter(String name, TypeDescriptor type, boolean optional, boolean rest) {
    public Parameter {
      checkNotNull(name);
      checkNotNull(type);
    }

    public static Parameter required(String name, TypeDescriptor type) {
      return new Parameter(name, type, false, false);
    }

    public static Parameter optional(String name, TypeDescriptor type) {
      return new Parameter(name, type, true, false);
    }

    public static Parameter rest(String name, TypeDescriptor arrayType) {
      return new Parameter(name, arrayType, false, true);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link Signature}. */
  public static final class Builder {
    private final ImmutableList.Builder<Parameter> parameters = ImmutableList.builder();
    private final ImmutableList.Builder<String> typeParameters = ImmutableList.builder();
    private @Nullable TypeDescriptor returnType;
    private @Nullable TypeDescriptor thisType;
    private boolean isConstructor;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder addParameter(Parameter parameter) {
      parameters.add(parameter);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addParameter(String name, TypeDescriptor type) {
      return addParameter(Parameter.required(name, type));
    }

    @CanIgnoreReturnValue
    public Builder addOptionalParameter(String name, TypeDescriptor type) {
      return addParameter(Parameter.optional(name, type));
    }

    @CanIgnoreReturnValue
    public Builder addRestParameter(String name, TypeDescriptor arrayType) {
      return addParameter(Parameter.rest(name, arrayType));
    }

    @CanIgnoreReturnValue
    public Builder addTypeParameter(String name) {
      typeParameters.add(name);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setReturnType(@Nullable TypeDescriptor returnType) {
      this.returnType = returnType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setThisType(@Nullable TypeDescriptor thisType) {
      this.thisType = thisType;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setConstructor(boolean isConstructor) {
      this.isConstructor = isConstructor;
      return this;
    }

    public Signature build() {
      return new Signature(
          parameters.build(), returnType, typeParameters.build(), thisType, isConstructor);
    }
  }
}
