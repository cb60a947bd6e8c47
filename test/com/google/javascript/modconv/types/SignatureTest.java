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

import static com.google.common.truth.Truth.assertThat;
import static com.google.javascript.modconv.types.TypeDescriptor.arrayOf;
import static com.google.javascript.modconv.types.TypeDescriptor.number;
import static com.google.javascript.modconv.types.TypeDescriptor.string;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.modconv.types.Signature.Parameter;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class SignatureTest {

  @Test
  public void testBuilder() {
    Signature signature =
        Signature.builder()
            .addTypeParameter("T")
            .addParameter("a", string())
            .addOptionalParameter("b", number())
            .addRestParameter("c", arrayOf(string()))
            .setReturnType(number())
            .build();

    assertThat(signature.parameters())
        .containsExactly(
            Parameter.required("a", string()),
            Parameter.optional("b", number()),
            Parameter.rest("c", arrayOf(string())))
        .inOrder();
    assertThat(signature.typeParameters()).containsExactly("T");
    assertThat(signature.returnType()).isEqualTo(number());
    assertThat(signature.thisType()).isNull();
    assertThat(signature.isConstructor()).isFalse();
  }

  @Test
  public void testOnlyLastParameterMayBeVariadic() {
    Signature.Builder builder =
        Signature.builder().addRestParameter("a", arrayOf(string())).addParameter("b", number());

    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  public void testEmptyCompositesAreRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> new TypeDescriptor.Union(ImmutableList.of()));
    assertThrows(
        IllegalArgumentException.class, () -> new TypeDescriptor.FunctionType(ImmutableList.of()));
  }

  @Test
  public void testDescriptorsCompareByValue() {
    JsSymbol foo = JsSymbol.builder("Foo", SymbolKind.CLASS).declaredIn("foo.ts").build();

    assertThat(TypeDescriptor.union(string(), number()))
        .isEqualTo(TypeDescriptor.union(string(), number()));
    assertThat(TypeDescriptor.reference(foo)).isEqualTo(TypeDescriptor.reference(foo));
    assertThat(TypeDescriptor.generic(TypeDescriptor.reference(foo), string()).getKind())
        .isEqualTo(TypeDescriptor.Kind.GENERIC);
  }
}
