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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class JsSymbolTest {

  @Test
  public void testDeclarations() {
    JsSymbol local = JsSymbol.builder("Foo", SymbolKind.CLASS).declaredIn("a.ts").build();
    JsSymbol merged =
        JsSymbol.builder("Foo", SymbolKind.INTERFACE)
            .declaredIn("a.ts")
            .exportSpecifierIn("b.ts", local)
            .build();

    assertThat(merged.getDeclaringFile()).isEqualTo("a.ts");
    assertThat(merged.isDeclaredOnlyIn("a.ts")).isFalse();
    assertThat(local.isDeclaredOnlyIn("a.ts")).isTrue();
    assertThat(merged.getDeclarations().get(1).localTarget()).isSameInstanceAs(local);
    assertThat(merged.getDeclarations().get(1).exportSpecifier()).isTrue();
  }

  @Test
  public void testSymbolWithoutDeclarations() {
    JsSymbol t = JsSymbol.builder("T", SymbolKind.TYPE_PARAMETER).build();

    assertThat(t.getDeclaringFile()).isNull();
    assertThat(t.isDeclaredOnlyIn("a.ts")).isFalse();
  }

  @Test
  public void testIdentity() {
    JsSymbol a = JsSymbol.builder("Foo", SymbolKind.CLASS).declaredIn("a.ts").build();
    JsSymbol b = JsSymbol.builder("Foo", SymbolKind.CLASS).declaredIn("a.ts").build();

    assertThat(a).isNotEqualTo(b);
    assertThat(a.toString()).isEqualTo("CLASS Foo");
  }

  @Test
  public void testNominalKinds() {
    assertThat(SymbolKind.CLASS.isNominalObjectType()).isTrue();
    assertThat(SymbolKind.INTERFACE.isNominalObjectType()).isTrue();
    assertThat(SymbolKind.ENUM.isNominalObjectType()).isFalse();
    assertThat(SymbolKind.TYPE_ALIAS.isNominalObjectType()).isFalse();
  }
}
