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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.javascript.modconv.types.JsSymbol;
import com.google.javascript.modconv.types.SymbolKind;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ModuleAliasTableTest {

  private final ModuleAliasTable table = new ModuleAliasTable();

  @Test
  public void testRegisterNumbersSyntheticAliases() {
    assertThat(table.register("a")).isEqualTo("moduleVar_1");
    assertThat(table.register("b")).isEqualTo("moduleVar_2");
    assertThat(table.register("a")).isEqualTo("moduleVar_1");
    assertThat(table.namespaces()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void testBind() {
    table.bind("a", "a_1");

    assertThat(table.lookup("a")).isEqualTo("a_1");
    assertThat(table.register("a")).isEqualTo("a_1");
    assertThrows(IllegalStateException.class, () -> table.bind("a", "other"));
  }

  @Test
  public void testSideEffectRegistration() {
    table.registerSideEffect("a");

    assertThat(table.isRegistered("a")).isTrue();
    assertThat(table.lookup("a")).isNull();
    assertThrows(IllegalStateException.class, () -> table.registerSideEffect("a"));

    assertThat(table.register("a")).isEqualTo("moduleVar_1");
    assertThat(table.namespaces()).containsExactly("a");
  }

  @Test
  public void testBindAfterSideEffect() {
    table.registerSideEffect("a");
    table.bind("a", "a_1");

    assertThat(table.lookup("a")).isEqualTo("a_1");
  }

  @Test
  public void testSymbolAliasKeepsFirst() {
    JsSymbol foo = JsSymbol.builder("Foo", SymbolKind.CLASS).declaredIn("foo.ts").build();
    JsSymbol otherFoo = JsSymbol.builder("Foo", SymbolKind.CLASS).declaredIn("foo.ts").build();

    table.registerSymbolAlias(foo, "foo_1.Foo");
    table.registerSymbolAlias(foo, "moduleVar_1.Foo");

    assertThat(table.lookupSymbolAlias(foo)).isEqualTo("foo_1.Foo");
    assertThat(table.lookupSymbolAlias(otherFoo)).isNull();
  }
}
