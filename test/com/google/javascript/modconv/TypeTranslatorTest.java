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
import static com.google.javascript.modconv.types.TypeDescriptor.arrayOf;
import static com.google.javascript.modconv.types.TypeDescriptor.booleanType;
import static com.google.javascript.modconv.types.TypeDescriptor.generic;
import static com.google.javascript.modconv.types.TypeDescriptor.number;
import static com.google.javascript.modconv.types.TypeDescriptor.reference;
import static com.google.javascript.modconv.types.TypeDescriptor.string;
import static com.google.javascript.modconv.types.TypeDescriptor.union;

import com.google.common.collect.Iterables;
import com.google.javascript.modconv.ast.IR;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.types.JsSymbol;
import com.google.javascript.modconv.types.Signature;
import com.google.javascript.modconv.types.SymbolKind;
import com.google.javascript.modconv.types.TypeDescriptor;
import com.google.javascript.modconv.types.TypeDescriptor.PrimitiveType;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class TypeTranslatorTest {

  private ConversionContext context;
  private TypeTranslator translator;
  private Node node;

  @Before
  public void setUp() {
    context =
        new ConversionContext(
            new ModuleConversionOptions(), new FakeModuleOracle(), new FakeNamingHost(), "a.ts");
    translator = context.getTypeTranslator();
    node = IR.name("x");
  }

  private String translate(TypeDescriptor type) {
    return translator.translate(node, type);
  }

  @Test
  public void testPrimitives() {
    assertThat(translate(string())).isEqualTo("string");
    assertThat(translate(TypeDescriptor.voidType())).isEqualTo("void");
    assertThat(translate(TypeDescriptor.primitive(PrimitiveType.ANY))).isEqualTo("?");
    assertThat(translate(TypeDescriptor.primitive(PrimitiveType.UNKNOWN))).isEqualTo("*");
    assertThat(translate(TypeDescriptor.primitive(PrimitiveType.OBJECT))).isEqualTo("!Object");
    assertThat(context.getDiagnostics()).isEmpty();
  }

  @Test
  public void testUnionDropsDuplicateMembers() {
    assertThat(translate(union(string(), number(), string()))).isEqualTo("(string|number)");
    assertThat(translate(union(string(), string()))).isEqualTo("string");
  }

  @Test
  public void testArrayAndGeneric() {
    JsSymbol map = JsSymbol.builder("Map", SymbolKind.CLASS).declaredIn("lib.d.ts").build();

    assertThat(translate(arrayOf(number()))).isEqualTo("!Array<number>");
    assertThat(translate(generic(reference(map), string(), booleanType())))
        .isEqualTo("!Map<string,boolean>");
  }

  @Test
  public void testReferences() {
    JsSymbol local = JsSymbol.builder("Local", SymbolKind.CLASS).declaredIn("a.ts").build();
    JsSymbol alias = JsSymbol.builder("Id", SymbolKind.TYPE_ALIAS).declaredIn("a.ts").build();
    JsSymbol typeParameter = JsSymbol.builder("T", SymbolKind.TYPE_PARAMETER).build();

    assertThat(translate(reference(local))).isEqualTo("!Local");
    assertThat(translate(reference(alias))).isEqualTo("Id");
    assertThat(translate(reference(typeParameter))).isEqualTo("T");
  }

  @Test
  public void testReferenceToOtherModuleUsesAlias() {
    JsSymbol foo = JsSymbol.builder("Foo", SymbolKind.INTERFACE).declaredIn("b.ts").build();
    JsSymbol bar = JsSymbol.builder("Bar", SymbolKind.CLASS).declaredIn("b.ts").build();
    context.getAliasTable().registerSymbolAlias(foo, "b_1.Foo");

    assertThat(translate(reference(foo))).isEqualTo("!b_1.Foo");
    assertThat(translate(reference(bar))).isEqualTo("!Bar");
  }

  @Test
  public void testFunctionTypes() {
    JsSymbol thisType = JsSymbol.builder("Widget", SymbolKind.CLASS).declaredIn("a.ts").build();
    Signature signature =
        Signature.builder()
            .setThisType(reference(thisType))
            .addParameter("a", string())
            .addOptionalParameter("b", number())
            .addRestParameter("c", arrayOf(booleanType()))
            .setReturnType(number())
            .build();

    assertThat(translate(TypeDescriptor.function(signature)))
        .isEqualTo("function(this:!Widget, string, number=, ...boolean): number");
    assertThat(translate(TypeDescriptor.function(Signature.builder().build())))
        .isEqualTo("function(): void");
  }

  @Test
  public void testConstructorType() {
    JsSymbol widget = JsSymbol.builder("Widget", SymbolKind.CLASS).declaredIn("a.ts").build();
    Signature signature =
        Signature.builder()
            .addParameter("a", string())
            .setReturnType(reference(widget))
            .setConstructor(true)
            .build();

    assertThat(translate(TypeDescriptor.function(signature)))
        .isEqualTo("function(new:!Widget, string)");
  }

  @Test
  public void testRestElementOfReadonlyArray() {
    JsSymbol readonlyArray =
        JsSymbol.builder("ReadonlyArray", SymbolKind.INTERFACE).declaredIn("lib.d.ts").build();

    assertThat(translator.translateRestElement(node, generic(reference(readonlyArray), string())))
        .isEqualTo("string");
    assertThat(translator.translateRestElement(node, arrayOf(number()))).isEqualTo("number");
  }

  @Test
  public void testMissingTypeIsReported() {
    assertThat(translator.translate(node, null)).isEqualTo("?");
    assertThat(translate(TypeDescriptor.unknown("recursive type"))).isEqualTo("?");

    assertThat(context.getDiagnostics()).hasSize(2);
    JSError last = Iterables.getLast(context.getDiagnostics());
    assertThat(last.type()).isEqualTo(TypeTranslator.UNKNOWN_TYPE);
    assertThat(last.description()).isEqualTo("Could not resolve the type of x: recursive type");
    assertThat(last.defaultLevel()).isEqualTo(CheckLevel.WARNING);
  }
}
