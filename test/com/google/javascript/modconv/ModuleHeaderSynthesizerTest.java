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

import com.google.javascript.modconv.ast.IR;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.ast.NonJSDocComment;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link ModuleHeaderSynthesizer}. */
@RunWith(JUnit4.class)
public final class ModuleHeaderSynthesizerTest {

  private ModuleConversionOptions options;
  private FakeModuleOracle oracle;
  private ConversionContext context;

  @Before
  public void setUp() {
    options = new ModuleConversionOptions();
    oracle = new FakeModuleOracle();
    context = null;
  }

  private ConversionContext context() {
    if (context == null) {
      context = new ConversionContext(options, oracle, new FakeNamingHost(), "src/main.ts");
    }
    return context;
  }

  private String synthesize(Node script) {
    new ModuleHeaderSynthesizer(context()).synthesize(script, "src.main");
    return new CodePrinter.Builder(script).build();
  }

  @Test
  public void testFullHeader() {
    assertThat(synthesize(IR.script(IR.exprResult(IR.call(IR.name("foo"))))))
        .isEqualTo(
            "goog.module('src.main');\n"
                + "var module = module || {id: 'src/main.ts'};\n"
                + "goog.require('tslib');\n"
                + "module = module;\n"
                + "exports = {};\n"
                + "foo();\n");
    assertThat(context.getReferencedModules()).containsExactly("tslib");
  }

  @Test
  public void testEs5ModeOmitsModuleAndExportsAssignments() {
    options.setEs5Mode(true);

    assertThat(synthesize(IR.script()))
        .isEqualTo(
            "goog.module('src.main');\n"
                + "var module = module || {id: 'src/main.ts'};\n"
                + "goog.require('tslib');\n");
  }

  @Test
  public void testExistingExportsAssignmentIsNotDuplicated() {
    Node script = IR.script(IR.exprResult(IR.assign(IR.name("exports"), IR.name("Foo"))));

    assertThat(synthesize(script))
        .isEqualTo(
            "goog.module('src.main');\n"
                + "var module = module || {id: 'src/main.ts'};\n"
                + "goog.require('tslib');\n"
                + "module = module;\n"
                + "exports = Foo;\n");
  }

  @Test
  public void testJsTranspilationOmitsTslib() {
    options.setJsTranspilation(true);

    assertThat(synthesize(IR.script())).doesNotContain("tslib");
    assertThat(context.getReferencedModules()).isEmpty();
  }

  @Test
  public void testTslibAlreadyRequired() {
    context().getAliasTable().bind("tslib", "tslib_1");

    assertThat(synthesize(IR.script())).doesNotContain("goog.require('tslib')");
  }

  @Test
  public void testTslibResolvedInsideProject() {
    options.setRootDir("root");
    oracle.withResolvedPath("tslib", "root/lib/tslib.d.ts");

    assertThat(synthesize(IR.script())).contains("goog.require('root.lib.tslib');\n");
  }

  @Test
  public void testTslibResolvedToThirdPartyKeepsSpecifier() {
    options.setRootDir("root");
    oracle.withResolvedPath("tslib", "root/node_modules/tslib/tslib.d.ts");

    assertThat(synthesize(IR.script())).contains("goog.require('tslib');\n");
  }

  @Test
  public void testHeaderFollowsLeadingComments() {
    Node license = IR.notEmitted();
    license.setNonJSDocComment(new NonJSDocComment(1, 0, "// License"));
    options.setEs5Mode(true);

    assertThat(synthesize(IR.script(license, IR.exprResult(IR.call(IR.name("foo"))))))
        .isEqualTo(
            "// License\n"
                + "goog.module('src.main');\n"
                + "var module = module || {id: 'src/main.ts'};\n"
                + "goog.require('tslib');\n"
                + "foo();\n");
  }

  @Test
  public void testHeaderIsMarkedSynthesized() {
    Node statement = IR.exprResult(IR.call(IR.name("foo")));
    Node script = IR.script(statement);
    script.setSourceFileName("src/main.ts");

    synthesize(script);

    Node first = script.getFirstChild();
    assertThat(first.getBooleanProp(Node.Prop.SYNTHESIZED)).isTrue();
    assertThat(first.getSourceFileName()).isEqualTo("src/main.ts");
    assertThat(statement.getBooleanProp(Node.Prop.SYNTHESIZED)).isFalse();
  }
}
