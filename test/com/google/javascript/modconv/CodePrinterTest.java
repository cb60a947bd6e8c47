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

import com.google.common.collect.ImmutableList;
import com.google.javascript.modconv.ast.AnnotationTag;
import com.google.javascript.modconv.ast.IR;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.ast.NonJSDocComment;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CodePrinterTest {

  private static String print(Node n) {
    return new CodePrinter.Builder(n).build();
  }

  @Test
  public void testQuote() {
    assertThat(CodePrinter.quote("a'b")).isEqualTo("'a\\'b'");
    assertThat(CodePrinter.quote("line\nbreak\t\\")).isEqualTo("'line\\nbreak\\t\\\\'");
    assertThat(CodePrinter.quote("\u2028")).isEqualTo("'\\u2028'");
    assertThat(CodePrinter.quote("\0")).isEqualTo("'\\x00'");
  }

  @Test
  public void testFormatNumber() {
    assertThat(CodePrinter.formatNumber(3)).isEqualTo("3");
    assertThat(CodePrinter.formatNumber(-2)).isEqualTo("-2");
    assertThat(CodePrinter.formatNumber(0.5)).isEqualTo("0.5");
  }

  @Test
  public void testPrecedence() {
    assertThat(print(IR.getprop(IR.or(IR.name("a"), IR.name("b")), "c")))
        .isEqualTo("(a || b).c");
    assertThat(print(IR.assign(IR.name("a"), IR.comma(IR.name("b"), IR.name("c")))))
        .isEqualTo("a = (b, c)");
    assertThat(print(IR.and(IR.or(IR.name("a"), IR.name("b")), IR.name("c"))))
        .isEqualTo("(a || b) && c");
    assertThat(print(IR.or(IR.name("a"), IR.and(IR.name("b"), IR.name("c")))))
        .isEqualTo("a || b && c");
    assertThat(print(IR.not(IR.typeof(IR.name("a"))))).isEqualTo("!typeof a");
    assertThat(print(IR.newNode(IR.getprop(IR.name("a"), "B"), IR.number(1))))
        .isEqualTo("new a.B(1)");
  }

  @Test
  public void testExpressionStatementStartingWithBraceIsParenthesized() {
    Node objectStatement =
        IR.exprResult(IR.getprop(IR.objectlit(IR.stringKey("a", IR.number(1))), "a"));
    Node functionStatement =
        IR.exprResult(
            IR.call(IR.function(IR.name(""), IR.paramList(), IR.block())));

    assertThat(print(objectStatement)).isEqualTo("({a: 1}.a);\n");
    assertThat(print(functionStatement)).isEqualTo("(function() {}());\n");
  }

  @Test
  public void testArrowFunctions() {
    Node objectBody =
        IR.arrowFunction(IR.name(""), IR.paramList(IR.name("a")), IR.objectlit());
    Node restParams =
        IR.arrowFunction(
            IR.name(""),
            IR.paramList(IR.name("a"), IR.rest(IR.name("b"))),
            IR.block(IR.returnNode(IR.name("b"))));

    assertThat(print(IR.exprResult(objectBody))).isEqualTo("(a) => ({});\n");
    assertThat(print(IR.exprResult(restParams))).isEqualTo("(a, ...b) => {\n  return b;\n};\n");
  }

  @Test
  public void testNestedBlocksAreIndented() {
    Node function =
        IR.function(
            IR.name("f"),
            IR.paramList(),
            IR.block(
                IR.var(IR.name("x"), IR.number(1)),
                IR.block(IR.exprResult(IR.call(IR.name("g")))),
                IR.returnNode()));

    assertThat(print(IR.script(function)))
        .isEqualTo("function f() {\n  var x = 1;\n  {\n    g();\n  }\n  return;\n}\n");
  }

  @Test
  public void testClass() {
    Node method =
        IR.memberFunctionDef(
            "m", IR.function(IR.name(""), IR.paramList(IR.name("a")), IR.block()));
    Node classNode =
        IR.classNode(IR.name("A"), IR.name("B"), IR.classMembers(method));

    assertThat(print(IR.script(classNode))).isEqualTo("class A extends B {\n  m(a) {}\n}\n");
  }

  @Test
  public void testComments() {
    Node leading = IR.exprResult(IR.call(IR.name("a")));
    leading.setNonJSDocComment(new NonJSDocComment(1, 0, "// leading"));
    NonJSDocComment trailingComment = new NonJSDocComment(2, 5, "// trailing");
    trailingComment.setIsTrailing(true);
    Node trailing = IR.exprResult(IR.call(IR.name("b")));
    trailing.setNonJSDocComment(trailingComment);
    Node placeholder = IR.notEmitted();
    placeholder.setNonJSDocComment(new NonJSDocComment(3, 0, "/* kept */"));
    Node script = IR.script(leading, trailing, placeholder);

    assertThat(print(script)).isEqualTo("// leading\na();\nb(); // trailing\n/* kept */\n");
    assertThat(new CodePrinter.Builder(script).setPrintComments(false).build())
        .isEqualTo("a();\nb();\n");
  }

  @Test
  public void testAnnotations() {
    Node single = IR.constNode(IR.name("x"), IR.string("s"));
    single.setAnnotation(ImmutableList.of(AnnotationTag.constTag("string")));
    Node multi =
        IR.function(IR.name("f"), IR.paramList(IR.name("a")), IR.block());
    multi.setAnnotation(
        ImmutableList.of(AnnotationTag.param("number", "a"), AnnotationTag.returnTag("void")));
    Node script = IR.script(single, multi);

    assertThat(print(script))
        .isEqualTo(
            "/** @const {string} */\n"
                + "const x = 's';\n"
                + "/**\n"
                + " * @param {number} a\n"
                + " * @return {void}\n"
                + " */\n"
                + "function f(a) {}\n");
    assertThat(new CodePrinter.Builder(script).setPrintAnnotations(false).build())
        .isEqualTo("const x = 's';\nfunction f(a) {}\n");
  }

  @Test
  public void testQuotedKeysAndElements() {
    Node literal =
        IR.objectlit(
            IR.quotedStringKey("a-b", IR.arraylit(IR.number(1), IR.nullNode())),
            IR.stringKey("c", IR.getelem(IR.thisNode(), IR.string("d"))));

    assertThat(print(literal)).isEqualTo("{'a-b': [1, null], c: this['d']}");
  }

  @Test
  public void testDestructuringDeclaration() {
    Node pattern = IR.objectPattern(IR.stringKey("a", IR.name("b")));

    assertThat(print(IR.constNode(pattern, IR.name("c")))).isEqualTo("const {a: b} = c;\n");
  }
}
