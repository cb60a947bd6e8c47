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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.modconv.ast.AnnotationTag;
import com.google.javascript.modconv.ast.NonJSDocComment;
import com.google.javascript.modconv.ast.Node;

/**
 * Generates JavaScript source from an AST, one statement per line with two-space indentation.
 * Strings are always single quoted, the way goog.module and goog.require arguments are written.
 */
public final class CodePrinter {

  private static final int INDENT_WIDTH = 2;

  // Operator precedences, higher binds tighter.
  private static final int PRECEDENCE_COMMA = 0;
  private static final int PRECEDENCE_ASSIGN = 1;
  private static final int PRECEDENCE_OR = 4;
  private static final int PRECEDENCE_AND = 5;
  private static final int PRECEDENCE_UNARY = 15;
  private static final int PRECEDENCE_NEW = 17;
  private static final int PRECEDENCE_CALL = 18;
  private static final int PRECEDENCE_PRIMARY = 20;

  private final boolean printComments;
  private final boolean printAnnotations;
  private final StringBuilder sb = new StringBuilder();
  private int indent = 0;

  private CodePrinter(boolean printComments, boolean printAnnotations) {
    this.printComments = printComments;
    this.printAnnotations = printAnnotations;
  }

  public static final class Builder {
    private final Node root;
    private boolean printComments = true;
    private boolean printAnnotations = true;

    /**
     * Sets the root node from which to generate the source code.
     *
     * @param node a SCRIPT, a statement or an expression
     */
    public Builder(Node node) {
      root = checkNotNull(node);
    }

    /** Sets whether leading non-JSDoc comments are printed. */
    @CanIgnoreReturnValue
    public Builder setPrintComments(boolean printComments) {
      this.printComments = printComments;
      return this;
    }

    /** Sets whether annotation blocks are printed as JSDoc comments. */
    @CanIgnoreReturnValue
    public Builder setPrintAnnotations(boolean printAnnotations) {
      this.printAnnotations = printAnnotations;
      return this;
    }

    /** Generates the source code and returns it. */
    public String build() {
      CodePrinter printer = new CodePrinter(printComments, printAnnotations);
      if (root.isScript() || root.isBlock()) {
        for (Node statement : root.children()) {
          printer.statement(statement);
        }
      } else if (isStatement(root)) {
        printer.statement(root);
      } else {
        printer.expr(root, PRECEDENCE_COMMA);
      }
      return printer.sb.toString();
    }
  }

  private static boolean isStatement(Node n) {
    switch (n.getToken()) {
      case EXPR_RESULT:
      case VAR:
      case LET:
      case CONST:
      case RETURN:
      case EMPTY:
      case NOT_EMITTED:
      case BLOCK:
        return true;
      case FUNCTION:
      case CLASS:
        return !n.hasParent() || n.getParent().isScript() || n.getParent().isBlock();
      default:
        return false;
    }
  }

  // ==========================================================================
  // Statements

  private void statement(Node n) {
    NonJSDocComment comment = printComments ? n.getNonJSDocComment() : null;
    if (comment != null && !comment.isTrailing()) {
      startLine();
      sb.append(comment.getCommentString()).append('\n');
    }
    if (n.isNotEmitted()) {
      return;
    }
    ImmutableList<AnnotationTag> annotation = n.getAnnotation();
    if (printAnnotations && annotation != null && !annotation.isEmpty()) {
      startLine();
      sb.append(AnnotationPrinter.print(annotation, indent)).append('\n');
    }
    startLine();
    switch (n.getToken()) {
      case EMPTY:
        sb.append(';');
        break;
      case EXPR_RESULT:
        Node expr = n.getFirstChild();
        if (startsWithBrace(expr)) {
          sb.append('(');
          expr(expr, PRECEDENCE_COMMA);
          sb.append(')');
        } else {
          expr(expr, PRECEDENCE_COMMA);
        }
        sb.append(';');
        break;
      case VAR:
      case LET:
      case CONST:
        declaration(n);
        sb.append(';');
        break;
      case RETURN:
        sb.append("return");
        if (n.hasChildren()) {
          sb.append(' ');
          expr(n.getFirstChild(), PRECEDENCE_COMMA);
        }
        sb.append(';');
        break;
      case FUNCTION:
        function(n);
        break;
      case CLASS:
        classNode(n);
        break;
      case BLOCK:
        block(n);
        break;
      default:
        throw new IllegalStateException("Unexpected statement: " + n);
    }
    if (comment != null && comment.isTrailing()) {
      sb.append(' ').append(comment.getCommentString());
    }
    sb.append('\n');
  }

  /** Whether an expression statement must be parenthesized to not read as a declaration. */
  private static boolean startsWithBrace(Node expr) {
    Node n = expr;
    while (true) {
      switch (n.getToken()) {
        case OBJECTLIT:
        case CLASS:
          return true;
        case FUNCTION:
          return !n.isArrowFunction();
        case ASSIGN:
        case COMMA:
        case AND:
        case OR:
        case CALL:
        case GETPROP:
        case GETELEM:
          n = n.getFirstChild();
          break;
        default:
          return false;
      }
    }
  }

  private void startLine() {
    sb.append(Strings.repeat(" ", indent));
  }

  private void declaration(Node n) {
    sb.append(n.isVar() ? "var " : n.isLet() ? "let " : "const ");
    boolean first = true;
    for (Node declarator : n.children()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      if (declarator.isName()) {
        sb.append(declarator.getString());
        if (declarator.hasChildren()) {
          sb.append(" = ");
          expr(declarator.getFirstChild(), PRECEDENCE_ASSIGN);
        }
      } else {
        // A destructuring pattern followed by its initializer.
        expr(declarator, PRECEDENCE_PRIMARY);
        Node value = declarator.getNext();
        if (value != null) {
          sb.append(" = ");
          expr(value, PRECEDENCE_ASSIGN);
        }
        break;
      }
    }
  }

  private void block(Node n) {
    if (!n.hasChildren()) {
      sb.append("{}");
      return;
    }
    sb.append("{\n");
    indent += INDENT_WIDTH;
    for (Node statement : n.children()) {
      statement(statement);
    }
    indent -= INDENT_WIDTH;
    startLine();
    sb.append('}');
  }

  private void function(Node n) {
    Node name = n.getFirstChild();
    Node params = n.getSecondChild();
    Node body = n.getLastChild();
    if (n.isArrowFunction()) {
      paramList(params);
      sb.append(" => ");
      if (body.isBlock()) {
        block(body);
      } else if (body.isObjectLit()) {
        sb.append('(');
        expr(body, PRECEDENCE_ASSIGN);
        sb.append(')');
      } else {
        expr(body, PRECEDENCE_ASSIGN);
      }
      return;
    }
    sb.append("function");
    if (!name.getString().isEmpty()) {
      sb.append(' ').append(name.getString());
    }
    paramList(params);
    sb.append(' ');
    block(body);
  }

  private void paramList(Node params) {
    sb.append('(');
    commaSeparated(params);
    sb.append(')');
  }

  private void classNode(Node n) {
    sb.append("class");
    Node name = n.getFirstChild();
    if (name.isName() && !name.getString().isEmpty()) {
      sb.append(' ').append(name.getString());
    }
    Node superClass = name.getNext();
    if (!superClass.isEmpty()) {
      sb.append(" extends ");
      expr(superClass, PRECEDENCE_CALL);
    }
    Node members = n.getLastChild();
    if (!members.hasChildren()) {
      sb.append(" {}");
      return;
    }
    sb.append(" {\n");
    indent += INDENT_WIDTH;
    for (Node member : members.children()) {
      ImmutableList<AnnotationTag> annotation = member.getAnnotation();
      if (printAnnotations && annotation != null && !annotation.isEmpty()) {
        startLine();
        sb.append(AnnotationPrinter.print(annotation, indent)).append('\n');
      }
      startLine();
      memberFunction(member);
      sb.append('\n');
    }
    indent -= INDENT_WIDTH;
    startLine();
    sb.append('}');
  }

  private void memberFunction(Node member) {
    Node function = member.getFirstChild();
    sb.append(member.getString());
    paramList(function.getSecondChild());
    sb.append(' ');
    block(function.getLastChild());
  }

  // ==========================================================================
  // Expressions

  private void expr(Node n, int minPrecedence) {
    int precedence = precedence(n);
    boolean parens = precedence < minPrecedence;
    if (parens) {
      sb.append('(');
    }
    switch (n.getToken()) {
      case COMMA:
        expr(n.getFirstChild(), PRECEDENCE_COMMA);
        sb.append(", ");
        expr(n.getLastChild(), PRECEDENCE_ASSIGN);
        break;
      case ASSIGN:
        expr(n.getFirstChild(), PRECEDENCE_CALL);
        sb.append(" = ");
        expr(n.getLastChild(), PRECEDENCE_ASSIGN);
        break;
      case OR:
        binary(n, " || ", PRECEDENCE_OR);
        break;
      case AND:
        binary(n, " && ", PRECEDENCE_AND);
        break;
      case NOT:
        sb.append('!');
        expr(n.getFirstChild(), PRECEDENCE_UNARY);
        break;
      case TYPEOF:
        sb.append("typeof ");
        expr(n.getFirstChild(), PRECEDENCE_UNARY);
        break;
      case VOID:
        sb.append("void ");
        expr(n.getFirstChild(), PRECEDENCE_UNARY);
        break;
      case NEW:
        sb.append("new ");
        expr(n.getFirstChild(), PRECEDENCE_CALL);
        sb.append('(');
        commaSeparatedAfterFirst(n);
        sb.append(')');
        break;
      case CALL:
        expr(n.getFirstChild(), PRECEDENCE_CALL);
        sb.append('(');
        commaSeparatedAfterFirst(n);
        sb.append(')');
        break;
      case GETPROP:
        expr(n.getFirstChild(), PRECEDENCE_CALL);
        sb.append('.').append(n.getString());
        break;
      case GETELEM:
        expr(n.getFirstChild(), PRECEDENCE_CALL);
        sb.append('[');
        expr(n.getLastChild(), PRECEDENCE_COMMA);
        sb.append(']');
        break;
      case NAME:
        sb.append(n.getString());
        break;
      case NUMBER:
        sb.append(formatNumber(n.getDouble()));
        break;
      case STRINGLIT:
        sb.append(quote(n.getString()));
        break;
      case NULL:
        sb.append("null");
        break;
      case THIS:
        sb.append("this");
        break;
      case TRUE:
        sb.append("true");
        break;
      case FALSE:
        sb.append("false");
        break;
      case ARRAYLIT:
      case ARRAY_PATTERN:
        sb.append('[');
        commaSeparated(n);
        sb.append(']');
        break;
      case OBJECTLIT:
      case OBJECT_PATTERN:
        sb.append('{');
        commaSeparated(n);
        sb.append('}');
        break;
      case STRING_KEY:
        sb.append(n.isQuotedString() ? quote(n.getString()) : n.getString());
        sb.append(": ");
        expr(n.getFirstChild(), PRECEDENCE_ASSIGN);
        break;
      case MEMBER_FUNCTION_DEF:
        memberFunction(n);
        break;
      case FUNCTION:
        function(n);
        break;
      case CLASS:
        classNode(n);
        break;
      case ITER_REST:
        sb.append("...");
        expr(n.getFirstChild(), PRECEDENCE_ASSIGN);
        break;
      case DEFAULT_VALUE:
        expr(n.getFirstChild(), PRECEDENCE_PRIMARY);
        sb.append(" = ");
        expr(n.getLastChild(), PRECEDENCE_ASSIGN);
        break;
      case EMPTY:
        break;
      default:
        throw new IllegalStateException("Unexpected expression: " + n);
    }
    if (parens) {
      sb.append(')');
    }
  }

  private void binary(Node n, String operator, int precedence) {
    expr(n.getFirstChild(), precedence);
    sb.append(operator);
    expr(n.getLastChild(), precedence + 1);
  }

  private void commaSeparated(Node parent) {
    boolean first = true;
    for (Node child : parent.children()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      expr(child, PRECEDENCE_ASSIGN);
    }
  }

  private void commaSeparatedAfterFirst(Node parent) {
    for (Node child = parent.getSecondChild(); child != null; child = child.getNext()) {
      expr(child, PRECEDENCE_ASSIGN);
      if (child.getNext() != null) {
        sb.append(", ");
      }
    }
  }

  private static int precedence(Node n) {
    switch (n.getToken()) {
      case COMMA:
        return PRECEDENCE_COMMA;
      case ASSIGN:
        return PRECEDENCE_ASSIGN;
      case OR:
        return PRECEDENCE_OR;
      case AND:
        return PRECEDENCE_AND;
      case NOT:
      case TYPEOF:
      case VOID:
        return PRECEDENCE_UNARY;
      case NEW:
        return PRECEDENCE_NEW;
      case CALL:
      case GETPROP:
      case GETELEM:
        return PRECEDENCE_CALL;
      case FUNCTION:
        return n.isArrowFunction() ? PRECEDENCE_ASSIGN : PRECEDENCE_PRIMARY;
      default:
        return PRECEDENCE_PRIMARY;
    }
  }

  static String formatNumber(double d) {
    if (d == (long) d) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  /** Returns {@code s} as a single-quoted JavaScript string literal. */
  static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\0': sb.append("\\x00"); break;
        case '\b': sb.append("\\b"); break;
        case '\f': sb.append("\\f"); break;
        case '\n': sb.append("\\n"); break;
        case '\r': sb.append("\\r"); break;
        case '\t': sb.append("\\t"); break;
        case '\\': sb.append("\\\\"); break;
        case '\'': sb.append("\\'"); break;
        case '\u2028': sb.append("\\u2028"); break;
        case '\u2029': sb.append("\\u2029"); break;
        default: sb.append(c);
      }
    }
    return sb.append('\'').toString();
  }
}
