/*
 *
 * ***** BEGIN LICENSE BLOCK *****
 * Version: MPL 1.1/GPL 2.0
 *
 * The contents of this file are subject to the Mozilla Public License Version
 * 1.1 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * http://www.mozilla.org/MPL/
 *
 * Software distributed under the License is distributed on an "AS IS" basis,
 * WITHOUT WARRANTY OF ANY KIND, either express or implied. See the License
 * for the specific language governing rights and limitations under the
 * License.
 *
 * The Original Code is Rhino code, released
 * May 6, 1999.
 *
 * The Initial Developer of the Original Code is
 * Netscape Communications Corporation.
 * Portions created by the Initial Developer are Copyright (C) 1997-1999
 * the Initial Developer. All Rights Reserved.
 *
 * Contributor(s):
 *   Roger Lawrence
 *   Mike McCabe
 *   Igor Bukanov
 *   Milen Nankov
 *
 * Alternatively, the contents of this file may be used under the terms of
 * the GNU General Public License Version 2 or later (the "GPL"), in which
 * case the provisions of the GPL are applicable instead of those above. If
 * you wish to allow use of your version of this file only under the terms of
 * the GPL and not to allow others to use your version of this file under the
 * MPL, indicate your decision by deleting the provisions above and replacing
 * them with the notice and other provisions required by the GPL. If you do
 * not delete the provisions above, a recipient may use your version of this
 * file under either the MPL or the GPL.
 *
 * ***** END LICENSE BLOCK ***** */

package com.google.javascript.modconv.ast;

import static com.google.common.base.Preconditions.checkState;

import java.util.List;

/** An AST construction helper class */
public class IR {

  private IR() {}

  public static Node empty() {
    return new Node(Token.EMPTY);
  }

  /** A statement that prints nothing but the comments it carries. */
  public static Node notEmitted() {
    return new Node(Token.NOT_EMITTED);
  }

  public static Node export(Node declaration) {
    checkState(mayBeStatementNoReturn(declaration), declaration);
    return new Node(Token.EXPORT, declaration);
  }

  public static Node importNode(Node name, Node moduleIdentifier) {
    checkState(name.isName() || name.isEmpty(), name);
    checkState(moduleIdentifier.isString(), moduleIdentifier);
    return new Node(Token.IMPORT, name, moduleIdentifier);
  }

  public static Node function(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name, params, body);
  }

  public static Node arrowFunction(Node name, Node params, Node body) {
    checkState(name.isName());
    checkState(params.isParamList());
    checkState(body.isBlock() || mayBeExpression(body));
    Node func = new Node(Token.FUNCTION, name, params, body);
    func.setIsArrowFunction(true);
    return func;
  }

  public static Node paramList(Node... params) {
    return paramList(List.of(params));
  }

  public static Node paramList(List<Node> params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName() || param.isRest() || param.isDefaultValue(), param);
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  public static Node block(Node... stmts) {
    return block(List.of(stmts));
  }

  public static Node block(List<Node> stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node script(Node... stmts) {
    return script(List.of(stmts));
  }

  public static Node script(List<Node> stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatementNoReturn(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node classNode(Node name, Node superClass, Node members) {
    checkState(name.isName() || name.isEmpty());
    checkState(mayBeExpressionOrEmpty(superClass));
    checkState(members.getToken() == Token.CLASS_MEMBERS);
    return new Node(Token.CLASS, name, superClass, members);
  }

  public static Node classMembers(Node... members) {
    Node classMembers = new Node(Token.CLASS_MEMBERS);
    for (Node member : members) {
      checkState(member.isMemberFunctionDef(), member);
      classMembers.addChildToBack(member);
    }
    return classMembers;
  }

  public static Node var(Node lhs, Node value) {
    return declaration(lhs, value, Token.VAR);
  }

  public static Node var(Node lhs) {
    return declaration(lhs, Token.VAR);
  }

  public static Node let(Node lhs, Node value) {
    return declaration(lhs, value, Token.LET);
  }

  public static Node constNode(Node lhs, Node value) {
    return declaration(lhs, value, Token.CONST);
  }

  public static Node declaration(Node lhs, Token type) {
    checkState(lhs.isName() || lhs.isDestructuringPattern(), lhs);
    return new Node(type, lhs);
  }

  public static Node declaration(Node lhs, Node value, Token type) {
    checkState(
        type == Token.VAR || type == Token.LET || type == Token.CONST, "Unexpected %s", type);
    checkState(mayBeExpression(value), value);
    if (lhs.isName()) {
      checkState(!lhs.hasChildren());
      lhs.addChildToBack(value);
      return new Node(type, lhs);
    }
    checkState(lhs.isDestructuringPattern(), lhs);
    return new Node(type, lhs, value);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node call(Node target, Node... args) {
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg) || arg.isRest(), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  public static Node newNode(Node target, Node... args) {
    Node newcall = new Node(Token.NEW, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      newcall.addChildToBack(arg);
    }
    return newcall;
  }

  public static Node name(String name) {
    checkState(name.indexOf('.') == -1, "Invalid name '%s'. Did you mean to use getprop?", name);
    return Node.newString(Token.NAME, name);
  }

  public static Node getprop(Node target, String prop, String... moreProps) {
    checkState(mayBeExpression(target), target);
    Node result = Node.newString(Token.GETPROP, prop);
    result.addChildToBack(target);
    for (String moreProp : moreProps) {
      Node next = Node.newString(Token.GETPROP, moreProp);
      next.addChildToBack(result);
      result = next;
    }
    return result;
  }

  public static Node getelem(Node target, Node elem) {
    checkState(mayBeExpression(target));
    checkState(mayBeExpression(elem));
    return new Node(Token.GETELEM, target, elem);
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName() || target.isGetProp() || target.isGetElem(), target);
    checkState(mayBeExpression(expr));
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node comma(Node expr1, Node expr2) {
    return binaryOp(Token.COMMA, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr1) {
    return unaryOp(Token.NOT, expr1);
  }

  public static Node voidNode(Node expr1) {
    return unaryOp(Token.VOID, expr1);
  }

  public static Node typeof(Node expr) {
    return unaryOp(Token.TYPEOF, expr);
  }

  public static Node objectlit(Node... propdefs) {
    Node objectlit = new Node(Token.OBJECTLIT);
    for (Node propdef : propdefs) {
      checkState(propdef.isStringKey() || propdef.isMemberFunctionDef(), propdef);
      objectlit.addChildToBack(propdef);
    }
    return objectlit;
  }

  public static Node arraylit(Node... exprs) {
    Node arraylit = new Node(Token.ARRAYLIT);
    for (Node expr : exprs) {
      checkState(mayBeExpressionOrEmpty(expr));
      arraylit.addChildToBack(expr);
    }
    return arraylit;
  }

  public static Node objectPattern(Node... keys) {
    Node objectPattern = new Node(Token.OBJECT_PATTERN);
    for (Node key : keys) {
      checkState(key.isStringKey() || key.isRest());
      objectPattern.addChildToBack(key);
    }
    return objectPattern;
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node stringKey(String s, Node value) {
    checkState(mayBeExpression(value) || value.isName() || value.isDefaultValue());
    Node stringKey = Node.newString(Token.STRING_KEY, s);
    stringKey.addChildToBack(value);
    return stringKey;
  }

  public static Node quotedStringKey(String s, Node value) {
    Node k = stringKey(s, value);
    k.setQuotedString();
    return k;
  }

  public static Node memberFunctionDef(String name, Node function) {
    checkState(function.isFunction());
    Node member = Node.newString(Token.MEMBER_FUNCTION_DEF, name);
    member.addChildToBack(function);
    return member;
  }

  public static Node rest(Node target) {
    checkState(target.isName() || target.isDestructuringPattern(), target);
    return new Node(Token.ITER_REST, target);
  }

  public static Node defaultValue(Node target, Node value) {
    checkState(target.isName(), target);
    checkState(mayBeExpression(value), value);
    return new Node(Token.DEFAULT_VALUE, target, value);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node thisNode() {
    return new Node(Token.THIS);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  // helper methods

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  private static Node unaryOp(Token token, Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(token, expr);
  }

  private static boolean mayBeExpressionOrEmpty(Node n) {
    return n.isEmpty() || mayBeExpression(n);
  }

  private static boolean mayBeStatementNoReturn(Node n) {
    switch (n.getToken()) {
      case EMPTY:
      case NOT_EMITTED:
      case FUNCTION:
        // EMPTY and FUNCTION are used both in expression and statement
        // contexts
        return true;

      case BLOCK:
      case CLASS:
      case CONST:
      case EXPR_RESULT:
      case LET:
      case VAR:
      case IMPORT:
      case EXPORT:
        return true;

      default:
        return false;
    }
  }

  /**
   * It isn't possible to always determine if a detached node is a expression,
   * so make a best guess.
   */
  public static boolean mayBeStatement(Node n) {
    if (!mayBeStatementNoReturn(n)) {
      return n.isReturn();
    }
    return true;
  }

  /**
   * It isn't possible to always determine if a detached node is a expression,
   * so make a best guess.
   */
  public static boolean mayBeExpression(Node n) {
    switch (n.getToken()) {
      case FUNCTION:
      case CLASS:
        // FUNCTION and CLASS are used both in expression and statement
        // contexts.
        return true;

      case AND:
      case ARRAYLIT:
      case ASSIGN:
      case CALL:
      case COMMA:
      case FALSE:
      case GETPROP:
      case GETELEM:
      case NAME:
      case NEW:
      case NOT:
      case NUMBER:
      case NULL:
      case OBJECTLIT:
      case OR:
      case STRINGLIT:
      case THIS:
      case TYPEOF:
      case TRUE:
      case VOID:
        return true;

      default:
        return false;
    }
  }
}
