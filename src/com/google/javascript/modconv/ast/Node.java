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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children form a doubly linked list: {@code first.previous} is the last child and the last
 * child's {@code next} is null.
 */
public class Node {

  /** Boolean properties. */
  public enum Prop {
    // Set if the node is an arrow function.
    ARROW_FN,
    // Set to indicate a quoted object lit key
    QUOTED,
    // Indicates that a SCRIPT node is syntactically a module rather than a script.
    MODULE,
    // Indicates that a SCRIPT node is a goog.module.
    GOOG_MODULE,
    // The node was created by the module converter rather than read from the input.
    SYNTHESIZED
  }

  private final Token token;

  private @Nullable Node parent;

  private @Nullable Node first; // first child

  private @Nullable Node next; // next sibling, null for the last child

  private @Nullable Node previous; // previous sibling, the last sibling for the first child

  private final EnumSet<Prop> props = EnumSet.noneOf(Prop.class);

  private @Nullable String sourceFileName;

  private int lineno = -1;

  private int charno = -1;

  private int length;

  private @Nullable NonJSDocComment nonJSDocComment;

  private @Nullable ImmutableList<AnnotationTag> annotation;

  public Node(Token token) {
    this.token = token;
  }

  public Node(Token token, Node child) {
    this(token);
    addChildToBack(child);
  }

  public Node(Token token, Node left, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(right);
  }

  public Node(Token token, Node left, Node mid, Node right) {
    this(token);
    addChildToBack(left);
    addChildToBack(mid);
    addChildToBack(right);
  }

  public static Node newNumber(double number) {
    return new NumberNode(number);
  }

  public static Node newString(String str) {
    return new StringNode(Token.STRINGLIT, str);
  }

  public static Node newString(Token token, String str) {
    return new StringNode(token, str);
  }

  private static final class NumberNode extends Node {
    private double number;

    NumberNode(double number) {
      super(Token.NUMBER);
      this.number = number;
    }

    @Override
    public double getDouble() {
      return number;
    }

    @Override
    public void setDouble(double d) {
      this.number = d;
    }

    @Override
    Node cloneNode() {
      return copyBaseNodeFields(this, new NumberNode(number));
    }

    @Override
    boolean isEquivalentValue(Node node) {
      return node instanceof NumberNode && ((NumberNode) node).number == number;
    }
  }

  private static final class StringNode extends Node {
    private String str;

    StringNode(Token token, String str) {
      super(token);
      this.str = checkNotNull(str, "String nodes require a value: %s", token);
    }

    @Override
    public String getString() {
      return str;
    }

    @Override
    public void setString(String str) {
      this.str = checkNotNull(str);
    }

    @Override
    Node cloneNode() {
      return copyBaseNodeFields(this, new StringNode(getToken(), str));
    }

    @Override
    boolean isEquivalentValue(Node node) {
      return node instanceof StringNode && ((StringNode) node).str.equals(str);
    }
  }

  public final Token getToken() {
    return token;
  }

  public final boolean hasChildren() {
    return first != null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild());
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first == null ? null : first.next;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final boolean hasTwoChildren() {
    return first != null && first.next != null && first.next == getLastChild();
  }

  public final boolean hasXChildren(int x) {
    int c = 0;
    for (Node n = first; n != null && c <= x; n = n.next) {
      c++;
    }
    return c == x;
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      child.previous = last;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  /** Adds every node of {@code children} to the back of this node's children, in order. */
  public final void addChildrenToBack(Iterable<Node> children) {
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  /** Inserts this detached node immediately before {@code existing}. */
  public final void insertBefore(Node existing) {
    checkDetached();
    existing.checkAttached();
    Node existingParent = existing.parent;
    if (existingParent.first == existing) {
      existingParent.addChildToFront(this);
      return;
    }
    Node before = existing.previous;
    this.parent = existingParent;
    this.previous = before;
    this.next = existing;
    before.next = this;
    existing.previous = this;
  }

  /** Inserts this detached node immediately after {@code existing}. */
  public final void insertAfter(Node existing) {
    checkDetached();
    existing.checkAttached();
    Node existingParent = existing.parent;
    if (existing.next == null) {
      existingParent.addChildToBack(this);
      return;
    }
    Node after = existing.next;
    this.parent = existingParent;
    this.previous = existing;
    this.next = after;
    existing.next = this;
    after.previous = this;
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();
    replacement.srcrefIfMissing(this);
    replacement.insertBefore(this);
    this.detach();
  }

  /** Removes this node from its parent, but retains its subtree. */
  @CanIgnoreReturnValue
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      // this.next remains null;
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
      // existingPrevious.next remains null
    } else {
      // existingParent.first is unchanged;
      existingPrevious.next = existingNext;
    }

    return this;
  }

  /** Removes all children from this node and isolates the children from each other. */
  public final ImmutableList<Node> detachChildren() {
    ImmutableList.Builder<Node> children = ImmutableList.builder();
    for (Node child = first; child != null; ) {
      Node nextChild = child.next;
      child.parent = null;
      child.next = null;
      child.previous = null;
      children.add(child);
      child = nextChild;
    }
    first = null;
    return children.build();
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  /**
   * Return an iterable object that iterates over this node's children. The iterator does not
   * support the optional operation {@link Iterator#remove()}.
   */
  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node n = current;
            current = current.next;
            return n;
          }
        };
  }

  // ==========================================================================
  // Values

  public double getDouble() {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  public void setDouble(double d) {
    throw new UnsupportedOperationException(this + " is not a number node");
  }

  public String getString() {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  public void setString(String str) {
    throw new UnsupportedOperationException(this + " is not a string node");
  }

  public final boolean getBooleanProp(Prop prop) {
    return props.contains(prop);
  }

  public final void putBooleanProp(Prop prop, boolean value) {
    if (value) {
      props.add(prop);
    } else {
      props.remove(prop);
    }
  }

  public final boolean isArrowFunction() {
    return getBooleanProp(Prop.ARROW_FN);
  }

  public final void setIsArrowFunction(boolean value) {
    checkState(isFunction());
    putBooleanProp(Prop.ARROW_FN, value);
  }

  public final boolean isQuotedString() {
    return getBooleanProp(Prop.QUOTED);
  }

  public final void setQuotedString() {
    checkState(isStringKey(), this);
    putBooleanProp(Prop.QUOTED, true);
  }

  // ==========================================================================
  // Comments and annotations

  /**
   * Get the NonJSDoc comment string attached to this node.
   *
   * @return the information or empty string if no nonJSDoc is attached to this node
   */
  public final String getNonJSDocCommentString() {
    return nonJSDocComment == null ? "" : nonJSDocComment.getCommentString();
  }

  public final @Nullable NonJSDocComment getNonJSDocComment() {
    return nonJSDocComment;
  }

  @CanIgnoreReturnValue
  public final Node setNonJSDocComment(@Nullable NonJSDocComment comment) {
    this.nonJSDocComment = comment;
    return this;
  }

  /** The annotation block attached to this declaration, or null if it has none. */
  public final @Nullable ImmutableList<AnnotationTag> getAnnotation() {
    return annotation;
  }

  @CanIgnoreReturnValue
  public final Node setAnnotation(@Nullable ImmutableList<AnnotationTag> annotation) {
    this.annotation = annotation;
    return this;
  }

  // ==========================================================================
  // Source position

  public final @Nullable String getSourceFileName() {
    return sourceFileName;
  }

  @CanIgnoreReturnValue
  public final Node setSourceFileName(@Nullable String sourceFileName) {
    this.sourceFileName = sourceFileName;
    return this;
  }

  // Returns the 1-based line number
  public final int getLineno() {
    return lineno;
  }

  // Returns the 0-based column number
  public final int getCharno() {
    return charno;
  }

  @CanIgnoreReturnValue
  public final Node setLinenoCharno(int lineno, int charno) {
    if (lineno < 0 || charno < 0) {
      this.lineno = -1;
      this.charno = -1;
    } else {
      this.lineno = lineno;
      this.charno = charno;
    }
    return this;
  }

  public final int getLength() {
    return length;
  }

  public final String getLocation() {
    return this.getSourceFileName() + ":" + this.getLineno() + ":" + this.getCharno();
  }

  /** Copy the source info from `other` onto `this`. */
  @CanIgnoreReturnValue
  public final Node srcref(Node other) {
    sourceFileName = other.sourceFileName;
    lineno = other.lineno;
    charno = other.charno;
    length = other.length;
    return this;
  }

  /** For all Nodes in the subtree of `this`, copy the source info from `other`. */
  @CanIgnoreReturnValue
  public final Node srcrefTree(Node other) {
    this.srcref(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTree(other);
    }
    return this;
  }

  /** Iff source info is not set on `this`, copy the source info from `other`. */
  @CanIgnoreReturnValue
  public final Node srcrefIfMissing(Node other) {
    if (sourceFileName == null) {
      sourceFileName = other.sourceFileName;
      lineno = other.lineno;
      charno = other.charno;
      length = other.length;
    }
    return this;
  }

  /**
   * For all Nodes in the subtree of `this`, iff source info is not set, copy the source info from
   * `other`.
   */
  @CanIgnoreReturnValue
  public final Node srcrefTreeIfMissing(Node other) {
    this.srcrefIfMissing(other);
    for (Node child = first; child != null; child = child.next) {
      child.srcrefTreeIfMissing(other);
    }
    return this;
  }

  /**
   * Makes this statement stand in for {@code original}: copies the source position onto the whole
   * subtree and moves the leading comment over.
   */
  @CanIgnoreReturnValue
  public final Node useSourceInfoAndCommentsFrom(Node original) {
    srcrefTreeIfMissing(original);
    if (nonJSDocComment == null) {
      nonJSDocComment = original.nonJSDocComment;
    }
    return this;
  }

  // ==========================================================================
  // Cloning

  /** Returns a detached clone of the Node, specifically excluding its children. */
  @CheckReturnValue
  Node cloneNode() {
    return copyBaseNodeFields(this, new Node(token));
  }

  private static Node copyBaseNodeFields(Node source, Node dest) {
    dest.props.addAll(source.props);
    dest.sourceFileName = source.sourceFileName;
    dest.lineno = source.lineno;
    dest.charno = source.charno;
    dest.length = source.length;
    dest.nonJSDocComment = source.nonJSDocComment;
    dest.annotation = source.annotation;
    return dest;
  }

  /** Returns a detached clone of the Node and all its children. */
  @CheckReturnValue
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node child = first; child != null; child = child.next) {
      result.addChildToBack(child.cloneTree());
    }
    return result;
  }

  // ==========================================================================
  // Equivalence

  /** Whether this node's value (string or number), if it has one, equals {@code node}'s. */
  boolean isEquivalentValue(Node node) {
    return node.getClass() == Node.class;
  }

  /**
   * Returns true if this node is equivalent semantically to another including the structure of
   * its children. Source positions, comments and annotations are ignored.
   */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token
        || !props.equals(node.props)
        || !isEquivalentValue(node)
        || !node.isEquivalentValue(this)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  // ==========================================================================
  // Names

  /**
   * This function takes a set of GETPROP nodes and produces a string that is each property
   * separated by dots. If the node ultimately under the left sub-tree is not a simple name, this is
   * not a valid qualified name.
   *
   * @return a null if this is not a qualified name, or a dot-separated string of the name and
   *     properties.
   */
  public final @Nullable String getQualifiedName() {
    switch (token) {
      case NAME:
        String name = getString();
        return name.isEmpty() ? null : name;
      case GETPROP:
        String left = first.getQualifiedName();
        return left == null ? null : left + "." + getString();
      case THIS:
        return "this";
      default:
        return null;
    }
  }

  /**
   * Returns whether a node corresponds to a simple or a qualified name, such as <code>x</code> or
   * <code>a.b.c</code> or <code>this.a</code>.
   */
  public final boolean isQualifiedName() {
    switch (this.getToken()) {
      case NAME:
        return !getString().isEmpty();
      case THIS:
        return true;
      case GETPROP:
        return getFirstChild().isQualifiedName();
      default:
        return false;
    }
  }

  /**
   * Returns whether a node matches a simple name, such as <code>x</code>, returns false if this is
   * not a NAME node.
   */
  public final boolean matchesName(String name) {
    if (token != Token.NAME) {
      return false;
    }
    String internalString = getString();
    return !internalString.isEmpty() && name.equals(internalString);
  }

  /**
   * Returns whether a node matches a simple or a qualified name, such as <code>x</code> or <code>
   * a.b.c</code> or <code>this.a</code>.
   */
  public final boolean matchesQualifiedName(String name) {
    return name.equals(getQualifiedName());
  }

  // ==========================================================================
  // Token predicates

  public final boolean isAssign() {
    return this.token == Token.ASSIGN;
  }

  public final boolean isBlock() {
    return this.token == Token.BLOCK;
  }

  public final boolean isCall() {
    return this.token == Token.CALL;
  }

  public final boolean isClass() {
    return this.token == Token.CLASS;
  }

  public final boolean isComma() {
    return this.token == Token.COMMA;
  }

  public final boolean isConst() {
    return this.token == Token.CONST;
  }

  public final boolean isDefaultValue() {
    return this.token == Token.DEFAULT_VALUE;
  }

  public final boolean isDestructuringPattern() {
    return this.token == Token.ARRAY_PATTERN || this.token == Token.OBJECT_PATTERN;
  }

  public final boolean isEmpty() {
    return this.token == Token.EMPTY;
  }

  public final boolean isExport() {
    return this.token == Token.EXPORT;
  }

  public final boolean isExprResult() {
    return this.token == Token.EXPR_RESULT;
  }

  public final boolean isFalse() {
    return this.token == Token.FALSE;
  }

  public final boolean isFunction() {
    return this.token == Token.FUNCTION;
  }

  public final boolean isGetElem() {
    return this.token == Token.GETELEM;
  }

  public final boolean isGetProp() {
    return this.token == Token.GETPROP;
  }

  public final boolean isImport() {
    return this.token == Token.IMPORT;
  }

  public final boolean isLet() {
    return this.token == Token.LET;
  }

  public final boolean isMemberFunctionDef() {
    return this.token == Token.MEMBER_FUNCTION_DEF;
  }

  public final boolean isName() {
    return this.token == Token.NAME;
  }

  /** Whether this is a VAR, LET or CONST statement. */
  public final boolean isNameDeclaration() {
    return this.token == Token.VAR || this.token == Token.LET || this.token == Token.CONST;
  }

  public final boolean isNotEmitted() {
    return this.token == Token.NOT_EMITTED;
  }

  public final boolean isNumber() {
    return this.token == Token.NUMBER;
  }

  public final boolean isObjectLit() {
    return this.token == Token.OBJECTLIT;
  }

  public final boolean isParamList() {
    return this.token == Token.PARAM_LIST;
  }

  public final boolean isRest() {
    return this.token == Token.ITER_REST;
  }

  public final boolean isReturn() {
    return this.token == Token.RETURN;
  }

  public final boolean isScript() {
    return this.token == Token.SCRIPT;
  }

  public final boolean isString() {
    return this.token == Token.STRINGLIT;
  }

  public final boolean isStringKey() {
    return this.token == Token.STRING_KEY;
  }

  public final boolean isTrue() {
    return this.token == Token.TRUE;
  }

  public final boolean isVar() {
    return this.token == Token.VAR;
  }

  public final boolean isVoid() {
    return this.token == Token.VOID;
  }

  // ==========================================================================
  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder(token.name());
    if (this instanceof StringNode) {
      sb.append(' ').append(getString());
    } else if (this instanceof NumberNode) {
      sb.append(' ').append(getDouble());
    }
    if (lineno != -1) {
      sb.append(' ').append(lineno).append(':').append(charno);
    }
    if (!props.isEmpty()) {
      sb.append(' ').append(props);
    }
    return sb.toString();
  }

  /** Renders this subtree, one node per line, indented by depth. */
  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    toStringTreeHelper(this, 0, sb);
    return sb.toString();
  }

  private static void toStringTreeHelper(Node n, int level, StringBuilder sb) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(n).append('\n');
    for (Node cursor = n.first; cursor != null; cursor = cursor.next) {
      toStringTreeHelper(cursor, level + 1, sb);
    }
  }
}
