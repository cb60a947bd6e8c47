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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.javascript.modconv.ast.IR;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.ast.Token;
import com.google.javascript.modconv.types.JsSymbol;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites the top-level statements of a CommonJS module, as emitted by the TypeScript compiler,
 * into goog.module form.
 *
 * <ul>
 *   <li>converts require() calls to goog.require() calls, with or without a binding
 *   <li>removes "use strict"; and Object.defineProperty(exports, '__esModule', ...) statements
 *   <li>converts module.exports assignments to exports assignments
 *   <li>splits comma expressions and __exportStar() calls into separate statements
 *   <li>turns getter based re-exports into plain exports assignments
 *   <li>makes sure every namespace is required exactly once and reuses the binding later on
 * </ul>
 *
 * <p>Each matcher either recognizes its statement completely or leaves it untouched; nothing is
 * rewritten halfway. Statements no matcher recognizes keep their position and, if they declare a
 * function or variable, get an annotation block.
 */
public final class CommonJsToGoogModule {

  private static final Logger logger = Logger.getLogger(CommonJsToGoogModule.class.getName());

  private final ConversionContext context;
  private final ModuleAliasTable aliasTable;
  private final DeclarationAnnotator annotator;

  // goog.require statements that bind nothing, by namespace, until some later load needs a binding.
  private final Map<String, Node> sideEffectRequires = new HashMap<>();

  // Local names bound to goog: namespaces, with the symbol of the binding when the oracle knows it.
  // `.default` on these is the namespace itself.
  private final Map<String, @Nullable JsSymbol> googNamespaceBindings = new HashMap<>();

  // TypeScript emits at most one `exports.a = exports.b = void 0;` per file. A second one is code.
  private boolean didRewriteDefaultExportsAssignment = false;

  public CommonJsToGoogModule(ConversionContext context) {
    this.context = checkNotNull(context);
    this.aliasTable = context.getAliasTable();
    this.annotator = new DeclarationAnnotator(context);
  }

  /** Rewrites the statements of {@code script} in place. */
  public void process(Node script) {
    checkArgument(script.isScript(), "Expected a SCRIPT, got %s", script);
    for (Node statement : script.children()) {
      checkState(
          !statement.isImport() && !statement.isExport(),
          "ES module declarations must be lowered to CommonJS before conversion: %s",
          statement);
    }
    for (Node statement : script.detachChildren()) {
      script.addChildrenToBack(visitTopLevelStatement(statement));
    }
    if (!googNamespaceBindings.isEmpty()) {
      collapseDefaultAccesses(script);
    }
  }

  /** Returns the statements that replace {@code statement}, at least one. */
  private List<Node> visitTopLevelStatement(Node statement) {
    if (context.getOptions().isJsTranspilation()) {
      Node tslib = maybeRewriteRequireTslib(statement);
      if (tslib != null) {
        return ImmutableList.of(tslib);
      }
    }
    switch (statement.getToken()) {
      case EXPR_RESULT:
        List<Node> rewritten = visitExpressionStatement(statement);
        if (rewritten != null) {
          return rewritten;
        }
        break;
      case VAR:
      case LET:
      case CONST:
        Node require = maybeRewriteRequireDeclaration(statement);
        if (require != null) {
          return ImmutableList.of(require);
        }
        break;
      default:
        break;
    }
    annotator.annotate(statement);
    return ImmutableList.of(statement);
  }

  private @Nullable List<Node> visitExpressionStatement(Node statement) {
    Node expr = statement.getFirstChild();
    if (isUseStrict(expr) || isEsModuleProperty(expr)) {
      return ImmutableList.of(createNotEmittedStatement(statement));
    }
    if (!didRewriteDefaultExportsAssignment && isExportsVoid0Assignment(expr)) {
      didRewriteDefaultExportsAssignment = true;
      return ImmutableList.of(createNotEmittedStatement(statement));
    }

    Node moduleExports = maybeRewriteModuleExportsAssignment(statement);
    if (moduleExports != null) {
      return ImmutableList.of(moduleExports);
    }
    List<Node> commaExpanded = maybeRewriteCommaExpression(statement);
    if (commaExpanded != null) {
      return commaExpanded;
    }
    List<Node> exportStarAsNs = maybeRewriteExportStarAsNs(statement);
    if (exportStarAsNs != null) {
      return exportStarAsNs;
    }
    Node getterExport = maybeRewriteObjectDefinePropertyOnExports(statement);
    if (getterExport != null) {
      return ImmutableList.of(getterExport);
    }

    // The rest handles only calls:
    //   goog.declareModuleId(...);
    //   __exportStar(require('foo'), exports);
    //   require('foo');
    if (!expr.isCall()) {
      return null;
    }
    Node declaredModuleId = maybeRewriteDeclareModuleId(statement);
    if (declaredModuleId != null) {
      return ImmutableList.of(declaredModuleId);
    }
    List<Node> exportStar = maybeRewriteExportStar(statement);
    if (exportStar != null) {
      return exportStar;
    }
    Node sideEffectRequire = maybeRewriteSideEffectRequire(statement);
    if (sideEffectRequire != null) {
      return ImmutableList.of(sideEffectRequire);
    }
    return null;
  }

  // ==========================================================================
  // Statements that are dropped

  /** Matches {@code 'use strict';}. */
  private static boolean isUseStrict(Node expr) {
    return expr.isString() && expr.getString().equals("use strict");
  }

  /** Matches {@code Object.defineProperty(exports, '__esModule', {value: true});}. */
  private static boolean isEsModuleProperty(Node expr) {
    if (!isDefinePropertyOnExports(expr)) {
      return false;
    }
    Node name = expr.getChildAtIndex(2);
    if (!name.getString().equals("__esModule")) {
      return false;
    }
    Node config = expr.getLastChild();
    if (!config.hasOneChild()) {
      return false;
    }
    Node key = config.getFirstChild();
    if (!isPlainKey(key, "value")) {
      return false;
    }
    return key.getFirstChild().isTrue();
  }

  /** Matches {@code exports.a = exports.b = void 0}. */
  private static boolean isExportsVoid0Assignment(Node expr) {
    if (!expr.isAssign()) {
      return false;
    }
    Node lhs = expr.getFirstChild();
    if (!lhs.isGetProp() || !lhs.getFirstChild().matchesName("exports")) {
      return false;
    }
    Node rhs = expr.getLastChild();
    if (rhs.isAssign()) {
      return isExportsVoid0Assignment(rhs);
    }
    if (!rhs.isVoid()) {
      return false;
    }
    Node operand = rhs.getFirstChild();
    return operand.isNumber() && operand.getDouble() == 0;
  }

  // ==========================================================================
  // Exports

  /** Replaces {@code module.exports = X;} with {@code exports = X;}. */
  private static @Nullable Node maybeRewriteModuleExportsAssignment(Node statement) {
    Node expr = statement.getFirstChild();
    if (!expr.isAssign()) {
      return null;
    }
    if (!expr.getFirstChild().matchesQualifiedName("module.exports")) {
      return null;
    }
    Node value = expr.getLastChild().detach();
    return IR.exprResult(IR.assign(IR.name("exports"), value))
        .useSourceInfoAndCommentsFrom(statement);
  }

  /**
   * Converts {@code x = foo, y(), z.bar();} into {@code x = foo; y(); z.bar();}. Closure rejects
   * the {@code exports.x = ..., exports.y = ...;} form TypeScript emits for grouped exports.
   */
  private static @Nullable List<Node> maybeRewriteCommaExpression(Node statement) {
    Node expr = statement.getFirstChild();
    if (!expr.isComma()) {
      return null;
    }
    List<Node> operands = new ArrayList<>();
    collectCommaOperands(expr, operands);
    List<Node> statements = new ArrayList<>();
    for (Node operand : operands) {
      statements.add(IR.exprResult(operand.detach()).srcrefTreeIfMissing(operand));
    }
    return withCommentsFrom(statements, statement);
  }

  private static void collectCommaOperands(Node expr, List<Node> operands) {
    if (expr.isComma()) {
      for (Node child : expr.children()) {
        collectCommaOperands(child, operands);
      }
    } else {
      operands.add(expr);
    }
  }

  /**
   * Rewrites {@code exports.ns = require('ns');}, the emit of {@code export * as ns from 'ns'},
   * into a binding followed by the export. Closure infers the namespace's type only through a
   * binding.
   */
  private @Nullable List<Node> maybeRewriteExportStarAsNs(Node statement) {
    Node expr = statement.getFirstChild();
    if (!expr.isAssign()) {
      return null;
    }
    Node lhs = expr.getFirstChild();
    if (!lhs.isGetProp() || !lhs.getFirstChild().matchesName("exports")) {
      return null;
    }
    Node call = expr.getLastChild();
    String specifier = extractRequire(call);
    if (specifier == null) {
      return null;
    }
    String namespace = resolveNamespace(specifier);
    List<Node> statements = new ArrayList<>();
    String alias = bindNamespace(namespace, null, statements, statement);
    registerExportAliases(call.getSecondChild(), alias);
    statements.add(
        IR.exprResult(IR.assign(IR.getprop(IR.name("exports"), lhs.getString()), IR.name(alias))));
    return withCommentsFrom(statements, statement);
  }

  /**
   * Rewrites the live binding TypeScript emits for a re-export,
   *
   * <pre>
   * Object.defineProperty(exports, 'a', {enumerable: true, get: function() { return a_1.a; }});
   * </pre>
   *
   * into {@code exports.a = a_1.a;}. goog.module exports are not live and Closure does not allow
   * defineProperty on exports.
   */
  private static @Nullable Node maybeRewriteObjectDefinePropertyOnExports(Node statement) {
    Node expr = statement.getFirstChild();
    if (!isDefinePropertyOnExports(expr)) {
      return null;
    }
    Node config = expr.getLastChild();

    // Not marked enumerable means TypeScript did not generate this.
    Node enumerable = findProperty(config, "enumerable");
    if (enumerable == null || !enumerable.isStringKey()) {
      return null;
    }
    if (!enumerable.getFirstChild().isTrue()) {
      return null;
    }

    Node getter = findProperty(config, "get");
    if (getter == null) {
      return null;
    }
    Node function = getter.getFirstChild();
    if (!function.isFunction() || function.isArrowFunction()) {
      return null;
    }

    // The getter must be exactly `return <value>;`.
    Node body = function.getLastChild();
    if (!body.hasOneChild()) {
      return null;
    }
    Node getterReturn = body.getFirstChild();
    if (!getterReturn.isReturn() || !getterReturn.hasOneChild()) {
      return null;
    }

    String exportedName = expr.getChildAtIndex(2).getString();
    Node value = getterReturn.getFirstChild().detach();
    return IR.exprResult(IR.assign(IR.getprop(IR.name("exports"), exportedName), value))
        .useSourceInfoAndCommentsFrom(statement);
  }

  /**
   * Rewrites {@code __exportStar(require('foo'), exports);} and {@code __export(require('foo'));}
   * into a binding and the export call on that binding. Closure rejects requires that are not
   * top-level statements.
   */
  private @Nullable List<Node> maybeRewriteExportStar(Node statement) {
    Node call = statement.getFirstChild();
    Node callee = call.getFirstChild();
    if (!callee.matchesName("__exportStar") && !callee.matchesName("__export")) {
      return null;
    }
    Node required = call.getSecondChild();
    if (required == null) {
      return null;
    }
    String specifier = extractRequire(required);
    if (specifier == null) {
      return null;
    }
    String namespace = resolveNamespace(specifier);
    List<Node> statements = new ArrayList<>();
    String alias = bindNamespace(namespace, null, statements, statement);
    registerExportAliases(required.getSecondChild(), alias);

    Node exportCall = IR.call(IR.name(callee.getString()), IR.name(alias));
    Node target = required.getNext();
    if (target != null) {
      exportCall.addChildToBack(target.detach());
    }
    statements.add(IR.exprResult(exportCall));
    return withCommentsFrom(statements, statement);
  }

  /**
   * Rewrites {@code goog.declareModuleId('foo.bar');} into a write to the loader's module table,
   *
   * <pre>
   * goog.loadedModules_['foo.bar'] = {
   *   exports: exports,
   *   type: goog.ModuleType.GOOG,
   *   moduleId: 'foo.bar'
   * };
   * </pre>
   *
   * which exposes this goog.module under the declared id as well. This only works at runtime, in
   * uncompiled development mode.
   */
  private static @Nullable Node maybeRewriteDeclareModuleId(Node statement) {
    Node call = statement.getFirstChild();
    if (!call.getFirstChild().matchesQualifiedName("goog.declareModuleId")) {
      return null;
    }
    if (!call.hasTwoChildren() || !call.getSecondChild().isString()) {
      return null;
    }
    String moduleId = call.getSecondChild().getString();
    Node moduleTable =
        IR.getelem(IR.getprop(IR.name("goog"), "loadedModules_"), IR.string(moduleId));
    Node moduleRecord =
        IR.objectlit(
            IR.stringKey("exports", IR.name("exports")),
            IR.stringKey("type", IR.getprop(IR.name("goog"), "ModuleType", "GOOG")),
            IR.stringKey("moduleId", IR.string(moduleId)));
    return IR.exprResult(IR.assign(moduleTable, moduleRecord))
        .useSourceInfoAndCommentsFrom(statement);
  }

  // ==========================================================================
  // Requires

  /**
   * In JS transpilation mode {@code require('tslib');} becomes {@code goog.require('tslib');}
   * without going through module resolution.
   */
  private @Nullable Node maybeRewriteRequireTslib(Node statement) {
    if (!statement.isExprResult()) {
      return null;
    }
    String specifier = extractRequire(statement.getFirstChild());
    if (specifier == null || !specifier.equals(context.getOptions().getTslibSpecifier())) {
      return null;
    }
    context.addReferencedModule(specifier);
    if (aliasTable.isRegistered(specifier)) {
      return createNotEmittedStatement(statement);
    }
    return createSideEffectRequire(specifier, statement);
  }

  /**
   * Rewrites {@code require('foo');}. The first load of a namespace becomes {@code
   * goog.require('foo');}, later ones are dropped.
   */
  private @Nullable Node maybeRewriteSideEffectRequire(Node statement) {
    String specifier = extractRequire(statement.getFirstChild());
    if (specifier == null) {
      return null;
    }
    String namespace = resolveNamespace(specifier);
    if (aliasTable.isRegistered(namespace)) {
      return createNotEmittedStatement(statement);
    }
    return createSideEffectRequire(namespace, statement);
  }

  private Node createSideEffectRequire(String namespace, Node original) {
    aliasTable.registerSideEffect(namespace);
    Node require =
        IR.exprResult(createGoogRequireCall(namespace)).useSourceInfoAndCommentsFrom(original);
    sideEffectRequires.put(namespace, require);
    return require;
  }

  /**
   * Rewrites {@code var x = require('foo');}. The first load binds the namespace to {@code x}; a
   * later one binds {@code x} to the existing binding.
   */
  private @Nullable Node maybeRewriteRequireDeclaration(Node statement) {
    // A single plain name, not `var x = ..., y = ...;` and not a destructuring pattern.
    if (!statement.hasOneChild()) {
      return null;
    }
    Node name = statement.getFirstChild();
    if (!name.isName() || !name.hasOneChild()) {
      return null;
    }
    Node call = name.getFirstChild();
    String specifier = extractRequire(call);
    if (specifier == null) {
      return null;
    }
    String localName = name.getString();
    String namespace = resolveNamespace(specifier);

    // A goog.module sees the Closure base library as the ambient `goog`, so a binding to it is
    // dropped rather than required.
    ModuleConversionOptions options = context.getOptions();
    if (localName.equals(options.getAmbientLoaderName())
        && namespace.equals(options.getAmbientLoaderNamespace())) {
      return createNotEmittedStatement(statement);
    }
    if (ModuleNames.extractGoogNamespaceImport(specifier) != null) {
      googNamespaceBindings.put(localName, context.getOracle().resolveSymbol(name));
    }

    List<Node> statements = new ArrayList<>();
    String alias = bindNamespace(namespace, localName, statements, statement);
    registerExportAliases(call.getSecondChild(), localName);
    if (!statements.isEmpty()) {
      return statements.get(0);
    }
    if (alias.equals(localName)) {
      return createNotEmittedStatement(statement);
    }
    return createBinding(localName, IR.name(alias)).useSourceInfoAndCommentsFrom(statement);
  }

  /**
   * Returns the local name that holds {@code namespace}. If the namespace has no binding yet, adds
   * the {@code goog.require} statement creating one to {@code statements}, or converts an earlier
   * side-effect-only require of it into a binding.
   *
   * @param preferredName the name a new binding should get, or null for a {@code moduleVar_N}
   */
  private String bindNamespace(
      String namespace, @Nullable String preferredName, List<Node> statements, Node original) {
    String existing = aliasTable.lookup(namespace);
    if (existing != null) {
      return existing;
    }
    Node sideEffectRequire = sideEffectRequires.remove(namespace);
    if (sideEffectRequire != null) {
      String alias = aliasTable.register(namespace);
      logger.fine("Binding earlier require of " + namespace + " to " + alias);
      Node binding =
          createBinding(alias, createGoogRequireCall(namespace))
              .useSourceInfoAndCommentsFrom(sideEffectRequire);
      sideEffectRequire.replaceWith(binding);
      return alias;
    }
    String alias;
    if (preferredName != null) {
      aliasTable.bind(namespace, preferredName);
      alias = preferredName;
    } else {
      alias = aliasTable.register(namespace);
    }
    statements.add(
        createBinding(alias, createGoogRequireCall(namespace))
            .useSourceInfoAndCommentsFrom(original));
    return alias;
  }

  /**
   * Makes the exports of the module required at {@code specifierNode} reachable from type
   * expressions as {@code alias.name}.
   *
   * <p>Only exports that are cleanly declared in that module's own file are aliased. An export
   * without declarations, declared in another file, or forwarding to a symbol that cannot be
   * resolved to that file is skipped: when the origin is ambiguous, emit less.
   */
  private void registerExportAliases(Node specifierNode, String alias) {
    JsSymbol moduleSymbol = context.getOracle().resolveSymbol(specifierNode);
    if (moduleSymbol == null) {
      return;
    }
    String moduleFile = moduleSymbol.getDeclaringFile();
    if (moduleFile == null) {
      return;
    }
    for (JsSymbol exported : context.getOracle().exportsOf(moduleSymbol)) {
      JsSymbol local = localDeclarationOf(exported, moduleFile);
      if (local == null) {
        continue;
      }
      String aliasText = alias + "." + exported.getName();
      aliasTable.registerSymbolAlias(exported, aliasText);
      if (local != exported) {
        aliasTable.registerSymbolAlias(local, aliasText);
      }
    }
  }

  private static @Nullable JsSymbol localDeclarationOf(JsSymbol exported, String moduleFile) {
    if (exported.getDeclarations().isEmpty()) {
      return null;
    }
    JsSymbol local = exported;
    for (JsSymbol.Declaration declaration : exported.getDeclarations()) {
      if (!declaration.fileName().equals(moduleFile)) {
        return null;
      }
      if (declaration.exportSpecifier()) {
        JsSymbol target = declaration.localTarget();
        if (target == null || !target.isDeclaredOnlyIn(moduleFile)) {
          return null;
        }
        local = target;
      }
    }
    return local;
  }

  private String resolveNamespace(String specifier) {
    String namespace =
        ModuleNames.importPathToGoogNamespace(context, context.getFileName(), specifier);
    context.addReferencedModule(namespace);
    return namespace;
  }

  // ==========================================================================
  // goog: namespace imports

  /**
   * Replaces {@code x.default} with {@code x} for bindings of goog: namespaces, so that the
   * namespace's value can be imported as if it were a default export. Accesses through a function
   * parameter or local that shadows the binding are left alone.
   */
  private void collapseDefaultAccesses(Node root) {
    List<Node> defaultAccesses = new ArrayList<>();
    collectDefaultAccesses(root, googNamespaceBindings.keySet(), defaultAccesses);
    for (Node access : defaultAccesses) {
      access.replaceWith(access.getFirstChild().detach());
    }
  }

  private void collectDefaultAccesses(
      Node n, Set<String> bindingsInScope, List<Node> defaultAccesses) {
    Set<String> inScope = bindingsInScope;
    if (n.isFunction() || n.isBlock() || n.isClass()) {
      Set<String> shadowed = new HashSet<>();
      collectScopeDeclarations(n, shadowed);
      shadowed.retainAll(bindingsInScope);
      if (!shadowed.isEmpty()) {
        inScope = new HashSet<>(bindingsInScope);
        inScope.removeAll(shadowed);
      }
    }
    if (inScope.isEmpty()) {
      return;
    }
    for (Node child : n.children()) {
      collectDefaultAccesses(child, inScope, defaultAccesses);
    }
    if (!n.isGetProp() || !n.getString().equals("default")) {
      return;
    }
    Node target = n.getFirstChild();
    if (!target.isName() || !inScope.contains(target.getString())) {
      return;
    }
    Node parent = n.getParent();
    if (parent.isAssign() && parent.getFirstChild() == n) {
      return;
    }
    if (!refersToGoogNamespaceBinding(target)) {
      return;
    }
    defaultAccesses.add(n);
  }

  /** Whether the oracle, where it can tell, agrees that {@code name} is the goog: binding. */
  private boolean refersToGoogNamespaceBinding(Node name) {
    @Nullable JsSymbol binding = googNamespaceBindings.get(name.getString());
    if (binding == null) {
      return true;
    }
    @Nullable JsSymbol symbol = context.getOracle().resolveSymbol(name);
    return symbol == null || symbol == binding;
  }

  /**
   * Adds the names a function, block or class declares for its own scope. A function's scope
   * takes its name, its parameters and every declaration in its body outside nested functions.
   * Over-approximates, which only ever leaves an access uncollapsed.
   */
  private static void collectScopeDeclarations(Node scope, Set<String> names) {
    switch (scope.getToken()) {
      case FUNCTION:
        if (!scope.getFirstChild().getString().isEmpty()) {
          names.add(scope.getFirstChild().getString());
        }
        collectNames(scope.getSecondChild(), names);
        if (scope.getLastChild().isBlock()) {
          collectBodyDeclarations(scope.getLastChild(), names);
        }
        break;
      case BLOCK:
        for (Node statement : scope.children()) {
          collectDeclaredNames(statement, names);
        }
        break;
      case CLASS:
        collectNames(scope.getFirstChild(), names);
        break;
      default:
        throw new IllegalStateException("Not a scope: " + scope);
    }
  }

  private static void collectBodyDeclarations(Node n, Set<String> names) {
    for (Node child : n.children()) {
      collectDeclaredNames(child, names);
      if (!child.isFunction() && !child.isClass()) {
        collectBodyDeclarations(child, names);
      }
    }
  }

  private static void collectDeclaredNames(Node statement, Set<String> names) {
    if (statement.isNameDeclaration()) {
      for (Node target : statement.children()) {
        if (target.isName()) {
          names.add(target.getString());
        } else if (target.isDestructuringPattern()) {
          collectNames(target, names);
        }
      }
    } else if ((statement.isFunction() || statement.isClass())
        && statement.getFirstChild().isName()
        && !statement.getFirstChild().getString().isEmpty()) {
      names.add(statement.getFirstChild().getString());
    }
  }

  private static void collectNames(Node n, Set<String> names) {
    if (n.isName()) {
      if (!n.getString().isEmpty()) {
        names.add(n.getString());
      }
      return;
    }
    for (Node child : n.children()) {
      collectNames(child, names);
    }
  }

  // ==========================================================================
  // Helpers

  /** Returns the specifier if {@code n} is {@code require('specifier')}. */
  private static @Nullable String extractRequire(Node n) {
    if (!n.isCall() || !n.getFirstChild().matchesName("require")) {
      return null;
    }
    if (!n.hasTwoChildren()) {
      return null;
    }
    Node argument = n.getSecondChild();
    return argument.isString() ? argument.getString() : null;
  }

  /** Matches {@code Object.defineProperty(exports, '<string>', {...})}. */
  private static boolean isDefinePropertyOnExports(Node expr) {
    if (!expr.isCall() || !expr.getFirstChild().matchesQualifiedName("Object.defineProperty")) {
      return false;
    }
    if (!expr.hasXChildren(4)) {
      return false;
    }
    return expr.getSecondChild().matchesName("exports")
        && expr.getChildAtIndex(2).isString()
        && expr.getLastChild().isObjectLit();
  }

  /** Returns the first property named {@code name} of an object literal. */
  private static @Nullable Node findProperty(Node objectLit, String name) {
    for (Node key : objectLit.children()) {
      if ((key.isStringKey() || key.isMemberFunctionDef()) && isPlainKey(key, name)) {
        return key;
      }
    }
    return null;
  }

  private static boolean isPlainKey(Node key, String name) {
    if (!key.isStringKey() && !key.isMemberFunctionDef()) {
      return false;
    }
    return !key.isQuotedString() && key.getString().equals(name);
  }

  private Node createBinding(String localName, Node value) {
    Token declarationType = context.getOptions().isEs5Mode() ? Token.VAR : Token.CONST;
    return IR.declaration(IR.name(localName), value, declarationType);
  }

  private static Node createGoogRequireCall(String namespace) {
    return IR.call(IR.getprop(IR.name("goog"), "require"), IR.string(namespace));
  }

  /** Replaces a statement with a placeholder that only keeps its comments. */
  private static Node createNotEmittedStatement(Node original) {
    return IR.notEmitted().srcref(original).setNonJSDocComment(original.getNonJSDocComment());
  }

  private static List<Node> withCommentsFrom(List<Node> statements, Node original) {
    for (Node statement : statements) {
      statement.srcrefTreeIfMissing(original);
    }
    Node first = statements.get(0);
    if (first.getNonJSDocComment() == null) {
      first.setNonJSDocComment(original.getNonJSDocComment());
    }
    return statements;
  }
}
