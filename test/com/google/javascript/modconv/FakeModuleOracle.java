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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.types.JsSymbol;
import com.google.javascript.modconv.types.TypeDescriptor;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A {@link ModuleOracle} answering from tables filled in by the test. Types are looked up by the
 * qualified name of the node asked about, or {@code Owner.prototype.method} for a method; module
 * symbols by the string literal of the import.
 */
final class FakeModuleOracle implements ModuleOracle {

  private final Map<String, TypeDescriptor> typesByName = new HashMap<>();
  private final Map<String, JsSymbol> modulesBySpecifier = new HashMap<>();
  private final Map<JsSymbol, ImmutableList<JsSymbol>> exportsByModule = new IdentityHashMap<>();
  private final Map<String, String> resolvedPaths = new HashMap<>();
  private final Map<Node, JsSymbol> symbolsByNode = new IdentityHashMap<>();

  @CanIgnoreReturnValue
  FakeModuleOracle withType(String name, TypeDescriptor type) {
    typesByName.put(name, type);
    return this;
  }

  @CanIgnoreReturnValue
  FakeModuleOracle withModule(String specifier, JsSymbol moduleSymbol, JsSymbol... exports) {
    modulesBySpecifier.put(specifier, moduleSymbol);
    exportsByModule.put(moduleSymbol, ImmutableList.copyOf(exports));
    return this;
  }

  @CanIgnoreReturnValue
  FakeModuleOracle withSymbol(Node node, JsSymbol symbol) {
    symbolsByNode.put(node, symbol);
    return this;
  }

  @CanIgnoreReturnValue
  FakeModuleOracle withResolvedPath(String specifier, String path) {
    resolvedPaths.put(specifier, path);
    return this;
  }

  @Override
  public @Nullable JsSymbol resolveSymbol(Node node) {
    JsSymbol symbol = symbolsByNode.get(node);
    if (symbol != null) {
      return symbol;
    }
    return node.isString() ? modulesBySpecifier.get(node.getString()) : null;
  }

  @Override
  public @Nullable TypeDescriptor typeOf(Node node) {
    String name = node.isMemberFunctionDef() ? methodName(node) : node.getQualifiedName();
    return name == null ? null : typesByName.get(name);
  }

  /** Names a method {@code Owner.prototype.method}. */
  private static @Nullable String methodName(Node member) {
    Node classNode = member.getParent().getParent();
    String owner = classNode.getFirstChild().getQualifiedName();
    return owner == null ? null : owner + ".prototype." + member.getString();
  }

  @Override
  public ImmutableList<JsSymbol> exportsOf(JsSymbol moduleSymbol) {
    ImmutableList<JsSymbol> exports = exportsByModule.get(moduleSymbol);
    return exports == null ? ImmutableList.of() : exports;
  }

  @Override
  public @Nullable String resolveModulePath(String fromFile, String specifier) {
    return resolvedPaths.get(specifier);
  }
}
