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
import com.google.javascript.modconv.ast.Node;
import com.google.javascript.modconv.types.JsSymbol;
import com.google.javascript.modconv.types.TypeDescriptor;
import org.jspecify.annotations.Nullable;

/**
 * Read-only view of the front end's name, type and module resolution. The converter never parses
 * or type checks anything itself; everything it knows about symbols comes through here.
 */
public interface ModuleOracle {

  /**
   * Returns the symbol a node refers to. For the string literal argument of a {@code require}
   * call this is the imported module's symbol.
   */
  @Nullable JsSymbol resolveSymbol(Node node);

  /**
   * Returns the type of the expression or declared name at {@code node}. For a class name this is
   * the constructor type, with construct signatures; for a method definition it is the method's
   * type.
   */
  @Nullable TypeDescriptor typeOf(Node node);

  /** Returns the symbols exported by a module symbol, in declaration order. */
  ImmutableList<JsSymbol> exportsOf(JsSymbol moduleSymbol);

  /**
   * Resolves an import specifier to the file it names, following index shorthands and path
   * mappings. Returns null when the specifier does not resolve.
   */
  @Nullable String resolveModulePath(String fromFile, String specifier);
}
