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

import org.jspecify.annotations.Nullable;

/** Static helpers for turning import specifiers into goog.module namespaces. */
final class ModuleNames {

  static final String GOOG_NAMESPACE_PREFIX = "goog:";

  private static final String THIRD_PARTY_DIRECTORY = "node_modules";

  private ModuleNames() {}

  /**
   * Extracts the namespace part of a goog: import specifier, or returns null if the given
   * specifier is not a goog: import.
   *
   * <p>For example, for {@code require('goog:foo.Bar')}, returns {@code foo.Bar}.
   */
  static @Nullable String extractGoogNamespaceImport(String specifier) {
    if (specifier.startsWith(GOOG_NAMESPACE_PREFIX)) {
      return specifier.substring(GOOG_NAMESPACE_PREFIX.length());
    }
    return null;
  }

  /**
   * Resolves an import specifier to a file name through the oracle. Unresolvable specifiers and
   * specifiers resolving into a third-party package directory come back unchanged; those are
   * loaded through their package metadata and the loader handles them.
   */
  static String resolveModuleName(
      ModuleOracle oracle, String rootDir, String fromFile, String specifier) {
    String resolved = oracle.resolveModulePath(fromFile, specifier);
    if (resolved == null) {
      return specifier;
    }
    if (relativize(rootDir, resolved).contains(THIRD_PARTY_DIRECTORY)) {
      return specifier;
    }
    return resolved;
  }

  /** Converts an import specifier into the namespace it is registered under. */
  static String importPathToGoogNamespace(
      ConversionContext context, String fromFile, String specifier) {
    String namespace = extractGoogNamespaceImport(specifier);
    if (namespace != null) {
      return namespace;
    }
    String path = specifier;
    if (context.getOptions().getConvertIndexImportShorthand()) {
      path =
          resolveModuleName(
              context.getOracle(), context.getOptions().getRootDir(), fromFile, specifier);
    }
    return context.getNamingHost().pathToRegisteredName(fromFile, path);
  }

  private static String relativize(String rootDir, String path) {
    if (rootDir.isEmpty()) {
      return path;
    }
    String prefix = rootDir.endsWith("/") ? rootDir : rootDir + "/";
    return path.startsWith(prefix) ? path.substring(prefix.length()) : path;
  }
}
