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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.javascript.modconv.ast.Node;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * State for converting one module. Created when a module's conversion starts and dropped when it
 * ends; nothing in here is shared between modules.
 */
public final class ConversionContext {

  private final ModuleConversionOptions options;
  private final ModuleOracle oracle;
  private final ModuleNamingHost namingHost;
  private final String fileName;
  private final ModuleAliasTable aliasTable = new ModuleAliasTable();
  private final List<JSError> diagnostics = new ArrayList<>();
  private final Set<String> referencedModules = new LinkedHashSet<>();
  private @Nullable TypeTranslator typeTranslator;

  public ConversionContext(
      ModuleConversionOptions options,
      ModuleOracle oracle,
      ModuleNamingHost namingHost,
      String fileName) {
    this.options = checkNotNull(options);
    this.oracle = checkNotNull(oracle);
    this.namingHost = checkNotNull(namingHost);
    this.fileName = checkNotNull(fileName);
  }

  public ModuleConversionOptions getOptions() {
    return options;
  }

  public ModuleOracle getOracle() {
    return oracle;
  }

  public ModuleNamingHost getNamingHost() {
    return namingHost;
  }

  /** The file being converted. */
  public String getFileName() {
    return fileName;
  }

  public ModuleAliasTable getAliasTable() {
    return aliasTable;
  }

  /** The translator for this module; its cache lives as long as this context. */
  public TypeTranslator getTypeTranslator() {
    if (typeTranslator == null) {
      typeTranslator = new TypeTranslator(this);
    }
    return typeTranslator;
  }

  public void report(JSError error) {
    diagnostics.add(error);
  }

  void report(Node n, DiagnosticType type, String... arguments) {
    report(JSError.make(n, type, arguments));
  }

  public ImmutableList<JSError> getDiagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  void addReferencedModule(String namespace) {
    referencedModules.add(namespace);
  }

  /** Namespaces this module loads, in the order they were first seen. */
  public ImmutableSet<String> getReferencedModules() {
    return ImmutableSet.copyOf(referencedModules);
  }
}
