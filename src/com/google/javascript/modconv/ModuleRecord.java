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

import com.google.common.collect.ImmutableSet;

/**
 * What the ledger records about one converted module.
 *
 * @param fileName the converted file
 * @param moduleName the dotted name the file is registered under
 * @param referencedModules the namespaces the file loads, in first-seen order
 */
public record ModuleRecord(
    String fileName, String moduleName, ImmutableSet<String> referencedModules) {
  public ModuleRecord {
    checkNotNull(fileName);
    checkNotNull(moduleName);
    checkNotNull(referencedModules);
  }
}
