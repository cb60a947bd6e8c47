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

/** Maps file paths to the names modules are registered under. */
public interface ModuleNamingHost {

  /**
   * Takes a context (the file name of the current file) and the path of an import and generates
   * the dotted goog.module name for the imported module. An empty context means {@code path} is
   * the file being converted.
   */
  String pathToRegisteredName(String contextFile, String path);

  /** Returns the value {@code module.id} takes for the given file. */
  String fileNameToModuleId(String fileName);
}
