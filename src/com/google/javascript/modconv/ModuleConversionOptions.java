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

import java.io.Serializable;

/** Options for converting CommonJS modules to goog.module. */
public class ModuleConversionOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Emit {@code var} bindings and skip the ES6-only header statements. */
  boolean es5Mode = false;

  /**
   * The input is transpiled JavaScript rather than TypeScript output. Scripts that are not modules
   * are left alone, {@code require('tslib')} is always rewritten to {@code goog.require('tslib')}
   * and no tslib dependency is added to the header.
   */
  boolean jsTranspilation = false;

  /** Resolve {@code 'pkg'} to {@code 'pkg/index'} and path mappings before naming a module. */
  boolean convertIndexImportShorthand = false;

  /** Root against which resolved paths are checked for third-party package directories. */
  String rootDir = "";

  /** Local name of a binding to the Closure base library that is dropped instead of required. */
  String ambientLoaderName = "goog";

  /** Namespace of the Closure base library module. */
  String ambientLoaderNamespace = "google3.javascript.closure.goog";

  /** Import specifier of the TypeScript helper library. */
  String tslibSpecifier = "tslib";

  public ModuleConversionOptions() {}

  public void setEs5Mode(boolean es5Mode) {
    this.es5Mode = es5Mode;
  }

  public boolean isEs5Mode() {
    return es5Mode;
  }

  public void setJsTranspilation(boolean jsTranspilation) {
    this.jsTranspilation = jsTranspilation;
  }

  public boolean isJsTranspilation() {
    return jsTranspilation;
  }

  public void setConvertIndexImportShorthand(boolean convertIndexImportShorthand) {
    this.convertIndexImportShorthand = convertIndexImportShorthand;
  }

  public boolean getConvertIndexImportShorthand() {
    return convertIndexImportShorthand;
  }

  public void setRootDir(String rootDir) {
    this.rootDir = checkNotNull(rootDir);
  }

  public String getRootDir() {
    return rootDir;
  }

  public void setAmbientLoader(String localName, String namespace) {
    this.ambientLoaderName = checkNotNull(localName);
    this.ambientLoaderNamespace = checkNotNull(namespace);
  }

  public String getAmbientLoaderName() {
    return ambientLoaderName;
  }

  public String getAmbientLoaderNamespace() {
    return ambientLoaderNamespace;
  }

  public void setTslibSpecifier(String tslibSpecifier) {
    this.tslibSpecifier = checkNotNull(tslibSpecifier);
  }

  public String getTslibSpecifier() {
    return tslibSpecifier;
  }
}
