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

import com.google.common.collect.ImmutableList;
import com.google.javascript.modconv.ast.IR;
import com.google.javascript.modconv.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Adds the goog.module prologue to a converted script:
 *
 * <pre>
 * goog.module('dotted.name');
 * var module = module || {id: 'path/to/file.ts'};
 * goog.require('tslib');
 * module = module;
 * exports = {};
 * </pre>
 *
 * The prologue goes after any leading comment-only placeholders. The tslib require is skipped in JS
 * transpilation mode or when the body already requires it. The last two statements are only
 * emitted outside ES5 mode, and {@code exports = {};} only when the body does not assign {@code
 * exports} itself.
 */
public final class ModuleHeaderSynthesizer {

  private final ConversionContext context;

  public ModuleHeaderSynthesizer(ConversionContext context) {
    this.context = checkNotNull(context);
  }

  /** Inserts the prologue for the module registered as {@code moduleName} into {@code script}. */
  public void synthesize(Node script, String moduleName) {
    checkArgument(script.isScript(), script);
    ImmutableList<Node> header = createHeader(script, moduleName);
    Node insertionPoint = script.getFirstChild();
    while (insertionPoint != null && insertionPoint.isNotEmitted()) {
      insertionPoint = insertionPoint.getNext();
    }
    for (Node statement : header) {
      statement.srcrefTreeIfMissing(script);
      statement.putBooleanProp(Node.Prop.SYNTHESIZED, true);
      if (insertionPoint == null) {
        script.addChildToBack(statement);
      } else {
        statement.insertBefore(insertionPoint);
      }
    }
  }

  private ImmutableList<Node> createHeader(Node script, String moduleName) {
    ImmutableList.Builder<Node> header = ImmutableList.builder();
    header.add(
        IR.exprResult(IR.call(IR.getprop(IR.name("goog"), "module"), IR.string(moduleName))));

    // Lets code read its own module URL from `module.id`, as it can in an ES module. The guard
    // keeps Closure's advanced optimizations from complaining.
    String moduleId = context.getNamingHost().fileNameToModuleId(context.getFileName());
    header.add(
        IR.var(
            IR.name("module"),
            IR.or(IR.name("module"), IR.objectlit(IR.stringKey("id", IR.string(moduleId))))));

    // Required unconditionally so that module manifests agree between the development and the
    // Closure emit, only one of which may use tslib.
    if (!context.getOptions().isJsTranspilation()) {
      String tslib = tslibNamespace();
      if (!context.getAliasTable().isRegistered(tslib)) {
        context.addReferencedModule(tslib);
        header.add(
            IR.exprResult(IR.call(IR.getprop(IR.name("goog"), "require"), IR.string(tslib))));
      }
    }

    if (!context.getOptions().isEs5Mode()) {
      header.add(IR.exprResult(IR.assign(IR.name("module"), IR.name("module"))));
      if (findExportsAssignment(script) == null) {
        header.add(IR.exprResult(IR.assign(IR.name("exports"), IR.objectlit())));
      }
    }
    return header.build();
  }

  private String tslibNamespace() {
    String fileName = context.getFileName();
    ModuleConversionOptions options = context.getOptions();
    String path =
        ModuleNames.resolveModuleName(
            context.getOracle(), options.getRootDir(), fileName, options.getTslibSpecifier());
    return context.getNamingHost().pathToRegisteredName(fileName, path);
  }

  /** Returns the first top-level {@code exports = ...;} statement of the script. */
  private static @Nullable Node findExportsAssignment(Node script) {
    for (Node statement : script.children()) {
      if (!statement.isExprResult()) {
        continue;
      }
      Node expr = statement.getFirstChild();
      if (expr.isAssign() && expr.getFirstChild().matchesName("exports")) {
        return statement;
      }
    }
    return null;
  }
}
