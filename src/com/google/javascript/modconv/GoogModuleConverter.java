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
import com.google.javascript.modconv.ast.Node;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Converts CommonJS modules to goog.module, one module per call.
 *
 * <p>Each call rewrites the statements of the given SCRIPT in place, prepends the goog.module
 * header, reports the module's diagnostics to the error manager and appends a record to the
 * manifest. No other state survives a call, so one converter can serve many modules; the manifest
 * is the only thing callers converting in parallel share.
 */
public final class GoogModuleConverter {

  private static final Logger logger = Logger.getLogger(GoogModuleConverter.class.getName());

  /**
   * The outcome of converting one script.
   *
   * @param script the converted script, the same node that was passed in
   * @param moduleName the name the module was registered under, or null if the script was left
   *     alone
   * @param diagnostics the warnings and errors reported while converting this script
   */
  public record ConversionResult(
      Node script, @Nullable String moduleName, ImmutableList<JSError> diagnostics) {
    public boolean isConverted() {
      return moduleName != null;
    }
  }

  private final ModuleConversionOptions options;
  private final ModuleOracle oracle;
  private final ModuleNamingHost namingHost;
  private final ModulesManifest manifest;
  private final ErrorManager errorManager;

  /** Creates a converter that reports diagnostics to a {@link LoggerErrorManager}. */
  public GoogModuleConverter(
      ModuleConversionOptions options,
      ModuleOracle oracle,
      ModuleNamingHost namingHost,
      ModulesManifest manifest) {
    this(options, oracle, namingHost, manifest, new LoggerErrorManager(logger));
  }

  public GoogModuleConverter(
      ModuleConversionOptions options,
      ModuleOracle oracle,
      ModuleNamingHost namingHost,
      ModulesManifest manifest,
      ErrorManager errorManager) {
    this.options = checkNotNull(options);
    this.oracle = checkNotNull(oracle);
    this.namingHost = checkNotNull(namingHost);
    this.manifest = checkNotNull(manifest);
    this.errorManager = checkNotNull(errorManager);
  }

  public ErrorManager getErrorManager() {
    return errorManager;
  }

  /**
   * Converts {@code script}.
   *
   * @throws IllegalArgumentException if {@code script} is not a SCRIPT with a source file name
   * @throws IllegalStateException if the script still contains ES import or export declarations
   */
  public ConversionResult convert(Node script) {
    checkArgument(script.isScript(), "Expected a SCRIPT, got %s", script);
    String fileName = script.getSourceFileName();
    checkArgument(fileName != null, "SCRIPT has no source file name");

    // JS scripts, as opposed to modules, must not become goog.modules.
    if (options.isJsTranspilation() && !script.getBooleanProp(Node.Prop.MODULE)) {
      logger.fine("Leaving non-module script " + fileName + " unchanged");
      return new ConversionResult(script, null, ImmutableList.of());
    }

    ConversionContext context = new ConversionContext(options, oracle, namingHost, fileName);
    String moduleName = namingHost.pathToRegisteredName("", fileName);

    new CommonJsToGoogModule(context).process(script);
    new ModuleHeaderSynthesizer(context).synthesize(script, moduleName);
    script.putBooleanProp(Node.Prop.GOOG_MODULE, true);

    manifest.appendRecord(new ModuleRecord(fileName, moduleName, context.getReferencedModules()));
    ImmutableList<JSError> diagnostics = context.getDiagnostics();
    for (JSError error : diagnostics) {
      errorManager.report(error.defaultLevel(), error);
    }
    logger.fine(
        "Converted "
            + fileName
            + " to goog.module "
            + moduleName
            + " with "
            + context.getReferencedModules().size()
            + " dependencies");
    return new ConversionResult(script, moduleName, diagnostics);
  }
}
