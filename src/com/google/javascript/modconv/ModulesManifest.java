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
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Append-only ledger of converted modules: which file is registered under which name, and which
 * namespaces each file loads. It is the only state shared between module conversions, so every
 * method is synchronized.
 */
public final class ModulesManifest {

  // file name -> module name, in conversion order
  private final Map<String, String> moduleNameByFile = new LinkedHashMap<>();
  // module name -> file name
  private final Map<String, String> fileByModuleName = new LinkedHashMap<>();
  // file name -> referenced module names
  private final Map<String, Set<String>> referencedModulesByFile = new LinkedHashMap<>();

  public synchronized void addModule(String fileName, String moduleName) {
    checkNotNull(fileName);
    checkNotNull(moduleName);
    moduleNameByFile.put(fileName, moduleName);
    fileByModuleName.put(moduleName, fileName);
    referencedModulesByFile.computeIfAbsent(fileName, f -> new LinkedHashSet<>());
  }

  public synchronized void addReferencedModule(String fileName, String moduleName) {
    referencedModulesByFile.computeIfAbsent(fileName, f -> new LinkedHashSet<>()).add(moduleName);
  }

  public synchronized void addReferencedModules(String fileName, Iterable<String> moduleNames) {
    Set<String> referenced =
        referencedModulesByFile.computeIfAbsent(fileName, f -> new LinkedHashSet<>());
    for (String moduleName : moduleNames) {
      referenced.add(moduleName);
    }
  }

  /** Records a whole module at once. */
  public synchronized void appendRecord(ModuleRecord record) {
    addModule(record.fileName(), record.moduleName());
    addReferencedModules(record.fileName(), record.referencedModules());
  }

  public synchronized @Nullable String getModuleName(String fileName) {
    return moduleNameByFile.get(fileName);
  }

  public synchronized @Nullable String getFileNameFromModule(String moduleName) {
    return fileByModuleName.get(moduleName);
  }

  public synchronized ImmutableSet<String> getReferencedModules(String fileName) {
    Set<String> referenced = referencedModulesByFile.get(fileName);
    return referenced == null ? ImmutableSet.of() : ImmutableSet.copyOf(referenced);
  }

  /** The registered module names, in the order the modules were added. */
  public synchronized ImmutableList<String> getModuleNames() {
    return ImmutableList.copyOf(moduleNameByFile.values());
  }

  public synchronized ImmutableList<String> getFileNames() {
    return ImmutableList.copyOf(moduleNameByFile.keySet());
  }

  /**
   * Writes the manifest as a JSON array with one object per module:
   *
   * <pre>
   * [{"fileName": "a.ts", "moduleName": "a", "referencedModules": ["b"]}]
   * </pre>
   *
   * @param writer receives the JSON. This class does not close it.
   */
  public synchronized void writeJson(Writer writer) throws IOException {
    JsonWriter jsonWriter = new JsonWriter(writer);
    jsonWriter.beginArray();
    for (Map.Entry<String, String> module : moduleNameByFile.entrySet()) {
      jsonWriter.beginObject();
      jsonWriter.name("fileName").value(module.getKey());
      jsonWriter.name("moduleName").value(module.getValue());
      jsonWriter.name("referencedModules").beginArray();
      for (String referenced : referencedModulesByFile.get(module.getKey())) {
        jsonWriter.value(referenced);
      }
      jsonWriter.endArray();
      jsonWriter.endObject();
    }
    jsonWriter.endArray();
    jsonWriter.flush();
  }

  public synchronized String toJson() {
    StringWriter writer = new StringWriter();
    try {
      writeJson(writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }
}
