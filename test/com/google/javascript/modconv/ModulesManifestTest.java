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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ModulesManifestTest {

  private final ModulesManifest manifest = new ModulesManifest();

  @Test
  public void testLookups() {
    manifest.addModule("src/a.ts", "src.a");
    manifest.addReferencedModule("src/a.ts", "src.b");
    manifest.addReferencedModules("src/a.ts", ImmutableSet.of("src.c", "src.b"));

    assertThat(manifest.getModuleName("src/a.ts")).isEqualTo("src.a");
    assertThat(manifest.getFileNameFromModule("src.a")).isEqualTo("src/a.ts");
    assertThat(manifest.getReferencedModules("src/a.ts"))
        .containsExactly("src.b", "src.c")
        .inOrder();
    assertThat(manifest.getModuleName("src/b.ts")).isNull();
    assertThat(manifest.getReferencedModules("src/b.ts")).isEmpty();
  }

  @Test
  public void testModulesKeepInsertionOrder() {
    manifest.appendRecord(new ModuleRecord("b.ts", "b", ImmutableSet.of()));
    manifest.appendRecord(new ModuleRecord("a.ts", "a", ImmutableSet.of("b")));

    assertThat(manifest.getModuleNames()).containsExactly("b", "a").inOrder();
    assertThat(manifest.getFileNames()).containsExactly("b.ts", "a.ts").inOrder();
  }

  @Test
  public void testJson() {
    manifest.appendRecord(new ModuleRecord("a.ts", "a", ImmutableSet.of("b", "tslib")));
    manifest.appendRecord(new ModuleRecord("b.ts", "b", ImmutableSet.of()));

    assertThat(manifest.toJson())
        .isEqualTo(
            "[{\"fileName\":\"a.ts\",\"moduleName\":\"a\",\"referencedModules\":[\"b\",\"tslib\"]},"
                + "{\"fileName\":\"b.ts\",\"moduleName\":\"b\",\"referencedModules\":[]}]");
  }

  @Test
  public void testWriteJsonLeavesWriterOpen() throws Exception {
    StringWriter writer = new StringWriter();

    manifest.writeJson(writer);
    writer.write("\n");

    assertThat(writer.toString()).isEqualTo("[]\n");
  }

  @Test
  public void testConcurrentRecords() throws Exception {
    List<Thread> threads = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      String name = "m" + i;
      threads.add(
          new Thread(
              () -> {
                for (int j = 0; j < 100; j++) {
                  manifest.appendRecord(
                      new ModuleRecord(name + "_" + j + ".ts", name + "_" + j, ImmutableSet.of()));
                }
              }));
    }
    for (Thread thread : threads) {
      thread.start();
    }
    for (Thread thread : threads) {
      thread.join();
    }

    assertThat(manifest.getModuleNames()).hasSize(800);
  }
}
