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

import com.google.common.base.Strings;
import com.google.javascript.modconv.ast.AnnotationTag;
import java.util.List;

/** Renders annotation blocks as JSDoc comments. */
final class AnnotationPrinter {

  private AnnotationPrinter() {}

  /**
   * Renders {@code tags} as a JSDoc comment. A single tag fits on one line, {@code /** @const
   * {string} *&#47;}; more tags get one line each.
   *
   * @param indent the indentation of the annotated statement
   */
  static String print(List<AnnotationTag> tags, int indent) {
    if (tags.size() == 1) {
      return "/** " + tags.get(0) + " */";
    }
    String prefix = Strings.repeat(" ", indent);
    StringBuilder sb = new StringBuilder("/**\n");
    for (AnnotationTag tag : tags) {
      sb.append(prefix).append(" * ").append(tag).append('\n');
    }
    return sb.append(prefix).append(" */").toString();
  }
}
