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

package com.google.javascript.modconv.ast;

import java.io.Serializable;

/** Minimal class holding information about a nonJSDoc comment's source location and contents */
public class NonJSDocComment implements Serializable {
  private final int startLine;
  private final int startColumn;
  private final String contents;
  private boolean isTrailing;

  public NonJSDocComment(int startLine, int startColumn, String contents) {
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.contents = contents;
    this.isTrailing = false;
  }

  public String getCommentString() {
    if (contents == null) {
      return "";
    }
    return contents;
  }

  public int getStartLine() {
    return startLine;
  }

  public int getStartColumn() {
    return startColumn;
  }

  public void setIsTrailing(boolean isTrailing) {
    this.isTrailing = isTrailing;
  }

  /** Indicates whether this comment is placed after the source node it is attached to. */
  public boolean isTrailing() {
    return this.isTrailing;
  }

  @Override
  public String toString() {
    return getCommentString();
  }
}
