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

import static com.google.common.base.Strings.emptyToNull;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.modconv.ast.Node;
import org.jspecify.annotations.Nullable;

/**
 * Conversion diagnostic.
 *
 * @param type A type of the error.
 * @param description Description of the error.
 * @param sourceName Name of the source
 * @param lineno One-indexed line number of the error location.
 * @param charno Zero-indexed character number of the error location.
 * @param length Length of the error region.
 * @param node Node where the warning occurred.
 * @param defaultLevel The level reported unless the caller overrides it.
 */
public record JSError(
    DiagnosticType type,
    String description,
    @Nullable String sourceName,
    int lineno,
    int charno,
    int length,
    @Nullable Node node,
    CheckLevel defaultLevel) {
  public JSError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  private static final int DEFAULT_LINENO = -1;
  private static final int DEFAULT_CHARNO = -1;
  private static final int DEFAULT_LENGTH = 0;

  /**
   * Creates a JSError with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(DiagnosticType type, String... arguments) {
    return builder(type, arguments).build();
  }

  /**
   * Creates a JSError at a given source location
   *
   * @param sourceName The source file name
   * @param lineno Line number with source file, or -1 if unknown
   * @param charno Column number within line, or -1 for whole line.
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(
      String sourceName, int lineno, int charno, DiagnosticType type, String... arguments) {
    return builder(type, arguments).setSourceLocation(sourceName, lineno, charno).build();
  }

  /**
   * Creates a JSError from a file and Node position.
   *
   * @param n Determines the line and char position and source file name
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static JSError make(Node n, DiagnosticType type, String... arguments) {
    return builder(type, arguments).setNode(n).build();
  }

  static final class Builder {
    private final DiagnosticType type;
    private final String[] args;

    private final CheckLevel level;
    private @Nullable Node n;
    private @Nullable String sourceName;
    private int lineno = DEFAULT_LINENO;
    private int charno = DEFAULT_CHARNO;
    private int length = DEFAULT_LENGTH;

    private Builder(DiagnosticType type, String... args) {
      this.type = type;
      this.args = args;
      this.level = type.level;
    }

    /**
     * Sets the location where this error occurred.
     *
     * <p>Incompatible with {@link #setSourceLocation(String, int, int)}
     */
    @CanIgnoreReturnValue
    Builder setNode(Node n) {
      Preconditions.checkState(
          this.sourceName == null, "Cannot provide a Node when there's already a source name");
      this.n = n;
      this.sourceName = n.getSourceFileName();
      this.lineno = n.getLineno();
      this.charno = n.getCharno();
      this.length = n.getLength();
      return this;
    }

    /**
     * Sets the location where this error occurred
     *
     * <p>Incompatible with {@link #setNode(Node)}
     */
    @CanIgnoreReturnValue
    Builder setSourceLocation(String sourceName, int lineno, int charno) {
      Preconditions.checkState(
          this.n == null, "Cannot provide a source location when there is already a Node");
      this.sourceName = sourceName;
      this.lineno = lineno;
      this.charno = charno;
      return this;
    }

    JSError build() {
      return new JSError(type, type.format(args), sourceName, lineno, charno, length, n, level);
    }
  }

  static Builder builder(DiagnosticType type, String... arguments) {
    return new Builder(type, arguments);
  }

  /** Renders this error as {@code file:line:col: LEVEL - [KEY] description}. */
  public String format(CheckLevel level) {
    String source = emptyToNull(sourceName) != null ? sourceName : "(unknown source)";
    StringBuilder sb = new StringBuilder(source);
    if (lineno != DEFAULT_LINENO) {
      sb.append(':').append(lineno);
      if (charno != DEFAULT_CHARNO) {
        sb.append(':').append(charno);
      }
    }
    return sb.append(": ")
        .append(level)
        .append(" - [")
        .append(type.key)
        .append("] ")
        .append(description)
        .toString();
  }

  /** @return the default rendering of an error as text. */
  @Override
  public final String toString() {
    String sourceName =
        emptyToNull(this.sourceName()) != null ? this.sourceName() : "(unknown source)";
    String lineno =
        this.lineno() != DEFAULT_LINENO ? String.valueOf(this.lineno()) : "(unknown line)";
    String charno =
        this.charno() != DEFAULT_CHARNO ? String.valueOf(this.charno()) : "(unknown column)";

    return this.type().key
        + ". "
        + this.description()
        + " at "
        + sourceName
        + " line "
        + lineno
        + " : "
        + charno;
  }
}
