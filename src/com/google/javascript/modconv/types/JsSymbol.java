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

package com.google.javascript.modconv.types;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * A named entity as resolved by the front end: a module, a class, a function and so on.
 *
 * <p>Symbols compare by identity. Two symbols with the same name declared in different files are
 * different symbols.
 */
public final class JsSymbol {

  /**
   * Where a symbol is declared.
   *
   * @param fileName the file holding the declaration
   * @param exportSpecifier whether the declaration is an export specifier ({@code export {x}}) that
   *     forwards to another symbol rather than declaring a value itself
   * @param localTarget for an export specifier, the symbol it forwards to, if the front end could
   *     resolve it
   */
  public record Declaration(
      String fileName, boolean exportSpecifier, @Nullable JsSymbol localTarget) {
    public Declaration {
      checkNotNull(fileName);
    }
  }

  private final String name;
  private final SymbolKind kind;
  private final ImmutableList<Declaration> declarations;

  private JsSymbol(String name, SymbolKind kind, ImmutableList<Declaration> declarations) {
    this.name = name;
    this.kind = kind;
    this.declarations = declarations;
  }

  public static Builder builder(String name, SymbolKind kind) {
    return new Builder(name, kind);
  }

  public String getName() {
    return name;
  }

  public SymbolKind getKind() {
    return kind;
  }

  public ImmutableList<Declaration> getDeclarations() {
    return declarations;
  }

  /** The file of the first declaration, or null for symbols without declarations. */
  public @Nullable String getDeclaringFile() {
    return declarations.isEmpty() ? null : declarations.get(0).fileName();
  }

  /** Whether every declaration of this symbol is in {@code fileName}. */
  public boolean isDeclaredOnlyIn(String fileName) {
    if (declarations.isEmpty()) {
      return false;
    }
    for (Declaration declaration : declarations) {
      if (!declaration.fileName().equals(fileName)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return kind + " " + name;
  }

  /** Builder for {@link JsSymbol}. */
  public static final class Builder {
    private final String name;
    private final SymbolKind kind;
    private final ImmutableList.Builder<Declaration> declarations = ImmutableList.builder();

    private Builder(String name, SymbolKind kind) {
      this.name = checkNotNull(name);
      this.kind = checkNotNull(kind);
    }

    @CanIgnoreReturnValue
    public Builder declaredIn(String fileName) {
      declarations.add(new Declaration(fileName, false, null));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder exportSpecifierIn(String fileName, @Nullable JsSymbol localTarget) {
      declarations.add(new Declaration(fileName, true, localTarget));
      return this;
    }

    public JsSymbol build() {
      return new JsSymbol(name, kind, declarations.build());
    }
  }
}
