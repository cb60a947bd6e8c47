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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.javascript.modconv.types.JsSymbol;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Tracks, for one module, which namespaces have been required and the local name each one is bound
 * to. A namespace is required at most once; every later load reuses the first binding.
 *
 * <p>Also records the text under which symbols of other modules are reachable from this module,
 * e.g. {@code moduleVar_1.Foo}, for use in type expressions.
 */
public final class ModuleAliasTable {

  static final String SYNTHETIC_ALIAS_PREFIX = "moduleVar_";

  // Namespaces in discovery order. A null value marks a side-effect-only require.
  private final Map<String, @Nullable String> aliases = new LinkedHashMap<>();
  private final Map<JsSymbol, String> symbolAliases = new IdentityHashMap<>();
  private int nextAliasIndex = 1;

  /**
   * Returns the local name bound to {@code namespace}, creating a {@code moduleVar_N} binding if
   * the namespace has none yet.
   */
  @CanIgnoreReturnValue
  public String register(String namespace) {
    String alias = aliases.get(namespace);
    if (alias == null) {
      alias = SYNTHETIC_ALIAS_PREFIX + nextAliasIndex++;
      aliases.put(namespace, alias);
    }
    return alias;
  }

  /** Records that {@code namespace} is bound to a user-chosen local name. */
  public void bind(String namespace, String localName) {
    checkNotNull(localName);
    checkState(
        aliases.get(namespace) == null, "%s is already bound to %s", namespace, lookup(namespace));
    aliases.put(namespace, localName);
  }

  /** Records a require of {@code namespace} that binds nothing. */
  public void registerSideEffect(String namespace) {
    checkState(!aliases.containsKey(namespace), "%s is already registered", namespace);
    aliases.put(namespace, null);
  }

  /** Returns the local name bound to {@code namespace}, or null if it is unbound. */
  public @Nullable String lookup(String namespace) {
    return aliases.get(namespace);
  }

  public boolean isRegistered(String namespace) {
    return aliases.containsKey(namespace);
  }

  /** Every registered namespace, in the order it was first seen. */
  public ImmutableList<String> namespaces() {
    return ImmutableList.copyOf(aliases.keySet());
  }

  /** Records that {@code symbol} is reachable in this module as {@code aliasText}. */
  public void registerSymbolAlias(JsSymbol symbol, String aliasText) {
    symbolAliases.putIfAbsent(symbol, aliasText);
  }

  public @Nullable String lookupSymbolAlias(JsSymbol symbol) {
    return symbolAliases.get(symbol);
  }
}
