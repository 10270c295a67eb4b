// Copyright (C) 2026 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.reqscope.scope;

import com.google.inject.Key;
import org.reqscope.common.Nullable;

/** Boundary within which resolving a key yields a consistent, lifetime-bounded object graph. */
public interface ResolutionScope {
  /** Short label of the scope kind, for example {@code root} or {@code request}. */
  String tag();

  /** Returns the enclosing scope, or {@code null} for the root container. */
  @Nullable
  ResolutionScope parent();

  /**
   * Resolves {@code key} in this scope, falling back to enclosing scopes for keys this scope does
   * not bind itself.
   *
   * @throws com.google.inject.ConfigurationException if {@code key} cannot be bound.
   * @throws com.google.inject.ProvisionException if constructing the instance fails.
   * @throws com.google.inject.OutOfScopeException if this scope was already closed.
   */
  <T> T getInstance(Key<T> key);

  default <T> T getInstance(Class<T> type) {
    return getInstance(Key.get(type));
  }

  /** Returns true if {@code key} is bound in this scope or one of its ancestors. */
  boolean isRegistered(Key<?> key);
}
