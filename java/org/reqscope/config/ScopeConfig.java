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

package org.reqscope.config;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import org.eclipse.jgit.lib.Config;

/**
 * Settings for request scopes and middleware auto-wiring.
 *
 * <p>Read from a git-style config file:
 *
 * <pre>
 * [scope]
 *   requestTag = request
 *   disposeInstances = true
 *   closeOrder = reverse-creation
 * [autowire]
 *   exclude = com.example.LegacyMiddleware
 * </pre>
 */
@AutoValue
public abstract class ScopeConfig {
  public static final String SECTION_SCOPE = "scope";
  public static final String SECTION_AUTOWIRE = "autowire";

  public static final String KEY_REQUEST_TAG = "requestTag";
  public static final String KEY_DISPOSE_INSTANCES = "disposeInstances";
  public static final String KEY_CLOSE_ORDER = "closeOrder";
  public static final String KEY_EXCLUDE = "exclude";

  public static final String DEFAULT_REQUEST_TAG = "request";

  /** Tag reported by request scopes and used as prefix of their request ids. */
  public abstract String requestTag();

  /** Whether a closing request scope closes the {@link AutoCloseable} instances it created. */
  public abstract boolean disposeInstances();

  public abstract CloseOrder closeOrder();

  /** Binary names of middleware types the auto-wiring scanner must skip. */
  public abstract ImmutableSet<String> autowireExcludes();

  public static ScopeConfig defaults() {
    return create(
        DEFAULT_REQUEST_TAG, true, CloseOrder.REVERSE_CREATION, ImmutableSet.of());
  }

  public static ScopeConfig create(
      String requestTag,
      boolean disposeInstances,
      CloseOrder closeOrder,
      ImmutableSet<String> autowireExcludes) {
    return new AutoValue_ScopeConfig(requestTag, disposeInstances, closeOrder, autowireExcludes);
  }

  /**
   * Parses the settings out of {@code cfg}; unset keys take their default.
   *
   * @throws IllegalArgumentException if {@code scope.closeOrder} holds an unknown value.
   */
  public static ScopeConfig fromConfig(Config cfg) {
    String tag = Strings.emptyToNull(cfg.getString(SECTION_SCOPE, null, KEY_REQUEST_TAG));
    return create(
        tag != null ? tag.trim() : DEFAULT_REQUEST_TAG,
        cfg.getBoolean(SECTION_SCOPE, KEY_DISPOSE_INSTANCES, true),
        cfg.getEnum(SECTION_SCOPE, null, KEY_CLOSE_ORDER, CloseOrder.REVERSE_CREATION),
        Arrays.stream(cfg.getStringList(SECTION_AUTOWIRE, null, KEY_EXCLUDE))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(ImmutableSet.toImmutableSet()));
  }

  /** Returns true if the auto-wiring scanner should skip {@code type}. */
  public boolean isExcluded(Class<?> type) {
    return autowireExcludes().contains(type.getName());
  }
}
