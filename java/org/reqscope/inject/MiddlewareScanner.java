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

package org.reqscope.inject;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Key;
import java.lang.reflect.Modifier;
import org.reqscope.config.ScopeConfig;
import org.reqscope.pipeline.Middleware;
import org.reqscope.scope.ScopedContainer;

/** Finds the middleware types a {@link ScopedContainer} knows how to build. */
class MiddlewareScanner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Returns the keys of all registered middleware that still need an adapter stage.
   *
   * <p>A registration qualifies if {@link #isMiddlewareCapability(Key)} accepts its key, no adapter
   * for it is registered in the container and the configuration does not exclude it. Keys are
   * returned in the container's enumeration order.
   */
  static ImmutableList<Key<? extends Middleware>> scan(ScopedContainer container) {
    ScopeConfig config = container.config();
    ImmutableList.Builder<Key<? extends Middleware>> found = ImmutableList.builder();
    for (Key<?> key : container.registrations()) {
      if (!isMiddlewareCapability(key)) {
        continue;
      }
      if (container.isRegistered(ContainerMiddleware.adapterKey(key))) {
        logger.atFine().log("Skipping %s: adapter is registered explicitly", key);
        continue;
      }
      if (config.isExcluded(key.getTypeLiteral().getRawType())) {
        logger.atFine().log("Skipping %s: excluded by autowire.exclude", key);
        continue;
      }
      @SuppressWarnings("unchecked")
      Key<? extends Middleware> middleware = (Key<? extends Middleware>) key;
      found.add(middleware);
    }
    return found.build();
  }

  /**
   * Returns true if {@code key} names a concrete middleware type.
   *
   * <p>Annotated keys, abstract types, interfaces and adapters themselves do not qualify.
   */
  static boolean isMiddlewareCapability(Key<?> key) {
    if (key.getAnnotationType() != null) {
      return false;
    }
    Class<?> type = key.getTypeLiteral().getRawType();
    return Middleware.class.isAssignableFrom(type)
        && !type.isInterface()
        && !Modifier.isAbstract(type.getModifiers())
        && !ContainerMiddleware.class.isAssignableFrom(type)
        && !ScopeInjectorMiddleware.class.isAssignableFrom(type);
  }

  private MiddlewareScanner() {}
}
