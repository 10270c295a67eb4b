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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import org.reqscope.pipeline.AppBuilder;
import org.reqscope.pipeline.Middleware;
import org.reqscope.scope.ScopedContainer;

/**
 * Wires a {@link ScopedContainer} into an {@link AppBuilder}.
 *
 * <p>Two styles are supported. The simple one installs the request scope and every middleware
 * bound in the container in one go:
 *
 * <pre>
 * ScopedPipelines.registerAllMiddleware(app, container);
 * app.use(new StaticFiles());
 * </pre>
 *
 * The other separates injecting the request scope from adding container-built middleware, since
 * the scope usually belongs early in the pipeline while the middleware may belong later:
 *
 * <pre>
 * ScopedPipelines.registerInjector(app, container);
 * app.use(new BasicAuthentication());
 * ScopedPipelines.registerMiddlewareType(app, PathRewriter.class);
 * app.use(new StaticFiles());
 * </pre>
 *
 * Mixing {@link #registerAllMiddleware} with {@link #registerMiddlewareType} for the same type
 * installs that middleware twice.
 */
public final class ScopedPipelines {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Property of the {@link AppBuilder} marking that the scope injector was installed. */
  static final String INJECTOR_REGISTERED_KEY =
      "ScopeInjectorRegistered:" + ScopedPipelines.class.getName();

  /**
   * Returns true if the request scope injector was installed into {@code app}.
   *
   * <p>Useful when composing an application from several setup routines that may each try to
   * install the injector.
   *
   * @throws NullPointerException if {@code app} is null.
   */
  public static boolean isInjectorRegistered(AppBuilder app) {
    requireNonNull(app, "app");
    return app.properties().containsKey(INJECTOR_REGISTERED_KEY);
  }

  /**
   * Installs a stage that opens a request scope of {@code container} for the rest of the pipeline.
   *
   * <p>Only the first call for a given {@code app} installs the stage; later calls leave the
   * pipeline unchanged. The registration marker is set before the stage is appended, so while
   * another thread is inside this call {@link #isInjectorRegistered} may already return true
   * although {@link AppBuilder#stages()} does not list the stage yet.
   *
   * @return {@code app}.
   * @throws NullPointerException if {@code app} or {@code container} is null; the pipeline is not
   *     modified in that case.
   */
  @CanIgnoreReturnValue
  public static AppBuilder registerInjector(AppBuilder app, ScopedContainer container) {
    requireNonNull(app, "app");
    requireNonNull(container, "container");
    return installInjector(app, container);
  }

  /**
   * Installs the request scope injector followed by one stage for every middleware type bound in
   * {@code container}.
   *
   * <p>Middleware types whose {@link ContainerMiddleware} adapter is bound explicitly, or that are
   * listed in {@code autowire.exclude}, are skipped. The order of the auto-wired stages follows the
   * container's binding order and is not otherwise guaranteed.
   *
   * @return {@code app}.
   * @throws NullPointerException if {@code app} or {@code container} is null; the pipeline is not
   *     modified in that case.
   */
  @CanIgnoreReturnValue
  public static AppBuilder registerAllMiddleware(AppBuilder app, ScopedContainer container) {
    requireNonNull(app, "app");
    requireNonNull(container, "container");
    installInjector(app, container);
    return useAllMiddlewareRegisteredInContainer(app, container);
  }

  /**
   * Installs a stage resolving {@code type} from the current scope on every request.
   *
   * @return {@code app}.
   * @throws NullPointerException if {@code app} or {@code type} is null.
   */
  @CanIgnoreReturnValue
  public static <T extends Middleware> AppBuilder registerMiddlewareType(
      AppBuilder app, Class<T> type) {
    requireNonNull(type, "type");
    return registerMiddlewareType(app, Key.get(type));
  }

  @CanIgnoreReturnValue
  public static <T extends Middleware> AppBuilder registerMiddlewareType(
      AppBuilder app, TypeLiteral<T> type) {
    requireNonNull(type, "type");
    return registerMiddlewareType(app, Key.get(type));
  }

  @CanIgnoreReturnValue
  public static <T extends Middleware> AppBuilder registerMiddlewareType(
      AppBuilder app, Key<T> key) {
    requireNonNull(app, "app");
    requireNonNull(key, "key");
    return app.use(ContainerMiddleware.of(key));
  }

  private static AppBuilder installInjector(AppBuilder app, ScopedContainer container) {
    if (app.properties().putIfAbsent(INJECTOR_REGISTERED_KEY, Boolean.TRUE) != null) {
      logger.atWarning().log("Request scope injector already registered; ignoring %s", container);
      return app;
    }
    app.use(new ScopeInjectorMiddleware(container));
    logger.atFine().log("Registered request scope injector for %s", container);
    return app;
  }

  private static AppBuilder useAllMiddlewareRegisteredInContainer(
      AppBuilder app, ScopedContainer container) {
    ImmutableList<Key<? extends Middleware>> middleware = MiddlewareScanner.scan(container);
    if (middleware.isEmpty()) {
      return app;
    }

    for (Key<? extends Middleware> key : middleware) {
      app.use(ContainerMiddleware.of(key));
      logger.atFine().log("Auto-wired middleware %s", key);
    }
    logger.atInfo().log("Auto-wired %d middleware from %s", middleware.size(), container);
    return app;
  }

  private ScopedPipelines() {}
}
