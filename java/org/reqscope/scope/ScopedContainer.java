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

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.stream.Collectors.toList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.inject.Binding;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.OutOfScopeException;
import com.google.inject.Stage;
import com.google.inject.spi.Element;
import com.google.inject.spi.Elements;
import com.google.inject.spi.LinkedKeyBinding;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.reqscope.common.Nullable;
import org.reqscope.config.ScopeConfig;
import org.reqscope.pipeline.RequestContext;

/**
 * Application-lifetime root of all request scopes.
 *
 * <p>Wraps the application {@link Injector} together with the <em>per-request modules</em>: modules
 * whose bindings are installed into every {@link RequestScope} instead of the root. A binding
 * declared as a singleton in a per-request module yields one instance per request; bindings of
 * the root injector are shared by all requests. Components depending on {@link RequestContext}
 * must be bound in a per-request module, as the root injector cannot satisfy that dependency.
 *
 * <p>The container is read-only once built and may be shared by any number of threads.
 */
public class ScopedContainer implements ResolutionScope {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String ROOT_TAG = "root";

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Wraps an existing injector.
   *
   * @param injector application injector; becomes the parent of every request scope.
   * @param config scope settings.
   * @param perRequestModules modules installed into each request scope.
   * @throws IllegalArgumentException if {@code injector} already binds a key that a per-request
   *     module binds; no request scope could be created in that case.
   */
  public static ScopedContainer wrap(
      Injector injector, ScopeConfig config, Iterable<? extends Module> perRequestModules) {
    requireNonNull(injector, "injector");
    requireNonNull(config, "config");
    requireNonNull(perRequestModules, "perRequestModules");
    return new ScopedContainer(injector, config, ImmutableList.copyOf(perRequestModules));
  }

  private final Injector injector;
  private final ScopeConfig config;
  private final ImmutableList<Module> perRequestModules;
  private final ImmutableSet<Key<?>> perRequestKeys;
  private final ImmutableSet<Key<?>> linkedTargets;

  private ScopedContainer(
      Injector injector, ScopeConfig config, ImmutableList<Module> perRequestModules) {
    this.injector = injector;
    this.config = config;
    this.perRequestModules = perRequestModules;

    List<Element> elements = Elements.getElements(perRequestModules);
    this.perRequestKeys =
        elements.stream()
            .filter(e -> e instanceof Binding)
            .<Key<?>>map(e -> ((Binding<?>) e).getKey())
            .collect(ImmutableSet.toImmutableSet());
    List<Key<?>> inRoot =
        perRequestKeys.stream()
            .filter(k -> injector.getExistingBinding(k) != null)
            .collect(toList());
    if (!inRoot.isEmpty()) {
      throw new IllegalArgumentException(
          "Keys of per-request modules are already bound in the root injector: " + inRoot);
    }
    this.linkedTargets =
        elements.stream()
            .filter(e -> e instanceof LinkedKeyBinding)
            .<Key<?>>map(e -> ((LinkedKeyBinding<?>) e).getLinkedKey())
            .filter(k -> isConstructible(k) && !perRequestKeys.contains(k))
            .filter(k -> injector.getExistingBinding(k) == null)
            .collect(ImmutableSet.toImmutableSet());
    logger.atInfo().log(
        "Created scoped container with %d root and %d per-request bindings",
        injector.getBindings().size(), perRequestKeys.size());
  }

  private static boolean isConstructible(Key<?> key) {
    if (key.getAnnotationType() != null) {
      return false;
    }
    Class<?> type = key.getTypeLiteral().getRawType();
    return !type.isInterface() && !Modifier.isAbstract(type.getModifiers());
  }

  /**
   * Opens a new request scope for {@code context}.
   *
   * <p>The caller owns the returned scope and must close it once the request completes, normally
   * with try-with-resources.
   */
  public RequestScope beginRequestScope(RequestContext context) {
    requireNonNull(context, "context");
    return new RequestScope(this, context);
  }

  /**
   * Enumerates the keys of all registrations this container knows: explicit bindings of the root
   * injector and its ancestors, then bindings of the per-request modules.
   *
   * <p>The order follows Guice's binding order but is not a contract.
   */
  public ImmutableList<Key<?>> registrations() {
    ImmutableSet.Builder<Key<?>> keys = ImmutableSet.builder();
    for (Injector i = injector; i != null; i = i.getParent()) {
      keys.addAll(i.getBindings().keySet());
    }
    keys.addAll(perRequestKeys);
    return keys.build().asList();
  }

  @Override
  public boolean isRegistered(Key<?> key) {
    requireNonNull(key, "key");
    return perRequestKeys.contains(key) || injector.getExistingBinding(key) != null;
  }

  /**
   * Returns true if {@code key} is bound by a per-request module, or is the implementation a
   * per-request module links to and therefore gets bound in every request scope.
   */
  public boolean isPerRequest(Key<?> key) {
    return perRequestKeys.contains(key) || linkedTargets.contains(key);
  }

  /**
   * {@inheritDoc}
   *
   * @throws OutOfScopeException if {@code key} is bound per request. The root injector is left
   *     untouched so that later request scopes can still bind {@code key}.
   */
  @Override
  public <T> T getInstance(Key<T> key) {
    requireNonNull(key, "key");
    if (isPerRequest(key)) {
      throw new OutOfScopeException(
          "Cannot resolve " + key + " outside of a request scope; it is bound per request");
    }
    return injector.getInstance(key);
  }

  @Override
  public String tag() {
    return ROOT_TAG;
  }

  @Override
  @Nullable
  public ResolutionScope parent() {
    return null;
  }

  public Injector injector() {
    return injector;
  }

  public ScopeConfig config() {
    return config;
  }

  /**
   * Returns a module holding the per-request bindings for one new request scope.
   *
   * <p>The per-request modules are recorded afresh for every scope: {@code @Provides} methods
   * keep injector-specific state and cannot be shared between child injectors, and a module
   * instance must not be configured by two threads at once. Implementations that per-request
   * modules link to are bound untargetted, so that the request scope constructs them itself
   * instead of the root injector creating a just-in-time binding for them.
   */
  Module newPerRequestModule() {
    List<Element> elements;
    synchronized (perRequestModules) {
      elements = Elements.getElements(perRequestModules);
    }
    ImmutableList<Key<?>> targets =
        linkedTargets.stream()
            .filter(k -> injector.getExistingBinding(k) == null)
            .collect(ImmutableList.toImmutableList());
    if (targets.size() < linkedTargets.size()) {
      logger.atWarning().atMostEvery(1, MINUTES).log(
          "Root injector has bound %s meanwhile; their instances are not owned by request scopes",
          linkedTargets.stream().filter(k -> !targets.contains(k)).collect(toList()));
    }
    Module recorded = Elements.getModule(elements);
    return binder -> {
      binder.install(recorded);
      for (Key<?> target : targets) {
        binder.bind(target);
      }
    };
  }

  @Override
  public String toString() {
    return "ScopedContainer[" + ROOT_TAG + "]";
  }

  /** Assembles a {@link ScopedContainer} from modules. */
  public static class Builder {
    private final List<Module> modules = new ArrayList<>();
    private final List<Module> perRequestModules = new ArrayList<>();
    private ScopeConfig config = ScopeConfig.defaults();
    private Stage stage = Stage.DEVELOPMENT;

    private Builder() {}

    /** Adds modules to the application injector. */
    @CanIgnoreReturnValue
    public Builder install(Module... m) {
      modules.addAll(Arrays.asList(m));
      return this;
    }

    /** Adds modules installed into every request scope. */
    @CanIgnoreReturnValue
    public Builder installPerRequest(Module... m) {
      perRequestModules.addAll(Arrays.asList(m));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder config(ScopeConfig c) {
      config = requireNonNull(c, "config");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder stage(Stage s) {
      stage = requireNonNull(s, "stage");
      return this;
    }

    /**
     * Creates the application injector and wraps it.
     *
     * @throws com.google.inject.CreationException if the application modules are invalid.
     */
    public ScopedContainer build() {
      return wrap(Guice.createInjector(stage, modules), config, perRequestModules);
    }
  }
}
