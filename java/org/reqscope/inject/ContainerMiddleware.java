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

import com.google.inject.Inject;
import com.google.inject.Key;
import com.google.inject.TypeLiteral;
import com.google.inject.util.Types;
import java.io.IOException;
import java.lang.reflect.Type;
import javax.servlet.ServletException;
import org.reqscope.pipeline.Middleware;
import org.reqscope.pipeline.Next;
import org.reqscope.pipeline.RequestContext;
import org.reqscope.scope.ResolutionScope;

/**
 * Pipeline stage that delegates to a {@code T} resolved from the current scope on every request.
 *
 * <p>Install it after the scope injector (see {@link ScopedPipelines#registerInjector}) so that
 * {@code T} comes from the request scope. Installed earlier, {@code T} is resolved from the root
 * container: that works for root bindings, while a {@code T} bound per request fails each request
 * with {@link com.google.inject.OutOfScopeException}.
 *
 * <p>Binding {@code ContainerMiddleware<T>} explicitly in the container keeps {@link
 * ScopedPipelines#registerAllMiddleware} from installing a stage for {@code T}; Guice can
 * construct such a binding on its own.
 *
 * @param <T> the middleware type to resolve.
 */
public class ContainerMiddleware<T extends Middleware> implements Middleware {
  public static <T extends Middleware> ContainerMiddleware<T> of(Class<T> type) {
    return new ContainerMiddleware<>(Key.get(type));
  }

  public static <T extends Middleware> ContainerMiddleware<T> of(TypeLiteral<T> type) {
    return new ContainerMiddleware<>(Key.get(type));
  }

  public static <T extends Middleware> ContainerMiddleware<T> of(Key<T> key) {
    return new ContainerMiddleware<>(key);
  }

  /** Returns the key under which an adapter for {@code middleware} would be bound. */
  public static Key<?> adapterKey(Key<?> middleware) {
    Type type = middleware.getTypeLiteral().getType();
    return Key.get(Types.newParameterizedType(ContainerMiddleware.class, type));
  }

  private final Key<T> key;

  @Inject
  ContainerMiddleware(TypeLiteral<T> type) {
    this(Key.get(type));
  }

  private ContainerMiddleware(Key<T> key) {
    this.key = requireNonNull(key, "key");
  }

  public Key<T> key() {
    return key;
  }

  @Override
  public void invoke(RequestContext context, ResolutionScope scope, Next next)
      throws IOException, ServletException {
    scope.getInstance(key).invoke(context, scope, next);
  }

  @Override
  public String toString() {
    return "ContainerMiddleware[" + key.getTypeLiteral() + "]";
  }
}
