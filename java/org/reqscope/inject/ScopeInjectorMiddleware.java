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

import java.io.IOException;
import javax.servlet.ServletException;
import org.reqscope.pipeline.Middleware;
import org.reqscope.pipeline.Next;
import org.reqscope.pipeline.RequestContext;
import org.reqscope.scope.RequestScope;
import org.reqscope.scope.ResolutionScope;
import org.reqscope.scope.ScopedContainer;

/**
 * Opens a {@link RequestScope} around the downstream stages of each request.
 *
 * <p>Downstream stages receive the request scope instead of the scope this stage was handed. The
 * scope is closed once the downstream stages return or throw.
 */
class ScopeInjectorMiddleware implements Middleware {
  private final ScopedContainer container;

  ScopeInjectorMiddleware(ScopedContainer container) {
    this.container = requireNonNull(container, "container");
  }

  @Override
  public void invoke(RequestContext context, ResolutionScope scope, Next next)
      throws IOException, ServletException {
    try (RequestScope requestScope = container.beginRequestScope(context)) {
      next.invoke(context, requestScope);
    }
  }

  @Override
  public String toString() {
    return "ScopeInjector[" + container + "]";
  }
}
