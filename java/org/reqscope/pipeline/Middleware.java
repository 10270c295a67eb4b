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

package org.reqscope.pipeline;

import java.io.IOException;
import javax.servlet.ServletException;
import org.reqscope.scope.ResolutionScope;

/**
 * One stage of a {@link Pipeline}.
 *
 * <p>A stage may run logic before and after delegating to {@code next}, or answer the request
 * itself by not calling {@code next} at all. The resolution scope is handed from stage to stage:
 * a stage that opens a narrower scope passes it on through {@link Next#invoke(RequestContext,
 * ResolutionScope)}, all other stages pass on the scope they received.
 *
 * <p>Concrete, non-abstract types implementing this interface and bound in a {@link
 * org.reqscope.scope.ScopedContainer} are picked up by {@link
 * org.reqscope.inject.ScopedPipelines#registerAllMiddleware}.
 */
@FunctionalInterface
public interface Middleware {
  /**
   * Processes one request.
   *
   * @param context the current request.
   * @param scope scope to resolve dependencies from for the duration of this request.
   * @param next remainder of the pipeline.
   */
  void invoke(RequestContext context, ResolutionScope scope, Next next)
      throws IOException, ServletException;
}
