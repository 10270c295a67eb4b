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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import javax.servlet.ServletException;
import org.reqscope.scope.ResolutionScope;

/** Immutable, ordered chain of {@link Middleware} stages. */
public class Pipeline {
  private final ImmutableList<Middleware> stages;

  Pipeline(ImmutableList<Middleware> stages) {
    this.stages = stages;
  }

  public ImmutableList<Middleware> stages() {
    return stages;
  }

  /**
   * Runs {@code context} through all stages.
   *
   * @param context the request.
   * @param scope scope handed to the first stage, normally the root container.
   * @param terminal invoked if the last stage calls its continuation.
   */
  public void handle(RequestContext context, ResolutionScope scope, Next terminal)
      throws IOException, ServletException {
    requireNonNull(context, "context");
    requireNonNull(scope, "scope");
    requireNonNull(terminal, "terminal");
    invoke(0, context, scope, terminal);
  }

  private void invoke(int index, RequestContext context, ResolutionScope scope, Next terminal)
      throws IOException, ServletException {
    if (index == stages.size()) {
      terminal.invoke(context, scope);
      return;
    }
    stages.get(index).invoke(context, scope, (c, s) -> invoke(index + 1, c, s, terminal));
  }
}
