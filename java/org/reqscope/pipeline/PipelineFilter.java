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

import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import javax.servlet.Filter;
import javax.servlet.FilterChain;
import javax.servlet.FilterConfig;
import javax.servlet.ServletException;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.reqscope.scope.ResolutionScope;

/**
 * Runs every HTTP request through a {@link Pipeline}.
 *
 * <p>The pipeline starts out with {@code rootScope}; if its last stage calls its continuation the
 * request proceeds down the servlet filter chain.
 */
public class PipelineFilter implements Filter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Pipeline pipeline;
  private final ResolutionScope rootScope;

  public PipelineFilter(Pipeline pipeline, ResolutionScope rootScope) {
    this.pipeline = requireNonNull(pipeline, "pipeline");
    this.rootScope = requireNonNull(rootScope, "rootScope");
  }

  @Override
  public void init(FilterConfig filterConfig) {
    logger.atFine().log("Pipeline filter with %d stages initialized", pipeline.stages().size());
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    if (!(request instanceof HttpServletRequest) || !(response instanceof HttpServletResponse)) {
      chain.doFilter(request, response);
      return;
    }

    RequestContext context =
        new HttpRequestContext((HttpServletRequest) request, (HttpServletResponse) response);
    pipeline.handle(
        context, rootScope, (c, s) -> chain.doFilter(c.getRequest(), c.getResponse()));
  }

  @Override
  public void destroy() {}
}
