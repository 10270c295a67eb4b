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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import javax.servlet.FilterChain;
import javax.servlet.ServletRequest;
import javax.servlet.ServletResponse;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.junit.Before;
import org.junit.Test;
import org.reqscope.scope.ResolutionScope;
import org.reqscope.testing.ReqScopeTestBase;

public class PipelineFilterTest extends ReqScopeTestBase {
  private HttpServletRequest req;
  private HttpServletResponse res;
  private FilterChain chain;
  private ResolutionScope root;

  @Before
  public void setUp() {
    req = mock(HttpServletRequest.class);
    res = mock(HttpServletResponse.class);
    chain = mock(FilterChain.class);
    root = mock(ResolutionScope.class);
  }

  @Test
  public void passesThroughToChain() throws Exception {
    RequestContext[] seen = new RequestContext[1];
    ResolutionScope[] scope = new ResolutionScope[1];
    Pipeline pipeline =
        new AppBuilder()
            .use(
                (c, s, next) -> {
                  seen[0] = c;
                  scope[0] = s;
                  next.invoke(c, s);
                })
            .build();

    new PipelineFilter(pipeline, root).doFilter(req, res, chain);

    verify(chain).doFilter(req, res);
    assertThat(seen[0].getRequest()).isSameInstanceAs(req);
    assertThat(seen[0].getResponse()).isSameInstanceAs(res);
    assertThat(scope[0]).isSameInstanceAs(root);
  }

  @Test
  public void shortCircuitSkipsChain() throws Exception {
    Pipeline pipeline = new AppBuilder().use((c, s, next) -> {}).build();

    new PipelineFilter(pipeline, root).doFilter(req, res, chain);

    verifyNoInteractions(chain);
  }

  @Test
  public void nonHttpRequestBypassesPipeline() throws Exception {
    ServletRequest plainReq = mock(ServletRequest.class);
    ServletResponse plainRes = mock(ServletResponse.class);
    boolean[] ran = new boolean[1];
    Pipeline pipeline = new AppBuilder().use((c, s, next) -> ran[0] = true).build();

    new PipelineFilter(pipeline, root).doFilter(plainReq, plainRes, chain);

    verify(chain).doFilter(plainReq, plainRes);
    assertThat(ran[0]).isFalse();
  }

  @Test
  public void nullArgumentsAreRejected() {
    Pipeline pipeline = new AppBuilder().build();
    assertThrows(NullPointerException.class, () -> new PipelineFilter(null, root));
    assertThrows(NullPointerException.class, () -> new PipelineFilter(pipeline, null));
  }
}
