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

import com.google.inject.AbstractModule;
import com.google.inject.Inject;
import java.io.IOException;
import javax.servlet.ServletException;
import org.reqscope.pipeline.Middleware;
import org.reqscope.pipeline.Next;
import org.reqscope.pipeline.RequestContext;
import org.reqscope.scope.ResolutionScope;
import org.reqscope.testing.Recorder;

/** Middleware types and modules shared by the tests of this package. */
class Fixtures {
  /** Bound in the root injector. */
  static class AlphaMiddleware implements Middleware {
    private final Recorder recorder;

    @Inject
    AlphaMiddleware(Recorder recorder) {
      this.recorder = recorder;
    }

    @Override
    public void invoke(RequestContext context, ResolutionScope scope, Next next)
        throws IOException, ServletException {
      recorder.record("alpha");
      next.invoke(context, scope);
    }
  }

  /** Bound per request; needs the current request. */
  static class BetaMiddleware implements Middleware {
    private final Recorder recorder;
    private final RequestContext request;

    @Inject
    BetaMiddleware(Recorder recorder, RequestContext request) {
      this.recorder = recorder;
      this.request = request;
    }

    @Override
    public void invoke(RequestContext context, ResolutionScope scope, Next next)
        throws IOException, ServletException {
      recorder.record("beta " + request.getRequest().getRequestURI());
      next.invoke(context, scope);
    }
  }

  abstract static class AbstractMiddleware implements Middleware {}

  static class Clock {}

  static AbstractModule rootModule(Recorder recorder) {
    return new AbstractModule() {
      @Override
      protected void configure() {
        bind(Recorder.class).toInstance(recorder);
        bind(AlphaMiddleware.class);
        bind(Clock.class);
      }
    };
  }

  static AbstractModule perRequestModule() {
    return new AbstractModule() {
      @Override
      protected void configure() {
        bind(BetaMiddleware.class);
      }
    };
  }

  private Fixtures() {}
}
