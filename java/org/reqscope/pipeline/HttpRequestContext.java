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

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/** Request context backed by a servlet request/response pair. */
public class HttpRequestContext implements RequestContext {
  private final HttpServletRequest request;
  private final HttpServletResponse response;

  public HttpRequestContext(HttpServletRequest request, HttpServletResponse response) {
    this.request = requireNonNull(request, "request");
    this.response = requireNonNull(response, "response");
  }

  @Override
  public HttpServletRequest getRequest() {
    return request;
  }

  @Override
  public HttpServletResponse getResponse() {
    return response;
  }

  @Override
  public String toString() {
    StringBuilder s = new StringBuilder();
    s.append(request.getMethod()).append(" ").append(request.getRequestURI());
    String query = request.getQueryString();
    if (query != null) {
      s.append("?").append(query);
    }
    return s.toString();
  }
}
