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

package org.reqscope.logging;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.HashSet;
import java.util.Set;
import javax.servlet.http.HttpServletRequest;
import org.junit.Test;

public class RequestIdTest {
  private static HttpServletRequest request(String method, String uri) {
    HttpServletRequest req = mock(HttpServletRequest.class);
    when(req.getMethod()).thenReturn(method);
    when(req.getRequestURI()).thenReturn(uri);
    return req;
  }

  @Test
  public void startsWithTag() {
    RequestId id = RequestId.forRequest("request", request("GET", "/changes"));
    assertThat(id.toString()).matches("request-\\d+-[0-9a-f]{8}");
    assertThat(id.tag()).isEqualTo("request");
  }

  @Test
  public void createWithoutRequest() {
    assertThat(RequestId.create("batch").toString()).matches("batch-\\d+-[0-9a-f]{8}");
    assertThat(RequestId.forRequest("batch", null).tag()).isEqualTo("batch");
  }

  @Test
  public void toleratesRequestWithoutMethodOrUri() {
    assertThat(RequestId.forRequest("request", mock(HttpServletRequest.class)).toString())
        .startsWith("request-");
  }

  @Test
  public void idsForSameRequestAreUnique() {
    HttpServletRequest req = request("POST", "/a");
    Set<RequestId> ids = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      ids.add(RequestId.forRequest("request", req));
    }
    assertThat(ids).hasSize(100);
  }

  @Test
  public void equalityFollowsString() {
    RequestId id = RequestId.create("request");
    assertThat(id).isEqualTo(id);
    assertThat(id).isNotEqualTo(RequestId.create("request"));
  }

  @Test
  public void nullTagIsRejected() {
    assertThrows(NullPointerException.class, () -> RequestId.create(null));
  }
}
