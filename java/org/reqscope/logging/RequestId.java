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

import static com.google.common.base.Strings.nullToEmpty;
import static java.util.Objects.requireNonNull;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.concurrent.atomic.AtomicLong;
import javax.servlet.http.HttpServletRequest;
import org.reqscope.common.Nullable;

/**
 * Identifier of one request scope, used in log records.
 *
 * <p>Rendered as {@code <tag>-<millis>-<hash>}. The hash covers the opening thread, a process-wide
 * sequence number, the host and, where known, the request method and URI.
 */
public class RequestId {
  private static final String HOST = hostAddress();
  private static final AtomicLong SEQUENCE = new AtomicLong();

  /** Creates the id of a scope opened for {@code request}. */
  public static RequestId forRequest(String tag, @Nullable HttpServletRequest request) {
    Hasher h = baseHash();
    if (request != null) {
      h.putUnencodedChars(nullToEmpty(request.getMethod()))
          .putChar(' ')
          .putUnencodedChars(nullToEmpty(request.getRequestURI()));
    }
    return new RequestId(tag, h);
  }

  /** Creates an id for work that is not tied to an HTTP request. */
  public static RequestId create(String tag) {
    return new RequestId(tag, baseHash());
  }

  private static Hasher baseHash() {
    return Hashing.murmur3_128()
        .newHasher()
        .putLong(Thread.currentThread().getId())
        .putLong(SEQUENCE.incrementAndGet())
        .putUnencodedChars(HOST);
  }

  private static String hostAddress() {
    try {
      return InetAddress.getLocalHost().getHostAddress();
    } catch (UnknownHostException e) {
      return "unknown";
    }
  }

  private final String tag;
  private final String str;

  private RequestId(String tag, Hasher h) {
    this.tag = requireNonNull(tag, "tag");
    this.str = tag + "-" + System.currentTimeMillis() + "-" + h.hash().toString().substring(0, 8);
  }

  public String tag() {
    return tag;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof RequestId && str.equals(((RequestId) o).str);
  }

  @Override
  public int hashCode() {
    return str.hashCode();
  }

  @Override
  public String toString() {
    return str;
  }
}
