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
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Collects the stages of a {@link Pipeline} during application setup.
 *
 * <p>Stages run in the order they were added. The builder also carries a property bag that setup
 * code uses to leave markers for other setup code, for example to record that a stage was already
 * installed.
 */
public class AppBuilder {
  private final ConcurrentMap<String, Object> properties = new ConcurrentHashMap<>();
  private final List<Middleware> stages = new ArrayList<>();

  /** Appends {@code stage} to the end of the pipeline. */
  @CanIgnoreReturnValue
  public AppBuilder use(Middleware stage) {
    requireNonNull(stage, "stage");
    synchronized (stages) {
      stages.add(stage);
    }
    return this;
  }

  /** Setup-time properties; safe for concurrent use. */
  public ConcurrentMap<String, Object> properties() {
    return properties;
  }

  public int stageCount() {
    synchronized (stages) {
      return stages.size();
    }
  }

  /** Snapshot of the stages added so far, in execution order. */
  public ImmutableList<Middleware> stages() {
    synchronized (stages) {
      return ImmutableList.copyOf(stages);
    }
  }

  /** Freezes the current stages into a pipeline; later {@link #use} calls do not affect it. */
  public Pipeline build() {
    return new Pipeline(stages());
  }
}
