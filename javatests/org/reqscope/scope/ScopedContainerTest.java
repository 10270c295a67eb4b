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

package org.reqscope.scope;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.Module;
import com.google.inject.name.Names;
import org.junit.Test;
import org.reqscope.config.ScopeConfig;
import org.reqscope.testing.ReqScopeTestBase;

public class ScopedContainerTest extends ReqScopeTestBase {
  static class Clock {}

  static class Cart {}

  private static Module rootModule() {
    return new AbstractModule() {
      @Override
      protected void configure() {
        bind(Clock.class);
        bind(String.class).annotatedWith(Names.named("site")).toInstance("example.org");
      }
    };
  }

  private static Module perRequestModule() {
    return new AbstractModule() {
      @Override
      protected void configure() {
        bind(Cart.class);
      }
    };
  }

  private static ScopedContainer newContainer() {
    return ScopedContainer.builder()
        .install(rootModule())
        .installPerRequest(perRequestModule())
        .build();
  }

  @Test
  public void rootScopeHasNoParent() {
    ScopedContainer container = ScopedContainer.builder().build();
    assertThat(container.tag()).isEqualTo(ScopedContainer.ROOT_TAG);
    assertThat(container.parent()).isNull();
    assertThat(container.config()).isEqualTo(ScopeConfig.defaults());
  }

  @Test
  public void registrationsCoverRootAndPerRequestBindings() {
    ScopedContainer container = newContainer();

    assertThat(container.registrations())
        .containsAtLeast(
            Key.get(Clock.class), Key.get(String.class, Names.named("site")), Key.get(Cart.class));
  }

  @Test
  public void isRegisteredAndIsPerRequest() {
    ScopedContainer container = newContainer();

    assertThat(container.isRegistered(Key.get(Clock.class))).isTrue();
    assertThat(container.isRegistered(Key.get(Cart.class))).isTrue();
    assertThat(container.isRegistered(Key.get(Integer.class))).isFalse();
    assertThat(container.isPerRequest(Key.get(Cart.class))).isTrue();
    assertThat(container.isPerRequest(Key.get(Clock.class))).isFalse();
  }

  @Test
  public void perRequestBindingsAreNotInstalledInRoot() {
    ScopedContainer container =
        ScopedContainer.builder().installPerRequest(perRequestModule()).build();

    assertThat(container.injector().getExistingBinding(Key.get(Cart.class))).isNull();
    try (RequestScope scope = container.beginRequestScope(newRequestContext())) {
      assertThat(scope.isRegistered(Key.get(Cart.class))).isTrue();
      assertThat(scope.getInstance(Cart.class)).isNotNull();
    }
  }

  @Test
  public void wrapIncludesAncestorBindings() {
    Injector base = Guice.createInjector(rootModule());
    Injector app = base.createChildInjector();
    ScopedContainer container =
        ScopedContainer.wrap(app, ScopeConfig.defaults(), ImmutableList.of(perRequestModule()));

    assertThat(container.registrations()).contains(Key.get(Clock.class));
    assertThat(container.isRegistered(Key.get(Clock.class))).isTrue();
    assertThat(container.getInstance(Key.get(String.class, Names.named("site"))))
        .isEqualTo("example.org");
  }

  @Test
  public void perRequestKeyAlsoBoundInRootIsRejected() {
    ScopedContainer.Builder builder =
        ScopedContainer.builder()
            .install(
                new AbstractModule() {
                  @Override
                  protected void configure() {
                    bind(Cart.class);
                  }
                })
            .installPerRequest(perRequestModule());

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
    assertThat(e).hasMessageThat().contains(Cart.class.getName());
  }

  @Test
  public void nullArgumentsAreRejected() {
    ScopedContainer container = ScopedContainer.builder().build();
    assertThrows(NullPointerException.class, () -> container.beginRequestScope(null));
    assertThrows(NullPointerException.class, () -> container.isRegistered(null));
    assertThrows(
        NullPointerException.class,
        () -> ScopedContainer.wrap(null, ScopeConfig.defaults(), ImmutableList.of()));
  }
}
