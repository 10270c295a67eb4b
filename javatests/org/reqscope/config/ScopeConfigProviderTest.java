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

package org.reqscope.config;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.inject.ProvisionException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.reqscope.testing.ReqScopeTestBase;

public class ScopeConfigProviderTest extends ReqScopeTestBase {
  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  private Path write(String text) throws Exception {
    Path path = tmp.getRoot().toPath().resolve("reqscope.config");
    Files.write(path, text.getBytes(UTF_8));
    return path;
  }

  @Test
  public void missingFileYieldsDefaults() {
    Path path = tmp.getRoot().toPath().resolve("absent.config");
    assertThat(new ScopeConfigProvider(path).get()).isEqualTo(ScopeConfig.defaults());
  }

  @Test
  public void readsFile() throws Exception {
    ScopeConfigProvider provider =
        new ScopeConfigProvider(write("[scope]\n  requestTag = api\n  closeOrder = creation\n"));

    ScopeConfig config = provider.get();

    assertThat(config.requestTag()).isEqualTo("api");
    assertThat(config.closeOrder()).isEqualTo(CloseOrder.CREATION);
    assertThat(config.disposeInstances()).isTrue();
  }

  @Test
  public void cachesFirstRead() throws Exception {
    Path path = write("[scope]\n  requestTag = first\n");
    ScopeConfigProvider provider = new ScopeConfigProvider(path);
    ScopeConfig first = provider.get();

    Files.write(path, "[scope]\n  requestTag = second\n".getBytes(UTF_8));

    assertThat(provider.get()).isSameInstanceAs(first);
    assertThat(provider.get().requestTag()).isEqualTo("first");
  }

  @Test
  public void malformedFileFailsProvisioning() throws Exception {
    ScopeConfigProvider provider = new ScopeConfigProvider(write("[scope\n  requestTag = x\n"));
    assertThrows(ProvisionException.class, provider::get);
  }

  @Test
  public void nullPathIsRejected() {
    assertThrows(NullPointerException.class, () -> new ScopeConfigProvider(null));
  }
}
