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

import static java.util.Objects.requireNonNull;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Provider;
import com.google.inject.ProvisionException;
import java.io.IOException;
import java.nio.file.Path;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.storage.file.FileBasedConfig;
import org.eclipse.jgit.util.FS;
import org.reqscope.common.Nullable;

/**
 * Provides the {@link ScopeConfig} stored in a config file.
 *
 * <p>The file is read on first use and cached. A missing file yields {@link
 * ScopeConfig#defaults()}.
 */
public class ScopeConfigProvider implements Provider<ScopeConfig> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Path path;
  private final Object lock = new Object();

  @Nullable private ScopeConfig config;

  public ScopeConfigProvider(Path path) {
    this.path = requireNonNull(path, "path");
  }

  @Override
  public ScopeConfig get() {
    synchronized (lock) {
      if (config == null) {
        config = ScopeConfig.fromConfig(loadConfig(path));
      }
      return config;
    }
  }

  private static FileBasedConfig loadConfig(Path path) {
    FileBasedConfig cfg = new FileBasedConfig(path.toFile(), FS.DETECTED);
    if (!cfg.getFile().exists()) {
      logger.atInfo().log("No %s; assuming defaults", path.toAbsolutePath());
      return cfg;
    }
    try {
      cfg.load();
    } catch (IOException | ConfigInvalidException e) {
      throw new ProvisionException(e.getMessage(), e);
    }
    return cfg;
  }
}
