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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.flogger.FluentLogger;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.OutOfScopeException;
import com.google.inject.matcher.Matchers;
import com.google.inject.spi.InstanceBinding;
import com.google.inject.spi.ProvisionListener;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.reqscope.config.CloseOrder;
import org.reqscope.config.ScopeConfig;
import org.reqscope.logging.RequestId;
import org.reqscope.pipeline.RequestContext;

/**
 * Resolution scope bound to exactly one request.
 *
 * <p>Backed by a child injector of the root container holding the per-request bindings plus the
 * request's {@link RequestContext}. Every {@link AutoCloseable} instance the scope provisions
 * through its own bindings is owned by the scope and closed together with it. Instances resolved
 * from the root are shared and never closed here.
 *
 * <p>{@link #close()} runs at most once; afterwards the scope refuses to resolve anything.
 */
public class RequestScope implements ResolutionScope, AutoCloseable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final List<AutoCloseable> owned = new ArrayList<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private final ScopedContainer parent;
  private final RequestContext context;
  private final ScopeConfig config;
  private final RequestId id;
  private final Injector injector;

  RequestScope(ScopedContainer parent, RequestContext context) {
    this.parent = parent;
    this.context = context;
    this.config = parent.config();
    this.id = RequestId.forRequest(config.requestTag(), context.getRequest());
    this.injector =
        parent
            .injector()
            .createChildInjector(
                parent.newPerRequestModule(),
                new AbstractModule() {
                  @Override
                  protected void configure() {
                    bind(RequestContext.class).toInstance(context);
                    bind(RequestScope.class).toInstance(RequestScope.this);
                    if (config.disposeInstances()) {
                      bindListener(Matchers.any(), new OwnershipListener());
                    }
                  }
                });
    logger.atFine().log("Opened request scope %s for %s", id, context);
  }

  public RequestId id() {
    return id;
  }

  public RequestContext context() {
    return context;
  }

  /** Child injector backing this scope. */
  public Injector injector() {
    return injector;
  }

  public boolean isOpen() {
    return !closed.get();
  }

  @Override
  public String tag() {
    return config.requestTag();
  }

  @Override
  public ScopedContainer parent() {
    return parent;
  }

  @Override
  public <T> T getInstance(Key<T> key) {
    requireOpen();
    return injector.getInstance(key);
  }

  @Override
  public boolean isRegistered(Key<?> key) {
    return injector.getExistingBinding(key) != null;
  }

  /** Instances owned by this scope, in creation order. */
  public ImmutableList<AutoCloseable> ownedInstances() {
    synchronized (owned) {
      return ImmutableList.copyOf(owned);
    }
  }

  /**
   * Closes the scope and every instance it owns.
   *
   * <p>A failure to close one instance does not prevent closing the others.
   *
   * @throws ScopeDisposalException if any owned instance failed to close.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }

    List<AutoCloseable> toClose;
    synchronized (owned) {
      toClose = new ArrayList<>(owned);
      owned.clear();
    }
    if (config.closeOrder() == CloseOrder.REVERSE_CREATION) {
      toClose = Lists.reverse(toClose);
    }

    ScopeDisposalException failure = null;
    for (AutoCloseable c : toClose) {
      try {
        c.close();
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        logger.atWarning().withCause(e).log("Failed to close %s owned by request scope %s", c, id);
        if (failure == null) {
          failure = new ScopeDisposalException(id);
        }
        failure.addSuppressed(e);
      }
    }
    logger.atFine().log("Closed request scope %s; disposed %d instances", id, toClose.size());

    if (failure != null) {
      throw failure;
    }
  }

  private void requireOpen() {
    if (closed.get()) {
      throw new OutOfScopeException("Request scope " + id + " is closed");
    }
  }

  @Override
  public String toString() {
    return "RequestScope[" + id + "]";
  }

  private class OwnershipListener implements ProvisionListener {
    @Override
    public <T> void onProvision(ProvisionInvocation<T> provision) {
      T instance = provision.provision();
      if (instance instanceof AutoCloseable
          && !(provision.getBinding() instanceof InstanceBinding)) {
        synchronized (owned) {
          owned.add((AutoCloseable) instance);
        }
      }
    }
  }
}
