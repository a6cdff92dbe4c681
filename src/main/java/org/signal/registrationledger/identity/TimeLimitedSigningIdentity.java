/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounds the time spent in every call to a {@link SigningIdentity}. Signing and key export calls that time out fail
 * with a {@link SigningBackendException}.
 */
public class TimeLimitedSigningIdentity extends TimeLimitedSignatureVerifier implements SigningIdentity {

  private final SigningIdentity delegate;

  public TimeLimitedSigningIdentity(final SigningIdentity delegate,
      final Duration timeout,
      final ExecutorService executorService) {

    super(delegate, timeout, executorService);
    this.delegate = delegate;
  }

  @Override
  public String sign(final byte[] payload) throws SigningBackendException {
    return callWithTimeout("sign", () -> delegate.sign(payload));
  }

  @Override
  public String exportPublicKey() throws SigningBackendException {
    return callWithTimeout("export public key", delegate::exportPublicKey);
  }

  @Override
  public String fingerprint() {
    return delegate.fingerprint();
  }

  private <T> T callWithTimeout(final String operation, final Callable<T> callable) throws SigningBackendException {
    try {
      return timeLimiter.callWithTimeout(callable, timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      throw new SigningBackendException("Signing backend did not " + operation + " within " + timeout, e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SigningBackendException("Interrupted while waiting to " + operation, e);
    } catch (final ExecutionException e) {
      if (e.getCause() instanceof SigningBackendException signingBackendException) {
        throw signingBackendException;
      }
      throw new SigningBackendException("Signing backend failed to " + operation, e.getCause());
    } catch (final UncheckedExecutionException | ExecutionError e) {
      throw new SigningBackendException("Signing backend failed to " + operation, e.getCause());
    }
  }
}
