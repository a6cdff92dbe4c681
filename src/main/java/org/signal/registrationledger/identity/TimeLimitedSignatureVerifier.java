/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.SimpleTimeLimiter;
import com.google.common.util.concurrent.TimeLimiter;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds the time spent in a {@link SignatureVerifier}. A verifier that does not answer in time, or that fails
 * unexpectedly, produces a failed result rather than a hang or an exception.
 */
public class TimeLimitedSignatureVerifier implements SignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(TimeLimitedSignatureVerifier.class);

  private final SignatureVerifier delegate;
  protected final Duration timeout;
  protected final TimeLimiter timeLimiter;

  public TimeLimitedSignatureVerifier(final SignatureVerifier delegate,
      final Duration timeout,
      final ExecutorService executorService) {

    this.delegate = delegate;
    this.timeout = timeout;
    this.timeLimiter = SimpleTimeLimiter.create(executorService);
  }

  @Override
  public VerificationResult verify(final byte[] payload, final String signature, final String publicKey) {
    try {
      return timeLimiter.callWithTimeout(() -> delegate.verify(payload, signature, publicKey),
          timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (final TimeoutException e) {
      logger.warn("Signature verification did not complete within {}", timeout);
      return VerificationResult.failure("Verification timed out after " + timeout);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return VerificationResult.failure("Interrupted while verifying signature");
    } catch (final ExecutionException | UncheckedExecutionException | ExecutionError e) {
      logger.warn("Signature verification backend failed", e.getCause());
      return VerificationResult.failure("Verification backend failed: " + e.getCause());
    }
  }
}
