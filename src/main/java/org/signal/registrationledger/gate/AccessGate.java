/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.gate;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Singleton;
import org.signal.registrationledger.metrics.MetricsUtil;
import org.signal.registrationledger.verification.IdentityVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps operations so that they only run once a required identity has been verified. A wrapped operation checks the
 * identity on every invocation, and on failure throws {@link PermissionDeniedException} without invoking the
 * underlying operation at all.
 * <p>
 * Operations of zero, one or two arguments can be wrapped directly. Operations that take more arguments bundle them
 * into a single value and are wrapped as a {@link ProtectedFunction}.
 */
@Singleton
public class AccessGate {

  private static final Logger logger = LoggerFactory.getLogger(AccessGate.class);

  private final IdentityVerifier identityVerifier;
  private final Counter deniedCounter;

  public AccessGate(final IdentityVerifier identityVerifier, final MeterRegistry meterRegistry) {
    this.identityVerifier = identityVerifier;
    this.deniedCounter = meterRegistry.counter(MetricsUtil.name(AccessGate.class, "denied"));
  }

  public <T, E extends Exception> ProtectedOperation<T, E> guard(final String requiredFingerprint,
      final ProtectedOperation<T, E> operation) {

    return () -> {
      requireVerified(requiredFingerprint);
      return operation.call();
    };
  }

  public <A, R, E extends Exception> ProtectedFunction<A, R, E> guard(final String requiredFingerprint,
      final ProtectedFunction<A, R, E> function) {

    return argument -> {
      requireVerified(requiredFingerprint);
      return function.apply(argument);
    };
  }

  public <A, B, R, E extends Exception> ProtectedBiFunction<A, B, R, E> guard(final String requiredFingerprint,
      final ProtectedBiFunction<A, B, R, E> function) {

    return (first, second) -> {
      requireVerified(requiredFingerprint);
      return function.apply(first, second);
    };
  }

  private void requireVerified(final String fingerprint) throws PermissionDeniedException {
    if (!identityVerifier.verify(fingerprint)) {
      deniedCounter.increment();
      logger.info("Denied protected operation for unverified identity {}", fingerprint);
      throw new PermissionDeniedException(fingerprint);
    }
  }
}
