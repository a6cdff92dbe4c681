/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimeLimitedSigningIdentityTest {

  private static final byte[] PAYLOAD = {1, 2, 3};

  private ExecutorService executorService;
  private SigningIdentity delegate;
  private TimeLimitedSigningIdentity timeLimitedSigningIdentity;
  private CountDownLatch neverReleased;

  @BeforeEach
  void setUp() {
    executorService = Executors.newCachedThreadPool();
    delegate = mock(SigningIdentity.class);
    neverReleased = new CountDownLatch(1);
    timeLimitedSigningIdentity = new TimeLimitedSigningIdentity(delegate, Duration.ofMillis(100), executorService);
  }

  @AfterEach
  void tearDown() {
    neverReleased.countDown();
    executorService.shutdownNow();
  }

  @Test
  void testDelegates() throws SigningBackendException {
    when(delegate.sign(PAYLOAD)).thenReturn("signature");
    when(delegate.exportPublicKey()).thenReturn("public key");
    when(delegate.fingerprint()).thenReturn("FP1");
    when(delegate.verify(PAYLOAD, "signature", "public key")).thenReturn(VerificationResult.success("FP1"));

    assertEquals("signature", timeLimitedSigningIdentity.sign(PAYLOAD));
    assertEquals("public key", timeLimitedSigningIdentity.exportPublicKey());
    assertEquals("FP1", timeLimitedSigningIdentity.fingerprint());
    assertTrue(timeLimitedSigningIdentity.verify(PAYLOAD, "signature", "public key").valid());
  }

  @Test
  void testSignTimeout() throws SigningBackendException {
    when(delegate.sign(any())).thenAnswer(invocation -> {
      neverReleased.await();
      return "too late";
    });

    assertThrows(SigningBackendException.class, () -> timeLimitedSigningIdentity.sign(PAYLOAD));
  }

  @Test
  void testSignFailurePropagates() throws SigningBackendException {
    final SigningBackendException failure = new SigningBackendException("no key");
    when(delegate.sign(any())).thenThrow(failure);

    assertSame(failure, assertThrows(SigningBackendException.class, () -> timeLimitedSigningIdentity.sign(PAYLOAD)));
  }

  @Test
  void testUncheckedSignFailureWrapped() throws SigningBackendException {
    when(delegate.sign(any())).thenThrow(new IllegalStateException("backend gone"));

    final SigningBackendException e =
        assertThrows(SigningBackendException.class, () -> timeLimitedSigningIdentity.sign(PAYLOAD));

    assertTrue(e.getCause() instanceof IllegalStateException);
  }

  @Test
  void testSignErrorWrapped() throws SigningBackendException {
    when(delegate.sign(any())).thenThrow(new NoSuchMethodError("backend linkage"));

    final SigningBackendException e =
        assertThrows(SigningBackendException.class, () -> timeLimitedSigningIdentity.sign(PAYLOAD));

    assertTrue(e.getCause() instanceof NoSuchMethodError);
  }

  @Test
  void testVerifyTimeout() {
    when(delegate.verify(any(), any(), any())).thenAnswer(invocation -> {
      neverReleased.await();
      return VerificationResult.success("FP1");
    });

    final VerificationResult result = timeLimitedSigningIdentity.verify(PAYLOAD, "signature", "public key");

    assertFalse(result.valid());
    assertTrue(result.failureReason().isPresent());
  }

  @Test
  void testVerifyExceptionBecomesFailure() {
    when(delegate.verify(any(), any(), any())).thenThrow(new IllegalStateException("backend gone"));

    assertFalse(timeLimitedSigningIdentity.verify(PAYLOAD, "signature", "public key").valid());
  }

  @Test
  void testVerifyErrorBecomesFailure() {
    when(delegate.verify(any(), any(), any())).thenThrow(new NoSuchMethodError("backend linkage"));

    final VerificationResult result = timeLimitedSigningIdentity.verify(PAYLOAD, "signature", "public key");

    assertFalse(result.valid());
    assertTrue(result.failureReason().isPresent());
  }
}
